package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.PermissionPolicy;
import me.golemcore.relay.domain.model.Principal;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.model.Tier;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PermissionEngineTest {

    private static final PermissionPolicy POLICY = PermissionPolicy.builder()
            .defaultTier(Tier.BLOCKED)
            .privateTier(Tier.DEFAULT)
            .adminId("1")
            .override(Scope.group("trusted-group"), Tier.TRUSTED)
            .override(Scope.privateChat("spammer"), Tier.BLOCKED)
            .override(Scope.group("admin-muted"), Tier.BLOCKED)
            .build();

    private final PermissionEngine engine = new PermissionEngine();

    @Test
    void shouldUsePrivateTierForPrivateScope() {
        assertEquals(Tier.DEFAULT, engine.evaluate(new Principal("5"), Scope.privateChat("5"), POLICY));
    }

    @Test
    void shouldUseDefaultTierForGroupScope() {
        assertEquals(Tier.BLOCKED, engine.evaluate(new Principal("5"), Scope.group("99"), POLICY));
    }

    @Test
    void shouldGrantAdminToConfiguredAdmins() {
        assertEquals(Tier.ADMIN, engine.evaluate(new Principal("1"), Scope.group("99"), POLICY));
        assertEquals(Tier.ADMIN, engine.evaluate(new Principal("1"), Scope.privateChat("1"), POLICY));
    }

    @Test
    void shouldPreferScopeOverrideOverEverythingElse() {
        assertEquals(Tier.TRUSTED, engine.evaluate(new Principal("5"), Scope.group("trusted-group"), POLICY));
        assertEquals(Tier.BLOCKED, engine.evaluate(new Principal("spammer"), Scope.privateChat("spammer"), POLICY));
        assertEquals(Tier.BLOCKED, engine.evaluate(new Principal("1"), Scope.group("admin-muted"), POLICY));
    }

    @Test
    void shouldBeDeterministic() {
        Principal principal = new Principal("5");
        Scope scope = Scope.group("trusted-group");
        Tier first = engine.evaluate(principal, scope, POLICY);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, engine.evaluate(principal, scope, POLICY));
        }
    }

    @Test
    void shouldOrderTiers() {
        assertTrue(Tier.ADMIN.isAtLeast(Tier.TRUSTED));
        assertTrue(Tier.DEFAULT.permitsReply());
        assertFalse(Tier.BLOCKED.permitsReply());
    }
}
