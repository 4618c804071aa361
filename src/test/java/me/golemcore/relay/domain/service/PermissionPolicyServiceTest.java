package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.PermissionPolicy;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.model.Tier;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.config.ConfigException;
import me.golemcore.relay.port.outbound.ConversationRepositoryPort;
import me.golemcore.relay.port.outbound.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PermissionPolicyServiceTest {

    private BotProperties properties;
    private ConversationRepositoryPort repository;
    private PermissionPolicyService service;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        repository = mock(ConversationRepositoryPort.class);
        service = new PermissionPolicyService(properties, repository);
    }

    @Test
    void shouldPreferStoredPolicy() {
        PermissionPolicy stored = PermissionPolicy.builder()
                .defaultTier(Tier.TRUSTED)
                .privateTier(Tier.TRUSTED)
                .build();
        when(repository.loadPolicy()).thenReturn(Optional.of(stored));

        service.load();

        assertSame(stored, service.current());
        verify(repository, never()).savePolicy(any());
    }

    @Test
    void shouldFallBackToConfiguredPolicyAndSaveIt() {
        properties.getPermission().setDefaultTier(Tier.BLOCKED);
        properties.getPermission().getAdmins().add(" 42 ");
        properties.getPermission().getOverrides().put("group:7", Tier.TRUSTED);
        when(repository.loadPolicy()).thenReturn(Optional.empty());

        service.load();

        PermissionPolicy policy = service.current();
        assertEquals(Tier.BLOCKED, policy.getDefaultTier());
        assertEquals(Tier.DEFAULT, policy.getPrivateTier());
        assertEquals(java.util.Set.of("42"), policy.getAdminIds());
        assertEquals(Optional.of(Tier.TRUSTED), policy.overrideFor(Scope.group("7")));
        verify(repository).savePolicy(policy);
    }

    @Test
    void shouldFailStartupOnMalformedOverrideKey() {
        properties.getPermission().getOverrides().put("channel-7", Tier.TRUSTED);
        when(repository.loadPolicy()).thenReturn(Optional.empty());

        assertThrows(ConfigException.class, () -> service.load());
    }

    @Test
    void shouldFailStartupOnMissingTier() {
        properties.getPermission().setPrivateTier(null);
        when(repository.loadPolicy()).thenReturn(Optional.empty());

        assertThrows(ConfigException.class, () -> service.load());
    }

    @Test
    void shouldFailStartupWhenStoredPolicyIsUnreadable() {
        when(repository.loadPolicy()).thenThrow(new PersistenceException("corrupted"));

        assertThrows(ConfigException.class, () -> service.load());
    }

    @Test
    void shouldKeepRunningWhenInitialSaveFails() {
        when(repository.loadPolicy()).thenReturn(Optional.empty());
        doThrow(new PersistenceException("disk full")).when(repository).savePolicy(any());

        service.load();

        assertEquals(Tier.DEFAULT, service.current().getDefaultTier());
    }

    @Test
    void shouldSwapWholeSnapshotOnReplace() {
        when(repository.loadPolicy()).thenReturn(Optional.empty());
        service.load();
        PermissionPolicy before = service.current();
        PermissionPolicy next = before.toBuilder().adminId("9").build();

        service.replace(next);

        assertSame(next, service.current());
        assertEquals(0, before.getAdminIds().size());
        verify(repository).savePolicy(next);
    }

    @Test
    void shouldRejectInvalidReplacementAndKeepCurrent() {
        when(repository.loadPolicy()).thenReturn(Optional.empty());
        service.load();
        PermissionPolicy before = service.current();
        PermissionPolicy invalid = before.toBuilder().adminId(" ").build();

        assertThrows(ConfigException.class, () -> service.replace(invalid));
        assertSame(before, service.current());
    }

    @Test
    void shouldRefuseAccessBeforeLoad() {
        assertThrows(IllegalStateException.class, () -> service.current());
    }
}
