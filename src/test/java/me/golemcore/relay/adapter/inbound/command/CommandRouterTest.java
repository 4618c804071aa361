package me.golemcore.relay.adapter.inbound.command;

import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.model.Tier;
import me.golemcore.relay.domain.service.ConversationStore;
import me.golemcore.relay.domain.service.ReplyTrigger;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.inbound.CommandPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class CommandRouterTest {

    private static final Scope SCOPE = Scope.group("777");

    private ConversationStore conversationStore;
    private ReplyTrigger replyTrigger;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        conversationStore = mock(ConversationStore.class);
        replyTrigger = mock(ReplyTrigger.class);
        router = new CommandRouter(new BotProperties(), conversationStore, replyTrigger);
    }

    @Test
    void shouldEchoArguments() {
        CommandPort.CommandResult result = router.execute("echo", List.of("hello", "world"), context(Tier.DEFAULT))
                .join();

        assertTrue(result.success());
        assertEquals("hello world", result.output());
    }

    @Test
    void shouldShowUsageForEmptyEcho() {
        CommandPort.CommandResult result = router.execute("echo", List.of(), context(Tier.DEFAULT)).join();

        assertFalse(result.success());
        assertEquals("Usage: #echo <text>", result.output());
    }

    @Test
    void shouldListCommandsWithPrefix() {
        CommandPort.CommandResult result = router.execute("HELP", List.of(), context(Tier.DEFAULT)).join();

        assertTrue(result.success());
        assertTrue(result.output().contains("#echo <text>"));
        assertTrue(result.output().contains("#reset - Forget this chat's history"));
    }

    @Test
    void shouldReportSenderAndTier() {
        CommandPort.CommandResult result = router.execute("whoami", List.of(), context(Tier.TRUSTED)).join();

        assertTrue(result.output().contains("id: 10001"));
        assertTrue(result.output().contains("tier: TRUSTED"));
    }

    @Test
    void shouldResetForTrustedSender() {
        CommandPort.CommandResult result = router.execute("reset", List.of(), context(Tier.ADMIN)).join();

        assertTrue(result.success());
        verify(conversationStore).clear(SCOPE);
        verify(replyTrigger).reset(SCOPE);
    }

    @Test
    void shouldRefuseResetForDefaultTier() {
        CommandPort.CommandResult result = router.execute("reset", List.of(), context(Tier.DEFAULT)).join();

        assertFalse(result.success());
        verify(conversationStore, never()).clear(any());
    }

    @Test
    void shouldRecognizeOnlyRegisteredCommands() {
        assertTrue(router.hasCommand("Echo"));
        assertFalse(router.hasCommand("deploy"));
        assertFalse(router.execute("deploy", List.of(), context(Tier.ADMIN)).join().success());
        assertEquals(4, router.listCommands().size());
    }

    private static Map<String, Object> context(Tier tier) {
        return Map.of(
                CommandPort.CONTEXT_SCOPE, SCOPE,
                CommandPort.CONTEXT_SENDER_ID, "10001",
                CommandPort.CONTEXT_TIER, tier);
    }
}
