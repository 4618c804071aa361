package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplyTriggerTest {

    private static final Scope GROUP = Scope.group("1");

    private BotProperties properties;
    private ReplyTrigger trigger;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getTrigger().getKeywords().put("Golem", 60);
        properties.getTrigger().getKeywords().put("weather", 20);
        trigger = new ReplyTrigger(properties);
    }

    @Test
    void shouldAlwaysReplyInPrivateChat() {
        assertTrue(trigger.shouldReply(event(Scope.privateChat("5"), "anything", false)));
    }

    @Test
    void shouldReplyToMentionInGroup() {
        assertTrue(trigger.shouldReply(event(GROUP, "hey", true)));
    }

    @Test
    void shouldIgnoreUnaddressedGroupMessage() {
        assertFalse(trigger.shouldReply(event(GROUP, "nice weather today", false)));
    }

    @Test
    void shouldMatchKeywordsCaseInsensitively() {
        assertTrue(trigger.shouldReply(event(GROUP, "hey GOLEM what's up", false)));
        assertEquals(80, trigger.score(event(GROUP, "golem, how is the weather?", false), false));
    }

    @Test
    void shouldBoostFollowUpMessagesAfterReply() {
        properties.getTrigger().getKeywords().put("thanks", 20);
        trigger.onReplied(GROUP);

        assertTrue(trigger.shouldReply(event(GROUP, "thanks", false)));
        assertTrue(trigger.shouldReply(event(GROUP, "thanks again", false)));
        assertFalse(trigger.shouldReply(event(GROUP, "thanks!", false)));
    }

    @Test
    void shouldNotBoostPrivateChats() {
        trigger.onReplied(Scope.privateChat("5"));

        assertEquals(0, trigger.score(event(GROUP, "hello", false), false));
        assertFalse(trigger.shouldReply(event(GROUP, "hello", false)));
    }

    @Test
    void shouldDropBoostOnReset() {
        properties.getTrigger().getKeywords().put("thanks", 20);
        trigger.onReplied(GROUP);

        trigger.reset(GROUP);

        assertFalse(trigger.shouldReply(event(GROUP, "thanks", false)));
    }

    private static InboundEvent event(Scope scope, String text, boolean mention) {
        return InboundEvent.builder()
                .scope(scope)
                .senderId("5")
                .rawText(text)
                .mentionsSelf(mention)
                .build();
    }
}
