package me.golemcore.relay.domain.loop;

import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecentSequenceCacheTest {

    private RecentSequenceCache cache;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getDispatch().setDedupCacheSize(2);
        properties.getDispatch().setMaxTrackedScopes(2);
        cache = new RecentSequenceCache(properties);
    }

    @Test
    void shouldSuppressReplayedSequence() {
        assertTrue(cache.markSeen(event(Scope.group("1"), 10, null)));
        assertFalse(cache.markSeen(event(Scope.group("1"), 10, null)));
        assertTrue(cache.markSeen(event(Scope.group("2"), 10, null)));
    }

    @Test
    void shouldFallBackToMessageIdAndPassAnonymousEvents() {
        assertTrue(cache.markSeen(event(Scope.privateChat("5"), 0, "abc")));
        assertFalse(cache.markSeen(event(Scope.privateChat("5"), 0, "abc")));
        assertTrue(cache.markSeen(event(Scope.privateChat("5"), 0, null)));
        assertTrue(cache.markSeen(event(Scope.privateChat("5"), 0, null)));
    }

    @Test
    void shouldForgetOldestIdentitiesPerScope() {
        Scope scope = Scope.group("1");
        cache.markSeen(event(scope, 1, null));
        cache.markSeen(event(scope, 2, null));
        cache.markSeen(event(scope, 3, null));

        assertTrue(cache.markSeen(event(scope, 1, null)));
        assertFalse(cache.markSeen(event(scope, 3, null)));
    }

    @Test
    void shouldTrackOnlyMostRecentlyActiveScopes() {
        cache.markSeen(event(Scope.group("a"), 1, null));
        cache.markSeen(event(Scope.group("b"), 1, null));
        cache.markSeen(event(Scope.group("a"), 2, null));
        cache.markSeen(event(Scope.group("c"), 1, null));

        assertEquals(2, cache.trackedScopes());
        assertFalse(cache.markSeen(event(Scope.group("a"), 1, null)));
        assertTrue(cache.markSeen(event(Scope.group("b"), 1, null)));
    }

    private static InboundEvent event(Scope scope, long sequenceNo, String messageId) {
        return InboundEvent.builder()
                .scope(scope)
                .senderId("7")
                .rawText("hi")
                .sequenceNo(sequenceNo)
                .messageId(messageId)
                .build();
    }
}
