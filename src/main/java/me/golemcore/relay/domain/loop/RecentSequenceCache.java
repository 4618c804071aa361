package me.golemcore.relay.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded per-scope memory of recently processed events, used to suppress
 * replays after a gateway reconnect.
 *
 * <p>
 * Both dimensions are bounded: each scope keeps its last
 * {@code bot.dispatch.dedup-cache-size} identities, and only the
 * {@code bot.dispatch.max-tracked-scopes} most recently active scopes are
 * remembered at all.
 */
@Component
public class RecentSequenceCache {

    private final int capacity;
    private final int maxScopes;
    private final Map<Scope, Map<String, Boolean>> seenByScope;

    public RecentSequenceCache(BotProperties properties) {
        this.capacity = Math.max(1, properties.getDispatch().getDedupCacheSize());
        this.maxScopes = Math.max(1, properties.getDispatch().getMaxTrackedScopes());
        this.seenByScope = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<Scope, Map<String, Boolean>> eldest) {
                return size() > maxScopes;
            }
        };
    }

    /**
     * Records the event and reports whether it was new. Events without any
     * identity are always treated as new.
     */
    public boolean markSeen(InboundEvent event) {
        String key = identity(event);
        if (key == null) {
            return true;
        }
        synchronized (seenByScope) {
            Map<String, Boolean> seen = seenByScope.computeIfAbsent(event.getScope(), scope -> newBoundedSet());
            return seen.put(key, Boolean.TRUE) == null;
        }
    }

    int trackedScopes() {
        synchronized (seenByScope) {
            return seenByScope.size();
        }
    }

    private Map<String, Boolean> newBoundedSet() {
        return new LinkedHashMap<>(16, 0.75f, false) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    private static String identity(InboundEvent event) {
        if (event.getSequenceNo() != 0) {
            return "seq:" + event.getSequenceNo();
        }
        if (event.getMessageId() != null && !event.getMessageId().isBlank()) {
            return "id:" + event.getMessageId();
        }
        return null;
    }
}
