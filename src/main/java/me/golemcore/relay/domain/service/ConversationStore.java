package me.golemcore.relay.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ConversationContext;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.model.Turn;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.outbound.ConversationRepositoryPort;
import me.golemcore.relay.port.outbound.PersistenceException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Per-scope rolling context windows with write-behind persistence.
 *
 * <p>
 * A window holds at most {@code bot.conversation.window-size} turns; appending
 * beyond that evicts the oldest turn. Windows are loaded lazily on first access
 * and flushed asynchronously; a failed write is logged and never blocks the
 * dispatch path.
 *
 * <p>
 * At most {@code bot.conversation.max-loaded-scopes} windows stay in memory.
 * After each flush the least recently used windows that are fully written are
 * dropped; they are reloaded from the repository on next access.
 *
 * <p>
 * Each window is guarded by its own monitor. Ordering across events of the
 * same scope is the dispatcher's job, so callers append in inbound order.
 */
@Service
@Slf4j
public class ConversationStore {

    private final ConversationRepositoryPort repository;
    private final ExecutorService persistenceExecutor;
    private final int windowSize;
    private final int maxLoadedScopes;

    private final Map<Scope, Window> windows = new ConcurrentHashMap<>();
    private final AtomicLong accessCounter = new AtomicLong();

    public ConversationStore(BotProperties properties, ConversationRepositoryPort repository,
            @Qualifier("persistenceExecutor") ExecutorService persistenceExecutor) {
        this.repository = repository;
        this.persistenceExecutor = persistenceExecutor;
        BotProperties.ConversationProperties conversation = properties.getConversation();
        this.windowSize = Math.max(1, conversation.getWindowSize());
        this.maxLoadedScopes = Math.max(1, conversation.getMaxLoadedScopes());
    }

    /**
     * Appends a turn and returns the window after eviction.
     */
    public ConversationContext append(Scope scope, Turn turn) {
        return withWindow(scope, window -> {
            window.turns.addLast(turn);
            int evicted = 0;
            while (window.turns.size() > windowSize) {
                window.turns.removeFirst();
                evicted++;
            }
            window.dirty = true;
            if (evicted > 0) {
                log.trace("[Conversation] evicted {} turn(s) from {}", evicted, scope);
            }
            return window.toContext(scope);
        });
    }

    public ConversationContext snapshot(Scope scope) {
        return withWindow(scope, window -> window.toContext(scope));
    }

    /**
     * Schedules a durable write of the scope's window. The returned future
     * always completes normally; write failures are logged.
     */
    public CompletableFuture<Void> flush(Scope scope) {
        Window window = windows.get(scope);
        if (window == null) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.runAsync(() -> {
                write(scope, window);
                evictIdleWindows();
            }, persistenceExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("[Conversation] flush executor unavailable, writing {} inline", scope);
            write(scope, window);
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * Empties the scope's window and schedules a flush.
     */
    public CompletableFuture<Void> clear(Scope scope) {
        withWindow(scope, window -> {
            window.turns.clear();
            window.dirty = true;
            return null;
        });
        log.info("[Conversation] cleared context for {}", scope);
        return flush(scope);
    }

    /**
     * Synchronously writes every window changed since its last write.
     */
    public void flushAll() {
        int written = 0;
        for (Map.Entry<Scope, Window> entry : windows.entrySet()) {
            if (write(entry.getKey(), entry.getValue())) {
                written++;
            }
        }
        log.info("[Conversation] flushed {} context(s)", written);
    }

    private <T> T withWindow(Scope scope, Function<Window, T> action) {
        while (true) {
            Window window = windows.computeIfAbsent(scope, this::load);
            synchronized (window) {
                if (!window.retired) {
                    window.lastAccess = accessCounter.incrementAndGet();
                    return action.apply(window);
                }
            }
            windows.remove(scope, window);
        }
    }

    private Window load(Scope scope) {
        Window window = new Window();
        try {
            repository.loadContext(scope).ifPresent(stored -> {
                List<Turn> turns = stored.getTurns();
                int skip = Math.max(0, turns.size() - windowSize);
                window.turns.addAll(turns.subList(skip, turns.size()));
                if (skip > 0) {
                    log.debug("[Conversation] trimmed {} stored turn(s) for {}", skip, scope);
                }
            });
        } catch (PersistenceException e) {
            log.warn("[Conversation] failed to load context for {}, starting empty: {}", scope, e.getMessage());
        }
        return window;
    }

    private boolean write(Scope scope, Window window) {
        ConversationContext context;
        synchronized (window) {
            if (!window.dirty) {
                return false;
            }
            context = window.toContext(scope);
            window.dirty = false;
            window.writing = true;
        }
        try {
            repository.saveContext(scope, context);
            return true;
        } catch (RuntimeException e) { // NOSONAR - best-effort persistence
            synchronized (window) {
                window.dirty = true;
            }
            log.error("[Conversation] write failed for {}: {}", scope, e.getMessage(), e);
            return false;
        } finally {
            synchronized (window) {
                window.writing = false;
            }
        }
    }

    private void evictIdleWindows() {
        int excess = windows.size() - maxLoadedScopes;
        if (excess <= 0) {
            return;
        }
        List<Map.Entry<Scope, Window>> candidates = new ArrayList<>(windows.entrySet());
        candidates.sort(Comparator.comparingLong(entry -> entry.getValue().lastAccess));
        int evicted = 0;
        for (Map.Entry<Scope, Window> entry : candidates) {
            if (evicted >= excess) {
                break;
            }
            Window window = entry.getValue();
            synchronized (window) {
                if (window.dirty || window.writing || window.retired) {
                    continue;
                }
                window.retired = true;
            }
            if (windows.remove(entry.getKey(), window)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("[Conversation] unloaded {} idle context(s), {} still loaded", evicted, windows.size());
        }
    }

    private static final class Window {
        private final Deque<Turn> turns = new ArrayDeque<>();
        private boolean dirty;
        private boolean writing;
        // set once the window has left the map; holders must reload
        private boolean retired;
        private volatile long lastAccess;

        private ConversationContext toContext(Scope scope) {
            return ConversationContext.of(scope, new ArrayList<>(turns));
        }
    }
}
