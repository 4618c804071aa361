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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.DispatchOutcome;
import me.golemcore.relay.domain.model.DispatchState;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.ratelimit.AdmissionGate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the {@link Dispatcher} once per inbound event, one event at a time per
 * scope.
 *
 * <p>
 * Each scope gets a runner with a FIFO queue. The next queued event starts
 * only after the current run has returned its outcome, so a scope's context
 * is always written in inbound order. Runs of different scopes proceed in
 * parallel on the shared executor, bounded by a global {@link AdmissionGate}.
 * Queued events are never discarded while the coordinator is running. Idle
 * runners are evicted.
 */
@Service
@Slf4j
public class ScopeRunCoordinator {

    private static final int BACKLOG_WARN_STEP = 50;

    private final Dispatcher dispatcher;
    private final ExecutorService scopeRunExecutor;
    private final AdmissionGate admissionGate;

    private final Map<Scope, ScopeRunner> runners = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    public ScopeRunCoordinator(BotProperties properties, Dispatcher dispatcher,
            @Qualifier("scopeRunExecutor") ExecutorService scopeRunExecutor) {
        this.dispatcher = dispatcher;
        this.scopeRunExecutor = scopeRunExecutor;
        this.admissionGate = new AdmissionGate(Math.max(1, properties.getDispatch().getMaxConcurrentScopes()));
    }

    /**
     * Queues an event behind any run already active for its scope.
     *
     * @return completes with the event's outcome; completes with a
     *         {@code SHUTDOWN} failure if the event is dropped
     */
    public CompletableFuture<DispatchOutcome> enqueue(InboundEvent event) {
        Objects.requireNonNull(event, "event");
        if (!accepting) {
            log.warn("[Dispatcher] not accepting events, dropped event for {} (seq={})",
                    event.getScope(), event.getSequenceNo());
            return CompletableFuture.completedFuture(dropped(event, "dispatcher stopped"));
        }
        PendingRun pending = new PendingRun(event);
        while (true) {
            ScopeRunner runner = runners.computeIfAbsent(event.getScope(), ScopeRunner::new);
            if (runner.offer(pending)) {
                return pending.outcome;
            }
            // runner was evicted between lookup and offer
            runners.remove(event.getScope(), runner);
        }
    }

    public int activeScopes() {
        return runners.size();
    }

    public AdmissionGate admissionGate() {
        return admissionGate;
    }

    /**
     * Stops accepting events, drops everything still queued and waits up to
     * {@code timeout} for in-flight runs to finish. Runs still active after the
     * timeout are interrupted.
     *
     * @return outcomes of every dropped or cut-off event
     */
    public List<DispatchOutcome> shutdown(Duration timeout) {
        accepting = false;
        List<DispatchOutcome> failed = new ArrayList<>();
        List<PendingRun> inFlight = new ArrayList<>();
        for (ScopeRunner runner : runners.values()) {
            runner.close(failed, inFlight);
        }
        for (DispatchOutcome outcome : failed) {
            log.warn("[Dispatcher] {} (seq={}) not processed: {}", outcome.getScope(), outcome.getSequenceNo(),
                    outcome.getError());
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        for (PendingRun run : inFlight) {
            long remaining = deadline - System.nanoTime();
            try {
                run.outcome.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                cutOff(run, failed);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cutOff(run, failed);
            } catch (ExecutionException e) {
                log.debug("[Dispatcher] run for {} ended exceptionally during shutdown", run.event.getScope());
            }
        }
        log.info("[Dispatcher] shut down: {} in-flight run(s) drained, {} event(s) failed",
                inFlight.size(), failed.size());
        return failed;
    }

    private void cutOff(PendingRun run, List<DispatchOutcome> failed) {
        Future<?> task = run.task;
        if (task != null) {
            task.cancel(true);
        }
        DispatchOutcome outcome = dropped(run.event, "shutdown timeout reached");
        run.outcome.complete(outcome);
        failed.add(outcome);
        log.warn("[Dispatcher] run for {} (seq={}) cut off by shutdown", run.event.getScope(),
                run.event.getSequenceNo());
    }

    private static DispatchOutcome dropped(InboundEvent event, String error) {
        return DispatchOutcome.builder()
                .scope(event.getScope())
                .sequenceNo(event.getSequenceNo())
                .finalState(DispatchState.FAILED)
                .reason(DispatchOutcome.Reason.SHUTDOWN)
                .error(error)
                .waited(Duration.ZERO)
                .transition(DispatchState.FAILED)
                .build();
    }

    private static final class PendingRun {

        private final InboundEvent event;
        private final CompletableFuture<DispatchOutcome> outcome = new CompletableFuture<>();
        private volatile Future<?> task;

        private PendingRun(InboundEvent event) {
            this.event = event;
        }
    }

    private final class ScopeRunner {

        private final Scope scope;
        private final Object lock = new Object();
        private final Deque<PendingRun> queue = new ArrayDeque<>();

        private PendingRun current;
        private boolean evicted;
        private boolean closed;

        private ScopeRunner(Scope scope) {
            this.scope = scope;
        }

        boolean offer(PendingRun pending) {
            synchronized (lock) {
                if (evicted) {
                    return false;
                }
                if (closed) {
                    pending.outcome.complete(dropped(pending.event, "dispatcher stopped"));
                    return true;
                }
                if (current != null) {
                    queue.addLast(pending);
                    if (queue.size() % BACKLOG_WARN_STEP == 0) {
                        log.warn("[Dispatcher] {} event(s) waiting for {}", queue.size(), scope);
                    }
                    return true;
                }
                current = pending;
            }
            startRun(pending);
            return true;
        }

        private void startRun(PendingRun pending) {
            try {
                pending.task = scopeRunExecutor.submit(() -> execute(pending));
            } catch (RejectedExecutionException e) {
                log.error("[Dispatcher] executor rejected run for {}: {}", scope, e.getMessage());
                pending.outcome.complete(dropped(pending.event, "executor rejected run"));
                onRunComplete(pending);
            }
        }

        private void execute(PendingRun pending) {
            DispatchOutcome outcome;
            boolean admitted = false;
            try {
                if (admissionGate.inFlight() >= admissionGate.capacity()) {
                    log.debug("[Dispatcher] {} waiting for admission ({} running, {} queued)", scope,
                            admissionGate.inFlight(), admissionGate.waiting());
                }
                admissionGate.acquire();
                admitted = true;
                outcome = dispatcher.process(pending.event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = dropped(pending.event, "interrupted before start");
            } catch (RuntimeException e) { // NOSONAR - must not kill executor thread
                log.error("[Dispatcher] run failed for {}: {}", scope, e.getMessage(), e);
                outcome = dropped(pending.event, e.getMessage());
            } finally {
                if (admitted) {
                    admissionGate.release();
                }
            }
            logOutcome(outcome);
            pending.outcome.complete(outcome);
            onRunComplete(pending);
        }

        private void onRunComplete(PendingRun finished) {
            PendingRun next;
            synchronized (lock) {
                if (current == finished) {
                    current = null;
                }
                if (closed || queue.isEmpty()) {
                    next = null;
                } else {
                    next = queue.removeFirst();
                    current = next;
                }
            }
            if (next != null) {
                startRun(next);
                return;
            }
            evictIfIdle();
        }

        void close(List<DispatchOutcome> failed, List<PendingRun> inFlight) {
            synchronized (lock) {
                closed = true;
                while (!queue.isEmpty()) {
                    PendingRun pending = queue.removeFirst();
                    DispatchOutcome outcome = dropped(pending.event, "dispatcher stopped before run");
                    pending.outcome.complete(outcome);
                    failed.add(outcome);
                }
                if (current != null) {
                    inFlight.add(current);
                }
            }
        }

        private void evictIfIdle() {
            synchronized (lock) {
                if (current != null || !queue.isEmpty() || closed) {
                    return;
                }
                evicted = true;
            }
            if (runners.remove(scope, this)) {
                log.debug("[Dispatcher] evicted idle runner for {}", scope);
            }
        }
    }

    private static void logOutcome(DispatchOutcome outcome) {
        if (outcome.isFailed()) {
            log.warn("[Dispatcher] {} (seq={}) FAILED: {} after {} completion / {} send attempt(s): {}",
                    outcome.getScope(), outcome.getSequenceNo(), outcome.getReason(),
                    outcome.getCompletionAttempts(), outcome.getSendAttempts(), outcome.getError());
        } else {
            log.debug("[Dispatcher] {} (seq={}) -> {} {}", outcome.getScope(), outcome.getSequenceNo(),
                    outcome.getFinalState(), outcome.getReason());
        }
    }
}
