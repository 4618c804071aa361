package me.golemcore.relay.infrastructure.config;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.loop.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the dispatch loop.
 *
 * <ul>
 * <li>{@code scopeRunExecutor} runs one dispatch at a time per scope; the
 * admission gate bounds how many are active.</li>
 * <li>{@code persistenceExecutor} serializes asynchronous context flushes.</li>
 * </ul>
 */
@Configuration
@Slf4j
public class DispatchExecutorConfiguration {

    private ExecutorService scopeRunExecutor;
    private ExecutorService persistenceExecutor;

    @Bean
    public ExecutorService scopeRunExecutor() {
        if (scopeRunExecutor == null) {
            scopeRunExecutor = Executors.newCachedThreadPool(daemonThreads("scope-run"));
        }
        return scopeRunExecutor;
    }

    @Bean
    public ExecutorService persistenceExecutor() {
        if (persistenceExecutor == null) {
            persistenceExecutor = Executors.newSingleThreadExecutor(daemonThreads("conversation-flush"));
        }
        return persistenceExecutor;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @PreDestroy
    public void shutdown() {
        if (scopeRunExecutor != null) {
            scopeRunExecutor.shutdownNow();
        }
        if (persistenceExecutor != null) {
            persistenceExecutor.shutdown();
        }
        log.debug("[Dispatcher] executors shut down");
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
