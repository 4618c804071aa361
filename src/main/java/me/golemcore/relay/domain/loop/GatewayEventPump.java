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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.DispatchOutcome;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.service.ConversationStore;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.config.LoggingFlagsConfigurer;
import me.golemcore.relay.port.inbound.GatewayPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Single thread pulling events off the gateway and handing them to the
 * per-scope runners.
 *
 * <p>
 * Shutdown order: stop pulling, drain the runners, flush every context, close
 * the gateway.
 */
@Component
@Slf4j
public class GatewayEventPump {

    private static final Logger CHAT_LOG = LoggerFactory.getLogger(LoggingFlagsConfigurer.CHAT_LOGGER);
    private static final long JOIN_TIMEOUT_MS = 2000;

    private final GatewayPort gateway;
    private final ScopeRunCoordinator coordinator;
    private final ConversationStore conversationStore;
    private final Duration pollTimeout;
    private final Duration shutdownTimeout;

    private volatile boolean running;
    private volatile boolean stopped;
    private Thread worker;

    public GatewayEventPump(BotProperties properties, GatewayPort gateway, ScopeRunCoordinator coordinator,
            ConversationStore conversationStore) {
        this.gateway = gateway;
        this.coordinator = coordinator;
        this.conversationStore = conversationStore;
        this.pollTimeout = properties.getHeartbeat();
        this.shutdownTimeout = properties.getDispatch().getShutdownTimeout();
    }

    public synchronized void start() {
        if (running || stopped) {
            return;
        }
        running = true;
        worker = new Thread(this::pump, "gateway-pump");
        worker.setDaemon(true);
        worker.start();
        log.info("[Gateway] event pump started (poll interval {} ms)", pollTimeout.toMillis());
    }

    public boolean isRunning() {
        return running;
    }

    void pump() {
        while (running) {
            try {
                Optional<InboundEvent> next = gateway.nextEvent(pollTimeout);
                next.ifPresent(this::dispatch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) { // NOSONAR - must not kill the pump thread
                log.error("[Gateway] event pump error: {}", e.getMessage(), e);
            }
        }
        log.debug("[Gateway] event pump stopped");
    }

    void dispatch(InboundEvent event) {
        CHAT_LOG.info("[{}] {}({}): {}", event.getScope(), event.senderLabel(), event.getSenderId(),
                event.getRawText());
        coordinator.enqueue(event);
    }

    @PreDestroy
    public void shutdown() {
        Thread pumpThread;
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            running = false;
            pumpThread = worker;
        }
        log.info("[Gateway] shutting down event pump");
        if (pumpThread != null) {
            pumpThread.interrupt();
            try {
                pumpThread.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        List<DispatchOutcome> failed = coordinator.shutdown(shutdownTimeout);
        if (!failed.isEmpty()) {
            log.warn("[Gateway] {} event(s) left unprocessed at shutdown", failed.size());
        }
        conversationStore.flushAll();
        gateway.stop();
    }
}
