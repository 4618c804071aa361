package me.golemcore.relay.port.inbound;

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

import me.golemcore.relay.domain.model.DeliveryResult;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Scope;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port to the messaging gateway: the inbound event stream plus the outbound
 * command API.
 *
 * <p>
 * Events are exposed as a pull-based, effectively infinite sequence. The
 * stream is at-least-once: after a reconnect the bridge may replay events, so
 * consumers must tolerate duplicates. While disconnected no new events become
 * available; buffering is the bridge's responsibility.
 */
public interface GatewayPort {

    /**
     * Opens the event connection. Reconnects are handled internally until
     * {@link #stop()} is called.
     */
    void start();

    void stop();

    boolean isConnected();

    /**
     * Waits up to {@code timeout} for the next inbound event.
     *
     * @return the next event, or empty if none arrived in time
     */
    Optional<InboundEvent> nextEvent(Duration timeout) throws InterruptedException;

    /**
     * Sends a text reply to the given scope. Never completes exceptionally;
     * failures are reported through {@link DeliveryResult#getFailureKind()}.
     */
    CompletableFuture<DeliveryResult> send(Scope scope, String text);
}
