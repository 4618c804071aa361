package me.golemcore.relay.adapter.inbound.onebot;

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

import feign.FeignException;
import feign.RetryableException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.DeliveryResult;
import me.golemcore.relay.domain.model.GatewayFailureKind;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.http.FeignClientFactory;
import me.golemcore.relay.port.inbound.GatewayPort;
import me.golemcore.relay.ratelimit.ExponentialBackoff;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gateway adapter for OneBot 11 bridges such as NapCat.
 *
 * <p>
 * Events arrive over a bearer-authenticated WebSocket and are buffered for
 * {@link #nextEvent(Duration)}. Replies go out through the bridge's HTTP API.
 * The socket reconnects with exponential backoff seeded at
 * {@code bot.heartbeat}, capped at {@code bot.gateway.reconnect-max-delay},
 * with 20% jitter; the schedule resets after a successful connect.
 *
 * <p>
 * Sequence gaps and replays are logged per scope; replays are still forwarded
 * and deduplicated by the dispatcher.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OneBotGatewayAdapter implements GatewayPort {

    private static final double RECONNECT_JITTER = 0.2;
    private static final int NORMAL_CLOSURE = 1000;

    private final BotProperties properties;
    private final OkHttpClient okHttpClient;
    private final FeignClientFactory feignClientFactory;
    private final OneBotEventParser parser;

    private final BlockingQueue<InboundEvent> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicInteger connectionGeneration = new AtomicInteger();

    private Map<Scope, Long> lastSequences;
    private volatile String selfId;
    private volatile WebSocket webSocket;
    private OneBotApi api;
    private ExponentialBackoff reconnectBackoff;
    private ScheduledExecutorService reconnectScheduler;
    private ExecutorService sendExecutor;

    @PostConstruct
    public void init() {
        BotProperties.GatewayProperties gateway = properties.getGateway();
        api = feignClientFactory.createAuthenticated(OneBotApi.class, gateway.getHttpUrl(), gateway.getToken(),
                gateway.getSendTimeout());
        reconnectBackoff = new ExponentialBackoff(properties.getHeartbeat(), gateway.getReconnectMaxDelay(),
                RECONNECT_JITTER);
        int maxTrackedScopes = Math.max(1, properties.getDispatch().getMaxTrackedScopes());
        lastSequences = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<Scope, Long> eldest) {
                return size() > maxTrackedScopes;
            }
        };
        sendExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "gateway-send");
            thread.setDaemon(true);
            return thread;
        });
        reconnectScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "gateway-reconnect");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("[Gateway] connecting to {}", properties.getGateway().getWebsocketUrl());
        connect();
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "shutdown");
        }
        connected.set(false);
        reconnectScheduler.shutdownNow();
        sendExecutor.shutdown();
        log.info("[Gateway] stopped");
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public Optional<InboundEvent> nextEvent(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(events.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public CompletableFuture<DeliveryResult> send(Scope scope, String text) {
        Duration timeout = properties.getGateway().getSendTimeout();
        CompletableFuture<DeliveryResult> call;
        try {
            call = CompletableFuture.supplyAsync(() -> doSend(scope, text), sendExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(
                    DeliveryResult.failure(GatewayFailureKind.DISCONNECTED, "gateway stopped"));
        }
        return call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    DeliveryResult result = classifySendFailure(error);
                    log.warn("[Gateway] send to {} failed: kind={}, error={}", scope, result.getFailureKind(),
                            result.getError());
                    return result;
                });
    }

    public String getSelfId() {
        return selfId;
    }

    private DeliveryResult doSend(Scope scope, String text) {
        OneBotSendRequest.OneBotSendRequestBuilder request = OneBotSendRequest.builder()
                .message(text)
                .autoEscape(true);
        OneBotResponse response;
        if (scope.isPrivate()) {
            response = api.sendPrivateMessage(request.userId(OneBotSendRequest.idValue(scope.id())).build());
        } else {
            response = api.sendGroupMessage(request.groupId(OneBotSendRequest.idValue(scope.id())).build());
        }

        if (response != null && response.isOk()) {
            String deliveryId = response.messageId();
            log.debug("[Gateway] delivered to {}: message_id={}", scope, deliveryId);
            return DeliveryResult.delivered(deliveryId);
        }
        String error = response == null
                ? "empty response"
                : "status=" + response.getStatus() + ", retcode=" + response.getRetcode()
                        + ", message=" + (response.getWording() != null ? response.getWording()
                                : response.getMessage());
        log.warn("[Gateway] bridge refused message for {}: {}", scope, error);
        return DeliveryResult.failure(GatewayFailureKind.SEND_FAILED, error);
    }

    static DeliveryResult classifySendFailure(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return DeliveryResult.failure(GatewayFailureKind.TIMEOUT, "send timed out");
        }
        if (cause instanceof RetryableException) {
            if (cause.getCause() instanceof InterruptedIOException) {
                return DeliveryResult.failure(GatewayFailureKind.TIMEOUT, cause.getMessage());
            }
            return DeliveryResult.failure(GatewayFailureKind.DISCONNECTED, cause.getMessage());
        }
        if (cause instanceof FeignException feignException) {
            GatewayFailureKind kind = feignException.status() >= 500 || feignException.status() < 0
                    ? GatewayFailureKind.DISCONNECTED
                    : GatewayFailureKind.SEND_FAILED;
            return DeliveryResult.failure(kind, "HTTP " + feignException.status());
        }
        if (cause instanceof IOException) {
            return DeliveryResult.failure(GatewayFailureKind.DISCONNECTED, cause.getMessage());
        }
        return DeliveryResult.failure(GatewayFailureKind.SEND_FAILED,
                cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    // ==================== Event socket ====================

    private void connect() {
        if (!running.get()) {
            return;
        }
        BotProperties.GatewayProperties gateway = properties.getGateway();
        Request.Builder request = new Request.Builder().url(gateway.getWebsocketUrl());
        if (gateway.getToken() != null && !gateway.getToken().isBlank()) {
            request.header("Authorization", "Bearer " + gateway.getToken());
        }
        OkHttpClient socketClient = okHttpClient.newBuilder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .build();
        int generation = connectionGeneration.incrementAndGet();
        webSocket = socketClient.newWebSocket(request.build(), new EventSocketListener(generation));
    }

    private void scheduleReconnect() {
        if (!running.get()) {
            return;
        }
        int attempt = reconnectAttempts.getAndIncrement();
        Duration delay = reconnectBackoff.delayFor(attempt);
        log.warn("[Gateway] reconnecting in {} ms (attempt {})", delay.toMillis(), attempt + 1);
        try {
            reconnectScheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[Gateway] reconnect skipped, adapter stopping");
        }
    }

    void handleFrame(String text) {
        OneBotFrame frame;
        try {
            frame = parser.parse(text);
        } catch (IOException | RuntimeException e) {
            log.warn("[Gateway] skipped malformed frame: {}", e.getMessage());
            return;
        }

        if (selfId == null && frame.getSelfId() != null) {
            selfId = frame.getSelfId();
        }
        switch (frame.getType()) {
            case LIFECYCLE -> {
                selfId = frame.getSelfId();
                log.info("[Gateway] bridge lifecycle event, self id {}", selfId);
            }
            case HEARTBEAT -> {
                if (Boolean.FALSE.equals(frame.getOnline()) || Boolean.FALSE.equals(frame.getGood())) {
                    log.warn("[Gateway] bridge unhealthy: online={}, good={}", frame.getOnline(), frame.getGood());
                }
            }
            case MESSAGE -> onMessageFrame(frame);
            default -> log.trace("[Gateway] ignored frame");
        }
    }

    private void onMessageFrame(OneBotFrame frame) {
        if (selfId != null && selfId.equals(frame.getSenderId())) {
            return;
        }
        long sequenceNo = resolveSequence(frame);
        trackSequence(frame.getScope(), sequenceNo);

        boolean mentionsSelf = frame.getMentions().contains(OneBotEventParser.MENTION_ALL)
                || (selfId != null && frame.getMentions().contains(selfId));
        InboundEvent event = InboundEvent.builder()
                .scope(frame.getScope())
                .senderId(frame.getSenderId())
                .senderName(frame.getSenderName())
                .rawText(frame.getText())
                .receivedAt(frame.getTime())
                .sequenceNo(sequenceNo)
                .messageId(frame.getMessageId())
                .mentionsSelf(mentionsSelf)
                .build();
        events.add(event);
    }

    private long resolveSequence(OneBotFrame frame) {
        if (frame.getMessageSeq() != null) {
            return frame.getMessageSeq();
        }
        try {
            return frame.getMessageId() != null ? Long.parseLong(frame.getMessageId()) : 0L;
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private void trackSequence(Scope scope, long sequenceNo) {
        synchronized (lastSequences) {
            Long previous = lastSequences.get(scope);
            if (previous == null) {
                lastSequences.put(scope, sequenceNo);
                return;
            }
            if (sequenceNo <= previous) {
                log.debug("[Gateway] replayed or reordered event in {}: seq={} <= last={}",
                        scope, sequenceNo, previous);
                return;
            }
            if (sequenceNo > previous + 1) {
                log.debug("[Gateway] sequence gap in {}: {} -> {}", scope, previous, sequenceNo);
            }
            lastSequences.put(scope, sequenceNo);
        }
    }

    int reconnectAttempts() {
        return reconnectAttempts.get();
    }

    int connectionGeneration() {
        return connectionGeneration.get();
    }

    int trackedScopes() {
        synchronized (lastSequences) {
            return lastSequences.size();
        }
    }

    final class EventSocketListener extends WebSocketListener {

        private final int generation;

        EventSocketListener(int generation) {
            this.generation = generation;
        }

        private boolean isCurrent() {
            return generation == connectionGeneration.get();
        }

        @Override
        public void onOpen(WebSocket socket, Response response) {
            if (!isCurrent()) {
                return;
            }
            connected.set(true);
            reconnectAttempts.set(0);
            log.info("[Gateway] connected");
        }

        @Override
        public void onMessage(WebSocket socket, String text) {
            if (!isCurrent()) {
                return;
            }
            handleFrame(text);
        }

        @Override
        public void onClosing(WebSocket socket, int code, String reason) {
            socket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket socket, int code, String reason) {
            if (!isCurrent()) {
                return;
            }
            connected.set(false);
            log.warn("[Gateway] connection closed: code={}, reason={}", code, reason);
            scheduleReconnect();
        }

        @Override
        public void onFailure(WebSocket socket, Throwable failure, Response response) {
            if (!isCurrent()) {
                return;
            }
            connected.set(false);
            log.warn("[Gateway] connection failed: {}{}", failure.getMessage(),
                    response != null ? " (HTTP " + response.code() + ")" : "");
            scheduleReconnect();
        }
    }
}
