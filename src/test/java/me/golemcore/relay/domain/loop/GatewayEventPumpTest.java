package me.golemcore.relay.domain.loop;

import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.domain.service.ConversationStore;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.port.inbound.GatewayPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GatewayEventPumpTest {

    private BotProperties properties;
    private GatewayPort gateway;
    private ScopeRunCoordinator coordinator;
    private ConversationStore conversationStore;
    private GatewayEventPump pump;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.setHeartbeat(Duration.ofMillis(20));
        gateway = mock(GatewayPort.class);
        coordinator = mock(ScopeRunCoordinator.class);
        conversationStore = mock(ConversationStore.class);
        pump = new GatewayEventPump(properties, gateway, coordinator, conversationStore);
    }

    @Test
    void shouldForwardEventsToCoordinator() throws Exception {
        InboundEvent event = InboundEvent.builder()
                .scope(Scope.privateChat("10001"))
                .senderId("10001")
                .senderName("Alice")
                .rawText("hi")
                .receivedAt(Instant.parse("2026-03-01T12:00:00Z"))
                .sequenceNo(1)
                .build();
        AtomicBoolean delivered = new AtomicBoolean();
        when(gateway.nextEvent(any())).thenAnswer(inv -> {
            if (delivered.compareAndSet(false, true)) {
                return Optional.of(event);
            }
            Thread.sleep(10);
            return Optional.empty();
        });

        pump.start();
        assertTrue(pump.isRunning());

        verify(coordinator, timeout(2000)).enqueue(event);
        pump.shutdown();
        assertFalse(pump.isRunning());
    }

    @Test
    void shouldDrainFlushAndCloseInOrderOnShutdown() throws Exception {
        when(gateway.nextEvent(any())).thenAnswer(inv -> {
            Thread.sleep(10);
            return Optional.empty();
        });
        pump.start();

        pump.shutdown();

        InOrder order = inOrder(coordinator, conversationStore, gateway);
        order.verify(coordinator).shutdown(properties.getDispatch().getShutdownTimeout());
        order.verify(conversationStore).flushAll();
        order.verify(gateway).stop();
    }

    @Test
    void shouldNotRestartAfterShutdown() throws Exception {
        pump.shutdown();
        pump.start();

        assertFalse(pump.isRunning());
        verify(gateway, never()).nextEvent(any());
    }
}
