package me.golemcore.relay.adapter.inbound.onebot;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.http.FeignClientFactory;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OneBotGatewayReconnectTest {

    private static final String MESSAGE_FRAME = """
            {"post_type":"message","message_type":"private","self_id":42,"user_id":10001,
             "message_id":77,"message":"back again"}
            """;

    private MockWebServer server;
    private OneBotGatewayAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        BotProperties properties = new BotProperties();
        properties.setHeartbeat(Duration.ofMillis(50));
        properties.getGateway().setReconnectMaxDelay(Duration.ofMillis(200));
        properties.getGateway().setWebsocketUrl(server.url("/").toString().replaceFirst("^http", "ws"));
        properties.getGateway().setHttpUrl(server.url("/").toString());
        properties.getGateway().setToken("secret");

        OkHttpClient client = new OkHttpClient();
        ObjectMapper objectMapper = new ObjectMapper();
        OneBotEventParser parser = new OneBotEventParser(objectMapper,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
        adapter = new OneBotGatewayAdapter(properties, client, new FeignClientFactory(client, objectMapper), parser);
        adapter.init();
    }

    @AfterEach
    void tearDown() throws Exception {
        adapter.stop();
        server.shutdown();
    }

    @Test
    void shouldReconnectAfterBridgeClosesSocket() throws Exception {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket socket, Response response) {
                socket.close(1001, "bridge restarting");
            }
        }));
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket socket, Response response) {
                socket.send(MESSAGE_FRAME);
            }
        }));

        adapter.start();

        RecordedRequest first = server.takeRequest(2, TimeUnit.SECONDS);
        RecordedRequest second = server.takeRequest(2, TimeUnit.SECONDS);
        assertNotNull(first);
        assertNotNull(second);
        assertEquals("Bearer secret", first.getHeader("Authorization"));
        assertEquals("Bearer secret", second.getHeader("Authorization"));

        InboundEvent event = adapter.nextEvent(Duration.ofSeconds(2)).orElseThrow();
        assertEquals(Scope.privateChat("10001"), event.getScope());
        assertEquals(77L, event.getSequenceNo());

        awaitTrue(adapter::isConnected);
        assertEquals(0, adapter.reconnectAttempts());
        assertEquals(2, adapter.connectionGeneration());
    }

    @Test
    void shouldKeepRetryingWhileUpgradeIsRefused() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
        }));

        adapter.start();

        for (int i = 0; i < 3; i++) {
            assertNotNull(server.takeRequest(3, TimeUnit.SECONDS));
        }
        awaitTrue(adapter::isConnected);
        assertEquals(0, adapter.reconnectAttempts());
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean());
    }
}
