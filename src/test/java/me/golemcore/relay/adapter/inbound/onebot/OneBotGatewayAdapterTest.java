package me.golemcore.relay.adapter.inbound.onebot;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.DeliveryResult;
import me.golemcore.relay.domain.model.GatewayFailureKind;
import me.golemcore.relay.domain.model.InboundEvent;
import me.golemcore.relay.domain.model.Scope;
import me.golemcore.relay.infrastructure.config.BotProperties;
import me.golemcore.relay.infrastructure.http.FeignClientFactory;
import me.golemcore.relay.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OneBotGatewayAdapterTest {

    private OkHttpMockEngine bridge;
    private OneBotGatewayAdapter adapter;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getGateway().setHttpUrl("http://bridge.test:3000");
        properties.getGateway().setToken("secret");
        properties.getDispatch().setMaxTrackedScopes(2);
        bridge = new OkHttpMockEngine();
        objectMapper = new ObjectMapper();
        OneBotEventParser parser = new OneBotEventParser(objectMapper,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
        adapter = new OneBotGatewayAdapter(properties, bridge.client(),
                new FeignClientFactory(bridge.client(), objectMapper), parser);
        adapter.init();
    }

    @AfterEach
    void tearDown() {
        adapter.stop();
    }

    @Test
    void shouldSendPrivateReplyAsPlainText() throws Exception {
        bridge.replyOk("90001");

        DeliveryResult result = adapter.send(Scope.privateChat("10001"), "hello [CQ:face,id=1]")
                .get(2, TimeUnit.SECONDS);

        assertTrue(result.isDelivered());
        assertEquals("90001", result.getDeliveryId());
        OkHttpMockEngine.Exchange exchange = bridge.lastExchange();
        assertEquals("POST", exchange.method());
        assertEquals("/send_private_msg", exchange.path());
        assertEquals("Bearer secret", exchange.authorization());
        var body = objectMapper.readTree(exchange.body());
        assertEquals(10001L, body.get("user_id").asLong());
        assertTrue(body.get("user_id").isNumber());
        assertEquals("hello [CQ:face,id=1]", body.get("message").asText());
        assertTrue(body.get("auto_escape").asBoolean());
        assertFalse(body.has("group_id"));
    }

    @Test
    void shouldSendGroupReply() throws Exception {
        bridge.replyOk("7");

        DeliveryResult result = adapter.send(Scope.group("777"), "hi all").get(2, TimeUnit.SECONDS);

        assertTrue(result.isDelivered());
        assertEquals("/send_group_msg", bridge.lastExchange().path());
    }

    @Test
    void shouldReportRefusalAsSendFailed() throws Exception {
        bridge.replyRefused(1200, "group muted");

        DeliveryResult result = adapter.send(Scope.group("777"), "hi").get(2, TimeUnit.SECONDS);

        assertFalse(result.isDelivered());
        assertEquals(GatewayFailureKind.SEND_FAILED, result.getFailureKind());
        assertTrue(result.getError().contains("group muted"));
    }

    @Test
    void shouldClassifyHttpAndNetworkFailures() throws Exception {
        bridge.replyJson(503, "{}");
        bridge.replyJson(400, "{}");
        bridge.fail(new IOException("connection reset"));
        bridge.fail(new SocketTimeoutException("read timed out"));
        Scope scope = Scope.privateChat("1");

        assertEquals(GatewayFailureKind.DISCONNECTED,
                adapter.send(scope, "a").get(2, TimeUnit.SECONDS).getFailureKind());
        assertEquals(GatewayFailureKind.SEND_FAILED,
                adapter.send(scope, "b").get(2, TimeUnit.SECONDS).getFailureKind());
        assertEquals(GatewayFailureKind.DISCONNECTED,
                adapter.send(scope, "c").get(2, TimeUnit.SECONDS).getFailureKind());
        assertEquals(GatewayFailureKind.TIMEOUT,
                adapter.send(scope, "d").get(2, TimeUnit.SECONDS).getFailureKind());
    }

    @Test
    void shouldClassifyCallTimeout() {
        DeliveryResult result = OneBotGatewayAdapter.classifySendFailure(
                new CompletionException(new TimeoutException()));

        assertEquals(GatewayFailureKind.TIMEOUT, result.getFailureKind());
    }

    @Test
    void shouldQueueMessagesAndDetectSelfMentions() throws Exception {
        adapter.handleFrame("{\"post_type\":\"meta_event\",\"meta_event_type\":\"lifecycle\",\"self_id\":42}");
        adapter.handleFrame("""
                {"post_type":"message","message_type":"group","self_id":42,"user_id":10001,"group_id":777,
                 "message_id":5,"message_seq":1201,"sender":{"nickname":"Alice"},
                 "message":[{"type":"at","data":{"qq":"42"}},{"type":"text","data":{"text":"ping"}}]}
                """);

        assertEquals("42", adapter.getSelfId());
        InboundEvent event = adapter.nextEvent(Duration.ofMillis(200)).orElseThrow();
        assertEquals(Scope.group("777"), event.getScope());
        assertEquals(1201L, event.getSequenceNo());
        assertEquals("5", event.getMessageId());
        assertEquals("Alice", event.getSenderName());
        assertTrue(event.isMentionsSelf());
    }

    @Test
    void shouldUseMessageIdWhenSequenceMissing() throws Exception {
        adapter.handleFrame("""
                {"post_type":"message","message_type":"private","self_id":42,"user_id":10001,
                 "message_id":88,"message":[{"type":"text","data":{"text":"hi"}}]}
                """);

        InboundEvent event = adapter.nextEvent(Duration.ofMillis(200)).orElseThrow();
        assertEquals(88L, event.getSequenceNo());
        assertFalse(event.isMentionsSelf());
    }

    @Test
    void shouldDropOwnMessagesAndMalformedFrames() throws Exception {
        adapter.handleFrame("{\"post_type\":\"meta_event\",\"meta_event_type\":\"lifecycle\",\"self_id\":42}");
        adapter.handleFrame("""
                {"post_type":"message","message_type":"private","self_id":42,"user_id":42,
                 "message_id":1,"message":"echo"}
                """);
        adapter.handleFrame("not json at all");
        adapter.handleFrame("{\"post_type\":\"notice\"}");

        Optional<InboundEvent> event = adapter.nextEvent(Duration.ofMillis(50));
        assertTrue(event.isEmpty());
    }

    @Test
    void shouldIgnoreFramesFromSupersededConnection() throws Exception {
        String frame = """
                {"post_type":"message","message_type":"private","self_id":42,"user_id":10001,
                 "message_id":9,"message":"hello"}
                """;
        int current = adapter.connectionGeneration();

        adapter.new EventSocketListener(current - 1).onMessage(null, frame);
        assertTrue(adapter.nextEvent(Duration.ofMillis(50)).isEmpty());

        adapter.new EventSocketListener(current).onMessage(null, frame);
        assertEquals(9L, adapter.nextEvent(Duration.ofMillis(200)).orElseThrow().getSequenceNo());
    }

    @Test
    void shouldBoundTrackedSequenceScopes() throws Exception {
        for (int user = 1; user <= 3; user++) {
            adapter.handleFrame("{\"post_type\":\"message\",\"message_type\":\"private\",\"self_id\":42,"
                    + "\"user_id\":" + user + ",\"message_id\":" + (100 + user) + ",\"message\":\"hi\"}");
        }

        assertEquals(2, adapter.trackedScopes());
        for (int user = 1; user <= 3; user++) {
            InboundEvent event = adapter.nextEvent(Duration.ofMillis(200)).orElseThrow();
            assertEquals(Scope.privateChat(String.valueOf(user)), event.getScope());
        }
    }

    @Test
    void shouldStayDisconnectedUntilStarted() {
        assertFalse(adapter.isConnected());
    }
}
