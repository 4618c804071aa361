package me.golemcore.relay.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory stand-in for a OneBot bridge's HTTP action endpoint.
 * <p>
 * Nothing touches the network: each call consumes the next planned reply or
 * failure, and every request is recorded for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final ConcurrentLinkedQueue<Planned> planned = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Exchange> exchanges = new ConcurrentLinkedQueue<>();

    /**
     * Client routed through this engine. Base URLs are never resolved.
     */
    public OkHttpClient client() {
        return new OkHttpClient.Builder()
                .addInterceptor(this)
                .retryOnConnectionFailure(false)
                .build();
    }

    public void replyOk(String messageId) {
        replyJson(200, "{\"status\":\"ok\",\"retcode\":0,\"data\":{\"message_id\":" + messageId + "}}");
    }

    public void replyRefused(int retcode, String wording) {
        replyJson(200, "{\"status\":\"failed\",\"retcode\":" + retcode
                + ",\"data\":null,\"wording\":\"" + wording + "\"}");
    }

    public void replyJson(int httpStatus, String body) {
        planned.add(new Planned(httpStatus, body, null));
    }

    public void fail(IOException failure) {
        planned.add(new Planned(0, null, failure));
    }

    public List<Exchange> exchanges() {
        return new ArrayList<>(exchanges);
    }

    public Exchange lastExchange() {
        Exchange last = null;
        for (Exchange exchange : exchanges) {
            last = exchange;
        }
        return last;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        exchanges.add(new Exchange(request.method(), request.url().encodedPath(),
                request.header("Authorization"), bodyOf(request)));

        Planned next = planned.poll();
        if (next == null) {
            throw new IOException("bridge mock has no reply for " + request.method() + " " + request.url());
        }
        if (next.failure() != null) {
            throw next.failure();
        }
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(next.httpStatus())
                .message("mock")
                .body(ResponseBody.create(next.body() != null ? next.body() : "", JSON))
                .build();
    }

    private static String bodyOf(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Planned(int httpStatus, String body, IOException failure) {
    }

    /**
     * One recorded request.
     */
    public record Exchange(String method, String path, String authorization, String body) {
    }
}
