package com.reportpull.auth;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Scripted HTTP endpoint on the loopback interface. Replies are served in order; once the
 * queue is empty the fallback reply is used.
 */
public final class FakeHttpServer implements AutoCloseable {

    public record Recorded(String method, String path, String rawQuery, Map<String, List<String>> headers, String body) {
        public String header(String name) {
            return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst()
                .orElse(null);
        }

        public Map<String, String> form() {
            return decode(body);
        }

        public Map<String, String> query() {
            return decode(rawQuery);
        }

        private static Map<String, String> decode(String encoded) {
            Map<String, String> out = new LinkedHashMap<>();
            if (encoded == null || encoded.isEmpty()) {
                return out;
            }
            for (String pair : encoded.split("&")) {
                int idx = pair.indexOf('=');
                out.put(URLDecoder.decode(idx < 0 ? pair : pair.substring(0, idx), StandardCharsets.UTF_8),
                    idx < 0 ? "" : URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
            }
            return out;
        }
    }

    public record Reply(int status, String body) {}

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final Deque<Reply> replies = new ConcurrentLinkedDeque<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private volatile Reply fallback = new Reply(500, "{\"error\":\"unexpected_request\"}");
    private volatile long delayMillis;
    private volatile Function<Recorded, Reply> responder;
    private final AtomicBoolean closed = new AtomicBoolean();

    private final URI uri;

    private FakeHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", this::handle);
        server.setExecutor(executor);
        server.start();
        uri = URI.create("http://" + server.getAddress().getAddress().getHostAddress() + ":" + server.getAddress().getPort());
    }

    public static FakeHttpServer start() throws IOException {
        return new FakeHttpServer();
    }

    public URI uri() {
        return uri;
    }

    public FakeHttpServer enqueue(int status, String body) {
        replies.add(new Reply(status, body));
        return this;
    }

    public FakeHttpServer always(int status, String body) {
        fallback = new Reply(status, body);
        return this;
    }

    /**
     * Computes every reply from the request, ignoring the queue and the fallback.
     */
    public FakeHttpServer respond(Function<Recorded, Reply> responder) {
        this.responder = responder;
        return this;
    }

    public FakeHttpServer delay(long millis) {
        delayMillis = millis;
        return this;
    }

    public List<Recorded> requests() {
        return requests;
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        Recorded recorded = new Recorded(exchange.getRequestMethod(), exchange.getRequestURI().getPath(),
            exchange.getRequestURI().getRawQuery(), Map.copyOf(exchange.getRequestHeaders()), body);
        requests.add(recorded);
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exchange.close();
                return;
            }
        }
        Function<Recorded, Reply> computed = responder;
        Reply reply = computed != null ? computed.apply(recorded) : replies.poll();
        if (reply == null) {
            reply = fallback;
        }
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(reply.status(), bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        server.stop(0);
        executor.shutdownNow();
    }
}
