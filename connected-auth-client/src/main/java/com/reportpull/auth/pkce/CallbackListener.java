package com.reportpull.auth.pkce;

import java.io.IOException;
import java.io.OutputStream;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import lombok.extern.slf4j.Slf4j;

/**
 * One-shot localhost listener for the OAuth redirect.
 * <p>
 * The first request on {@value #CALLBACK_PATH} is turned into a single {@link CallbackResult}
 * published on a future. The waiting thread races that future against its timeout, and the
 * socket is stopped on every exit path.
 */
@Slf4j
public final class CallbackListener implements AutoCloseable {

    public static final String CALLBACK_PATH = "/callback";
    static final String HOST = "localhost";

    private final int startPort;
    private final int portRange;
    private final Function<String, Map<String, String>> queryParser;
    private final CompletableFuture<CallbackResult> result = new CompletableFuture<>();
    private final AtomicBoolean handled = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicReference<ListenerState> state = new AtomicReference<>(ListenerState.IDLE);

    private HttpServer server;
    private ExecutorService executor;
    private int port = -1;

    public CallbackListener(int startPort, int portRange) {
        this(startPort, portRange, CallbackListener::parseQuery);
    }

    CallbackListener(int startPort, int portRange, Function<String, Map<String, String>> queryParser) {
        if (portRange < 1) {
            throw new IllegalArgumentException("portRange must be at least 1");
        }
        this.startPort = startPort;
        this.portRange = portRange;
        this.queryParser = queryParser;
    }

    /**
     * Binds the first free port in {@code [startPort, startPort + portRange)} and starts serving.
     *
     * @return the bound port
     * @throws CallbackBindException when every port in the range is taken
     */
    public synchronized int bind() {
        if (state.get() != ListenerState.IDLE) {
            throw new IllegalStateException("Listener already bound: " + state.get());
        }
        IOException last = null;
        for (int candidate = startPort; candidate < startPort + portRange; candidate++) {
            try {
                server = HttpServer.create(new InetSocketAddress(HOST, candidate), 0);
                port = candidate;
                break;
            } catch (BindException e) {
                log.debug("Callback port {} is busy", candidate);
                last = e;
            } catch (IOException e) {
                last = e;
            }
        }
        if (server == null) {
            throw new CallbackBindException("No free callback port in range " + startPort + "-"
                + (startPort + portRange - 1) + " on " + HOST, last);
        }

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "oauth-callback-" + port);
            t.setDaemon(true);
            return t;
        });
        server.createContext(CALLBACK_PATH, this::handle);
        server.createContext("/", exchange -> respond(exchange, 404, page("Not Found", "Nothing to see here.")));
        server.setExecutor(executor);
        server.start();
        state.set(ListenerState.PORT_BOUND);
        log.info("OAuth callback listener bound on http://{}:{}{}", HOST, port, CALLBACK_PATH);
        return port;
    }

    public int port() {
        return port;
    }

    public String redirectUri() {
        return "http://" + HOST + ":" + port + CALLBACK_PATH;
    }

    public ListenerState state() {
        return state.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void markBrowserOpened() {
        state.compareAndSet(ListenerState.PORT_BOUND, ListenerState.BROWSER_OPENED);
    }

    /**
     * Blocks until the redirect arrives or {@code timeout} elapses, then tears the listener down.
     */
    public CallbackResult awaitResult(Duration timeout) {
        if (!state.compareAndSet(ListenerState.BROWSER_OPENED, ListenerState.AWAITING_CALLBACK)) {
            state.compareAndSet(ListenerState.PORT_BOUND, ListenerState.AWAITING_CALLBACK);
        }
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            state.set(ListenerState.TIMEOUT);
            log.warn("No OAuth callback within {}s on port {}", timeout.toSeconds(), port);
            return new CallbackResult.TimedOut(timeout.toSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.set(ListenerState.FAILED);
            return new CallbackResult.HandlingFailed("Interrupted while waiting for the OAuth callback");
        } catch (ExecutionException e) {
            state.set(ListenerState.FAILED);
            return new CallbackResult.HandlingFailed("Callback handling failed: " + e.getCause());
        } finally {
            close();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
        if (!result.isDone()) {
            result.complete(new CallbackResult.HandlingFailed("Listener closed before a callback arrived"));
        }
        log.debug("OAuth callback listener on port {} closed", port);
    }

    private void handle(HttpExchange exchange) throws IOException {
        if (!handled.compareAndSet(false, true)) {
            respond(exchange, 409, page("Already Handled", "This sign-in attempt has already completed."));
            return;
        }
        CallbackResult outcome = null;
        try {
            Map<String, String> query = queryParser.apply(exchange.getRequestURI().getRawQuery());
            if (query.containsKey("code")) {
                outcome = new CallbackResult.CodeReceived(query.get("code"), query.get("state"));
                state.set(ListenerState.CODE_RECEIVED);
                respond(exchange, 200, page("Authentication Successful",
                    "You can now close this window and return to the application.")
                    .replace("</body>", "<script>setTimeout(function(){window.close();},3000);</script></body>"));
            } else if (query.containsKey("error")) {
                String error = query.get("error");
                String description = query.getOrDefault("error_description", "Unknown error");
                outcome = new CallbackResult.ProviderError(error, description, query.get("state"));
                state.set(ListenerState.ERROR_RECEIVED);
                log.warn("OAuth provider returned error {}: {}", error, description);
                respond(exchange, 400, page("Authentication Failed",
                    "Error: " + escape(error) + "<br>Description: " + escape(description)
                        + "<br>Please close this window and try again."));
            } else {
                outcome = new CallbackResult.Malformed("Callback carried neither code nor error");
                state.set(ListenerState.MALFORMED);
                respond(exchange, 400, page("Authentication Error",
                    "The sign-in response was not understood. Please close this window and try again."));
            }
        } catch (Exception e) {
            log.error("Error handling OAuth callback", e);
            if (outcome == null) {
                outcome = new CallbackResult.HandlingFailed("Error handling OAuth callback: " + e.getClass().getSimpleName());
                state.set(ListenerState.FAILED);
            }
            try {
                respond(exchange, 500, page("Authentication Error",
                    "An error occurred during authentication. Please close this window and try again."));
            } catch (IOException | RuntimeException writeFailure) {
                log.debug("Could not send error page: {}", writeFailure.toString());
            }
        } finally {
            result.complete(outcome != null
                ? outcome
                : new CallbackResult.HandlingFailed("Callback handler exited without a result"));
        }
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int idx = pair.indexOf('=');
            String key = URLDecoder.decode(idx < 0 ? pair : pair.substring(0, idx), StandardCharsets.UTF_8);
            String value = idx < 0 ? "" : URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
            params.putIfAbsent(key, value);
        }
        return params;
    }

    private static void respond(HttpExchange exchange, int status, String html) throws IOException {
        byte[] bytes = html.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static String page(String title, String message) {
        return "<html><head><title>" + escape(title) + "</title></head>"
            + "<body style=\"font-family: Arial, sans-serif; text-align: center; padding: 50px;\">"
            + "<h2>" + escape(title) + "</h2><p>" + message + "</p></body></html>";
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;")
            .replace("\"", "&quot;").replace("'", "&#39;");
    }
}
