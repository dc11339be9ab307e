package com.reportpull.auth.pkce;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CallbackListenerTest {

    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    private CallbackListener listener;

    @AfterEach
    void tearDown() {
        if (listener != null) {
            listener.close();
        }
    }

    @Test
    void codeCallbackIsDeliveredAndSocketStops() throws Exception {
        listener = new CallbackListener(Ports.freePort(), 10);
        listener.bind();
        assertThat(listener.state()).isEqualTo(ListenerState.PORT_BOUND);
        assertThat(listener.redirectUri()).isEqualTo("http://localhost:" + listener.port() + "/callback");

        HttpResponse<String> page = get(listener.redirectUri() + "?code=abc123&state=s1");
        CallbackResult result = listener.awaitResult(Duration.ofSeconds(5));

        assertThat(page.statusCode()).isEqualTo(200);
        assertThat(page.body()).contains("Authentication Successful");
        assertThat(result).isEqualTo(new CallbackResult.CodeReceived("abc123", "s1"));
        assertThat(listener.state()).isEqualTo(ListenerState.CODE_RECEIVED);
        assertThat(listener.isClosed()).isTrue();
        assertThatThrownBy(() -> get(listener.redirectUri() + "?code=again")).isInstanceOf(IOException.class);
    }

    @Test
    void providerErrorIsCapturedWithDefaultDescription() throws Exception {
        listener = new CallbackListener(Ports.freePort(), 10);
        listener.bind();

        HttpResponse<String> page = get(listener.redirectUri() + "?error=access_denied&state=s1");
        CallbackResult result = listener.awaitResult(Duration.ofSeconds(5));

        assertThat(page.statusCode()).isEqualTo(400);
        assertThat(result).isEqualTo(new CallbackResult.ProviderError("access_denied", "Unknown error", "s1"));
        assertThat(listener.state()).isEqualTo(ListenerState.ERROR_RECEIVED);
    }

    @Test
    void errorPageEscapesProviderText() throws Exception {
        listener = new CallbackListener(Ports.freePort(), 10);
        listener.bind();

        HttpResponse<String> page = get(listener.redirectUri()
            + "?error=%3Cb%3Ebad%3C%2Fb%3E&error_description=%3Cscript%3Ealert(1)%3C%2Fscript%3E");

        assertThat(page.body()).doesNotContain("<script>alert(1)").contains("&lt;script&gt;");
        assertThat(page.body()).doesNotContain("<b>bad</b>");
    }

    @Test
    void handlerFailureCompletesWithGenericErrorAndCloses() throws Exception {
        listener = new CallbackListener(Ports.freePort(), 10, query -> {
            throw new IllegalStateException("parser exploded");
        });
        listener.bind();

        HttpResponse<String> page = get(listener.redirectUri() + "?code=abc123&state=s1");
        CallbackResult result = listener.awaitResult(Duration.ofSeconds(5));

        assertThat(page.statusCode()).isEqualTo(500);
        assertThat(page.body()).contains("Authentication Error").doesNotContain("parser exploded");
        assertThat(result).isInstanceOf(CallbackResult.HandlingFailed.class);
        assertThat(((CallbackResult.HandlingFailed) result).reason()).contains("IllegalStateException");
        assertThat(listener.state()).isEqualTo(ListenerState.FAILED);
        assertThat(listener.isClosed()).isTrue();
    }

    @Test
    void callbackWithoutCodeOrErrorIsMalformed() throws Exception {
        listener = new CallbackListener(Ports.freePort(), 10);
        listener.bind();

        HttpResponse<String> page = get(listener.redirectUri() + "?state=only");

        assertThat(page.statusCode()).isEqualTo(400);
        assertThat(listener.awaitResult(Duration.ofSeconds(5))).isInstanceOf(CallbackResult.Malformed.class);
        assertThat(listener.state()).isEqualTo(ListenerState.MALFORMED);
    }

    @Test
    void onlyTheFirstCallbackCounts() throws Exception {
        listener = new CallbackListener(Ports.freePort(), 10);
        listener.bind();

        HttpResponse<String> favicon = get("http://localhost:" + listener.port() + "/favicon.ico");
        HttpResponse<String> first = get(listener.redirectUri() + "?code=first");
        HttpResponse<String> second = get(listener.redirectUri() + "?code=second");

        assertThat(favicon.statusCode()).isEqualTo(404);
        assertThat(first.statusCode()).isEqualTo(200);
        assertThat(second.statusCode()).isEqualTo(409);
        assertThat(listener.awaitResult(Duration.ofSeconds(5)))
            .isEqualTo(new CallbackResult.CodeReceived("first", null));
    }

    @Test
    void timesOutAndReleasesThePort() throws Exception {
        listener = new CallbackListener(Ports.freePort(), 10);
        int port = listener.bind();
        listener.markBrowserOpened();
        assertThat(listener.state()).isEqualTo(ListenerState.BROWSER_OPENED);

        CallbackResult result = listener.awaitResult(Duration.ofMillis(200));

        assertThat(result).isInstanceOf(CallbackResult.TimedOut.class);
        assertThat(listener.state()).isEqualTo(ListenerState.TIMEOUT);
        assertThat(listener.isClosed()).isTrue();
        CallbackListener reuse = new CallbackListener(port, 1);
        try {
            assertThat(reuse.bind()).isEqualTo(port);
        } finally {
            reuse.close();
        }
    }

    @Test
    void skipsBusyPorts() throws Exception {
        try (ServerSocket busy = Ports.occupy()) {
            listener = new CallbackListener(busy.getLocalPort(), 10);

            int port = listener.bind();

            assertThat(port).isGreaterThan(busy.getLocalPort()).isLessThan(busy.getLocalPort() + 10);
        }
    }

    @Test
    void failsWhenEveryPortInRangeIsBusy() throws Exception {
        try (ServerSocket busy = Ports.occupy()) {
            listener = new CallbackListener(busy.getLocalPort(), 1);

            assertThatThrownBy(listener::bind)
                .isInstanceOf(CallbackBindException.class)
                .hasMessageContaining(String.valueOf(busy.getLocalPort()));
        }
    }

    @Test
    void parsesQueryKeepingFirstValue() {
        assertThat(CallbackListener.parseQuery("code=a%2Fb&state=x+y&code=ignored&flag"))
            .containsEntry("code", "a/b")
            .containsEntry("state", "x y")
            .containsEntry("flag", "");
    }

    private HttpResponse<String> get(String url) throws IOException, InterruptedException {
        return http.send(HttpRequest.newBuilder(URI.create(url)).timeout(Duration.ofSeconds(5)).GET().build(),
            HttpResponse.BodyHandlers.ofString());
    }
}
