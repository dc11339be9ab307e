package com.reportpull.auth.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.reportpull.auth.FakeHttpServer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionHandleTest {

    private FakeHttpServer server;
    private WorkerScheduler worker;

    @BeforeEach
    void setUp() throws Exception {
        server = FakeHttpServer.start();
        worker = new WorkerScheduler("http");
    }

    @AfterEach
    void tearDown() {
        worker.close();
        server.close();
    }

    @Test
    void executesThroughPooledClient() throws Exception {
        server.always(200, "{\"ok\":true}");
        PoolConfig config = PoolConfig.restApi();
        SessionHandle handle = new SessionHandle(worker, new PooledHttpClientFactory().create(config), config, Instant.now());

        String body = handle.execute(new HttpGet(server.uri().resolve("/ping")),
            response -> EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8));
        String again = handle.execute(new HttpGet(server.uri().resolve("/ping")),
            response -> EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8));

        assertThat(body).isEqualTo("{\"ok\":true}");
        assertThat(again).isEqualTo(body);
        assertThat(server.requests()).hasSize(2);
        handle.close();
    }

    @Test
    void requestIsCancelledAtTotalDeadline() throws Exception {
        server.delay(3_000).always(200, "late");
        PoolConfig config = PoolConfig.defaults().toBuilder()
            .readTimeout(Duration.ofSeconds(30))
            .totalTimeout(Duration.ofMillis(300))
            .build();
        SessionHandle handle = new SessionHandle(worker, new PooledHttpClientFactory().create(config), config, Instant.now());

        long start = System.nanoTime();
        assertThatThrownBy(() -> handle.execute(new HttpGet(server.uri().resolve("/slow")),
            response -> EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)))
            .isInstanceOf(IOException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(2_500));
        handle.close();
    }

    @Test
    void closedHandleRefusesRequests() throws Exception {
        PoolConfig config = PoolConfig.defaults();
        SessionHandle handle = new SessionHandle(worker, new PooledHttpClientFactory().create(config), config, Instant.now());
        handle.close();
        handle.close();

        assertThat(handle.isClosed()).isTrue();
        assertThatThrownBy(() -> handle.execute(new HttpGet(server.uri()), response -> null))
            .isInstanceOf(IllegalStateException.class);
    }
}
