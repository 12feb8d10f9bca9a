package com.articlegate.core.http;

import com.articlegate.core.config.AcquisitionConfig;
import com.articlegate.core.model.Purpose;
import com.articlegate.core.security.UrlValidator;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdkHttpTransportTest {

    static HttpServer s;
    static ExecutorService pool;
    static int port;
    static final CountDownLatch release = new CountDownLatch(1);

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        pool = Executors.newCachedThreadPool();
        s.setExecutor(pool);

        s.createContext("/ok", ex -> respond(ex, 200, "text/plain; charset=utf-8", "hello"));

        s.createContext("/moved", ex -> {
            ex.getResponseHeaders().add("Location", "/ok");
            ex.sendResponseHeaders(302, -1);
            ex.close();
        });

        s.createContext("/echo-ua", ex ->
                respond(ex, 200, "text/plain", String.valueOf(ex.getRequestHeaders().getFirst("User-Agent"))));

        // 헤더 + 일부 본문 후 멈춤 (slow-drip)
        s.createContext("/stall-body", ex -> {
            ex.getResponseHeaders().add("Content-Type", "text/html");
            ex.sendResponseHeaders(200, 0);
            OutputStream os = ex.getResponseBody();
            os.write("<html>partial".getBytes(StandardCharsets.UTF_8));
            os.flush();
            await();
            ex.close();
        });

        // 헤더를 보내지 않고 멈춤
        s.createContext("/stall-headers", ex -> {
            await();
            respond(ex, 200, "text/plain", "late");
        });

        s.start();
        port = s.getAddress().getPort();
    }

    @AfterAll
    static void down() {
        release.countDown();
        if (s != null) s.stop(0);
        if (pool != null) pool.shutdownNow();
    }

    private static void await() {
        try {
            release.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void respond(HttpExchange ex, int code, String ct, String body) throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", ct);
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(b); }
    }

    private static URI u(String path) {
        return URI.create("http://127.0.0.1:" + port + path);
    }

    private static JdkHttpTransport transport(Duration read) {
        HttpClient c = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofSeconds(2))
                .build();
        return new JdkHttpTransport(c, read);
    }

    @Test
    void streams_status_headers_and_body() throws Exception {
        try (TransportResponse r = transport(Duration.ofSeconds(5)).open(u("/ok"), Map.of())) {
            assertThat(r.statusCode()).isEqualTo(200);
            assertThat(r.header("content-type")).contains("text/plain; charset=utf-8");
            assertThat(new String(r.body().readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("hello");
        }
    }

    @Test
    void redirect_is_returned_not_followed() throws Exception {
        try (TransportResponse r = transport(Duration.ofSeconds(5)).open(u("/moved"), Map.of())) {
            assertThat(r.statusCode()).isEqualTo(302);
            assertThat(r.header("Location")).contains("/ok");
        }
    }

    @Test
    void request_headers_are_sent() throws Exception {
        try (TransportResponse r = transport(Duration.ofSeconds(5))
                .open(u("/echo-ua"), Map.of("User-Agent", "articlegate-test/1.0"))) {
            assertThat(new String(r.body().readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("articlegate-test/1.0");
        }
    }

    @Test
    void stalled_body_hits_idle_read_timeout() throws Exception {
        long t0 = System.nanoTime();
        try (TransportResponse r = transport(Duration.ofMillis(300)).open(u("/stall-body"), Map.of())) {
            assertThat(r.statusCode()).isEqualTo(200);
            assertThatThrownBy(() -> r.body().readAllBytes()).isInstanceOf(IOException.class);
        }
        assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofSeconds(5));
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
    }

    @Test
    void stalled_headers_hit_request_timeout() {
        assertThatThrownBy(() -> transport(Duration.ofMillis(300)).open(u("/stall-headers"), Map.of()))
                .isInstanceOf(IOException.class);
    }

    @Test
    void fetcher_over_real_client_drops_restricted_headers_and_rejects_bad_port() {
        AcquisitionConfig cfg = AcquisitionConfig.builder()
                .allowedSchemes(List.of("http"))
                .blockPrivateIps(false)
                .build();
        SecureFetcher f = new SecureFetcher(cfg, new UrlValidator(cfg), transport(Duration.ofSeconds(5)));

        FetchOutcome ok = f.fetch(u("/ok").toString(), Purpose.ARTICLE, Map.of("Host", "evil.example", "Connection", "close"));
        assertThat(ok.isOk()).isTrue();
        assertThat(new String(ok.result().getBody(), StandardCharsets.UTF_8)).isEqualTo("hello");

        FetchOutcome bad = f.fetch("http://127.0.0.1:99999/ok", Purpose.ARTICLE);
        assertThat(bad.error()).isEqualTo(FetchError.INVALID_URL);
    }

    @Test
    void client_following_redirects_is_refused() {
        HttpClient following = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
        assertThatThrownBy(() -> new JdkHttpTransport(following, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
