package com.wikicrawler.core.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class HttpPageFetcherTest {

    static HttpServer s;
    static String base;

    private final HttpPageFetcher fetcher = new HttpPageFetcher("WikiCrawler-test");

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + s.getAddress().getPort();

        s.createContext("/wiki/Ok", ex -> respond(ex, 200, "<p>Türkiye</p>".getBytes(StandardCharsets.UTF_8)));
        s.createContext("/wiki/Missing", ex -> respond(ex, 404, "nope".getBytes(StandardCharsets.UTF_8)));
        s.createContext("/wiki/Latin1", ex -> respond(ex, 200, new byte[]{'a', (byte) 0xFC, 'b'}));
        s.createContext("/wiki/Moved", ex -> {
            ex.getResponseHeaders().add("Location", "/wiki/Ok");
            respond(ex, 302, new byte[0]);
        });
        s.createContext("/wiki/Slow", ex -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(ex, 200, "late".getBytes(StandardCharsets.UTF_8));
        });
        s.setExecutor(Executors.newCachedThreadPool());
        s.start();
    }

    @AfterAll
    static void down() { s.stop(0); }

    private static void respond(HttpExchange ex, int code, byte[] body) throws IOException {
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(code, body.length == 0 ? -1 : body.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(body);
        }
    }

    @Test
    void returns_utf8_body_on_200() throws FetchException {
        assertThat(fetcher.fetch(base + "/wiki/Ok", Duration.ofSeconds(5))).isEqualTo("<p>Türkiye</p>");
    }

    @Test
    void follows_redirects() throws FetchException {
        assertThat(fetcher.fetch(base + "/wiki/Moved", Duration.ofSeconds(5))).isEqualTo("<p>Türkiye</p>");
    }

    @Test
    void non_2xx_is_http_status_error() {
        FetchException e = catchThrowableOfType(
                () -> fetcher.fetch(base + "/wiki/Missing", Duration.ofSeconds(5)), FetchException.class);

        assertThat(e.getKind()).isEqualTo(FetchException.Kind.HTTP_STATUS);
        assertThat(e.getStatusCode()).isEqualTo(404);
        assertThat(e.getUrl()).endsWith("/wiki/Missing");
    }

    @Test
    void invalid_utf8_is_decode_error_not_replacement() {
        FetchException e = catchThrowableOfType(
                () -> fetcher.fetch(base + "/wiki/Latin1", Duration.ofSeconds(5)), FetchException.class);

        assertThat(e.getKind()).isEqualTo(FetchException.Kind.DECODE);
    }

    @Test
    void timeout_is_transport_error() {
        FetchException e = catchThrowableOfType(
                () -> fetcher.fetch(base + "/wiki/Slow", Duration.ofMillis(200)), FetchException.class);

        assertThat(e.getKind()).isEqualTo(FetchException.Kind.TRANSPORT);
    }

    @Test
    void malformed_or_unsupported_url_is_transport_error() {
        FetchException bad = catchThrowableOfType(
                () -> fetcher.fetch("http://exa mple.com/", Duration.ofSeconds(1)), FetchException.class);
        FetchException ftp = catchThrowableOfType(
                () -> fetcher.fetch("ftp://example.com/", Duration.ofSeconds(1)), FetchException.class);

        assertThat(bad.getKind()).isEqualTo(FetchException.Kind.TRANSPORT);
        assertThat(ftp.getKind()).isEqualTo(FetchException.Kind.TRANSPORT);
    }

    @Test
    void decode_helper_accepts_empty_body() throws FetchException {
        assertThat(HttpPageFetcher.decodeUtf8("u", new byte[0])).isEmpty();
    }
}
