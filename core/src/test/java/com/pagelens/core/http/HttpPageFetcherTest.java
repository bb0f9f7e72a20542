package com.pagelens.core.http;

import com.pagelens.core.model.FetchFailure;
import com.pagelens.core.model.FetchOutcome;
import com.pagelens.core.model.InspectConfig;
import com.pagelens.core.model.RawResponse;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class HttpPageFetcherTest {

    private HttpServer server;
    private String base;
    private final AtomicReference<String> seenUserAgent = new AtomicReference<>();
    private final AtomicReference<String> seenLanguage = new AtomicReference<>();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/gbk", ex -> {
            seenUserAgent.set(ex.getRequestHeaders().getFirst("User-Agent"));
            seenLanguage.set(ex.getRequestHeaders().getFirst("Accept-Language"));
            byte[] body = "<title>中文页面</title>".getBytes(Charset.forName("GBK"));
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=GBK");
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.createContext("/plain", ex -> {
            byte[] body = "<p>no charset</p>".getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "text/html");
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.createContext("/gone", ex -> {
            byte[] body = "<h1>Not here</h1>".getBytes(StandardCharsets.UTF_8);
            ex.sendResponseHeaders(404, body.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(body); }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        if (server != null) server.stop(0);
    }

    @Test
    void fetches_raw_bytes_with_declared_charset_and_browser_headers() {
        InspectConfig cfg = InspectConfig.defaults().setTimeoutSeconds(5);
        FetchOutcome out = new HttpPageFetcher(cfg).fetch(base + "/gbk");

        assertThat(out.isSuccess()).isTrue();
        RawResponse raw = out.getResponse().orElseThrow();
        assertThat(raw.getStatusCode()).isEqualTo(200);
        assertThat(raw.getDeclaredEncoding()).isEqualTo("GBK");
        assertThat(new String(raw.getBytes(), Charset.forName("GBK"))).isEqualTo("<title>中文页面</title>");
        assertThat(seenUserAgent.get()).isEqualTo(cfg.getUserAgent());
        assertThat(seenLanguage.get()).isEqualTo("zh-CN,zh;q=0.9,en;q=0.8");
    }

    @Test
    void missing_charset_parameter_means_no_declaration() {
        FetchOutcome out = new HttpPageFetcher(InspectConfig.defaults()).fetch(base + "/plain");
        assertThat(out.getResponse().orElseThrow().hasDeclaredEncoding()).isFalse();
    }

    @Test
    void non_200_is_still_a_document() {
        FetchOutcome out = new HttpPageFetcher(InspectConfig.defaults()).fetch(base + "/gone");
        assertThat(out.isSuccess()).isTrue();
        assertThat(out.getResponse().orElseThrow().getStatusCode()).isEqualTo(404);
    }

    @Test
    void refused_connection_is_classified() throws IOException {
        int port = server.getAddress().getPort();
        server.stop(0);
        server = null;
        FetchOutcome out = new HttpPageFetcher(InspectConfig.defaults().setTimeoutSeconds(2))
                .fetch("http://127.0.0.1:" + port + "/");
        assertThat(out.isSuccess()).isFalse();
        assertThat(out.getFailure()).isEqualTo(FetchFailure.CONNECTION_ERROR);
        assertThat(out.getDetail()).isNotBlank();
    }

    @Test
    void send_hook_failures_map_to_failure_kinds() {
        InspectConfig cfg = InspectConfig.defaults();

        FetchOutcome timeout = new HttpPageFetcher(cfg, req -> { throw new HttpTimeoutException("request timed out"); })
                .fetch("https://slow.example");
        assertThat(timeout.getFailure()).isEqualTo(FetchFailure.TIMEOUT);

        FetchOutcome tls = new HttpPageFetcher(cfg, req -> { throw new IOException("wrapped", new SSLHandshakeException("bad cert")); })
                .fetch("https://badssl.example");
        assertThat(tls.getFailure()).isEqualTo(FetchFailure.TLS_ERROR);

        FetchOutcome other = new HttpPageFetcher(cfg, req -> { throw new IllegalStateException("boom"); })
                .fetch("https://x.example");
        assertThat(other.getFailure()).isEqualTo(FetchFailure.UNKNOWN);
    }

    @Test
    void malformed_url_is_a_failure_not_an_exception() {
        FetchOutcome out = new HttpPageFetcher(InspectConfig.defaults()).fetch("ht tp://bad url");
        assertThat(out.isSuccess()).isFalse();
        assertThat(out.getFailure()).isEqualTo(FetchFailure.UNKNOWN);
    }

    @Test
    void classify_walks_the_cause_chain() {
        assertThat(HttpPageFetcher.classify(new IOException(new ConnectException("refused"))))
                .isEqualTo(FetchFailure.CONNECTION_ERROR);
        assertThat(HttpPageFetcher.classify(new IOException("reset"))).isEqualTo(FetchFailure.CONNECTION_ERROR);
    }

    @Test
    void charset_parameter_parsing() {
        assertThat(HttpPageFetcher.charsetOf("text/html; charset=\"utf-8\"")).isEqualTo("utf-8");
        assertThat(HttpPageFetcher.charsetOf("text/html;CHARSET=gb2312;foo=bar")).isEqualTo("gb2312");
        assertThat(HttpPageFetcher.charsetOf("text/html")).isNull();
        assertThat(HttpPageFetcher.charsetOf(null)).isNull();
    }
}
