package com.pagelens.core.http;

import com.pagelens.core.api.IPageFetcher;
import com.pagelens.core.model.FetchFailure;
import com.pagelens.core.model.FetchOutcome;
import com.pagelens.core.model.InspectConfig;
import com.pagelens.core.model.RawResponse;
import com.pagelens.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 단일 페이지 GET. 응답은 바이트 그대로 넘기고 디코딩은 EncodingResolver에 맡긴다.
 * 실패는 예외 대신 FetchFailure로 분류해 돌려준다.
 */
public class HttpPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(HttpPageFetcher.class);

    private static final Pattern CHARSET = Pattern.compile("(?i)charset\\s*=\\s*[\"']?([^\"';\\s]+)");
    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8";

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final InspectConfig config;
    private final HttpSender sender;

    public HttpPageFetcher(InspectConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(InspectConfig config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    public FetchOutcome fetch(String url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", ACCEPT)
                    .header("Accept-Language", config.getAcceptLanguage())
                    .GET()
                    .build();

            HttpResponse<byte[]> resp = sender.send(req);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            int status = resp.statusCode();
            if (status != 200) {
                // 분석은 계속하되 경고만 남긴다
                LOG.warn("Non-200 status {} for {}", status, url);
            }
            String contentType = resp.headers().firstValue("Content-Type").orElse(null);

            RawResponse raw = RawResponse.builder()
                    .sourceUrl(url)
                    .bytes(resp.body())
                    .declaredEncoding(charsetOf(contentType))
                    .statusCode(status)
                    .contentType(contentType)
                    .responseTimeMs(elapsedMs)
                    .build();
            SLOG.info("fetch-done", "url", url, "status", status, "bytes", raw.length(), "ms", elapsedMs);
            return FetchOutcome.success(raw);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(url, FetchFailure.UNKNOWN, e);
        } catch (Exception e) {
            return failed(url, classify(e), e);
        }
    }

    private static FetchOutcome failed(String url, FetchFailure kind, Exception e) {
        SLOG.warn("fetch-failed", "url", url, "kind", kind, "error", e.getClass().getSimpleName(), "message", e.getMessage());
        String detail = (e.getMessage() == null) ? e.getClass().getSimpleName() : e.getMessage();
        return FetchOutcome.failure(kind, detail);
    }

    /** 원인 체인을 따라가며 실패 종류를 판정 */
    static FetchFailure classify(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException) return FetchFailure.TIMEOUT;
            if (t instanceof SSLException) return FetchFailure.TLS_ERROR;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                    || t instanceof UnknownHostException
                    || t instanceof UnresolvedAddressException) {
                return FetchFailure.CONNECTION_ERROR;
            }
        }
        if (e instanceof IOException) return FetchFailure.CONNECTION_ERROR;
        return FetchFailure.UNKNOWN;
    }

    /** Content-Type 헤더의 charset 파라미터. 없으면 null. */
    static String charsetOf(String contentType) {
        if (contentType == null) return null;
        Matcher m = CHARSET.matcher(contentType);
        return m.find() ? m.group(1) : null;
    }
}
