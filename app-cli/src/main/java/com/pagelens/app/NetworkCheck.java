package com.pagelens.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/** 기준 사이트 몇 곳에 대한 도달성 확인 (--check-network) */
final class NetworkCheck {

    private static final Logger LOG = LoggerFactory.getLogger(NetworkCheck.class);

    record Target(String name, String url, Duration timeout) {}

    static final List<Target> TARGETS = List.of(
            new Target("Baidu", "https://www.baidu.com", Duration.ofSeconds(5)),
            new Target("Tencent", "https://www.qq.com", Duration.ofSeconds(5)),
            new Target("GitHub", "https://github.com", Duration.ofSeconds(10)));

    static final List<String> SUGGESTED_SITES = List.of(
            "https://www.baidu.com",
            "https://www.qq.com",
            "https://www.jd.com",
            "https://www.taobao.com",
            "https://www.zhihu.com");

    /** 상태코드 반환, 실패 시 예외 */
    @FunctionalInterface
    interface Probe {
        int status(Target target) throws Exception;
    }

    private final Probe probe;

    NetworkCheck() {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.probe = t -> client.send(
                HttpRequest.newBuilder(URI.create(t.url())).timeout(t.timeout()).GET().build(),
                HttpResponse.BodyHandlers.discarding()).statusCode();
    }

    NetworkCheck(Probe probe) {
        this.probe = Objects.requireNonNull(probe, "probe");
    }

    /** @return 도달 가능한 대상 수 */
    int run(List<Target> targets, PrintStream out) {
        out.println("🔍 Network connectivity check...");
        int reachable = 0;
        for (Target t : targets) {
            try {
                int status = probe.status(t);
                out.println("  ✅ " + t.name() + ": reachable (status " + status + ")");
                reachable++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                out.println("  ❌ " + t.name() + ": interrupted");
                break;
            } catch (Exception e) {
                LOG.debug("Probe of {} failed", t.url(), e);
                out.println("  ❌ " + t.name() + ": unreachable (" + e.getClass().getSimpleName()
                        + (e.getMessage() == null ? "" : ": " + e.getMessage()) + ")");
            }
        }
        return reachable;
    }
}
