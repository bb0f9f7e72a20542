package com.pagelens.app;

import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.Finding;
import com.pagelens.core.model.PageReport;

import java.io.PrintStream;
import java.util.Map;

/** 사람용 콘솔 출력. 필드 결과마다 섹션 하나. */
final class ConsoleReporter {

    private static final String RULE = "=".repeat(50);

    private final PrintStream out;

    ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    void header(String url) {
        out.println("🔍 Starting SEO analysis: " + url);
        out.println(RULE);
    }

    void render(PageReport report) {
        out.println("Status code: " + report.getStatusCode());
        out.println("Response time: " + report.getResponseTimeMs() + " ms");
        if (report.getContentType() != null) {
            out.println("Content-Type: " + report.getContentType());
        }
        out.println("Decoded as " + report.getCharset() + " (" + report.getDecodeStage() + ")");
        if (report.isDecodeDegraded()) {
            out.println("⚠️ Encoding could not be confirmed; text may contain replacement or dropped characters.");
        }

        boolean hintShown = false;
        for (FieldResult r : report.getResults()) {
            section(r);
            if (!hintShown && !report.isContentVisible()) {
                // 첫 섹션(콘텐츠 가시성) 바로 뒤에 한 번만
                out.println();
                out.println("Note: initial content is insufficient, so the checks below may be inaccurate.");
                hintShown = true;
            }
        }

        out.println();
        out.println(RULE);
        out.println("Basic checks complete.");
        out.println(RULE);
    }

    private void section(FieldResult r) {
        out.println();
        out.println("--- " + r.getField().label() + " --- " + r.getStatus().icon() + " " + r.getStatus());
        for (Map.Entry<String, Object> e : r.getMetrics().entrySet()) {
            out.println("  " + e.getKey() + ": " + e.getValue());
        }
        for (Finding f : r.getFindings()) {
            out.println("  " + f.getLevel().icon() + " " + f.getMessage());
        }
    }

    void fetchFailed(String url, String reason) {
        out.println();
        out.println("Could not fetch " + url + " (" + reason + "). Check:");
        out.println("1. the network connection");
        out.println("2. that the URL is correct");
        out.println("3. that the site is reachable");
        suggestions();
    }

    void suggestions() {
        out.println();
        out.println("Suggested test sites:");
        for (String s : NetworkCheck.SUGGESTED_SITES) {
            out.println("  - " + s);
        }
    }
}
