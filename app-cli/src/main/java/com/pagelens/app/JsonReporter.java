package com.pagelens.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pagelens.core.model.FieldResult;
import com.pagelens.core.model.Finding;
import com.pagelens.core.model.PageReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** --json 출력. 모델을 Map 트리로 옮긴 뒤 Jackson으로 직렬화. */
final class JsonReporter {

    private final ObjectMapper om = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    String toJson(PageReport report) throws JsonProcessingException {
        return om.writeValueAsString(toTree(report));
    }

    static Map<String, Object> toTree(PageReport report) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("url", report.getUrl());
        root.put("statusCode", report.getStatusCode());
        root.put("contentType", report.getContentType());
        root.put("responseTimeMs", report.getResponseTimeMs());
        root.put("charset", report.getCharset());
        root.put("decodeStage", report.getDecodeStage().name());
        root.put("decodeDegraded", report.isDecodeDegraded());
        root.put("contentVisible", report.isContentVisible());

        List<Map<String, Object>> fields = new ArrayList<>();
        for (FieldResult r : report.getResults()) {
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("field", r.getField().name());
            f.put("status", r.getStatus().name());
            f.put("verdict", r.isVerdict());
            f.put("metrics", r.getMetrics());
            List<Map<String, String>> findings = new ArrayList<>();
            for (Finding x : r.getFindings()) {
                findings.add(Map.of("level", x.getLevel().name(), "message", x.getMessage()));
            }
            f.put("findings", findings);
            fields.add(f);
        }
        root.put("results", fields);
        return root;
    }
}
