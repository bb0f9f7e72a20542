package com.pagelens.core.util;

import com.pagelens.core.model.InspectConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * pagelens.yml → InspectConfig. 없는 키는 기본값 유지.
 *
 * 예상 YAML 키:
 * timeoutSeconds: 10
 * userAgent: "Mozilla/5.0 ..."
 * acceptLanguage: "zh-CN,zh;q=0.9,en;q=0.8"
 * followRedirects: true
 * blockedSites: ["google.com", "youtube.com"]
 *
 * encoding:
 *   cjkSiteHints: [".cn", "sina", "baidu"]
 *   detectionSampleBytes: 1024
 *   minConfidence: 0.8
 *   cjkCandidates: [gbk, gb2312, gb18030, utf-8, iso-8859-1]
 *   defaultCandidates: [utf-8, gbk, gb2312, iso-8859-1]
 *
 * visibility:
 *   noiseTags: [script, style, nav]
 *   noiseSelectors: [".menu", "#nav"]
 *
 * heading:
 *   stopWords: ["的", "和"]
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "pagelens.yml";

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 pagelens.yml. 없으면 기본값. */
    public static InspectConfig loadDefault() throws IOException {
        Path p = Path.of(DEFAULT_FILE);
        if (!Files.exists(p)) {
            InspectConfig cfg = InspectConfig.defaults();
            cfg.validate();
            return cfg;
        }
        return load(p);
    }

    public static InspectConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 문법 오류/잘못된 값은 IllegalArgumentException */
    public static InspectConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root;
        try {
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("invalid YAML: " + e.getMessage(), e);
        }

        InspectConfig cfg = InspectConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 스칼라면 기본값 유지
            cfg.validate();
            return cfg;
        }

        setLong(map, "timeoutSeconds", cfg::setTimeoutSeconds);
        setString(map, "userAgent", cfg::setUserAgent);
        setString(map, "acceptLanguage", cfg::setAcceptLanguage);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setStringList(map, "blockedSites", cfg::setBlockedSites);

        Map<?, ?> enc = getMap(map, "encoding");
        if (enc != null) {
            var e = cfg.encoding();
            setStringList(enc, "cjkSiteHints", e::setCjkSiteHints);
            setInt(enc, "detectionSampleBytes", e::setDetectionSampleBytes);
            setDouble(enc, "minConfidence", e::setMinConfidence);
            setStringList(enc, "cjkCandidates", e::setCjkCandidates);
            setStringList(enc, "defaultCandidates", e::setDefaultCandidates);
        }

        Map<?, ?> vis = getMap(map, "visibility");
        if (vis != null) {
            var v = cfg.visibility();
            setStringList(vis, "noiseTags", v::setNoiseTags);
            setStringList(vis, "noiseSelectors", v::setNoiseSelectors);
        }

        Map<?, ?> heading = getMap(map, "heading");
        if (heading != null) {
            setStringList(heading, "stopWords", cfg.heading()::setStopWords);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) {
                if (!p.isEmpty()) out.add(p);
            }
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }
}
