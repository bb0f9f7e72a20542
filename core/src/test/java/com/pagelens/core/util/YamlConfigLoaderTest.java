package com.pagelens.core.util;

import com.pagelens.core.model.InspectConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    @Test
    void loads_overrides_and_keeps_other_defaults() throws Exception {
        Path yml = tmp.resolve("pagelens.yml");
        Files.writeString(yml, """
                timeoutSeconds: 3
                followRedirects: false
                blockedSites: [example.net]
                encoding:
                  cjkSiteHints: [".tw", weibo]
                  minConfidence: 0.5
                visibility:
                  noiseSelectors: ".ads, #cookie-banner"
                heading:
                  stopWords: [之, 于]
                """, StandardCharsets.UTF_8);

        InspectConfig cfg = YamlConfigLoader.load(yml);

        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(cfg.isFollowRedirects()).isFalse();
        assertThat(cfg.getBlockedSites()).containsExactly("example.net");
        assertThat(cfg.encoding().getCjkSiteHints()).containsExactly(".tw", "weibo");
        assertThat(cfg.encoding().getMinConfidence()).isEqualTo(0.5);
        assertThat(cfg.encoding().getDetectionSampleBytes()).isEqualTo(1024);
        assertThat(cfg.visibility().getNoiseSelectors()).containsExactly(".ads", "#cookie-banner");
        assertThat(cfg.visibility().getNoiseTags()).contains("script", "nav");
        assertThat(cfg.heading().getStopWords()).containsExactly("之", "于");
        assertThat(cfg.getAcceptLanguage()).isEqualTo("zh-CN,zh;q=0.9,en;q=0.8");
    }

    @Test
    void empty_document_yields_defaults() {
        InspectConfig cfg = YamlConfigLoader.load(new ByteArrayInputStream(new byte[0]));
        assertThat(cfg.getTimeoutSeconds()).isEqualTo(10);
        assertThat(cfg.encoding().getCjkCandidates()).startsWith("gbk", "gb2312", "gb18030");
    }

    @Test
    void invalid_values_are_rejected() {
        String yml = "encoding:\n  minConfidence: 1.5\n";
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(new ByteArrayInputStream(yml.getBytes(StandardCharsets.UTF_8))));

        String stop = "heading:\n  stopWords: [的话]\n";
        assertThatThrownBy(() -> YamlConfigLoader.load(new ByteArrayInputStream(stop.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("single characters");

        String blankTag = "visibility:\n  noiseTags: [script, \"\"]\n";
        assertThatThrownBy(() -> YamlConfigLoader.load(new ByteArrayInputStream(blankTag.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("noiseTags");
    }

    @Test
    void malformed_yaml_is_reported_as_illegal_argument() {
        String broken = "timeoutSeconds: [1, 2\n";
        assertThatThrownBy(() -> YamlConfigLoader.load(new ByteArrayInputStream(broken.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missing_explicit_file_is_an_io_error() {
        assertThrows(IOException.class, () -> YamlConfigLoader.load(tmp.resolve("nope.yml")));
    }
}
