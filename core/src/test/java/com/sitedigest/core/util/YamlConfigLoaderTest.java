package com.sitedigest.core.util;

import com.sitedigest.core.model.DedupPolicy;
import com.sitedigest.core.model.DigestConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir Path tmp;

    @Test
    void loads_nested_sections_and_keeps_defaults_for_missing_keys() throws IOException {
        Path f = tmp.resolve("digest.yml");
        Files.writeString(f, String.join("\n",
                "maxPages: 8",
                "dedupPolicy: strict",
                "fetch:",
                "  timeoutMs: 4000",
                "fallback:",
                "  enabled: false",
                "  concurrency: 2",
                "  crawlTimeoutMs: 30000",
                "digest:",
                "  maxOutputBytes: 2000",
                "server:",
                "  port: 9090",
                "unknownKey: whatever"));

        DigestConfig cfg = YamlConfigLoader.load(f);

        assertThat(cfg.getMaxPages()).isEqualTo(8);
        assertThat(cfg.getDedupPolicy()).isEqualTo(DedupPolicy.STRICT);
        assertThat(cfg.fetch().getTimeout()).isEqualTo(Duration.ofSeconds(4));
        assertThat(cfg.fetch().getMaxAttempts()).isEqualTo(3);
        assertThat(cfg.fallback().isEnabled()).isFalse();
        assertThat(cfg.fallback().getConcurrency()).isEqualTo(2);
        assertThat(cfg.fallback().getCrawlTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(cfg.output().getMaxOutputBytes()).isEqualTo(2000);
        assertThat(cfg.output().getMaxHeadings()).isEqualTo(4);
        assertThat(cfg.getServerPort()).isEqualTo(9090);
    }

    @Test
    void dashed_enum_value_is_accepted() {
        DigestConfig cfg = YamlConfigLoader.load(stream("dedupPolicy: product-repeats\n"));
        assertThat(cfg.getDedupPolicy()).isEqualTo(DedupPolicy.PRODUCT_REPEATS);
    }

    @Test
    void empty_document_yields_defaults() {
        DigestConfig cfg = YamlConfigLoader.load(stream(""));
        assertThat(cfg.getMaxPages()).isEqualTo(15);
        assertThat(cfg.output().getMaxOutputBytes()).isEqualTo(7800);
    }

    @Test
    void unknown_enum_value_is_rejected() {
        assertThatThrownBy(() -> YamlConfigLoader.load(stream("dedupPolicy: sometimes\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dedupPolicy");
    }

    @Test
    void missing_file_is_an_io_error() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class);
    }

    private static ByteArrayInputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}
