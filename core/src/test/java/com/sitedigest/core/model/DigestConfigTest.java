package com.sitedigest.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DigestConfigTest {

    @Test
    void defaults_match_documented_values() {
        DigestConfig c = DigestConfig.defaults();
        assertThat(c.getMaxPages()).isEqualTo(15);
        assertThat(c.getDedupPolicy()).isEqualTo(DedupPolicy.PRODUCT_REPEATS);
        assertThat(c.fetch().getTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(c.fallback().isEnabled()).isTrue();
        assertThat(c.fallback().getConcurrency()).isEqualTo(4);
        assertThat(c.fallback().getCrawlTimeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(c.output().getMaxOutputBytes()).isEqualTo(7800);
        assertThat(c.getServerPort()).isEqualTo(8000);
        c.validate();
    }

    @Test
    void setters_clamp_out_of_range_values() {
        DigestConfig c = new DigestConfig()
                .setMaxPages(0)
                .setDedupPolicy(null);
        c.fetch().setMaxAttempts(-3).setBackoffMs(-1);
        c.fallback().setConcurrency(0).setMaxRedirects(-2);

        assertThat(c.getMaxPages()).isEqualTo(1);
        assertThat(c.getDedupPolicy()).isEqualTo(DedupPolicy.PRODUCT_REPEATS);
        assertThat(c.fetch().getMaxAttempts()).isEqualTo(1);
        assertThat(c.fetch().getBackoffMs()).isZero();
        assertThat(c.fallback().getConcurrency()).isEqualTo(1);
        assertThat(c.fallback().getMaxRedirects()).isZero();
    }

    @Test
    void validate_rejects_bad_port() {
        DigestConfig c = new DigestConfig().setServerPort(70000);
        assertThatThrownBy(c::validate).isInstanceOf(IllegalArgumentException.class);
    }
}
