package com.sitedigest.core.util;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    @Test
    void normalize_lowercases_drops_fragment_default_port_and_trailing_slash() {
        URI n = UrlUtils.normalize(URI.create("HTTPS://Example.COM:443//pricing/#plans"));
        assertThat(n.toString()).isEqualTo("https://example.com/pricing");
    }

    @Test
    void normalize_keeps_query_and_non_default_port() {
        URI n = UrlUtils.normalize(URI.create("http://example.com:8080/a/?x=1"));
        assertThat(n.toString()).isEqualTo("http://example.com:8080/a?x=1");
    }

    @Test
    void root_with_and_without_slash_share_one_key() {
        assertThat(UrlUtils.key(URI.create("https://example.com/")))
                .isEqualTo(UrlUtils.key(URI.create("https://example.com")));
    }

    @Test
    void sameOrigin_compares_scheme_host_and_effective_port() {
        URI a = URI.create("https://example.com/x");
        assertThat(UrlUtils.sameOrigin(a, URI.create("https://EXAMPLE.com:443/y"))).isTrue();
        assertThat(UrlUtils.sameOrigin(a, URI.create("http://example.com/y"))).isFalse();
        assertThat(UrlUtils.sameOrigin(a, URI.create("https://blog.example.com/y"))).isFalse();
        assertThat(UrlUtils.sameOrigin(a, URI.create("https://example.com:8443/y"))).isFalse();
    }

    @Test
    void resolve_against_empty_path_base_inserts_slash() {
        URI base = URI.create("http://a.com");
        assertThat(UrlUtils.resolve(base, "b").toString()).isEqualTo("http://a.com/b");
        assertThat(UrlUtils.resolve(URI.create("http://a.com/docs/x"), "../y").toString())
                .isEqualTo("http://a.com/y");
    }

    @Test
    void display_and_classifier_paths() {
        assertThat(UrlUtils.displayPath("https://example.com")).isEqualTo("/");
        assertThat(UrlUtils.displayPath("https://example.com/Pricing/")).isEqualTo("/Pricing");
        assertThat(UrlUtils.classifierPath("https://example.com/Pricing/Teams/")).isEqualTo("pricing/teams");
        assertThat(UrlUtils.classifierPath("https://example.com/")).isEmpty();
    }

    @Test
    void parseNormalized_returns_null_for_garbage() {
        assertThat(UrlUtils.parseNormalized("http://exa mple.com")).isNull();
        assertThat(UrlUtils.parseNormalized("  ")).isNull();
    }
}
