package com.sitedigest.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlTargetTest {

    @Test
    @DisplayName("scheme 없으면 https 부착")
    void bare_host_gets_https() {
        CrawlTarget t = CrawlTarget.parse("Example.com");
        assertThat(t.url().toString()).isEqualTo("https://example.com");
        assertThat(t.domain()).isEqualTo("example.com");
        assertThat(t.rawUrl()).isEqualTo("Example.com");
    }

    @Test
    void http_scheme_and_port_are_kept() {
        CrawlTarget t = CrawlTarget.parse("http://localhost:8080/start/");
        assertThat(t.scheme()).isEqualTo("http");
        assertThat(t.domain()).isEqualTo("localhost:8080");
        assertThat(t.url().toString()).isEqualTo("http://localhost:8080/start");
        assertThat(t.siteRoot().toString()).isEqualTo("http://localhost:8080");
    }

    @Test
    void blank_input_is_missing_url() {
        assertThatThrownBy(() -> CrawlTarget.parse("   "))
                .isInstanceOf(InvalidTargetException.class)
                .hasMessage("Missing 'url' field");
    }

    @Test
    void unparsable_input_is_invalid() {
        assertThatThrownBy(() -> CrawlTarget.parse("http://exa mple.com"))
                .isInstanceOf(InvalidTargetException.class);
        assertThatThrownBy(() -> CrawlTarget.parse("https:///nohost"))
                .isInstanceOf(InvalidTargetException.class);
    }
}
