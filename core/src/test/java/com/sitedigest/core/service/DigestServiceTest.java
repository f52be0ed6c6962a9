package com.sitedigest.core.service;

import com.sitedigest.core.crawler.SiteUnreachableException;
import com.sitedigest.core.model.DedupPolicy;
import com.sitedigest.core.model.DigestConfig;
import com.sitedigest.core.model.DigestResult;
import com.sitedigest.core.model.InvalidTargetException;
import com.sitedigest.core.testutil.TestSite;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DigestServiceTest {

    private TestSite site;

    @BeforeEach
    void setUp() throws Exception {
        site = new TestSite()
                .html("/", """
                        <html><head><title>Acme</title>
                          <meta name="description" content="Acme automates invoicing for agencies.">
                          <meta property="og:site_name" content="Acme">
                        </head><body>
                          <nav>
                            <a href="/features">Features</a><a href="/pricing">Pricing</a>
                            <a href="/about">About</a><a href="/team">Team</a><a href="/blog">Blog</a>
                          </nav>
                          <main><h1>Invoices on autopilot</h1>
                            <p>Get started today. Acme automates invoicing for agencies. Teams get paid faster.</p>
                          </main>
                        </body></html>""")
                .html("/features", TestSite.page("Acme Pay", "Reminders go out automatically."))
                .html("/pricing", TestSite.page("Plans", "Three plans for every team size."))
                .html("/about", TestSite.page("About Acme", "Founded in 2015 in Lyon."))
                .html("/team", TestSite.page("Our Team", "Twelve people across two offices."))
                .html("/blog", TestSite.page("Blog", "Monthly product updates."));
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    private static DigestConfig cfg() {
        DigestConfig c = DigestConfig.defaults();
        c.fetch().setTimeoutMs(5000).setBackoffMs(0);
        c.fallback().setDelayMs(0).setBackoffMs(0);
        return c;
    }

    @Test
    void end_to_end_digest_of_a_small_site() {
        DigestResult r = new DigestService(cfg()).digest(site.base());

        assertThat(r.domain()).isEqualTo(site.domain());
        assertThat(r.categories()).containsExactly("about", "blog", "home", "pricing", "product");
        assertThat(r.pageCount()).isEqualTo(5);
        assertThat(r.hasPricing()).isTrue();
        assertThat(r.hasBlog()).isTrue();
        assertThat(r.hasCareers()).isFalse();

        String c = r.content();
        assertThat(c).startsWith("=== SITE DIGEST: " + site.domain() + " ===\nName: Acme\nTagline: Invoices on autopilot");
        assertThat(c).contains("Products: Acme Pay");
        assertThat(c).contains("[home] /\nAcme automates invoicing for agencies. Teams get paid faster.");
        assertThat(c).contains("[pricing] /pricing").contains("[about] /about").doesNotContain("/team");
        assertThat(c).doesNotContain("Get started");
        // 우선순위: home → product → pricing → about → blog
        assertThat(c.indexOf("[home]")).isLessThan(c.indexOf("[product]"));
        assertThat(c.indexOf("[product]")).isLessThan(c.indexOf("[pricing]"));
        assertThat(c.indexOf("[about]")).isLessThan(c.indexOf("[blog]"));
    }

    @Test
    void none_policy_keeps_repeated_categories() {
        DigestResult r = new DigestService(cfg().setDedupPolicy(DedupPolicy.NONE)).digest(site.base());

        assertThat(r.pageCount()).isEqualTo(6);
        assertThat(r.content()).contains("[about] /team");
    }

    @Test
    void content_respects_byte_budget() {
        DigestConfig c = cfg();
        c.output().setMaxOutputBytes(300);

        DigestResult r = new DigestService(c).digest(site.base());

        assertThat(r.content().getBytes(StandardCharsets.UTF_8).length).isLessThanOrEqualTo(300);
    }

    @Test
    void blank_target_is_rejected() {
        assertThatThrownBy(() -> new DigestService(cfg()).digest(" "))
                .isInstanceOf(InvalidTargetException.class);
    }

    @Test
    void unreachable_site_is_reported() {
        site.otherwise(500, "text/plain", "boom").respond("/", 500, "text/plain", "boom");
        DigestConfig c = cfg();
        c.fetch().setMaxAttempts(1);
        c.fallback().setMaxAttempts(1);

        assertThatThrownBy(() -> new DigestService(c).digest(site.base()))
                .isInstanceOf(SiteUnreachableException.class);
    }
}
