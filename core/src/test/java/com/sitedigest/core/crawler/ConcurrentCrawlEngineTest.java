package com.sitedigest.core.crawler;

import com.sitedigest.core.extract.PageExtractor;
import com.sitedigest.core.http.HttpFetcher;
import com.sitedigest.core.model.CrawlTarget;
import com.sitedigest.core.model.DigestConfig;
import com.sitedigest.core.model.ExtractedPage;
import com.sitedigest.core.testutil.RecordingSleeper;
import com.sitedigest.core.testutil.TestSite;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrentCrawlEngineTest {

    private TestSite site;

    @BeforeEach
    void setUp() throws Exception {
        site = new TestSite();
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    private static DigestConfig cfg(int maxPages) {
        DigestConfig c = DigestConfig.defaults().setMaxPages(maxPages);
        c.fallback().setConcurrency(4).setDelayMs(0).setBackoffMs(0).setRequestTimeoutMs(5000);
        return c;
    }

    @Test
    void page_cap_holds_under_concurrency_and_home_comes_first() {
        String[] links = new String[10];
        for (int i = 0; i < links.length; i++) {
            links[i] = "/p" + i;
            site.html(links[i], TestSite.page("Page " + i, "Body " + i));
        }
        site.html("/", TestSite.page("Home", "Welcome.", links));

        List<ExtractedPage> pages = new ConcurrentCrawlEngine(cfg(4)).crawl(CrawlTarget.parse(site.base()));

        assertThat(pages).hasSize(4);
        assertThat(pages.get(0).h1()).isEqualTo("Home");
    }

    @Test
    void results_follow_discovery_order() {
        site.html("/", TestSite.page("Home", "Welcome.", "/a", "/b", "/c"))
                .html("/a", TestSite.page("A", "a"))
                .html("/b", TestSite.page("B", "b"))
                .html("/c", TestSite.page("C", "c"));

        List<ExtractedPage> pages = new ConcurrentCrawlEngine(cfg(10)).crawl(CrawlTarget.parse(site.base()));

        assertThat(pages).extracting(ExtractedPage::h1).containsExactly("Home", "A", "B", "C");
    }

    @Test
    void forbidden_is_retried_and_redirects_are_followed() {
        site.sequence("/", new TestSite.Route(403, "text/html", "blocked", Map.of()),
                        TestSite.htmlRoute(TestSite.page("Home", "Welcome.", "/old")))
                .redirect("/old", "/pricing")
                .html("/pricing", TestSite.page("Pricing", "Plans."));

        List<ExtractedPage> pages = new ConcurrentCrawlEngine(cfg(10)).crawl(CrawlTarget.parse(site.base()));

        assertThat(pages).extracting(ExtractedPage::h1).containsExactly("Home", "Pricing");
        assertThat(site.hits("/")).isEqualTo(2);
        assertThat(site.hits("/pricing")).isEqualTo(1);
    }

    @Test
    void non_html_home_yields_no_pages() {
        site.otherwise(200, "application/json", "{}");

        List<ExtractedPage> pages = new ConcurrentCrawlEngine(cfg(10)).crawl(CrawlTarget.parse(site.base()));

        assertThat(pages).isEmpty();
    }

    @Test
    @Timeout(10)
    void whole_crawl_timeout_abandons_and_returns_nothing() {
        DigestConfig c = cfg(10);
        c.fallback().setCrawlTimeoutMs(300);
        HttpFetcher.HttpSender slow = req -> {
            Thread.sleep(5_000);
            throw new IllegalStateException("unreachable");
        };
        HttpFetcher fetcher = HttpFetcher.fallback(c, slow, new RecordingSleeper());

        List<ExtractedPage> pages = new ConcurrentCrawlEngine(c, fetcher, new PageExtractor(),
                new LinkDiscoverer(), new RecordingSleeper()).crawl(CrawlTarget.parse("https://slow.test"));

        assertThat(pages).isEmpty();
    }
}
