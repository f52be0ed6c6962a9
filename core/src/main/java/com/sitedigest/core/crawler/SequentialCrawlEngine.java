package com.sitedigest.core.crawler;

import com.sitedigest.core.api.CrawlEngine;
import com.sitedigest.core.extract.PageExtractor;
import com.sitedigest.core.http.HttpFetcher;
import com.sitedigest.core.model.CrawlStats;
import com.sitedigest.core.model.CrawlTarget;
import com.sitedigest.core.model.DigestConfig;
import com.sitedigest.core.model.ExtractedPage;
import com.sitedigest.core.util.StructuredLog;
import com.sitedigest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 1차 크롤러: 한 번에 한 페이지씩.
 * 방문 순서 = 시작 URL(이미 받은 문서 재사용) → 사이트 루트(다르면) → 홈 내비 링크(발견 순).
 * 추출 성공이 maxPages 에 도달하거나 후보가 떨어지면 종료.
 */
public final class SequentialCrawlEngine implements CrawlEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SequentialCrawlEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(SequentialCrawlEngine.class);

    private final int maxPages;
    private final PageLoader loader;
    private final LinkDiscoverer discoverer;

    /** 기본 구현 */
    public SequentialCrawlEngine(DigestConfig cfg) {
        this(cfg, HttpFetcher.primary(cfg), new PageExtractor(), new LinkDiscoverer());
    }

    /** DI/테스트용 */
    public SequentialCrawlEngine(DigestConfig cfg, HttpFetcher fetcher, PageExtractor extractor, LinkDiscoverer discoverer) {
        this.maxPages = Objects.requireNonNull(cfg, "cfg").getMaxPages();
        this.loader = new PageLoader(fetcher, extractor);
        this.discoverer = Objects.requireNonNull(discoverer, "discoverer");
    }

    @Override public String name() { return "sequential"; }

    @Override
    public List<ExtractedPage> crawl(CrawlTarget target) {
        Objects.requireNonNull(target, "target");
        CrawlStats stats = new CrawlStats();
        URI start = target.url();

        LOG.info("Crawl start: engine={}, target={}, maxPages={}", name(), start, maxPages);
        SLOG.info("crawl-start", "engine", name(), "target", start, "maxPages", maxPages);

        PageOutcome home;
        try {
            home = loader.load(start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException("Interrupted while fetching " + start, e);
        }
        stats.addRequests(home.attempts(), home.retries());
        if (!home.isExtracted()) {
            SLOG.warn("crawl-failed", "engine", name(), "url", start, "reason", home.reason());
            throw new CrawlException("Cannot fetch start page " + start + ": " + home.reason());
        }

        // 후보: 시작 URL → 루트 → 내비 링크 (정규화 키로 중복 제거)
        Map<String, URI> candidates = new LinkedHashMap<>();
        candidates.put(UrlUtils.key(start), start);
        URI root = target.siteRoot();
        candidates.putIfAbsent(UrlUtils.key(root), root);
        for (URI link : discoverer.discover(home.document(), home.finalUrl())) {
            candidates.putIfAbsent(UrlUtils.key(link), link);
        }
        LOG.debug("Candidates for {}: {}", start, candidates.size());

        String startKey = UrlUtils.key(start);
        List<ExtractedPage> pages = new ArrayList<>();
        for (Map.Entry<String, URI> e : candidates.entrySet()) {
            if (pages.size() >= maxPages) break;
            URI url = e.getValue();

            PageOutcome o;
            if (e.getKey().equals(startKey)) {
                o = home;
            } else {
                try {
                    o = loader.load(url);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    LOG.info("Crawl interrupted after {} pages", pages.size());
                    break;
                }
                stats.addRequests(o.attempts(), o.retries());
            }

            if (o.isExtracted()) {
                pages.add(o.page());
                stats.pageExtracted();
                SLOG.debug("page-extracted", "url", url, "pageNo", pages.size());
            } else {
                recordMiss(stats, o);
            }
        }

        var snap = stats.snapshot();
        LOG.info("Crawl done: engine={}, pages={}, requests={}, skipped={}, failed={}",
                name(), pages.size(), snap.requestsTotal(), snap.pagesSkipped(), snap.pagesFailed());
        SLOG.info("crawl-done", "engine", name(), "pages", pages.size(),
                "requests", snap.requestsTotal(), "retries", snap.retriesTotal(),
                "skipped", snap.pagesSkipped(), "failed", snap.pagesFailed());
        return pages;
    }

    static void recordMiss(CrawlStats stats, PageOutcome o) {
        switch (o.outcome()) {
            case SKIPPED: stats.pageSkipped(); break;
            default: stats.pageFailed(); break;
        }
        SLOG.debug("page-skipped", "url", o.url(), "outcome", o.outcome(), "reason", o.reason());
    }
}
