package com.sitedigest.core.crawler;

import com.sitedigest.core.api.CrawlEngine;
import com.sitedigest.core.extract.PageExtractor;
import com.sitedigest.core.http.HttpFetcher;
import com.sitedigest.core.model.CrawlStats;
import com.sitedigest.core.model.CrawlTarget;
import com.sitedigest.core.model.DigestConfig;
import com.sitedigest.core.model.ExtractedPage;
import com.sitedigest.core.util.DefaultSleeper;
import com.sitedigest.core.util.NamedThreadFactory;
import com.sitedigest.core.util.RequestPacer;
import com.sitedigest.core.util.Sleeper;
import com.sitedigest.core.util.StructuredLog;
import com.sitedigest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 2차(대체) 크롤러: 고정 스레드풀 + 요청 간격 페이싱 + 실행 전체 타임아웃.
 *  - 방문 예약 집합(동시 안전) / 페이지 예산(원자적 예약)만 공유
 *  - 요청은 쿠키 유지 + 수동 리다이렉트 클라이언트({@link HttpFetcher#fallback})
 *  - 타임아웃 시 남은 작업 취소, 결과는 빈 목록(실패)
 * 결과 순서는 발견 순(홈 = 0).
 */
public final class ConcurrentCrawlEngine implements CrawlEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ConcurrentCrawlEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(ConcurrentCrawlEngine.class);

    private final int maxPages;
    private final int concurrency;
    private final Duration delay;
    private final Duration crawlTimeout;
    private final PageLoader loader;
    private final LinkDiscoverer discoverer;
    private final Sleeper sleeper;

    /** 기본 구현 */
    public ConcurrentCrawlEngine(DigestConfig cfg) {
        this(cfg, HttpFetcher.fallback(cfg), new PageExtractor(), new LinkDiscoverer(), DefaultSleeper.INSTANCE);
    }

    /** DI/테스트용 (sleeper 는 페이싱 대기용) */
    public ConcurrentCrawlEngine(DigestConfig cfg, HttpFetcher fetcher, PageExtractor extractor,
                                 LinkDiscoverer discoverer, Sleeper sleeper) {
        Objects.requireNonNull(cfg, "cfg");
        this.maxPages = cfg.getMaxPages();
        this.concurrency = Math.max(1, cfg.fallback().getConcurrency());
        this.delay = Duration.ofMillis(cfg.fallback().getDelayMs());
        this.crawlTimeout = cfg.fallback().getCrawlTimeout();
        this.loader = new PageLoader(fetcher, extractor);
        this.discoverer = Objects.requireNonNull(discoverer, "discoverer");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override public String name() { return "concurrent"; }

    @Override
    public List<ExtractedPage> crawl(CrawlTarget target) {
        Objects.requireNonNull(target, "target");
        final URI start = target.url();
        final CrawlStats stats = new CrawlStats();
        final PageBudget budget = new PageBudget(maxPages, crawlTimeout);
        final RequestPacer pacer = new RequestPacer(delay, sleeper);
        final Set<String> scheduled = ConcurrentHashMap.newKeySet();
        final ConcurrentSkipListMap<Integer, ExtractedPage> results = new ConcurrentSkipListMap<>();
        final AtomicInteger inFlight = new AtomicInteger();

        LOG.info("Crawl start: engine={}, target={}, cc={}, delayMs={}, timeoutMs={}",
                name(), start, concurrency, delay.toMillis(), crawlTimeout.toMillis());
        SLOG.info("crawl-start", "engine", name(), "target", start, "maxPages", maxPages, "cc", concurrency);

        ExecutorService exec = Executors.newFixedThreadPool(concurrency, new NamedThreadFactory("fallback-worker"));
        List<Future<?>> futures = new ArrayList<>();
        try {
            // ---- 1) 홈 ----
            scheduled.add(UrlUtils.key(start));
            Future<PageOutcome> homeF = exec.submit(() -> fetchPaced(start, pacer, stats, inFlight));
            futures.add(homeF);
            PageOutcome home = homeF.get(budget.remainingNanos(), TimeUnit.NANOSECONDS);
            if (!home.isExtracted()) {
                SequentialCrawlEngine.recordMiss(stats, home);
                SLOG.warn("crawl-failed", "engine", name(), "url", start, "reason", home.reason());
                return List.of();
            }
            budget.tryReserve();
            results.put(0, home.page());
            stats.pageExtracted();

            // ---- 2) 루트 + 내비 링크 ----
            List<URI> candidates = new ArrayList<>();
            candidates.add(target.siteRoot());
            candidates.addAll(discoverer.discover(home.document(), home.finalUrl()));

            int index = 1;
            for (URI url : candidates) {
                if (!scheduled.add(UrlUtils.key(url))) continue;
                final int order = index++;
                futures.add(exec.submit(() -> {
                    if (budget.isExhausted()) return null;
                    PageOutcome o = fetchPaced(url, pacer, stats, inFlight);
                    if (!o.isExtracted()) {
                        SequentialCrawlEngine.recordMiss(stats, o);
                    } else if (budget.tryReserve()) {
                        results.put(order, o.page());
                        stats.pageExtracted();
                        SLOG.debug("page-extracted", "url", url, "order", order);
                    }
                    return null;
                }));
            }

            // ---- 3) 수집(전체 데드라인) ----
            for (Future<?> f : futures) {
                try {
                    f.get(budget.remainingNanos(), TimeUnit.NANOSECONDS);
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.warn("Fallback task failed: {}", cause.toString());
                }
            }
        } catch (TimeoutException e) {
            LOG.warn("Fallback crawl of {} exceeded {} ms; abandoning", start, crawlTimeout.toMillis());
            SLOG.warn("crawl-failed", "engine", name(), "url", start, "reason", "timeout",
                    "pagesSoFar", results.size());
            futures.forEach(f -> f.cancel(true));
            return List.of();
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            SLOG.error("crawl-failed", cause, "engine", name(), "url", start);
            return List.of();
        } catch (CancellationException e) {
            LOG.warn("Fallback crawl of {} cancelled", start);
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlException("Interrupted during fallback crawl of " + start, e);
        } finally {
            exec.shutdownNow();
        }

        List<ExtractedPage> pages = new ArrayList<>(results.values());
        var snap = stats.snapshot();
        LOG.info("Crawl done: engine={}, pages={}, requests={}, maxObservedCC={}",
                name(), pages.size(), snap.requestsTotal(), snap.maxObservedConcurrency());
        SLOG.info("crawl-done", "engine", name(), "pages", pages.size(),
                "requests", snap.requestsTotal(), "retries", snap.retriesTotal(),
                "skipped", snap.pagesSkipped(), "failed", snap.pagesFailed(),
                "maxObservedCC", snap.maxObservedConcurrency());
        return pages;
    }

    private PageOutcome fetchPaced(URI url, RequestPacer pacer, CrawlStats stats, AtomicInteger inFlight)
            throws InterruptedException {
        pacer.acquire();
        stats.observeConcurrency(inFlight.incrementAndGet());
        try {
            PageOutcome o = loader.load(url);
            stats.addRequests(o.attempts(), o.retries());
            return o;
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
