package com.sitedigest.core.crawler;

import com.sitedigest.core.api.CrawlEngine;
import com.sitedigest.core.model.CrawlTarget;
import com.sitedigest.core.model.DigestConfig;
import com.sitedigest.core.model.ExtractedPage;
import com.sitedigest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 1차 엔진 실행 → 0 페이지(또는 시작 페이지 실패)면 2차 엔진으로 처음부터 다시.
 * 두 엔진은 동시에 돌지 않는다. 둘 다 0 페이지면 {@link SiteUnreachableException}.
 */
public final class CrawlOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlOrchestrator.class);

    private final CrawlEngine primary;
    private final CrawlEngine fallback;   // null 이면 대체 크롤 없음

    public CrawlOrchestrator(CrawlEngine primary, CrawlEngine fallback) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = fallback;
    }

    public static CrawlOrchestrator create(DigestConfig cfg) {
        CrawlEngine fb = cfg.fallback().isEnabled() ? new ConcurrentCrawlEngine(cfg) : null;
        return new CrawlOrchestrator(new SequentialCrawlEngine(cfg), fb);
    }

    public List<ExtractedPage> crawl(CrawlTarget target) {
        Objects.requireNonNull(target, "target");

        List<ExtractedPage> pages = run(primary, target);
        if (!pages.isEmpty()) return pages;

        if (fallback == null) {
            throw unreachable(target);
        }
        LOG.info("Primary engine yielded no pages for {}; escalating to {}", target.domain(), fallback.name());
        SLOG.info("fallback-start", "domain", target.domain(), "engine", fallback.name());

        pages = run(fallback, target);
        if (pages.isEmpty()) {
            throw unreachable(target);
        }
        return pages;
    }

    private static List<ExtractedPage> run(CrawlEngine engine, CrawlTarget target) {
        try {
            List<ExtractedPage> pages = engine.crawl(target);
            if (pages == null || pages.isEmpty()) {
                SLOG.warn("engine-empty", "engine", engine.name(), "domain", target.domain());
                return List.of();
            }
            return pages;
        } catch (SiteUnreachableException e) {
            throw e;
        } catch (CrawlException e) {
            LOG.warn("Engine {} failed for {}: {}", engine.name(), target.domain(), e.getMessage());
            SLOG.warn("engine-empty", "engine", engine.name(), "domain", target.domain(), "reason", e.getMessage());
            return List.of();
        }
    }

    private static SiteUnreachableException unreachable(CrawlTarget target) {
        SLOG.warn("crawl-failed", "domain", target.domain(), "reason", "site unreachable");
        return new SiteUnreachableException(target.domain(),
                "Could not fetch any page from " + target.domain() + " (site unreachable or blocking crawlers)");
    }
}
