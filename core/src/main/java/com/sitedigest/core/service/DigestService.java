package com.sitedigest.core.service;

import com.sitedigest.core.api.SiteDigester;
import com.sitedigest.core.classify.Categorizer;
import com.sitedigest.core.crawler.CrawlOrchestrator;
import com.sitedigest.core.digest.DigestAssembler;
import com.sitedigest.core.digest.PageDeduplicator;
import com.sitedigest.core.model.CategorizedPage;
import com.sitedigest.core.model.Category;
import com.sitedigest.core.model.CrawlTarget;
import com.sitedigest.core.model.Digest;
import com.sitedigest.core.model.DigestConfig;
import com.sitedigest.core.model.DigestResult;
import com.sitedigest.core.model.ExtractedPage;
import com.sitedigest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * 다이제스트 오케스트레이터:
 *  - 대상 파싱 → 크롤(1차, 필요 시 2차) → 분류 → 카테고리 중복 제거 → 조립
 *  - 기본 구현체는 설정으로 생성, DI 생성자는 테스트 주입용
 * 요청 간 공유 상태 없음(문장 중복 제거 풀은 조립 1회 범위).
 */
public final class DigestService implements SiteDigester {

    private static final Logger LOG = LoggerFactory.getLogger(DigestService.class);
    private static final StructuredLog SLOG = StructuredLog.get(DigestService.class);

    private final CrawlOrchestrator crawler;
    private final Categorizer categorizer;
    private final PageDeduplicator deduplicator;
    private final DigestAssembler assembler;

    /** 기본 구현 */
    public DigestService(DigestConfig config) {
        this(validated(config), CrawlOrchestrator.create(config), new Categorizer(),
                new PageDeduplicator(config.getDedupPolicy()), new DigestAssembler(config));
    }

    /** DI/테스트용 */
    public DigestService(DigestConfig config, CrawlOrchestrator crawler, Categorizer categorizer,
                         PageDeduplicator deduplicator, DigestAssembler assembler) {
        Objects.requireNonNull(config, "config");
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.categorizer = Objects.requireNonNull(categorizer, "categorizer");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    @Override
    public DigestResult digest(String rawTarget) {
        long t0 = System.nanoTime();
        CrawlTarget target = CrawlTarget.parse(rawTarget);
        LOG.info("Digest start: target={}, domain={}", target.url(), target.domain());

        List<ExtractedPage> pages = crawler.crawl(target);

        List<CategorizedPage> categorized = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            ExtractedPage p = pages.get(i);
            categorized.add(new CategorizedPage(p, categorizer.categorize(p.url(), p), i));
        }
        List<CategorizedPage> retained = deduplicator.dedupe(categorized);

        Digest digest = assembler.assemble(target.domain(), retained);

        TreeSet<String> categories = new TreeSet<>();
        boolean pricing = false, blog = false, careers = false;
        for (CategorizedPage cp : retained) {
            categories.add(cp.category().slug());
            pricing |= cp.category() == Category.PRICING;
            blog |= cp.category() == Category.BLOG;
            careers |= cp.category() == Category.CAREERS;
        }

        long ms = (System.nanoTime() - t0) / 1_000_000;
        LOG.info("Digest built: domain={}, crawled={}, retained={}, blocks={}, bytes={}, elapsedMs={}",
                target.domain(), pages.size(), retained.size(), digest.blocks().size(), digest.totalBytes(), ms);
        SLOG.info("digest-built",
                "domain", target.domain(),
                "crawled", pages.size(),
                "retained", retained.size(),
                "blocks", digest.blocks().size(),
                "bytes", digest.totalBytes(),
                "categories", categories,
                "elapsedMs", ms);

        return new DigestResult(target.domain(), new ArrayList<>(categories),
                pricing, blog, careers, retained.size(), digest.content());
    }

    private static DigestConfig validated(DigestConfig cfg) {
        Objects.requireNonNull(cfg, "config").validate();
        return cfg;
    }
}
