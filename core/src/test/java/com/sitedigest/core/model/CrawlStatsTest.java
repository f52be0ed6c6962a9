package com.sitedigest.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlStatsTest {

    @Test
    void requests_and_retries_are_counted_separately() {
        CrawlStats stats = new CrawlStats();
        // 브라우저 403 1회 + 크롤러 프로파일 성공 1회: 요청 2, 재시도 0
        stats.addRequests(2, 0);
        stats.addRequests(3, 2);
        stats.pageExtracted();
        stats.pageSkipped();

        CrawlStats.Snapshot s = stats.snapshot();
        assertThat(s.requestsTotal()).isEqualTo(5);
        assertThat(s.retriesTotal()).isEqualTo(2);
        assertThat(s.pagesExtracted()).isEqualTo(1);
        assertThat(s.pagesSkipped()).isEqualTo(1);
    }

    @Test
    void observed_concurrency_keeps_the_maximum() {
        CrawlStats stats = new CrawlStats();
        stats.observeConcurrency(3);
        stats.observeConcurrency(1);
        assertThat(stats.snapshot().maxObservedConcurrency()).isEqualTo(3);
    }
}
