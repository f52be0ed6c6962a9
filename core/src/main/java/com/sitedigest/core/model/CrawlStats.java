package com.sitedigest.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 1회 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);   // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicInteger pagesExtracted = new AtomicInteger(0);
    private final AtomicInteger pagesSkipped = new AtomicInteger(0);
    private final AtomicInteger pagesFailed = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    /** 페이지 1건의 HTTP 시도 수와 그중 재시도 수 */
    public void addRequests(long attempts, long retries) {
        requestsTotal.addAndGet(Math.max(0, attempts));
        retriesTotal.addAndGet(Math.max(0, retries));
    }
    public void pageExtracted() { pagesExtracted.incrementAndGet(); }
    public void pageSkipped() { pagesSkipped.incrementAndGet(); }
    public void pageFailed() { pagesFailed.incrementAndGet(); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(requestsTotal.get(), retriesTotal.get(), pagesExtracted.get(), pagesSkipped.get(),
                pagesFailed.get(), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 */
    public record Snapshot(long requestsTotal, long retriesTotal, int pagesExtracted, int pagesSkipped,
                           int pagesFailed, int maxObservedConcurrency) {}
}
