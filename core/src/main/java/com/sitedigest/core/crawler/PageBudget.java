package com.sitedigest.core.crawler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/** per-run 페이지 수/시간 예산을 동시에 관리하는 게이트 (스레드 세이프) */
public final class PageBudget {
    private final AtomicInteger used = new AtomicInteger();
    private final int maxPages;
    private final long deadlineNanos;

    public PageBudget(int maxPages, Duration timeLimit) {
        this.maxPages = Math.max(1, maxPages);
        this.deadlineNanos = System.nanoTime() + Math.max(1, timeLimit.toNanos());
    }

    /** 한도 미만이면 1 예약하고 true. 동시 호출에서도 maxPages 를 넘지 않음 */
    public boolean tryReserve() {
        while (true) {
            int cur = used.get();
            if (cur >= maxPages) return false;
            if (used.compareAndSet(cur, cur + 1)) return true;
        }
    }

    public boolean isExhausted() { return used.get() >= maxPages; }
    public long remainingNanos() { return Math.max(0, deadlineNanos - System.nanoTime()); }

    public int used() { return used.get(); }
}
