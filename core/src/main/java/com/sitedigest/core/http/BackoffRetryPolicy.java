package com.sitedigest.core.http;

import com.sitedigest.core.model.DigestConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/** 지정 상태코드 + 연결 오류(-1)에서만 재시도. base → 2×base → 4×base (지터 없음) */
public final class BackoffRetryPolicy implements RetryPolicy {

    /** 1차 크롤러: 일시적 오류만 */
    public static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 500, 502, 503, 504);
    /** 2차 크롤러: 403/408 도 재시도 */
    public static final Set<Integer> FALLBACK_STATUSES = Set.of(403, 408, 429, 500, 502, 503, 504);

    private final int maxAttempts;
    private final long baseMillis;
    private final Set<Integer> retryable;

    public BackoffRetryPolicy(int maxAttempts, long baseMillis, Set<Integer> retryableStatuses) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
        this.retryable = Set.copyOf(Objects.requireNonNull(retryableStatuses, "retryableStatuses"));
    }

    public static BackoffRetryPolicy primary(DigestConfig cfg) {
        return new BackoffRetryPolicy(cfg.fetch().getMaxAttempts(), cfg.fetch().getBackoffMs(), TRANSIENT_STATUSES);
    }

    public static BackoffRetryPolicy fallback(DigestConfig cfg) {
        return new BackoffRetryPolicy(cfg.fallback().getMaxAttempts(), cfg.fallback().getBackoffMs(), FALLBACK_STATUSES);
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        if (attempt >= maxAttempts) return false;
        return statusCode == -1 || retryable.contains(statusCode);
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(20, Math.max(0, attempt - 1));   // 1,2,4...
        return Duration.ofMillis(baseMillis * pow);
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
