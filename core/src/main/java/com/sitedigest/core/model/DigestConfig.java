package com.sitedigest.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 다이제스트 설정 (digest.yml 매핑 대상). 순수 설정 보관용.
 * 세터는 범위를 보정(clamp)하고, 최종 검증은 validate() 에서 한다.
 */
public final class DigestConfig {

    /** 1차(순차) 크롤러 요청 설정: YAML `fetch:` 섹션 */
    public static final class FetchCfg {
        private Duration timeout = Duration.ofSeconds(15);
        private int maxAttempts = 3;
        private long backoffMs = 500;

        public Duration getTimeout() { return timeout; }
        public FetchCfg setTimeout(Duration v) { if (v != null && !v.isNegative() && !v.isZero()) this.timeout = v; return this; }
        public FetchCfg setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }

        public int getMaxAttempts() { return maxAttempts; }
        public FetchCfg setMaxAttempts(int v) { this.maxAttempts = Math.max(1, v); return this; }

        public long getBackoffMs() { return backoffMs; }
        public FetchCfg setBackoffMs(long v) { this.backoffMs = Math.max(0, v); return this; }
    }

    /** 2차(동시) 크롤러 설정: YAML `fallback:` 섹션 */
    public static final class FallbackCfg {
        private boolean enabled = true;
        private int concurrency = 4;
        private long delayMs = 500;
        private Duration requestTimeout = Duration.ofSeconds(20);
        private int maxAttempts = 3;
        private long backoffMs = 500;
        private int maxRedirects = 5;
        private Duration crawlTimeout = Duration.ofSeconds(90);

        public boolean isEnabled() { return enabled; }
        public FallbackCfg setEnabled(boolean v) { this.enabled = v; return this; }

        public int getConcurrency() { return concurrency; }
        public FallbackCfg setConcurrency(int v) { this.concurrency = Math.max(1, v); return this; }

        public long getDelayMs() { return delayMs; }
        public FallbackCfg setDelayMs(long v) { this.delayMs = Math.max(0, v); return this; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public FallbackCfg setRequestTimeoutMs(long ms) { this.requestTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }

        public int getMaxAttempts() { return maxAttempts; }
        public FallbackCfg setMaxAttempts(int v) { this.maxAttempts = Math.max(1, v); return this; }

        public long getBackoffMs() { return backoffMs; }
        public FallbackCfg setBackoffMs(long v) { this.backoffMs = Math.max(0, v); return this; }

        public int getMaxRedirects() { return maxRedirects; }
        public FallbackCfg setMaxRedirects(int v) { this.maxRedirects = Math.max(0, v); return this; }

        public Duration getCrawlTimeout() { return crawlTimeout; }
        public FallbackCfg setCrawlTimeoutMs(long ms) { this.crawlTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    }

    /** 출력 설정: YAML `digest:` 섹션 */
    public static final class OutputCfg {
        private int maxOutputBytes = 7800;
        private int maxHeadings = 4;

        public int getMaxOutputBytes() { return maxOutputBytes; }
        public OutputCfg setMaxOutputBytes(int v) { this.maxOutputBytes = Math.max(1, v); return this; }

        public int getMaxHeadings() { return maxHeadings; }
        public OutputCfg setMaxHeadings(int v) { this.maxHeadings = Math.max(0, v); return this; }
    }

    // ---------- 기본 필드 ----------
    private int maxPages = 15;
    private DedupPolicy dedupPolicy = DedupPolicy.PRODUCT_REPEATS;
    private int serverPort = 8000;

    private final FetchCfg fetch = new FetchCfg();
    private final FallbackCfg fallback = new FallbackCfg();
    private final OutputCfg output = new OutputCfg();

    // ---------- getters ----------
    public int getMaxPages() { return maxPages; }
    public DedupPolicy getDedupPolicy() { return dedupPolicy; }
    public int getServerPort() { return serverPort; }
    public FetchCfg fetch() { return fetch; }
    public FallbackCfg fallback() { return fallback; }
    public OutputCfg output() { return output; }

    // ---------- fluent setters ----------
    public DigestConfig setMaxPages(int v) { this.maxPages = Math.max(1, v); return this; }
    public DigestConfig setDedupPolicy(DedupPolicy p) {
        this.dedupPolicy = (p != null ? p : DedupPolicy.PRODUCT_REPEATS);
        return this;
    }
    public DigestConfig setServerPort(int v) { this.serverPort = v; return this; }

    // ---------- validate ----------
    public void validate() {
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        Objects.requireNonNull(dedupPolicy, "dedupPolicy");
        if (serverPort < 0 || serverPort > 65535)
            throw new IllegalArgumentException("server.port must be in 0..65535");
        if (fetch.getTimeout() == null || fetch.getTimeout().isZero() || fetch.getTimeout().isNegative())
            throw new IllegalArgumentException("fetch.timeoutMs must be > 0");
        if (fallback.getConcurrency() < 1)
            throw new IllegalArgumentException("fallback.concurrency must be >= 1");
        if (output.getMaxOutputBytes() < 1)
            throw new IllegalArgumentException("digest.maxOutputBytes must be >= 1");
    }

    // ---------- helpers ----------
    public static DigestConfig defaults() { return new DigestConfig(); }
}
