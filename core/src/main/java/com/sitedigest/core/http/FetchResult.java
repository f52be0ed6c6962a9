package com.sitedigest.core.http;

import java.util.Objects;

/**
 * 페이지 1건 요청 결과.
 * SKIPPED(비 HTML, 타임아웃)와 FAILED(연결 오류, 비 2xx)는 모두 크롤 중 흡수된다.
 */
public final class FetchResult {

    public enum Outcome { SUCCESS, SKIPPED, FAILED }

    private final Outcome outcome;
    private final FetchResponse response;
    private final String reason;
    private final int retries;

    private FetchResult(Outcome outcome, FetchResponse response, String reason, int retries) {
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.response = response;
        this.reason = reason == null ? "" : reason;
        this.retries = Math.max(0, retries);
    }

    private static int retriesOf(FetchResponse r) {
        return r == null ? 0 : r.getAttempts() - 1;
    }

    public static FetchResult success(FetchResponse r) {
        return new FetchResult(Outcome.SUCCESS, Objects.requireNonNull(r, "response"), "ok", retriesOf(r));
    }
    public static FetchResult skipped(FetchResponse r, String reason) { return new FetchResult(Outcome.SKIPPED, r, reason, retriesOf(r)); }
    public static FetchResult failed(FetchResponse r, String reason) { return new FetchResult(Outcome.FAILED, r, reason, retriesOf(r)); }

    /** 프로파일별 재시도 합계로 교체 (프로파일 전환은 재시도가 아님) */
    FetchResult withRetries(int n) { return new FetchResult(outcome, response, reason, n); }

    public Outcome outcome() { return outcome; }
    /** 마지막 응답. 인터럽트 등으로 응답이 없으면 null */
    public FetchResponse response() { return response; }
    public String reason() { return reason; }
    public boolean isSuccess() { return outcome == Outcome.SUCCESS; }
    /** 모든 프로파일에 걸친 요청 수 */
    public int attempts() { return response == null ? 0 : response.getAttempts(); }
    public int retries() { return retries; }

    @Override public String toString() {
        return outcome + "(" + reason + ")";
    }
}
