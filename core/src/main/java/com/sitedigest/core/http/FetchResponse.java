package com.sitedigest.core.http;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** HTTP 응답 캡처(본문은 텍스트). statusCode -1 = 연결 오류/타임아웃, error 에 사유. */
public final class FetchResponse {
    private final URI url;
    private final URI finalUrl;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;
    private final int attempts;
    private final boolean timedOut;
    private final String error;

    private FetchResponse(Builder b) {
        this.url = b.url;
        this.finalUrl = (b.finalUrl == null) ? b.url : b.finalUrl;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
        this.attempts = Math.max(1, b.attempts);
        this.timedOut = b.timedOut;
        this.error = b.error;
    }

    // ---------- getters ----------
    public URI getUrl() { return url; }
    /** 리다이렉트 이후 최종 URL */
    public URI getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public int getAttempts() { return attempts; }
    public boolean isTimedOut() { return timedOut; }
    public String getError() { return error; }

    public boolean isSuccess() { return statusCode >= 200 && statusCode < 300; }

    /** text/html 또는 application/xhtml 만 HTML 로 취급 */
    public boolean isHtml() {
        if (contentType == null) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml");
    }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    /** 시도 횟수만 바꾼 사본 */
    FetchResponse withAttempts(int n) {
        return toBuilder().attempts(n).build();
    }

    public Builder toBuilder() {
        return builder().url(url).finalUrl(finalUrl).statusCode(statusCode).headers(headers)
                .body(body).contentType(contentType).responseTimeMs(responseTimeMs)
                .attempts(attempts).timedOut(timedOut).error(error);
    }

    @Override public String toString() {
        return "FetchResponse{" + url + " -> " + statusCode
                + (error != null ? " (" + error + ")" : "") + ", attempts=" + attempts + "}";
    }

    // ---------- 빌더 ----------
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private URI finalUrl;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private String contentType;
        private long responseTimeMs;
        private int attempts = 1;
        private boolean timedOut;
        private String error;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder finalUrl(URI finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder attempts(int attempts) { this.attempts = attempts; return this; }
        public Builder timedOut(boolean timedOut) { this.timedOut = timedOut; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public FetchResponse build() {
            Objects.requireNonNull(url, "url");
            return new FetchResponse(this);
        }
    }
}
