package com.sitedigest.core.http;

import com.sitedigest.core.model.DigestConfig;
import com.sitedigest.core.util.DefaultSleeper;
import com.sitedigest.core.util.Sleeper;
import com.sitedigest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 페이지 요청기: 헤더 프로파일 순회 + 프로파일별 재시도.
 * <ul>
 *   <li>프로파일마다 {@link RetryPolicy} 로 재시도(Retry-After 우선, 상한 30s)</li>
 *   <li>2xx + HTML 이면 성공. 실패/비 HTML 이면 다음 프로파일로 한 번 더</li>
 *   <li>maxRedirects &gt; 0 이면 리다이렉트를 직접 따라간다(클라이언트는 NEVER)</li>
 * </ul>
 * 비 HTML 응답은 본문을 읽지 않고 버린다.
 */
public class HttpFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFetcher.class);
    private static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final HttpSender sender;
    private final Duration timeout;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final List<HeaderProfile> profiles;
    private final int maxRedirects;

    public HttpFetcher(HttpSender sender, Duration timeout, RetryPolicy policy, Sleeper sleeper,
                       List<HeaderProfile> profiles, int maxRedirects) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.profiles = List.copyOf(profiles);
        if (this.profiles.isEmpty()) throw new IllegalArgumentException("profiles must not be empty");
        this.maxRedirects = Math.max(0, maxRedirects);
    }

    /** 1차(순차) 크롤러용: 클라이언트가 리다이렉트 추적, BROWSER → CRAWLER */
    public static HttpFetcher primary(DigestConfig cfg) {
        Duration t = cfg.fetch().getTimeout();
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(t)
                .build();
        return primary(cfg, clientSender(client), DefaultSleeper.INSTANCE);
    }

    public static HttpFetcher primary(DigestConfig cfg, HttpSender sender, Sleeper sleeper) {
        return new HttpFetcher(sender, cfg.fetch().getTimeout(), BackoffRetryPolicy.primary(cfg), sleeper,
                List.of(HeaderProfile.BROWSER, HeaderProfile.CRAWLER), 0);
    }

    /** 2차(동시) 크롤러용: 쿠키 유지 + 수동 리다이렉트, 403 재시도 */
    public static HttpFetcher fallback(DigestConfig cfg) {
        var fb = cfg.fallback();
        HttpClient client = HttpClient.newBuilder()
                .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(fb.getRequestTimeout())
                .build();
        return fallback(cfg, clientSender(client), DefaultSleeper.INSTANCE);
    }

    public static HttpFetcher fallback(DigestConfig cfg, HttpSender sender, Sleeper sleeper) {
        var fb = cfg.fallback();
        return new HttpFetcher(sender, fb.getRequestTimeout(), BackoffRetryPolicy.fallback(cfg), sleeper,
                List.of(HeaderProfile.BROWSER), fb.getMaxRedirects());
    }

    /** HttpClient 를 송신 훅으로 감싼다. HTML 이 아닌 본문은 버림 */
    public static HttpSender clientSender(HttpClient client) {
        Objects.requireNonNull(client, "client");
        HttpResponse.BodyHandler<String> handler = info -> isHtmlType(info.headers())
                ? HttpResponse.BodyHandlers.ofString().apply(info)
                : HttpResponse.BodySubscribers.replacing("");
        return req -> client.send(req, handler);
    }

    // ---------- 요청 ----------

    /** 프로파일 순회 + 재시도 포함 최종 판정 */
    public FetchResult fetch(URI url) throws InterruptedException {
        Objects.requireNonNull(url, "url");
        FetchResponse last = null;
        String reason = "";
        boolean skip = false;
        int totalAttempts = 0;
        int retries = 0;

        for (HeaderProfile profile : profiles) {
            FetchResponse r = sendWithRetry(url, profile);
            totalAttempts += r.getAttempts();
            retries += r.getAttempts() - 1;
            last = r;
            if (r.isSuccess() && r.isHtml()) {
                return FetchResult.success(r.withAttempts(totalAttempts)).withRetries(retries);
            }
            if (r.isSuccess()) {
                skip = true;
                reason = "non-html: " + r.getContentType();
            } else if (r.isTimedOut()) {
                skip = true;
                reason = "timeout";
            } else {
                skip = false;
                reason = (r.getStatusCode() == -1) ? "error: " + r.getError() : "status " + r.getStatusCode();
            }
            LOG.debug("Fetch {} with {} profile: {}", url, profile, reason);
        }
        last = last.withAttempts(totalAttempts);
        FetchResult out = skip ? FetchResult.skipped(last, reason) : FetchResult.failed(last, reason);
        return out.withRetries(retries);
    }

    /** 재시도 포함 버전: 정책이 허용하는 상태에서만 재시도, Retry-After 우선 */
    public FetchResponse sendWithRetry(URI url, HeaderProfile profile) throws InterruptedException {
        int attempt = 1;
        while (true) {
            FetchResponse data = send(url, profile);
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while fetching " + url);
            }
            if (!policy.shouldRetry(data.getStatusCode(), attempt)) {
                return data.withAttempts(attempt);
            }
            sleeper.sleep(resolveRetryAfterOr(policy.nextDelay(attempt), data));
            attempt++;
        }
    }

    /** 단일 시도. 예외 시 status -1 */
    public FetchResponse send(URI url, HeaderProfile profile) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        URI current = url;
        try {
            for (int hop = 0; ; hop++) {
                HttpResponse<String> resp = sender.send(request(current, profile));
                int sc = resp.statusCode();
                String location = resp.headers().firstValue("Location").orElse(null);
                if (maxRedirects > 0 && isRedirect(sc) && location != null && hop < maxRedirects) {
                    current = UrlUtils.resolve(current, location.trim());
                    continue;
                }
                URI finalUrl = (maxRedirects > 0 || resp.uri() == null) ? current : resp.uri();
                return toResponse(url, finalUrl, resp, start);
            }
        } catch (HttpTimeoutException e) {
            return errorResponse(url, start, true, "timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResponse(url, start, false, "interrupted");
        } catch (Exception e) {
            return errorResponse(url, start, false, e.getClass().getSimpleName()
                    + (e.getMessage() != null ? ": " + e.getMessage() : ""));
        }
    }

    private HttpRequest request(URI url, HeaderProfile profile) {
        HttpRequest.Builder b = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .GET();
        for (Map.Entry<String, String> h : profile.headers().entrySet()) {
            b.header(h.getKey(), h.getValue());
        }
        return b.build();
    }

    private static FetchResponse toResponse(URI url, URI finalUrl, HttpResponse<String> resp, long start) {
        HttpHeaders hh = resp.headers();
        return FetchResponse.builder()
                .url(url)
                .finalUrl(finalUrl)
                .statusCode(resp.statusCode())
                .headers(hh.map())
                .body(resp.body() == null ? "" : resp.body())
                .contentType(hh.firstValue("Content-Type").orElse(null))
                .responseTimeMs(elapsedMs(start))
                .build();
    }

    private static FetchResponse errorResponse(URI url, long start, boolean timedOut, String error) {
        return FetchResponse.builder()
                .url(url)
                .statusCode(-1)
                .headers(Map.of())
                .body("")
                .responseTimeMs(elapsedMs(start))
                .timedOut(timedOut)
                .error(error)
                .build();
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }

    private static boolean isRedirect(int sc) {
        return sc == 301 || sc == 302 || sc == 303 || sc == 307 || sc == 308;
    }

    private static boolean isHtmlType(HttpHeaders headers) {
        String ct = headers.firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml");
    }

    /** Retry-After(초) 헤더를 존중하되 과도한 대기는 30초로 상한 */
    static Duration resolveRetryAfterOr(Duration fallback, FetchResponse data) {
        String v = data.header("Retry-After");
        if (v == null || v.isBlank()) return fallback;
        try {
            long sec = Long.parseLong(v.trim());
            Duration d = Duration.ofSeconds(Math.max(0, sec));
            return d.compareTo(RETRY_AFTER_CAP) > 0 ? RETRY_AFTER_CAP : d;
        } catch (NumberFormatException e) {
            // HTTP-date 형태는 기본 백오프 사용
            return fallback;
        }
    }
}
