package com.sitedigest.core.crawler;

import com.sitedigest.core.http.FetchResult;
import com.sitedigest.core.model.ExtractedPage;
import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.Objects;

/** 페이지 1건 처리 결과(요청 + 파싱 + 추출). 엔진이 SKIPPED/FAILED 를 흡수한다. */
public final class PageOutcome {
    private final URI url;
    private final FetchResult.Outcome outcome;
    private final ExtractedPage page;
    private final Document document;
    private final URI finalUrl;
    private final String reason;
    private final int attempts;
    private final int retries;

    private PageOutcome(URI url, FetchResult.Outcome outcome, ExtractedPage page, Document document,
                        URI finalUrl, String reason, FetchResult fetch) {
        this.url = Objects.requireNonNull(url, "url");
        this.outcome = outcome;
        this.page = page;
        this.document = document;
        this.finalUrl = finalUrl == null ? url : finalUrl;
        this.reason = reason == null ? "" : reason;
        this.attempts = fetch.attempts();
        this.retries = fetch.retries();
    }

    static PageOutcome extracted(URI url, URI finalUrl, Document doc, ExtractedPage page, FetchResult fetch) {
        return new PageOutcome(url, FetchResult.Outcome.SUCCESS, Objects.requireNonNull(page, "page"),
                doc, finalUrl, "ok", fetch);
    }

    static PageOutcome notFetched(URI url, FetchResult r) {
        return new PageOutcome(url, r.outcome(), null, null, null, r.reason(), r);
    }

    static PageOutcome extractionFailed(URI url, String reason, FetchResult fetch) {
        return new PageOutcome(url, FetchResult.Outcome.FAILED, null, null, null, reason, fetch);
    }

    public URI url() { return url; }
    public FetchResult.Outcome outcome() { return outcome; }
    public boolean isExtracted() { return outcome == FetchResult.Outcome.SUCCESS; }
    /** 성공 시에만 non-null */
    public ExtractedPage page() { return page; }
    /** 성공 시 파싱된 원본 문서(링크 탐색용) */
    public Document document() { return document; }
    public URI finalUrl() { return finalUrl; }
    public String reason() { return reason; }
    public int attempts() { return attempts; }
    public int retries() { return retries; }
}
