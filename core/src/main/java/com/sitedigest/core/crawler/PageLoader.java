package com.sitedigest.core.crawler;

import com.sitedigest.core.extract.PageExtractor;
import com.sitedigest.core.http.FetchResponse;
import com.sitedigest.core.http.FetchResult;
import com.sitedigest.core.http.HttpFetcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;

/** 요청 → jsoup 파싱 → 추출. 두 엔진이 공유한다. */
final class PageLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PageLoader.class);

    private final HttpFetcher fetcher;
    private final PageExtractor extractor;

    PageLoader(HttpFetcher fetcher, PageExtractor extractor) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    PageOutcome load(URI url) throws InterruptedException {
        FetchResult r = fetcher.fetch(url);
        if (!r.isSuccess()) return PageOutcome.notFetched(url, r);

        FetchResponse resp = r.response();
        try {
            Document doc = Jsoup.parse(resp.getBody(), resp.getFinalUrl().toString());
            return PageOutcome.extracted(url, resp.getFinalUrl(), doc, extractor.extract(doc, url.toString()), r);
        } catch (RuntimeException e) {
            LOG.warn("Extraction failed for {}: {}", url, e.toString());
            return PageOutcome.extractionFailed(url, "extract: " + e.getClass().getSimpleName(), r);
        }
    }
}
