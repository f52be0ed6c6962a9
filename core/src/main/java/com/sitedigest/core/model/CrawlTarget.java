package com.sitedigest.core.model;

import com.sitedigest.core.util.UrlUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 대상. 원본 입력 + 정규화 URL + 도메인(authority, 포트 포함).
 * scheme 이 없으면 https 를 붙인다.
 */
public record CrawlTarget(String rawUrl, URI url, String domain) {

    public CrawlTarget {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(domain, "domain");
    }

    public static CrawlTarget parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidTargetException("Missing 'url' field");
        }
        String s = raw.trim();
        String lower = s.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            s = "https://" + s;
        }
        URI u;
        try {
            u = new URI(s);
        } catch (URISyntaxException e) {
            throw new InvalidTargetException("Not a valid URL: " + raw, e);
        }
        if (u.getHost() == null || u.getHost().isBlank()) {
            throw new InvalidTargetException("URL has no host: " + raw);
        }
        URI n = UrlUtils.normalize(u);
        String domain = n.getRawAuthority() == null ? n.getHost() : n.getRawAuthority();
        return new CrawlTarget(raw, n, domain.toLowerCase(Locale.ROOT));
    }

    public String scheme() { return url.getScheme(); }

    public URI siteRoot() { return UrlUtils.siteRoot(url); }
}
