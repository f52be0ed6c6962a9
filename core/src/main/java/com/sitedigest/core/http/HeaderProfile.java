package com.sitedigest.core.http;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 요청 헤더 세트. BROWSER 로 먼저 시도하고 실패 시 CRAWLER 로 한 번 더.
 * Accept-Encoding 은 넣지 않는다(HttpClient 는 압축 해제를 하지 않음).
 */
public enum HeaderProfile {
    BROWSER(browser()),
    CRAWLER(crawler());

    private final Map<String, String> headers;

    HeaderProfile(Map<String, String> headers) {
        this.headers = headers;
    }

    public Map<String, String> headers() { return headers; }

    private static Map<String, String> browser() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("User-Agent", "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36");
        m.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        m.put("Accept-Language", "en-US,en;q=0.9,fr;q=0.8");
        m.put("Cache-Control", "no-cache");
        m.put("Sec-Fetch-Dest", "document");
        m.put("Sec-Fetch-Mode", "navigate");
        m.put("Sec-Fetch-Site", "none");
        m.put("Sec-Fetch-User", "?1");
        m.put("Upgrade-Insecure-Requests", "1");
        return java.util.Collections.unmodifiableMap(m);
    }

    private static Map<String, String> crawler() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("User-Agent", "Mozilla/5.0 (compatible; Googlebot/2.1; +http://www.google.com/bot.html)");
        m.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        m.put("Accept-Language", "en-US,en;q=0.9");
        return java.util.Collections.unmodifiableMap(m);
    }
}
