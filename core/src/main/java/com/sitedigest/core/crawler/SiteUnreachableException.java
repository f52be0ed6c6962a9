package com.sitedigest.core.crawler;

/** 1차/2차 엔진 모두 추출 0건. 호출자까지 전파된다. */
public class SiteUnreachableException extends CrawlException {
    private final String domain;

    public SiteUnreachableException(String domain, String message) {
        super(message);
        this.domain = domain;
    }

    public String getDomain() { return domain; }
}
