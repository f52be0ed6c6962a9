package com.sitedigest.core.crawler;

/** 엔진이 시작 페이지조차 가져오지 못함. 오케스트레이터는 빈 결과로 취급한다. */
public class CrawlException extends RuntimeException {
    public CrawlException(String message) { super(message); }
    public CrawlException(String message, Throwable cause) { super(message, cause); }
}
