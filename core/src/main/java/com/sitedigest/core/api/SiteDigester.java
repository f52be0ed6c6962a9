package com.sitedigest.core.api;

import com.sitedigest.core.model.DigestResult;

/** 대상 문자열 → 다이제스트. HTTP 엔드포인트가 의존하는 경계. */
@FunctionalInterface
public interface SiteDigester {
    /**
     * @throws com.sitedigest.core.model.InvalidTargetException 빈/해석 불가 대상
     * @throws com.sitedigest.core.crawler.SiteUnreachableException 두 엔진 모두 0 페이지
     */
    DigestResult digest(String target);
}
