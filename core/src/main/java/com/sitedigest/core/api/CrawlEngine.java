package com.sitedigest.core.api;

import com.sitedigest.core.model.CrawlTarget;
import com.sitedigest.core.model.ExtractedPage;

import java.util.List;

/**
 * 크롤 엔진 최소 계약: 대상 사이트에서 추출된 페이지 목록을 돌려준다.
 * 빈 목록 = 추출 성공 0건. 시작 페이지조차 못 가져오면
 * {@link com.sitedigest.core.crawler.CrawlException} 을 던질 수 있다.
 */
public interface CrawlEngine {
    List<ExtractedPage> crawl(CrawlTarget target);

    /** 로그용 엔진 이름 */
    String name();
}
