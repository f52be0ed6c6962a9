package com.sitedigest.core.model;

import java.util.Objects;

/** 분류 태그가 붙은 페이지. crawlIndex 는 크롤 순서(동순위 정렬 기준). */
public record CategorizedPage(ExtractedPage page, Category category, int crawlIndex) {
    public CategorizedPage {
        Objects.requireNonNull(page, "page");
        Objects.requireNonNull(category, "category");
    }

    public String url() { return page.url(); }
}
