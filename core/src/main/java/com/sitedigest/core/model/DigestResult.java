package com.sitedigest.core.model;

import java.util.List;

/** 한 번의 다이제스트 실행 결과(엔드포인트 응답 형태와 1:1) */
public record DigestResult(
        String domain,
        List<String> categories,
        boolean hasPricing,
        boolean hasBlog,
        boolean hasCareers,
        int pageCount,
        String content) {

    public DigestResult {
        categories = categories == null ? List.of() : List.copyOf(categories);
        content = content == null ? "" : content;
    }
}
