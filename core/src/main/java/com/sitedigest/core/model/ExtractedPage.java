package com.sitedigest.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 한 페이지에서 뽑아낸 정규화 텍스트 필드. 생성 후 불변.
 * 문자열 필드는 null 대신 "" 로 보관한다.
 */
public record ExtractedPage(
        String url,
        String title,
        String metaDescription,
        String h1,
        List<String> headings,
        String textPreview,
        StructuredData structuredData) {

    public ExtractedPage {
        Objects.requireNonNull(url, "url");
        title = nz(title);
        metaDescription = nz(metaDescription);
        h1 = nz(h1);
        headings = (headings == null) ? List.of() : List.copyOf(headings);
        textPreview = nz(textPreview);
        structuredData = (structuredData == null) ? StructuredData.EMPTY : structuredData;
    }

    private static String nz(String s) { return s == null ? "" : s; }
}
