package com.sitedigest.core.model;

import java.util.List;

/** 다이제스트 헤더용 사이트 단위 신호 */
public record CompanySignals(
        String tagline,
        List<String> products,
        String siteName,
        boolean hasPricing,
        boolean hasBlog,
        boolean hasCareers) {

    public CompanySignals {
        tagline = tagline == null ? "" : tagline;
        products = products == null ? List.of() : List.copyOf(products);
        siteName = siteName == null ? "" : siteName;
    }
}
