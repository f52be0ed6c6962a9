package com.sitedigest.core.digest;

import com.sitedigest.core.extract.TextNormalizer;
import com.sitedigest.core.model.CategorizedPage;
import com.sitedigest.core.model.Category;
import com.sitedigest.core.model.CompanySignals;
import com.sitedigest.core.model.ExtractedPage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** 사이트 단위 신호(태그라인, 제품 목록, 사이트명, 플래그) 추출 */
public final class SignalExtractor {

    static final int TAGLINE_MAX_CHARS = 120;
    static final int PRODUCT_MAX_CHARS = 80;

    public CompanySignals extract(List<CategorizedPage> pages) {
        String tagline = "";
        String siteName = "";
        List<String> products = new ArrayList<>();
        Set<String> productKeys = new HashSet<>();
        boolean pricing = false, blog = false, careers = false;
        boolean homeSeen = false;

        for (CategorizedPage cp : pages) {
            ExtractedPage p = cp.page();
            Category c = cp.category();

            // 태그라인은 첫 홈 페이지에서만
            if (c == Category.HOME && !homeSeen) {
                homeSeen = true;
                tagline = tagline(p);
            }
            if (c == Category.PRODUCT) {
                String name = !p.h1().isBlank() ? p.h1() : p.title();
                if (!name.isBlank() && name.length() < PRODUCT_MAX_CHARS
                        && productKeys.add(name.toLowerCase(Locale.ROOT))) {
                    products.add(name);
                }
            }
            String og = p.structuredData().ogSiteName();
            if (siteName.isEmpty() && og != null && !og.isBlank()) {
                siteName = og;
            }
            pricing |= c == Category.PRICING;
            blog |= c == Category.BLOG;
            careers |= c == Category.CAREERS;
        }
        return new CompanySignals(tagline, products, siteName, pricing, blog, careers);
    }

    static String tagline(ExtractedPage home) {
        String t = home.h1();
        if (t.isBlank() && home.structuredData().ogTitle() != null) t = home.structuredData().ogTitle();
        if (t.isBlank()) t = home.metaDescription();
        t = t.strip();
        if (t.length() > TAGLINE_MAX_CHARS) {
            List<String> sentences = TextNormalizer.splitSentences(t);
            if (!sentences.isEmpty()) t = sentences.get(0);
        }
        return t;
    }
}
