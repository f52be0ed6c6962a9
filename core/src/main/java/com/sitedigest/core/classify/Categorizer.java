package com.sitedigest.core.classify;

import com.sitedigest.core.config.CategoryRules;
import com.sitedigest.core.model.Category;
import com.sitedigest.core.model.ExtractedPage;
import com.sitedigest.core.util.UrlUtils;

import java.util.Locale;
import java.util.Objects;

/**
 * 규칙 기반 페이지 분류. (url, 내용)의 순수 함수, 첫 매치 승.
 *  0) 홈: 빈 경로 / home / index / index.html / 3자 이하 알파벳(로케일 접두사)
 *  1) URL 경로 키워드
 *  2) 본문 키워드(title + h1 + meta + headings, 소문자)
 *  3) 경로 세그먼트 접두사(why-, demo ...) → product
 *  4) other
 */
public final class Categorizer {

    private final CategoryRules rules;

    public Categorizer() {
        this(CategoryRules.DEFAULT);
    }

    public Categorizer(CategoryRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public Category categorize(ExtractedPage page) {
        return categorize(page.url(), page);
    }

    public Category categorize(String url, ExtractedPage content) {
        String path = UrlUtils.classifierPath(url);

        if (isHomePath(path)) return Category.HOME;

        for (CategoryRules.Rule r : rules.urlRules()) {
            if (r.matches(path)) return r.category();
        }

        if (content != null) {
            String text = searchableText(content);
            for (CategoryRules.Rule r : rules.contentRules()) {
                if (r.matches(text)) return r.category();
            }
        }

        for (String segment : path.split("/")) {
            for (String prefix : rules.productSegmentPrefixes()) {
                if (segment.startsWith(prefix)) return Category.PRODUCT;
            }
        }
        return Category.OTHER;
    }

    boolean isHomePath(String path) {
        if (rules.homePaths().contains(path)) return true;
        if (path.length() > 3) return false;
        for (int i = 0; i < path.length(); i++) {
            if (!Character.isLetter(path.charAt(i))) return false;
        }
        return true;
    }

    static String searchableText(ExtractedPage p) {
        String joined = String.join(" ", p.title(), p.h1(), p.metaDescription(), String.join(" ", p.headings()));
        return joined.toLowerCase(Locale.ROOT);
    }
}
