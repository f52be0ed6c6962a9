package com.sitedigest.core.config;

import com.sitedigest.core.model.Category;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 분류 키워드 중앙 테이블 (불변, 프로세스 전역 1개).
 * - 행 순서 = 동률 시 우선순위(앞 행 승)
 * - URL 표는 슬러그용, 본문 표는 문장용 키워드
 * - 여기만 수정하면 분류 동작이 바뀜
 */
public final class CategoryRules {

    /** (카테고리, 키워드 목록) 한 행 */
    public record Rule(Category category, List<String> keywords) {
        public Rule {
            Objects.requireNonNull(category, "category");
            keywords = List.copyOf(keywords);
        }

        /** 키워드 중 하나라도 부분 문자열이면 true */
        public boolean matches(String haystack) {
            for (String k : keywords) {
                if (haystack.contains(k)) return true;
            }
            return false;
        }
    }

    public static final CategoryRules DEFAULT = new CategoryRules(
            List.of(
                    rule(Category.PRICING, "pricing", "plans", "tarif", "price", "cost", "subscription"),
                    rule(Category.PRODUCT, "product", "features", "solution", "use-case", "platform", "capabilities"),
                    rule(Category.ABOUT, "about", "team", "a-propos", "qui-sommes", "our-story", "our-team", "leadership"),
                    rule(Category.CONTACT, "contact", "contact-us", "contactez"),
                    rule(Category.BLOG, "blog", "articles", "news", "actualites", "insights", "resources"),
                    rule(Category.LEGAL, "privacy", "terms", "legal", "cgu", "cgv", "mentions-legales", "cookie",
                            "gdpr", "imprint", "disclaimer"),
                    rule(Category.CAREERS, "careers", "jobs", "recrutement", "hiring", "open-positions", "join-us",
                            "work-with-us"),
                    rule(Category.FAQ, "faq", "help", "support", "help-center", "knowledge-base"),
                    rule(Category.PARTNERS, "partner", "partenaire", "integrations", "marketplace", "ecosystem"),
                    rule(Category.CASE_STUDY, "case-stud", "temoignage", "success-stor", "customer-stor", "clients",
                            "testimonial"),
                    rule(Category.PRESS, "press", "presse", "media", "newsroom", "in-the-news"),
                    rule(Category.INVESTORS, "investor", "ir", "shareholders", "annual-report", "governance"),
                    rule(Category.SECURITY, "security", "compliance", "trust", "certifications", "soc2", "iso27001"),
                    rule(Category.API, "api", "docs", "documentation", "developer", "reference", "changelog", "sdk")),
            List.of(
                    rule(Category.PRICING, "pricing", "price", "cost", "subscription", "free trial", "per month",
                            "per year", "plan"),
                    rule(Category.PRODUCT, "product", "feature", "solution", "how it works", "capabilities", "platform"),
                    rule(Category.ABOUT, "about us", "our team", "our story", "who we are", "our mission", "founded"),
                    rule(Category.CONTACT, "contact us", "get in touch", "reach out"),
                    rule(Category.BLOG, "blog", "article", "news", "latest post", "insights"),
                    rule(Category.LEGAL, "privacy policy", "terms of service", "terms and conditions", "cookie policy",
                            "legal notice"),
                    rule(Category.CAREERS, "careers", "open positions", "join our team", "we're hiring", "job opening"),
                    rule(Category.FAQ, "frequently asked", "faq", "help center", "common questions"),
                    rule(Category.PARTNERS, "partners", "integrations", "marketplace", "ecosystem"),
                    rule(Category.CASE_STUDY, "case study", "customer story", "success story", "testimonial"),
                    rule(Category.PRESS, "press release", "in the news", "media coverage", "newsroom"),
                    rule(Category.INVESTORS, "investor relations", "shareholders", "annual report",
                            "quarterly results"),
                    rule(Category.SECURITY, "security", "compliance", "trust center", "certifications",
                            "data protection"),
                    rule(Category.API, "api reference", "documentation", "developer guide", "sdk", "api docs")),
            List.of("why-", "how-it-works", "what-is-", "tour", "demo", "overview"),
            Set.of("", "home", "index", "index.html"));

    private final List<Rule> urlRules;
    private final List<Rule> contentRules;
    private final List<String> productSegmentPrefixes;
    private final Set<String> homePaths;

    public CategoryRules(List<Rule> urlRules, List<Rule> contentRules,
                         List<String> productSegmentPrefixes, Set<String> homePaths) {
        this.urlRules = List.copyOf(urlRules);
        this.contentRules = List.copyOf(contentRules);
        this.productSegmentPrefixes = List.copyOf(productSegmentPrefixes);
        this.homePaths = Set.copyOf(homePaths);
    }

    public List<Rule> urlRules() { return urlRules; }
    public List<Rule> contentRules() { return contentRules; }
    /** 3차 패스: 경로 세그먼트 접두사 → product */
    public List<String> productSegmentPrefixes() { return productSegmentPrefixes; }
    public Set<String> homePaths() { return homePaths; }

    private static Rule rule(Category c, String... keywords) {
        return new Rule(c, List.of(keywords));
    }
}
