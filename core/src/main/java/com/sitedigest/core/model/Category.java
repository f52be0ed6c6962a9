package com.sitedigest.core.model;

/**
 * 페이지 분류 태그. rank 가 낮을수록 다이제스트에서 먼저 배치된다.
 */
public enum Category {
    HOME("home", 0),
    PRODUCT("product", 1),
    PRICING("pricing", 2),
    ABOUT("about", 3),
    CASE_STUDY("case-study", 4),
    SECURITY("security", 5),
    API("api", 6),
    PARTNERS("partners", 7),
    FAQ("faq", 8),
    CAREERS("careers", 9),
    BLOG("blog", 10),
    PRESS("press", 11),
    INVESTORS("investors", 12),
    CONTACT("contact", 13),
    LEGAL("legal", 14),
    OTHER("other", 15);

    private final String slug;
    private final int rank;

    Category(String slug, int rank) {
        this.slug = slug;
        this.rank = rank;
    }

    public String slug() { return slug; }
    public int rank() { return rank; }

    @Override public String toString() { return slug; }
}
