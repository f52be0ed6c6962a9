package com.sitedigest.core.model;

/**
 * 카테고리 단위 중복 제거 정책. other 는 NONE 외 모든 정책에서 반복 허용.
 * <ul>
 *   <li>STRICT: other 만 여러 페이지</li>
 *   <li>PRODUCT_REPEATS: product, other 여러 페이지 (기본)</li>
 *   <li>NONE: 제거 안 함</li>
 * </ul>
 */
public enum DedupPolicy {
    STRICT,
    PRODUCT_REPEATS,
    NONE;

    public boolean allowsRepeat(Category c) {
        switch (this) {
            case NONE: return true;
            case PRODUCT_REPEATS: return c == Category.PRODUCT || c == Category.OTHER;
            default: return c == Category.OTHER;
        }
    }
}
