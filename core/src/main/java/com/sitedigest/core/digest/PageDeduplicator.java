package com.sitedigest.core.digest;

import com.sitedigest.core.model.CategorizedPage;
import com.sitedigest.core.model.Category;
import com.sitedigest.core.model.DedupPolicy;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** 카테고리 단위 중복 제거: 크롤 순서대로 카테고리별 첫 페이지만 남긴다(반복 허용 카테고리 제외). */
public final class PageDeduplicator {

    private final DedupPolicy policy;

    public PageDeduplicator(DedupPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public List<CategorizedPage> dedupe(List<CategorizedPage> pages) {
        List<CategorizedPage> ordered = new ArrayList<>(pages);
        ordered.sort((a, b) -> Integer.compare(a.crawlIndex(), b.crawlIndex()));

        Set<Category> seen = EnumSet.noneOf(Category.class);
        List<CategorizedPage> out = new ArrayList<>();
        for (CategorizedPage p : ordered) {
            if (seen.add(p.category()) || policy.allowsRepeat(p.category())) {
                out.add(p);
            }
        }
        return out;
    }
}
