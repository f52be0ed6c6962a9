package com.sitedigest.core.digest;

import com.sitedigest.core.extract.TextNormalizer;
import com.sitedigest.core.model.ExtractedPage;
import com.sitedigest.core.model.StructuredData;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 페이지 요약 선택.
 * 설명 우선순위: meta → og:description → schema description → h1.
 * 설명이 있으면 본문 문장을 최대 3개 덧붙인다(설명/서로와 겹침 0.5 이하만).
 * 없으면 본문 앞 2문장.
 */
public final class SummarySelector {

    static final int EXTRA_SENTENCES = 3;
    static final int FALLBACK_SENTENCES = 2;

    public String summarize(ExtractedPage page) {
        List<String> body = TextNormalizer.splitSentences(page.textPreview());
        String desc = description(page);

        if (desc == null) {
            return String.join(" ", body.subList(0, Math.min(FALLBACK_SENTENCES, body.size())));
        }

        List<String> chosen = new ArrayList<>();
        chosen.add(desc);
        List<Set<String>> pool = new ArrayList<>();
        for (String s : TextNormalizer.splitSentences(desc)) pool.add(SentenceDeduplicator.words(s));

        int added = 0;
        for (String s : body) {
            if (added >= EXTRA_SENTENCES) break;
            Set<String> w = SentenceDeduplicator.words(s);
            if (w.isEmpty() || nearDuplicate(w, pool)) continue;
            chosen.add(s);
            pool.add(w);
            added++;
        }
        return String.join(" ", chosen);
    }

    static String description(ExtractedPage page) {
        StructuredData sd = page.structuredData();
        return firstNonBlank(page.metaDescription(), sd.ogDescription(), sd.schemaDescription(), page.h1());
    }

    private static boolean nearDuplicate(Set<String> w, List<Set<String>> pool) {
        for (Set<String> p : pool) {
            if (SentenceDeduplicator.overlap(w, p) > SentenceDeduplicator.THRESHOLD) return true;
        }
        return false;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.strip();
        }
        return null;
    }
}
