package com.sitedigest.core.digest;

import com.sitedigest.core.extract.TextNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 문장 단위 중복 제거.
 * 겹침 비율 = |A ∩ B| / min(|A|, |B|) (소문자 단어 집합). 0.5 초과면 버리고,
 * 살아남은 문장은 풀에 추가한다(같은 페이지 안에서도 즉시 반영).
 */
public final class SentenceDeduplicator {

    public static final double THRESHOLD = 0.5;

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    /** 살아남은 문장 목록(원문 순서) */
    public List<String> keep(DedupState state, String text) {
        List<String> kept = new ArrayList<>();
        for (String sentence : TextNormalizer.splitSentences(text)) {
            Set<String> w = words(sentence);
            if (w.isEmpty()) continue;
            if (state.isNearDuplicate(w, THRESHOLD)) continue;
            state.add(w);
            kept.add(sentence);
        }
        return kept;
    }

    public static Set<String> words(String sentence) {
        Set<String> out = new LinkedHashSet<>();
        if (sentence == null) return out;
        for (String t : NON_WORD.split(sentence.toLowerCase(Locale.ROOT))) {
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /** 한쪽이라도 비면 0 */
    public static double overlap(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> small = a.size() <= b.size() ? a : b;
        Set<String> large = small == a ? b : a;
        int common = 0;
        for (String w : small) {
            if (large.contains(w)) common++;
        }
        return (double) common / small.size();
    }
}
