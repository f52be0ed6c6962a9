package com.sitedigest.core.digest;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 다이제스트 1회 동안 누적되는 "이미 본 문장" 풀(단어 집합 목록).
 * 페이지 사이에서 공유되며 조립이 끝나면 버린다. 스레드 세이프 아님.
 */
public final class DedupState {
    private final List<Set<String>> seen;

    public DedupState() {
        this.seen = new ArrayList<>();
    }

    private DedupState(List<Set<String>> seen) {
        this.seen = new ArrayList<>(seen);
    }

    /** 기존 문장 중 하나라도 겹침 비율이 threshold 초과면 true */
    public boolean isNearDuplicate(Set<String> words, double threshold) {
        for (Set<String> s : seen) {
            if (SentenceDeduplicator.overlap(words, s) > threshold) return true;
        }
        return false;
    }

    public void add(Set<String> words) {
        seen.add(Set.copyOf(words));
    }

    public int size() { return seen.size(); }

    /** 독립 사본(원본 풀 불변) */
    public DedupState copy() {
        return new DedupState(seen);
    }
}
