package com.sitedigest.core.model;

import java.util.List;

/**
 * 조립된 다이제스트: 헤더 + 우선순위 순 블록.
 * content() 는 헤더와 각 블록을 SEPARATOR 로 이어 붙인 최종 텍스트.
 */
public record Digest(String header, List<DigestBlock> blocks, int totalBytes) {
    public static final String SEPARATOR = "\n\n";

    public Digest {
        header = header == null ? "" : header;
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public String content() {
        StringBuilder sb = new StringBuilder(header);
        for (DigestBlock b : blocks) sb.append(SEPARATOR).append(b.text());
        return sb.toString();
    }
}
