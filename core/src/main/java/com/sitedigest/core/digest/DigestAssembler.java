package com.sitedigest.core.digest;

import com.sitedigest.core.model.CategorizedPage;
import com.sitedigest.core.model.CompanySignals;
import com.sitedigest.core.model.Digest;
import com.sitedigest.core.model.DigestBlock;
import com.sitedigest.core.model.DigestConfig;
import com.sitedigest.core.util.UrlUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 바이트 예산 안에서 다이제스트 조립.
 * <ol>
 *   <li>헤더(도메인, 사이트명, 태그라인, 제품, 페이지 수, 플래그)</li>
 *   <li>카테고리 rank → 크롤 순서로 정렬</li>
 *   <li>남은 예산 = 전체 − 헤더 − 구분자×페이지 수, 페이지당 몫 × 티어(1.4 / 1.0 / 0.7).
 *       몫은 아직 쓰지 않은 예산으로 상한</li>
 *   <li>블록이 몫을 넘으면 끝 50자씩 잘라 "..." 를 붙여 맞춘다</li>
 *   <li>그래도 전체가 넘으면 뒤(낮은 우선순위) 블록부터 버린다. 헤더는 유지</li>
 * </ol>
 * 문장 중복 제거 풀은 정렬 순서대로 누적되므로 상위 페이지가 내용을 온전히 유지한다.
 * 풀에는 잘리고 난 블록에 실제로 남은 문장만 들어간다.
 */
public final class DigestAssembler {

    public static final String ELLIPSIS = "...";
    static final int CUT_CHARS = 50;

    private final int maxBytes;
    private final int maxHeadings;
    private final SentenceDeduplicator sentences;
    private final SummarySelector summaries;
    private final SignalExtractor signals;

    public DigestAssembler(DigestConfig cfg) {
        this(cfg.output().getMaxOutputBytes(), cfg.output().getMaxHeadings());
    }

    public DigestAssembler(int maxBytes, int maxHeadings) {
        this(maxBytes, maxHeadings, new SentenceDeduplicator(), new SummarySelector(), new SignalExtractor());
    }

    public DigestAssembler(int maxBytes, int maxHeadings, SentenceDeduplicator sentences,
                           SummarySelector summaries, SignalExtractor signals) {
        this.maxBytes = Math.max(1, maxBytes);
        this.maxHeadings = Math.max(0, maxHeadings);
        this.sentences = Objects.requireNonNull(sentences, "sentences");
        this.summaries = Objects.requireNonNull(summaries, "summaries");
        this.signals = Objects.requireNonNull(signals, "signals");
    }

    /** pages 는 크롤 순서의 (중복 제거된) 분류 결과 */
    public Digest assemble(String domain, List<CategorizedPage> pages) {
        CompanySignals sig = signals.extract(pages);
        String header = renderHeader(domain, sig, pages.size());
        int headerBytes = bytes(header);
        int sepBytes = bytes(Digest.SEPARATOR);

        List<CategorizedPage> sorted = new ArrayList<>(pages);
        sorted.sort(Comparator.comparingInt((CategorizedPage p) -> p.category().rank())
                .thenComparingInt(CategorizedPage::crawlIndex));

        int remaining = Math.max(0, maxBytes - headerBytes - sepBytes * sorted.size());
        double share = sorted.isEmpty() ? 0 : (double) remaining / sorted.size();

        DedupState state = new DedupState();
        List<DigestBlock> blocks = new ArrayList<>();
        int left = remaining;
        for (int i = 0; i < sorted.size(); i++) {
            CategorizedPage p = sorted.get(i);
            // 티어 몫, 단 아직 안 쓴 예산을 넘지 않음
            int allowance = Math.min((int) Math.floor(share * tier(i)), left);
            List<String> kept = sentences.keep(state.copy(), summaries.summarize(p.page()));
            String text = fit(renderBlock(p, String.join(" ", kept)), allowance);
            if (text.isEmpty()) continue;
            // 잘린 뒤에도 남은 문장만 풀에 반영
            for (String s : kept) {
                if (text.contains(s)) state.add(SentenceDeduplicator.words(s));
            }
            int b = bytes(text);
            blocks.add(new DigestBlock(p.category(), UrlUtils.displayPath(p.url()), text, b));
            left -= b;
        }

        int total = total(headerBytes, sepBytes, blocks);
        while (total > maxBytes && !blocks.isEmpty()) {
            blocks.remove(blocks.size() - 1);
            total = total(headerBytes, sepBytes, blocks);
        }
        return new Digest(header, blocks, total);
    }

    static double tier(int index) {
        if (index < 3) return 1.4;
        if (index < 6) return 1.0;
        return 0.7;
    }

    String renderHeader(String domain, CompanySignals sig, int pageCount) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== SITE DIGEST: ").append(domain).append(" ===");
        if (!sig.siteName().isEmpty()) sb.append("\nName: ").append(sig.siteName());
        if (!sig.tagline().isEmpty()) sb.append("\nTagline: ").append(sig.tagline());
        if (!sig.products().isEmpty()) sb.append("\nProducts: ").append(String.join("; ", sig.products()));
        sb.append("\nPages: ").append(pageCount)
                .append(" | pricing: ").append(yesNo(sig.hasPricing()))
                .append(" | blog: ").append(yesNo(sig.hasBlog()))
                .append(" | careers: ").append(yesNo(sig.hasCareers()));
        return sb.toString();
    }

    /** [category] /path + 요약(문장 중복 제거 끝난 것) + 요약에 없는 헤딩 최대 N개 */
    String renderBlock(CategorizedPage p, String summary) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(p.category().slug()).append("] ").append(UrlUtils.displayPath(p.url()));

        if (!summary.isEmpty()) sb.append('\n').append(summary);

        String summaryLower = summary.toLowerCase(Locale.ROOT);
        Set<String> seen = new LinkedHashSet<>();
        for (String h : p.page().headings()) {
            if (seen.size() >= maxHeadings) break;
            String key = h.toLowerCase(Locale.ROOT);
            if (summaryLower.contains(key) || !seen.add(key)) continue;
            sb.append("\n- ").append(h);
        }
        return sb.toString();
    }

    /** allowance 이하가 될 때까지 끝 50자씩 자르고 "..." 부착. 못 맞추면 "" */
    static String fit(String text, int allowance) {
        if (bytes(text) <= allowance) return text;
        // UTF-8 바이트 수 >= 문자 수
        int head = Math.min(text.length(), Math.max(0, allowance));
        if (head > 0 && head < text.length() && Character.isLowSurrogate(text.charAt(head))) head--;
        String core = text.substring(0, head);
        while (!core.isEmpty()) {
            int cut = Math.max(0, core.length() - CUT_CHARS);
            if (cut > 0 && Character.isLowSurrogate(core.charAt(cut))) cut--;
            core = core.substring(0, cut).stripTrailing();
            if (core.isEmpty()) break;
            String candidate = core + ELLIPSIS;
            if (bytes(candidate) <= allowance) return candidate;
        }
        return "";
    }

    private static int total(int headerBytes, int sepBytes, List<DigestBlock> blocks) {
        int t = headerBytes;
        for (DigestBlock b : blocks) t += sepBytes + b.byteLength();
        return t;
    }

    static int bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static String yesNo(boolean b) { return b ? "yes" : "no"; }
}
