package com.sitedigest.core.extract;

import com.sitedigest.core.model.ExtractedPage;
import com.sitedigest.core.model.StructuredData;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 파싱된 문서 1건 → ExtractedPage.
 * 순서: 메타데이터(JSON-LD/OG) 먼저 → 작업 사본에서 노이즈 제거 → main/article/body 본문.
 * title/h1/meta/headings 는 normalize 만, 본문은 보일러플레이트 제거까지.
 */
public final class PageExtractor {

    /** 본문 렌더링용 노이즈 요소 */
    static final String NOISE_TAGS = "script, style, nav, footer, aside, header, noscript";
    static final String NOISE_MARKERS = String.join(", ",
            "[role=navigation]", "[role=banner]", "[role=contentinfo]",
            "[class*=cookie]", "[id*=cookie]",
            "[class*=banner]", "[class*=popup]", "[class*=modal]",
            "[class*=mega-menu]", "[class*=nav-]", "[class*=dropdown-menu]");

    private final StructuredDataExtractor structuredData;

    public PageExtractor() {
        this(new StructuredDataExtractor());
    }

    public PageExtractor(StructuredDataExtractor structuredData) {
        this.structuredData = Objects.requireNonNull(structuredData, "structuredData");
    }

    public ExtractedPage extract(Document doc, String url) {
        Objects.requireNonNull(doc, "doc");
        Objects.requireNonNull(url, "url");

        StructuredData sd = structuredData.extract(doc);

        String title = TextNormalizer.normalize(doc.title());
        String meta = attr(doc.selectFirst("meta[name=description]"), "content");
        Element h1El = doc.selectFirst("h1");
        String h1 = h1El == null ? "" : TextNormalizer.normalize(h1El.text());

        List<String> headings = new ArrayList<>();
        for (Element h : doc.select("h2, h3")) {
            String t = TextNormalizer.normalize(h.text());
            if (!t.isEmpty()) headings.add(t);
        }

        Document work = doc.clone();
        work.select(NOISE_TAGS).remove();
        work.select(NOISE_MARKERS).remove();

        Element main = work.selectFirst("main");
        if (main == null) main = work.selectFirst("article");
        if (main == null) main = work.body();
        String text = (main == null) ? "" : TextNormalizer.clean(main.text());

        return new ExtractedPage(url, title, meta, h1, headings, text, sd);
    }

    private static String attr(Element el, String name) {
        return el == null ? "" : TextNormalizer.normalize(el.attr(name));
    }
}
