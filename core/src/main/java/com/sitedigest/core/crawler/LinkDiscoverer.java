package com.sitedigest.core.crawler;

import com.sitedigest.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 내비게이션 영역(nav/header/role=navigation|banner)의 a[href] 수집.
 * 영역에서 링크가 하나도 안 나오면 문서 전체 a[href] 로 대체.
 * fragment/끝 슬래시 제거, http(s) + 동일 오리진만, 발견 순서 유지.
 */
public final class LinkDiscoverer {

    private static final Logger LOG = LoggerFactory.getLogger(LinkDiscoverer.class);
    static final String NAV_REGIONS = "nav, header, [role=navigation], [role=banner]";

    public List<URI> discover(Document doc, URI base) {
        if (doc == null || base == null) return List.of();

        Map<String, URI> out = new LinkedHashMap<>();
        for (Element region : doc.select(NAV_REGIONS)) {
            collect(region.select("a[href]"), base, out);
        }
        if (out.isEmpty()) {
            collect(doc.select("a[href]"), base, out);
        }
        return new ArrayList<>(out.values());
    }

    private static void collect(Elements anchors, URI base, Map<String, URI> out) {
        for (Element a : anchors) {
            URI u = resolve(base, a.attr("href"));
            if (u == null) continue;
            if (!UrlUtils.isHttp(u) || !UrlUtils.sameOrigin(base, u)) continue;
            URI n = UrlUtils.normalize(u);
            out.putIfAbsent(n.toString(), n);
        }
    }

    private static URI resolve(URI base, String href) {
        if (href == null) return null;
        String h = href.strip();
        int hash = h.indexOf('#');
        if (hash >= 0) h = h.substring(0, hash);
        if (h.isEmpty()) return null;
        h = h.replace(" ", "%20");
        try {
            return UrlUtils.resolve(base, h);
        } catch (IllegalArgumentException e) {
            LOG.debug("Skipping unparseable href '{}': {}", href, e.getMessage());
            return null;
        }
    }
}
