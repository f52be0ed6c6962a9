package com.sitedigest.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + same-origin 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 끝 슬래시 제거("/" 루트는 빈 경로), 중복 슬래시 축소
     * - query 는 그대로 유지
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "https" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = effectivePort(scheme, u.getPort());
        if (port == defaultPort(scheme)) port = -1;

        String path = (u.getPath() == null) ? "" : u.getPath().replaceAll("/{2,}", "/");
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);

        try {
            return new URI(scheme, null, host, port, path, u.getQuery(), null);
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /** 중복 판정 키: 정규화 URL 문자열 */
    public static String key(URI u) {
        URI n = normalize(u);
        return n == null ? "" : n.toString();
    }

    /** 문자열 URL 파싱 + 정규화. 파싱 불가면 null. */
    public static URI parseNormalized(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return normalize(new URI(raw.trim()));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** scheme + host + 실효 포트가 모두 같으면 동일 오리진 */
    public static boolean sameOrigin(URI a, URI b) {
        if (a == null || b == null) return false;
        String sa = a.getScheme() == null ? "" : a.getScheme().toLowerCase(Locale.ROOT);
        String sb = b.getScheme() == null ? "" : b.getScheme().toLowerCase(Locale.ROOT);
        if (!sa.equals(sb)) return false;
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return ha.equals(hb) && effectivePort(sa, a.getPort()) == effectivePort(sb, b.getPort());
    }

    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme().toLowerCase(Locale.ROOT);
        return s.equals("http") || s.equals("https");
    }

    /** scheme://authority (경로 없음) */
    public static URI siteRoot(URI u) {
        URI n = normalize(u);
        try {
            return new URI(n.getScheme(), null, n.getHost(), n.getPort(), "", null, null);
        } catch (URISyntaxException e) {
            return n;
        }
    }

    /**
     * base 기준 상대 참조 해석. 경로가 빈 base 는 "/" 로 보정한다
     * (URI.resolve 는 빈 경로 base 에서 "http://a.comb" 처럼 이어 붙임).
     */
    public static URI resolve(URI base, String ref) {
        URI b = base;
        if (b.getRawPath() == null || b.getRawPath().isEmpty()) {
            b = URI.create(b.getScheme() + "://" + b.getRawAuthority() + "/"
                    + (b.getRawQuery() != null ? "?" + b.getRawQuery() : ""));
        }
        return b.resolve(ref);
    }

    /** 표시용 경로: 비어 있으면 "/" */
    public static String displayPath(String url) {
        URI u = parseNormalized(url);
        String p = (u == null || u.getPath() == null) ? "" : u.getPath();
        return p.isEmpty() ? "/" : p;
    }

    /** 분류용 경로: 소문자, 앞뒤 슬래시 제거 */
    public static String classifierPath(String url) {
        URI u = parseNormalized(url);
        String p = (u == null || u.getPath() == null) ? "" : u.getPath().toLowerCase(Locale.ROOT);
        int s = 0, e = p.length();
        while (s < e && p.charAt(s) == '/') s++;
        while (e > s && p.charAt(e - 1) == '/') e--;
        return p.substring(s, e);
    }

    private static int effectivePort(String scheme, int port) {
        return port == -1 ? defaultPort(scheme) : port;
    }

    private static int defaultPort(String scheme) {
        if ("http".equals(scheme)) return 80;
        if ("https".equals(scheme)) return 443;
        return -1;
    }
}
