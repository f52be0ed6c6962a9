package com.sitedigest.core.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 텍스트 정규화 + 보일러플레이트 제거. 순수 함수, 패턴은 클래스 로딩 시 한 번만 컴파일.
 *
 * normalize 순서: 보이지 않는 문자 → 공백, 가로 공백 축소, 빈 줄 축소, 스크립트 잔재 제거, trim.
 * removeBoilerplate: 줄 단위(문장 단위로 쪼개서 80자 미만 CTA 문장 제거) → 인라인 CTA 제거.
 */
public final class TextNormalizer {

    private TextNormalizer() {}

    /** 짧은 줄/문장을 버리는 기준 길이 */
    public static final int SHORT_LINE_CHARS = 80;

    private static final Pattern INVISIBLE = Pattern.compile("[\\u200b\\u200c\\u200d\\u2060\\ufeff\\u200e\\u200f\\u00ad]");
    private static final Pattern HORIZONTAL_WS = Pattern.compile("[ \\t\\u00a0]+");
    private static final Pattern CRLF = Pattern.compile("\r\n?");
    private static final Pattern BLANK_LINES = Pattern.compile("\n[ \t]*\n+");
    private static final Pattern UNDEFINED = Pattern.compile("\\bundefined\\b");
    private static final Pattern BARE_NULL = Pattern.compile("\\bnull\\b(?!\\s+(?:and|or|pointer|value|check|safety))");
    private static final Pattern SPACE_BEFORE_NL = Pattern.compile(" *\n *");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    /** 줄 단위 제거 대상(소문자) */
    public static final List<String> BOILERPLATE_PHRASES = List.of(
            "get started", "learn more", "read more", "sign up", "start free trial",
            "book a demo", "request a demo", "schedule a demo", "try for free",
            "contact sales", "talk to sales", "watch demo", "see it in action",
            "start now", "join now", "subscribe now", "download now",
            "accept all cookies", "cookie policy", "we use cookies", "accept cookies",
            "manage cookies", "cookie settings",
            "skip to main content", "skip to footer", "skip to navigation", "skip to content",
            "toggle navigation", "close menu", "open menu",
            "register now", "sign in", "log in", "create account");

    private static final List<Pattern> BOILERPLATE_PATTERNS = compileWordPatterns(BOILERPLATE_PHRASES);

    /** 문장 중간에 박힌 단독 CTA */
    private static final Pattern INLINE_CTA = Pattern.compile(
            "\\b(?:Get Started|Learn More|Read More|Sign Up|Book a Demo|Request a Demo|Register Now|"
                    + "Start Free Trial|Try for Free|Contact Sales|Talk to Sales|Watch Demo|See it in Action|"
                    + "Download Now|Subscribe Now|Start Now|Join Now|"
                    + "Skip to main content|Skip to footer|Skip to navigation|Skip to content)\\b",
            Pattern.CASE_INSENSITIVE);

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";
        String s = INVISIBLE.matcher(text).replaceAll(" ");
        s = HORIZONTAL_WS.matcher(s).replaceAll(" ");
        s = CRLF.matcher(s).replaceAll("\n");
        s = BLANK_LINES.matcher(s).replaceAll("\n");
        s = UNDEFINED.matcher(s).replaceAll("");
        s = BARE_NULL.matcher(s).replaceAll("");
        // 잔재 제거로 생긴 이중 공백
        s = HORIZONTAL_WS.matcher(s).replaceAll(" ");
        return s.strip();
    }

    /** normalize 결과에 적용 */
    public static String removeBoilerplate(String text) {
        if (text == null || text.isEmpty()) return "";
        List<String> kept = new ArrayList<>();
        for (String line : text.split("\n")) {
            String l = line.strip();
            if (l.isEmpty()) continue;
            List<String> units = new ArrayList<>();
            for (String unit : splitSentences(l)) {
                if (!isBoilerplate(unit)) units.add(unit);
            }
            if (!units.isEmpty()) kept.add(String.join(" ", units));
        }
        String s = String.join("\n", kept);
        s = INLINE_CTA.matcher(s).replaceAll("");
        s = HORIZONTAL_WS.matcher(s).replaceAll(" ");
        s = SPACE_BEFORE_NL.matcher(s).replaceAll("\n");
        return s.strip();
    }

    /** normalize + removeBoilerplate */
    public static String clean(String text) {
        return removeBoilerplate(normalize(text));
    }

    /** 80자 미만이면서 문구와 같거나(단어 경계로) 포함하면 보일러플레이트 */
    public static boolean isBoilerplate(String unit) {
        if (unit == null) return false;
        String lower = unit.strip().toLowerCase(Locale.ROOT);
        if (lower.isEmpty()) return false;
        if (BOILERPLATE_PHRASES.contains(lower)) return true;
        if (lower.length() >= SHORT_LINE_CHARS) return false;
        for (Pattern p : BOILERPLATE_PATTERNS) {
            if (p.matcher(lower).find()) return true;
        }
        return false;
    }

    /** 문장 종결부호(.!?) + 공백 기준 분할. 빈 조각은 버림 */
    public static List<String> splitSentences(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;
        for (String s : SENTENCE_END.split(text.strip())) {
            String t = s.strip();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static List<Pattern> compileWordPatterns(List<String> phrases) {
        List<Pattern> out = new ArrayList<>(phrases.size());
        for (String p : phrases) out.add(Pattern.compile("\\b" + Pattern.quote(p) + "\\b"));
        return List.copyOf(out);
    }
}
