package com.pagelens.core.crawler.robots;

import java.net.URI;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 경로 기준 매칭:
 * - 쿼리 무시, rawPath 사용, 퍼센트 인코딩 HEX 대문자 통일(디코드하지 않음)
 * 우선순위:
 *  (1) 더 긴 규칙이 승('*'와 끝의 '$'는 길이 미산입)
 *  (2) 길이 같으면 Allow 우선
 * 패턴: '*' 임의 길이, 끝의 '$'는 경로 끝 고정, 그 외 접두 매칭
 */
public final class RobotsMatcher {
    private RobotsMatcher() {}

    /** 규칙 매치가 없으면 허용 */
    public static boolean isAllowed(URI url, RobotsRules rules) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(rules, "rules");

        String path = normalizePath(url);
        String best = null;
        boolean bestAllow = true;

        for (String r : rules.disallow()) {
            if (matches(path, r) && (best == null || effectiveLen(r) > effectiveLen(best))) {
                best = r;
                bestAllow = false;
            }
        }
        for (String r : rules.allow()) {
            if (!matches(path, r)) continue;
            // 같은 길이면 Allow 우선
            if (best == null || effectiveLen(r) >= effectiveLen(best)) {
                best = r;
                bestAllow = true;
            }
        }
        return best == null || bestAllow;
    }

    /** 룰 문자열 정규화(퍼센트 HEX 대문자). '$'는 보존 */
    static String normalizeRule(String rule) {
        if (rule == null) return "";
        String r = rule.trim();
        if (r.isEmpty()) return r;
        boolean endsWithDollar = r.endsWith("$");
        if (endsWithDollar) r = r.substring(0, r.length() - 1);
        r = uppercasePctHex(r);
        return endsWithDollar ? (r + "$") : r;
    }

    static boolean matches(String path, String rule) {
        if (rule == null || rule.isEmpty()) return false;

        String r = rule;
        boolean endsWithDollar = r.endsWith("$");
        if (endsWithDollar) r = r.substring(0, r.length() - 1);

        if (r.indexOf('*') >= 0) {
            String regex = "^" + toRegexKeepingStar(r) + (endsWithDollar ? "$" : ".*");
            return Pattern.compile(regex).matcher(path).matches();
        }
        if (endsWithDollar) return path.equals(r);
        return path.startsWith(r);
    }

    private static String toRegexKeepingStar(String s) {
        StringBuilder sb = new StringBuilder();
        for (String part : s.split("\\*", -1)) {
            if (sb.length() > 0 || s.startsWith("*")) sb.append(".*");
            sb.append(Pattern.quote(part));
        }
        return sb.toString();
    }

    /** URL 경로 정규화: rawPath + 퍼센트 HEX 대문자화 */
    static String normalizePath(URI uri) {
        String rawPath = uri.getRawPath();
        if (rawPath == null || rawPath.isEmpty()) rawPath = "/";
        return uppercasePctHex(rawPath);
    }

    static String uppercasePctHex(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                out.append('%')
                   .append(Character.toUpperCase(s.charAt(i + 1)))
                   .append(Character.toUpperCase(s.charAt(i + 2)));
                i += 2;
                continue;
            }
            out.append(ch);
        }
        return out.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /** 우선순위 길이: 끝의 '$' 제외, '*' 미산입 */
    static int effectiveLen(String raw) {
        int end = raw.endsWith("$") ? raw.length() - 1 : raw.length();
        int score = 0;
        for (int i = 0; i < end; i++) {
            if (raw.charAt(i) != '*') score++;
        }
        return score;
    }
}
