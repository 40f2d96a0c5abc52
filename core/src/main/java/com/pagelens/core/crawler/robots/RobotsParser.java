package com.pagelens.core.crawler.robots;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 파서
 * - 지원 지시어: User-agent / Allow / Disallow / Crawl-delay (키 대소문자 무시)
 * - 연속된 User-agent 라인은 같은 그룹, 그 뒤 규칙 누적
 * - UA 키는 소문자로 저장
 */
public final class RobotsParser {

    private RobotsParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");
    static final String UA_ALL = "*";

    public static ParsedRobots parse(String robotsTxt) {
        if (robotsTxt == null) robotsTxt = "";

        Map<String, RobotsRules> byUa = new LinkedHashMap<>();
        List<String> currentAgents = new ArrayList<>();
        boolean lastWasUA = false;

        for (String rawLine : robotsTxt.split("\\r?\\n")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            switch (key) {
                case "user-agent" -> {
                    String ua = (val.isEmpty() ? UA_ALL : val).toLowerCase(Locale.ROOT);
                    if (!lastWasUA) currentAgents = new ArrayList<>(); // 새 그룹 시작
                    currentAgents.add(ua);
                    byUa.putIfAbsent(ua, new RobotsRules());
                    lastWasUA = true;
                }
                case "allow" -> {
                    ensureAgents(currentAgents, byUa);
                    for (String ua : currentAgents) byUa.get(ua).addAllow(val);
                    lastWasUA = false;
                }
                case "disallow" -> {
                    ensureAgents(currentAgents, byUa);
                    for (String ua : currentAgents) byUa.get(ua).addDisallow(val);
                    lastWasUA = false;
                }
                case "crawl-delay" -> {
                    ensureAgents(currentAgents, byUa);
                    Double d = parseDelay(val);
                    if (d != null) for (String ua : currentAgents) byUa.get(ua).crawlDelay(d);
                    lastWasUA = false;
                }
                default -> lastWasUA = false; // Sitemap 등 기타 지시어 무시
            }
        }
        return new ParsedRobots(byUa);
    }

    private static Double parseDelay(String v) {
        try {
            double d = Double.parseDouble(v);
            return (d >= 0) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void ensureAgents(List<String> currentAgents, Map<String, RobotsRules> byUa) {
        if (currentAgents.isEmpty()) {
            currentAgents.add(UA_ALL);
            byUa.putIfAbsent(UA_ALL, new RobotsRules());
        }
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }

    /** UA(소문자) → 규칙 */
    public record ParsedRobots(Map<String, RobotsRules> byUa) {

        /**
         * UA 문자열에 그룹 이름이 포함되면 그 그룹(가장 긴 이름 우선), 없으면 "*" 그룹, 그것도 없으면 빈 규칙.
         * 예: "Mozilla/5.0 (compatible; PageLens/1.0)" → "pagelens" 그룹
         */
        public RobotsRules selectFor(String userAgent) {
            String ua = (userAgent == null) ? "" : userAgent.toLowerCase(Locale.ROOT);
            String best = null;
            for (String name : byUa.keySet()) {
                if (name.equals(UA_ALL)) continue;
                if (ua.contains(name) && (best == null || name.length() > best.length())) best = name;
            }
            if (best != null) return byUa.get(best);
            RobotsRules star = byUa.get(UA_ALL);
            return (star != null) ? star : new RobotsRules();
        }
    }
}
