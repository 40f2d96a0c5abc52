package com.pagelens.core.crawler.robots;

import java.net.URI;
import java.util.Objects;

/**
 * 호스트 하나에 대해 선택된 robots 규칙.
 * - UA 선택: UA 문자열에 그룹 이름이 포함되면 해당 그룹, 없으면 '*' 그룹
 * - robots.txt 없음/실패 시 allowAll()
 */
public final class RobotsPolicy {

    private static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(new RobotsRules(), true);

    private final RobotsRules rules;
    private final boolean allowAll;

    private RobotsPolicy(RobotsRules rules, boolean allowAll) {
        this.rules = Objects.requireNonNull(rules);
        this.allowAll = allowAll;
    }

    public static RobotsPolicy parse(String robotsTxt, String userAgent) {
        RobotsParser.ParsedRobots parsed = RobotsParser.parse(robotsTxt);
        return new RobotsPolicy(parsed.selectFor(userAgent), false);
    }

    public static RobotsPolicy allowAll() {
        return ALLOW_ALL;
    }

    public boolean allow(URI url) {
        if (allowAll) return true;
        return RobotsMatcher.isAllowed(url, rules);
    }

    /** 선택된 그룹의 Crawl-delay(초), 없으면 null */
    public Double crawlDelaySeconds() {
        return rules.crawlDelaySeconds();
    }

    public boolean isAllowAll() {
        return allowAll;
    }
}
