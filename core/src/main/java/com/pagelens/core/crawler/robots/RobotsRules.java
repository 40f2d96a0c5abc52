package com.pagelens.core.crawler.robots;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** User-agent 그룹 하나의 규칙 묶음 */
public final class RobotsRules {
    private final List<String> allow = new ArrayList<>();
    private final List<String> disallow = new ArrayList<>();
    private Double crawlDelaySeconds;

    RobotsRules addAllow(String path) {
        if (path != null && !path.isBlank()) allow.add(RobotsMatcher.normalizeRule(path));
        return this;
    }

    RobotsRules addDisallow(String path) {
        // Disallow: (빈값) 은 규칙으로 취급하지 않음
        if (path != null && !path.isBlank()) disallow.add(RobotsMatcher.normalizeRule(path));
        return this;
    }

    RobotsRules crawlDelay(Double seconds) {
        this.crawlDelaySeconds = seconds;
        return this;
    }

    public List<String> allow() { return Collections.unmodifiableList(allow); }
    public List<String> disallow() { return Collections.unmodifiableList(disallow); }
    /** Crawl-delay(초). 없으면 null */
    public Double crawlDelaySeconds() { return crawlDelaySeconds; }
}
