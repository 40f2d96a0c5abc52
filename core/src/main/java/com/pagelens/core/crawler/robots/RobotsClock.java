package com.pagelens.core.crawler.robots;

/** robots 캐시 TTL 판정용 시계(테스트에서 고정 시계 주입) */
@FunctionalInterface
public interface RobotsClock {
    long nowMillis();

    RobotsClock SYSTEM = System::currentTimeMillis;
}
