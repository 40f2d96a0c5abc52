package com.pagelens.core.util;

import java.time.Duration;

/** 재시도 대기 추상화(테스트에서 기록용 구현 주입) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    /** Thread.sleep 기반. 0 이하는 바로 반환 */
    Sleeper SYSTEM = d -> {
        long ms = (d == null) ? 0 : d.toMillis();
        if (ms > 0) Thread.sleep(ms);
    };
}
