package com.pagelens.core.http;

import java.time.Duration;

/** 수집 실패 1건에 대해 재시도 여부와 대기 시간을 정한다 */
public interface RetryPolicy {
    /** attempt는 방금 실패한 시도 번호(1부터). true면 nextDelay 후 다시 보낸다. */
    boolean shouldRetry(CollectionException failure, int attempt);

    Duration nextDelay(int attempt);

    /** 첫 시도 포함 최대 시도 횟수 */
    int maxAttempts();
}
