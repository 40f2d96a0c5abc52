package com.pagelens.core.model;

import java.time.Instant;
import java.util.Objects;

/** 캐시 엔트리(불변). 갱신은 통째 교체, 부분 수정 없음. */
public record CacheEntry(String fingerprint, AnalysisResult payload, Instant createdAt, Instant expiresAt) {

    public CacheEntry {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be >= createdAt");
        }
    }

    /** 같은 저장 시점의 엔트리인지(payload 비교 없이 createdAt/expiresAt로 판정) */
    public boolean sameVersion(CacheEntry other) {
        return other != null && fingerprint.equals(other.fingerprint)
                && createdAt.equals(other.createdAt) && expiresAt.equals(other.expiresAt);
    }

    /** expiresAt 시점 포함 이후는 만료로 본다. */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
