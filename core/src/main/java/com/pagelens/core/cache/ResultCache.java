package com.pagelens.core.cache;

import com.pagelens.core.model.CacheEntry;

import java.time.Instant;
import java.util.Optional;

/**
 * 캐시 저장소 SPI. 만료 판정은 호출자(AnalysisCache) 몫이고 백엔드는 엔트리를 그대로 보관한다.
 * 모든 메서드는 실패 시 CacheBackendException을 던질 수 있다.
 */
public interface ResultCache {
    Optional<CacheEntry> get(String fingerprint);

    /** 같은 fingerprint가 있으면 통째로 교체 */
    void put(CacheEntry entry);

    boolean remove(String fingerprint);

    /** 저장된 엔트리가 아직 expected와 같은 버전일 때만 삭제. 그 사이 교체됐으면 그대로 둔다. */
    boolean removeIfUnchanged(CacheEntry expected);

    void clear();

    /** now 기준 만료된 엔트리 삭제, 삭제 수 반환 */
    int evictExpired(Instant now);

    int size();
}
