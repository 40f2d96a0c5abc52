package com.pagelens.core.cache;

import com.pagelens.core.model.CacheEntry;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** 접근 순서 LRU. maxEntries 초과 시 가장 오래 안 쓴 엔트리부터 밀어낸다. */
public final class InMemoryResultCache implements ResultCache {

    private final int maxEntries;
    private final LinkedHashMap<String, CacheEntry> map;

    public InMemoryResultCache(int maxEntries) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1");
        this.maxEntries = maxEntries;
        this.map = new LinkedHashMap<>(16, 0.75f, true) {
            @Override protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                return size() > InMemoryResultCache.this.maxEntries;
            }
        };
    }

    @Override public synchronized Optional<CacheEntry> get(String fingerprint) {
        return Optional.ofNullable(map.get(fingerprint));
    }

    @Override public synchronized void put(CacheEntry entry) {
        map.put(entry.fingerprint(), entry);
    }

    @Override public synchronized boolean remove(String fingerprint) {
        return map.remove(fingerprint) != null;
    }

    @Override public synchronized boolean removeIfUnchanged(CacheEntry expected) {
        CacheEntry cur = map.get(expected.fingerprint());
        if (cur == null || !cur.sameVersion(expected)) return false;
        map.remove(expected.fingerprint());
        return true;
    }

    @Override public synchronized void clear() {
        map.clear();
    }

    @Override public synchronized int evictExpired(Instant now) {
        int n = 0;
        for (Iterator<CacheEntry> it = map.values().iterator(); it.hasNext(); ) {
            if (it.next().isExpired(now)) {
                it.remove();
                n++;
            }
        }
        return n;
    }

    @Override public synchronized int size() {
        return map.size();
    }

    public int getMaxEntries() { return maxEntries; }
}
