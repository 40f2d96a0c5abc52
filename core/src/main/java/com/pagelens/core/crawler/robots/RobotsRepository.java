package com.pagelens.core.crawler.robots;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 호스트별 robots 정책 캐시.
 * - 성공(2xx) TTL 30분, 실패(allow-all) TTL 10분 기본
 * - 같은 호스트 리다이렉트만 최대 3회 추적
 * - 같은 키를 동시에 조회하면 한 번만 가져온다(키 단위 잠금)
 */
public final class RobotsRepository {
    private static final Logger LOG = LoggerFactory.getLogger(RobotsRepository.class);

    public static final Duration DEFAULT_SUCCESS_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_FAILURE_TTL = Duration.ofMinutes(10);
    private static final int MAX_REDIRECTS = 3;

    private final RobotsFetcher fetcher;
    private final RobotsClock clock;
    private final Map<String, Entry> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    private final Duration successTtl;
    private final Duration failureTtl;

    public RobotsRepository(RobotsFetcher fetcher, RobotsClock clock) {
        this(fetcher, clock, DEFAULT_SUCCESS_TTL, DEFAULT_FAILURE_TTL);
    }

    public RobotsRepository(RobotsFetcher fetcher, RobotsClock clock,
                            Duration successTtl, Duration failureTtl) {
        this.fetcher = Objects.requireNonNull(fetcher);
        this.clock = Objects.requireNonNull(clock);
        this.successTtl = (successTtl == null ? DEFAULT_SUCCESS_TTL : successTtl);
        this.failureTtl = (failureTtl == null ? DEFAULT_FAILURE_TTL : failureTtl);
    }

    /** host:port 키 (포트 없으면 스킴 기본포트) */
    static String cacheKey(URI pageUri) {
        String scheme = Optional.ofNullable(pageUri.getScheme()).orElse("https").toLowerCase(Locale.ROOT);
        String host = Optional.ofNullable(pageUri.getHost()).orElse("").toLowerCase(Locale.ROOT);
        int port = pageUri.getPort();
        if (port < 0) port = scheme.equals("http") ? 80 : 443;
        return host + ":" + port;
    }

    /** pageUri 기준 정책(캐시 사용). 실패 시 allow-all */
    public RobotsPolicy policyFor(URI pageUri, String userAgent) {
        String key = cacheKey(pageUri);
        Entry e = cache.get(key);
        if (e != null && e.expiresAt > clock.nowMillis()) return e.policy;

        Object lock = locks.computeIfAbsent(key, k -> new Object());
        synchronized (lock) {
            long now = clock.nowMillis();
            e = cache.get(key);
            if (e != null && e.expiresAt > now) return e.policy;

            RobotsPolicy policy = fetchAndBuildPolicy(pageUri, userAgent);
            long ttlMs = policy.isAllowAll() ? failureTtl.toMillis() : successTtl.toMillis();
            cache.put(key, new Entry(policy, now + ttlMs));
            return policy;
        }
    }

    public void clear() {
        cache.clear();
    }

    int size() {
        return cache.size();
    }

    private RobotsPolicy fetchAndBuildPolicy(URI pageUri, String userAgent) {
        String scheme = Optional.ofNullable(pageUri.getScheme()).orElse("").toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return RobotsPolicy.allowAll();

        URI robots = robotsTxtUri(pageUri);
        if (robots == null) return RobotsPolicy.allowAll();

        URI cur = robots;
        for (int i = 0; i <= MAX_REDIRECTS; i++) {
            RobotsFetcher.Response r = fetcher.fetch(cur);
            if (r.isNetworkFailure()) {
                LOG.debug("robots fetch failed {}: {}", cur, r.error());
                return RobotsPolicy.allowAll();
            }
            int s = r.status();
            if (s >= 200 && s < 300) {
                return RobotsPolicy.parse(r.body(), userAgent);
            }
            URI next = r.finalUri();
            if (isRedirect(s) && next != null && !next.equals(cur)) {
                if (!sameHost(cur, next)) return RobotsPolicy.allowAll(); // 크로스-호스트
                cur = next;
                continue;
            }
            // 404/410/5xx/기타
            return RobotsPolicy.allowAll();
        }
        return RobotsPolicy.allowAll(); // too many redirects
    }

    private static boolean isRedirect(int s) {
        return s == 301 || s == 302 || s == 307 || s == 308;
    }

    private static boolean sameHost(URI a, URI b) {
        String ha = Optional.ofNullable(a.getHost()).orElse("").toLowerCase(Locale.ROOT);
        String hb = Optional.ofNullable(b.getHost()).orElse("").toLowerCase(Locale.ROOT);
        return ha.equals(hb);
    }

    static URI robotsTxtUri(URI page) {
        String host = page.getHost();
        if (host == null || host.isEmpty()) return null;
        String scheme = Optional.ofNullable(page.getScheme()).orElse("https");
        int port = page.getPort();
        String authority = (port < 0) ? host : host + ":" + port;
        return URI.create(scheme + "://" + authority + "/robots.txt");
    }

    private record Entry(RobotsPolicy policy, long expiresAt) {}
}
