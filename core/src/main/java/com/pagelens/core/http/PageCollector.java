package com.pagelens.core.http;

import com.pagelens.core.api.ICollector;
import com.pagelens.core.crawler.robots.HttpRobotsFetcher;
import com.pagelens.core.crawler.robots.RobotsClock;
import com.pagelens.core.crawler.robots.RobotsFetcher;
import com.pagelens.core.crawler.robots.RobotsPolicy;
import com.pagelens.core.crawler.robots.RobotsRepository;
import com.pagelens.core.model.CollectorConfig;
import com.pagelens.core.model.RawDocument;
import com.pagelens.core.util.RateLimiter;
import com.pagelens.core.util.Sleeper;
import com.pagelens.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * robots 확인 → 토큰 버킷 → 전송 → (429/5xx/네트워크 오류면) 백오프 후 재시도.
 * 레이트리미터와 robots 캐시는 인스턴스 하나에 하나씩이며 모든 워커가 공유한다.
 */
public class PageCollector implements ICollector {
    private static final Logger LOG = LoggerFactory.getLogger(PageCollector.class);
    private static final StructuredLog SLOG = StructuredLog.get(PageCollector.class);

    static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("host", "connection", "content-length", "expect", "upgrade");

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        Response send(HttpRequest req, CollectorConfig config) throws IOException, InterruptedException;
    }

    /** 송신 결과. body는 max_body_bytes 이내로 잘린 상태여야 한다. */
    public record Response(int status, Map<String, List<String>> headers, byte[] body,
                           URI finalUri, boolean truncated) {
        public Response {
            headers = (headers == null) ? Map.of() : headers;
            body = (body == null) ? new byte[0] : body;
        }

        public static Response of(int status, Map<String, List<String>> headers, String body) {
            return new Response(status, headers, body == null ? null : body.getBytes(StandardCharsets.UTF_8), null, false);
        }

        String firstHeader(String name) {
            for (Map.Entry<String, List<String>> e : headers.entrySet()) {
                if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                    return e.getValue().get(0);
                }
            }
            return null;
        }
    }

    private final CollectorConfig baseConfig;
    private final HttpSender sender;
    private final RobotsRepository robots;
    private final RateLimiter limiter;
    private final Sleeper sleeper;
    private final RobotsClock clock;

    private final Map<ClientKey, HttpClient> clients = new ConcurrentHashMap<>();

    private final AtomicLong fetchCalls = new AtomicLong();
    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();

    public PageCollector(CollectorConfig baseConfig) {
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
        this.limiter = new RateLimiter(baseConfig.getBurst(), baseConfig.getRequestsPerSecond());
        this.sender = this::sendWithClient;
        this.sleeper = Sleeper.SYSTEM;
        this.clock = RobotsClock.SYSTEM;
        HttpClient robotsClient = newClient(baseConfig.isVerifySsl(), false, baseConfig.getTimeout());
        this.robots = new RobotsRepository(
                throttled(new HttpRobotsFetcher(robotsClient, baseConfig.getUserAgent(), baseConfig.getTimeout())),
                clock, baseConfig.getRobotsCacheTtl(), RobotsRepository.DEFAULT_FAILURE_TTL);
    }

    /** 테스트용 생성자(송신 훅/robots 수집기/슬리퍼/시계 주입) */
    public PageCollector(CollectorConfig baseConfig, HttpSender sender, RobotsFetcher robotsFetcher,
                         Sleeper sleeper, RobotsClock clock) {
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig");
        this.limiter = new RateLimiter(baseConfig.getBurst(), baseConfig.getRequestsPerSecond());
        this.sender = Objects.requireNonNull(sender, "sender");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.robots = new RobotsRepository(throttled(Objects.requireNonNull(robotsFetcher, "robotsFetcher")),
                clock, baseConfig.getRobotsCacheTtl(), RobotsRepository.DEFAULT_FAILURE_TTL);
    }

    @Override
    public RawDocument fetch(URI url, CollectorConfig config) throws CollectionException {
        Objects.requireNonNull(url, "url");
        CollectorConfig cfg = (config == null) ? baseConfig : config;
        fetchCalls.incrementAndGet();

        if (cfg.isRespectRobots()) {
            RobotsPolicy policy = robots.policyFor(url, cfg.getUserAgent());
            if (!policy.allow(url)) {
                SLOG.info("robots-disallowed", "url", url);
                throw CollectionException.robotsDisallowed(url);
            }
        }

        HttpRequest req = buildRequest(url, cfg);
        RetryPolicy policy = DefaultRetryPolicy.from(cfg);
        int attempt = 1;
        try {
            while (true) {
                limiter.acquire();
                attempts.incrementAndGet();
                long start = System.nanoTime();

                CollectionException failure;
                String retryAfter = null;
                try {
                    Response res = sender.send(req, cfg);
                    long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                    int status = res.status();
                    if (status < 400) {
                        return toRawDocument(url, res, elapsedMs);
                    }
                    failure = CollectionException.httpStatus(url, status);
                    retryAfter = res.firstHeader("Retry-After");
                } catch (HttpTimeoutException e) {
                    failure = CollectionException.timeout(url, e);
                } catch (IOException e) {
                    failure = CollectionException.connection(url, e);
                }

                if (!policy.shouldRetry(failure, attempt)) {
                    throw failure;
                }
                Duration delay = resolveRetryAfterOr(policy.nextDelay(attempt), retryAfter);
                retries.incrementAndGet();
                SLOG.info("fetch-retry", "url", url, "attempt", attempt, "kind", failure.getKind(),
                        "status", failure.getStatusCode(), "delayMs", delay.toMillis());
                sleeper.sleep(delay);
                attempt++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CollectionException.connection(url, e);
        }
    }

    /** fetch() 호출 수(robots 거부 포함) */
    public long fetchCount() { return fetchCalls.get(); }
    /** 실제 HTTP 시도 수(재시도 포함, robots.txt 제외) */
    public long attemptCount() { return attempts.get(); }
    public long retryCount() { return retries.get(); }

    public RateLimiter rateLimiter() { return limiter; }

    HttpRequest buildRequest(URI url, CollectorConfig cfg) throws CollectionException {
        try {
            HttpRequest.Builder b = HttpRequest.newBuilder(url)
                    .timeout(cfg.getTimeout())
                    .GET()
                    .header("User-Agent", cfg.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
            for (Map.Entry<String, String> h : cfg.getHeaders().entrySet()) {
                if (h.getKey() == null || h.getValue() == null) continue;
                if (RESTRICTED_HEADERS.contains(h.getKey().toLowerCase(Locale.ROOT))) {
                    LOG.debug("dropping restricted header {}", h.getKey());
                    continue;
                }
                b.setHeader(h.getKey(), h.getValue());
            }
            return b.build();
        } catch (IllegalArgumentException e) {
            throw CollectionException.connection(url, e);
        }
    }

    /** Retry-After(초 또는 HTTP-date)를 존중하되 30초로 상한 */
    Duration resolveRetryAfterOr(Duration fallback, String retryAfter) {
        if (retryAfter == null || retryAfter.isBlank()) return fallback;
        String v = retryAfter.trim();
        try {
            long sec = Long.parseLong(v);
            return Duration.ofSeconds(Math.max(0, Math.min(sec, RETRY_AFTER_CAP.getSeconds())));
        } catch (NumberFormatException notSeconds) {
            try {
                Instant at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                long ms = at.toEpochMilli() - clock.nowMillis();
                return Duration.ofMillis(Math.max(0, Math.min(ms, RETRY_AFTER_CAP.toMillis())));
            } catch (DateTimeParseException unparsable) {
                LOG.debug("ignoring unparsable Retry-After '{}'", v);
                return fallback;
            }
        }
    }

    private RawDocument toRawDocument(URI url, Response res, long elapsedMs) {
        return RawDocument.builder()
                .url(url)
                .finalUrl(res.finalUri() == null ? url : res.finalUri())
                .statusCode(res.status())
                .headers(res.headers())
                .body(res.body())
                .contentType(res.firstHeader("Content-Type"))
                .fetchedAt(Instant.ofEpochMilli(clock.nowMillis()))
                .responseTimeMs(elapsedMs)
                .truncated(res.truncated())
                .build();
    }

    // 프로덕션 경로: 설정 조합별 HttpClient를 재사용
    private Response sendWithClient(HttpRequest req, CollectorConfig cfg) throws IOException, InterruptedException {
        HttpClient client = clients.computeIfAbsent(
                new ClientKey(cfg.isVerifySsl(), cfg.isFollowRedirects(), cfg.getTimeout()),
                k -> newClient(k.verifySsl(), k.followRedirects(), k.connectTimeout()));
        HttpResponse<InputStream> res = client.send(req, HttpResponse.BodyHandlers.ofInputStream());
        long max = cfg.getMaxBodyBytes();
        int limit = (int) Math.min(max + 1, Integer.MAX_VALUE - 8L);
        byte[] body;
        try (InputStream in = res.body()) {
            body = in.readNBytes(limit);
        }
        boolean truncated = body.length > max;
        if (truncated) body = Arrays.copyOf(body, (int) max);
        return new Response(res.statusCode(), res.headers().map(), body, res.uri(), truncated);
    }

    private static HttpClient newClient(boolean verifySsl, boolean followRedirects, Duration connectTimeout) {
        HttpClient.Builder b = HttpClient.newBuilder()
                .followRedirects(followRedirects ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(connectTimeout);
        if (!verifySsl) b.sslContext(InsecureTls.trustAllContext());
        return b.build();
    }

    // robots.txt 요청도 같은 버킷에서 토큰을 소비
    private RobotsFetcher throttled(RobotsFetcher delegate) {
        return uri -> {
            try {
                limiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RobotsFetcher.Response.fail("interrupted", uri);
            }
            return delegate.fetch(uri);
        };
    }

    private record ClientKey(boolean verifySsl, boolean followRedirects, Duration connectTimeout) {}
}
