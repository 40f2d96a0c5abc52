package com.pagelens.core.http;

import com.pagelens.core.crawler.robots.RobotsFetcher;
import com.pagelens.core.model.CollectorConfig;
import com.pagelens.core.model.RawDocument;
import com.pagelens.core.util.Sleeper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageCollectorTest {

    private static final URI PAGE = URI.create("https://example.com/page");
    private static final long NOW = Instant.parse("2024-05-01T12:00:00Z").toEpochMilli();

    /** sleep(Duration) 호출만 기록 */
    static class RecordingSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    private static final RobotsFetcher NO_ROBOTS = uri -> RobotsFetcher.Response.ok(404, "", uri);

    private static CollectorConfig fastConfig() {
        return CollectorConfig.builder()
                .requestsPerSecond(1000)
                .burst(10)
                .maxRetries(2)
                .retryDelay(Duration.ofMillis(100))
                .build();
    }

    private static PageCollector collector(PageCollector.HttpSender sender, RecordingSleeper sleeper) {
        return new PageCollector(fastConfig(), sender, NO_ROBOTS, sleeper, () -> NOW);
    }

    @Test
    void retryAfter_is_honored_on_429_and_succeeds_on_second_attempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        PageCollector.HttpSender sender = (req, cfg) -> calls.incrementAndGet() == 1
                ? PageCollector.Response.of(429, Map.of("Retry-After", List.of("1")), "slow down")
                : PageCollector.Response.of(200, Map.of("Content-Type", List.of("text/html")), "<html></html>");
        RecordingSleeper sleeper = new RecordingSleeper();
        PageCollector pc = collector(sender, sleeper);

        RawDocument doc = pc.fetch(PAGE, null);

        assertThat(doc.getStatusCode()).isEqualTo(200);
        assertThat(doc.getContentType()).isEqualTo("text/html");
        assertThat(doc.getFinalUrl()).isEqualTo(PAGE);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1));
        assertThat(pc.attemptCount()).isEqualTo(2);
        assertThat(pc.retryCount()).isEqualTo(1);
        assertThat(pc.fetchCount()).isEqualTo(1);
    }

    @Test
    void server_errors_exhaust_retries_then_fail_with_status() {
        AtomicInteger calls = new AtomicInteger();
        PageCollector.HttpSender sender = (req, cfg) -> {
            calls.incrementAndGet();
            return PageCollector.Response.of(503, Map.of(), "busy");
        };
        RecordingSleeper sleeper = new RecordingSleeper();
        PageCollector pc = collector(sender, sleeper);

        assertThatThrownBy(() -> pc.fetch(PAGE, null))
                .isInstanceOfSatisfying(CollectionException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(CollectionException.Kind.HTTP_STATUS);
                    assertThat(e.getStatusCode()).isEqualTo(503);
                    assertThat(e.isTransient()).isTrue();
                });
        assertThat(calls.get()).isEqualTo(3); // maxRetries=2 → 3회 시도
        assertThat(sleeper.sleeps).hasSize(2);
        assertThat(sleeper.sleeps.get(1)).isGreaterThan(sleeper.sleeps.get(0));
    }

    @Test
    void client_errors_are_not_retried() {
        AtomicInteger calls = new AtomicInteger();
        PageCollector.HttpSender sender = (req, cfg) -> {
            calls.incrementAndGet();
            return PageCollector.Response.of(404, Map.of(), "nope");
        };
        RecordingSleeper sleeper = new RecordingSleeper();

        assertThatThrownBy(() -> collector(sender, sleeper).fetch(PAGE, null))
                .isInstanceOfSatisfying(CollectionException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(CollectionException.Kind.HTTP_STATUS);
                    assertThat(e.getStatusCode()).isEqualTo(404);
                    assertThat(e.isTransient()).isFalse();
                });
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void network_errors_are_retried_and_classified() {
        RecordingSleeper sleeper = new RecordingSleeper();
        PageCollector.HttpSender refused = (req, cfg) -> { throw new IOException("connection refused"); };
        assertThatThrownBy(() -> collector(refused, sleeper).fetch(PAGE, null))
                .isInstanceOfSatisfying(CollectionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CollectionException.Kind.CONNECTION_ERROR));
        assertThat(sleeper.sleeps).hasSize(2);

        PageCollector.HttpSender slow = (req, cfg) -> { throw new HttpTimeoutException("request timed out"); };
        assertThatThrownBy(() -> collector(slow, new RecordingSleeper()).fetch(PAGE, null))
                .isInstanceOfSatisfying(CollectionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CollectionException.Kind.TIMEOUT));
    }

    @Test
    void robots_disallow_blocks_before_any_request() {
        AtomicInteger calls = new AtomicInteger();
        PageCollector.HttpSender sender = (req, cfg) -> {
            calls.incrementAndGet();
            return PageCollector.Response.of(200, Map.of(), "ok");
        };
        RobotsFetcher robots = uri -> RobotsFetcher.Response.ok(200, "User-agent: *\nDisallow: /page\n", uri);
        PageCollector pc = new PageCollector(fastConfig(), sender, robots, new RecordingSleeper(), () -> NOW);

        assertThatThrownBy(() -> pc.fetch(PAGE, null))
                .isInstanceOfSatisfying(CollectionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(CollectionException.Kind.ROBOTS_DISALLOWED));
        assertThat(calls.get()).isZero();
        assertThat(pc.fetchCount()).isEqualTo(1);
        assertThat(pc.attemptCount()).isZero();
    }

    @Test
    void robots_ignored_when_respect_robots_is_off() throws Exception {
        PageCollector.HttpSender sender = (req, cfg) -> PageCollector.Response.of(200, Map.of(), "ok");
        RobotsFetcher robots = uri -> RobotsFetcher.Response.ok(200, "User-agent: *\nDisallow: /\n", uri);
        PageCollector pc = new PageCollector(fastConfig(), sender, robots, new RecordingSleeper(), () -> NOW);

        CollectorConfig relaxed = fastConfig().toBuilder().respectRobots(false).build();
        assertThat(pc.fetch(PAGE, relaxed).getStatusCode()).isEqualTo(200);
    }

    @Test
    void custom_headers_are_sent_but_restricted_ones_dropped() throws Exception {
        PageCollector pc = collector((req, cfg) -> PageCollector.Response.of(200, Map.of(), ""), new RecordingSleeper());
        CollectorConfig cfg = fastConfig().toBuilder()
                .header("Host", "evil.example")
                .header("Connection", "close")
                .header("X-Trace", "abc")
                .userAgent("PageLensTest/0.1")
                .build();

        HttpRequest req = pc.buildRequest(PAGE, cfg);

        assertThat(req.headers().firstValue("X-Trace")).hasValue("abc");
        assertThat(req.headers().firstValue("User-Agent")).hasValue("PageLensTest/0.1");
        assertThat(req.headers().firstValue("Host")).isEmpty();
        assertThat(req.headers().firstValue("Connection")).isEmpty();
        assertThat(req.timeout()).hasValue(cfg.getTimeout());
    }

    @Test
    void retry_after_seconds_and_http_date_are_capped() {
        PageCollector pc = collector((req, cfg) -> PageCollector.Response.of(200, Map.of(), ""), new RecordingSleeper());
        Duration fallback = Duration.ofMillis(250);

        assertThat(pc.resolveRetryAfterOr(fallback, "5")).isEqualTo(Duration.ofSeconds(5));
        assertThat(pc.resolveRetryAfterOr(fallback, "120")).isEqualTo(PageCollector.RETRY_AFTER_CAP);
        assertThat(pc.resolveRetryAfterOr(fallback, null)).isEqualTo(fallback);
        assertThat(pc.resolveRetryAfterOr(fallback, "soon")).isEqualTo(fallback);

        String inTenSeconds = DateTimeFormatter.RFC_1123_DATE_TIME
                .format(Instant.ofEpochMilli(NOW).plusSeconds(10).atZone(ZoneOffset.UTC));
        assertThat(pc.resolveRetryAfterOr(fallback, inTenSeconds)).isEqualTo(Duration.ofSeconds(10));
    }
}
