package com.pagelens.core.crawler.robots;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/** java.net.http 기반 robots.txt 수집기. 클라이언트는 Redirect.NEVER 여야 한다. */
public final class HttpRobotsFetcher implements RobotsFetcher {
    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;

    public HttpRobotsFetcher(HttpClient client, String userAgent, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public Response fetch(URI robotsTxtUri) {
        try {
            HttpRequest req = HttpRequest.newBuilder(robotsTxtUri)
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/plain,*/*;q=0.8")
                    .build();

            HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int code = res.statusCode();

            // 리다이렉트면 Location만 전달(본문 무시)
            if (code == 301 || code == 302 || code == 307 || code == 308) {
                URI next = res.headers().firstValue("Location").map(robotsTxtUri::resolve).orElse(robotsTxtUri);
                return Response.redirect(code, next);
            }
            return Response.ok(code, res.body(), robotsTxtUri);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Response.fail("interrupted", robotsTxtUri);
        } catch (IOException | IllegalArgumentException e) {
            return Response.fail(e.toString(), robotsTxtUri);
        }
    }
}
