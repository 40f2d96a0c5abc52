package com.pagelens.core.crawler.robots;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

final class FakeFetcher implements RobotsFetcher {
    private record Stub(int status, String body, URI finalUri, String err) {}

    private final Map<String, Stub> byUri = new LinkedHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();

    FakeFetcher stub(URI uri, int status, String body) {
        byUri.put(uri.toString(), new Stub(status, body, uri, null));
        return this;
    }
    FakeFetcher redirect(URI from, URI to, int status) {
        byUri.put(from.toString(), new Stub(status, "", to, null));
        return this;
    }
    FakeFetcher fail(URI uri, String err) {
        byUri.put(uri.toString(), new Stub(0, "", uri, err));
        return this;
    }

    int calls() { return calls.get(); }

    @Override public Response fetch(URI robotsTxtUri) {
        calls.incrementAndGet();
        Stub s = byUri.get(robotsTxtUri.toString());
        if (s == null) return Response.fail("no stub", robotsTxtUri);
        if (s.status() == 0) return Response.fail(s.err(), robotsTxtUri);
        if (s.status() >= 300 && s.status() < 400) return Response.redirect(s.status(), s.finalUri());
        return Response.ok(s.status(), s.body(), robotsTxtUri);
    }
}
