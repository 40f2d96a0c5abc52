package com.pagelens.core.crawler;

import com.pagelens.core.api.ICollector;
import com.pagelens.core.api.IProcessor;
import com.pagelens.core.http.CollectionException;
import com.pagelens.core.model.CollectorConfig;
import com.pagelens.core.model.EngineConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.ProcessorConfig;
import com.pagelens.core.model.RawDocument;
import com.pagelens.core.util.StructuredLog;
import com.pagelens.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * BFS 기반 사이트 탐색
 * - sameDomainOnly / maxDepth / maxPages / excludePaths
 * - robots/레이트리밋/재시도는 수집기가 처리(robots 거부 페이지는 결과에서 빠진다)
 * - 링크 추출은 처리기(ParsedDocument.links) 재사용
 */
public class SiteCrawler {
    private static final Logger LOG = LoggerFactory.getLogger(SiteCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(SiteCrawler.class);

    private static final Set<String> STATIC_EXT = Set.of(
            "css", "js", "png", "jpg", "jpeg", "gif", "ico", "svg", "webp", "avif",
            "woff", "woff2", "ttf", "eot", "otf", "map", "pdf", "zip", "gz", "mp4", "mp3", "webm");

    private final ICollector collector;
    private final IProcessor processor;
    private final EngineConfig.CrawlCfg crawl;

    public SiteCrawler(ICollector collector, IProcessor processor, EngineConfig.CrawlCfg crawl) {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.crawl = Objects.requireNonNull(crawl, "crawl");
    }

    /** 방문(수집 성공) 순서대로 URL 목록. 시드가 실패하면 시드만 돌려줘 배치에서 FAILED로 남게 한다. */
    public List<URI> crawl(URI seedUri, CollectorConfig cc, ProcessorConfig pc, Instant deadline, AtomicBoolean cancel) {
        URI seed = UrlUtils.normalize(Objects.requireNonNull(seedUri, "seed"));
        int maxDepth = Math.max(0, crawl.getMaxDepth());
        int maxPages = Math.max(1, crawl.getMaxPages());
        List<String> excludes = crawl.getExcludePaths();

        Set<URI> seen = new LinkedHashSet<>();      // 중복 방지 전용
        List<URI> fetched = new ArrayList<>();      // 실제 방문 성공 목록
        Deque<Node> q = new ArrayDeque<>();
        seen.add(seed);
        q.addLast(new Node(seed, 0));

        while (!q.isEmpty() && fetched.size() < maxPages) {
            if ((cancel != null && cancel.get()) || (deadline != null && !Instant.now().isBefore(deadline))) {
                LOG.info("Crawl stopped early at {} page(s)", fetched.size());
                break;
            }
            Node cur = q.pollFirst();

            ParsedDocument doc;
            try {
                RawDocument raw = collector.fetch(cur.uri, cc);
                doc = processor.parse(raw, pc);
            } catch (CollectionException e) {
                LOG.debug("Crawl skip {}: {}", cur.uri, e.getMessage());
                continue;
            }
            fetched.add(cur.uri);

            if (cur.depth >= maxDepth) continue;

            for (ParsedDocument.Link link : doc.getLinks()) {
                URI n = UrlUtils.parseHttp(link.href());
                if (n == null) continue;
                if (crawl.isSameDomainOnly() && !UrlUtils.sameDomain(seed, n)) continue;
                if (UrlUtils.isExcluded(n, excludes)) continue;
                if (isStatic(n)) continue;
                if (seen.add(n)) q.addLast(new Node(n, cur.depth + 1));
            }
        }

        if (fetched.isEmpty()) fetched.add(seed);
        SLOG.info("crawl-done", "seed", seed, "pages", fetched.size(), "discovered", seen.size());
        return fetched;
    }

    static boolean isStatic(URI u) {
        String p = (u.getPath() == null) ? "" : u.getPath().toLowerCase(Locale.ROOT);
        int slash = p.lastIndexOf('/');
        int dot = p.lastIndexOf('.');
        if (dot < 0 || dot < slash) return false;
        return STATIC_EXT.contains(p.substring(dot + 1));
    }

    private static final class Node {
        final URI uri; final int depth;
        Node(URI u, int d) { this.uri = u; this.depth = d; }
    }
}
