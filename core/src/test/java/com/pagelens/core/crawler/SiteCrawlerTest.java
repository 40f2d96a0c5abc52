package com.pagelens.core.crawler;

import com.pagelens.core.model.CollectorConfig;
import com.pagelens.core.model.EngineConfig;
import com.pagelens.core.model.ProcessorConfig;
import com.pagelens.core.processor.HtmlProcessor;
import com.pagelens.core.testutil.FakeCollector;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SiteCrawlerTest {

    private static final String SEED = "https://site.example/";

    private static String links(String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><body>");
        for (String h : hrefs) sb.append("<a href=\"").append(h).append("\">go</a>");
        return sb.append("</body></html>").toString();
    }

    private static FakeCollector site() {
        return new FakeCollector()
                .page(SEED, links("/a", "/b", "https://other.example/x", "/style.css", "/admin/panel", "#top"))
                .page("https://site.example/a", links("/a/deep", "/"))
                .page("https://site.example/b", links("/b/deep"))
                .page("https://site.example/a/deep", links("/a/deeper"))
                .page("https://site.example/b/deep", links())
                .page("https://site.example/a/deeper", links())
                .page("https://site.example/admin/panel", links())
                .page("https://other.example/x", links());
    }

    private static List<URI> crawl(FakeCollector collector, EngineConfig.CrawlCfg cfg) {
        return new SiteCrawler(collector, new HtmlProcessor(), cfg)
                .crawl(URI.create(SEED), CollectorConfig.defaults(), ProcessorConfig.defaults(), null, null);
    }

    private static List<String> strings(List<URI> uris) {
        return uris.stream().map(URI::toString).toList();
    }

    @Test
    void breadth_first_within_depth() {
        EngineConfig.CrawlCfg cfg = new EngineConfig.CrawlCfg().setMaxDepth(1).setExcludePaths(List.of("/admin"));

        assertThat(strings(crawl(site(), cfg))).containsExactly(
                SEED, "https://site.example/a", "https://site.example/b");
    }

    @Test
    void deeper_crawl_visits_each_page_once() {
        FakeCollector collector = site();
        EngineConfig.CrawlCfg cfg = new EngineConfig.CrawlCfg().setMaxDepth(3).setExcludePaths(List.of("/admin"));

        List<URI> pages = crawl(collector, cfg);

        assertThat(strings(pages)).containsExactly(
                SEED, "https://site.example/a", "https://site.example/b",
                "https://site.example/a/deep", "https://site.example/b/deep", "https://site.example/a/deeper");
        assertEquals(pages.size(), collector.callCount());
    }

    @Test
    void page_budget_stops_the_crawl() {
        FakeCollector collector = site();
        EngineConfig.CrawlCfg cfg = new EngineConfig.CrawlCfg().setMaxDepth(5).setMaxPages(2);

        assertThat(crawl(collector, cfg)).hasSize(2);
        assertEquals(2, collector.callCount());
    }

    @Test
    void other_domains_followed_only_when_allowed() {
        EngineConfig.CrawlCfg cfg = new EngineConfig.CrawlCfg().setMaxDepth(1).setSameDomainOnly(false);

        assertThat(strings(crawl(site(), cfg)))
                .contains("https://other.example/x", "https://site.example/admin/panel")
                .doesNotContain("https://site.example/style.css");
    }

    @Test
    void failed_pages_are_left_out() {
        FakeCollector collector = site().status("https://site.example/a", 500);
        EngineConfig.CrawlCfg cfg = new EngineConfig.CrawlCfg().setMaxDepth(1).setExcludePaths(List.of("/admin"));

        assertThat(strings(crawl(collector, cfg))).containsExactly(SEED, "https://site.example/b");
    }

    @Test
    void unreachable_seed_is_still_returned() {
        FakeCollector collector = new FakeCollector().status(SEED, 503);

        assertThat(strings(crawl(collector, new EngineConfig.CrawlCfg()))).containsExactly(SEED);
    }

    @Test
    void cancel_and_past_deadline_stop_before_fetching() {
        FakeCollector collector = site();
        SiteCrawler crawler = new SiteCrawler(collector, new HtmlProcessor(), new EngineConfig.CrawlCfg());

        List<URI> cancelled = crawler.crawl(URI.create(SEED), CollectorConfig.defaults(), ProcessorConfig.defaults(),
                null, new AtomicBoolean(true));
        List<URI> late = crawler.crawl(URI.create(SEED), CollectorConfig.defaults(), ProcessorConfig.defaults(),
                Instant.now().minusSeconds(1), null);

        assertThat(strings(cancelled)).containsExactly(SEED);
        assertThat(strings(late)).containsExactly(SEED);
        assertEquals(0, collector.callCount());
    }

    @Test
    void static_assets_are_recognised_by_extension() {
        assertTrue(SiteCrawler.isStatic(URI.create("https://site.example/img/logo.PNG")));
        assertTrue(SiteCrawler.isStatic(URI.create("https://site.example/app.js")));
        assertFalse(SiteCrawler.isStatic(URI.create("https://site.example/v1.2/page")));
        assertFalse(SiteCrawler.isStatic(URI.create("https://site.example/docs/")));
    }
}
