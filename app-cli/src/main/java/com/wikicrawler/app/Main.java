package com.wikicrawler.app;

import com.wikicrawler.app.config.EnvConfigResolver;
import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.CrawlProgress;
import com.wikicrawler.core.model.CrawlSummary;
import com.wikicrawler.core.service.CrawlService;
import com.wikicrawler.core.util.LoggingConfigurator;
import com.wikicrawler.core.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/** CLI 진입점: 환경변수/crawl.yml 로 설정을 만들고 크롤을 실행한다. */
public final class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private Main() {}

    public static void main(String[] args) {
        // 로그 초기화 (-Dwc.log.dir 없으면 "logs")
        LoggingConfigurator.init(Path.of(System.getProperty("wc.log.dir", "logs")));

        CrawlConfig config;
        try {
            config = EnvConfigResolver.fromSystem().resolve();
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        try {
            CrawlSummary summary = new CrawlService(config).run(consoleProgress());
            printSummary(config, summary);
        } catch (IOException | RuntimeException e) {
            LOG.error("Crawl aborted", e);
            System.exit(1);
        }
    }

    static ProgressListener consoleProgress() {
        return p -> {
            if (p.outcome() == CrawlProgress.Outcome.REJECTED) return;
            LOG.info("progress: {}/{} pages, attempted={}, queue={}, last={} ({})",
                    p.pagesCompleted(), p.totalBudget(), p.attempted(), p.queueDepth(),
                    p.url(), p.success() ? "ok" : "failed");
        };
    }

    private static void printSummary(CrawlConfig config, CrawlSummary s) {
        System.out.println("==== Crawl summary ====");
        System.out.println("Output dir : " + config.getOutputDir().toAbsolutePath());
        System.out.println("Files      : " + s.fileCount + " / " + config.getMaxFiles());
        System.out.println("Saved      : " + s.succeeded);
        System.out.println("Failed     : " + s.failed);
        System.out.println("Rejected   : " + s.rejected);
        if (s.skipped > 0) System.out.println("Skipped    : " + s.skipped);
        if (s.persistenceFailures > 0) System.out.println("State save failures: " + s.persistenceFailures);
        System.out.println(s.stopReason == CrawlSummary.StopReason.BUDGET_REACHED
                ? "Stopped    : page budget reached"
                : "Stopped    : no more URLs to crawl");
    }
}
