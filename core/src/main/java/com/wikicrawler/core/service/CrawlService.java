package com.wikicrawler.core.service;

import com.wikicrawler.core.api.IArticleExtractor;
import com.wikicrawler.core.api.IPageFetcher;
import com.wikicrawler.core.crawler.CrawlLoop;
import com.wikicrawler.core.extract.JsoupArticleExtractor;
import com.wikicrawler.core.frontier.Frontier;
import com.wikicrawler.core.frontier.FrontierState;
import com.wikicrawler.core.frontier.FrontierStateStore;
import com.wikicrawler.core.http.HttpPageFetcher;
import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.CrawlSummary;
import com.wikicrawler.core.output.ArticleWriter;
import com.wikicrawler.core.util.ProgressListener;
import com.wikicrawler.core.util.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * 크롤 오케스트레이터:
 *  - 상태 파일 로드 → 프런티어 구성 → CrawlLoop 실행 → 요약 로그
 *  - 기본 구현체(HttpPageFetcher/JsoupArticleExtractor/ArticleWriter)
 *  - DI 생성자는 테스트 주입용
 */
public final class CrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLogger SLOG = StructuredLogger.get(CrawlService.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final IArticleExtractor extractor;
    private final ArticleWriter writer;

    /** 기본 구현 */
    public CrawlService(CrawlConfig config) {
        this(config, new HttpPageFetcher(config.getUserAgent()),
                new JsoupArticleExtractor(config.extract()), new ArticleWriter());
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config, IPageFetcher fetcher, IArticleExtractor extractor, ArticleWriter writer) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public CrawlSummary run() throws IOException {
        return run(ProgressListener.NONE);
    }

    /**
     * 이전 실행 상태를 이어서 크롤한다.
     * @throws IOException 상태 파일을 읽을 수 없거나 깨진 경우(진행 상황을 조용히 버리지 않음)
     */
    public CrawlSummary run(ProgressListener listener) throws IOException {
        FrontierStateStore store = new FrontierStateStore(config.getStateFile());
        FrontierState state = store.load();

        LOG.info("Crawl start: seeds={}, maxFiles={}, site={}, output={}, resumed files={}, visited={}",
                config.getStartUrls(), config.getMaxFiles(), config.getSite(),
                config.getOutputDir().toAbsolutePath(), state.getFileCount(), state.getVisited().size());
        SLOG.info("crawl-start",
                "seeds", config.getStartUrls().size(),
                "maxFiles", config.getMaxFiles(),
                "site", config.getSite(),
                "resumedFiles", state.getFileCount(),
                "visited", state.getVisited().size());

        Frontier frontier = new Frontier(state, config);
        CrawlLoop loop = new CrawlLoop(config, frontier, fetcher, extractor, writer, store, listener);
        CrawlSummary summary = loop.crawl();

        LOG.info("Crawl end: {}", summary);
        SLOG.info("crawl-end",
                "stopReason", summary.stopReason.name(),
                "fileCount", summary.fileCount,
                "succeeded", summary.succeeded,
                "failed", summary.failed,
                "rejected", summary.rejected,
                "persistenceFailures", summary.persistenceFailures);
        return summary;
    }

    public CrawlConfig getConfig() { return config; }
}
