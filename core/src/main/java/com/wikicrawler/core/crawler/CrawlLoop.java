package com.wikicrawler.core.crawler;

import com.wikicrawler.core.api.IArticleExtractor;
import com.wikicrawler.core.api.ICrawler;
import com.wikicrawler.core.api.IPageFetcher;
import com.wikicrawler.core.extract.ContentFilter;
import com.wikicrawler.core.frontier.Frontier;
import com.wikicrawler.core.frontier.FrontierStateStore;
import com.wikicrawler.core.http.FetchException;
import com.wikicrawler.core.model.ContentBlock;
import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.CrawlProgress;
import com.wikicrawler.core.model.CrawlProgress.Outcome;
import com.wikicrawler.core.model.CrawlStats;
import com.wikicrawler.core.model.CrawlSummary;
import com.wikicrawler.core.model.EmptyPagePolicy;
import com.wikicrawler.core.model.PageResult;
import com.wikicrawler.core.output.ArticleWriter;
import com.wikicrawler.core.output.ArtifactNaming;
import com.wikicrawler.core.util.ProgressListener;
import com.wikicrawler.core.util.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * BFS 크롤 루프 (단일 스레드, 순차)
 * - 큐 앞에서 URL 하나 꺼냄 → 거절 판정 → fetch → extract → filter → write → 프런티어 반영 → 상태 저장
 * - 큐 소진 또는 예산 도달 시 종료 (종료 사유 구분)
 */
public class CrawlLoop implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlLoop.class);
    private static final StructuredLogger SLOG = StructuredLogger.get(CrawlLoop.class);

    private final Frontier frontier;
    private final IPageFetcher fetcher;
    private final IArticleExtractor extractor;
    private final ArticleWriter writer;
    private final FrontierStateStore store;
    private final ProgressListener listener;

    private final List<String> startUrls;
    private final Path outputDir;
    private final Duration timeout;
    private final EmptyPagePolicy emptyPagePolicy;

    private final CrawlStats stats = new CrawlStats();

    public CrawlLoop(CrawlConfig config, Frontier frontier, IPageFetcher fetcher, IArticleExtractor extractor,
                     ArticleWriter writer, FrontierStateStore store, ProgressListener listener) {
        Objects.requireNonNull(config, "config");
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.store = Objects.requireNonNull(store, "store");
        this.listener = (listener != null) ? listener : ProgressListener.NONE;
        this.startUrls = config.getStartUrls();
        this.outputDir = config.getOutputDir();
        this.timeout = config.getTimeout();
        this.emptyPagePolicy = config.policy().getEmptyPage();
    }

    @Override
    public CrawlSummary crawl() {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new CrawlAbortedException("Cannot create output directory: " + outputDir.toAbsolutePath(), e);
        }

        frontier.seed(startUrls);

        CrawlSummary.StopReason reason;
        while (true) {
            if (frontier.budgetReached()) { reason = CrawlSummary.StopReason.BUDGET_REACHED; break; }
            if (!frontier.hasPending()) { reason = CrawlSummary.StopReason.FRONTIER_EXHAUSTED; break; }

            String url = frontier.poll();
            Outcome outcome = step(url);
            listener.onProgress(new CrawlProgress(url, outcome, stats.attempted(),
                    frontier.fileCount(), frontier.maxFiles(), frontier.queueDepth()));
        }

        if (reason == CrawlSummary.StopReason.BUDGET_REACHED) {
            LOG.info("Stopped: page budget reached ({}/{}), {} URL(s) left in queue",
                    frontier.fileCount(), frontier.maxFiles(), frontier.queueDepth());
        } else {
            LOG.info("Stopped: frontier exhausted after {} file(s)", frontier.fileCount());
        }
        return stats.summarize(frontier.fileCount(), reason);
    }

    /** URL 하나 처리. 프런티어 변경은 여기서만 일어난다. */
    Outcome step(String url) {
        Frontier.Rejection rejection = frontier.check(url);
        if (rejection != null) {
            stats.reject();
            LOG.debug("Rejected {}: {}", url, rejection);
            return Outcome.REJECTED;
        }

        stats.attempt();
        String html;
        try {
            html = fetcher.fetch(url, timeout);
        } catch (FetchException e) {
            stats.failure();
            int failures = frontier.recordFailure(url);
            LOG.warn("Fetch failed ({}) for {}: {}", e.getKind(), url, e.getMessage());
            SLOG.warn("fetch-failed", "url", url, "kind", e.getKind().name(),
                    "status", e.getStatusCode(), "failures", failures);
            checkpoint();
            return Outcome.FAILED;
        }

        PageResult page = extractor.extract(html, url);
        List<ContentBlock> blocks = ContentFilter.filter(page.blocks());

        if (emptyPagePolicy == EmptyPagePolicy.SKIP && !page.hasParagraph()) {
            int queued = frontier.recordVisitedWithoutArtifact(url, page.links());
            stats.skip();
            LOG.info("Skipped empty page {} (queued {} link(s))", url, queued);
            checkpoint();
            return Outcome.SKIPPED_EMPTY;
        }

        Path target = ArtifactNaming.artifactPath(outputDir, frontier.nextFileNumber(), page.title());
        try {
            writer.write(page.title(), blocks, target);
        } catch (IOException e) {
            stats.failure();
            discardPartial(target, e);
            int failures = frontier.recordFailure(url);
            LOG.error("Could not write {} for {}", target, url, e);
            SLOG.error("write-failed", e, "url", url, "file", target.toString(), "failures", failures);
            checkpoint();
            if (!Files.isDirectory(outputDir) || !Files.isWritable(outputDir)) {
                throw new CrawlAbortedException("Output directory is not writable: " + outputDir.toAbsolutePath(), e);
            }
            return Outcome.FAILED;
        }

        int queued = frontier.recordSuccess(url, page.links());
        stats.success();
        LOG.info("[{}/{}] Saved {} -> {}", frontier.fileCount(), frontier.maxFiles(), url, target.getFileName());
        SLOG.info("page-saved", "url", url, "file", target.getFileName().toString(),
                "blocks", blocks.size(), "links", page.links().size(), "queued", queued,
                "queueDepth", frontier.queueDepth());
        checkpoint();
        return Outcome.SAVED;
    }

    // 번호가 확정되지 않은 산출물은 남기지 않는다 (fileCount == 디스크 산출물 수)
    private static void discardPartial(Path target, IOException cause) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    // 저장 실패는 알리고 계속 진행 (메모리 상태는 되돌리지 않음)
    private void checkpoint() {
        try {
            store.save(frontier.state());
        } catch (IOException e) {
            stats.persistenceFailure();
            LOG.error("Could not persist frontier state to {}; progress of this step is not durable",
                    store.getFile(), e);
        }
    }
}
