package com.wikicrawler.core.frontier;

import com.wikicrawler.core.model.CrawlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 크롤 프런티어: 방문 집합 + 대기 큐(FIFO) + 파일 카운터를 단독 소유한다.
 * - 무엇을 다음에 꺼낼지, 언제 멈출지, 링크를 큐에 넣을지 판단
 * - 파일/네트워크 I/O 없음 (저장은 FrontierStateStore, 호출은 CrawlLoop)
 */
public final class Frontier {

    private static final Logger LOG = LoggerFactory.getLogger(Frontier.class);

    /** 시도 전 거절 사유 */
    public enum Rejection { VISITED, BUDGET_REACHED, OUT_OF_SCOPE, RETRIES_EXHAUSTED }

    private final FrontierState state;
    private final Deque<String> pending = new ArrayDeque<>();

    private final int maxFiles;
    private final String site;
    private final int maxFetchAttempts;     // 0 = 무제한
    private final boolean dedupAtEnqueue;
    private final Set<String> enqueued;     // dedupAtEnqueue 일 때만 사용

    public Frontier(FrontierState state, CrawlConfig config) {
        this(state, config.getMaxFiles(), config.getSite(),
                config.policy().getMaxFetchAttempts(), config.policy().isDedupAtEnqueue());
    }

    public Frontier(FrontierState state, int maxFiles, String site, int maxFetchAttempts, boolean dedupAtEnqueue) {
        this.state = Objects.requireNonNull(state, "state");
        this.site = Objects.requireNonNull(site, "site");
        this.maxFiles = Math.max(0, maxFiles);
        this.maxFetchAttempts = Math.max(0, maxFetchAttempts);
        this.dedupAtEnqueue = dedupAtEnqueue;
        this.enqueued = dedupAtEnqueue ? new HashSet<>() : null;
    }

    /**
     * 시작 URL 투입. 방문 여부는 꺼낼 때 판단(여기서는 정규화만).
     * dedupAtEnqueue 면 시드도 enqueued 집합에 기록해 이후 링크와 중복되지 않게 한다.
     */
    public void seed(Collection<String> startUrls) {
        if (startUrls == null) return;
        for (String raw : startUrls) {
            String url = LinkNormalizer.normalize(raw == null ? null : raw.trim(), null);
            if (url == null) {
                LOG.warn("Ignoring start URL that is not absolute http(s): {}", raw);
                continue;
            }
            if (enqueued != null && !enqueued.add(url)) continue;
            pending.addLast(url);
        }
    }

    public boolean hasPending() { return !pending.isEmpty(); }

    /** 큐 맨 앞 URL, 비어 있으면 null */
    public String poll() { return pending.pollFirst(); }

    public int queueDepth() { return pending.size(); }

    public boolean budgetReached() { return state.getFileCount() >= maxFiles; }

    /** 시도해도 되면 null, 아니면 거절 사유. 상태 변화 없음. */
    public Rejection check(String url) {
        if (state.isVisited(url)) return Rejection.VISITED;
        if (budgetReached()) return Rejection.BUDGET_REACHED;
        if (!LinkNormalizer.inScope(url, site)) return Rejection.OUT_OF_SCOPE;
        if (maxFetchAttempts > 0 && state.failureCount(url) >= maxFetchAttempts) return Rejection.RETRIES_EXHAUSTED;
        return null;
    }

    /** 다음 산출물 번호(아직 확정 아님) */
    public int nextFileNumber() { return state.getFileCount() + 1; }

    /**
     * 산출물 기록 성공 반영: fileCount+1, 방문 처리, 링크 큐잉.
     * @return 큐에 새로 넣은 링크 수
     */
    public int recordSuccess(String url, List<String> rawLinks) {
        state.incrementFileCount();
        return markVisitedAndEnqueue(url, rawLinks);
    }

    /** 파일 없이 방문만 처리(SKIP 정책). fileCount 불변. */
    public int recordVisitedWithoutArtifact(String url, List<String> rawLinks) {
        return markVisitedAndEnqueue(url, rawLinks);
    }

    /** fetch 실패 누적. 방문 처리하지 않음. @return 누적 실패 횟수 */
    public int recordFailure(String url) {
        return state.recordFailure(url);
    }

    public int fileCount() { return state.getFileCount(); }

    public int maxFiles() { return maxFiles; }

    public FrontierState state() { return state; }

    private int markVisitedAndEnqueue(String url, List<String> rawLinks) {
        state.markVisited(url);
        if (enqueued != null) enqueued.add(url);

        int added = 0;
        if (rawLinks == null) return 0;
        for (String href : rawLinks) {
            String link = LinkNormalizer.normalize(href, url);
            if (link == null || link.isEmpty()) continue;
            if (!LinkNormalizer.inScope(link, site)) continue;
            if (state.isVisited(link)) continue;
            if (enqueued != null && !enqueued.add(link)) continue;
            pending.addLast(link);
            added++;
        }
        return added;
    }
}
