package com.wikicrawler.core.model;

/** 크롤 1회 실행 결과 요약 (불변). */
public final class CrawlSummary {

    public enum StopReason {
        /** fileCount >= maxFiles */
        BUDGET_REACHED,
        /** 대기 큐 소진 */
        FRONTIER_EXHAUSTED
    }

    public final int attempted;
    public final int succeeded;
    public final int failed;
    public final int rejected;
    public final int skipped;
    public final int persistenceFailures;
    public final int fileCount;
    public final StopReason stopReason;

    public CrawlSummary(int attempted, int succeeded, int failed, int rejected, int skipped,
                        int persistenceFailures, int fileCount, StopReason stopReason) {
        this.attempted = attempted;
        this.succeeded = succeeded;
        this.failed = failed;
        this.rejected = rejected;
        this.skipped = skipped;
        this.persistenceFailures = persistenceFailures;
        this.fileCount = fileCount;
        this.stopReason = stopReason;
    }

    @Override
    public String toString() {
        return "CrawlSummary{attempted=" + attempted + ", succeeded=" + succeeded + ", failed=" + failed
                + ", rejected=" + rejected + ", skipped=" + skipped
                + ", persistenceFailures=" + persistenceFailures
                + ", fileCount=" + fileCount + ", stopReason=" + stopReason + '}';
    }
}
