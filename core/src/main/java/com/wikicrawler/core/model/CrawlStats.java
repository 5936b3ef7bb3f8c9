package com.wikicrawler.core.model;

/** 크롤 실행 중 카운터 누적기. 단일 스레드 루프 전용. */
public final class CrawlStats {
    private int attempted;            // fetch까지 간 수(거절 제외)
    private int succeeded;            // 산출물 기록 성공
    private int failed;               // fetch 실패 + 산출물 기록 실패
    private int rejected;             // 방문됨/예산/범위/재시도 소진으로 거절
    private int skipped;              // SKIP 정책으로 파일 없이 방문 처리
    private int persistenceFailures;  // 상태 파일 저장 실패

    public void attempt() { attempted++; }
    public void success() { succeeded++; }
    public void failure() { failed++; }
    public void reject() { rejected++; }
    public void skip() { skipped++; }
    public void persistenceFailure() { persistenceFailures++; }

    public int attempted() { return attempted; }

    public CrawlSummary summarize(int fileCount, CrawlSummary.StopReason reason) {
        return new CrawlSummary(attempted, succeeded, failed, rejected, skipped,
                persistenceFailures, fileCount, reason);
    }
}
