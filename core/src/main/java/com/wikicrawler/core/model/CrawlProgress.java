package com.wikicrawler.core.model;

/**
 * 한 스텝 처리 직후의 진행 상황 스냅샷.
 *
 * @param url            이번 스텝에서 꺼낸 URL
 * @param outcome        스텝 결과
 * @param attempted      지금까지 실제 fetch를 시도한 수
 * @param pagesCompleted 현재 fileCount (이전 실행 포함)
 * @param totalBudget    maxFiles
 * @param queueDepth     남은 대기 큐 길이
 */
public record CrawlProgress(String url, Outcome outcome, int attempted,
                            int pagesCompleted, int totalBudget, int queueDepth) {

    public enum Outcome { SAVED, SKIPPED_EMPTY, FAILED, REJECTED }

    public boolean success() {
        return outcome == Outcome.SAVED || outcome == Outcome.SKIPPED_EMPTY;
    }
}
