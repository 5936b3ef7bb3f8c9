package com.wikicrawler.core.util;

import com.wikicrawler.core.model.CrawlProgress;

@FunctionalInterface
public interface ProgressListener {
    /**
     * 스텝(큐에서 URL 하나 처리)마다 호출.
     * @param progress 완료 페이지 수 / 예산 / 큐 길이 / 시도 수 / 이번 결과
     */
    void onProgress(CrawlProgress progress);

    ProgressListener NONE = p -> {};
}
