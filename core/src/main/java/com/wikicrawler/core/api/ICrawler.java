// ICrawler.java
package com.wikicrawler.core.api;

import com.wikicrawler.core.model.CrawlSummary;

/** 크롤러 최소 계약: 큐가 비거나 예산이 찰 때까지 돌고 요약을 돌려준다. */
public interface ICrawler {
    CrawlSummary crawl();
}
