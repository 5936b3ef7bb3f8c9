package com.wikicrawler.core.api;

import com.wikicrawler.core.http.FetchException;

import java.time.Duration;

/** URL 하나를 받아 본문 문자열을 돌려주는 전략 인터페이스. */
@FunctionalInterface
public interface IPageFetcher {
    /**
     * url의 응답 본문을 UTF-8로 디코딩해 반환.
     * HTTP 오류/네트워크 오류/디코딩 오류는 FetchException(kind 구분)으로 던진다.
     */
    String fetch(String url, Duration timeout) throws FetchException;
}
