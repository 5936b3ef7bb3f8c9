package com.wikicrawler.core.crawler;

/** 출력 디렉터리 자체를 쓸 수 없는 등 더 진행할 수 없는 상황. */
public class CrawlAbortedException extends RuntimeException {
    public CrawlAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
