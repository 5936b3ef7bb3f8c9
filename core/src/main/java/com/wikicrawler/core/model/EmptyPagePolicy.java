package com.wikicrawler.core.model;

/** 필터링 후 문단이 하나도 없는 페이지 처리 방식 */
public enum EmptyPagePolicy {
    /** 빈 본문이어도 산출물 기록 + 방문 처리 + 카운트 (기존 동작) */
    WRITE,
    /** 방문 처리만 하고 파일은 만들지 않음, 카운트 증가 없음 */
    SKIP
}
