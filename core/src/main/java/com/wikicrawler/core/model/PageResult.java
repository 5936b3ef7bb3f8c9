package com.wikicrawler.core.model;

import java.util.List;

/**
 * 한 페이지의 추출 결과. title은 없으면 null.
 * links는 href 원문 그대로(정규화 전), 문단 → 문단 내 앵커 순서.
 */
public record PageResult(String title, List<ContentBlock> blocks, List<String> links) {

    public PageResult {
        blocks = (blocks == null ? List.of() : List.copyOf(blocks));
        links = (links == null ? List.of() : List.copyOf(links));
    }

    public static PageResult empty(String title) {
        return new PageResult(title, List.of(), List.of());
    }

    public boolean hasParagraph() {
        for (ContentBlock b : blocks) {
            if (b instanceof ContentBlock.Paragraph) return true;
        }
        return false;
    }
}
