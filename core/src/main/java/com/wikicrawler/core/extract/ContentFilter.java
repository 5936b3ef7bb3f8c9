package com.wikicrawler.core.extract;

import com.wikicrawler.core.model.ContentBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 내용 없는 제목 제거 필터.
 * Heading 은 다음 Heading(또는 끝) 전에 Paragraph 가 하나라도 있을 때만 남긴다.
 * Paragraph 는 항상 유지. 순수 함수.
 */
public final class ContentFilter {
    private ContentFilter() {}

    public static List<ContentBlock> filter(List<ContentBlock> blocks) {
        if (blocks == null || blocks.isEmpty()) return List.of();

        // 뒤에서 앞으로: "다음 Heading 전까지 Paragraph 를 봤는가"
        List<ContentBlock> kept = new ArrayList<>(blocks.size());
        boolean paragraphAhead = false;
        for (int i = blocks.size() - 1; i >= 0; i--) {
            ContentBlock b = blocks.get(i);
            if (b instanceof ContentBlock.Heading) {
                if (paragraphAhead) kept.add(b);
                paragraphAhead = false;
            } else {
                kept.add(b);
                paragraphAhead = true;
            }
        }
        Collections.reverse(kept);
        return List.copyOf(kept);
    }
}
