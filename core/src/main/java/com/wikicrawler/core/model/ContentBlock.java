package com.wikicrawler.core.model;

import java.util.Objects;

/**
 * 본문 추출 단위: 제목(Heading) 또는 문단(Paragraph).
 * 문서 순서대로 생성되며 생성 후 불변.
 */
public interface ContentBlock {

    String text();

    record Heading(int level, String text) implements ContentBlock {
        public Heading {
            if (level < 1 || level > 6) throw new IllegalArgumentException("heading level must be 1..6: " + level);
            Objects.requireNonNull(text, "text");
        }
    }

    record Paragraph(String text) implements ContentBlock {
        public Paragraph {
            Objects.requireNonNull(text, "text");
        }
    }

    static Heading heading(int level, String text) { return new Heading(level, text); }

    static Paragraph paragraph(String text) { return new Paragraph(text); }
}
