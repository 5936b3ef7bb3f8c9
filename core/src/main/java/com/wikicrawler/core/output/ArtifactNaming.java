package com.wikicrawler.core.output;

import java.nio.file.Path;
import java.util.Locale;

/** 산출물 파일명 규칙: {@code <번호:03d>_<정리된 제목>.txt} */
public final class ArtifactNaming {
    private ArtifactNaming() {}

    public static Path artifactPath(Path outputDir, int fileNumber, String title) {
        return outputDir.resolve(fileName(fileNumber, title));
    }

    public static String fileName(int fileNumber, String title) {
        if (fileNumber < 1) throw new IllegalArgumentException("fileNumber must be >= 1: " + fileNumber);
        return String.format(Locale.ROOT, "%03d_%s.txt", fileNumber, sanitize(title));
    }

    /** 제목 부분의 UTF-8 최대 바이트 수 (파일명 255바이트 제한 안에 번호와 확장자 여유) */
    static final int MAX_TITLE_BYTES = 200;

    /** 공백, 경로 구분자(/ \) → '_' ; 비어 있으면 "Untitled" ; 너무 길면 코드 포인트 경계에서 자름 */
    public static String sanitize(String title) {
        if (title == null || title.isBlank()) return ArticleWriter.UNTITLED;
        return truncateUtf8(title.replace(' ', '_').replace('/', '_').replace('\\', '_'), MAX_TITLE_BYTES);
    }

    private static String truncateUtf8(String s, int maxBytes) {
        int bytes = 0;
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            int len = cp < 0x80 ? 1 : cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
            if (bytes + len > maxBytes) break;
            bytes += len;
            i += Character.charCount(cp);
        }
        return s.substring(0, i);
    }
}
