package com.wikicrawler.core.output;

import com.wikicrawler.core.model.ContentBlock;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * 제목 + 필터링된 블록을 텍스트 산출물로 기록.
 * 형식:
 * <pre>
 * Title: 제목
 * ==================================================
 *
 * ## 소제목
 *
 * 문단
 *
 * </pre>
 */
public class ArticleWriter {

    static final String SEPARATOR = "=".repeat(50);
    static final String UNTITLED = "Untitled";

    /**
     * destination 을 덮어쓴다. 임시 파일에 다 쓴 뒤 move 하므로 실패해도 destination 에 잘린 파일이 남지 않는다.
     * 실패는 IOException 그대로 전달(재시도 없음).
     */
    public void write(String title, List<ContentBlock> blocks, Path destination) throws IOException {
        Path tmp = destination.resolveSibling(destination.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, render(title, blocks), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            try {
                Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    public static String render(String title, List<ContentBlock> blocks) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Title: ").append(title == null ? UNTITLED : title).append('\n');
        sb.append(SEPARATOR).append("\n\n");

        if (blocks != null) {
            for (ContentBlock b : blocks) {
                if (b instanceof ContentBlock.Heading h) {
                    sb.append("#".repeat(h.level())).append(' ').append(h.text()).append("\n\n");
                } else {
                    sb.append(b.text()).append("\n\n");
                }
            }
        }
        return sb.toString();
    }
}
