package com.wikicrawler.core.service;

import com.wikicrawler.core.extract.JsoupArticleExtractor;
import com.wikicrawler.core.http.FetchException;
import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.CrawlSummary;
import com.wikicrawler.core.output.ArticleWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlServiceTest {

    private static final String A = "https://tr.wikipedia.org/wiki/A";
    private static final String B = "https://tr.wikipedia.org/wiki/B";
    private static final String C = "https://tr.wikipedia.org/wiki/C";

    @TempDir
    Path tmp;

    private final Map<String, String> site = Map.of(
            A, page("Alpha", "/wiki/B"),
            B, page("Beta", "/wiki/C"),
            C, page("Gamma", "/wiki/A"));
    private final List<String> fetched = new ArrayList<>();

    private static String page(String title, String link) {
        return "<span class=\"mw-page-title-main\">" + title + "</span>"
                + "<div class=\"mw-content-ltr\"><p>" + title + " <a href=\"" + link + "\">next</a></p></div>";
    }

    private CrawlService service(int maxFiles) {
        CrawlConfig cfg = CrawlConfig.defaults()
                .setStartUrls(List.of(A))
                .setMaxFiles(maxFiles)
                .setOutputDir(tmp.resolve("data"));
        return new CrawlService(cfg, (url, timeout) -> {
            fetched.add(url);
            String html = site.get(url);
            if (html == null) throw FetchException.httpStatus(url, 404);
            return html;
        }, new JsoupArticleExtractor(), new ArticleWriter());
    }

    @Test
    @DisplayName("예산을 늘려 다시 실행하면 방문하지 않은 시드부터 이어간다")
    void second_run_with_same_state_does_not_redo_work() throws IOException {
        CrawlSummary first = service(2).run();
        assertThat(first.stopReason).isEqualTo(CrawlSummary.StopReason.BUDGET_REACHED);
        assertThat(fetched).containsExactly(A, B);

        fetched.clear();
        CrawlSummary second = service(3).run();

        // 큐는 저장되지 않으므로 시드(A)만 다시 들어오고 이미 방문 → 거절
        assertThat(fetched).isEmpty();
        assertThat(second.fileCount).isEqualTo(2);
        assertThat(second.stopReason).isEqualTo(CrawlSummary.StopReason.FRONTIER_EXHAUSTED);
        assertThat(Files.exists(tmp.resolve("data/crawl_state.json"))).isTrue();
    }

    @Test
    @DisplayName("깨진 상태 파일은 IOException, 진행 상황을 초기화하지 않는다")
    void corrupt_state_file_fails_the_run() throws IOException {
        Path state = tmp.resolve("data/crawl_state.json");
        Files.createDirectories(state.getParent());
        Files.writeString(state, "{\"visited\": [\"x\"], \"file_count\": ");

        assertThatThrownBy(() -> service(5).run()).isInstanceOf(IOException.class);
        assertThat(fetched).isEmpty();
        assertThat(Files.readString(state)).startsWith("{\"visited\"");
    }

    @Test
    void invalid_config_is_rejected_at_construction() {
        CrawlConfig cfg = CrawlConfig.defaults().setMaxFiles(-1);

        assertThatThrownBy(() -> new CrawlService(cfg))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxFiles");
    }
}
