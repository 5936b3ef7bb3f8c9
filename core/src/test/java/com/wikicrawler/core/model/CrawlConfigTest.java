package com.wikicrawler.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlConfigTest {

    @Test
    void defaults_are_valid() {
        CrawlConfig cfg = CrawlConfig.defaults();

        assertThatCode(cfg::validate).doesNotThrowAnyException();
        assertThat(cfg.getMaxFiles()).isEqualTo(50);
        assertThat(cfg.getSite()).isEqualTo("wikipedia.org");
        assertThat(cfg.getTimeoutSeconds()).isEqualTo(30);
        assertThat(cfg.getStateFile()).isEqualTo(Path.of("data").resolve("crawl_state.json"));
        assertThat(cfg.policy().getEmptyPage()).isEqualTo(EmptyPagePolicy.WRITE);
        assertThat(cfg.policy().getMaxFetchAttempts()).isEqualTo(3);
        assertThat(cfg.policy().isDedupAtEnqueue()).isFalse();
    }

    @Test
    void state_file_follows_output_dir_unless_set() {
        CrawlConfig cfg = CrawlConfig.defaults().setOutputDir(Path.of("out"));
        assertThat(cfg.getStateFile()).isEqualTo(Path.of("out", "crawl_state.json"));

        cfg.setStateFile(Path.of("elsewhere.json"));
        assertThat(cfg.getStateFile()).isEqualTo(Path.of("elsewhere.json"));
    }

    @Test
    void start_urls_are_trimmed_and_blanks_dropped() {
        CrawlConfig cfg = CrawlConfig.defaults().setStartUrls(Arrays.asList(" https://x.org/a ", "", null, "  "));

        assertThat(cfg.getStartUrls()).containsExactly("https://x.org/a");
    }

    @Test
    void validate_rejects_bad_values() {
        assertThatThrownBy(() -> CrawlConfig.defaults().setStartUrls(List.of(" ")).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("startUrls");
        assertThatThrownBy(() -> CrawlConfig.defaults().setMaxFiles(-1).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxFiles");
        assertThatThrownBy(() -> CrawlConfig.defaults().setSite(" ").validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("site");
        assertThatThrownBy(() -> CrawlConfig.defaults().setTimeout(Duration.ZERO).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("timeout");

        CrawlConfig negativeAttempts = CrawlConfig.defaults();
        negativeAttempts.policy().setMaxFetchAttempts(-1);
        assertThatThrownBy(negativeAttempts::validate)
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxFetchAttempts");
    }

    @Test
    void zero_budget_is_allowed() {
        CrawlConfig cfg = CrawlConfig.defaults().setMaxFiles(0);

        assertThatCode(cfg::validate).doesNotThrowAnyException();
    }

    @Test
    void non_positive_timeout_seconds_fail_validation() {
        assertThatThrownBy(() -> CrawlConfig.defaults().setTimeoutSeconds(0).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("timeout");
        assertThatThrownBy(() -> CrawlConfig.defaults().setTimeoutSeconds(-5).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("timeout");
        assertThat(CrawlConfig.defaults().setTimeoutSeconds(1).getTimeoutSeconds()).isEqualTo(1);
    }

    @Test
    void blank_selectors_keep_defaults() {
        CrawlConfig cfg = CrawlConfig.defaults();
        cfg.extract().setTitleSelector(" ").setContentSelector(null);

        assertThat(cfg.extract().getTitleSelector()).isEqualTo("span.mw-page-title-main");
        assertThat(cfg.extract().getContentSelector()).isEqualTo("div.mw-content-ltr");
    }
}
