package com.wikicrawler.app.config;

import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.util.YamlConfigLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * 실행 설정 결정: defaults → crawl.yml(있으면) → 환경변수 순으로 덮어쓴다.
 *
 * 환경변수:
 *  CRAWL_CONFIG       YAML 경로 (기본 ./crawl.yml, 없으면 건너뜀)
 *  MAX_FILES          최대 산출물 수 (기본 50)
 *  START_URLS         쉼표 구분 시작 URL
 *  OUTPUT_DIR         산출물 디렉터리 (기본 data)
 *  STATE_FILE         상태 파일 (기본 OUTPUT_DIR/crawl_state.json)
 *  SITE               host 범위 부분 문자열 (기본 wikipedia.org)
 *  FETCH_TIMEOUT_SEC  요청 타임아웃 초 (기본 30)
 */
public final class EnvConfigResolver {

    private final Map<String, String> env;

    public EnvConfigResolver(Map<String, String> env) {
        this.env = Objects.requireNonNull(env, "env");
    }

    public static EnvConfigResolver fromSystem() {
        return new EnvConfigResolver(System.getenv());
    }

    /** 최종 설정. 값이 잘못되면 IllegalArgumentException, YAML 읽기 실패는 IOException. */
    public CrawlConfig resolve() throws IOException {
        CrawlConfig cfg = loadYamlOrDefaults();
        applyEnv(cfg);
        cfg.validate();
        return cfg;
    }

    private CrawlConfig loadYamlOrDefaults() throws IOException {
        String explicit = get("CRAWL_CONFIG");
        if (explicit != null) {
            // 명시한 파일이 없으면 오류
            return YamlConfigLoader.load(Path.of(explicit));
        }
        Path def = Path.of("crawl.yml");
        return Files.exists(def) ? YamlConfigLoader.load(def) : CrawlConfig.defaults();
    }

    void applyEnv(CrawlConfig cfg) {
        String maxFiles = get("MAX_FILES");
        if (maxFiles != null) cfg.setMaxFiles(parseInt("MAX_FILES", maxFiles));

        String startUrls = get("START_URLS");
        if (startUrls != null) cfg.setStartUrls(YamlConfigLoader.splitCsv(startUrls));

        String outputDir = get("OUTPUT_DIR");
        if (outputDir != null) cfg.setOutputDir(Path.of(outputDir));

        String stateFile = get("STATE_FILE");
        if (stateFile != null) cfg.setStateFile(Path.of(stateFile));

        String site = get("SITE");
        if (site != null) cfg.setSite(site);

        String timeout = get("FETCH_TIMEOUT_SEC");
        if (timeout != null) cfg.setTimeout(Duration.ofSeconds(parseInt("FETCH_TIMEOUT_SEC", timeout)));
    }

    // 빈 문자열은 미설정으로 취급
    private String get(String key) {
        String v = env.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }
}
