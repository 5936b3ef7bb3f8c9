package com.wikicrawler.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * 환경변수 오버라이드는 app 쪽 EnvConfigResolver 에서 처리한다.
 */
public final class CrawlConfig {

    public static final String DEFAULT_SEED = "https://tr.wikipedia.org/wiki/Recep_Tayyip_Erdo%C4%9Fan";
    public static final String DEFAULT_SITE = "wikipedia.org";
    public static final String STATE_FILE_NAME = "crawl_state.json";

    /** 본문 추출 관련 하위 설정: YAML의 `extract:` 섹션과 매핑 */
    public static final class ExtractCfg {
        /** 문서 제목 요소 */
        private String titleSelector = "span.mw-page-title-main";
        /** 본문 컨테이너 요소 */
        private String contentSelector = "div.mw-content-ltr";

        public String getTitleSelector() { return titleSelector; }
        public ExtractCfg setTitleSelector(String v) { if (v != null && !v.isBlank()) this.titleSelector = v.trim(); return this; }

        public String getContentSelector() { return contentSelector; }
        public ExtractCfg setContentSelector(String v) { if (v != null && !v.isBlank()) this.contentSelector = v.trim(); return this; }
    }

    /** 프런티어 정책 하위 설정: YAML의 `policy:` 섹션과 매핑 */
    public static final class PolicyCfg {
        private EmptyPagePolicy emptyPage = EmptyPagePolicy.WRITE;
        /** URL당 fetch 시도 상한(실행 간 누적). 0이면 무제한 */
        private int maxFetchAttempts = 3;
        /** true면 큐 삽입 시점에 이미 큐에 있는 URL도 걸러낸다 */
        private boolean dedupAtEnqueue = false;

        public EmptyPagePolicy getEmptyPage() { return emptyPage; }
        public PolicyCfg setEmptyPage(EmptyPagePolicy v) { this.emptyPage = (v != null ? v : EmptyPagePolicy.WRITE); return this; }

        public int getMaxFetchAttempts() { return maxFetchAttempts; }
        public PolicyCfg setMaxFetchAttempts(int v) { this.maxFetchAttempts = v; return this; }

        public boolean isDedupAtEnqueue() { return dedupAtEnqueue; }
        public PolicyCfg setDedupAtEnqueue(boolean v) { this.dedupAtEnqueue = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private List<String> startUrls = List.of(DEFAULT_SEED);
    private int maxFiles = 50;
    private String site = DEFAULT_SITE;          // host 부분 문자열 매칭
    private Path outputDir = Path.of("data");
    private Path stateFile;                      // null이면 outputDir/crawl_state.json
    private Duration timeout = Duration.ofSeconds(30);
    private String userAgent = "WikiCrawler/0.1 (+crawler)";

    private final ExtractCfg extract = new ExtractCfg();
    private final PolicyCfg policy = new PolicyCfg();

    // ---------- getters ----------
    public List<String> getStartUrls() { return startUrls; }
    public int getMaxFiles() { return maxFiles; }
    public String getSite() { return site; }
    public Path getOutputDir() { return outputDir; }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public ExtractCfg extract() { return extract; }
    public PolicyCfg policy() { return policy; }

    /** 상태 파일 경로: 명시값 우선, 없으면 출력 디렉터리 아래 */
    public Path getStateFile() {
        return stateFile != null ? stateFile : outputDir.resolve(STATE_FILE_NAME);
    }

    // ---------- fluent setters ----------
    public CrawlConfig setStartUrls(List<String> urls) {
        if (urls == null) return this;
        List<String> out = new ArrayList<>();
        for (String u : urls) {
            if (u != null && !u.isBlank()) out.add(u.trim());
        }
        this.startUrls = List.copyOf(out);
        return this;
    }
    public CrawlConfig setMaxFiles(int maxFiles) { this.maxFiles = maxFiles; return this; }
    public CrawlConfig setSite(String site) { this.site = site; return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setStateFile(Path stateFile) { this.stateFile = stateFile; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setUserAgent(String userAgent) {
        if (userAgent != null && !userAgent.isBlank()) this.userAgent = userAgent.trim();
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(startUrls, "startUrls");
        if (startUrls.isEmpty()) throw new IllegalArgumentException("startUrls must not be empty");
        if (maxFiles < 0) throw new IllegalArgumentException("maxFiles must be >= 0");
        if (site == null || site.isBlank()) throw new IllegalArgumentException("site must not be blank");
        Objects.requireNonNull(outputDir, "outputDir");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (policy.getMaxFetchAttempts() < 0)
            throw new IllegalArgumentException("policy.maxFetchAttempts must be >= 0");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutSeconds() { return timeout.toSeconds(); }

    /** 0 이하도 그대로 받는다. 거절은 validate() 몫 */
    public CrawlConfig setTimeoutSeconds(long sec) {
        this.timeout = Duration.ofSeconds(sec);
        return this;
    }
}
