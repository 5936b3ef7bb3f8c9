package com.wikicrawler.core.util;

import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.EmptyPagePolicy;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * startUrls: ["https://tr.wikipedia.org/wiki/T%C3%BCrkiye"]   # 또는 "a,b,c"
 * maxFiles: 50
 * site: "wikipedia.org"
 * outputDir: "data"
 * stateFile: "data/crawl_state.json"
 * timeoutSec: 30
 * userAgent: "WikiCrawler/0.1"
 *
 * extract:
 *   titleSelector: "span.mw-page-title-main"
 *   contentSelector: "div.mw-content-ltr"
 *
 * policy:
 *   emptyPage: WRITE | SKIP
 *   maxFetchAttempts: 3
 *   dedupAtEnqueue: false
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("crawl.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);
            return apply(root, CrawlConfig.defaults());
        }
    }

    /** 이미 파싱된 YAML 트리를 cfg 위에 덮어쓴다. 검증은 호출자 몫. */
    static CrawlConfig apply(Object root, CrawlConfig cfg) {
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setStringList(map, "startUrls", cfg::setStartUrls);
        setInt(map, "maxFiles", cfg::setMaxFiles);
        setString(map, "site", cfg::setSite);
        setPath(map, "outputDir", cfg::setOutputDir);
        setPath(map, "stateFile", cfg::setStateFile);
        setInt(map, "timeoutSec", cfg::setTimeoutSeconds);
        setString(map, "userAgent", cfg::setUserAgent);

        // 2) extract.*
        Map<String, Object> extract = getMap(map, "extract");
        if (extract != null) {
            var e = cfg.extract();
            setString(extract, "titleSelector", e::setTitleSelector);
            setString(extract, "contentSelector", e::setContentSelector);
        }

        // 3) policy.*
        Map<String, Object> policy = getMap(map, "policy");
        if (policy != null) {
            var p = cfg.policy();
            setEnum(policy, "emptyPage", EmptyPagePolicy.class, p::setEmptyPage);
            setInt(policy, "maxFetchAttempts", p::setMaxFetchAttempts);
            setBoolean(policy, "dedupAtEnqueue", p::setDedupAtEnqueue);
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        setter.accept(splitCsv(String.valueOf(v)));
    }

    /** 쉼표 구분 문자열 → 공백 제거된 비어 있지 않은 항목들 */
    public static List<String> splitCsv(String s) {
        List<String> out = new ArrayList<>();
        if (s == null) return out;
        for (String p : s.split(",")) {
            String t = p.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) {
            try {
                setter.accept(Integer.parseInt(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer: " + v, e);
            }
        }
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException(key + " must be one of "
                + List.of(type.getEnumConstants()) + ": " + s.toUpperCase(Locale.ROOT));
    }
}
