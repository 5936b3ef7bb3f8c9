package com.wikicrawler.core.frontier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 영속 프런티어 상태: {"visited": [...], "file_count": n, "failures": {url: n}}.
 * - visited 는 늘어나기만 한다(삭제 API 없음)
 * - fileCount 는 지금까지 기록된 산출물 수
 * - failures 는 URL별 fetch 실패 누적(성공 시 제거), 비어 있으면 직렬화 생략
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"visited", "file_count", "failures"})
public final class FrontierState {

    private final Set<String> visited;
    private int fileCount;
    private final Map<String, Integer> failures;

    public FrontierState() {
        this(null, 0, null);
    }

    @JsonCreator
    public FrontierState(@JsonProperty("visited") Collection<String> visited,
                         @JsonProperty("file_count") int fileCount,
                         @JsonProperty("failures") Map<String, Integer> failures) {
        if (fileCount < 0) throw new IllegalArgumentException("file_count must be >= 0: " + fileCount);
        this.visited = new LinkedHashSet<>();
        if (visited != null) {
            for (String v : visited) if (v != null) this.visited.add(v);
        }
        this.fileCount = fileCount;
        this.failures = new LinkedHashMap<>();
        if (failures != null) {
            failures.forEach((k, v) -> { if (k != null && v != null && v > 0) this.failures.put(k, v); });
        }
    }

    @JsonProperty("visited")
    public Set<String> getVisited() { return Collections.unmodifiableSet(visited); }

    @JsonProperty("file_count")
    public int getFileCount() { return fileCount; }

    @JsonProperty("failures")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Integer> getFailures() { return Collections.unmodifiableMap(failures); }

    public boolean isVisited(String url) { return visited.contains(url); }

    public int failureCount(String url) { return failures.getOrDefault(url, 0); }

    // ---- 변경은 같은 패키지(Frontier)에서만 ----

    boolean markVisited(String url) {
        failures.remove(url);
        return visited.add(url);
    }

    int incrementFileCount() { return ++fileCount; }

    int recordFailure(String url) { return failures.merge(url, 1, Integer::sum); }
}
