package com.wikicrawler.core.frontier;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LinkNormalizerTest {

    private static final String BASE = "https://tr.wikipedia.org/wiki/Bar";

    @Test
    void root_relative_is_resolved_against_base_host() {
        assertThat(LinkNormalizer.normalize("/wiki/Foo", BASE)).isEqualTo("https://tr.wikipedia.org/wiki/Foo");
        // .. 해석은 하지 않음
        assertThat(LinkNormalizer.normalize("/wiki/../Foo", BASE)).isEqualTo("https://tr.wikipedia.org/wiki/../Foo");
    }

    @Test
    void root_relative_keeps_non_default_port() {
        assertThat(LinkNormalizer.normalize("/wiki/Foo", "http://127.0.0.1:8080/wiki/Bar"))
                .isEqualTo("http://127.0.0.1:8080/wiki/Foo");
    }

    @Test
    void root_relative_without_base_is_rejected() {
        assertThat(LinkNormalizer.normalize("/wiki/Foo", null)).isNull();
        assertThat(LinkNormalizer.normalize("/wiki/Foo", "not a url")).isNull();
    }

    @Test
    void absolute_http_urls_pass_through_unchanged() {
        assertThat(LinkNormalizer.normalize("https://en.wikipedia.org/wiki/X#y", BASE))
                .isEqualTo("https://en.wikipedia.org/wiki/X#y");
        assertThat(LinkNormalizer.normalize("HTTP://example.com", BASE)).isEqualTo("HTTP://example.com");
    }

    @Test
    void everything_else_is_rejected() {
        assertThat(LinkNormalizer.normalize("", BASE)).isNull();
        assertThat(LinkNormalizer.normalize(null, BASE)).isNull();
        assertThat(LinkNormalizer.normalize("#cite_note-1", BASE)).isNull();
        assertThat(LinkNormalizer.normalize("javascript:void(0)", BASE)).isNull();
        assertThat(LinkNormalizer.normalize("mailto:a@b.c", BASE)).isNull();
        assertThat(LinkNormalizer.normalize("//upload.wikimedia.org/x.png", BASE)).isNull();
        assertThat(LinkNormalizer.normalize("Foo", BASE)).isNull();
        assertThat(LinkNormalizer.normalize("./Foo", BASE)).isNull();
    }

    @Test
    void scope_is_host_substring_case_insensitive() {
        assertThat(LinkNormalizer.inScope("https://tr.wikipedia.org/wiki/A", "wikipedia.org")).isTrue();
        assertThat(LinkNormalizer.inScope("https://TR.Wikipedia.ORG/wiki/A", "wikipedia.org")).isTrue();
        assertThat(LinkNormalizer.inScope("https://www.wikidata.org/wiki/Q1", "wikipedia.org")).isFalse();
        // path 에만 있는 경우는 제외
        assertThat(LinkNormalizer.inScope("https://evil.com/wikipedia.org", "wikipedia.org")).isFalse();
    }

    @Test
    void malformed_url_is_out_of_scope() {
        assertThat(LinkNormalizer.inScope("https://tr.wikipedia.org/wiki/A B", "wikipedia.org")).isFalse();
        assertThat(LinkNormalizer.inScope("no host", "wikipedia.org")).isFalse();
        assertThat(LinkNormalizer.inScope(null, "wikipedia.org")).isFalse();
    }
}
