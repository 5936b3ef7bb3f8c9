package com.wikicrawler.core.frontier;

import java.net.URI;
import java.util.Locale;

/** href 정규화 + 사이트 범위 판정 유틸 */
public final class LinkNormalizer {
    private LinkNormalizer(){}

    /**
     * 정규화 규칙:
     * - 빈 문자열, "#..." → null
     * - "//..."(프로토콜 상대) → null
     * - "/..." → base 의 scheme://authority + href (.. / . 해석 없음), base 없으면 null
     * - "http://", "https://" 로 시작 → 그대로
     * - 그 외(mailto:, javascript:, 상대 경로 등) → null
     */
    public static String normalize(String href, String baseUrl) {
        if (href == null || href.isEmpty() || href.startsWith("#")) return null;
        if (href.startsWith("//")) return null;

        if (href.startsWith("/")) {
            String root = siteRoot(baseUrl);
            return root == null ? null : root + href;
        }

        String lower = href.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return href;
        return null;
    }

    /** host 에 site 부분 문자열이 있으면 true(대소문자 무시). host 파싱 실패 시 false */
    public static boolean inScope(String url, String site) {
        if (url == null || site == null || site.isBlank()) return false;
        String host = hostOf(url);
        if (host == null) return false;
        return host.toLowerCase(Locale.ROOT).contains(site.toLowerCase(Locale.ROOT));
    }

    static String hostOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    // base 의 "scheme://authority" (포트 포함), 파싱 불가면 null
    private static String siteRoot(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) return null;
        try {
            URI base = URI.create(baseUrl);
            String scheme = base.getScheme();
            String authority = base.getRawAuthority();
            if (scheme == null || authority == null) return null;
            return scheme + "://" + authority;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
