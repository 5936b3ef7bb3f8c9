package com.wikicrawler.core.extract;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

/** 추출 텍스트 공통 처리 */
final class Texts {
    private Texts() {}

    /**
     * 요소와 모든 하위 텍스트 노드를 문서 순서대로 그대로 이어 붙인 뒤 trim.
     * &lt;br&gt; 같은 요소는 줄바꿈으로 바꾸지 않는다(텍스트 노드만 모음).
     */
    static String text(Element el) {
        if (el == null) return "";
        StringBuilder sb = new StringBuilder();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode t) sb.append(t.getWholeText());
        }, el);
        return trim(sb.toString());
    }

    /** 앞뒤 공백 제거. 일반 공백 외에 NBSP(U+00A0, U+2007, U+202F)도 제거 */
    static String trim(String s) {
        if (s == null) return "";
        int start = 0;
        int end = s.length();
        while (start < end && isSpace(s.charAt(start))) start++;
        while (end > start && isSpace(s.charAt(end - 1))) end--;
        return s.substring(start, end);
    }

    private static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}
