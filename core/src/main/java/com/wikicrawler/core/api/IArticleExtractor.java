package com.wikicrawler.core.api;

import com.wikicrawler.core.model.PageResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/** 파싱된 문서에서 제목/본문 블록/링크를 뽑는 계약. 예외 대신 빈 결과를 돌려준다. */
public interface IArticleExtractor {

    PageResult extract(Document document);

    /** 원문 마크업을 파싱한 뒤 extract(Document) 위임 */
    default PageResult extract(String html, String baseUri) {
        String src = (html == null ? "" : html);
        return extract(Jsoup.parse(src, baseUri == null ? "" : baseUri));
    }
}
