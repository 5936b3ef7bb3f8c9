package com.wikicrawler.core.extract;

import com.wikicrawler.core.api.IArticleExtractor;
import com.wikicrawler.core.model.ContentBlock;
import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.PageResult;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.QueryParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSoup 기반 위키 본문 추출기.
 * - 제목: titleSelector 첫 요소의 텍스트
 * - 본문 컨테이너(contentSelector)의 직계 p, 2단계 이내 h1~h6 을 문서 순서로 수집
 * - 문단 안의 a[href] 를 원문 그대로 링크 목록에 추가
 */
public class JsoupArticleExtractor implements IArticleExtractor {
    private final String titleSelector;
    private final String contentSelector;

    public JsoupArticleExtractor() {
        this(new CrawlConfig.ExtractCfg());
    }

    public JsoupArticleExtractor(CrawlConfig.ExtractCfg cfg) {
        this(cfg.getTitleSelector(), cfg.getContentSelector());
    }

    public JsoupArticleExtractor(String titleSelector, String contentSelector) {
        this.titleSelector = Objects.requireNonNull(titleSelector, "titleSelector");
        this.contentSelector = Objects.requireNonNull(contentSelector, "contentSelector");
        // 잘못된 셀렉터는 생성 시점에 실패시킨다 (SelectorParseException)
        QueryParser.parse(titleSelector);
        QueryParser.parse(contentSelector);
    }

    @Override
    public PageResult extract(Document doc) {
        if (doc == null) return PageResult.empty(null);

        String title = extractTitle(doc);
        Element content = doc.selectFirst(contentSelector);
        if (content == null) return PageResult.empty(title);

        List<ContentBlock> blocks = new ArrayList<>();
        List<String> links = new ArrayList<>();

        // 한 번의 순회로 분류: 자식 자체 → 그 자식의 직계 heading 순서가 곧 문서 순서
        for (Element child : content.children()) {
            if ("p".equals(child.normalName())) {
                addParagraph(child, blocks, links);
            } else {
                addHeading(child, blocks);
            }
            for (Element grandChild : child.children()) {
                addHeading(grandChild, blocks);
            }
        }
        return new PageResult(title, blocks, links);
    }

    String extractTitle(Document doc) {
        Element el = doc.selectFirst(titleSelector);
        if (el == null) return null;
        return Texts.text(el);
    }

    private static void addParagraph(Element p, List<ContentBlock> blocks, List<String> links) {
        // 링크 먼저 (문서 순서)
        for (Element a : p.getElementsByTag("a")) {
            String href = a.attr("href");
            if (!href.isEmpty()) links.add(href);
        }
        String text = Texts.text(p);
        if (!text.isEmpty()) blocks.add(ContentBlock.paragraph(text));
    }

    private static void addHeading(Element el, List<ContentBlock> blocks) {
        int level = headingLevel(el);
        if (level > 0) blocks.add(ContentBlock.heading(level, Texts.text(el)));
    }

    /** h1..h6 이면 1..6, 아니면 0 */
    static int headingLevel(Element el) {
        String name = el.normalName();
        if (name.length() != 2 || name.charAt(0) != 'h') return 0;
        char c = name.charAt(1);
        return (c >= '1' && c <= '6') ? c - '0' : 0;
    }
}
