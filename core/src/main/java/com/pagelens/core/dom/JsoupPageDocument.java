package com.pagelens.core.dom;

import com.pagelens.core.api.PageDocument;
import com.pagelens.core.api.PageElement;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/** jsoup Document 기반 PageDocument 구현 */
public final class JsoupPageDocument implements PageDocument {
    private final Document doc;

    public JsoupPageDocument(Document doc) {
        this.doc = Objects.requireNonNull(doc, "doc");
    }

    @Override
    public Optional<PageElement> first(String tag) {
        Element e = doc.getElementsByTag(tag).first();
        return (e == null) ? Optional.empty() : Optional.of(new JsoupPageElement(e));
    }

    @Override
    public List<PageElement> all(String tag) {
        return JsoupPageElement.wrap(doc.getElementsByTag(tag));
    }

    @Override
    public List<PageElement> select(String cssQuery) {
        try {
            return JsoupPageElement.wrap(doc.select(cssQuery));
        } catch (Selector.SelectorParseException e) {
            return List.of();
        }
    }

    @Override
    public List<PageElement> withAttribute(String tag, String attr, Predicate<String> valueTest) {
        List<PageElement> out = new ArrayList<>();
        for (Element e : doc.getElementsByTag(tag)) {
            if (!e.hasAttr(attr)) continue;
            if (valueTest == null || valueTest.test(e.attr(attr))) out.add(new JsoupPageElement(e));
        }
        return out;
    }

    /** doc.body()는 없으면 body를 만들어 버리므로 태그 조회로 확인한다 (프레임셋 문서는 body 없음). */
    @Override
    public Optional<PageElement> body() {
        Element b = doc.getElementsByTag("body").first();
        return (b == null) ? Optional.empty() : Optional.of(new JsoupPageElement(b));
    }
}
