package com.pagelens.core.dom;

import com.pagelens.core.api.PageElement;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** jsoup Element 어댑터 */
final class JsoupPageElement implements PageElement {
    private final Element el;

    JsoupPageElement(Element el) {
        this.el = Objects.requireNonNull(el, "el");
    }

    @Override public String text() { return el.text().trim(); }

    @Override
    public Optional<String> attr(String name) {
        if (name == null || !el.hasAttr(name)) return Optional.empty();
        return Optional.of(el.attr(name));
    }

    @Override
    public List<PageElement> select(String cssQuery) {
        try {
            return wrap(el.select(cssQuery));
        } catch (Selector.SelectorParseException e) {
            return List.of();
        }
    }

    @Override
    public List<PageElement> all(String tag) {
        return wrap(el.getElementsByTag(tag));
    }

    @Override
    public PageElement isolatedCopy() {
        // clone()은 부모 없는 독립 서브트리를 만든다
        return new JsoupPageElement(el.clone());
    }

    @Override
    public void detach() {
        if (el.parent() != null) {
            el.remove();
        } else {
            // 루트 자체가 노이즈(예: <body class="header">)면 텍스트가 남지 않아야 한다
            el.empty();
        }
    }

    static List<PageElement> wrap(List<Element> elements) {
        List<PageElement> out = new ArrayList<>(elements.size());
        for (Element e : elements) out.add(new JsoupPageElement(e));
        return out;
    }
}
