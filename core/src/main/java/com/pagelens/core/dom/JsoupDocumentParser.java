package com.pagelens.core.dom;

import com.pagelens.core.api.IDocumentParser;
import com.pagelens.core.api.PageDocument;
import org.jsoup.Jsoup;

/** jsoup HTML 파서. 잘못된 마크업도 HTML5 트리 규칙에 따라 복구한다. */
public final class JsoupDocumentParser implements IDocumentParser {

    @Override
    public PageDocument parse(String html, String baseUrl) {
        String src = (html == null) ? "" : html;
        String base = (baseUrl == null) ? "" : baseUrl;
        return new JsoupPageDocument(Jsoup.parse(src, base));
    }
}
