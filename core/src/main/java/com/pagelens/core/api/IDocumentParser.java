package com.pagelens.core.api;

/** 파싱 최소 계약: 텍스트를 문서로. 잘못된 마크업도 최소 트리로 관대하게 처리. */
public interface IDocumentParser {
    PageDocument parse(String html, String baseUrl);
}
