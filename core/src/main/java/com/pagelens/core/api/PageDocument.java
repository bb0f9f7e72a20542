package com.pagelens.core.api;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 파싱된 문서에 대한 최소 조회 계약.
 * 분석기는 이 인터페이스만 사용하며 문서를 변경하지 않는다.
 */
public interface PageDocument {

    /** 문서 순서상 첫 번째 태그 요소 */
    Optional<PageElement> first(String tag);

    /** 문서 순서대로 모든 태그 요소 */
    List<PageElement> all(String tag);

    /** CSS 셀렉터 매칭. 잘못된 셀렉터는 빈 리스트. */
    List<PageElement> select(String cssQuery);

    /** tag 요소 중 attr 값이 조건을 만족하는 것 (속성이 없으면 제외) */
    List<PageElement> withAttribute(String tag, String attr, Predicate<String> valueTest);

    /** &lt;body&gt; 요소. 없으면 empty. */
    Optional<PageElement> body();
}
