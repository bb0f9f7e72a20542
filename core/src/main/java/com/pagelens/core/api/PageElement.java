package com.pagelens.core.api;

import java.util.List;
import java.util.Optional;

/** 문서 트리의 한 요소(서브트리) */
public interface PageElement {

    /** 서브트리의 가시 텍스트. 공백은 단일 스페이스로 축약, 앞뒤 trim. */
    String text();

    /** 속성 값. 속성이 없으면 empty, 값이 빈 문자열이면 Optional.of(""). */
    Optional<String> attr(String name);

    /** 하위 요소 중 CSS 셀렉터 매칭 (자기 자신 포함 가능) */
    List<PageElement> select(String cssQuery);

    /** 하위 요소 중 태그 매칭 */
    List<PageElement> all(String tag);

    /** 원본 트리와 분리된 깊은 복사본. 복사본에 대한 detach는 원본에 영향 없음. */
    PageElement isolatedCopy();

    /** 트리에서 이 서브트리를 제거. 부모가 없는 루트(복사본)는 내용을 비운다. */
    void detach();
}
