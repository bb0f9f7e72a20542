package com.pagelens.core.model;

/** EncodingResolver가 텍스트를 얻은 단계 (뒤로 갈수록 추정에 가까움) */
public enum DecodeStage {
    /** 응답이 선언한 charset으로 엄격 디코딩 성공 */
    DECLARED,
    /** 선언 charset 실패 후 사이트 힌트(GBK/UTF-8)로 성공 */
    SITE_HINT,
    /** 통계적 감지 결과(신뢰도 초과)로 디코딩 */
    DETECTED,
    /** 후보 인코딩 목록 중 하나로 성공 */
    FALLBACK,
    /** 모든 후보 실패: UTF-8 손실 디코딩 */
    LOSSY
}
