package com.newsenricher.core.extractor;

import com.newsenricher.core.model.ContentRecord;

import java.util.Optional;

/**
 * 본문 추출 캐스케이드의 한 단계.
 * 반환 레코드의 extraction_method는 {@link ContentExtractor}가 {@link #name()}으로 채운다.
 * 최소 길이 검사도 호출 측 책임이다.
 */
public interface ExtractionStrategy {

    /** extraction_method 태그 */
    String name();

    /** 본문을 찾지 못하면 empty. 파싱 예외는 호출 측에서 "이 전략 실패"로 처리 */
    Optional<ContentRecord> extract(Page page) throws Exception;
}
