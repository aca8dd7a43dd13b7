package com.newsenricher.core.model;

/** 배치 실행 방식 */
public enum ProcessingMode {
    /** 입력 순서대로 한 건씩 */
    SEQUENTIAL,
    /** 고정 크기 워커 풀 */
    CONCURRENT
}
