package com.newsenricher.core.error;

import com.newsenricher.core.model.ErrorKind;

import java.util.Objects;

/** 오류 분류(ErrorKind)를 실어 나르는 비검사 예외 */
public class EnrichmentException extends RuntimeException {
    private final ErrorKind kind;

    public EnrichmentException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public EnrichmentException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() { return kind; }
}
