package com.bondyield.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the application's exceptions. Carries the {@link ErrorCode} that decides the HTTP
 * status and an optional map of details rendered into the error body.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }
}
