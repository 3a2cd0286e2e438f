package com.bondyield.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes returned in {@code error.code}, each bound to the HTTP status it is sent with.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(400),
    BAD_REQUEST(400),
    NOT_FOUND(404),
    METHOD_NOT_ALLOWED(405),
    UNSUPPORTED_MEDIA_TYPE(415),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    public String getCode() {
        return name();
    }
}
