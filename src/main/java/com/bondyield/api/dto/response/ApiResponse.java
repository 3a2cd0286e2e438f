package com.bondyield.api.dto.response;

import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Body of every successful bond API call: {@code {"success": true, "data": ..., "timestamp": ...}}.
 * Built by {@link com.bondyield.config.ApiResponseAdvice}; controllers return the bare payload.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiResponse<T> {

    boolean success;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
