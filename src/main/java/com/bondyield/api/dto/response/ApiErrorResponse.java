package com.bondyield.api.dto.response;

import com.bondyield.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import lombok.Value;

/**
 * Body of every failed request:
 * <pre>
 * {"success": false, "error": {"code", "message", "details", "timestamp", "path"}}
 * </pre>
 * {@code details} is omitted when there is nothing field-specific to report.
 */
@Value
public class ApiErrorResponse {

    boolean success;
    ErrorBody error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Map<String, Object> safeDetails = details != null ? details : Map.of();
        return new ApiErrorResponse(
                false, new ErrorBody(errorCode.getCode(), message, safeDetails, Instant.now(), path));
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class ErrorBody {
        String code;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
