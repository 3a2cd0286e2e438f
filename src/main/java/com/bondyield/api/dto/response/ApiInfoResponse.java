package com.bondyield.api.dto.response;

import com.bondyield.api.dto.request.CalculateBondRequest;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Self-description returned by {@code GET /api/bonds}: what the API is, which endpoints it
 * exposes, and a ready-to-send example request body.
 */
@Data
@Builder
public class ApiInfoResponse {

    private String name;
    private String version;

    /** "METHOD path" to a one-line description. */
    private Map<String, String> endpoints;

    private CalculateBondRequest example;
}
