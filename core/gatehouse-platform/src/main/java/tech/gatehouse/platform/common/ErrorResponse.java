package tech.gatehouse.platform.common;

import java.util.Map;

/**
 * JSON error body returned by all resources.
 */
public record ErrorResponse(String error, String code, Map<String, Object> details) {

    public ErrorResponse(String error, String code) {
        this(error, code, Map.of());
    }
}
