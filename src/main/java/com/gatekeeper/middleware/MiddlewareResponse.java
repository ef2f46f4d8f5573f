package com.gatekeeper.middleware;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MiddlewareResponse {

    public static final int OK = 200;
    public static final int TOO_MANY_REQUESTS = 429;

    private boolean allowed;
    private int statusCode;
    private String message;
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    public static MiddlewareResponse allowed(Map<String, String> headers) {
        return MiddlewareResponse.builder()
                .allowed(true)
                .statusCode(OK)
                .message("OK")
                .headers(new LinkedHashMap<>(headers))
                .build();
    }

    public static MiddlewareResponse blocked(String message, Map<String, String> headers) {
        return MiddlewareResponse.builder()
                .allowed(false)
                .statusCode(TOO_MANY_REQUESTS)
                .message(message)
                .headers(new LinkedHashMap<>(headers))
                .build();
    }
}
