package com.parkthrive.crmops.http;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;

import java.util.Map;

/**
 * One HTTP call. {@code path} is relative to the transport's base URL unless it is absolute.
 */
@Value
@Builder(toBuilder = true)
public class ApiRequest {

    HttpMethod method;
    String path;

    @Singular("queryParam")
    Map<String, String> queryParams;

    Object body;
    MediaType contentType;

    @Builder.Default
    Idempotency idempotency = Idempotency.READ;

    public enum Idempotency {
        READ,
        WRITE
    }

    public static ApiRequest get(String path) {
        return ApiRequest.builder()
                .method(HttpMethod.GET)
                .path(path)
                .idempotency(Idempotency.READ)
                .build();
    }

    /**
     * POST that only reads (search and report endpoints)
     */
    public static ApiRequest query(String path, Object body) {
        return ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(path)
                .body(body)
                .contentType(MediaType.APPLICATION_JSON)
                .idempotency(Idempotency.READ)
                .build();
    }

    public static ApiRequest put(String path, Object body) {
        return ApiRequest.builder()
                .method(HttpMethod.PUT)
                .path(path)
                .body(body)
                .contentType(MediaType.APPLICATION_JSON)
                .idempotency(Idempotency.WRITE)
                .build();
    }

    public static ApiRequest post(String path, Object body) {
        return ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(path)
                .body(body)
                .contentType(MediaType.APPLICATION_JSON)
                .idempotency(Idempotency.WRITE)
                .build();
    }

    public boolean isAbsolute() {
        return path != null && (path.startsWith("http://") || path.startsWith("https://"));
    }

    public String describe() {
        return method + " " + path;
    }
}
