package com.openforge.posgate.common;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Response envelope shared by every endpoint.
 *
 *   success → {"success":true,"data":…}
 *   failure → {"success":false,"error":"…","code":"TOKEN_EXPIRED"}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean             success,
        T                   data,
        String              message,
        String              error,
        String              code,
        Map<String, Object> details
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, null, null, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message, null, null, null);
    }

    public static ApiResponse<Void> error(ErrorCode code, String message, Map<String, Object> details) {
        return new ApiResponse<>(false, null, null, message, code.name(), details);
    }

    public static ApiResponse<Void> error(ApiException e) {
        return error(e.getCode(), e.getMessage(), e.getDetails());
    }
}
