package com.openforge.posgate.common;

import lombok.Getter;

import java.util.Map;

/**
 * An expected, client-facing failure. Carries the precise {@link ErrorCode}
 * so the handler never has to guess a status.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode code;
    private final transient Map<String, Object> details;

    public ApiException(ErrorCode code) {
        this(code, code.getDefaultMessage(), null);
    }

    public ApiException(ErrorCode code, String message) {
        this(code, message, null);
    }

    public ApiException(ErrorCode code, String message, Map<String, Object> details) {
        super(message);
        this.code = code;
        this.details = details;
    }
}
