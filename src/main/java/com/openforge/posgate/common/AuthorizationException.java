package com.openforge.posgate.common;

/**
 * Terminal authorization failure: authentication, tenant scope, role or
 * permission. Never retried, never downgraded to a 500.
 */
public class AuthorizationException extends ApiException {

    public AuthorizationException(ErrorCode code) {
        super(code);
    }

    public AuthorizationException(ErrorCode code, String message) {
        super(code, message);
    }
}
