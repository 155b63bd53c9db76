package io.crabcity.auth.identity;

import io.crabcity.auth.error.AuthException;

import static io.crabcity.auth.error.AuthErrorType.INVALID_SIGNATURE;

public class SignatureVerificationException extends AuthException {

    public SignatureVerificationException(String message) {
        super(INVALID_SIGNATURE, message);
    }

    public SignatureVerificationException(String message, Throwable cause) {
        super(INVALID_SIGNATURE, message, cause);
    }
}
