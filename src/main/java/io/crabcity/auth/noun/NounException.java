package io.crabcity.auth.noun;

import io.crabcity.auth.error.AuthException;
import lombok.Getter;

import static io.crabcity.auth.error.AuthErrorType.INVALID_NOUN;

@Getter
public class NounException extends AuthException {

    private final NounErrorType reason;

    public NounException(NounErrorType reason, String message) {
        super(INVALID_NOUN, message);
        this.reason = reason;
    }
}
