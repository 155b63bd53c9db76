package io.crabcity.auth.error;

import lombok.Getter;

import java.util.List;

import static io.crabcity.auth.error.RecoveryAction.Kind.NONE;
import static io.crabcity.auth.error.RecoveryAction.Kind.RECONNECT;
import static io.crabcity.auth.error.RecoveryAction.Kind.REDEEM_INVITE;

/**
 * Base of every failure raised by this library. Each subclass narrows the
 * {@link AuthErrorType} and may carry its own detail type.
 */
@Getter
public class AuthException extends Exception {

    private final AuthErrorType type;

    public AuthException(AuthErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public AuthException(AuthErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public String getErrorCode() {
        return type.getCode();
    }

    public RecoveryAction getRecovery() {
        switch (type) {
            case NOT_A_MEMBER:
                return RecoveryAction.of(REDEEM_INVITE);
            case ALREADY_A_MEMBER:
                return RecoveryAction.of(RECONNECT);
            case GRANT_NOT_ACTIVE:
            case BLOCKLISTED:
                return RecoveryAction.contactAdmin(List.of(), getMessage());
            default:
                return RecoveryAction.of(NONE);
        }
    }

    public ErrorResponse toResponse() {
        return ErrorResponse.from(this);
    }
}
