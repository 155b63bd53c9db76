package io.crabcity.auth.invite;

import io.crabcity.auth.error.AuthException;
import lombok.Getter;

import java.util.OptionalInt;

import static io.crabcity.auth.error.AuthErrorType.INVALID_INVITE;

@Getter
public class InviteException extends AuthException {

    private final InviteErrorType reason;
    private final Integer linkIndex;

    public InviteException(InviteErrorType reason, String message) {
        this(reason, null, message, null);
    }

    public InviteException(InviteErrorType reason, Integer linkIndex, String message) {
        this(reason, linkIndex, message, null);
    }

    public InviteException(InviteErrorType reason, Integer linkIndex, String message, Throwable cause) {
        super(INVALID_INVITE, "invalid invite: " + message, cause);
        this.reason = reason;
        this.linkIndex = linkIndex;
    }

    /**
     * Zero-based index of the offending link, when the failure is tied to one.
     */
    public OptionalInt link() {
        return linkIndex == null ? OptionalInt.empty() : OptionalInt.of(linkIndex);
    }
}
