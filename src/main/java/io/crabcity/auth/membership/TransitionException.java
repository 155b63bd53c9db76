package io.crabcity.auth.membership;

import io.crabcity.auth.error.AuthException;
import lombok.Getter;

import static io.crabcity.auth.error.AuthErrorType.INVALID_TRANSITION;

/**
 * An attempted transition that the membership table does not allow. Carries both the
 * attempted transition and the state it was attempted from.
 */
@Getter
public class TransitionException extends AuthException {

    private final MembershipTransition.Type transition;
    private final MembershipState from;
    private final String reason;

    public TransitionException(MembershipTransition.Type transition, MembershipState from, String reason) {
        super(INVALID_TRANSITION, "cannot apply " + transition + " from " + from + ": " + reason);
        this.transition = transition;
        this.from = from;
        this.reason = reason;
    }
}
