package io.crabcity.auth.invite;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why an invite was rejected. Each rule has its own type so callers never have to
 * guess from a generic "invalid invite".
 */
@Getter
@RequiredArgsConstructor
public enum InviteErrorType {
    MALFORMED("malformed"),
    UNSUPPORTED_VERSION("unsupported_version"),
    EMPTY_CHAIN("empty_chain"),
    CHAIN_TOO_DEEP("chain_too_deep"),
    DEPTH_EXHAUSTED("depth_exhausted"),
    DEPTH_NOT_DECREASING("depth_not_decreasing"),
    CAPABILITY_ESCALATION("capability_escalation"),
    EXPIRED("expired"),
    BAD_SIGNATURE("bad_signature"),
    ;

    private final String code;
}
