package io.crabcity.auth.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable, machine-readable error codes surfaced to callers.
 */
@Getter
@RequiredArgsConstructor
public enum AuthErrorType {
    INVALID_INVITE("invalid_invite"),
    INVALID_IDENTITY_PROOF("invalid_identity_proof"),
    INVALID_SIGNATURE("invalid_signature"),
    INVALID_TRANSITION("invalid_transition"),
    INVALID_REMOTE_IDENTITY("invalid_remote_identity"),
    INVALID_NOUN("invalid_noun"),
    CHAIN_BROKEN("chain_broken"),
    NOT_A_MEMBER("not_a_member"),
    GRANT_NOT_ACTIVE("grant_not_active"),
    INSUFFICIENT_ACCESS("insufficient_access"),
    BLOCKLISTED("blocklisted"),
    HANDLE_TAKEN("handle_taken"),
    ALREADY_A_MEMBER("already_a_member"),
    ;

    private final String code;
}
