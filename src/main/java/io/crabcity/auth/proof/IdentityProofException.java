package io.crabcity.auth.proof;

import io.crabcity.auth.error.AuthException;
import lombok.Getter;

import static io.crabcity.auth.error.AuthErrorType.INVALID_IDENTITY_PROOF;

@Getter
public class IdentityProofException extends AuthException {

    private final ProofErrorType reason;

    public IdentityProofException(ProofErrorType reason, String message) {
        super(INVALID_IDENTITY_PROOF, "invalid identity proof: " + message);
        this.reason = reason;
    }

    public IdentityProofException(ProofErrorType reason, String message, Throwable cause) {
        super(INVALID_IDENTITY_PROOF, "invalid identity proof: " + message, cause);
        this.reason = reason;
    }

    public IdentityProofException(ProofErrorType reason) {
        this(reason, reason.getDescription());
    }
}
