package io.crabcity.auth.event;

import io.crabcity.auth.error.AuthException;
import lombok.Getter;

import static io.crabcity.auth.error.AuthErrorType.CHAIN_BROKEN;

/**
 * First break found in an event log.
 */
@Getter
public class ChainException extends AuthException {

    private final ChainErrorType kind;
    /**
     * Position in the verified list: of the event, or of the checkpoint for checkpoint failures.
     */
    private final int index;
    private final long eventId;

    public ChainException(ChainErrorType kind, int index, long eventId, String message) {
        super(CHAIN_BROKEN, message);
        this.kind = kind;
        this.index = index;
        this.eventId = eventId;
    }

    public ChainException(ChainErrorType kind, int index, long eventId, String message, Throwable cause) {
        super(CHAIN_BROKEN, message, cause);
        this.kind = kind;
        this.index = index;
        this.eventId = eventId;
    }
}
