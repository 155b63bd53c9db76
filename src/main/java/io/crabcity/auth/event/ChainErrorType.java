package io.crabcity.auth.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ChainErrorType {
    /**
     * {@code prevHash} does not equal the previous event's hash.
     */
    BROKEN_LINK("broken_link"),
    /**
     * Stored hash does not match the hash recomputed from the fields.
     */
    HASH_MISMATCH("hash_mismatch"),
    BAD_CHECKPOINT_SIGNATURE("bad_checkpoint_signature"),
    /**
     * A checkpoint attests a different hash than the event with its id carries.
     */
    CHECKPOINT_MISMATCH("checkpoint_mismatch"),
    ;

    private final String code;
}
