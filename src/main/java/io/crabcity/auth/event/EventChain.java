package io.crabcity.auth.event;

import io.crabcity.auth.identity.PublicKey;
import io.crabcity.auth.identity.SignatureVerificationException;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import static io.crabcity.auth.event.ChainErrorType.BAD_CHECKPOINT_SIGNATURE;
import static io.crabcity.auth.event.ChainErrorType.BROKEN_LINK;
import static io.crabcity.auth.event.ChainErrorType.CHECKPOINT_MISMATCH;
import static io.crabcity.auth.event.ChainErrorType.HASH_MISMATCH;
import static lombok.AccessLevel.PRIVATE;

/**
 * Verification over a contiguous range of events.
 */
@Slf4j
@NoArgsConstructor(access = PRIVATE)
public final class EventChain {

    /**
     * Sequential scan: each event must link to its predecessor's hash (the first to
     * {@code genesisPrevHash}) and carry the hash of its own fields.
     *
     * @param genesisPrevHash expected {@code prevHash} of the first event; for a segment
     *                        starting mid-log, the hash of the event before it
     * @throws ChainException at the first break, with its index and event id
     */
    public static void verify(@NonNull List<Event> events, @NonNull byte[] genesisPrevHash) throws ChainException {
        var expectedPrev = genesisPrevHash;
        for (int i = 0; i < events.size(); i++) {
            var event = events.get(i);
            if (!event.follows(expectedPrev)) {
                throw broken(new ChainException(BROKEN_LINK, i, event.getId(),
                        "event " + Long.toUnsignedString(event.getId()) + ": prev_hash does not match previous event's hash"));
            }
            if (!event.verifyHash()) {
                throw broken(new ChainException(HASH_MISMATCH, i, event.getId(),
                        "event " + Long.toUnsignedString(event.getId()) + ": hash mismatch (computed != stored)"));
            }
            expectedPrev = event.getHash();
        }
    }

    /**
     * Checks that every checkpoint is signed by {@code instanceKey} and, when the event it
     * attests is among {@code events}, that the attested hash is that event's hash.
     * Checkpoints outside the range are only signature-checked.
     */
    public static void verifyCheckpoints(
            @NonNull List<Event> events,
            @NonNull List<EventCheckpoint> checkpoints,
            @NonNull PublicKey instanceKey
    ) throws ChainException {
        var byId = new HashMap<Long, Event>();
        events.forEach(event -> byId.put(event.getId(), event));

        for (int i = 0; i < checkpoints.size(); i++) {
            var checkpoint = checkpoints.get(i);
            try {
                checkpoint.verify(instanceKey);
            } catch (SignatureVerificationException e) {
                throw broken(new ChainException(BAD_CHECKPOINT_SIGNATURE, i, checkpoint.getEventId(),
                        "checkpoint at event " + Long.toUnsignedString(checkpoint.getEventId()) + ": bad signature", e));
            }

            var event = byId.get(checkpoint.getEventId());
            if (event != null && !event.hasHash(checkpoint.getChainHeadHash())) {
                throw broken(new ChainException(CHECKPOINT_MISMATCH, i, checkpoint.getEventId(),
                        "checkpoint at event " + Long.toUnsignedString(checkpoint.getEventId()) + ": attested hash differs from stored event"));
            }
        }
    }

    /**
     * Chain verification followed by checkpoint verification.
     */
    public static void verify(
            @NonNull List<Event> events,
            @NonNull byte[] genesisPrevHash,
            @NonNull List<EventCheckpoint> checkpoints,
            @NonNull PublicKey instanceKey
    ) throws ChainException {
        verify(events, genesisPrevHash);
        verifyCheckpoints(events, checkpoints, instanceKey);
    }

    /**
     * The checkpoint with the lowest event id at or after {@code eventId}: the anchor that
     * proves inclusion of that event.
     */
    public static Optional<EventCheckpoint> nearestCheckpoint(@NonNull List<EventCheckpoint> checkpoints, long eventId) {
        return checkpoints.stream()
                .filter(checkpoint -> Long.compareUnsigned(checkpoint.getEventId(), eventId) >= 0)
                .min(Comparator.comparing(EventCheckpoint::getEventId, Long::compareUnsigned));
    }

    private static ChainException broken(ChainException e) {
        log.debug("Event chain verification failed at index {}: {}", e.getIndex(), e.getMessage());

        return e;
    }
}
