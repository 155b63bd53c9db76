package io.crabcity.auth.event;

import io.crabcity.auth.identity.Identities;
import io.crabcity.auth.identity.PublicKey;
import io.crabcity.auth.identity.Signature;
import io.crabcity.auth.identity.SignatureVerificationException;
import io.crabcity.auth.identity.SigningKey;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.nio.ByteBuffer;

import static io.crabcity.auth.constant.EventConstant.CHECKPOINT_TAG;
import static io.crabcity.auth.constant.IdentityConstant.HASHLENGTH;
import static java.nio.charset.StandardCharsets.UTF_8;
import static lombok.AccessLevel.PRIVATE;

/**
 * The instance key's signature over a chain head. Signed message:
 * <pre>
 * {@code
 * "crab_city_checkpoint_v1:" ++ event_id(8, BE) ++ chain_head_hash(32) ++ created_at(utf8)
 * }
 * </pre>
 */
@Value
@AllArgsConstructor(access = PRIVATE)
public class EventCheckpoint {

    long eventId;
    byte[] chainHeadHash;
    Signature signature;
    String createdAt;

    public static EventCheckpoint sign(
            @NonNull SigningKey signingKey,
            long eventId,
            @NonNull byte[] chainHeadHash,
            @NonNull String createdAt
    ) {
        checkHashLength(chainHeadHash);
        var signature = signingKey.sign(signingMessage(eventId, chainHeadHash, createdAt));

        return new EventCheckpoint(eventId, chainHeadHash.clone(), signature, createdAt);
    }

    /**
     * Signs the head of {@code event}.
     */
    public static EventCheckpoint sign(@NonNull SigningKey signingKey, @NonNull Event event, @NonNull String createdAt) {
        return sign(signingKey, event.getId(), event.getHash(), createdAt);
    }

    public static EventCheckpoint restore(
            long eventId,
            @NonNull byte[] chainHeadHash,
            @NonNull Signature signature,
            @NonNull String createdAt
    ) {
        checkHashLength(chainHeadHash);

        return new EventCheckpoint(eventId, chainHeadHash.clone(), signature, createdAt);
    }

    public byte[] getChainHeadHash() {
        return chainHeadHash.clone();
    }

    public void verify(@NonNull PublicKey instanceKey) throws SignatureVerificationException {
        Identities.verify(instanceKey, signingMessage(eventId, chainHeadHash, createdAt), signature);
    }

    private static byte[] signingMessage(long eventId, byte[] chainHeadHash, String createdAt) {
        var createdAtBytes = createdAt.getBytes(UTF_8);

        return ByteBuffer.allocate(CHECKPOINT_TAG.length + Long.BYTES + HASHLENGTH + createdAtBytes.length)
                .put(CHECKPOINT_TAG)
                .putLong(eventId)
                .put(chainHeadHash)
                .put(createdAtBytes)
                .array();
    }

    private static void checkHashLength(byte[] hash) {
        if (hash.length != HASHLENGTH) {
            throw new IllegalArgumentException("chain head hash must be " + HASHLENGTH + " bytes, got " + hash.length);
        }
    }
}
