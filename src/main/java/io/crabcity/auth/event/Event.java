package io.crabcity.auth.event;

import com.fasterxml.jackson.databind.JsonNode;
import io.crabcity.auth.identity.PublicKey;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;

import static io.crabcity.auth.constant.IdentityConstant.HASHLENGTH;
import static io.crabcity.auth.utils.IdentityUtils.fullHash;
import static io.crabcity.auth.utils.JsonUtils.canonicalBytes;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.isNull;
import static lombok.AccessLevel.PRIVATE;

/**
 * One append-only audit log entry, linked to its predecessor by {@code prevHash}.
 * <p>
 * {@code hash = SHA-256(id(8, BE) ++ prevHash ++ type ++ actor ++ target ++ payload ++ createdAt)},
 * where an absent actor or target contributes a single {@code 0x00} byte, a present one
 * {@code 0x01} followed by the key, and the payload is compact JSON with sorted keys.
 */
@Value
@AllArgsConstructor(access = PRIVATE)
public class Event {

    private static final byte ABSENT = 0x00;
    private static final byte PRESENT = 0x01;

    /**
     * Unsigned 64-bit sequence number.
     */
    long id;
    byte[] prevHash;
    EventType type;
    PublicKey actor;
    PublicKey target;
    JsonNode payload;
    String createdAt;
    byte[] hash;

    /**
     * A new event with its hash computed from the fields.
     */
    public static Event create(
            long id,
            @NonNull byte[] prevHash,
            @NonNull EventType type,
            PublicKey actor,
            PublicKey target,
            @NonNull JsonNode payload,
            @NonNull String createdAt
    ) {
        checkHashLength(prevHash, "prevHash");
        var payloadCopy = payload.deepCopy();
        var hash = computeHash(id, prevHash, type, actor, target, payloadCopy, createdAt);

        return new Event(id, prevHash.clone(), type, actor, target, payloadCopy, createdAt, hash);
    }

    /**
     * The event following {@code previous}: next id, linked to its hash.
     */
    public static Event next(
            @NonNull Event previous,
            @NonNull EventType type,
            PublicKey actor,
            PublicKey target,
            @NonNull JsonNode payload,
            @NonNull String createdAt
    ) {
        return create(previous.id + 1, previous.hash, type, actor, target, payload, createdAt);
    }

    /**
     * An event as read back from storage, with its stored hash taken as is.
     * Use {@link #verifyHash()} or {@link EventChain#verify} to check it.
     */
    public static Event restore(
            long id,
            @NonNull byte[] prevHash,
            @NonNull EventType type,
            PublicKey actor,
            PublicKey target,
            @NonNull JsonNode payload,
            @NonNull String createdAt,
            @NonNull byte[] hash
    ) {
        checkHashLength(prevHash, "prevHash");
        checkHashLength(hash, "hash");

        return new Event(id, prevHash.clone(), type, actor, target, payload.deepCopy(), createdAt, hash.clone());
    }

    /**
     * The {@code prevHash} of the first event in an instance's log.
     */
    public static byte[] genesisPrevHash(@NonNull PublicKey instance) {
        return fullHash(instance.toBytes());
    }

    public byte[] getPrevHash() {
        return prevHash.clone();
    }

    public byte[] getHash() {
        return hash.clone();
    }

    public JsonNode getPayload() {
        return payload.deepCopy();
    }

    public Optional<PublicKey> actor() {
        return Optional.ofNullable(actor);
    }

    public Optional<PublicKey> target() {
        return Optional.ofNullable(target);
    }

    public byte[] computeHash() {
        return computeHash(id, prevHash, type, actor, target, payload, createdAt);
    }

    public boolean verifyHash() {
        return Arrays.equals(hash, computeHash());
    }

    boolean hasHash(byte[] expected) {
        return Arrays.equals(hash, expected);
    }

    boolean follows(byte[] expectedPrevHash) {
        return Arrays.equals(prevHash, expectedPrevHash);
    }

    private static byte[] computeHash(
            long id,
            byte[] prevHash,
            EventType type,
            PublicKey actor,
            PublicKey target,
            JsonNode payload,
            String createdAt
    ) {
        return fullHash(
                ByteBuffer.allocate(Long.BYTES).putLong(id).array(),
                prevHash,
                type.getLabel().getBytes(UTF_8),
                optionalKey(actor),
                optionalKey(target),
                canonicalBytes(payload),
                createdAt.getBytes(UTF_8)
        );
    }

    private static byte[] optionalKey(PublicKey key) {
        if (isNull(key)) {
            return new byte[]{ABSENT};
        }

        return ByteBuffer.allocate(1 + key.toBytes().length).put(PRESENT).put(key.toBytes()).array();
    }

    private static void checkHashLength(byte[] value, String name) {
        if (value.length != HASHLENGTH) {
            throw new IllegalArgumentException(name + " must be " + HASHLENGTH + " bytes, got " + value.length);
        }
    }
}
