package io.crabcity.auth.identity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import org.apache.commons.codec.DecoderException;

import static io.crabcity.auth.constant.IdentityConstant.FINGERPRINT_CHARS;
import static io.crabcity.auth.constant.IdentityConstant.FINGERPRINT_PREFIX;
import static io.crabcity.auth.constant.IdentityConstant.KEYSIZE;
import static io.crabcity.auth.utils.EncodingUtils.base64Decode;
import static io.crabcity.auth.utils.EncodingUtils.base64Encode;
import static io.crabcity.auth.utils.EncodingUtils.crockfordEncode;

/**
 * A 32-byte Ed25519 public key. This is the canonical identity of an actor and is
 * compared by byte equality only.
 */
@EqualsAndHashCode
public final class PublicKey {

    /**
     * Synthetic identity of the local operator (CLI/TUI over loopback). All zero bytes.
     * Never valid as the remote party of a network connection.
     */
    public static final PublicKey LOOPBACK = new PublicKey(new byte[KEYSIZE]);

    private final byte[] bytes;

    private PublicKey(byte[] bytes) {
        this.bytes = bytes;
    }

    public static PublicKey fromBytes(@NonNull final byte[] bytes) {
        if (bytes.length != KEYSIZE) {
            throw new IllegalArgumentException("public key must be " + KEYSIZE + " bytes, got " + bytes.length);
        }

        return new PublicKey(bytes.clone());
    }

    /**
     * Parse the URL-safe unpadded base64 form produced by {@link #toString()}.
     */
    @JsonCreator
    public static PublicKey fromBase64(final String encoded) throws DecoderException {
        var bytes = base64Decode(encoded);
        if (bytes.length != KEYSIZE) {
            throw new DecoderException("public key must be " + KEYSIZE + " bytes, got " + bytes.length);
        }

        return new PublicKey(bytes);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public boolean isLoopback() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }

        return true;
    }

    /**
     * {@code crab_} followed by the first 8 Crockford base32 characters of the key.
     * For display only: distinct keys can share a fingerprint.
     */
    public String fingerprint() {
        return FINGERPRINT_PREFIX + crockfordEncode(bytes).substring(0, FINGERPRINT_CHARS);
    }

    @JsonValue
    @Override
    public String toString() {
        return base64Encode(bytes);
    }
}
