package io.crabcity.auth.identity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.lang3.ArrayUtils;

import static io.crabcity.auth.constant.IdentityConstant.SIGLENGTH;
import static io.crabcity.auth.utils.EncodingUtils.base64Decode;
import static io.crabcity.auth.utils.EncodingUtils.base64Encode;

/**
 * A 64-byte Ed25519 signature.
 */
@EqualsAndHashCode
public final class Signature {

    private final byte[] bytes;

    private Signature(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Signature fromBytes(@NonNull final byte[] bytes) {
        if (bytes.length != SIGLENGTH) {
            throw new IllegalArgumentException("signature must be " + SIGLENGTH + " bytes, got " + bytes.length);
        }

        return new Signature(bytes.clone());
    }

    @JsonCreator
    public static Signature fromBase64(final String encoded) throws DecoderException {
        var bytes = base64Decode(encoded);
        if (bytes.length != SIGLENGTH) {
            throw new DecoderException("signature must be " + SIGLENGTH + " bytes, got " + bytes.length);
        }

        return new Signature(bytes);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @JsonValue
    public String toBase64() {
        return base64Encode(bytes);
    }

    @Override
    public String toString() {
        return "Signature(" + base64Encode(ArrayUtils.subarray(bytes, 0, 8)) + "...)";
    }
}
