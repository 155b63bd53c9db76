package io.crabcity.auth.invite;

import com.igormaznitsa.jbbp.io.JBBPBitInputStream;
import com.igormaznitsa.jbbp.io.JBBPBitOutputStream;
import io.crabcity.auth.capability.Capability;
import io.crabcity.auth.identity.Identities;
import io.crabcity.auth.identity.PublicKey;
import io.crabcity.auth.identity.Signature;
import io.crabcity.auth.identity.SignatureVerificationException;
import io.crabcity.auth.identity.SigningKey;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.io.IOException;
import java.nio.ByteBuffer;

import static com.igormaznitsa.jbbp.io.JBBPByteOrder.BIG_ENDIAN;
import static io.crabcity.auth.constant.IdentityConstant.HASHLENGTH;
import static io.crabcity.auth.constant.IdentityConstant.KEYSIZE;
import static io.crabcity.auth.constant.IdentityConstant.SIGLENGTH;
import static io.crabcity.auth.constant.InviteConstant.MAX_DEPTH_LIMIT;
import static io.crabcity.auth.constant.InviteConstant.MAX_USES_LIMIT;
import static io.crabcity.auth.constant.InviteConstant.NONCE_LENGTH;
import static io.crabcity.auth.utils.IdentityUtils.fullHash;
import static io.crabcity.auth.utils.IdentityUtils.randomBytes;
import static java.util.Objects.isNull;
import static lombok.AccessLevel.PRIVATE;

/**
 * One hop of a delegation chain.
 * <p>
 * Binary layout, 126 bytes, big endian:
 * <pre>
 * {@code
 * issuer(32) capability(1) max_depth(1) max_uses(4) expires_at(8) nonce(16) signature(64)
 * }
 * </pre>
 * An {@code expires_at} of zero means the link never expires.
 */
@Value
@AllArgsConstructor(access = PRIVATE)
public class InviteLink {

    PublicKey issuer;
    Capability capability;
    /**
     * Remaining sub-delegations allowed below this link, 0..255.
     */
    int maxDepth;
    /**
     * Unsigned 32-bit; 0 means unlimited. Enforced by the caller at redemption.
     */
    long maxUses;
    /**
     * Unix seconds, or null for no expiry.
     */
    Long expiresAt;
    byte[] nonce;
    Signature signature;

    /**
     * Create and sign a link. The signature covers
     * {@code prevLinkHash ++ instance ++ fields}; the root uses 32 zero bytes as previous hash.
     */
    public static InviteLink sign(
            @NonNull SigningKey signingKey,
            @NonNull byte[] prevLinkHash,
            @NonNull PublicKey instance,
            @NonNull Capability capability,
            int maxDepth,
            long maxUses,
            Long expiresAt
    ) {
        if (maxDepth < 0 || maxDepth > MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException("max_depth must fit in an unsigned byte: " + maxDepth);
        }
        if (maxUses < 0 || maxUses > MAX_USES_LIMIT) {
            throw new IllegalArgumentException("max_uses must fit in an unsigned 32-bit integer: " + maxUses);
        }
        if (prevLinkHash.length != HASHLENGTH) {
            throw new IllegalArgumentException("previous link hash must be " + HASHLENGTH + " bytes");
        }
        var expires = normalizeExpiry(expiresAt);
        var nonce = randomBytes(NONCE_LENGTH);

        var message = signingMessage(prevLinkHash, instance, capability, maxDepth, maxUses, expires, nonce);

        return new InviteLink(signingKey.publicKey(), capability, maxDepth, maxUses, expires, nonce, signingKey.sign(message));
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    public boolean hasExpiry() {
        return expiresAt != null;
    }

    /**
     * Expiry check in unix seconds. A link is still valid at exactly {@code expiresAt}.
     */
    public boolean isExpiredAt(long nowUnixSecs) {
        return hasExpiry() && Long.compareUnsigned(nowUnixSecs, expiresAt) > 0;
    }

    /**
     * SHA-256 of the link fields, excluding the signature. The next link signs over this.
     */
    public byte[] hash() {
        return fullHash(fieldBytes(issuer, capability, maxDepth, maxUses, expiresAt, nonce));
    }

    void verifySignature(byte[] prevLinkHash, PublicKey instance) throws SignatureVerificationException {
        var message = signingMessage(prevLinkHash, instance, capability, maxDepth, maxUses, expiresAt, nonce);
        Identities.verify(issuer, message, signature);
    }

    void write(final JBBPBitOutputStream out) throws IOException {
        out.writeBytes(issuer.toBytes(), KEYSIZE, BIG_ENDIAN);
        out.write(capability.getValue());
        out.write(maxDepth);
        out.writeInt((int) maxUses, BIG_ENDIAN);
        out.writeLong(isNull(expiresAt) ? 0L : expiresAt, BIG_ENDIAN);
        out.writeBytes(nonce, NONCE_LENGTH, BIG_ENDIAN);
        out.writeBytes(signature.toBytes(), SIGLENGTH, BIG_ENDIAN);
    }

    /**
     * Read exactly one link. The caller guarantees that {@code LINK_SIZE} bytes are available.
     */
    static InviteLink read(final JBBPBitInputStream in, int index) throws IOException, InviteException {
        var issuer = PublicKey.fromBytes(in.readByteArray(KEYSIZE, BIG_ENDIAN));
        var capabilityByte = (byte) in.readByte();
        var capability = capabilityFromByte(capabilityByte, index);
        var maxDepth = in.readByte() & 0xFF;
        var maxUses = Integer.toUnsignedLong(in.readInt(BIG_ENDIAN));
        var expires = normalizeExpiry(in.readLong(BIG_ENDIAN));
        var nonce = in.readByteArray(NONCE_LENGTH, BIG_ENDIAN);
        var signature = Signature.fromBytes(in.readByteArray(SIGLENGTH, BIG_ENDIAN));

        return new InviteLink(issuer, capability, maxDepth, maxUses, expires, nonce, signature);
    }

    private static Capability capabilityFromByte(byte value, int index) throws InviteException {
        for (var capability : Capability.values()) {
            if (capability.getValue() == value) {
                return capability;
            }
        }

        throw new InviteException(InviteErrorType.MALFORMED, index, "unknown capability byte " + (value & 0xFF) + " at link " + index);
    }

    private static Long normalizeExpiry(Long expiresAt) {
        return isNull(expiresAt) || expiresAt == 0L ? null : expiresAt;
    }

    private static byte[] signingMessage(
            byte[] prevLinkHash,
            PublicKey instance,
            Capability capability,
            int maxDepth,
            long maxUses,
            Long expiresAt,
            byte[] nonce
    ) {
        return ByteBuffer.allocate(HASHLENGTH + KEYSIZE + 1 + 1 + 4 + 8 + NONCE_LENGTH)
                .put(prevLinkHash)
                .put(instance.toBytes())
                .put(fieldBytes(null, capability, maxDepth, maxUses, expiresAt, nonce))
                .array();
    }

    /**
     * {@code [issuer] capability max_depth max_uses expires_at nonce}
     */
    private static byte[] fieldBytes(PublicKey issuer, Capability capability, int maxDepth, long maxUses, Long expiresAt, byte[] nonce) {
        var buffer = ByteBuffer.allocate((isNull(issuer) ? 0 : KEYSIZE) + 1 + 1 + 4 + 8 + NONCE_LENGTH);
        if (!isNull(issuer)) {
            buffer.put(issuer.toBytes());
        }

        return buffer
                .put(capability.getValue())
                .put((byte) maxDepth)
                .putInt((int) maxUses)
                .putLong(isNull(expiresAt) ? 0L : expiresAt)
                .put(nonce)
                .array();
    }
}
