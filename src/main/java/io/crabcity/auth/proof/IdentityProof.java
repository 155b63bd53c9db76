package io.crabcity.auth.proof;

import com.igormaznitsa.jbbp.io.JBBPBitInputStream;
import com.igormaznitsa.jbbp.io.JBBPBitOutputStream;
import io.crabcity.auth.identity.Identities;
import io.crabcity.auth.identity.PublicKey;
import io.crabcity.auth.identity.Signature;
import io.crabcity.auth.identity.SignatureVerificationException;
import io.crabcity.auth.identity.SigningKey;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.igormaznitsa.jbbp.io.JBBPByteOrder.BIG_ENDIAN;
import static io.crabcity.auth.constant.IdentityConstant.KEYSIZE;
import static io.crabcity.auth.constant.IdentityConstant.SIGLENGTH;
import static io.crabcity.auth.constant.ProofConstant.MAX_HANDLE_BYTES;
import static io.crabcity.auth.constant.ProofConstant.MAX_RELATED_KEYS;
import static io.crabcity.auth.constant.ProofConstant.MIN_HEADER_SIZE;
import static io.crabcity.auth.constant.ProofConstant.VERSION;
import static io.crabcity.auth.proof.ProofErrorType.BAD_SIGNATURE;
import static io.crabcity.auth.proof.ProofErrorType.INVALID_HANDLE_FLAG;
import static io.crabcity.auth.proof.ProofErrorType.INVALID_UTF8_HANDLE;
import static io.crabcity.auth.proof.ProofErrorType.KEY_COUNT_EXCEEDS_MAX;
import static io.crabcity.auth.proof.ProofErrorType.TOO_SHORT;
import static io.crabcity.auth.proof.ProofErrorType.TRAILING_BYTES;
import static io.crabcity.auth.proof.ProofErrorType.TRUNCATED_HANDLE;
import static io.crabcity.auth.proof.ProofErrorType.TRUNCATED_HANDLE_LEN;
import static io.crabcity.auth.proof.ProofErrorType.TRUNCATED_KEYS;
import static io.crabcity.auth.proof.ProofErrorType.TRUNCATED_TRAILER;
import static io.crabcity.auth.proof.ProofErrorType.UNSUPPORTED_VERSION;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.isNull;
import static lombok.AccessLevel.PRIVATE;

/**
 * Self-issued assertion linking a user's key on one instance to their other keys.
 * <p>
 * Binary layout, big endian:
 * <pre>
 * {@code
 * version(1) subject(32) instance(32) key_count(4) key(32) * key_count
 * has_handle(1) [handle_len(2) handle(utf8)] timestamp(8) signature(64)
 * }
 * </pre>
 * The signature covers everything before it.
 */
@Slf4j
@Value
@AllArgsConstructor(access = PRIVATE)
public class IdentityProof {

    private static final int HANDLE_ABSENT = 0;
    private static final int HANDLE_PRESENT = 1;

    int version;
    PublicKey subject;
    PublicKey instance;
    List<PublicKey> relatedKeys;
    String registryHandle;
    /**
     * Unsigned unix seconds.
     */
    long timestamp;
    Signature signature;

    public static IdentityProof sign(
            @NonNull SigningKey signingKey,
            @NonNull PublicKey instance,
            @NonNull List<PublicKey> relatedKeys,
            String handle,
            long timestamp
    ) {
        if (relatedKeys.size() > MAX_RELATED_KEYS) {
            throw new IllegalArgumentException("at most " + MAX_RELATED_KEYS + " related keys, got " + relatedKeys.size());
        }
        if (!isNull(handle) && handle.getBytes(UTF_8).length > MAX_HANDLE_BYTES) {
            throw new IllegalArgumentException("handle longer than " + MAX_HANDLE_BYTES + " bytes");
        }

        var subject = signingKey.publicKey();
        var keys = List.copyOf(relatedKeys);
        var message = body(VERSION, subject, instance, keys, handle, timestamp);

        return new IdentityProof(VERSION, subject, instance, keys, handle, timestamp, signingKey.sign(message));
    }

    public Optional<String> registryHandle() {
        return Optional.ofNullable(registryHandle);
    }

    public IdentityProofClaims verify() throws IdentityProofException {
        if (version != VERSION) {
            throw new IdentityProofException(UNSUPPORTED_VERSION, "unsupported version " + version);
        }

        try {
            Identities.verify(subject, body(version, subject, instance, relatedKeys, registryHandle, timestamp), signature);
        } catch (SignatureVerificationException e) {
            log.debug("Identity proof for {} failed verification", subject.fingerprint());
            throw new IdentityProofException(BAD_SIGNATURE, BAD_SIGNATURE.getDescription(), e);
        }

        return new IdentityProofClaims(subject, instance, relatedKeys, registryHandle, timestamp);
    }

    @SneakyThrows
    public byte[] toBytes() {
        try (var baos = new ByteArrayOutputStream()) {
            var out = new JBBPBitOutputStream(baos);
            writeBody(out, version, subject, instance, relatedKeys, registryHandle, timestamp);
            out.writeBytes(signature.toBytes(), SIGLENGTH, BIG_ENDIAN);
            out.flush();

            return baos.toByteArray();
        }
    }

    /**
     * Parse untrusted bytes. Every length is checked against the input before it is read,
     * so any input either parses or fails with an {@link IdentityProofException}.
     */
    public static IdentityProof fromBytes(final byte[] bytes) throws IdentityProofException {
        try {
            return parse(bytes);
        } catch (IdentityProofException e) {
            log.debug("Rejected identity proof bytes: {}", e.getMessage());
            throw e;
        }
    }

    private static IdentityProof parse(final byte[] bytes) throws IdentityProofException {
        if (isNull(bytes) || bytes.length < MIN_HEADER_SIZE) {
            throw new IdentityProofException(TOO_SHORT);
        }

        try (var in = new JBBPBitInputStream(new ByteArrayInputStream(bytes))) {
            long pos = MIN_HEADER_SIZE;
            var version = in.readByte() & 0xFF;
            var subject = PublicKey.fromBytes(in.readByteArray(KEYSIZE, BIG_ENDIAN));
            var instance = PublicKey.fromBytes(in.readByteArray(KEYSIZE, BIG_ENDIAN));
            var keyCount = Integer.toUnsignedLong(in.readInt(BIG_ENDIAN));
            if (keyCount > MAX_RELATED_KEYS) {
                throw new IdentityProofException(KEY_COUNT_EXCEEDS_MAX, "key count " + keyCount + " exceeds maximum " + MAX_RELATED_KEYS);
            }

            if (bytes.length < pos + keyCount * KEYSIZE + 1) {
                throw new IdentityProofException(TRUNCATED_KEYS);
            }
            var relatedKeys = new ArrayList<PublicKey>((int) keyCount);
            for (int i = 0; i < keyCount; i++) {
                relatedKeys.add(PublicKey.fromBytes(in.readByteArray(KEYSIZE, BIG_ENDIAN)));
            }
            pos += keyCount * KEYSIZE;

            var hasHandle = in.readByte();
            pos += 1;
            String handle = null;
            if (hasHandle == HANDLE_PRESENT) {
                if (bytes.length < pos + 2) {
                    throw new IdentityProofException(TRUNCATED_HANDLE_LEN);
                }
                var handleLength = in.readUnsignedShort(BIG_ENDIAN);
                pos += 2;
                if (bytes.length < pos + handleLength) {
                    throw new IdentityProofException(TRUNCATED_HANDLE);
                }
                handle = decodeUtf8(in.readByteArray(handleLength, BIG_ENDIAN));
                pos += handleLength;
            } else if (hasHandle != HANDLE_ABSENT) {
                throw new IdentityProofException(INVALID_HANDLE_FLAG, "invalid handle flag " + hasHandle);
            }

            if (bytes.length < pos + Long.BYTES + SIGLENGTH) {
                throw new IdentityProofException(TRUNCATED_TRAILER);
            }
            var timestamp = in.readLong(BIG_ENDIAN);
            var signature = Signature.fromBytes(in.readByteArray(SIGLENGTH, BIG_ENDIAN));
            pos += Long.BYTES + SIGLENGTH;

            if (bytes.length != pos) {
                throw new IdentityProofException(TRAILING_BYTES, (bytes.length - pos) + " trailing bytes");
            }

            return new IdentityProof(version, subject, instance, List.copyOf(relatedKeys), handle, timestamp, signature);
        } catch (IOException e) {
            throw new IdentityProofException(TOO_SHORT, "unreadable identity proof bytes", e);
        }
    }

    private static String decodeUtf8(byte[] raw) throws IdentityProofException {
        try {
            return UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IdentityProofException(INVALID_UTF8_HANDLE, INVALID_UTF8_HANDLE.getDescription(), e);
        }
    }

    @SneakyThrows
    private static byte[] body(int version, PublicKey subject, PublicKey instance, List<PublicKey> relatedKeys, String handle, long timestamp) {
        try (var baos = new ByteArrayOutputStream()) {
            var out = new JBBPBitOutputStream(baos);
            writeBody(out, version, subject, instance, relatedKeys, handle, timestamp);
            out.flush();

            return baos.toByteArray();
        }
    }

    private static void writeBody(
            JBBPBitOutputStream out,
            int version,
            PublicKey subject,
            PublicKey instance,
            List<PublicKey> relatedKeys,
            String handle,
            long timestamp
    ) throws IOException {
        out.write(version);
        out.writeBytes(subject.toBytes(), KEYSIZE, BIG_ENDIAN);
        out.writeBytes(instance.toBytes(), KEYSIZE, BIG_ENDIAN);
        out.writeInt(relatedKeys.size(), BIG_ENDIAN);
        for (var key : relatedKeys) {
            out.writeBytes(key.toBytes(), KEYSIZE, BIG_ENDIAN);
        }
        if (isNull(handle)) {
            out.write(HANDLE_ABSENT);
        } else {
            var handleBytes = handle.getBytes(UTF_8);
            out.write(HANDLE_PRESENT);
            out.writeShort(handleBytes.length, BIG_ENDIAN);
            out.writeBytes(handleBytes, handleBytes.length, BIG_ENDIAN);
        }
        out.writeLong(timestamp, BIG_ENDIAN);
    }
}
