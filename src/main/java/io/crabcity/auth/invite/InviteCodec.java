package io.crabcity.auth.invite;

import com.igormaznitsa.jbbp.io.JBBPBitInputStream;
import com.igormaznitsa.jbbp.io.JBBPBitOutputStream;
import io.crabcity.auth.identity.PublicKey;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.DecoderException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;

import static com.igormaznitsa.jbbp.io.JBBPByteOrder.BIG_ENDIAN;
import static io.crabcity.auth.constant.IdentityConstant.KEYSIZE;
import static io.crabcity.auth.constant.InviteConstant.HEADER_SIZE;
import static io.crabcity.auth.constant.InviteConstant.LINK_SIZE;
import static io.crabcity.auth.constant.InviteConstant.MAX_BASE32_CHARS;
import static io.crabcity.auth.constant.InviteConstant.MAX_CHAIN_DEPTH;
import static io.crabcity.auth.invite.InviteErrorType.CHAIN_TOO_DEEP;
import static io.crabcity.auth.invite.InviteErrorType.EMPTY_CHAIN;
import static io.crabcity.auth.invite.InviteErrorType.MALFORMED;
import static io.crabcity.auth.utils.EncodingUtils.crockfordDecode;
import static io.crabcity.auth.utils.EncodingUtils.crockfordEncode;
import static java.util.Objects.nonNull;
import static lombok.AccessLevel.PRIVATE;

/**
 * Invite wire format:
 * <pre>
 * {@code
 * version(1) instance(32) chain_length(1) link(126) * chain_length
 * }
 * </pre>
 * Invite bytes arrive from untrusted peers. Every length is checked against the
 * input before anything is read or allocated, so any input either parses or is
 * rejected with an {@link InviteException}.
 */
@Slf4j
@NoArgsConstructor(access = PRIVATE)
public final class InviteCodec {

    @SneakyThrows
    public static byte[] toBytes(@NonNull Invite invite) {
        try (var baos = new ByteArrayOutputStream(HEADER_SIZE + invite.getLinks().size() * LINK_SIZE)) {
            var out = new JBBPBitOutputStream(baos);
            out.write(invite.getVersion());
            out.writeBytes(invite.getInstance().toBytes(), KEYSIZE, BIG_ENDIAN);
            out.write(invite.getLinks().size());
            for (var link : invite.getLinks()) {
                link.write(out);
            }
            out.flush();

            return baos.toByteArray();
        }
    }

    public static Invite fromBytes(final byte[] bytes) throws InviteException {
        if (bytes == null || bytes.length < HEADER_SIZE) {
            throw rejected(new InviteException(MALFORMED, "too short"));
        }

        var chainLength = bytes[HEADER_SIZE - 1] & 0xFF;
        if (chainLength == 0) {
            throw rejected(new InviteException(EMPTY_CHAIN, "empty chain"));
        }
        if (chainLength > MAX_CHAIN_DEPTH) {
            throw rejected(new InviteException(CHAIN_TOO_DEEP, "chain length " + chainLength + " exceeds maximum " + MAX_CHAIN_DEPTH));
        }

        var expected = HEADER_SIZE + chainLength * LINK_SIZE;
        if (bytes.length != expected) {
            throw rejected(new InviteException(MALFORMED, "wrong size: expected " + expected + ", got " + bytes.length));
        }

        try (var in = new JBBPBitInputStream(new ByteArrayInputStream(bytes))) {
            var version = in.readByte() & 0xFF;
            var instance = PublicKey.fromBytes(in.readByteArray(KEYSIZE, BIG_ENDIAN));
            in.readByte();

            var links = new ArrayList<InviteLink>(chainLength);
            for (int i = 0; i < chainLength; i++) {
                links.add(InviteLink.read(in, i));
            }

            return Invite.of(version, instance, links);
        } catch (InviteException e) {
            throw rejected(e);
        } catch (IOException e) {
            throw rejected(new InviteException(MALFORMED, null, "unreadable invite bytes", e));
        }
    }

    public static String toBase32(@NonNull Invite invite) {
        return crockfordEncode(toBytes(invite));
    }

    public static Invite fromBase32(final String encoded) throws InviteException {
        if (nonNull(encoded) && encoded.length() > MAX_BASE32_CHARS) {
            throw rejected(new InviteException(MALFORMED, null,
                    "base32 invite too long: " + encoded.length() + " > " + MAX_BASE32_CHARS + " chars"));
        }

        byte[] bytes;
        try {
            bytes = crockfordDecode(encoded);
        } catch (DecoderException e) {
            throw rejected(new InviteException(MALFORMED, null, "invalid base32", e));
        }

        return fromBytes(bytes);
    }

    private static InviteException rejected(InviteException e) {
        log.debug("Rejected invite bytes: {}", e.getMessage());

        return e;
    }
}
