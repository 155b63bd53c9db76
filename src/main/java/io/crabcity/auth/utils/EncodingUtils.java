package io.crabcity.auth.utils;

import lombok.NoArgsConstructor;
import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Base32;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

import static lombok.AccessLevel.PRIVATE;

/**
 * Crockford base32 (uppercase, unpadded) and URL-safe base64 (unpadded).
 * <p>
 * Crockford is produced by translating the RFC 4648 alphabet ({@code A-Z2-7})
 * position by position into {@code 0-9A-Z} minus {@code I, L, O, U}.
 */
@NoArgsConstructor(access = PRIVATE)
public class EncodingUtils {

    private static final String RFC4648_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";
    private static final String CROCKFORD_ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";
    private static final char PAD = '=';

    private static final Base32 BASE32 = new Base32(0, new byte[0], false, (byte) PAD, CodecPolicy.STRICT);

    public static String crockfordEncode(final byte[] bytes) {
        var standard = StringUtils.stripEnd(BASE32.encodeAsString(bytes), String.valueOf(PAD));

        return StringUtils.replaceChars(standard, RFC4648_ALPHABET, CROCKFORD_ALPHABET);
    }

    /**
     * Decode Crockford base32, case-insensitive, unpadded.
     *
     * @throws DecoderException on any character outside the alphabet, an impossible length
     *                          or non-zero trailing bits
     */
    public static byte[] crockfordDecode(final String encoded) throws DecoderException {
        if (encoded == null) {
            throw new DecoderException("base32 input is null");
        }

        var upper = encoded.toUpperCase(Locale.ROOT);
        var standard = new StringBuilder(upper.length() + 8);
        for (int i = 0; i < upper.length(); i++) {
            var idx = CROCKFORD_ALPHABET.indexOf(upper.charAt(i));
            if (idx < 0) {
                throw new DecoderException("invalid crockford char at " + i);
            }
            standard.append(RFC4648_ALPHABET.charAt(idx));
        }

        // Unpadded base32 can only end with 0, 2, 4, 5 or 7 characters in the last block.
        var tail = standard.length() % 8;
        if (tail == 1 || tail == 3 || tail == 6) {
            throw new DecoderException("invalid base32 length " + standard.length());
        }
        while (standard.length() % 8 != 0) {
            standard.append(PAD);
        }

        try {
            return BASE32.decode(standard.toString());
        } catch (IllegalArgumentException e) {
            throw new DecoderException("base32 decode: " + e.getMessage(), e);
        }
    }

    public static String base64Encode(final byte[] bytes) {
        return Base64.encodeBase64URLSafeString(bytes);
    }

    /**
     * Decode URL-safe unpadded base64.
     *
     * @throws DecoderException if the input contains characters outside the URL-safe alphabet
     *                          or is not the canonical encoding of the decoded bytes
     */
    public static byte[] base64Decode(final String encoded) throws DecoderException {
        if (encoded == null || !encoded.matches("[A-Za-z0-9_-]*")) {
            throw new DecoderException("invalid url-safe base64");
        }
        if (encoded.length() % 4 == 1) {
            throw new DecoderException("invalid base64 length " + encoded.length());
        }

        var decoded = Base64.decodeBase64(encoded);
        // Non-zero padding bits would let two strings name the same bytes.
        if (!base64Encode(decoded).equals(encoded)) {
            throw new DecoderException("non-canonical base64");
        }

        return decoded;
    }
}
