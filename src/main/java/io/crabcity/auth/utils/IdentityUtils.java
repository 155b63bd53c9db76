package io.crabcity.auth.utils;

import lombok.NoArgsConstructor;

import java.security.SecureRandom;

import static lombok.AccessLevel.PRIVATE;
import static org.apache.commons.codec.digest.DigestUtils.getSha256Digest;

@NoArgsConstructor(access = PRIVATE)
public class IdentityUtils {

    private static final SecureRandom RANDOM = new SecureRandom();

    public static byte[] fullHash(final byte[] data) {
        return getSha256Digest().digest(data);
    }

    /**
     * SHA-256 over the concatenation of all parts, without building the concatenated array.
     */
    public static byte[] fullHash(final byte[]... parts) {
        var digest = getSha256Digest();
        for (byte[] part : parts) {
            digest.update(part);
        }

        return digest.digest();
    }

    public static byte[] randomBytes(int length) {
        var bytes = new byte[length];
        RANDOM.nextBytes(bytes);

        return bytes;
    }
}
