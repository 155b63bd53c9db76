package io.crabcity.auth.constant;

import lombok.NoArgsConstructor;

import static lombok.AccessLevel.PRIVATE;

@NoArgsConstructor(access = PRIVATE)
public class IdentityConstant {

    /**
     * Ed25519 public key size in bytes.
     */
    public static final int KEYSIZE = 32;

    /**
     * Ed25519 signature size in bytes.
     */
    public static final int SIGLENGTH = 64;

    public static final int HASHLENGTH = 32;            // In bytes, SHA-256

    /**
     * Fingerprints are display-only. They carry 40 bits of the key and
     * must never be used for lookup or authorization.
     */
    public static final String FINGERPRINT_PREFIX = "crab_";
    public static final int FINGERPRINT_CHARS = 8;
}
