package io.crabcity.auth.constant;

import lombok.NoArgsConstructor;

import static io.crabcity.auth.constant.IdentityConstant.KEYSIZE;
import static io.crabcity.auth.constant.IdentityConstant.SIGLENGTH;
import static lombok.AccessLevel.PRIVATE;

@NoArgsConstructor(access = PRIVATE)
public class InviteConstant {

    public static final int VERSION = 0x01;

    public static final int NONCE_LENGTH = 16;

    /**
     * Per-link binary size: issuer(32) + capability(1) + max_depth(1) + max_uses(4)
     * + expires_at(8) + nonce(16) + signature(64) = 126 bytes.
     */
    public static final int LINK_SIZE = KEYSIZE + 1 + 1 + 4 + 8 + NONCE_LENGTH + SIGLENGTH;

    /**
     * version(1) + instance(32) + chain_length(1)
     */
    public static final int HEADER_SIZE = 1 + KEYSIZE + 1;

    /**
     * Hard upper bound on the number of links in a chain. The length byte on the
     * wire is unsigned, so a hostile sender could otherwise claim 255 links.
     * Checked before any link is allocated.
     */
    public static final int MAX_CHAIN_DEPTH = 16;

    /**
     * Longest base32 text of a chain at {@link #MAX_CHAIN_DEPTH}, checked before decoding.
     */
    public static final int MAX_BASE32_CHARS = ((HEADER_SIZE + MAX_CHAIN_DEPTH * LINK_SIZE) * 8 + 4) / 5;

    public static final long MAX_USES_LIMIT = 0xFFFFFFFFL;
    public static final int MAX_DEPTH_LIMIT = 0xFF;
}
