package io.crabcity.auth.constant;

import lombok.NoArgsConstructor;

import static io.crabcity.auth.constant.IdentityConstant.KEYSIZE;
import static lombok.AccessLevel.PRIVATE;

@NoArgsConstructor(access = PRIVATE)
public class ProofConstant {

    public static final int VERSION = 0x01;

    public static final int MAX_RELATED_KEYS = 256;

    /**
     * version(1) + subject(32) + instance(32) + key_count(4)
     */
    public static final int MIN_HEADER_SIZE = 1 + KEYSIZE + KEYSIZE + 4;

    public static final int MAX_HANDLE_BYTES = 0xFFFF;
}
