package io.crabcity.auth.proof;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ProofErrorType {
    TOO_SHORT("too short"),
    KEY_COUNT_EXCEEDS_MAX("key count exceeds maximum"),
    TRUNCATED_KEYS("truncated keys"),
    INVALID_HANDLE_FLAG("invalid handle flag"),
    TRUNCATED_HANDLE_LEN("truncated handle length"),
    TRUNCATED_HANDLE("truncated handle"),
    INVALID_UTF8_HANDLE("invalid utf8 in handle"),
    TRUNCATED_TRAILER("truncated timestamp/signature"),
    TRAILING_BYTES("trailing bytes"),
    UNSUPPORTED_VERSION("unsupported version"),
    BAD_SIGNATURE("bad signature"),
    ;

    private final String description;
}
