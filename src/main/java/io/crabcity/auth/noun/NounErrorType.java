package io.crabcity.auth.noun;

public enum NounErrorType {
    UNKNOWN_FORMAT,
    INVALID_HANDLE,
    INVALID_GITHUB,
    INVALID_EMAIL
}
