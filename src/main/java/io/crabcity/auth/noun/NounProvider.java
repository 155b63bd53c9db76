package io.crabcity.auth.noun;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Namespace of an identity noun and its display prefix.
 */
@Getter
@RequiredArgsConstructor
public enum NounProvider {
    HANDLE("handle", "@"),
    GITHUB("github", "github:"),
    GOOGLE("google", "google:"),
    EMAIL("email", "email:"),
    ;

    private final String label;
    private final String prefix;

    @JsonCreator
    public static NounProvider fromLabel(String label) {
        for (var provider : values()) {
            if (provider.label.equals(label)) {
                return provider;
            }
        }

        throw new IllegalArgumentException("unknown noun provider: " + label);
    }

    @JsonValue
    @Override
    public String toString() {
        return label;
    }
}
