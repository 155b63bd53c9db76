package io.crabcity.auth.membership;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum MembershipState {
    INVITED("invited"),
    ACTIVE("active"),
    SUSPENDED("suspended"),
    /**
     * Terminal. Nothing leaves this state.
     */
    REMOVED("removed"),
    ;

    private final String label;

    @JsonCreator
    public static MembershipState fromLabel(final String label) {
        return Arrays.stream(values())
                .filter(state -> state.getLabel().equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown membership state: " + label));
    }

    @JsonValue
    @Override
    public String toString() {
        return label;
    }
}
