package io.crabcity.auth.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Optional;

/**
 * Named presets over {@link AccessRights}. Ordered: a greater capability always
 * expands to a strict superset of the rights of a lesser one.
 * <p>
 * Authorization never looks at the preset, only at the expanded rights.
 */
@Getter
@RequiredArgsConstructor
public enum Capability {
    VIEW((byte) 0, "view"),
    COLLABORATE((byte) 1, "collaborate"),
    ADMIN((byte) 2, "admin"),
    OWNER((byte) 3, "owner"),
    ;

    /**
     * Wire value inside invite links.
     */
    private final byte value;
    private final String label;

    public boolean isAtLeast(@NonNull Capability other) {
        return compareTo(other) >= 0;
    }

    public boolean exceeds(@NonNull Capability other) {
        return compareTo(other) > 0;
    }

    public AccessRights accessRights() {
        var rights = new ArrayList<AccessRight>();

        rights.add(AccessRight.of("content", "read"));
        rights.add(AccessRight.of("terminals", "read"));

        if (isAtLeast(COLLABORATE)) {
            rights.add(AccessRight.of("terminals", "input"));
            rights.add(AccessRight.of("chat", "send"));
            rights.add(AccessRight.of("tasks", "read", "create", "edit"));
            rights.add(AccessRight.of("instances", "create"));
        }

        if (isAtLeast(ADMIN)) {
            rights.add(AccessRight.of("members", "read", "invite", "suspend", "reinstate", "remove", "update"));
        }

        if (isAtLeast(OWNER)) {
            rights.add(AccessRight.of("instance", "manage", "transfer"));
        }

        return AccessRights.of(rights);
    }

    /**
     * Reverse lookup: the preset whose expansion is exactly equal to {@code access}.
     * Empty when an admin has tweaked individual rights away from every preset; in that
     * case the raw rights must be displayed, not a preset label.
     */
    public static Optional<Capability> fromAccess(@NonNull AccessRights access) {
        for (int i = values().length - 1; i >= 0; i--) {
            var cap = values()[i];
            if (cap.accessRights().equals(access)) {
                return Optional.of(cap);
            }
        }

        return Optional.empty();
    }

    public static Capability fromValue(final byte value) {
        return Arrays.stream(values())
                .filter(capability -> capability.getValue() == value)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown capability byte: " + (value & 0xFF)));
    }

    @JsonCreator
    public static Capability fromLabel(final String label) {
        return Arrays.stream(values())
                .filter(capability -> capability.getLabel().equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown capability: " + label));
    }

    @JsonValue
    @Override
    public String toString() {
        return label;
    }
}
