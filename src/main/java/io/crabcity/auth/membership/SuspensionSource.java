package io.crabcity.auth.membership;

import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.util.Objects;

import static lombok.AccessLevel.PRIVATE;

/**
 * Who suspended a grant. Only a blocklist-sourced suspension can be lifted by a
 * blocklist removal, and only for the same scope.
 */
@Value
@AllArgsConstructor(access = PRIVATE)
public class SuspensionSource {

    public enum Kind {
        ADMIN,
        BLOCKLIST,
    }

    private static final SuspensionSource ADMIN_SOURCE = new SuspensionSource(Kind.ADMIN, null);

    Kind kind;
    String scope;

    public static SuspensionSource admin() {
        return ADMIN_SOURCE;
    }

    public static SuspensionSource blocklist(@NonNull String scope) {
        return new SuspensionSource(Kind.BLOCKLIST, scope);
    }

    public boolean isBlocklist() {
        return kind == Kind.BLOCKLIST;
    }

    public boolean isBlocklist(String scope) {
        return isBlocklist() && Objects.equals(this.scope, scope);
    }
}
