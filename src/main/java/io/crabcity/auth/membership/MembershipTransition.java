package io.crabcity.auth.membership;

import io.crabcity.auth.identity.PublicKey;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import static lombok.AccessLevel.PRIVATE;

/**
 * The input alphabet of the membership state machine.
 */
@Value
@AllArgsConstructor(access = PRIVATE)
public class MembershipTransition {

    public enum Type {
        /** invited to active, on first successful authentication */
        ACTIVATE,
        /** active to suspended */
        SUSPEND,
        /** suspended to active */
        REINSTATE,
        /** any non-removed to removed */
        REMOVE,
        /** invited to removed, invite expired before first authentication */
        EXPIRE,
        /** active to suspended by a blocklist entry */
        BLOCKLIST_HIT,
        /** suspended to active, only for a blocklist suspension of the same scope */
        BLOCKLIST_LIFT,
        /** any non-removed to removed, key-loss recovery; a new grant is issued for the new key */
        REPLACE,
    }

    Type type;
    String reason;
    SuspensionSource source;
    String scope;
    PublicKey newKey;

    public static MembershipTransition activate() {
        return new MembershipTransition(Type.ACTIVATE, null, null, null, null);
    }

    public static MembershipTransition suspend(String reason, @NonNull SuspensionSource source) {
        return new MembershipTransition(Type.SUSPEND, reason, source, null, null);
    }

    public static MembershipTransition reinstate() {
        return new MembershipTransition(Type.REINSTATE, null, null, null, null);
    }

    public static MembershipTransition remove() {
        return new MembershipTransition(Type.REMOVE, null, null, null, null);
    }

    public static MembershipTransition expire() {
        return new MembershipTransition(Type.EXPIRE, null, null, null, null);
    }

    public static MembershipTransition blocklistHit(@NonNull String scope) {
        return new MembershipTransition(Type.BLOCKLIST_HIT, null, null, scope, null);
    }

    public static MembershipTransition blocklistLift(@NonNull String scope) {
        return new MembershipTransition(Type.BLOCKLIST_LIFT, null, null, scope, null);
    }

    public static MembershipTransition replace(@NonNull PublicKey newKey) {
        return new MembershipTransition(Type.REPLACE, null, null, null, newKey);
    }
}
