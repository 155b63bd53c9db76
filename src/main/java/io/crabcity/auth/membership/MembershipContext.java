package io.crabcity.auth.membership;

import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import static io.crabcity.auth.membership.MembershipState.ACTIVE;
import static io.crabcity.auth.membership.MembershipState.INVITED;
import static io.crabcity.auth.membership.MembershipState.REMOVED;
import static io.crabcity.auth.membership.MembershipState.SUSPENDED;
import static java.util.Objects.isNull;
import static lombok.AccessLevel.PRIVATE;

/**
 * A membership state together with the suspension source when suspended.
 * <p>
 * {@link #apply(MembershipTransition)} is the transition function:
 * <pre>
 * {@code
 *   INVITED   --ACTIVATE-------------------> ACTIVE
 *   INVITED   --EXPIRE---------------------> REMOVED
 *   ACTIVE    --SUSPEND(source)------------> SUSPENDED
 *   ACTIVE    --BLOCKLIST_HIT(scope)-------> SUSPENDED (blocklist scope)
 *   SUSPENDED --REINSTATE------------------> ACTIVE
 *   SUSPENDED --BLOCKLIST_LIFT(same scope)-> ACTIVE
 *   any but REMOVED --REMOVE | REPLACE-----> REMOVED
 * }
 * </pre>
 * Everything else is rejected.
 */
@Slf4j
@Value
@AllArgsConstructor(access = PRIVATE)
public class MembershipContext {

    MembershipState state;
    SuspensionSource suspensionSource;

    public static MembershipContext of(@NonNull MembershipState state) {
        if (state == SUSPENDED) {
            throw new IllegalArgumentException("a suspended context needs a suspension source");
        }

        return new MembershipContext(state, null);
    }

    public static MembershipContext suspended(@NonNull SuspensionSource source) {
        return new MembershipContext(SUSPENDED, source);
    }

    public MembershipContext apply(@NonNull MembershipTransition transition) throws TransitionException {
        var type = transition.getType();
        if (state == REMOVED) {
            throw rejected(type, "removed is a terminal state");
        }

        switch (type) {
            case ACTIVATE:
                require(type, INVITED);
                return of(ACTIVE);
            case EXPIRE:
                require(type, INVITED);
                return of(REMOVED);
            case SUSPEND:
                require(type, ACTIVE);
                return suspended(transition.getSource());
            case BLOCKLIST_HIT:
                require(type, ACTIVE);
                return suspended(SuspensionSource.blocklist(transition.getScope()));
            case REINSTATE:
                require(type, SUSPENDED);
                return of(ACTIVE);
            case BLOCKLIST_LIFT:
                require(type, SUSPENDED);
                if (isNull(suspensionSource) || !suspensionSource.isBlocklist()) {
                    throw rejected(type, "blocklist lift only applies to blocklist-sourced suspensions");
                }
                if (!suspensionSource.isBlocklist(transition.getScope())) {
                    throw rejected(type, "suspension scope '" + suspensionSource.getScope()
                            + "' does not match '" + transition.getScope() + "'");
                }
                return of(ACTIVE);
            case REMOVE:
            case REPLACE:
                return of(REMOVED);
            default:
                throw rejected(type, "unknown transition");
        }
    }

    private void require(MembershipTransition.Type type, MembershipState expected) throws TransitionException {
        if (state != expected) {
            throw rejected(type, type + " is only valid from " + expected);
        }
    }

    private TransitionException rejected(MembershipTransition.Type type, String reason) {
        log.debug("Rejected membership transition {} from {}: {}", type, state, reason);

        return new TransitionException(type, state, reason);
    }
}
