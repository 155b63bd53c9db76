package io.crabcity.auth.membership;

import io.crabcity.auth.identity.PublicKey;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.crabcity.auth.error.AuthErrorType.INVALID_TRANSITION;
import static io.crabcity.auth.membership.MembershipState.ACTIVE;
import static io.crabcity.auth.membership.MembershipState.INVITED;
import static io.crabcity.auth.membership.MembershipState.REMOVED;
import static io.crabcity.auth.membership.MembershipState.SUSPENDED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MembershipContextTest {

    private static final PublicKey NEW_KEY = PublicKey.fromBytes(new byte[]{
            1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16,
            17, 18, 19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30, 31, 32});

    private static Map<String, MembershipContext> contexts() {
        var contexts = new LinkedHashMap<String, MembershipContext>();
        contexts.put("invited", MembershipContext.of(INVITED));
        contexts.put("active", MembershipContext.of(ACTIVE));
        contexts.put("suspended/admin", MembershipContext.suspended(SuspensionSource.admin()));
        contexts.put("suspended/blocklist", MembershipContext.suspended(SuspensionSource.blocklist("org:acme")));
        contexts.put("removed", MembershipContext.of(REMOVED));

        return contexts;
    }

    private static Map<String, MembershipTransition> transitions() {
        var transitions = new LinkedHashMap<String, MembershipTransition>();
        transitions.put("activate", MembershipTransition.activate());
        transitions.put("suspend", MembershipTransition.suspend("spam", SuspensionSource.admin()));
        transitions.put("reinstate", MembershipTransition.reinstate());
        transitions.put("remove", MembershipTransition.remove());
        transitions.put("expire", MembershipTransition.expire());
        transitions.put("blocklist_hit", MembershipTransition.blocklistHit("org:acme"));
        transitions.put("blocklist_lift", MembershipTransition.blocklistLift("org:acme"));
        transitions.put("blocklist_lift_other", MembershipTransition.blocklistLift("org:other"));
        transitions.put("replace", MembershipTransition.replace(NEW_KEY));

        return transitions;
    }

    /**
     * Every allowed (context, transition) pair and its resulting state; all other pairs must fail.
     */
    private static final Map<String, MembershipState> ALLOWED = Map.ofEntries(
            Map.entry("invited+activate", ACTIVE),
            Map.entry("invited+expire", REMOVED),
            Map.entry("invited+remove", REMOVED),
            Map.entry("invited+replace", REMOVED),
            Map.entry("active+suspend", SUSPENDED),
            Map.entry("active+blocklist_hit", SUSPENDED),
            Map.entry("active+remove", REMOVED),
            Map.entry("active+replace", REMOVED),
            Map.entry("suspended/admin+reinstate", ACTIVE),
            Map.entry("suspended/admin+remove", REMOVED),
            Map.entry("suspended/admin+replace", REMOVED),
            Map.entry("suspended/blocklist+reinstate", ACTIVE),
            Map.entry("suspended/blocklist+blocklist_lift", ACTIVE),
            Map.entry("suspended/blocklist+remove", REMOVED),
            Map.entry("suspended/blocklist+replace", REMOVED)
    );

    @Test
    void exhaustiveTransitionTable() throws TransitionException {
        for (var context : contexts().entrySet()) {
            for (var transition : transitions().entrySet()) {
                var key = context.getKey() + "+" + transition.getKey();
                var expected = ALLOWED.get(key);
                if (expected == null) {
                    var e = assertThrows(TransitionException.class, () -> context.getValue().apply(transition.getValue()), key);
                    assertEquals(transition.getValue().getType(), e.getTransition(), key);
                    assertEquals(context.getValue().getState(), e.getFrom(), key);
                    assertEquals(INVALID_TRANSITION, e.getType(), key);
                } else {
                    assertEquals(expected, context.getValue().apply(transition.getValue()).getState(), key);
                }
            }
        }
    }

    @Test
    void removedIsTerminal() {
        var removed = MembershipContext.of(REMOVED);

        for (var transition : transitions().values()) {
            assertThrows(TransitionException.class, () -> removed.apply(transition));
        }
    }

    @Test
    void suspendedAlwaysCarriesSource() throws TransitionException {
        var active = MembershipContext.of(ACTIVE);

        var byAdmin = active.apply(MembershipTransition.suspend("abuse", SuspensionSource.admin()));
        var byBlocklist = active.apply(MembershipTransition.blocklistHit("org:acme"));

        assertEquals(SuspensionSource.admin(), byAdmin.getSuspensionSource());
        assertEquals(SuspensionSource.blocklist("org:acme"), byBlocklist.getSuspensionSource());
        assertNull(byBlocklist.apply(MembershipTransition.blocklistLift("org:acme")).getSuspensionSource());
        assertThrows(IllegalArgumentException.class, () -> MembershipContext.of(SUSPENDED));
    }

    @Test
    void blocklistLiftNeedsMatchingScope() {
        var suspended = MembershipContext.suspended(SuspensionSource.blocklist("org:acme"));

        var e = assertThrows(TransitionException.class, () -> suspended.apply(MembershipTransition.blocklistLift("org:other")));

        assertEquals(MembershipTransition.Type.BLOCKLIST_LIFT, e.getTransition());
        assertEquals(SUSPENDED, e.getFrom());
        assertNotNull(e.getReason());
    }

    @Test
    void reachableStatesAreAlwaysValid() throws TransitionException {
        // walk every path of length 4 from INVITED; every result is one of the four states
        var frontier = List.of(MembershipContext.of(INVITED));
        for (int step = 0; step < 4; step++) {
            var next = new ArrayList<MembershipContext>();
            for (var context : frontier) {
                for (var transition : transitions().values()) {
                    try {
                        var result = context.apply(transition);
                        assertEquals(result.getState() == SUSPENDED, result.getSuspensionSource() != null);
                        next.add(result);
                    } catch (TransitionException e) {
                        assertEquals(context.getState(), e.getFrom());
                    }
                }
            }
            frontier = next;
        }
    }

    @Test
    void stateLabels() {
        for (var state : MembershipState.values()) {
            assertEquals(state, MembershipState.fromLabel(state.toString()));
        }
        assertEquals("suspended", SUSPENDED.toString());
    }
}
