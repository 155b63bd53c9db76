package io.crabcity.auth.membership;

import io.crabcity.auth.capability.AccessRights;
import io.crabcity.auth.capability.Capability;
import io.crabcity.auth.error.AuthException;
import io.crabcity.auth.identity.PublicKey;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Optional;

import static io.crabcity.auth.capability.Capability.OWNER;
import static io.crabcity.auth.error.AuthErrorType.GRANT_NOT_ACTIVE;
import static io.crabcity.auth.error.AuthErrorType.INSUFFICIENT_ACCESS;
import static io.crabcity.auth.membership.MembershipState.ACTIVE;
import static io.crabcity.auth.membership.MembershipState.INVITED;

/**
 * One actor's standing on an instance. Immutable: every change yields a new grant.
 * <p>
 * The state only changes through {@link #apply(MembershipTransition)}. The loopback
 * grant is always an active owner and refuses every transition that would demote it.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class MemberGrant {

    @NonNull
    PublicKey publicKey;
    @NonNull
    Capability capability;
    @NonNull
    AccessRights access;
    @NonNull
    MembershipContext context;
    @NonNull
    @Builder.Default
    GrantProvenance provenance = GrantProvenance.none();

    /**
     * A fresh grant for a redeemed invite, waiting for its first authentication.
     */
    public static MemberGrant invited(PublicKey publicKey, Capability capability, GrantProvenance provenance) {
        return MemberGrant.builder()
                .publicKey(publicKey)
                .capability(capability)
                .access(capability.accessRights())
                .context(MembershipContext.of(INVITED))
                .provenance(provenance)
                .build();
    }

    /**
     * The seeded grant of the local operator.
     */
    public static MemberGrant loopback() {
        return MemberGrant.builder()
                .publicKey(PublicKey.LOOPBACK)
                .capability(OWNER)
                .access(OWNER.accessRights())
                .context(MembershipContext.of(ACTIVE))
                .build();
    }

    public MembershipState getState() {
        return context.getState();
    }

    public boolean isActive() {
        return getState() == ACTIVE;
    }

    public boolean isLoopback() {
        return publicKey.isLoopback();
    }

    public MemberGrant apply(@NonNull MembershipTransition transition) throws TransitionException {
        if (isLoopback() && transition.getType() != MembershipTransition.Type.ACTIVATE) {
            throw new TransitionException(transition.getType(), getState(), "the loopback grant cannot be changed");
        }

        var next = context.apply(transition);
        log.debug("Grant {} moved {} -> {} via {}", publicKey.fingerprint(), getState(), next.getState(), transition.getType());

        return toBuilder().context(next).build();
    }

    /**
     * Key-loss recovery. Left: this grant, removed. Right: an active grant for {@code newKey}
     * with the same rights and provenance, recording the key it replaces.
     */
    public Pair<MemberGrant, MemberGrant> replace(@NonNull PublicKey newKey) throws TransitionException {
        if (newKey.isLoopback() || newKey.equals(publicKey)) {
            throw new IllegalArgumentException("replacement key must be a new remote key");
        }

        var removed = apply(MembershipTransition.replace(newKey));
        var successor = toBuilder()
                .publicKey(newKey)
                .context(MembershipContext.of(ACTIVE))
                .provenance(provenance.toBuilder().replaces(publicKey).build())
                .build();

        return Pair.of(removed, successor);
    }

    /**
     * Admin tweak of individual rights. The preset label is kept for history, but
     * {@link #presetLabel()} only reports a preset while the rights still match it exactly.
     */
    public MemberGrant withAccess(@NonNull AccessRights access) {
        requireMutableRights();

        return toBuilder().access(access).build();
    }

    public MemberGrant withCapability(@NonNull Capability capability) {
        requireMutableRights();

        return toBuilder().capability(capability).access(capability.accessRights()).build();
    }

    public Optional<Capability> presetLabel() {
        return Capability.fromAccess(access);
    }

    /**
     * The authorization check. Anything but an active grant is a hard rejection,
     * regardless of the rights it holds.
     */
    public void authorize(String type, String action) throws AuthException {
        if (!isActive()) {
            throw new AuthException(GRANT_NOT_ACTIVE, "grant is " + getState());
        }
        if (!access.contains(type, action)) {
            throw new AuthException(INSUFFICIENT_ACCESS, "requires " + type + ":" + action);
        }
    }

    private void requireMutableRights() {
        if (isLoopback()) {
            throw new IllegalStateException("the loopback grant always holds owner rights");
        }
    }
}
