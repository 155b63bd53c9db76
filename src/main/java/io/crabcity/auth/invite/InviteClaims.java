package io.crabcity.auth.invite;

import io.crabcity.auth.capability.AccessRights;
import io.crabcity.auth.capability.Capability;
import io.crabcity.auth.identity.PublicKey;
import io.crabcity.auth.membership.GrantProvenance;
import io.crabcity.auth.membership.MemberGrant;
import lombok.NonNull;
import lombok.Value;

/**
 * What a successfully verified invite grants. Use counts and the issuer's own
 * standing are not part of the claims: the redeeming side checks those against its store.
 */
@Value
public class InviteClaims {

    PublicKey instance;
    Capability capability;
    PublicKey rootIssuer;
    PublicKey leafIssuer;
    int chainDepth;
    byte[] nonce;

    public byte[] getNonce() {
        return nonce.clone();
    }

    public AccessRights accessRights() {
        return capability.accessRights();
    }

    /**
     * The grant a redeemer receives, in the invited state until first authentication.
     */
    public MemberGrant toGrant(@NonNull PublicKey redeemer) {
        var provenance = GrantProvenance.builder()
                .invitedBy(leafIssuer)
                .invitedVia(getNonce())
                .build();

        return MemberGrant.invited(redeemer, capability, provenance);
    }
}
