package io.crabcity.auth.membership;

import io.crabcity.auth.identity.PublicKey;
import lombok.Builder;
import lombok.Value;

import static java.util.Objects.isNull;

/**
 * How a grant came to exist.
 */
@Value
public class GrantProvenance {

    /**
     * Issuer of the invite link that was redeemed (the leaf issuer for delegated chains).
     */
    PublicKey invitedBy;

    /**
     * Nonce of the redeemed invite link.
     */
    byte[] invitedVia;

    /**
     * The key this grant replaces after key loss, if any.
     */
    PublicKey replaces;

    @Builder(toBuilder = true)
    private GrantProvenance(PublicKey invitedBy, byte[] invitedVia, PublicKey replaces) {
        this.invitedBy = invitedBy;
        this.invitedVia = isNull(invitedVia) ? null : invitedVia.clone();
        this.replaces = replaces;
    }

    public static GrantProvenance none() {
        return GrantProvenance.builder().build();
    }

    public byte[] getInvitedVia() {
        return isNull(invitedVia) ? null : invitedVia.clone();
    }
}
