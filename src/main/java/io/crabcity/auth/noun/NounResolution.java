package io.crabcity.auth.noun;

import io.crabcity.auth.identity.PublicKey;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A registry's answer for a noun: the account and the keys it controls. The attestation
 * is the registry's signed blob, carried as is and never parsed here.
 */
@Value
public class NounResolution {

    UUID accountId;
    String handle;
    List<PublicKey> pubkeys;
    byte[] attestation;

    public NounResolution(@NonNull UUID accountId, String handle, @NonNull List<PublicKey> pubkeys, @NonNull byte[] attestation) {
        this.accountId = accountId;
        this.handle = handle;
        this.pubkeys = List.copyOf(pubkeys);
        this.attestation = attestation.clone();
    }

    public Optional<String> handle() {
        return Optional.ofNullable(handle);
    }

    public byte[] getAttestation() {
        return attestation.clone();
    }

    /**
     * Whether {@code key} is one of the resolved account's keys, e.g. the key redeeming a noun invite.
     */
    public boolean controls(@NonNull PublicKey key) {
        return pubkeys.contains(key);
    }
}
