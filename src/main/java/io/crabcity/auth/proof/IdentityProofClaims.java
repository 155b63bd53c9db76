package io.crabcity.auth.proof;

import io.crabcity.auth.identity.PublicKey;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * What a verified proof asserts: {@code subject}, known on {@code instance}, also
 * controls {@code relatedKeys}.
 */
@Value
public class IdentityProofClaims {

    PublicKey subject;
    PublicKey instance;
    List<PublicKey> relatedKeys;
    String registryHandle;
    long timestamp;

    public Optional<String> registryHandle() {
        return Optional.ofNullable(registryHandle);
    }
}
