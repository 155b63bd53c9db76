package io.crabcity.auth.membership;

import io.crabcity.auth.identity.PublicKey;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class MemberIdentity {

    @NonNull
    PublicKey publicKey;
    String displayName;
    String handle;
    String avatarUrl;

    public String fingerprint() {
        return publicKey.fingerprint();
    }

    public boolean isLoopback() {
        return publicKey.isLoopback();
    }
}
