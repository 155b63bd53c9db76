package io.crabcity.auth.error;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Value;

import java.util.List;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL;

/**
 * What a client can do about a failure. Mapping to concrete UI is the caller's job.
 */
@Value
@JsonInclude(NON_NULL)
public class RecoveryAction {

    @Getter
    @RequiredArgsConstructor
    public enum Kind {
        RECONNECT("reconnect"),
        CONTACT_ADMIN("contact_admin"),
        REDEEM_INVITE("redeem_invite"),
        NONE("none"),
        ;

        private final String value;
    }

    @JsonProperty("action")
    String action;

    @JsonProperty("admin_fingerprints")
    List<String> adminFingerprints;

    @JsonProperty("reason")
    String reason;

    @JsonCreator
    public RecoveryAction(
            @JsonProperty("action") String action,
            @JsonProperty("admin_fingerprints") List<String> adminFingerprints,
            @JsonProperty("reason") String reason
    ) {
        this.action = action;
        this.adminFingerprints = adminFingerprints;
        this.reason = reason;
    }

    public static RecoveryAction of(Kind kind) {
        return new RecoveryAction(kind.getValue(), null, null);
    }

    public static RecoveryAction contactAdmin(List<String> adminFingerprints, String reason) {
        return new RecoveryAction(Kind.CONTACT_ADMIN.getValue(), List.copyOf(adminFingerprints), reason);
    }
}
