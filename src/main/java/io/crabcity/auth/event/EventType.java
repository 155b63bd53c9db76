package io.crabcity.auth.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kind of an audit log entry. The dotted label is part of the event hash.
 */
@Getter
@RequiredArgsConstructor
public enum EventType {
    MEMBER_JOINED("member.joined"),
    MEMBER_SUSPENDED("member.suspended"),
    MEMBER_REINSTATED("member.reinstated"),
    MEMBER_REMOVED("member.removed"),
    MEMBER_REPLACED("member.replaced"),
    GRANT_CAPABILITY_CHANGED("grant.capability_changed"),
    GRANT_ACCESS_CHANGED("grant.access_changed"),
    INVITE_CREATED("invite.created"),
    INVITE_REDEEMED("invite.redeemed"),
    INVITE_REVOKED("invite.revoked"),
    INVITE_NOUN_CREATED("invite.noun_created"),
    INVITE_NOUN_RESOLVED("invite.noun_resolved"),
    IDENTITY_UPDATED("identity.updated"),
    ;

    private final String label;

    @JsonCreator
    public static EventType fromLabel(String label) {
        for (var type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }

        throw new IllegalArgumentException("unknown event type: " + label);
    }

    @JsonValue
    @Override
    public String toString() {
        return label;
    }
}
