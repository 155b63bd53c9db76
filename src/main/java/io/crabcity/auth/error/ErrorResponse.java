package io.crabcity.auth.error;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Serializable surface form of an {@link AuthException}.
 */
@Value
public class ErrorResponse {

    @JsonProperty("error")
    String error;

    @JsonProperty("message")
    String message;

    @JsonProperty("recovery")
    RecoveryAction recovery;

    @JsonCreator
    public ErrorResponse(
            @JsonProperty("error") String error,
            @JsonProperty("message") String message,
            @JsonProperty("recovery") RecoveryAction recovery
    ) {
        this.error = error;
        this.message = message;
        this.recovery = recovery;
    }

    public static ErrorResponse from(AuthException e) {
        return new ErrorResponse(e.getType().getCode(), e.getMessage(), e.getRecovery());
    }
}
