package io.crabcity.auth.noun;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.NonNull;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import static io.crabcity.auth.noun.NounErrorType.INVALID_EMAIL;
import static io.crabcity.auth.noun.NounErrorType.INVALID_GITHUB;
import static io.crabcity.auth.noun.NounErrorType.INVALID_HANDLE;
import static io.crabcity.auth.noun.NounErrorType.UNKNOWN_FORMAT;

/**
 * A human-readable account reference such as {@code @alex}, {@code github:alex} or
 * {@code email:alex@example.com}. Always validated on construction.
 * <p>
 * JSON shape: {@code {"provider": "github", "subject": "alex"}}.
 */
@Value
public class IdentityNoun {

    @JsonProperty("provider")
    NounProvider provider;

    @JsonProperty("subject")
    String subject;

    @JsonCreator
    public IdentityNoun(
            @JsonProperty("provider") @NonNull NounProvider provider,
            @JsonProperty("subject") @NonNull String subject
    ) throws NounException {
        validate(provider, subject);
        this.provider = provider;
        this.subject = subject;
    }

    public static IdentityNoun handle(String handle) throws NounException {
        return new IdentityNoun(NounProvider.HANDLE, handle);
    }

    public static IdentityNoun github(String username) throws NounException {
        return new IdentityNoun(NounProvider.GITHUB, username);
    }

    public static IdentityNoun google(String email) throws NounException {
        return new IdentityNoun(NounProvider.GOOGLE, email);
    }

    public static IdentityNoun email(String email) throws NounException {
        return new IdentityNoun(NounProvider.EMAIL, email);
    }

    /**
     * Parse the display form produced by {@link #toString()}.
     */
    public static IdentityNoun parse(@NonNull String value) throws NounException {
        for (var provider : NounProvider.values()) {
            if (value.startsWith(provider.getPrefix())) {
                return new IdentityNoun(provider, value.substring(provider.getPrefix().length()));
            }
        }

        throw new NounException(UNKNOWN_FORMAT, "unknown noun format: " + value);
    }

    @Override
    public String toString() {
        return provider.getPrefix() + subject;
    }

    private static void validate(NounProvider provider, String subject) throws NounException {
        switch (provider) {
            case HANDLE:
                validateHandle(subject);
                break;
            case GITHUB:
                validateGithub(subject);
                break;
            case GOOGLE:
            case EMAIL:
                validateEmail(subject, provider);
                break;
            default:
                throw new NounException(UNKNOWN_FORMAT, "unknown provider " + provider);
        }
    }

    private static void validateHandle(String handle) throws NounException {
        if (handle.length() < 3 || handle.length() > 30) {
            throw new NounException(INVALID_HANDLE, "invalid handle: must be 3-30 characters");
        }
        if (handle.startsWith("-") || handle.endsWith("-")) {
            throw new NounException(INVALID_HANDLE, "invalid handle: cannot start or end with hyphen");
        }
        if (!handle.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-')) {
            throw new NounException(INVALID_HANDLE, "invalid handle: must be lowercase alphanumeric + hyphens");
        }
    }

    private static void validateGithub(String username) throws NounException {
        if (username.isEmpty() || username.length() > 39) {
            throw new NounException(INVALID_GITHUB, "invalid github username: must be 1-39 characters");
        }
        if (username.startsWith("-")) {
            throw new NounException(INVALID_GITHUB, "invalid github username: cannot start with hyphen");
        }
        if (!StringUtils.isAsciiPrintable(username) || !username.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-')) {
            throw new NounException(INVALID_GITHUB, "invalid github username: must be alphanumeric + hyphens");
        }
    }

    private static void validateEmail(String email, NounProvider provider) throws NounException {
        if (email.isEmpty()) {
            throw invalidEmail(provider, "empty");
        }
        var at = email.indexOf('@');
        if (at < 0) {
            throw invalidEmail(provider, "missing @");
        }
        var local = email.substring(0, at);
        var domain = email.substring(at + 1);
        if (local.isEmpty()) {
            throw invalidEmail(provider, "empty local part");
        }
        if (domain.isEmpty()) {
            throw invalidEmail(provider, "empty domain");
        }
        if (!domain.contains(".")) {
            throw invalidEmail(provider, "domain must contain a dot");
        }
    }

    private static NounException invalidEmail(NounProvider provider, String reason) {
        return new NounException(INVALID_EMAIL, "invalid email for " + provider + ": " + reason);
    }
}
