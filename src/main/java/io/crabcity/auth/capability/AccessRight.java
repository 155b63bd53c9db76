package io.crabcity.auth.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * One resource type and the actions allowed on it. JSON shape:
 * {@code {"type": "tasks", "actions": ["create", "read"]}}.
 * <p>
 * Actions are kept sorted and de-duplicated. Construction validates the shape, so a
 * malformed entry arriving as JSON is rejected rather than trusted.
 */
@Value
public class AccessRight {

    @JsonProperty("type")
    String type;

    @JsonProperty("actions")
    List<String> actions;

    @JsonCreator
    public AccessRight(
            @JsonProperty("type") String type,
            @JsonProperty("actions") Collection<String> actions
    ) {
        requireToken(type, "type");
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("access right '" + type + "' must name at least one action");
        }
        actions.forEach(action -> requireToken(action, "action"));

        this.type = type;
        this.actions = List.copyOf(new TreeSet<>(actions));
    }

    public static AccessRight of(String type, String... actions) {
        return new AccessRight(type, Arrays.asList(actions));
    }

    public boolean allows(String action) {
        return actions.contains(action);
    }

    private static void requireToken(String value, String what) {
        if (StringUtils.isBlank(value) || StringUtils.containsWhitespace(value)) {
            throw new IllegalArgumentException("invalid access right " + what + ": '" + value + "'");
        }
    }
}
