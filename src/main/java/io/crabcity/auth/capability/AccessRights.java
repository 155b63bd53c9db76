package io.crabcity.auth.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import static java.util.Objects.isNull;

/**
 * The authoritative set of (resource type, action) pairs held by a grant.
 * <p>
 * Always normalized: types sorted, entries of the same type merged, actions sorted and
 * de-duplicated. Two values are equal exactly when they grant the same pairs. The
 * operations here are the only supported way to compare, narrow or audit rights.
 */
@EqualsAndHashCode
public final class AccessRights {

    private static final AccessRights EMPTY = new AccessRights(List.of());

    private final List<AccessRight> rights;

    private AccessRights(List<AccessRight> rights) {
        this.rights = rights;
    }

    public static AccessRights empty() {
        return EMPTY;
    }

    public static AccessRights single(String type, String action) {
        return of(List.of(AccessRight.of(type, action)));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AccessRights of(Collection<AccessRight> rights) {
        if (isNull(rights)) {
            throw new IllegalArgumentException("access rights must be an array");
        }

        var merged = new TreeMap<String, SortedSet<String>>();
        for (var right : rights) {
            if (isNull(right)) {
                throw new IllegalArgumentException("access rights must not contain null entries");
            }
            merged.computeIfAbsent(right.getType(), k -> new TreeSet<>()).addAll(right.getActions());
        }

        return fromMap(merged);
    }

    private static AccessRights fromMap(Map<String, SortedSet<String>> map) {
        var result = new ArrayList<AccessRight>(map.size());
        map.forEach((type, actions) -> {
            if (!actions.isEmpty()) {
                result.add(new AccessRight(type, actions));
            }
        });

        return result.isEmpty() ? EMPTY : new AccessRights(List.copyOf(result));
    }

    @JsonValue
    public List<AccessRight> getRights() {
        return rights;
    }

    public boolean isEmpty() {
        return rights.isEmpty();
    }

    /**
     * Per-type intersection of actions. Types present on only one side are dropped.
     * Commutative and idempotent.
     */
    public AccessRights intersect(@NonNull AccessRights other) {
        var result = new TreeMap<String, SortedSet<String>>();
        for (var right : rights) {
            var match = other.find(right.getType());
            if (isNull(match)) {
                continue;
            }
            var actions = new TreeSet<>(right.getActions());
            actions.retainAll(match.getActions());
            result.put(right.getType(), actions);
        }

        return fromMap(result);
    }

    public boolean contains(String type, String action) {
        var right = find(type);

        return right != null && right.allows(action);
    }

    /**
     * True when every (type, action) pair of {@code other} is also granted here.
     */
    public boolean isSupersetOf(@NonNull AccessRights other) {
        for (var right : other.rights) {
            for (var action : right.getActions()) {
                if (!contains(right.getType(), action)) {
                    return false;
                }
            }
        }

        return true;
    }

    /**
     * Audit diff from this value to {@code other}.
     *
     * @return left: pairs in {@code other} but not here (added), right: pairs here but not in {@code other} (removed)
     */
    public Pair<AccessRights, AccessRights> diff(@NonNull AccessRights other) {
        var types = new TreeSet<String>();
        rights.forEach(right -> types.add(right.getType()));
        other.rights.forEach(right -> types.add(right.getType()));

        var added = new TreeMap<String, SortedSet<String>>();
        var removed = new TreeMap<String, SortedSet<String>>();
        for (var type : types) {
            var mine = actionsOf(type);
            var theirs = other.actionsOf(type);

            added.put(type, new TreeSet<>(CollectionUtils.subtract(theirs, mine)));
            removed.put(type, new TreeSet<>(CollectionUtils.subtract(mine, theirs)));
        }

        return Pair.of(fromMap(added), fromMap(removed));
    }

    private SortedSet<String> actionsOf(String type) {
        var right = find(type);

        return isNull(right) ? new TreeSet<>() : new TreeSet<>(right.getActions());
    }

    private AccessRight find(String type) {
        for (var right : rights) {
            if (right.getType().equals(type)) {
                return right;
            }
        }

        return null;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("[");
        for (int i = 0; i < rights.size(); i++) {
            var right = rights.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(right.getType()).append(':').append(right.getActions());
        }

        return sb.append(']').toString();
    }
}
