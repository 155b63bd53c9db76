package io.crabcity.auth.capability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static io.crabcity.auth.capability.Capability.ADMIN;
import static io.crabcity.auth.capability.Capability.COLLABORATE;
import static io.crabcity.auth.capability.Capability.VIEW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AccessRightsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void normalizesOrderDuplicatesAndMerges() {
        var rights = AccessRights.of(List.of(
                AccessRight.of("tasks", "read", "edit", "read"),
                AccessRight.of("chat", "send"),
                AccessRight.of("tasks", "create")
        ));

        assertEquals("[chat:[send], tasks:[create, edit, read]]", rights.toString());
        assertEquals(rights, AccessRights.of(List.of(
                AccessRight.of("chat", "send"),
                AccessRight.of("tasks", "create", "edit", "read")
        )));
    }

    @Test
    void intersectDropsTypesPresentOnOneSide() {
        var left = AccessRights.of(List.of(AccessRight.of("tasks", "read", "edit"), AccessRight.of("chat", "send")));
        var right = AccessRights.of(List.of(AccessRight.of("tasks", "edit", "create"), AccessRight.of("members", "read")));

        assertEquals(AccessRights.single("tasks", "edit"), left.intersect(right));
        assertTrue(left.intersect(AccessRights.empty()).isEmpty());
    }

    @Test
    void diffReportsAddedAndRemoved() {
        var view = VIEW.accessRights();
        var admin = ADMIN.accessRights();

        var diff = view.diff(admin);

        assertTrue(diff.getRight().isEmpty());
        assertTrue(diff.getLeft().contains("members", "suspend"));
        assertFalse(diff.getLeft().contains("content", "read"));
        assertTrue(admin.diff(view).getLeft().isEmpty());
        assertEquals(diff.getLeft(), admin.diff(view).getRight());
    }

    @Test
    void diffAndIntersectConsistent() {
        for (var a : Capability.values()) {
            for (var b : Capability.values()) {
                var left = a.accessRights();
                var right = b.accessRights();
                var diff = left.diff(right);
                var common = left.intersect(right);

                // nothing added is already common, nothing removed is kept
                assertTrue(diff.getLeft().intersect(common).isEmpty());
                assertTrue(diff.getRight().intersect(common).isEmpty());
                assertTrue(right.isSupersetOf(diff.getLeft()));
                assertTrue(left.isSupersetOf(diff.getRight()));
            }
        }
    }

    @Test
    void singleAndContains() {
        var rights = AccessRights.single("terminals", "input");

        assertTrue(rights.contains("terminals", "input"));
        assertFalse(rights.contains("terminals", "read"));
        assertFalse(rights.contains("chat", "input"));
        assertFalse(rights.isEmpty());
    }

    @Test
    void jsonShape() throws JsonProcessingException {
        var rights = AccessRights.of(List.of(AccessRight.of("tasks", "read", "create")));

        var json = mapper.writeValueAsString(rights);

        assertEquals("[{\"type\":\"tasks\",\"actions\":[\"create\",\"read\"]}]", json);
        assertEquals(rights, mapper.readValue(json, AccessRights.class));
    }

    @Test
    void jsonNormalizesOnRead() throws JsonProcessingException {
        var json = "[{\"type\":\"tasks\",\"actions\":[\"read\",\"read\"]},{\"type\":\"chat\",\"actions\":[\"send\"]}]";

        var rights = mapper.readValue(json, AccessRights.class);

        assertEquals("[chat:[send], tasks:[read]]", rights.toString());
        assertEquals(COLLABORATE.accessRights(), mapper.readValue(mapper.writeValueAsString(COLLABORATE.accessRights()), AccessRights.class));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "[{\"type\":\"\",\"actions\":[\"read\"]}]",
            "[{\"type\":\"tasks\"}]",
            "[{\"type\":\"tasks\",\"actions\":[]}]",
            "[{\"type\":\"tasks\",\"actions\":[\"\"]}]",
            "[{\"type\":\"tasks\",\"actions\":[\"re ad\"]}]",
            "[{\"actions\":[\"read\"]}]",
            "[null]",
            "{\"type\":\"tasks\",\"actions\":[\"read\"]}"
    })
    void jsonValidatesShape(String json) {
        assertThrows(JsonMappingException.class, () -> mapper.readValue(json, AccessRights.class));
    }

    private static final String[] TYPES = {"content", "terminals", "chat", "tasks", "members", "instance"};
    private static final String[] ACTIONS = {"read", "input", "send", "create", "edit", "remove", "manage"};

    private static AccessRights randomRights(Random random) {
        var rights = new ArrayList<AccessRight>();
        for (var type : TYPES) {
            if (random.nextInt(3) == 0) {
                continue;
            }
            var actions = new ArrayList<String>();
            for (var action : ACTIONS) {
                if (random.nextBoolean()) {
                    actions.add(action);
                }
            }
            if (!actions.isEmpty()) {
                rights.add(new AccessRight(type, actions));
            }
        }

        return AccessRights.of(rights);
    }

    @Test
    void intersectLawsHoldForRandomRights() {
        var random = new Random(0xC0FFEE);
        for (int i = 0; i < 500; i++) {
            var a = randomRights(random);
            var b = randomRights(random);
            var c = randomRights(random);
            var ab = a.intersect(b);

            assertEquals(ab, b.intersect(a));
            assertEquals(a, a.intersect(a));
            assertEquals(ab, ab.intersect(ab));
            assertTrue(a.isSupersetOf(ab));
            assertTrue(b.isSupersetOf(ab));

            var narrowed = ab.intersect(c);
            assertTrue(ab.isSupersetOf(narrowed));
            assertTrue(a.isSupersetOf(narrowed) && b.isSupersetOf(narrowed));
            if (ab.isSupersetOf(c)) {
                assertTrue(a.isSupersetOf(c) && b.isSupersetOf(c));
            }
            assertEquals(ab.isSupersetOf(c), a.isSupersetOf(c) && b.isSupersetOf(c));
        }
    }
}
