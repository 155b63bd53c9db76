package io.crabcity.auth.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.crabcity.auth.identity.PublicKey;
import io.crabcity.auth.identity.SigningKey;
import org.apache.commons.codec.binary.Hex;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.crabcity.auth.event.EventType.GRANT_ACCESS_CHANGED;
import static io.crabcity.auth.event.EventType.MEMBER_JOINED;
import static io.crabcity.auth.utils.IdentityUtils.fullHash;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PublicKey instance = PublicKey.fromBytes(filled(1));

    private static byte[] filled(int value) {
        var bytes = new byte[32];
        Arrays.fill(bytes, (byte) value);

        return bytes;
    }

    @Test
    void hashIsDeterministic() throws JsonProcessingException {
        var prev = Event.genesisPrevHash(instance);

        var first = Event.create(0, prev, MEMBER_JOINED, null, null, mapper.readTree("{}"), "t");
        var second = Event.create(0, prev, MEMBER_JOINED, null, null, mapper.readTree("{}"), "t");

        assertArrayEquals(first.getHash(), second.getHash());
        assertEquals(first, second);
        assertTrue(first.verifyHash());
    }

    @Test
    void knownHashLayout() throws JsonProcessingException {
        var actor = PublicKey.fromBytes(filled(2));
        var event = Event.create(7, filled(3), GRANT_ACCESS_CHANGED, actor, null,
                mapper.readTree("{\"b\":1,\"a\":[true]}"), "2025-01-01T00:00:00Z");

        var expected = fullHash(
                new byte[]{0, 0, 0, 0, 0, 0, 0, 7},
                filled(3),
                "grant.access_changed".getBytes(),
                new byte[]{1},
                filled(2),
                new byte[]{0},
                "{\"a\":[true],\"b\":1}".getBytes(),
                "2025-01-01T00:00:00Z".getBytes()
        );

        assertEquals(Hex.encodeHexString(expected), Hex.encodeHexString(event.getHash()));
    }

    @Test
    void payloadKeyOrderDoesNotChangeHash() throws JsonProcessingException {
        var prev = new byte[32];

        var first = Event.create(0, prev, MEMBER_JOINED, null, null, mapper.readTree("{\"a\":1,\"b\":{\"y\":2,\"x\":3}}"), "t");
        var second = Event.create(0, prev, MEMBER_JOINED, null, null, mapper.readTree("{\"b\":{\"x\":3,\"y\":2},\"a\":1}"), "t");

        assertArrayEquals(first.getHash(), second.getHash());
    }

    @Test
    void everyFieldIsHashed() throws JsonProcessingException {
        var prev = new byte[32];
        var key = SigningKey.generate().publicKey();
        var base = Event.create(0, prev, MEMBER_JOINED, null, null, mapper.readTree("{\"a\":1}"), "t");

        assertHashDiffers(base, Event.create(1, prev, MEMBER_JOINED, null, null, mapper.readTree("{\"a\":1}"), "t"));
        assertHashDiffers(base, Event.create(0, filled(9), MEMBER_JOINED, null, null, mapper.readTree("{\"a\":1}"), "t"));
        assertHashDiffers(base, Event.create(0, prev, GRANT_ACCESS_CHANGED, null, null, mapper.readTree("{\"a\":1}"), "t"));
        assertHashDiffers(base, Event.create(0, prev, MEMBER_JOINED, key, null, mapper.readTree("{\"a\":1}"), "t"));
        assertHashDiffers(base, Event.create(0, prev, MEMBER_JOINED, null, key, mapper.readTree("{\"a\":1}"), "t"));
        assertHashDiffers(base, Event.create(0, prev, MEMBER_JOINED, null, null, mapper.readTree("{\"a\":2}"), "t"));
        assertHashDiffers(base, Event.create(0, prev, MEMBER_JOINED, null, null, mapper.readTree("{\"a\":1}"), "u"));

        var asActor = Event.create(0, prev, MEMBER_JOINED, key, null, mapper.readTree("{}"), "t");
        var asTarget = Event.create(0, prev, MEMBER_JOINED, null, key, mapper.readTree("{}"), "t");
        assertFalse(Arrays.equals(asActor.getHash(), asTarget.getHash()));
    }

    private static void assertHashDiffers(Event base, Event other) {
        assertFalse(Arrays.equals(base.getHash(), other.getHash()));
    }

    @Test
    void genesisPrevHashIsHashOfInstanceKey() {
        assertArrayEquals(fullHash(instance.toBytes()), Event.genesisPrevHash(instance));
    }

    @Test
    void nextLinksToPrevious() throws JsonProcessingException {
        var first = Event.create(0, Event.genesisPrevHash(instance), MEMBER_JOINED, null, null, mapper.readTree("{}"), "t0");

        var second = Event.next(first, MEMBER_JOINED, null, null, mapper.readTree("{}"), "t1");

        assertEquals(1, second.getId());
        assertArrayEquals(first.getHash(), second.getPrevHash());
    }

    @Test
    void restoredEventKeepsStoredHash() throws JsonProcessingException {
        var event = Event.create(0, new byte[32], MEMBER_JOINED, null, null, mapper.readTree("{\"a\":1}"), "t");

        var tampered = Event.restore(event.getId(), event.getPrevHash(), event.getType(), null, null,
                mapper.readTree("{\"a\":2}"), event.getCreatedAt(), event.getHash());

        assertFalse(tampered.verifyHash());
        assertArrayEquals(event.getHash(), tampered.getHash());
    }

    @Test
    void payloadIsDefensivelyCopied() throws JsonProcessingException {
        var payload = (ObjectNode) mapper.readTree("{\"a\":1}");
        var event = Event.create(0, new byte[32], MEMBER_JOINED, null, null, payload, "t");

        payload.put("a", 2);
        ((ObjectNode) event.getPayload()).put("a", 3);

        assertTrue(event.verifyHash());
    }

    @Test
    void wrongHashLengthRejected() throws JsonProcessingException {
        var payload = mapper.readTree("{}");

        assertThrows(IllegalArgumentException.class, () -> Event.create(0, new byte[31], MEMBER_JOINED, null, null, payload, "t"));
    }

    @Test
    void eventTypeLabels() {
        assertEquals(13, EventType.values().length);
        for (var type : EventType.values()) {
            assertEquals(type, EventType.fromLabel(type.toString()));
            assertTrue(type.toString().matches("[a-z]+\\.[a-z_]+"), type.toString());
        }
        assertEquals("invite.noun_resolved", EventType.INVITE_NOUN_RESOLVED.toString());
        assertThrows(IllegalArgumentException.class, () -> EventType.fromLabel("member_joined"));
    }
}
