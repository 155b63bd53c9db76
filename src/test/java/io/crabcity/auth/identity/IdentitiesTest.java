package io.crabcity.auth.identity;

import io.crabcity.auth.error.AuthException;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;

import static io.crabcity.auth.error.AuthErrorType.INVALID_REMOTE_IDENTITY;
import static io.crabcity.auth.error.AuthErrorType.INVALID_SIGNATURE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentitiesTest {

    @Test
    void signAndVerify() {
        var signingKey = SigningKey.generate();
        var message = "hello crab city".getBytes(UTF_8);

        var signature = signingKey.sign(message);

        assertDoesNotThrow(() -> Identities.verify(signingKey.publicKey(), message, signature));
    }

    @Test
    void rfc8032TestVector() throws DecoderException {
        // RFC 8032 section 7.1, TEST 2
        var signingKey = SigningKey.fromBytes(Hex.decodeHex("4ccd089b28ff96da9db6c346ec114e0f5b8a319f35aba624da8cf6ed4fb8a6fb"));

        var signature = signingKey.sign(Hex.decodeHex("72"));

        assertEquals("3d4017c3e843895a92b70aa74d1b7ebc9c982ccf2ec4968cc0cd55f12af4660c", Hex.encodeHexString(signingKey.publicKey().toBytes()));
        assertEquals("92a009a9f0d4cab8720e820b5f642540a2b27b5416503f8fb3762223ebdb69da"
                + "085ac1e43e15996e458f3613d0f11d8c387b2eaeb4302aeeb00d291612bb0c00", Hex.encodeHexString(signature.toBytes()));
    }

    @Test
    void wrongKeyFails() {
        var signer = SigningKey.generate();
        var other = SigningKey.generate();
        var message = "payload".getBytes(UTF_8);

        var e = assertThrows(SignatureVerificationException.class,
                () -> Identities.verify(other.publicKey(), message, signer.sign(message)));

        assertEquals(INVALID_SIGNATURE, e.getType());
    }

    @Test
    void tamperedMessageFails() {
        var signer = SigningKey.generate();
        var signature = signer.sign("payload".getBytes(UTF_8));

        assertThrows(SignatureVerificationException.class,
                () -> Identities.verify(signer.publicKey(), "paYload".getBytes(UTF_8), signature));
    }

    @Test
    void loopbackKeyNeverVerifies() {
        var signer = SigningKey.generate();
        var message = "payload".getBytes(UTF_8);

        assertThrows(SignatureVerificationException.class,
                () -> Identities.verify(PublicKey.LOOPBACK, message, signer.sign(message)));
    }

    @Test
    void seedRoundTrip() {
        var signingKey = SigningKey.generate(new SecureRandom());

        var restored = SigningKey.fromBytes(signingKey.toBytes());

        assertEquals(signingKey.publicKey(), restored.publicKey());
    }

    @Test
    void signingKeyToStringHidesSeed() {
        var signingKey = SigningKey.generate();

        var text = signingKey.toString();

        assertTrue(text.contains(signingKey.publicKey().fingerprint()));
        assertFalse(text.contains(Hex.encodeHexString(signingKey.toBytes())));
    }

    @Test
    void fingerprintFormat() {
        var key = SigningKey.generate().publicKey();

        var fingerprint = key.fingerprint();

        assertEquals(13, fingerprint.length());
        assertTrue(fingerprint.matches("crab_[0-9A-HJKMNP-TV-Z]{8}"), fingerprint);
        assertEquals(fingerprint, Identities.fingerprint(key));
        assertEquals("crab_00000000", PublicKey.LOOPBACK.fingerprint());
    }

    @Test
    void publicKeyEqualityIsByBytes() {
        var bytes = new byte[32];
        bytes[0] = 7;

        var first = PublicKey.fromBytes(bytes);
        bytes[1] = 9;
        var second = PublicKey.fromBytes(bytes);

        assertNotEquals(first, second);
        assertEquals(first, PublicKey.fromBytes(first.toBytes()));
        assertEquals(first.hashCode(), PublicKey.fromBytes(first.toBytes()).hashCode());
    }

    @Test
    void publicKeyBase64RoundTrip() throws DecoderException {
        var key = SigningKey.generate().publicKey();

        var text = key.toString();

        assertEquals(43, text.length());
        assertEquals(key, PublicKey.fromBase64(text));
        assertThrows(DecoderException.class, () -> PublicKey.fromBase64(text.substring(0, 40)));
    }

    @Test
    void nonCanonicalBase64Rejected() throws DecoderException {
        var canonical = PublicKey.LOOPBACK.toString();
        // Same 32 bytes, but with a padding bit set in the last character
        var aliased = canonical.substring(0, 42) + "B";

        assertEquals(PublicKey.LOOPBACK, PublicKey.fromBase64(canonical));
        assertThrows(DecoderException.class, () -> PublicKey.fromBase64(aliased));
    }

    @Test
    void wrongLengthsRejected() {
        assertThrows(IllegalArgumentException.class, () -> PublicKey.fromBytes(new byte[31]));
        assertThrows(IllegalArgumentException.class, () -> Signature.fromBytes(new byte[65]));
        assertThrows(IllegalArgumentException.class, () -> SigningKey.fromBytes(new byte[16]));
    }

    @Test
    void loopback() throws AuthException {
        assertTrue(PublicKey.LOOPBACK.isLoopback());
        assertTrue(Identities.isLoopback(PublicKey.fromBytes(new byte[32])));
        assertArrayEquals(new byte[32], PublicKey.LOOPBACK.toBytes());

        var remote = SigningKey.generate().publicKey();
        assertFalse(remote.isLoopback());
        assertSame(remote, Identities.requireRemote(remote));

        var e = assertThrows(AuthException.class, () -> Identities.requireRemote(PublicKey.LOOPBACK));
        assertEquals(INVALID_REMOTE_IDENTITY, e.getType());
    }
}
