package io.crabcity.auth.identity;

import io.crabcity.auth.error.AuthException;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import static io.crabcity.auth.error.AuthErrorType.INVALID_REMOTE_IDENTITY;
import static lombok.AccessLevel.PRIVATE;

/**
 * Standalone operations over public keys.
 */
@Slf4j
@NoArgsConstructor(access = PRIVATE)
public final class Identities {

    /**
     * Verify an Ed25519 signature.
     *
     * @throws SignatureVerificationException if the key is not a valid curve point or the
     *                                        signature does not match the message
     */
    public static void verify(
            @NonNull final PublicKey publicKey,
            @NonNull final byte[] message,
            @NonNull final Signature signature
    ) throws SignatureVerificationException {
        boolean valid;
        try {
            var sigPub = new Ed25519PublicKeyParameters(publicKey.toBytes(), 0);
            var verifier = new Ed25519Signer();
            verifier.init(false, sigPub);
            verifier.update(message, 0, message.length);
            valid = verifier.verifySignature(signature.toBytes());
        } catch (RuntimeException e) {
            throw new SignatureVerificationException("malformed public key " + publicKey.fingerprint(), e);
        }

        if (!valid) {
            throw new SignatureVerificationException("invalid signature");
        }
    }

    public static String fingerprint(@NonNull final PublicKey publicKey) {
        return publicKey.fingerprint();
    }

    public static boolean isLoopback(@NonNull final PublicKey publicKey) {
        return publicKey.isLoopback();
    }

    /**
     * Guard for the transport layer: the loopback sentinel may only ever be
     * assigned locally, never extracted from a remote handshake.
     */
    public static PublicKey requireRemote(@NonNull final PublicKey remote) throws AuthException {
        if (remote.isLoopback()) {
            log.warn("Rejected loopback identity presented by a remote peer");
            throw new AuthException(INVALID_REMOTE_IDENTITY, "loopback identity is not valid for remote connections");
        }

        return remote;
    }
}
