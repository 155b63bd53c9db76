package io.crabcity.auth.identity;

import lombok.NonNull;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.security.SecureRandom;

import static io.crabcity.auth.constant.IdentityConstant.KEYSIZE;

/**
 * An Ed25519 private key. Deliberately not {@link Cloneable} and never printed.
 */
public final class SigningKey {

    private final Ed25519PrivateKeyParameters prv;
    private final PublicKey publicKey;

    private SigningKey(Ed25519PrivateKeyParameters prv) {
        this.prv = prv;
        this.publicKey = PublicKey.fromBytes(prv.generatePublicKey().getEncoded());
    }

    public static SigningKey generate() {
        return generate(new SecureRandom());
    }

    public static SigningKey generate(@NonNull final SecureRandom random) {
        return new SigningKey(new Ed25519PrivateKeyParameters(random));
    }

    /**
     * Reconstruct from a raw 32-byte seed as produced by {@link #toBytes()}.
     */
    public static SigningKey fromBytes(@NonNull final byte[] seed) {
        if (seed.length != KEYSIZE) {
            throw new IllegalArgumentException("signing key seed must be " + KEYSIZE + " bytes, got " + seed.length);
        }

        return new SigningKey(new Ed25519PrivateKeyParameters(seed, 0));
    }

    /**
     * Raw 32-byte seed, suitable for persistent storage. <strong>HAZARD!</strong> This is secret material.
     */
    public byte[] toBytes() {
        return prv.getEncoded();
    }

    public PublicKey publicKey() {
        return publicKey;
    }

    public Signature sign(@NonNull final byte[] message) {
        var signer = new Ed25519Signer();
        signer.init(true, prv);
        signer.update(message, 0, message.length);

        return Signature.fromBytes(signer.generateSignature());
    }

    @Override
    public String toString() {
        return "SigningKey(" + publicKey.fingerprint() + ")";
    }
}
