package io.crabcity.auth.invite;

import io.crabcity.auth.capability.Capability;
import io.crabcity.auth.config.AuthConf;
import io.crabcity.auth.identity.PublicKey;
import io.crabcity.auth.identity.SignatureVerificationException;
import io.crabcity.auth.identity.SigningKey;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static io.crabcity.auth.constant.IdentityConstant.HASHLENGTH;
import static io.crabcity.auth.constant.InviteConstant.MAX_CHAIN_DEPTH;
import static io.crabcity.auth.constant.InviteConstant.VERSION;
import static io.crabcity.auth.invite.InviteErrorType.BAD_SIGNATURE;
import static io.crabcity.auth.invite.InviteErrorType.CAPABILITY_ESCALATION;
import static io.crabcity.auth.invite.InviteErrorType.CHAIN_TOO_DEEP;
import static io.crabcity.auth.invite.InviteErrorType.DEPTH_EXHAUSTED;
import static io.crabcity.auth.invite.InviteErrorType.DEPTH_NOT_DECREASING;
import static io.crabcity.auth.invite.InviteErrorType.EMPTY_CHAIN;
import static io.crabcity.auth.invite.InviteErrorType.EXPIRED;
import static io.crabcity.auth.invite.InviteErrorType.UNSUPPORTED_VERSION;
import static lombok.AccessLevel.PRIVATE;

/**
 * A self-contained, offline-verifiable invite: an instance identity and a chain of
 * signed links from root to leaf. A flat invite is a chain of one link with
 * {@code max_depth = 0}.
 * <p>
 * Invites are values. Creating, delegating and verifying never touch external state;
 * use counts and revocation live with the caller.
 */
@Slf4j
@Value
@AllArgsConstructor(access = PRIVATE)
public class Invite {

    /**
     * The root link signs over this in place of a previous link hash.
     */
    private static final byte[] GENESIS_PREV_HASH = new byte[HASHLENGTH];

    int version;
    PublicKey instance;
    List<InviteLink> links;

    /**
     * Assemble an invite from already signed links, e.g. after decoding. No checks beyond
     * the wire limits are made here; call {@link #verify()}.
     */
    public static Invite of(int version, @NonNull PublicKey instance, @NonNull List<InviteLink> links) {
        if (version < 0 || version > 0xFF) {
            throw new IllegalArgumentException("version must fit in a byte: " + version);
        }
        if (links.size() > 0xFF) {
            throw new IllegalArgumentException("chain length must fit in a byte: " + links.size());
        }

        return new Invite(version, instance, List.copyOf(links));
    }

    public static Invite createFlat(
            @NonNull SigningKey signingKey,
            @NonNull PublicKey instance,
            @NonNull Capability capability,
            long maxUses,
            Long expiresAt
    ) {
        return createDelegatable(signingKey, instance, capability, 0, maxUses, expiresAt);
    }

    /**
     * A root invite whose holder may delegate up to {@code maxDepth} further hops.
     */
    public static Invite createDelegatable(
            @NonNull SigningKey signingKey,
            @NonNull PublicKey instance,
            @NonNull Capability capability,
            int maxDepth,
            long maxUses,
            Long expiresAt
    ) {
        var root = InviteLink.sign(signingKey, GENESIS_PREV_HASH, instance, capability, maxDepth, maxUses, expiresAt);

        return new Invite(VERSION, instance, List.of(root));
    }

    /**
     * Append a link signed by {@code signingKey}. Escalation and exhausted depth are
     * refused here, at construction, not only at verification.
     */
    public static Invite delegate(
            @NonNull Invite parent,
            @NonNull SigningKey signingKey,
            @NonNull Capability capability,
            long maxUses,
            Long expiresAt
    ) throws InviteException {
        if (parent.links.isEmpty()) {
            throw new InviteException(EMPTY_CHAIN, "empty chain");
        }

        var leafIndex = parent.links.size() - 1;
        var leaf = parent.leaf();
        if (leaf.getMaxDepth() == 0) {
            throw new InviteException(DEPTH_EXHAUSTED, leafIndex, "cannot delegate: max_depth is 0");
        }
        if (capability.exceeds(leaf.getCapability())) {
            throw new InviteException(CAPABILITY_ESCALATION, leafIndex + 1,
                    "cannot escalate capability beyond parent: " + capability + " > " + leaf.getCapability());
        }
        if (parent.links.size() >= MAX_CHAIN_DEPTH) {
            throw new InviteException(CHAIN_TOO_DEEP, leafIndex + 1, "chain would exceed maximum " + MAX_CHAIN_DEPTH);
        }

        var link = InviteLink.sign(signingKey, leaf.hash(), parent.instance, capability, leaf.getMaxDepth() - 1, maxUses, expiresAt);
        var links = new ArrayList<>(parent.links);
        links.add(link);

        return new Invite(parent.version, parent.instance, List.copyOf(links));
    }

    public InviteLink root() {
        return links.get(0);
    }

    public InviteLink leaf() {
        return links.get(links.size() - 1);
    }

    public InviteClaims verify() throws InviteException {
        return verifyAt(Instant.now().getEpochSecond());
    }

    /**
     * Verify now, under the instance's configured chain cap.
     */
    public InviteClaims verify(@NonNull AuthConf conf) throws InviteException {
        return verifyAt(Instant.now().getEpochSecond(), conf.getMaxChainDepth());
    }

    public InviteClaims verifyAt(long nowUnixSecs) throws InviteException {
        return verifyAt(nowUnixSecs, MAX_CHAIN_DEPTH);
    }

    /**
     * Walk the chain root to leaf checking, per link: signature over the previous link's
     * hash, capability narrowing, strictly decreasing depth and expiry.
     *
     * @param nowUnixSecs   the time to check expiry against
     * @param maxChainDepth instance-wide cap on chain length; never above {@code MAX_CHAIN_DEPTH}
     * @throws InviteException naming the first failing link and rule
     */
    public InviteClaims verifyAt(long nowUnixSecs, int maxChainDepth) throws InviteException {
        try {
            return doVerify(nowUnixSecs, Math.min(maxChainDepth, MAX_CHAIN_DEPTH));
        } catch (InviteException e) {
            log.debug("Invite for instance {} rejected: {}", instance.fingerprint(), e.getMessage());
            throw e;
        }
    }

    private InviteClaims doVerify(long nowUnixSecs, int maxChainDepth) throws InviteException {
        if (version != VERSION) {
            throw new InviteException(UNSUPPORTED_VERSION, "unsupported version " + version);
        }
        if (links.isEmpty()) {
            throw new InviteException(EMPTY_CHAIN, "empty chain");
        }
        if (links.size() > maxChainDepth) {
            throw new InviteException(CHAIN_TOO_DEEP, "chain length " + links.size() + " exceeds maximum " + maxChainDepth);
        }

        var prevHash = GENESIS_PREV_HASH;
        InviteLink prev = null;
        for (int i = 0; i < links.size(); i++) {
            var link = links.get(i);

            try {
                link.verifySignature(prevHash, instance);
            } catch (SignatureVerificationException e) {
                throw new InviteException(BAD_SIGNATURE, i, "bad signature at link " + i, e);
            }

            if (prev != null) {
                if (link.getCapability().exceeds(prev.getCapability())) {
                    throw new InviteException(CAPABILITY_ESCALATION, i,
                            "capability escalation at link " + i + ": " + link.getCapability() + " > " + prev.getCapability());
                }
                if (prev.getMaxDepth() == 0) {
                    throw new InviteException(DEPTH_EXHAUSTED, i, "depth exhausted at link " + i);
                }
                if (link.getMaxDepth() >= prev.getMaxDepth()) {
                    throw new InviteException(DEPTH_NOT_DECREASING, i,
                            "depth must decrease at link " + i + ": " + link.getMaxDepth() + " >= " + prev.getMaxDepth());
                }
            }

            if (link.isExpiredAt(nowUnixSecs)) {
                throw new InviteException(EXPIRED, i, "link " + i + " expired");
            }

            prevHash = link.hash();
            prev = link;
        }

        var leaf = leaf();

        return new InviteClaims(instance, leaf.getCapability(), root().getIssuer(), leaf.getIssuer(), links.size(), leaf.getNonce());
    }

    public byte[] toBytes() {
        return InviteCodec.toBytes(this);
    }

    public static Invite fromBytes(final byte[] bytes) throws InviteException {
        return InviteCodec.fromBytes(bytes);
    }

    public String toBase32() {
        return InviteCodec.toBase32(this);
    }

    public static Invite fromBase32(final String encoded) throws InviteException {
        return InviteCodec.fromBase32(encoded);
    }
}
