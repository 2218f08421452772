package com.auditchain.core.canonical;

import com.auditchain.core.domain.AuditEntry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 chaining of audit entries.
 */
public final class EntryHasher {

    /** Predecessor hash of every genesis entry. */
    public static final String GENESIS_SENTINEL =
            "0000000000000000000000000000000000000000000000000000000000000000";

    private EntryHasher() {}

    /**
     * Computes {@code SHA-256(previousHash || canonical(entry))} as lower-case hex.
     * The stored entry hash of {@code entry} is ignored.
     */
    public static String hash(AuditEntry entry) {
        Objects.requireNonNull(entry.previousHash(), "Previous hash cannot be null");
        byte[] encoded = CanonicalEncoder.encode(entry);
        MessageDigest digest = sha256();
        digest.update(entry.previousHash().getBytes(StandardCharsets.UTF_8));
        digest.update(encoded);
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Hashes and seals an unsealed entry.
     */
    public static AuditEntry seal(AuditEntry entry) {
        return entry.withEntryHash(hash(entry));
    }

    public static String sha256Hex(byte[] data) {
        return HexFormat.of().formatHex(sha256().digest(data));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
