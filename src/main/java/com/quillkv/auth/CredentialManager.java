package com.quillkv.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillkv.store.KvStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Password credential for the single administrative principal. There is exactly one record, stored
 * under {@link #ADMIN_KEY}; seeding a different identifier replaces it.
 */
public class CredentialManager {

    private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HexFormat HEX = HexFormat.of();

    public static final String ADMIN_KEY = "admin:user";
    static final String ALGORITHM = "pbkdf2_sha256";
    static final int ITERATIONS = 150_000;
    private static final int SALT_BYTES = 16;
    private static final int HASH_BITS = 256;

    private final SecureRandom random = new SecureRandom();
    private final KvStore store;
    private final Clock clock;

    public CredentialManager(KvStore store) {
        this(store, Clock.systemUTC());
    }

    public CredentialManager(KvStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Seeds the credential unless one already exists for {@code identifier}.
     *
     * @return true if a record was written
     */
    public boolean ensurePrincipal(String identifier, String password) {
        if (identifier == null || identifier.isBlank() || password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Admin identifier and password are required");
        }
        var stored = store.get(ADMIN_KEY);
        var existing = stored.flatMap(CredentialManager::read);
        if (existing.isPresent() && identifier.equals(existing.get().email())) {
            log.debug("Admin credential already present, leaving it untouched");
            return false;
        }
        var record = newRecord(identifier, password);
        var value = MAPPER.valueToTree(record);
        if (existing.isPresent()) {
            log.warn("Replacing admin credential held by a different principal");
            store.put(ADMIN_KEY, value);
            return true;
        }
        if (stored.isPresent()) {
            log.warn("Stored admin credential is unreadable, replacing it");
            store.put(ADMIN_KEY, value);
            return true;
        }
        // Concurrent seeders converge on whichever record lands first.
        var winner = store.putIfAbsent(ADMIN_KEY, value);
        return winner.equals(value);
    }

    /** False for an unknown principal, a wrong password or an unreadable record. */
    public boolean verifyPassword(String identifier, String password) {
        var record = load();
        if (password == null || password.isEmpty()) return false;
        if (record.isEmpty() || identifier == null || !identifier.equals(record.get().email())) {
            return false;
        }
        var r = record.get();
        try {
            var expected = HEX.parseHex(r.hash());
            var actual = derive(password, HEX.parseHex(r.salt()), r.iterations(), expected.length * 8);
            return MessageDigest.isEqual(actual, expected);
        } catch (IllegalArgumentException e) {
            log.warn("Admin credential record is malformed: {}", e.getMessage());
            return false;
        }
    }

    private Optional<CredentialRecord> load() {
        return store.get(ADMIN_KEY).flatMap(CredentialManager::read);
    }

    private static Optional<CredentialRecord> read(JsonNode node) {
        if (!node.isObject()) {
            log.warn("Admin credential record is not an object");
            return Optional.empty();
        }
        try {
            var record = MAPPER.treeToValue(node, CredentialRecord.class);
            if (record.salt() == null || record.hash() == null || record.iterations() <= 0) {
                log.warn("Admin credential record is missing salt, hash or iterations");
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (Exception e) {
            log.warn("Admin credential record could not be read: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private CredentialRecord newRecord(String identifier, String password) {
        var salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        var hash = derive(password, salt, ITERATIONS, HASH_BITS);
        return new CredentialRecord(identifier, ALGORITHM, ITERATIONS,
                HEX.formatHex(salt), HEX.formatHex(hash), Instant.now(clock).toString());
    }

    static byte[] derive(String password, byte[] salt, int iterations, int bits) {
        if (iterations <= 0 || bits <= 0) {
            throw new IllegalArgumentException("iterations and length must be positive");
        }
        var spec = new PBEKeySpec(password.toCharArray(), salt, iterations, bits);
        try {
            // SecretKeyFactory is not documented as thread-safe; take one per call.
            return SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA256 unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }
}
