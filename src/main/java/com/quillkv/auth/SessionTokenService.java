package com.quillkv.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillkv.store.KvStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Issues and verifies stateless HMAC-SHA256 session tokens of the form
 * {@code base64url(header).base64url(payload).base64url(signature)}.
 * <p>
 * The signing secret lives in the {@link KvStore} under {@link #SECRET_KEY}; it is created on first use
 * and cached for the life of this service. There is no revocation: a token stays valid until it expires.
 */
public class SessionTokenService {

    private static final Logger log = LoggerFactory.getLogger(SessionTokenService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Base64.Encoder B64 = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder B64_DECODER = Base64.getUrlDecoder();
    private static final HexFormat HEX = HexFormat.of();

    public static final String SECRET_KEY = "admin:session_secret";
    static final String ALGORITHM = "HS256";
    static final int VERSION = 1;
    private static final int SECRET_BYTES = 32;
    private static final String HEADER = encodeJson(MAPPER.createObjectNode().put("alg", ALGORITHM).put("typ", "JWT"));

    private final SecureRandom random = new SecureRandom();
    private final AtomicReference<byte[]> secret = new AtomicReference<>();
    private final KvStore store;
    private final Clock clock;

    public SessionTokenService(KvStore store) {
        this(store, Clock.systemUTC());
    }

    public SessionTokenService(KvStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public String issue(String subject, Duration ttl) {
        long now = clock.millis();
        var claims = new SessionClaims(subject, now, now + ttl.toMillis(), VERSION);
        var signingInput = HEADER + "." + encodeJson(claims);
        return signingInput + "." + B64.encodeToString(sign(signingInput, secret()));
    }

    /**
     * @return the claims of a well-formed, correctly signed, unexpired token; empty otherwise
     */
    public Optional<SessionClaims> verify(String token) {
        if (token == null || token.isEmpty()) return Optional.empty();
        var parts = token.split("\\.", -1);
        if (parts.length != 3) return Optional.empty();
        var key = secret();
        try {
            var expected = B64.encodeToString(sign(parts[0] + "." + parts[1], key));
            if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII),
                    parts[2].getBytes(StandardCharsets.US_ASCII))) {
                log.debug("Session token signature mismatch");
                return Optional.empty();
            }
            var header = MAPPER.readTree(B64_DECODER.decode(parts[0]));
            if (!ALGORITHM.equals(header.path("alg").asText())) {
                return Optional.empty();
            }
            var claims = MAPPER.readValue(B64_DECODER.decode(parts[1]), SessionClaims.class);
            if (claims.sub() == null || claims.exp() <= clock.millis()) {
                log.debug("Session token expired or without subject");
                return Optional.empty();
            }
            return Optional.of(claims);
        } catch (Exception e) {
            log.debug("Malformed session token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Fetches the signing secret, creating it if no process has yet. */
    byte[] secret() {
        var cached = secret.get();
        if (cached != null) return cached;
        var existing = store.get(SECRET_KEY).flatMap(SessionTokenService::decodeSecret);
        var resolved = existing.orElseGet(this::createSecret);
        secret.compareAndSet(null, resolved);
        return secret.get();
    }

    private byte[] createSecret() {
        var bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        var value = MAPPER.createObjectNode()
                .put("secret", HEX.formatHex(bytes))
                .put("created_at", Instant.now(clock).toString());
        var winner = decodeSecret(store.putIfAbsent(SECRET_KEY, value));
        if (winner.isPresent()) return winner.get();
        log.warn("Stored session secret is unreadable, replacing it");
        store.put(SECRET_KEY, value);
        return bytes;
    }

    private static Optional<byte[]> decodeSecret(JsonNode node) {
        var hex = node.path("secret").asText("");
        if (hex.isEmpty()) return Optional.empty();
        try {
            return Optional.of(HEX.parseHex(hex));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static byte[] sign(String signingInput, byte[] key) {
        try {
            var mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key, "HmacSHA256"));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static String encodeJson(Object value) {
        try {
            return B64.encodeToString(MAPPER.writeValueAsBytes(value));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to encode token part", e);
        }
    }
}
