package com.quillkv.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".quillkv", "config.yaml"
    );
    private static final Pattern SAFE_SCHEMA = Pattern.compile("^[A-Za-z0-9_]+$");

    public static QuillKvConfig load() {
        return load(DEFAULT_PATH);
    }

    public static QuillKvConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static QuillKvConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var db = (Map<String, Object>) raw.getOrDefault("database", Map.of());
        var storage = (Map<String, Object>) raw.getOrDefault("storage", Map.of());
        var auth = (Map<String, Object>) raw.getOrDefault("auth", Map.of());

        return new QuillKvConfig(
            Integer.parseInt(envOrDefault(env, "QUILLKV_PORT",
                String.valueOf(server.getOrDefault("port", 3000)))),
            Map.of(
                "url", envOrDefault(env, "QUILLKV_DB_URL",
                    String.valueOf(db.getOrDefault("url", "jdbc:postgresql://localhost:5432/quillkv"))),
                "username", envOrDefault(env, "QUILLKV_DB_USER",
                    String.valueOf(db.getOrDefault("username", "quillkv"))),
                "password", envOrDefault(env, "QUILLKV_DB_PASS",
                    String.valueOf(db.getOrDefault("password", "quillkv"))),
                "schema", safeSchema(envOrDefault(env, "QUILLKV_DB_SCHEMA",
                    String.valueOf(db.getOrDefault("schema", "public"))))
            ),
            parseStorageConfig(storage, env),
            parseAuthConfig(auth, env)
        );
    }

    private static StorageConfig parseStorageConfig(Map<String, Object> storage, Function<String, String> env) {
        var defaults = StorageConfig.defaults();
        return new StorageConfig(
            envOrDefault(env, "QUILLKV_STORAGE",
                String.valueOf(storage.getOrDefault("backend", defaults.backend()))),
            envOrDefault(env, "QUILLKV_OWNER_ID",
                String.valueOf(storage.getOrDefault("owner-id", defaults.ownerId()))),
            Integer.parseInt(String.valueOf(
                storage.getOrDefault("query-timeout-seconds", defaults.queryTimeoutSeconds()))),
            Integer.parseInt(String.valueOf(storage.getOrDefault("pool-size", defaults.poolSize())))
        );
    }

    private static AuthConfig parseAuthConfig(Map<String, Object> auth, Function<String, String> env) {
        var defaults = AuthConfig.defaults();
        return new AuthConfig(
            envOrDefault(env, "QUILLKV_ADMIN_EMAIL",
                String.valueOf(auth.getOrDefault("admin-email", defaults.adminEmail()))),
            envOrDefault(env, "QUILLKV_ADMIN_PASSWORD",
                String.valueOf(auth.getOrDefault("admin-password", defaults.adminPassword()))),
            Long.parseLong(String.valueOf(auth.getOrDefault("session-ttl-hours", defaults.sessionTtlHours()))),
            Boolean.TRUE.equals(auth.getOrDefault("secure-cookie", defaults.secureCookie()))
        );
    }

    /** Schema names end up in SQL text, so anything but {@code [A-Za-z0-9_]+} falls back to public. */
    static String safeSchema(String schema) {
        return schema != null && SAFE_SCHEMA.matcher(schema).matches() ? schema : "public";
    }

    private static String envOrDefault(Function<String, String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
