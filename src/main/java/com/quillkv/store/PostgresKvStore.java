package com.quillkv.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link KvStore} over the {@code app_data} table. When the table has a {@code user_id} column every
 * statement is scoped to {@link StoreContext#ownerId()}, otherwise statements run unscoped.
 */
public class PostgresKvStore implements KvStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int PUT_IF_ABSENT_ATTEMPTS = 3;

    private final StoreContext context;
    private final boolean scoped;
    private final String upsertSql;
    private final String insertIfAbsentSql;
    private final String selectSql;
    private final String deleteSql;
    // Byte order, so listing matches plain String ordering whatever the database collation.
    private final String listSql;

    public PostgresKvStore(StoreContext context) {
        this.context = context;
        this.scoped = context.capabilities().appDataOwnerColumn();
        if (scoped) {
            upsertSql = "INSERT INTO app_data (key, value, user_id) VALUES (?, ?::jsonb, ?) "
                    + "ON CONFLICT (key, user_id) DO UPDATE SET value = EXCLUDED.value, updated_at = NOW()";
            insertIfAbsentSql = "INSERT INTO app_data (key, value, user_id) VALUES (?, ?::jsonb, ?) "
                    + "ON CONFLICT (key, user_id) DO NOTHING";
            selectSql = "SELECT value FROM app_data WHERE key = ? AND user_id = ?";
            deleteSql = "DELETE FROM app_data WHERE key = ? AND user_id = ?";
            listSql = "SELECT key FROM app_data WHERE key LIKE ? ESCAPE '\\' AND user_id = ? "
                    + "ORDER BY key COLLATE \"C\" DESC";
        } else {
            upsertSql = "INSERT INTO app_data (key, value) VALUES (?, ?::jsonb) "
                    + "ON CONFLICT (key) DO UPDATE SET value = EXCLUDED.value, updated_at = NOW()";
            insertIfAbsentSql = "INSERT INTO app_data (key, value) VALUES (?, ?::jsonb) ON CONFLICT (key) DO NOTHING";
            selectSql = "SELECT value FROM app_data WHERE key = ?";
            deleteSql = "DELETE FROM app_data WHERE key = ?";
            listSql = "SELECT key FROM app_data WHERE key LIKE ? ESCAPE '\\' ORDER BY key COLLATE \"C\" DESC";
        }
    }

    @Override
    public void put(String key, JsonNode value) {
        var payload = serialize(key, value);
        try (var conn = context.dataSource().getConnection();
             var ps = prepare(conn, upsertSql)) {
            ps.setString(1, key);
            ps.setString(2, payload);
            if (scoped) ps.setString(3, context.ownerId());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.translate("Failed to save key: " + key, e);
        }
    }

    @Override
    public JsonNode putIfAbsent(String key, JsonNode value) {
        var payload = serialize(key, value);
        try (var conn = context.dataSource().getConnection()) {
            for (int attempt = 0; attempt < PUT_IF_ABSENT_ATTEMPTS; attempt++) {
                if (insertIfAbsent(conn, key, payload) == 1) {
                    return value;
                }
                // Lost the race; the winner's row is visible to the next statement.
                var existing = select(conn, key);
                if (existing.isPresent()) {
                    return existing.get();
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("Failed to create key: " + key, e);
        }
        throw new BackendException("Key was deleted concurrently while being created: " + key, null);
    }

    @Override
    public Optional<JsonNode> get(String key) {
        try (var conn = context.dataSource().getConnection()) {
            return select(conn, key);
        } catch (SQLException e) {
            throw SqlErrors.translate("Failed to load key: " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try (var conn = context.dataSource().getConnection();
             var ps = prepare(conn, deleteSql)) {
            ps.setString(1, key);
            if (scoped) ps.setString(2, context.ownerId());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.translate("Failed to delete key: " + key, e);
        }
    }

    @Override
    public List<String> listKeysWithPrefix(String prefix) {
        try (var conn = context.dataSource().getConnection();
             var ps = prepare(conn, listSql)) {
            ps.setString(1, likePrefix(prefix));
            if (scoped) ps.setString(2, context.ownerId());
            try (var rs = ps.executeQuery()) {
                var keys = new ArrayList<String>();
                while (rs.next()) {
                    keys.add(rs.getString("key"));
                }
                return keys;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("Failed to list keys with prefix: " + prefix, e);
        }
    }

    /** Escapes LIKE metacharacters so the prefix only ever matches itself. */
    static String likePrefix(String prefix) {
        var sb = new StringBuilder(prefix.length() + 1);
        for (int i = 0; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            if (c == '\\' || c == '%' || c == '_') sb.append('\\');
            sb.append(c);
        }
        return sb.append('%').toString();
    }

    private int insertIfAbsent(Connection conn, String key, String payload) throws SQLException {
        try (var ps = prepare(conn, insertIfAbsentSql)) {
            ps.setString(1, key);
            ps.setString(2, payload);
            if (scoped) ps.setString(3, context.ownerId());
            return ps.executeUpdate();
        }
    }

    private Optional<JsonNode> select(Connection conn, String key) throws SQLException {
        try (var ps = prepare(conn, selectSql)) {
            ps.setString(1, key);
            if (scoped) ps.setString(2, context.ownerId());
            try (var rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                var raw = rs.getString("value");
                return Optional.of(raw == null ? MAPPER.nullNode() : MAPPER.readTree(raw));
            }
        } catch (JsonProcessingException e) {
            throw new BackendException("Stored value is not valid JSON: " + key, e);
        }
    }

    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        var ps = conn.prepareStatement(sql);
        if (context.queryTimeoutSeconds() > 0) {
            ps.setQueryTimeout(context.queryTimeoutSeconds());
        }
        return ps;
    }

    private static String serialize(String key, JsonNode value) {
        try {
            return MAPPER.writeValueAsString(value == null ? MAPPER.nullNode() : value);
        } catch (JsonProcessingException e) {
            throw new BackendException("Failed to serialize value for key: " + key, e);
        }
    }
}
