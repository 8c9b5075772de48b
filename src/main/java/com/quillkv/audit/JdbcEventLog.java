package com.quillkv.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillkv.store.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/** Appends audit rows to {@code user_logs}. */
public class JdbcEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventLog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final StoreContext context;
    private final String insertSql;

    public JdbcEventLog(StoreContext context) {
        this.context = context;
        this.insertSql = context.capabilities().auditOwnerColumn()
                ? "INSERT INTO user_logs (event, details, user_id) VALUES (?, ?::jsonb, ?)"
                : "INSERT INTO user_logs (event, details) VALUES (?, ?::jsonb)";
    }

    @Override
    public void log(String event, Map<String, ?> details) {
        try (var conn = context.dataSource().getConnection();
             var ps = conn.prepareStatement(insertSql)) {
            if (context.queryTimeoutSeconds() > 0) {
                ps.setQueryTimeout(context.queryTimeoutSeconds());
            }
            ps.setString(1, event);
            ps.setString(2, MAPPER.writeValueAsString(details == null ? Map.of() : details));
            if (context.capabilities().auditOwnerColumn()) {
                ps.setString(3, context.ownerId());
            }
            ps.executeUpdate();
        } catch (Exception e) {
            log.warn("Failed to record audit event {}: {}", event, e.getMessage());
        }
    }
}
