package com.quillkv.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

public class CapabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(CapabilityProbe.class);

    static final String SQL = """
            SELECT table_name, column_name
            FROM information_schema.columns
            WHERE table_schema = current_schema()
              AND table_name IN ('app_data', 'user_logs')
              AND column_name = 'user_id'
            """;

    private final DataSource dataSource;

    public CapabilityProbe(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /** Never throws: any failure means "no owner column", so no query references a missing column. */
    public SchemaCapabilities probe() {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(SQL);
             var rs = ps.executeQuery()) {
            boolean appData = false;
            boolean audit = false;
            while (rs.next()) {
                var table = rs.getString("table_name");
                if ("app_data".equals(table)) appData = true;
                if ("user_logs".equals(table)) audit = true;
            }
            var caps = new SchemaCapabilities(appData, audit);
            log.info("Schema capabilities: {}", caps);
            return caps;
        } catch (Exception e) {
            log.warn("Schema capability probe failed, running unscoped: {}", e.getMessage());
            return SchemaCapabilities.none();
        }
    }
}
