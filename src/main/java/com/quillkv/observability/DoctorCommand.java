package com.quillkv.observability;

import com.quillkv.auth.SessionTokenService;
import com.quillkv.store.KvStore;
import com.quillkv.store.SchemaCapabilities;

import javax.sql.DataSource;
import java.util.ArrayList;

/**
 * Plain-text health report. Never prints secret material, only whether it exists.
 */
public class DoctorCommand {

    private final DataSource dataSource;
    private final SchemaCapabilities capabilities;
    private final KvStore store;

    /**
     * @param dataSource null when running on the in-memory backend
     */
    public DoctorCommand(DataSource dataSource, SchemaCapabilities capabilities, KvStore store) {
        this.dataSource = dataSource;
        this.capabilities = capabilities;
        this.store = store;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkDatabase());
        results.add(checkCapabilities());
        results.add(checkSessionSecret());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkDatabase() {
        if (dataSource == null) {
            return "[WARN] In-memory storage (data is lost on restart)";
        }
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT 1");
             var rs = ps.executeQuery()) {
            return "[OK] PostgreSQL connection";
        } catch (Exception e) {
            return "[FAIL] PostgreSQL: " + e.getMessage();
        }
    }

    private String checkCapabilities() {
        return "[OK] Owner column: app_data=" + capabilities.appDataOwnerColumn()
                + ", user_logs=" + capabilities.auditOwnerColumn();
    }

    private String checkSessionSecret() {
        try {
            return store.get(SessionTokenService.SECRET_KEY).isPresent()
                    ? "[OK] Session secret present"
                    : "[WARN] Session secret not created yet (created on first login)";
        } catch (Exception e) {
            return "[FAIL] Session secret lookup: " + e.getMessage();
        }
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
