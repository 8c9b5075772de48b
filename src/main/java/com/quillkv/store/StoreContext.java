package com.quillkv.store;

import javax.sql.DataSource;

/**
 * Shared by every JDBC-backed component. Built once at startup, after the capability probe.
 *
 * @param ownerId             value written to and filtered on the {@code user_id} column when present
 * @param queryTimeoutSeconds per-statement timeout, 0 for none
 */
public record StoreContext(DataSource dataSource, SchemaCapabilities capabilities,
                           String ownerId, int queryTimeoutSeconds) {

    public static StoreContext create(DataSource dataSource, String ownerId, int queryTimeoutSeconds) {
        var caps = new CapabilityProbe(dataSource).probe();
        return new StoreContext(dataSource, caps, ownerId, queryTimeoutSeconds);
    }
}
