package com.quillkv.store;

/**
 * Which tables carry the {@code user_id} owner column. Detected once and never recomputed.
 */
public record SchemaCapabilities(boolean appDataOwnerColumn, boolean auditOwnerColumn) {

    public static SchemaCapabilities none() {
        return new SchemaCapabilities(false, false);
    }
}
