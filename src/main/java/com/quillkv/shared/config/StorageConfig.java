package com.quillkv.shared.config;

public record StorageConfig(
    String backend,
    String ownerId,
    int queryTimeoutSeconds,
    int poolSize
) {
    public static final String POSTGRES = "postgres";
    public static final String MEMORY = "memory";

    public static StorageConfig defaults() {
        return new StorageConfig(POSTGRES, "default", 10, 10);
    }

    public boolean inMemory() {
        return MEMORY.equalsIgnoreCase(backend);
    }
}
