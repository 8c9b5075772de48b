package com.quillkv.shared.config;

import java.util.Map;

public record QuillKvConfig(
    int serverPort,
    Map<String, String> database,
    StorageConfig storage,
    AuthConfig auth
) {}
