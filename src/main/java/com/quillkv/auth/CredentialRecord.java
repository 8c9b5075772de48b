package com.quillkv.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stored form of the administrative principal's password hash. Salt and hash are hex encoded.
 */
public record CredentialRecord(
    String email,
    String algo,
    int iterations,
    String salt,
    String hash,
    @JsonProperty("created_at") String createdAt
) {}
