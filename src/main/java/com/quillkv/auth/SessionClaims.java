package com.quillkv.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Payload of a session token. Timestamps are epoch milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionClaims(String sub, long iat, long exp, int ver) {}
