package com.quillkv.gateway.http;

import org.springframework.http.ResponseCookie;

import java.time.Duration;

final class SessionCookies {

    static final String NAME = "auth";

    private SessionCookies() {}

    static ResponseCookie issue(String token, Duration ttl, boolean secure) {
        return base(token, secure).maxAge(ttl).build();
    }

    /** Same name and attributes with an empty value and immediate expiry. */
    static ResponseCookie clear(boolean secure) {
        return base("", secure).maxAge(Duration.ZERO).build();
    }

    private static ResponseCookie.ResponseCookieBuilder base(String value, boolean secure) {
        return ResponseCookie.from(NAME, value)
                .httpOnly(true)
                .secure(secure)
                .path("/")
                .sameSite("Lax");
    }
}
