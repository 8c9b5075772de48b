package com.quillkv.shared.config;

import java.time.Duration;

/**
 * The one administrative principal and how its sessions behave. Blank email or password disables
 * seeding at startup.
 */
public record AuthConfig(
    String adminEmail,
    String adminPassword,
    long sessionTtlHours,
    boolean secureCookie
) {
    public static AuthConfig defaults() {
        return new AuthConfig("", "", 24, false);
    }

    public Duration sessionTtl() {
        return Duration.ofHours(sessionTtlHours);
    }

    public boolean seedable() {
        return adminEmail != null && !adminEmail.isBlank()
                && adminPassword != null && !adminPassword.isEmpty();
    }

    @Override
    public String toString() {
        return "AuthConfig[adminEmail=" + adminEmail + ", sessionTtlHours=" + sessionTtlHours
                + ", secureCookie=" + secureCookie + "]";
    }
}
