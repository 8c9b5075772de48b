package com.quillkv.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this.registry = new SimpleMeterRegistry();
    }

    public MeterRegistry registry() { return registry; }

    public Counter loginSuccess() {
        return Counter.builder("quillkv.auth.logins").tag("outcome", "success").register(registry);
    }

    public Counter loginFailure() {
        return Counter.builder("quillkv.auth.logins").tag("outcome", "failure").register(registry);
    }

    public Counter postsSaved() {
        return Counter.builder("quillkv.posts.saved").register(registry);
    }

    public Counter postsDeleted() {
        return Counter.builder("quillkv.posts.deleted").register(registry);
    }
}
