package com.quillkv.audit;

import java.util.Map;

/**
 * Best-effort audit sink. Implementations handle every failure internally; {@link #log} never throws.
 */
public interface EventLog {

    void log(String event, Map<String, ?> details);

    default void log(String event) {
        log(event, Map.of());
    }
}
