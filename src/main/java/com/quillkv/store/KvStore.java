package com.quillkv.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * String-keyed store of JSON values. Keys are opaque; callers give them structure by convention
 * (e.g. {@code post:<site>:<slug>}) and the store only ever looks at them for prefix matching.
 * <p>
 * Every method may throw {@link BackendUnavailableException} or {@link BackendException}.
 */
public interface KvStore {

    /** Inserts or overwrites the value under {@code key} in a single atomic statement. */
    void put(String key, JsonNode value);

    /**
     * Stores {@code value} only if {@code key} is absent.
     *
     * @return the value held under {@code key} after the call, which is the existing one if another
     *         writer got there first
     */
    JsonNode putIfAbsent(String key, JsonNode value);

    Optional<JsonNode> get(String key);

    /** Removes the key; absent keys are a no-op. */
    void delete(String key);

    /** Keys that start with {@code prefix} (matched literally), in descending key order. */
    List<String> listKeysWithPrefix(String prefix);
}
