package com.quillkv.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local {@link KvStore}. Values are deep-copied on the way in and out so callers never share
 * a live tree with the store.
 */
public class InMemoryKvStore implements KvStore {

    private final ConcurrentSkipListMap<String, JsonNode> entries = new ConcurrentSkipListMap<>();

    @Override
    public void put(String key, JsonNode value) {
        entries.put(key, copy(value));
    }

    @Override
    public JsonNode putIfAbsent(String key, JsonNode value) {
        var copy = copy(value);
        var existing = entries.putIfAbsent(key, copy);
        return (existing != null ? existing : copy).deepCopy();
    }

    @Override
    public Optional<JsonNode> get(String key) {
        return Optional.ofNullable(entries.get(key)).map(JsonNode::deepCopy);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public List<String> listKeysWithPrefix(String prefix) {
        var keys = new ArrayList<String>();
        // tailMap from the prefix holds every candidate in ascending order; stop at the first miss.
        for (var key : entries.tailMap(prefix, true).keySet()) {
            if (!key.startsWith(prefix)) break;
            keys.add(key);
        }
        Collections.reverse(keys);
        return keys;
    }

    private static JsonNode copy(JsonNode value) {
        return value == null ? NullNode.getInstance() : value.deepCopy();
    }
}
