package com.posh.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Insertion-ordered map with case-insensitive string keys. A key keeps the spelling it
 * was first inserted with; later puts under a different casing overwrite the value only.
 */
public final class PropertyMap<V> {

    private static final class Slot<V> {
        final String key;
        V value;

        Slot(String key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    private final LinkedHashMap<String, Slot<V>> slots = new LinkedHashMap<>();

    public PropertyMap() {}

    public PropertyMap(PropertyMap<V> other) {
        for (Slot<V> s : other.slots.values()) put(s.key, s.value);
    }

    static String fold(String key) {
        return key.toLowerCase(Locale.ROOT);
    }

    public V get(String key) {
        Slot<V> s = slots.get(fold(key));
        return s == null ? null : s.value;
    }

    public boolean containsKey(String key) {
        return slots.containsKey(fold(key));
    }

    public void put(String key, V value) {
        Slot<V> s = slots.get(fold(key));
        if (s != null) {
            s.value = value;
        } else {
            slots.put(fold(key), new Slot<>(key, value));
        }
    }

    public V remove(String key) {
        Slot<V> s = slots.remove(fold(key));
        return s == null ? null : s.value;
    }

    /** Stored spelling of the key, or null when absent. */
    public String originalKey(String key) {
        Slot<V> s = slots.get(fold(key));
        return s == null ? null : s.key;
    }

    public int size() { return slots.size(); }

    public boolean isEmpty() { return slots.isEmpty(); }

    public List<String> keys() {
        List<String> out = new ArrayList<>(slots.size());
        for (Slot<V> s : slots.values()) out.add(s.key);
        return out;
    }

    /** Snapshot in insertion order, keyed by the stored spelling. */
    public Map<String, V> toMap() {
        LinkedHashMap<String, V> out = new LinkedHashMap<>();
        for (Slot<V> s : slots.values()) out.put(s.key, s.value);
        return Collections.unmodifiableMap(out);
    }
}
