package net.vcc.util;

import java.util.AbstractMap;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.vcc.api.NamedValue;

/**
 * A map from names to values carrying those names.
 * Iteration follows insertion order. Every key must equal the name of
 * the value it maps to.
 */
public class NamedMap<V extends NamedValue> extends AbstractMap<String, V> {

    private final Map<String, V> data;

    public NamedMap(Map<String, V> data) {
        this.data = data;
        validateBackingMap(data);
    }
    public NamedMap() {
        this(new LinkedHashMap<String, V>());
    }

    protected void validateBackingMap(Map<String, V> map) {
        for (Map.Entry<String, V> ent : map.entrySet()) {
            // Intentionally permitting NPE-s.
            if (! ent.getKey().equals(ent.getValue().getName()))
                throw new IllegalArgumentException(
                    "Invalid pair in NamedMap backing data");
        }
    }

    public Set<String> keySet() {
        return Collections.unmodifiableSet(data.keySet());
    }

    public Collection<V> values() {
        return Collections.unmodifiableCollection(data.values());
    }

    public Set<Entry<String, V>> entrySet() {
        return Collections.unmodifiableMap(data).entrySet();
    }

    public int size() {
        return data.size();
    }

    public boolean containsKey(Object key) {
        return data.containsKey(key);
    }

    public boolean containsValue(Object value) {
        if (! (value instanceof NamedValue)) return false;
        String key = getNameOf((NamedValue) value);
        return containsKey(key) && value.equals(get(key));
    }

    public V get(Object key) {
        return data.get(key);
    }

    public V put(String key, V value) {
        // Intentionally permitting NPE-s.
        if (! key.equals(value.getName()))
            throw new IllegalArgumentException("Cannot insert pair " + key +
                ":" + value + " into NamedMap");
        return data.put(key, value);
    }

    /**
     * Insert value under its own name, unless the name is taken.
     * Returns whether the value was inserted.
     */
    public boolean add(V value) {
        String key = getNameOf(value);
        if (data.containsKey(key)) return false;
        data.put(key, value);
        return true;
    }

    public V remove(Object key) {
        return data.remove(key);
    }

    /**
     * Remove value if it is the one stored under its name.
     */
    public boolean removeValue(V value) {
        String key = getNameOf(value);
        if (data.get(key) != value) return false;
        data.remove(key);
        return true;
    }

    public void clear() {
        data.clear();
    }

    private static String getNameOf(NamedValue value) {
        String key = value.getName();
        if (key == null)
            throw new NullPointerException(
                "NamedValue name may not be null");
        return key;
    }

}
