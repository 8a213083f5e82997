package com.acme.finops.pluginhost.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Schema-free resource properties with typed accessors.
 *
 * <p>Values are normalized on construction:</p>
 * <ul>
 *   <li>every {@link Number} is stored as {@code double};</li>
 *   <li>nested maps become nested {@code PropertyBag}s;</li>
 *   <li>lists are copied and normalized element-wise;</li>
 *   <li>{@code null} values are dropped.</li>
 * </ul>
 *
 * <p>Accessor coercions: {@link #getString} renders any scalar with {@code String.valueOf}, so {@code 2.0}
 * reads as {@code "2.0"}; {@link #getDouble} accepts numbers and numeric strings; {@link #getBoolean}
 * accepts booleans and the strings {@code "true"}/{@code "false"} in any case. A value of the wrong shape
 * reads as empty, never as an exception.</p>
 */
public final class PropertyBag {
    private static final PropertyBag EMPTY = new PropertyBag(Map.of());

    private final Map<String, Object> values;

    private PropertyBag(Map<String, Object> normalized) {
        this.values = Collections.unmodifiableMap(normalized);
    }

    public static PropertyBag empty() {
        return EMPTY;
    }

    public static PropertyBag of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            Object n = normalize(v);
            if (k != null && n != null) {
                normalized.put(k, n);
            }
        });
        return new PropertyBag(normalized);
    }

    private static Object normalize(Object v) {
        if (v == null) {
            return null;
        }
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof PropertyBag || v instanceof String || v instanceof Boolean) {
            return v;
        }
        if (v instanceof Map<?, ?> m) {
            Map<String, Object> nested = new LinkedHashMap<>();
            m.forEach((k, val) -> nested.put(String.valueOf(k), val));
            return of(nested);
        }
        if (v instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                Object n = normalize(item);
                if (n != null) {
                    copy.add(n);
                }
            }
            return Collections.unmodifiableList(copy);
        }
        return String.valueOf(v);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<String> getString(String key) {
        Object v = values.get(key);
        if (v == null || v instanceof PropertyBag || v instanceof List) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(v));
    }

    public Optional<Double> getDouble(String key) {
        Object v = values.get(key);
        if (v instanceof Double d) {
            return Optional.of(d);
        }
        if (v instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException notNumeric) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<Boolean> getBoolean(String key) {
        Object v = values.get(key);
        if (v instanceof Boolean b) {
            return Optional.of(b);
        }
        if (v instanceof String s) {
            String t = s.trim();
            if (t.equalsIgnoreCase("true")) return Optional.of(Boolean.TRUE);
            if (t.equalsIgnoreCase("false")) return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }

    public Optional<PropertyBag> getBag(String key) {
        Object v = values.get(key);
        return v instanceof PropertyBag bag ? Optional.of(bag) : Optional.empty();
    }

    public List<Object> getList(String key) {
        Object v = values.get(key);
        if (v instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        return List.of();
    }

    /**
     * Read-only view; nested bags stay {@code PropertyBag} instances.
     */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PropertyBag other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
