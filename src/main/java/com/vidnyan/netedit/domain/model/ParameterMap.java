package com.vidnyan.netedit.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered parameters of a component. Keys keep the spelling they were
 * written with and are looked up ignoring case. Values are {@link Long},
 * {@link Double} or {@link String}; a bare flag has an empty string value.
 */
public class ParameterMap {

    public record Parameter(String name, Object value) {
    }

    private final LinkedHashMap<String, Parameter> parameters = new LinkedHashMap<>();

    public Optional<Object> get(String name) {
        Parameter p = parameters.get(key(name));
        return p == null ? Optional.empty() : Optional.of(p.value());
    }

    public boolean contains(String name) {
        return parameters.containsKey(key(name));
    }

    /**
     * Sets a value, keeping the original spelling and position of an existing key.
     */
    public void put(String name, Object value) {
        String key = key(name);
        Parameter existing = parameters.get(key);
        parameters.put(key, new Parameter(existing == null ? name : existing.name(), value));
    }

    public void remove(String name) {
        parameters.remove(key(name));
    }

    public List<Parameter> list() {
        return new ArrayList<>(parameters.values());
    }

    /**
     * Copy keyed by the written spelling, in line order.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        parameters.values().forEach(p -> map.put(p.name(), p.value()));
        return map;
    }

    public int size() {
        return parameters.size();
    }

    public boolean isEmpty() {
        return parameters.isEmpty();
    }

    public ParameterMap copy() {
        ParameterMap copy = new ParameterMap();
        copy.parameters.putAll(parameters);
        return copy;
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
