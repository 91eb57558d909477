package com.tableadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable set of labelled attributes extracted from one response.
 *
 * <p>Absent and blank attributes are indistinguishable: {@link #get(FieldKey)} returns
 * {@code ""} for both, never {@code null}. Only non-blank values are stored.
 */
public record ResponseFields(
    @JsonProperty("values") Map<FieldKey, String> values
) {

    private static final ResponseFields EMPTY = new ResponseFields(Map.of());

    public ResponseFields {
        EnumMap<FieldKey, String> copy = new EnumMap<>(FieldKey.class);
        if (values != null) {
            values.forEach((key, value) -> {
                if (key != null && value != null && !value.isBlank()) {
                    copy.put(key, value.trim());
                }
            });
        }
        values = Collections.unmodifiableMap(copy);
    }

    public static ResponseFields empty() {
        return EMPTY;
    }

    public static ResponseFields of(Map<FieldKey, String> values) {
        return new ResponseFields(values);
    }

    public String get(FieldKey key) {
        return values.getOrDefault(key, "");
    }

    public boolean has(FieldKey key) {
        return values.containsKey(key);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Copy with one attribute replaced; a blank value removes it. */
    public ResponseFields with(FieldKey key, String value) {
        EnumMap<FieldKey, String> copy = new EnumMap<>(FieldKey.class);
        copy.putAll(values);
        if (value == null || value.isBlank()) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new ResponseFields(copy);
    }
}
