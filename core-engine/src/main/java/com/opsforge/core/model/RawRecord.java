package com.opsforge.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loosely-typed alert or metric record as delivered by the ingestion layer.
 *
 * <p>
 * Ingestion hands records over as dictionaries. This class stores them as a
 * {@link Map} so that {@link RecordParser} can validate and convert them into
 * {@link AlertRecord} or {@link MetricPoint} without the ingestion side having
 * to know the typed model.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe while being populated. Once
 * handed to the parser it is only read.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public RawRecord() {
    }

    /**
     * Copy every entry of {@code source} into a new record.
     *
     * @param source key/value pairs; must not be {@code null}
     * @return a new record
     */
    public static RawRecord of(Map<String, ?> source) {
        Objects.requireNonNull(source, "Source map must not be null");
        RawRecord record = new RawRecord();
        source.forEach(record::setField);
        return record;
    }

    /**
     * Set a field value. Called by Jackson for every JSON property.
     *
     * @param key   the field name; must not be {@code null}
     * @param value the value
     * @throws NullPointerException if {@code key} is {@code null}
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * @return unmodifiable map of field names to values
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Retrieve the first present value among several alias field names.
     *
     * @param fieldNames candidate names in order of preference
     * @return the first non-null value, or empty
     */
    public Optional<Object> getFirstField(String... fieldNames) {
        for (String name : fieldNames) {
            Object value = fields.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Retrieve a numeric field value, coercing common JSON number types.
     *
     * <p>
     * Handles {@link Number} subclasses natively and attempts
     * {@link Double#parseDouble(String)} for string-encoded numbers.
     * </p>
     *
     * @param fieldName the field name
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawRecord that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "RawRecord" + fields;
    }
}
