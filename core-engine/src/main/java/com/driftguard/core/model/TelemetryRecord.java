package com.driftguard.core.model;

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
 * One LLM-interaction telemetry record.
 *
 * <p>
 * Records arrive as free-form JSON (prompt, response, latency, token count,
 * confidence, model id, ...). They are stored as an ordered {@link Map} so the
 * monitoring stages can read arbitrary input fields and append their own
 * annotation fields without a rigid schema.
 * </p>
 *
 * <p>
 * Annotation is additive: fields are added or overwritten, never removed.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. A record is annotated by
 * exactly one session on one thread.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelemetryRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Every key-value pair of the record, in arrival order. */
    private final Map<String, Object> fields = new LinkedHashMap<>();

    public TelemetryRecord() {
    }

    /**
     * Create a record pre-populated with the given fields.
     *
     * @param initial initial field values; must not be {@code null}
     */
    public TelemetryRecord(Map<String, ?> initial) {
        Objects.requireNonNull(initial, "Initial fields must not be null");
        initial.forEach(this::setField);
    }

    // ---------------------------------------------------------------
    // Jackson dynamic-property support
    // ---------------------------------------------------------------

    /**
     * Set a field value. Called by Jackson for every JSON property and by the
     * annotation stages for every computed field.
     *
     * @param key   the field name; must not be {@code null}
     * @param value the field value
     * @throws NullPointerException if {@code key} is {@code null}
     */
    @JsonAnySetter
    public void setField(String key, Object value) {
        Objects.requireNonNull(key, "Field key must not be null");
        fields.put(key, value);
    }

    /**
     * Return an <strong>unmodifiable</strong> view of all fields.
     *
     * @return unmodifiable map of field names to values
     */
    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    // ---------------------------------------------------------------
    // Field accessors
    // ---------------------------------------------------------------

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    /**
     * Retrieve a field value by name.
     *
     * @param fieldName the field name
     * @return optional containing the value, or empty if absent or {@code null}
     */
    public Optional<Object> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * Read a numeric field, distinguishing an absent field from a value that
     * cannot be interpreted as a number.
     *
     * <p>
     * {@link Number} values are used directly; strings are parsed with
     * {@link Double#parseDouble(String)} after trimming. Booleans and any
     * other type are reported as invalid.
     * </p>
     *
     * @param fieldName the field name
     * @return the typed reading, never {@code null}
     */
    public FieldReading readNumeric(String fieldName) {
        Object raw = fields.get(fieldName);
        if (raw == null) {
            return FieldReading.missing(fieldName);
        }
        if (raw instanceof Number n) {
            return FieldReading.present(fieldName, n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return FieldReading.present(fieldName, Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return FieldReading.invalid(fieldName, raw);
            }
        }
        return FieldReading.invalid(fieldName, raw);
    }

    /**
     * Retrieve a numeric field value, empty when absent or not numeric.
     *
     * @param fieldName the field name
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        FieldReading reading = readNumeric(fieldName);
        return reading.isPresent() ? Optional.of(reading.getValue()) : Optional.empty();
    }

    /**
     * Retrieve a string field value.
     *
     * @param fieldName the field name
     * @return optional containing the string value
     */
    public Optional<String> getStringField(String fieldName) {
        Object raw = fields.get(fieldName);
        return raw == null ? Optional.empty() : Optional.of(raw.toString());
    }

    /**
     * Retrieve a text field, treating absent and {@code null} values as the
     * empty string.
     *
     * @param fieldName the field name; may be {@code null}
     * @return the text, never {@code null}
     */
    public String getText(String fieldName) {
        if (fieldName == null) {
            return "";
        }
        return getStringField(fieldName).orElse("");
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TelemetryRecord that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "TelemetryRecord" + fields;
    }
}
