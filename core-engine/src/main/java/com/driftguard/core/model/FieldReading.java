package com.driftguard.core.model;

import java.util.Objects;

/**
 * Outcome of reading a numeric input field from a {@link TelemetryRecord}.
 *
 * <p>
 * A reading is either {@link Status#PRESENT} with a value, {@link Status#MISSING}
 * when the record does not carry the field, or {@link Status#INVALID} when the
 * raw value cannot be read as a number. Stages use the status to decide which
 * fields to write instead of relying on exceptions.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldReading {

    /** Reading status. */
    public enum Status {
        PRESENT,
        MISSING,
        INVALID
    }

    private final String fieldName;
    private final Status status;
    private final double value;
    private final Object raw;

    private FieldReading(String fieldName, Status status, double value, Object raw) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName must not be null");
        this.status = status;
        this.value = value;
        this.raw = raw;
    }

    public static FieldReading present(String fieldName, double value) {
        return new FieldReading(fieldName, Status.PRESENT, value, value);
    }

    public static FieldReading missing(String fieldName) {
        return new FieldReading(fieldName, Status.MISSING, Double.NaN, null);
    }

    public static FieldReading invalid(String fieldName, Object raw) {
        return new FieldReading(fieldName, Status.INVALID, Double.NaN, raw);
    }

    public String getFieldName() {
        return fieldName;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isPresent() {
        return status == Status.PRESENT;
    }

    /**
     * @return the numeric value
     * @throws IllegalStateException if the reading is not {@link Status#PRESENT}
     */
    public double getValue() {
        if (status != Status.PRESENT) {
            throw new IllegalStateException("Field '" + fieldName + "' has no numeric value: " + status);
        }
        return value;
    }

    public Object getRaw() {
        return raw;
    }

    /**
     * Describe why the reading has no value, in the wording used for record
     * error annotations.
     *
     * @return the description, or {@code null} for a present reading
     */
    public String describeProblem() {
        return switch (status) {
            case PRESENT -> null;
            case MISSING -> "Missing metric field: " + fieldName;
            case INVALID -> "Invalid numeric value for " + fieldName + ": " + raw;
        };
    }

    @Override
    public String toString() {
        return "FieldReading{" +
                "fieldName='" + fieldName + '\'' +
                ", status=" + status +
                ", raw=" + raw +
                '}';
    }
}
