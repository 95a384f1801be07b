package com.catalog.reconciliation.override;

import java.util.Objects;

/**
 * Replacement value carried by an override, or the explicit "cleared" marker.
 * An override can only blank a field through {@link #cleared()}.
 */
public final class OverrideValue {

    private static final OverrideValue CLEARED = new OverrideValue(null);

    private final Object value;

    private OverrideValue(Object value) {
        this.value = value;
    }

    public static OverrideValue of(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Use OverrideValue.cleared() to blank a field");
        }
        return new OverrideValue(value);
    }

    public static OverrideValue cleared() {
        return CLEARED;
    }

    public boolean isCleared() {
        return this == CLEARED;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OverrideValue that = (OverrideValue) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return isCleared() ? "<cleared>" : String.valueOf(value);
    }
}
