package org.dxworks.syntaxview.inspect;

import java.util.Objects;

/**
 * One row of the property table of a selected syntax element.
 */
public final class PropertyEntry {
    private final String name;
    private final String formattedValue;
    private final boolean error;

    public PropertyEntry(String name, String formattedValue, boolean error) {
        this.name = Objects.requireNonNull(name, "name");
        this.formattedValue = formattedValue;
        this.error = error;
    }

    public static PropertyEntry value(String name, String formattedValue) {
        return new PropertyEntry(name, formattedValue, false);
    }

    public static PropertyEntry error(String name, Throwable failure) {
        String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return new PropertyEntry(name, "Error: " + message, true);
    }

    public static PropertyEntry error(String name, String message) {
        return new PropertyEntry(name, "Error: " + message, true);
    }

    public String getName() {
        return name;
    }

    public String getFormattedValue() {
        return formattedValue;
    }

    public boolean isError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyEntry)) return false;
        PropertyEntry other = (PropertyEntry) o;
        return error == other.error
                && name.equals(other.name)
                && Objects.equals(formattedValue, other.formattedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, formattedValue, error);
    }

    @Override
    public String toString() {
        return name + " = " + formattedValue + (error ? " (error)" : "");
    }
}
