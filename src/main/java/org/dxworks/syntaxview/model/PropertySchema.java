package org.dxworks.syntaxview.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of the properties a syntax element variant exposes.
 * <p>
 * A variant that extends another one builds its schema with {@link #extend(PropertySchema)};
 * inherited properties keep their position and a redeclared name replaces the inherited accessor.
 */
public final class PropertySchema implements Iterable<SyntaxProperty> {
    private final List<SyntaxProperty> properties;

    private PropertySchema(List<SyntaxProperty> properties) {
        this.properties = Collections.unmodifiableList(properties);
    }

    public static Builder builder() {
        return new Builder(null);
    }

    public static Builder extend(PropertySchema parent) {
        return new Builder(parent);
    }

    public List<SyntaxProperty> getProperties() {
        return properties;
    }

    public int size() {
        return properties.size();
    }

    @Override
    public Iterator<SyntaxProperty> iterator() {
        return properties.iterator();
    }

    public static final class Builder {
        private final Map<String, SyntaxProperty> byName = new LinkedHashMap<>();

        private Builder(PropertySchema parent) {
            if (parent != null) {
                for (SyntaxProperty property : parent) {
                    byName.put(property.getName(), property);
                }
            }
        }

        public Builder add(SyntaxProperty property) {
            byName.put(property.getName(), property);
            return this;
        }

        public PropertySchema build() {
            return new PropertySchema(new ArrayList<>(byName.values()));
        }
    }
}
