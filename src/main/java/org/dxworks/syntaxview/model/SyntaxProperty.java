package org.dxworks.syntaxview.model;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A named, readable property of a syntax element variant.
 * <p>
 * Indexed properties need an index argument and therefore cannot be read as a plain
 * key-value pair; {@link #read(SyntaxElement)} rejects them.
 */
public final class SyntaxProperty {
    private final String name;
    private final boolean indexed;
    private final Function<SyntaxElement, Object> accessor;
    private final BiFunction<SyntaxElement, Integer, Object> indexedAccessor;

    private SyntaxProperty(String name,
                           Function<SyntaxElement, Object> accessor,
                           BiFunction<SyntaxElement, Integer, Object> indexedAccessor) {
        this.name = Objects.requireNonNull(name, "name");
        this.accessor = accessor;
        this.indexedAccessor = indexedAccessor;
        this.indexed = indexedAccessor != null;
    }

    public static <E extends SyntaxElement> SyntaxProperty of(String name, Class<E> owner, Function<? super E, ?> accessor) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(accessor, "accessor");
        return new SyntaxProperty(name, element -> accessor.apply(owner.cast(element)), null);
    }

    public static <E extends SyntaxElement> SyntaxProperty indexed(String name, Class<E> owner, BiFunction<? super E, Integer, ?> accessor) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(accessor, "accessor");
        return new SyntaxProperty(name, null, (element, index) -> accessor.apply(owner.cast(element), index));
    }

    public String getName() {
        return name;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public Object read(SyntaxElement element) {
        if (indexed) {
            throw new IllegalStateException("Property " + name + " requires an index");
        }
        return accessor.apply(element);
    }

    public Object read(SyntaxElement element, int index) {
        if (!indexed) {
            throw new IllegalStateException("Property " + name + " is not indexed");
        }
        return indexedAccessor.apply(element, index);
    }

    @Override
    public String toString() {
        return indexed ? name + "[]" : name;
    }
}
