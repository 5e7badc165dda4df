package org.dxworks.syntaxview.inspect;

import org.dxworks.syntaxview.model.SyntaxElement;
import org.dxworks.syntaxview.model.SyntaxProperty;
import org.dxworks.syntaxview.model.Trivia;
import org.dxworks.syntaxview.model.TriviaList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Builds the property table of a single syntax element from the property schema of its variant.
 * <p>
 * Inspection never throws: a property whose value or string form cannot be computed becomes an
 * error entry and the remaining properties are still inspected.
 */
public class PropertyInspector {

    public static final String TO_STRING_ENTRY = "ToString()";

    public static final int DEFAULT_TRIVIA_PREVIEW_COUNT = 3;
    public static final int DEFAULT_TRIVIA_PREVIEW_MAX_LENGTH = 30;
    public static final int DEFAULT_TO_STRING_MAX_LENGTH = 50;

    // RawKind duplicates the symbolic kind shown in the tree label
    private static final Set<String> SKIPPED_PROPERTIES = Set.of("Item", "RawKind");

    private final int triviaPreviewCount;
    private final int triviaPreviewMaxLength;
    private final int toStringMaxLength;

    public PropertyInspector() {
        this(DEFAULT_TRIVIA_PREVIEW_COUNT, DEFAULT_TRIVIA_PREVIEW_MAX_LENGTH, DEFAULT_TO_STRING_MAX_LENGTH);
    }

    public PropertyInspector(int triviaPreviewCount, int triviaPreviewMaxLength, int toStringMaxLength) {
        this.triviaPreviewCount = triviaPreviewCount;
        this.triviaPreviewMaxLength = triviaPreviewMaxLength;
        this.toStringMaxLength = toStringMaxLength;
    }

    public List<PropertyEntry> inspect(SyntaxElement element, int maxLength) {
        List<PropertyEntry> entries = new ArrayList<>();
        if (element == null) {
            entries.add(PropertyEntry.error(TO_STRING_ENTRY, "no element selected"));
            return entries;
        }

        for (SyntaxProperty property : schemaOf(element, entries)) {
            if (property.isIndexed() || SKIPPED_PROPERTIES.contains(property.getName())) {
                continue;
            }
            try {
                Object value = property.read(element);
                entries.add(PropertyEntry.value(property.getName(), format(value, maxLength)));
            } catch (RuntimeException | StackOverflowError | LinkageError e) {
                entries.add(PropertyEntry.error(property.getName(), e));
            }
        }

        try {
            String text = element.toString();
            entries.add(PropertyEntry.value(TO_STRING_ENTRY,
                    text == null ? "null" : TextTruncation.truncate(text, toStringMaxLength)));
        } catch (RuntimeException | StackOverflowError | LinkageError e) {
            entries.add(PropertyEntry.error(TO_STRING_ENTRY, e));
        }

        return entries;
    }

    private static Iterable<SyntaxProperty> schemaOf(SyntaxElement element, List<PropertyEntry> entries) {
        try {
            Iterable<SyntaxProperty> schema = element.getPropertySchema();
            return schema != null ? schema : List.of();
        } catch (RuntimeException | StackOverflowError | LinkageError e) {
            entries.add(PropertyEntry.error("PropertySchema", e));
            return List.of();
        }
    }

    String format(Object value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String text;
        if (value instanceof TriviaList) {
            // clipped to its first line once the previews exceed maxLength
            text = formatTriviaList((TriviaList) value);
        } else if (value instanceof SyntaxElement && !((SyntaxElement) value).isToken()) {
            SyntaxElement node = (SyntaxElement) value;
            text = node.getKind() + " (" + node.getTypeName() + ")";
        } else if (value instanceof Collection) {
            text = "Count: " + ((Collection<?>) value).size() + " (" + typeName(value) + ")";
        } else if (isPrimitive(value)) {
            text = String.valueOf(value);
        } else {
            text = value + " (" + typeName(value) + ")";
        }
        return TextTruncation.truncate(text, maxLength);
    }

    private String formatTriviaList(TriviaList triviaList) {
        StringBuilder sb = new StringBuilder("Count: ").append(triviaList.size());
        int previews = Math.min(triviaList.size(), triviaPreviewCount);
        for (int i = 0; i < previews; i++) {
            Trivia trivia = triviaList.get(i);
            sb.append("\n  [").append(i).append("] ")
              .append(trivia.getKind())
              .append(": \"")
              .append(TextTruncation.truncate(trivia.getText(), triviaPreviewMaxLength))
              .append('"');
        }
        return sb.toString();
    }

    private static boolean isPrimitive(Object value) {
        return value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof CharSequence;
    }

    private static String typeName(Object value) {
        String simpleName = value.getClass().getSimpleName();
        return simpleName.isEmpty() ? value.getClass().getName() : simpleName;
    }
}
