package org.dxworks.syntaxview.render;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import org.dxworks.syntaxview.tree.DisplayNode;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;

/**
 * Streams a display tree as JSON without recursion, so trees as deep as the materializer allows
 * can be written.
 */
public class DisplayTreeJsonWriter {

    private final JsonFactory factory = JsonFactory.builder()
            .streamWriteConstraints(StreamWriteConstraints.builder()
                    .maxNestingDepth(Integer.MAX_VALUE)
                    .build())
            .build();

    private final boolean pretty;

    public DisplayTreeJsonWriter() {
        this(true);
    }

    public DisplayTreeJsonWriter(boolean pretty) {
        this.pretty = pretty;
    }

    public String toJson(DisplayNode root) throws IOException {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            if (pretty) {
                generator.useDefaultPrettyPrinter();
            }
            Deque<Iterator<DisplayNode>> stack = new ArrayDeque<>();
            writeStart(generator, root);
            stack.push(root.getChildren().iterator());
            while (!stack.isEmpty()) {
                Iterator<DisplayNode> children = stack.peek();
                if (children.hasNext()) {
                    DisplayNode child = children.next();
                    writeStart(generator, child);
                    stack.push(child.getChildren().iterator());
                } else {
                    stack.pop();
                    generator.writeEndArray();
                    generator.writeEndObject();
                }
            }
        }
        return out.toString();
    }

    private static void writeStart(JsonGenerator generator, DisplayNode node) throws IOException {
        generator.writeStartObject();
        generator.writeStringField("label", node.getLabel());
        generator.writeStringField("classification", node.getClassification().name().toLowerCase(Locale.ROOT));
        if (node.isPlaceholder()) {
            generator.writeBooleanField("placeholder", true);
        }
        generator.writeArrayFieldStart("children");
    }
}
