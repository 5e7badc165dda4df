package org.dxworks.syntaxview;

import org.dxworks.syntaxview.inspect.PropertyEntry;
import org.dxworks.syntaxview.parser.ParseResult;
import org.dxworks.syntaxview.parser.SyntaxParser;
import org.dxworks.syntaxview.tree.DisplayNode;
import org.dxworks.syntaxview.tree.MaterializedTree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently displayed parse of a source text.
 * <p>
 * A new snapshot is published only once it is completely built; until then, and whenever parsing
 * fails, the previous snapshot stays current.
 */
public class SyntaxTreeSession {

    private final SyntaxParser parser;
    private final SyntaxTreeViewer viewer;
    private final AtomicReference<SyntaxTreeSnapshot> current = new AtomicReference<>();

    public SyntaxTreeSession(SyntaxParser parser, SyntaxTreeViewer viewer) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.viewer = Objects.requireNonNull(viewer, "viewer");
    }

    public ParseResult load(String sourceText) {
        ParseResult result = parser.parse(sourceText);
        if (!result.isSuccess()) {
            return result;
        }
        MaterializedTree displayTree = viewer.buildDisplayTree(result.getRoot());
        current.set(new SyntaxTreeSnapshot(sourceText, result.getRoot(), displayTree));
        return result;
    }

    public Optional<SyntaxTreeSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    public List<PropertyEntry> select(DisplayNode selected) {
        return viewer.getProperties(selected);
    }

    public SyntaxTreeViewer getViewer() {
        return viewer;
    }
}
