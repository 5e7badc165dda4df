package org.dxworks.syntaxview;

import org.dxworks.syntaxview.inspect.PropertyEntry;
import org.dxworks.syntaxview.inspect.PropertyInspector;
import org.dxworks.syntaxview.model.SyntaxElement;
import org.dxworks.syntaxview.tree.DisplayNode;
import org.dxworks.syntaxview.tree.MaterializedTree;
import org.dxworks.syntaxview.tree.TreeMaterializer;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for a presentation layer: builds display trees and the property table of a selection.
 */
public class SyntaxTreeViewer {

    private final SyntaxViewConfig config;
    private final TreeMaterializer materializer;
    private final PropertyInspector inspector;

    public SyntaxTreeViewer() {
        this(SyntaxViewConfig.defaults());
    }

    public SyntaxTreeViewer(SyntaxViewConfig config) {
        this.config = config;
        this.materializer = new TreeMaterializer(config.getMaxDepth());
        this.inspector = new PropertyInspector(config.getTriviaPreviewCount(),
                config.getTriviaPreviewMaxLength(), config.getToStringMaxLength());
    }

    public SyntaxViewConfig getConfig() {
        return config;
    }

    /**
     * Display nodes reach their elements only while the returned tree (or {@code root} itself)
     * is reachable; keep it for as long as properties may be requested.
     */
    public MaterializedTree buildDisplayTree(SyntaxElement root) {
        return materializer.materialize(root);
    }

    public List<PropertyEntry> getProperties(SyntaxElement element) {
        int maxLength = element != null && element.isToken()
                ? config.getTokenPropertyMaxLength()
                : config.getNodePropertyMaxLength();
        return inspector.inspect(element, maxLength);
    }

    public List<PropertyEntry> getProperties(DisplayNode selected) {
        if (selected == null) {
            return List.of(PropertyEntry.error(PropertyInspector.TO_STRING_ENTRY, "no element selected"));
        }
        Optional<SyntaxElement> element = selected.getBackingElement();
        if (element.isEmpty()) {
            return List.of(PropertyEntry.error(PropertyInspector.TO_STRING_ENTRY,
                    "no syntax element behind \"" + selected.getLabel() + "\""));
        }
        return getProperties(element.get());
    }
}
