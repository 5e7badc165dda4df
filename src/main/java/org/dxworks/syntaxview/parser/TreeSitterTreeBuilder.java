package org.dxworks.syntaxview.parser;

import org.dxworks.syntaxview.model.SyntaxElement;
import org.dxworks.syntaxview.model.SyntaxNode;
import org.dxworks.syntaxview.model.SyntaxToken;
import org.dxworks.syntaxview.model.TextSpan;
import org.dxworks.syntaxview.model.Trivia;
import org.dxworks.syntaxview.model.TriviaList;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts a Tree-sitter parse tree into {@link SyntaxNode}s and {@link SyntaxToken}s.
 * <p>
 * Tree-sitter nodes without children become tokens, except extras (comments), which become trivia.
 * The source text between tokens is split into whitespace, end-of-line and skipped-text trivia.
 * Trivia up to and including the first line break after a token is that token's trailing trivia,
 * the rest is leading trivia of the next token. A final {@code end_of_file} token carries whatever
 * follows the last token, so the full text of the root equals the source text.
 * <p>
 * All walks use explicit stacks.
 */
final class TreeSitterTreeBuilder {

    static final String END_OF_FILE = "end_of_file";

    private final byte[] source;

    TreeSitterTreeBuilder(String sourceText) {
        this.source = sourceText.getBytes(StandardCharsets.UTF_8);
    }

    SyntaxNode build(TSNode root) {
        List<Leaf> leaves = collectLeaves(root);
        TokenAssembler assembler = new TokenAssembler();
        for (Leaf leaf : leaves) {
            assembler.accept(leaf);
        }
        assembler.finish();
        return buildNodes(root, assembler.tokensByLeaf(leaves.size()), assembler.endOfFile());
    }

    private static List<Leaf> collectLeaves(TSNode root) {
        List<Leaf> leaves = new ArrayList<>();
        Deque<Leaf> stack = new ArrayDeque<>();
        pushChildren(stack, root);
        while (!stack.isEmpty()) {
            Leaf current = stack.pop();
            if (current.node.getChildCount() == 0) {
                leaves.add(current);
            } else {
                pushChildren(stack, current.node);
            }
        }
        return leaves;
    }

    private static void pushChildren(Deque<Leaf> stack, TSNode parent) {
        for (int i = parent.getChildCount() - 1; i >= 0; i--) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull()) {
                stack.push(new Leaf(child, fieldNameForChild(parent, i)));
            }
        }
    }

    private static SyntaxNode buildNodes(TSNode root, SyntaxElement[] tokensByLeaf, SyntaxToken endOfFile) {
        Deque<NodeFrame> stack = new ArrayDeque<>();
        stack.push(new NodeFrame(root, null));
        int leafIndex = 0;

        while (true) {
            NodeFrame frame = stack.peek();
            if (frame.next < frame.node.getChildCount()) {
                int i = frame.next++;
                TSNode child = frame.node.getChild(i);
                if (child == null || child.isNull()) continue;
                if (child.getChildCount() == 0) {
                    // null for comments, which live on as trivia
                    SyntaxElement token = tokensByLeaf[leafIndex++];
                    if (token != null) frame.children.add(token);
                } else {
                    stack.push(new NodeFrame(child, fieldNameForChild(frame.node, i)));
                }
                continue;
            }

            stack.pop();
            if (stack.isEmpty()) {
                frame.children.add(endOfFile);
                return toNode(frame);
            }
            stack.peek().children.add(toNode(frame));
        }
    }

    private static SyntaxNode toNode(NodeFrame frame) {
        TSNode node = frame.node;
        return new TreeSitterNode(node.getSymbol(), node.getType(), frame.children, node.isNamed(),
                node.hasError(), frame.fieldName, point(node.getStartPoint()), point(node.getEndPoint()),
                TextSpan.fromBounds(node.getStartByte(), Math.max(node.getStartByte(), node.getEndByte())));
    }

    private static String fieldNameForChild(TSNode parent, int index) {
        try {
            return parent.getFieldNameForChild(index);
        } catch (RuntimeException e) {
            // slot has no field in this grammar
            return null;
        }
    }

    private static SourcePoint point(TSPoint point) {
        return point == null ? null : new SourcePoint(point.getRow(), point.getColumn());
    }

    private String slice(int startByte, int endByte) {
        if (endByte <= startByte) return "";
        return new String(source, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    private int clamp(int offset) {
        return Math.max(0, Math.min(offset, source.length));
    }

    private final class TokenAssembler {
        private final List<PendingToken> tokens = new ArrayList<>();
        private List<Trivia> leading = new ArrayList<>();
        private PendingToken previous;
        private boolean lineOpen;
        private int cursor;
        private int leafIndex;
        private PendingToken endOfFile;

        void accept(Leaf leaf) {
            int start = Math.max(cursor, clamp(leaf.node.getStartByte()));
            int end = Math.max(start, clamp(leaf.node.getEndByte()));
            consumeGap(start);
            String text = slice(start, end);
            cursor = end;
            int index = leafIndex++;

            if (leaf.node.isExtra()) {
                addTrivia(new Trivia(leaf.node.getType(), text));
                if (text.endsWith("\n") || text.endsWith("\r")) {
                    lineOpen = false;
                }
                return;
            }

            PendingToken token = new PendingToken(index, leaf, text, leading);
            leading = new ArrayList<>();
            tokens.add(token);
            previous = token;
            lineOpen = true;
        }

        void finish() {
            consumeGap(source.length);
            endOfFile = new PendingToken(-1, null, "", leading);
            leading = new ArrayList<>();
            tokens.add(endOfFile);

            int position = 0;
            for (PendingToken token : tokens) {
                token.position = position;
                position += token.fullWidth();
            }
        }

        SyntaxElement[] tokensByLeaf(int leafCount) {
            SyntaxElement[] result = new SyntaxElement[leafCount];
            for (PendingToken token : tokens) {
                if (token.leafIndex >= 0) {
                    result[token.leafIndex] = token.toToken();
                }
            }
            return result;
        }

        SyntaxToken endOfFile() {
            return endOfFile.toToken();
        }

        private void consumeGap(int upTo) {
            if (upTo <= cursor) return;
            for (Trivia piece : TriviaScanner.scan(slice(cursor, upTo))) {
                addTrivia(piece);
                if (TriviaScanner.isEndOfLine(piece)) {
                    lineOpen = false;
                }
            }
            cursor = upTo;
        }

        private void addTrivia(Trivia trivia) {
            if (lineOpen && previous != null) {
                previous.trailing.add(trivia);
            } else {
                leading.add(trivia);
            }
        }
    }

    private static final class PendingToken {
        final int leafIndex;
        final Leaf leaf;
        final String text;
        final List<Trivia> leading;
        final List<Trivia> trailing = new ArrayList<>();
        int position;

        PendingToken(int leafIndex, Leaf leaf, String text, List<Trivia> leading) {
            this.leafIndex = leafIndex;
            this.leaf = leaf;
            this.text = text;
            this.leading = leading;
        }

        int fullWidth() {
            int width = text.length();
            for (Trivia trivia : leading) width += trivia.getText().length();
            for (Trivia trivia : trailing) width += trivia.getText().length();
            return width;
        }

        SyntaxToken toToken() {
            if (leaf == null) {
                return new SyntaxToken(SyntaxNode.UNKNOWN_RAW_KIND, END_OF_FILE, text,
                        TriviaList.of(leading), TriviaList.of(trailing), position, false);
            }
            TSNode node = leaf.node;
            return new TreeSitterToken(node.getSymbol(), node.getType(), text,
                    TriviaList.of(leading), TriviaList.of(trailing), position, node.isMissing(),
                    node.isNamed(), leaf.fieldName, point(node.getStartPoint()), point(node.getEndPoint()),
                    TextSpan.fromBounds(node.getStartByte(), Math.max(node.getStartByte(), node.getEndByte())));
        }
    }

    private static final class Leaf {
        final TSNode node;
        final String fieldName;

        Leaf(TSNode node, String fieldName) {
            this.node = node;
            this.fieldName = fieldName;
        }
    }

    private static final class NodeFrame {
        final TSNode node;
        final String fieldName;
        final List<SyntaxElement> children = new ArrayList<>();
        int next;

        NodeFrame(TSNode node, String fieldName) {
            this.node = node;
            this.fieldName = fieldName;
        }
    }
}
