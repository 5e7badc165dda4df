package org.dxworks.syntaxview.parser;

/**
 * Turns source text into a syntax tree.
 * <p>
 * Implementations report unparseable input through {@link ParseResult#failure(ParseFailure)}
 * instead of throwing. Error-tolerant parsers normally return a best-effort tree.
 */
public interface SyntaxParser {
    ParseResult parse(String sourceText);
}
