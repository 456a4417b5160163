package com.scadformatter.plugins.openscad.syntax;

/**
 * Turns OpenSCAD source into a syntax tree. Implementations are stateless and
 * safe to share between threads.
 */
public interface SyntaxProvider {

    /**
     * Parses a source text.
     *
     * @throws ScadParseException when the text cannot be tokenized at all;
     *         statement-level problems are reported on the returned tree instead
     */
    SyntaxTree parse(String source) throws ScadParseException;
}
