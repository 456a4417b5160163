package com.scadformatter.plugins.openscad.syntax;

import java.util.List;
import java.util.logging.Logger;

import com.scadformatter.util.LoggerUtil;

/**
 * The built-in OpenSCAD lexer and recursive-descent parser.
 */
public final class ScadSyntaxProvider implements SyntaxProvider {
    private static final Logger logger = LoggerUtil.getLogger(ScadSyntaxProvider.class);

    private static final ScadSyntaxProvider INSTANCE = new ScadSyntaxProvider();

    private ScadSyntaxProvider() {
    }

    /**
     * Returns the process-wide provider handle. There is no per-call setup; the
     * handle is immutable and may be used from any thread.
     */
    public static SyntaxProvider init() {
        return INSTANCE;
    }

    @Override
    public SyntaxTree parse(String source) throws ScadParseException {
        List<Token> tokens = new ScadLexer(source).tokenize();
        SyntaxTree tree = new ScadParser(source, tokens).parse();
        if (tree.hasErrors()) {
            logger.fine("Parsed with " + tree.getProblems().size() + " syntax problem(s)");
        }
        return tree;
    }
}
