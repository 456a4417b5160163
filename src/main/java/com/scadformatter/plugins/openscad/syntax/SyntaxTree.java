package com.scadformatter.plugins.openscad.syntax;

import java.util.List;

/**
 * Result of parsing one source text: the {@code source_file} root plus any
 * recoverable problems found on the way.
 */
public final class SyntaxTree {
    private final SyntaxNode root;
    private final String source;
    private final List<SyntaxProblem> problems;

    public SyntaxTree(SyntaxNode root, String source, List<SyntaxProblem> problems) {
        this.root = root;
        this.source = source;
        this.problems = List.copyOf(problems);
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public String getSource() {
        return source;
    }

    public List<SyntaxProblem> getProblems() {
        return problems;
    }

    public boolean hasErrors() {
        return !problems.isEmpty();
    }
}
