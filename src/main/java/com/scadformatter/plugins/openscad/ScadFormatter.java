package com.scadformatter.plugins.openscad;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.scadformatter.api.FormatOptions;
import com.scadformatter.api.FormatterResult;
import com.scadformatter.api.error.FormatterError;
import com.scadformatter.api.error.Severity;
import com.scadformatter.core.doc.Doc;
import com.scadformatter.core.doc.DocRenderer;
import com.scadformatter.plugins.openscad.printer.ScadPrinter;
import com.scadformatter.plugins.openscad.syntax.ScadParseException;
import com.scadformatter.plugins.openscad.syntax.SyntaxProblem;
import com.scadformatter.plugins.openscad.syntax.SyntaxProvider;
import com.scadformatter.plugins.openscad.syntax.SyntaxTree;
import com.scadformatter.util.LoggerUtil;

/**
 * Formats OpenSCAD source: parse, build the layout document, render.
 *
 * <p>Formatting fails open. Whenever the source cannot be formatted safely the
 * original text comes back unchanged, and no exception escapes.
 * Instances hold no mutable state and may be shared between threads.
 */
public class ScadFormatter {
    private static final Logger logger = LoggerUtil.getLogger(ScadFormatter.class);

    private final SyntaxProvider syntaxProvider;
    private final ScadPrinter printer = new ScadPrinter();

    public ScadFormatter(SyntaxProvider syntaxProvider) {
        this.syntaxProvider = syntaxProvider;
    }

    public String format(String source) {
        return format(source, FormatOptions.defaults());
    }

    /**
     * Returns the formatted source, or {@code source} itself when it cannot be
     * formatted.
     */
    public String format(String source, FormatOptions options) {
        return formatDetailed(source, options).getFormattedCode();
    }

    /**
     * Formats and reports why a fail-open happened. The formatted code of an
     * unsuccessful result is always the untouched source.
     */
    public FormatterResult formatDetailed(String source, FormatOptions options) {
        if (source == null) {
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(null)
                    .addError(new FormatterError(Severity.FATAL, "No source text", 1, 1))
                    .build();
        }

        try {
            SyntaxTree tree = syntaxProvider.parse(source);

            if (tree.hasErrors() && !options.isFormatWithSyntaxErrors()) {
                logger.fine("Leaving source unchanged: " + tree.getProblems().size() + " syntax problem(s)");
                FormatterResult.Builder result = FormatterResult.builder()
                        .successful(false)
                        .formattedCode(source);
                for (SyntaxProblem problem : tree.getProblems()) {
                    result.addError(new FormatterError(Severity.ERROR, problem.getMessage(),
                            problem.getLine() + 1, problem.getColumn() + 1,
                            "Fix the syntax error or enable formatWithSyntaxErrors"));
                }
                return result.build();
            }

            Doc doc = printer.print(tree);
            String formatted = new DocRenderer(options).render(doc);
            return FormatterResult.builder()
                    .successful(true)
                    .formattedCode(formatted)
                    .build();
        } catch (ScadParseException e) {
            logger.fine("Could not tokenize source: " + e.getMessage());
            return failOpen(source, new FormatterError(Severity.FATAL, e.getMessage(),
                    e.getLine() + 1, e.getColumn() + 1));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error while formatting", e);
            return failOpen(source, new FormatterError(Severity.FATAL,
                    "Unexpected error: " + e.getMessage(), 1, 1));
        } catch (StackOverflowError e) {
            logger.log(Level.SEVERE, "Source nests too deeply to format", e);
            return failOpen(source, new FormatterError(Severity.FATAL,
                    "Source nests too deeply to format", 1, 1));
        }
    }

    private static FormatterResult failOpen(String source, FormatterError error) {
        return FormatterResult.builder()
                .successful(false)
                .formattedCode(source)
                .addError(error)
                .build();
    }
}
