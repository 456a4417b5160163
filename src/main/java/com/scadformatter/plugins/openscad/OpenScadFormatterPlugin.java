package com.scadformatter.plugins.openscad;

import java.nio.file.Path;
import java.util.logging.Logger;

import com.scadformatter.api.FormatOptions;
import com.scadformatter.api.FormatterPlugin;
import com.scadformatter.api.FormatterResult;
import com.scadformatter.config.FormatterConfig;
import com.scadformatter.plugins.openscad.syntax.ScadSyntaxProvider;
import com.scadformatter.util.LoggerUtil;

/**
 * Formatter plugin for {@code .scad} files.
 */
public class OpenScadFormatterPlugin implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(OpenScadFormatterPlugin.class);

    private FormatOptions options = FormatOptions.defaults();
    private ScadFormatter formatter;

    @Override
    public void initialize(FormatterConfig config) {
        this.options = FormatOptions.fromConfig(config);
        this.formatter = new ScadFormatter(ScadSyntaxProvider.init());
        logger.fine("OpenSCAD plugin initialized with " + options);
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        if (formatter == null) {
            throw new IllegalStateException("Plugin used before initialize()");
        }
        return formatter.formatDetailed(sourceCode, options);
    }

    public FormatOptions getOptions() {
        return options;
    }
}
