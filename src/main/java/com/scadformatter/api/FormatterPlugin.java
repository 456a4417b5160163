package com.scadformatter.api;

import java.nio.file.Path;

import com.scadformatter.config.FormatterConfig;

/**
 * Interface for language-specific formatter plugins.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Format the provided source code. Implementations never throw for bad
     * input; a failed run carries the original source and its errors.
     */
    FormatterResult format(Path filePath, String sourceCode);
}
