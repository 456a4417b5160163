package com.scadformatter.api;

import com.scadformatter.config.FormatterConfig;

/**
 * Layout options for a single format call.
 */
public class FormatOptions {
    public static final int DEFAULT_INDENT_SIZE = 4;
    public static final int DEFAULT_PRINT_WIDTH = 80;

    private static final FormatOptions DEFAULTS = builder().build();

    private final int indentSize;
    private final boolean useTabs;
    private final int printWidth;
    private final boolean formatWithSyntaxErrors;

    private FormatOptions(Builder builder) {
        this.indentSize = builder.indentSize;
        this.useTabs = builder.useTabs;
        this.printWidth = builder.printWidth;
        this.formatWithSyntaxErrors = builder.formatWithSyntaxErrors;
    }

    public static FormatOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the general layout keys and the openscad plugin section of a
     * loaded configuration.
     */
    public static FormatOptions fromConfig(FormatterConfig config) {
        return builder()
                .indentSize(config.getGeneralConfig("indentSize", DEFAULT_INDENT_SIZE))
                .useTabs(config.getGeneralConfig("useTabs", false))
                .printWidth(config.getGeneralConfig("printWidth", DEFAULT_PRINT_WIDTH))
                .formatWithSyntaxErrors(config.getPluginConfig("openscad", "formatWithSyntaxErrors", false))
                .build();
    }

    /** Spaces per indent level; ignored for output when {@link #isUseTabs()} is set. */
    public int getIndentSize() {
        return indentSize;
    }

    public boolean isUseTabs() {
        return useTabs;
    }

    /** Column budget used by the layout engine's fits check. */
    public int getPrintWidth() {
        return printWidth;
    }

    /**
     * When set, a source with recoverable syntax errors is still formatted and
     * the broken statements are emitted as written.
     */
    public boolean isFormatWithSyntaxErrors() {
        return formatWithSyntaxErrors;
    }

    public Builder toBuilder() {
        return builder()
                .indentSize(indentSize)
                .useTabs(useTabs)
                .printWidth(printWidth)
                .formatWithSyntaxErrors(formatWithSyntaxErrors);
    }

    @Override
    public String toString() {
        return "FormatOptions{indentSize=" + indentSize + ", useTabs=" + useTabs
                + ", printWidth=" + printWidth + ", formatWithSyntaxErrors=" + formatWithSyntaxErrors + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int indentSize = DEFAULT_INDENT_SIZE;
        private boolean useTabs;
        private int printWidth = DEFAULT_PRINT_WIDTH;
        private boolean formatWithSyntaxErrors;

        public Builder indentSize(int indentSize) {
            this.indentSize = indentSize;
            return this;
        }

        public Builder useTabs(boolean useTabs) {
            this.useTabs = useTabs;
            return this;
        }

        public Builder printWidth(int printWidth) {
            this.printWidth = printWidth;
            return this;
        }

        public Builder formatWithSyntaxErrors(boolean formatWithSyntaxErrors) {
            this.formatWithSyntaxErrors = formatWithSyntaxErrors;
            return this;
        }

        public FormatOptions build() {
            if (indentSize <= 0) {
                throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
            }
            if (printWidth <= 0) {
                throw new IllegalArgumentException("printWidth must be positive: " + printWidth);
            }
            return new FormatOptions(this);
        }
    }
}
