package com.scadformatter.api.error;

public enum Severity {
    FATAL,   // Lexical errors or internal failures preventing formatting
    ERROR,   // Syntax errors; the file is left untouched
    WARNING, // Statements that could only be emitted verbatim
    INFO     // Informational messages about formatting
}
