package com.spformatter.api.error;

public enum Severity {
    FATAL,   // Grammar failure or unexpected exception, nothing was formatted
    ERROR,   // Syntax errors that no recovery strategy could format around
    WARNING, // Output was produced from a malformed parse
    INFO     // Syntax errors reported alongside recovered output
}
