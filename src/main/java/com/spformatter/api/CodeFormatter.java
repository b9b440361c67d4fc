package com.spformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * The main formatter interface that batch front ends use.
 */
public interface CodeFormatter {
    FormatterResult formatFile(Path filePath, String sourceCode);
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
