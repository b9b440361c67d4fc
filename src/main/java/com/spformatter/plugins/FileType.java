package com.spformatter.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.spformatter.util.LoggerUtil;

/**
 * Supported file types, detected by extension and, for files without a known one, by content.
 */
public enum FileType {
    SOURCEPAWN("sp"),
    INCLUDE("inc"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private final String extension;

    // Cache for file type detection
    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;
    private static final int CONTENT_SCAN_BYTES = 4096;

    private static final Pattern PLUGIN_PATTERN = Pattern.compile(
            "(?:#include\\s*<sourcemod>|public\\s+Plugin\\s*(?::\\s*)?myinfo)");

    private static final Pattern INCLUDE_GUARD_PATTERN = Pattern.compile(
            "#if\\s+defined\\s+_\\w+_included");

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects the file type from the extension, falling back to the first bytes of the file.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType typeByExtension = detectByExtension(filePath);
        if (typeByExtension != UNKNOWN) {
            typeCache.put(filePath, typeByExtension);
            return typeByExtension;
        }

        FileType detectedType = detectByContent(filePath);
        typeCache.put(filePath, detectedType);
        return detectedType;
    }

    /**
     * Detect file type by file extension.
     */
    public static FileType detectByExtension(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return UNKNOWN;
        }
        String fileName = name.toString().toLowerCase();
        if (!fileName.contains(".")) {
            return UNKNOWN;
        }

        String extension = fileName.substring(fileName.lastIndexOf('.') + 1);
        return switch (extension) {
            case "sp" -> SOURCEPAWN;
            case "inc" -> INCLUDE;
            default -> UNKNOWN;
        };
    }

    /**
     * Detect file type by reading the start of the file.
     */
    private static FileType detectByContent(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try {
            String content = _readPrefix(filePath);
            if (PLUGIN_PATTERN.matcher(content).find()) {
                return SOURCEPAWN;
            }
            if (INCLUDE_GUARD_PATTERN.matcher(content).find()) {
                return INCLUDE;
            }
            return UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    private static String _readPrefix(Path filePath) throws IOException {
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] bytes = in.readNBytes(CONTENT_SCAN_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    /**
     * Clear the file type detection cache.
     */
    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    /**
     * Get a human-readable description of the file type.
     */
    public String getDescription() {
        return switch (this) {
            case SOURCEPAWN -> "SourcePawn plugin source";
            case INCLUDE -> "SourcePawn include file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
