package com.scadformatter.plugins;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import com.scadformatter.util.LoggerUtil;

/**
 * Supported file types, detected by extension with a bounded cache.
 */
public enum FileType {
    OPENSCAD("scad"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private final String extension;

    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects the file type of a path.
     *
     * @param filePath The path to the file
     * @return The detected FileType, {@link #UNKNOWN} when nothing matches
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

        FileType detectedType = detectByExtension(filePath);
        typeCache.put(filePath, detectedType);
        return detectedType;
    }

    private static FileType detectByExtension(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return UNKNOWN;
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        if (!fileName.contains(".")) {
            return UNKNOWN;
        }

        String fileExtension = fileName.substring(fileName.lastIndexOf('.') + 1);
        return switch (fileExtension) {
            case "scad" -> OPENSCAD;
            default -> UNKNOWN;
        };
    }

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
            case OPENSCAD -> "OpenSCAD source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
