package com.ragingest.source;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

public final class SourceFiles {
    public static final List<String> SUPPORTED_EXTENSIONS = List.of(
            ".txt", ".md", ".markdown", ".html", ".htm", ".json", ".yaml", ".yml", ".rst", ".csv", ".xml");

    private SourceFiles() {
    }

    public static String extensionOf(String name) {
        if (name == null) {
            return "";
        }
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        String fileName = name.substring(slash + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    public static boolean isSupported(String name, List<String> extensions) {
        String extension = extensionOf(name);
        return !extension.isEmpty() && extensions.contains(extension);
    }

    public static String fileNameOf(String name) {
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return name.substring(slash + 1);
    }

    static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
