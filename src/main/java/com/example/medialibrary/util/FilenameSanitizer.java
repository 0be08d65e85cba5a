package com.example.medialibrary.util;

import java.util.regex.Pattern;

public final class FilenameSanitizer {

    private static final Pattern UNSAFE = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");
    private static final Pattern UNSAFE_OR_SPACE = Pattern.compile("[<>:\"/\\\\|?*\\s\\p{Cntrl}]");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");

    private static final int MAX_FILENAME_LENGTH = 200;

    private FilenameSanitizer() {
    }

    /**
     * Makes a file name safe on every common filesystem while keeping its extension.
     */
    public static String sanitizeFilename(String name) {
        String cleaned = UNSAFE.matcher(name).replaceAll("_").trim();
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        if (cleaned.isEmpty()) {
            cleaned = "media";
        }
        if (cleaned.length() > MAX_FILENAME_LENGTH) {
            int dot = cleaned.lastIndexOf('.');
            String extension = dot > 0 && cleaned.length() - dot <= 10 ? cleaned.substring(dot) : "";
            cleaned = cleaned.substring(0, MAX_FILENAME_LENGTH - extension.length()) + extension;
        }
        return cleaned;
    }

    /**
     * Short identifier-like token for generated names: no whitespace, no repeated underscores.
     */
    public static String safeToken(String text, int maxLength) {
        if (text == null) {
            return "unknown";
        }
        String safe = UNSAFE_OR_SPACE.matcher(text).replaceAll("_");
        safe = REPEATED_UNDERSCORES.matcher(safe).replaceAll("_");
        if (safe.length() > maxLength) {
            safe = safe.substring(0, maxLength);
        }
        safe = stripUnderscores(safe);
        return safe.isEmpty() ? "unknown" : safe;
    }

    private static String stripUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
