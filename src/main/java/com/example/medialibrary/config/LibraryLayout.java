package com.example.medialibrary.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Filesystem layout of the library and the URL to platform mapping.
 */
@Component
@Slf4j
public class LibraryLayout {

    public static final String UNKNOWN_PLATFORM = "other";

    private final MediaLibraryProperties properties;

    public LibraryLayout(MediaLibraryProperties properties) {
        this.properties = properties;
    }

    public String detectPlatform(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : properties.getPlatforms().entrySet()) {
            for (String pattern : entry.getValue()) {
                if (matchesAtDomainBoundary(lower, pattern.toLowerCase(Locale.ROOT))) {
                    return entry.getKey();
                }
            }
        }
        return UNKNOWN_PLATFORM;
    }

    // "t.co" must not match inside "combatfootage.com/..."
    private static boolean matchesAtDomainBoundary(String url, String pattern) {
        int from = 0;
        while (true) {
            int idx = url.indexOf(pattern, from);
            if (idx == -1) {
                return false;
            }
            int end = idx + pattern.length();
            boolean endOk = end >= url.length() || "/:?#".indexOf(url.charAt(end)) >= 0;
            boolean startOk = idx == 0 || "/.@".indexOf(url.charAt(idx - 1)) >= 0;
            if (endOk && startOk) {
                return true;
            }
            from = idx + 1;
        }
    }

    /**
     * Resolves and creates the directory a finished file of the given platform is moved into.
     */
    public Path resolveOutputDirectory(String platform, Path override, Boolean flatStructure) throws IOException {
        Path dir;
        if (override != null) {
            dir = override;
        } else if (flatStructure != null ? flatStructure : properties.isFlatStructure()) {
            dir = videosDir();
        } else {
            dir = videosDir().resolve(platform);
        }
        return ensureDirectory(dir);
    }

    public Path databasePath() {
        return orHome(properties.getDatabasePath(), "library.db");
    }

    public Path videosDir() {
        return orHome(properties.getVideosDir(), "videos");
    }

    public Path thumbnailsDir() {
        return orHome(properties.getThumbnailsDir(), "thumbnails");
    }

    public Path exportsDir() {
        return orHome(properties.getExportsDir(), "exports");
    }

    public Path tempDir() {
        return orHome(properties.getTempDir(), "tmp");
    }

    public Path ensureDirectory(Path dir) throws IOException {
        Path absolute = dir.toAbsolutePath().normalize();
        if (!Files.isDirectory(absolute)) {
            Files.createDirectories(absolute);
            log.info("Создана директория: {}", absolute);
        }
        return absolute;
    }

    private Path orHome(Path configured, String name) {
        return (configured != null ? configured : properties.getHome().resolve(name)).toAbsolutePath().normalize();
    }
}
