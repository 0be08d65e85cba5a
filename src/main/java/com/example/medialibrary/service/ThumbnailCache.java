package com.example.medialibrary.service;

import com.example.medialibrary.config.LibraryLayout;
import com.example.medialibrary.util.FilenameSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Keeps one thumbnail per item under {@code <thumbnails-dir>/<platform>_<sourceId>.<ext>}, adopted from
 * the image the extractor wrote next to the media file.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ThumbnailCache {

    static final List<String> IMAGE_EXTENSIONS = List.of("jpg", "jpeg", "png", "webp");

    private final LibraryLayout layout;

    @Value
    public static class CachedThumbnail {
        Path path;
        // false when a thumbnail for the same item was already cached
        boolean created;
    }

    /**
     * Never throws: a missing or unreadable image only means the record has no thumbnail.
     */
    public Optional<CachedThumbnail> adopt(Path extractionDirectory, String platform, String sourceId) {
        try {
            Optional<Path> image = findImage(extractionDirectory);
            if (image.isEmpty()) {
                log.debug("Миниатюра не найдена в {}", extractionDirectory);
                return Optional.empty();
            }
            Path directory = layout.ensureDirectory(layout.thumbnailsDir());
            Path target = directory.resolve(platform + "_" + FilenameSanitizer.safeToken(sourceId, 100)
                    + "." + extension(image.get()));
            if (Files.exists(target)) {
                return Optional.of(new CachedThumbnail(target, false));
            }
            Files.move(image.get(), target);
            log.debug("Миниатюра сохранена: {}", target);
            return Optional.of(new CachedThumbnail(target, true));
        } catch (IOException | RuntimeException e) {
            log.warn("Не удалось сохранить миниатюру для {}/{}: {}", platform, sourceId, e.getMessage());
            return Optional.empty();
        }
    }

    public void discard(CachedThumbnail thumbnail) {
        if (!thumbnail.isCreated()) {
            return;
        }
        try {
            Files.deleteIfExists(thumbnail.getPath());
        } catch (IOException e) {
            log.warn("Не удалось удалить миниатюру {}: {}", thumbnail.getPath(), e.getMessage());
        }
    }

    private static Optional<Path> findImage(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> IMAGE_EXTENSIONS.contains(extension(path)))
                    .min(Comparator.comparingInt((Path path) -> IMAGE_EXTENSIONS.indexOf(extension(path)))
                            .thenComparing(path -> path.getFileName().toString()));
        }
    }

    private static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
