package com.example.medialibrary.service;

import com.example.medialibrary.exception.MediaFileException;
import com.example.medialibrary.extractor.ExtractionResult;
import com.example.medialibrary.extractor.MediaMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the file an extractor produced. Strategies are tried in order and the first hit wins:
 * the reported path, the produced-outputs list, a name match against the metadata, and finally the most
 * recently modified video file in the directory.
 */
@Component
@Slf4j
public class OutputFileLocator {

    static final List<String> VIDEO_EXTENSIONS = List.of("mp4", "webm", "mkv");

    private static final int TITLE_FRAGMENT_LENGTH = 20;

    @FunctionalInterface
    interface Strategy {
        Optional<Path> locate(Path directory, ExtractionResult result);
    }

    private final List<Strategy> strategies = List.of(
            OutputFileLocator::reportedPath,
            OutputFileLocator::producedOutputs,
            OutputFileLocator::metadataMatch,
            OutputFileLocator::mostRecent
    );

    public Path locate(Path directory, ExtractionResult result) {
        for (Strategy strategy : strategies) {
            Optional<Path> found = strategy.locate(directory, result);
            if (found.isPresent()) {
                log.debug("Найден файл: {}", found.get());
                return found.get();
            }
        }
        throw new MediaFileException("Загруженный файл не найден в " + directory);
    }

    static Optional<Path> reportedPath(Path directory, ExtractionResult result) {
        return Optional.ofNullable(result.getPrimaryFile())
                .filter(Files::isRegularFile);
    }

    static Optional<Path> producedOutputs(Path directory, ExtractionResult result) {
        if (result.getProducedFiles() == null) {
            return Optional.empty();
        }
        return result.getProducedFiles().stream()
                .filter(Files::isRegularFile)
                .findFirst();
    }

    static Optional<Path> metadataMatch(Path directory, ExtractionResult result) {
        MediaMetadata metadata = result.getMetadata();
        if (metadata == null) {
            return Optional.empty();
        }
        String uploadDate = metadata.getUploadDate();
        String uploader = metadata.getUploader();
        String title = metadata.getTitle();
        String titleFragment = isBlank(title) ? null
                : title.substring(0, Math.min(TITLE_FRAGMENT_LENGTH, title.length()));

        return candidates(directory).stream()
                .filter(candidate -> {
                    String name = candidate.getFileName().toString();
                    boolean byDateAndUploader = !isBlank(uploadDate) && !isBlank(uploader)
                            && name.contains(uploadDate) && name.contains(uploader);
                    boolean byTitle = titleFragment != null && name.contains(titleFragment);
                    return byDateAndUploader || byTitle;
                })
                .findFirst();
    }

    static Optional<Path> mostRecent(Path directory, ExtractionResult result) {
        return candidates(directory).stream()
                .max(Comparator.comparing(OutputFileLocator::lastModified));
    }

    /**
     * Video files directly inside the directory, ordered by extension preference and then by name.
     */
    static List<Path> candidates(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> extensionRank(path) >= 0)
                    .sorted(Comparator.comparingInt(OutputFileLocator::extensionRank)
                            .thenComparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MediaFileException("Не удалось прочитать директорию " + directory + ": " + e.getMessage(), e);
        }
    }

    private static int extensionRank(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return -1;
        }
        return VIDEO_EXTENSIONS.indexOf(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
