package com.example.medialibrary.service;

import com.example.medialibrary.exception.MediaFileException;
import com.example.medialibrary.util.FilenameSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Set;

/**
 * Moves a finished file into a library directory so that it appears under its final name only once it
 * is complete. Names are reserved in-process, so concurrent placements never target the same file.
 */
@Component
@Slf4j
public class AtomicFilePlacer {

    private final Set<Path> reservedNames = new HashSet<>();

    public Path place(Path source, Path destinationDirectory) {
        String filename = FilenameSanitizer.sanitizeFilename(source.getFileName().toString());
        Path target = reserve(destinationDirectory.toAbsolutePath().normalize(), filename);
        try {
            moveAtomically(source, target);
            log.debug("Файл размещен: {} -> {}", source, target);
            return target;
        } catch (IOException e) {
            throw new MediaFileException("Не удалось переместить " + source + " в " + target + ": " + e.getMessage(), e);
        } finally {
            release(target);
        }
    }

    /**
     * Removes a placed file that will not be committed to the library.
     */
    public void discard(Path placed) {
        try {
            if (Files.deleteIfExists(placed)) {
                log.debug("Удален неиспользованный файл: {}", placed);
            }
        } catch (IOException e) {
            log.warn("Не удалось удалить файл {}: {}", placed, e.getMessage());
        }
    }

    private synchronized Path reserve(Path directory, String filename) {
        int dot = filename.lastIndexOf('.');
        String stem = dot > 0 ? filename.substring(0, dot) : filename;
        String extension = dot > 0 ? filename.substring(dot) : "";

        Path candidate = directory.resolve(filename);
        int counter = 1;
        while (reservedNames.contains(candidate) || Files.exists(candidate)) {
            candidate = directory.resolve(stem + "_" + counter + extension);
            counter++;
        }
        reservedNames.add(candidate);
        return candidate;
    }

    private synchronized void release(Path target) {
        reservedNames.remove(target);
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            // different filesystem: stage next to the target, then rename within the destination
            Path partial = target.resolveSibling("." + target.getFileName() + ".partial");
            try {
                Files.copy(source, partial, StandardCopyOption.REPLACE_EXISTING);
                Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException copyFailure) {
                try {
                    Files.deleteIfExists(partial);
                } catch (IOException cleanupFailure) {
                    copyFailure.addSuppressed(cleanupFailure);
                }
                throw copyFailure;
            }
            try {
                Files.delete(source);
            } catch (IOException deleteFailure) {
                log.warn("Не удалось удалить исходный файл {}: {}", source, deleteFailure.getMessage());
            }
        }
    }
}
