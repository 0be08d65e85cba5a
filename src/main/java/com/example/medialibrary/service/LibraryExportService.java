package com.example.medialibrary.service;

import com.example.medialibrary.config.LibraryLayout;
import com.example.medialibrary.dto.ExportedRecord;
import com.example.medialibrary.model.MediaRecord;
import com.example.medialibrary.util.FilenameSanitizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class LibraryExportService {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int DEFAULT_EXPORT_LIMIT = 10_000;
    private static final int SOURCE_ID_MAX_LENGTH = 50;

    private final LibraryStoreService libraryStoreService;
    private final LibraryLayout layout;
    private final ObjectMapper objectMapper;

    /**
     * Writes {@code <exports-dir>/<platform>_<sourceId>_<timestamp>.json} for one record.
     */
    public Path exportRecord(MediaRecord record) throws IOException {
        Path directory = layout.ensureDirectory(layout.exportsDir());
        String filename = record.getPlatform() + "_"
                + FilenameSanitizer.safeToken(record.getSourceId(), SOURCE_ID_MAX_LENGTH) + "_"
                + LocalDateTime.now().format(FILE_TIMESTAMP) + ".json";
        Path target = directory.resolve(filename);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), ExportedRecord.from(record));
        log.debug("Экспортирована запись id={} в {}", record.getId(), target);
        return target;
    }

    /**
     * Export after a committed ingest. The record is already stored, so a failure here is only logged.
     */
    public Optional<Path> exportRecordQuietly(MediaRecord record) {
        try {
            return Optional.of(exportRecord(record));
        } catch (IOException | RuntimeException e) {
            log.warn("Не удалось экспортировать запись id={}: {}", record.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the library, optionally filtered by platform or else by collection, into one JSON document.
     *
     * @return number of exported records
     */
    public int exportLibrary(Path exportPath, String platform, String collection, Integer limit) throws IOException {
        int effectiveLimit = limit != null ? limit : DEFAULT_EXPORT_LIMIT;
        List<MediaRecord> records;
        if (platform != null) {
            records = libraryStoreService.findByPlatform(platform, effectiveLimit);
        } else if (collection != null) {
            records = libraryStoreService.findByCollection(collection, effectiveLimit);
        } else {
            records = libraryStoreService.findRecent(effectiveLimit);
        }

        List<ExportedRecord> exported = records.stream()
                .map(ExportedRecord::from)
                .collect(Collectors.toList());

        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("platform", platform);
        filters.put("collection", collection);
        filters.put("limit", limit);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("exported_at", LocalDateTime.now().toString());
        document.put("total_videos", exported.size());
        document.put("filters", filters);
        document.put("videos", exported);

        Path parent = exportPath.toAbsolutePath().getParent();
        if (parent != null) {
            layout.ensureDirectory(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(exportPath.toFile(), document);
        log.info("Экспортировано {} записей в {}", exported.size(), exportPath);
        return exported.size();
    }
}
