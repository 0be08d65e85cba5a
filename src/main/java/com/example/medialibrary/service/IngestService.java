package com.example.medialibrary.service;

import com.example.medialibrary.config.LibraryLayout;
import com.example.medialibrary.config.MediaLibraryProperties;
import com.example.medialibrary.exception.DuplicateMediaException;
import com.example.medialibrary.exception.MediaFileException;
import com.example.medialibrary.extractor.ExtractionRequest;
import com.example.medialibrary.extractor.ExtractionResult;
import com.example.medialibrary.extractor.Extractor;
import com.example.medialibrary.extractor.MediaMetadata;
import com.example.medialibrary.extractor.ProgressChannel;
import com.example.medialibrary.model.CancellationToken;
import com.example.medialibrary.model.IngestOptions;
import com.example.medialibrary.model.MediaRecord;
import com.example.medialibrary.util.MetadataSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one acquisition from URL to committed library record. Whatever happens, the private
 * extraction directory is removed and a placed file survives only if its record was committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestService {

    static final String UNTITLED = "Untitled";
    static final String UNKNOWN_UPLOADER = "unknown";

    private static final Set<String> MISSING_UPLOADER_VALUES = Set.of("unknown", "null", "none");
    private static final DateTimeFormatter UPLOAD_DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final int HASH_SOURCE_ID_LENGTH = 16;

    private final LibraryStoreService libraryStoreService;
    private final Extractor extractor;
    private final LibraryLayout layout;
    private final OutputFileLocator outputFileLocator;
    private final AtomicFilePlacer atomicFilePlacer;
    private final ContentHasher contentHasher;
    private final ThumbnailCache thumbnailCache;
    private final LibraryExportService libraryExportService;
    private final MediaLibraryProperties properties;
    private final ObjectMapper objectMapper;

    private final Set<String> inFlightUrls = ConcurrentHashMap.newKeySet();

    public MediaRecord ingest(String url, IngestOptions options) {
        return ingest(url, options, ProgressChannel.NONE, CancellationToken.none());
    }

    public MediaRecord ingest(String url, IngestOptions options, ProgressChannel progress,
                              CancellationToken cancellation) {
        IngestOptions effectiveOptions = options != null ? options : IngestOptions.defaults();
        ProgressChannel channel = progress != null ? progress : ProgressChannel.NONE;
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();

        if (!inFlightUrls.add(url)) {
            log.info("URL уже загружается в другом потоке: {}", url);
            throw DuplicateMediaException.inFlight(url);
        }
        try {
            if (!effectiveOptions.isSkipDuplicateCheck()) {
                libraryStoreService.findByUrl(url).ifPresent(existing -> {
                    throw DuplicateMediaException.byUrl(url, existing.getId());
                });
            }
            return runPipeline(url, effectiveOptions, channel, token);
        } finally {
            inFlightUrls.remove(url);
        }
    }

    public boolean isInFlight(String url) {
        return inFlightUrls.contains(url);
    }

    private MediaRecord runPipeline(String url, IngestOptions options, ProgressChannel progress,
                                    CancellationToken token) {
        String platform = layout.detectPlatform(url);
        Path extractionDirectory = null;
        Path placedFile = null;
        ThumbnailCache.CachedThumbnail thumbnail = null;
        boolean committed = false;
        try {
            Path outputDirectory = layout.resolveOutputDirectory(
                    platform, options.getOutputDirectory(), options.getFlatStructure());

            token.throwIfCancelled();
            extractionDirectory = Files.createTempDirectory(layout.ensureDirectory(layout.tempDir()), "ingest_");
            log.info("Начало загрузки: url={}, platform={}", url, platform);
            ExtractionResult result = extractor.extract(ExtractionRequest.builder()
                    .url(url)
                    .platform(platform)
                    .targetDirectory(extractionDirectory)
                    .formatId(options.getFormatId())
                    .build(), progress, token);

            token.throwIfCancelled();
            Path producedFile = outputFileLocator.locate(extractionDirectory, result);

            token.throwIfCancelled();
            placedFile = atomicFilePlacer.place(producedFile, outputDirectory);

            token.throwIfCancelled();
            String contentHash = contentHasher.sha256(placedFile);

            token.throwIfCancelled();
            Optional<MediaRecord> sameContent = libraryStoreService.findByContentHash(contentHash);
            if (sameContent.isPresent()) {
                log.info("Содержимое уже в библиотеке: url={}, existingId={}", url, sameContent.get().getId());
                throw DuplicateMediaException.byContentHash(contentHash, sameContent.get().getId());
            }

            token.throwIfCancelled();
            MediaMetadata metadata = result.getMetadata() != null ? result.getMetadata() : MediaMetadata.builder().build();
            String sourceId = resolveSourceId(metadata, contentHash);
            thumbnail = thumbnailCache.adopt(extractionDirectory, platform, sourceId).orElse(null);

            token.throwIfCancelled();
            MediaRecord record = toRecord(url, platform, sourceId, metadata, options, placedFile, contentHash,
                    thumbnail != null ? thumbnail.getPath() : null);
            MediaRecord saved = libraryStoreService.insert(record);
            committed = true;
            log.info("Запись добавлена в библиотеку: id={}, title={}, path={}",
                    saved.getId(), saved.getTitle(), saved.getLocalPath());

            if (properties.isExportJson()) {
                libraryExportService.exportRecordQuietly(saved);
            }
            return saved;
        } catch (IOException e) {
            throw new MediaFileException("Ошибка файловой системы при загрузке " + url + ": " + e.getMessage(), e);
        } finally {
            if (!committed) {
                if (placedFile != null) {
                    atomicFilePlacer.discard(placedFile);
                }
                if (thumbnail != null) {
                    thumbnailCache.discard(thumbnail);
                }
            }
            if (extractionDirectory != null) {
                deleteExtractionDirectory(extractionDirectory);
            }
        }
    }

    private void deleteExtractionDirectory(Path directory) {
        try {
            FileSystemUtils.deleteRecursively(directory);
        } catch (IOException e) {
            log.warn("Не удалось удалить временную директорию {}: {}", directory, e.getMessage());
        }
    }

    MediaRecord toRecord(String url, String platform, String sourceId, MediaMetadata metadata,
                         IngestOptions options, Path placedFile, String contentHash, Path thumbnailPath)
            throws IOException {
        return MediaRecord.builder()
                .sourceUrl(url)
                .platform(platform)
                .sourceId(sourceId)
                .title(isBlank(metadata.getTitle()) ? UNTITLED : metadata.getTitle())
                .description(metadata.getDescription())
                .uploader(resolveUploader(metadata.getUploader(), platform))
                .uploaderId(metadata.getUploaderId())
                .uploadDate(parseUploadDate(metadata.getUploadDate()))
                .durationSeconds(metadata.getDuration() != null ? metadata.getDuration().intValue() : null)
                .viewCount(metadata.getViewCount())
                .likeCount(metadata.getLikeCount())
                .commentCount(metadata.getCommentCount())
                .resolution(formatResolution(metadata.getWidth(), metadata.getHeight()))
                .fps(metadata.getFps())
                .codec(metadata.getVcodec())
                .fileSizeBytes(Files.size(placedFile))
                .contentHash(contentHash)
                .localPath(placedFile.toAbsolutePath().toString())
                .thumbnailPath(thumbnailPath != null ? thumbnailPath.toString() : null)
                .ingestedAt(LocalDateTime.now())
                .tags(new ArrayList<>(options.getTags() != null ? options.getTags() : new ArrayList<>()))
                .collection(options.getCollection())
                .rawMetadata(serializeRawMetadata(metadata))
                .build();
    }

    static String resolveSourceId(MediaMetadata metadata, String contentHash) {
        if (!isBlank(metadata.getId())) {
            return metadata.getId();
        }
        return contentHash.substring(0, HASH_SOURCE_ID_LENGTH);
    }

    static String resolveUploader(String uploader, String platform) {
        if (isBlank(uploader) || MISSING_UPLOADER_VALUES.contains(uploader.trim().toLowerCase(Locale.ROOT))) {
            return "c-span".equals(platform) ? "C-SPAN" : UNKNOWN_UPLOADER;
        }
        return uploader;
    }

    static LocalDate parseUploadDate(String uploadDate) {
        if (isBlank(uploadDate)) {
            return null;
        }
        try {
            return LocalDate.parse(uploadDate.trim(), UPLOAD_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            log.debug("Некорректная дата загрузки: {}", uploadDate);
            return null;
        }
    }

    static String formatResolution(Integer width, Integer height) {
        return (width != null ? width.toString() : "?") + "x" + (height != null ? height.toString() : "?");
    }

    private String serializeRawMetadata(MediaMetadata metadata) {
        try {
            return objectMapper.writeValueAsString(MetadataSanitizer.sanitize(metadata.getRaw()));
        } catch (JsonProcessingException e) {
            log.warn("Не удалось сериализовать метаданные: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
