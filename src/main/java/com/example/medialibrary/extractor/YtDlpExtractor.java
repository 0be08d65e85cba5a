package com.example.medialibrary.extractor;

import com.example.medialibrary.config.MediaLibraryProperties;
import com.example.medialibrary.exception.ExtractionException;
import com.example.medialibrary.model.CancellationToken;
import com.example.medialibrary.model.DownloadProgress;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the {@code yt-dlp} executable for one URL. Progress and the final path are printed on dedicated
 * line prefixes, the info dictionary as one JSON line after post-processing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class YtDlpExtractor implements Extractor {

    static final String PROGRESS_PREFIX = "[progress] ";
    static final String FILEPATH_PREFIX = "[filepath] ";

    private static final int ERROR_TAIL_LINES = 20;
    private static final TypeReference<Map<String, Object>> INFO_TYPE = new TypeReference<>() {
    };

    private final MediaLibraryProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public ExtractionResult extract(ExtractionRequest request, ProgressChannel progress,
                                    CancellationToken cancellation) {
        List<String> command = buildCommand(request);
        log.debug("Команда extractor: {}", String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.directory(request.getTargetDirectory().toFile());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExtractionException("Не удалось запустить " + properties.getExtractor().getExecutable()
                    + ": " + e.getMessage(), e);
        }

        cancellation.onCancel(process::destroyForcibly);
        AtomicBoolean timedOut = new AtomicBoolean(false);
        long timeoutMs = properties.getExtractor().getTimeout().toMillis();
        CompletableFuture<Void> watchdog = CompletableFuture.runAsync(() -> {
            if (process.isAlive()) {
                timedOut.set(true);
                process.destroyForcibly();
            }
        }, CompletableFuture.delayedExecutor(timeoutMs, TimeUnit.MILLISECONDS));

        Deque<String> tail = new ArrayDeque<>();
        Map<String, Object> info = null;
        Path primaryFile = null;
        int exitCode;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith(PROGRESS_PREFIX)) {
                    DownloadProgress parsed = parseProgress(line.substring(PROGRESS_PREFIX.length()));
                    if (parsed != null) {
                        progress.publish(parsed);
                    }
                } else if (line.startsWith(FILEPATH_PREFIX)) {
                    primaryFile = Path.of(line.substring(FILEPATH_PREFIX.length()).trim());
                } else if (line.startsWith("{")) {
                    info = parseInfo(line);
                } else {
                    log.debug("yt-dlp: {}", line);
                    if (tail.size() == ERROR_TAIL_LINES) {
                        tail.removeFirst();
                    }
                    tail.addLast(line);
                }
            }
            exitCode = process.waitFor();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new ExtractionException("Ошибка чтения вывода yt-dlp: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ExtractionException("Извлечение прервано", e);
        } finally {
            watchdog.cancel(false);
        }

        cancellation.throwIfCancelled();
        if (timedOut.get()) {
            throw new ExtractionException("yt-dlp не завершился за " + properties.getExtractor().getTimeout());
        }
        if (exitCode != 0) {
            log.error("yt-dlp завершился с кодом {} для {}", exitCode, request.getUrl());
            throw new ExtractionException("yt-dlp завершился с кодом " + exitCode + ": " + String.join("\n", tail));
        }
        if (info == null) {
            throw new ExtractionException("yt-dlp не вернул метаданные для " + request.getUrl());
        }

        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder()
                .primaryFile(primaryFile)
                .metadata(toMetadata(info));
        producedFiles(info).forEach(result::producedFile);
        return result.build();
    }

    List<String> buildCommand(ExtractionRequest request) {
        MediaLibraryProperties.Extractor config = properties.getExtractor();
        List<String> command = new ArrayList<>();
        command.add(config.getExecutable());
        command.add("--no-playlist");
        command.add("--newline");
        command.add("--no-colors");
        command.add("--no-simulate");
        command.add("--progress");
        command.add("--progress-template");
        command.add("download:" + PROGRESS_PREFIX
                + "%(progress.downloaded_bytes)s %(progress.total_bytes,progress.total_bytes_estimate)s "
                + "%(progress.speed)s %(progress.eta)s");
        command.add("--print");
        command.add("after_move:" + FILEPATH_PREFIX + "%(filepath)s");
        command.add("--print");
        command.add("after_move:%()j");
        command.add("--merge-output-format");
        command.add("mp4");
        command.add("-o");
        command.add(request.getTargetDirectory().resolve(config.getFilenameTemplate()).toString());
        if (config.isWriteThumbnail()) {
            command.add("--write-thumbnail");
            command.add("--convert-thumbnails");
            command.add("jpg");
        }
        if (request.getFormatId() != null && !request.getFormatId().isBlank()) {
            command.add("-f");
            command.add(request.getFormatId());
        }
        command.add("--");
        command.add(request.getUrl());
        return command;
    }

    /**
     * Parses {@code downloaded total speed eta}; yt-dlp prints {@code NA} for unknown values.
     */
    static DownloadProgress parseProgress(String payload) {
        String[] parts = payload.trim().split("\\s+");
        if (parts.length < 4) {
            return null;
        }
        Double downloaded = parseNumber(parts[0]);
        if (downloaded == null) {
            return null;
        }
        Double total = parseNumber(parts[1]);
        Double eta = parseNumber(parts[3]);
        return DownloadProgress.builder()
                .downloadedBytes(downloaded.longValue())
                .totalBytes(total != null ? total.longValue() : null)
                .speedBytesPerSecond(parseNumber(parts[2]))
                .etaSeconds(eta != null ? eta.longValue() : null)
                .build();
    }

    private static Double parseNumber(String value) {
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Map<String, Object> parseInfo(String line) {
        try {
            return objectMapper.readValue(line, INFO_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Не удалось разобрать JSON от yt-dlp: {}", e.getOriginalMessage());
            return null;
        }
    }

    static MediaMetadata toMetadata(Map<String, Object> info) {
        return MediaMetadata.builder()
                .id(string(info, "id"))
                .title(string(info, "title"))
                .description(string(info, "description"))
                .uploader(string(info, "uploader"))
                .uploaderId(string(info, "uploader_id"))
                .uploadDate(string(info, "upload_date"))
                .duration(doubleValue(info, "duration"))
                .viewCount(longValue(info, "view_count"))
                .likeCount(longValue(info, "like_count"))
                .commentCount(longValue(info, "comment_count"))
                .width(intValue(info, "width"))
                .height(intValue(info, "height"))
                .fps(doubleValue(info, "fps"))
                .vcodec(string(info, "vcodec"))
                .thumbnailUrl(string(info, "thumbnail"))
                .raw(info)
                .build();
    }

    private static List<Path> producedFiles(Map<String, Object> info) {
        List<Path> files = new ArrayList<>();
        if (info.get("requested_downloads") instanceof Collection<?> downloads) {
            for (Object download : downloads) {
                if (download instanceof Map<?, ?> entry) {
                    for (String key : List.of("filepath", "_filename", "filename")) {
                        if (entry.get(key) instanceof String path && !path.isBlank()) {
                            files.add(Path.of(path));
                        }
                    }
                }
            }
        }
        if (info.get("filepath") instanceof String path && !path.isBlank()) {
            files.add(Path.of(path));
        }
        return files;
    }

    private static String string(Map<String, Object> info, String key) {
        Object value = info.get(key);
        return value != null ? value.toString() : null;
    }

    private static Double doubleValue(Map<String, Object> info, String key) {
        return info.get(key) instanceof Number number ? number.doubleValue() : null;
    }

    private static Long longValue(Map<String, Object> info, String key) {
        return info.get(key) instanceof Number number ? number.longValue() : null;
    }

    private static Integer intValue(Map<String, Object> info, String key) {
        return info.get(key) instanceof Number number ? number.intValue() : null;
    }
}
