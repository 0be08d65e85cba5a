package com.example.medialibrary.extractor;

import com.example.medialibrary.config.MediaLibraryProperties;
import com.example.medialibrary.exception.ExtractionException;
import com.example.medialibrary.exception.IngestCancelledException;
import com.example.medialibrary.model.CancellationToken;
import com.example.medialibrary.model.DownloadProgress;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YtDlpExtractorTest {

    @TempDir
    Path workDir;

    private MediaLibraryProperties properties;
    private YtDlpExtractor extractor;

    @BeforeEach
    void setUp() {
        properties = new MediaLibraryProperties();
        extractor = new YtDlpExtractor(properties, new ObjectMapper());
    }

    private ExtractionRequest request(String formatId) {
        return ExtractionRequest.builder()
                .url("https://www.youtube.com/watch?v=abc")
                .platform("youtube")
                .targetDirectory(workDir)
                .formatId(formatId)
                .build();
    }

    @Test
    void commandEndsWithUrlAfterOptionTerminator() {
        List<String> command = extractor.buildCommand(request("best"));

        assertThat(command.get(0)).isEqualTo("yt-dlp");
        assertThat(command).contains("--no-playlist", "--newline", "--write-thumbnail");
        assertThat(command).containsSubsequence("-f", "best");
        assertThat(command).containsSubsequence("-o", workDir.resolve(properties.getExtractor().getFilenameTemplate()).toString());
        assertThat(command.subList(command.size() - 2, command.size()))
                .containsExactly("--", "https://www.youtube.com/watch?v=abc");
    }

    @Test
    void thumbnailAndFormatOptionsAreOptional() {
        properties.getExtractor().setWriteThumbnail(false);

        List<String> command = extractor.buildCommand(request(" "));

        assertThat(command).doesNotContain("--write-thumbnail", "-f");
    }

    @Test
    void parsesProgressLines() {
        DownloadProgress progress = YtDlpExtractor.parseProgress("1024 4096 512.5 6");

        assertThat(progress.getDownloadedBytes()).isEqualTo(1024);
        assertThat(progress.getTotalBytes()).isEqualTo(4096L);
        assertThat(progress.getSpeedBytesPerSecond()).isEqualTo(512.5);
        assertThat(progress.getEtaSeconds()).isEqualTo(6L);
        assertThat(progress.percent()).isEqualTo(25.0);

        DownloadProgress unknown = YtDlpExtractor.parseProgress("2048 NA NA NA");
        assertThat(unknown.getTotalBytes()).isNull();
        assertThat(unknown.getSpeedBytesPerSecond()).isNull();
        assertThat(unknown.percent()).isNull();

        assertThat(YtDlpExtractor.parseProgress("NA NA NA NA")).isNull();
        assertThat(YtDlpExtractor.parseProgress("garbage")).isNull();
    }

    @Test
    void mapsInfoDictionaryToMetadata() {
        Map<String, Object> info = Map.of(
                "id", "abc",
                "title", "Clip",
                "upload_date", "20240115",
                "duration", 12,
                "view_count", 42,
                "width", 1920,
                "height", 1080,
                "fps", 29.97);

        MediaMetadata metadata = YtDlpExtractor.toMetadata(info);

        assertThat(metadata.getId()).isEqualTo("abc");
        assertThat(metadata.getUploadDate()).isEqualTo("20240115");
        assertThat(metadata.getDuration()).isEqualTo(12.0);
        assertThat(metadata.getViewCount()).isEqualTo(42L);
        assertThat(metadata.getWidth()).isEqualTo(1920);
        assertThat(metadata.getFps()).isEqualTo(29.97);
        assertThat(metadata.getUploader()).isNull();
        assertThat(metadata.getRaw()).isSameAs(info);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void readsProgressPathAndInfoFromProcessOutput() throws IOException {
        useScript("""
                echo "[download] Destination: clip.mp4"
                echo "[progress] 50 100 10.0 NA"
                echo "[progress] 100 100 NA 0"
                echo "[filepath] $(pwd -P)/clip.mp4"
                echo '{"id":"abc","title":"Clip","requested_downloads":[{"filepath":"/lib/tmp/clip.mp4"}]}'
                """);
        List<DownloadProgress> published = new CopyOnWriteArrayList<>();

        ExtractionResult result = extractor.extract(request(null), published::add, CancellationToken.none());

        assertThat(result.getPrimaryFile()).isEqualTo(Path.of(workDir.toRealPath().toString(), "clip.mp4"));
        assertThat(result.getProducedFiles()).containsExactly(Path.of("/lib/tmp/clip.mp4"));
        assertThat(result.getMetadata().getTitle()).isEqualTo("Clip");
        assertThat(published).extracting(DownloadProgress::getDownloadedBytes).containsExactly(50L, 100L);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitCarriesOutputTail() throws IOException {
        useScript("""
                echo "ERROR: Unsupported URL"
                exit 1
                """);

        assertThatThrownBy(() -> extractor.extract(request(null), ProgressChannel.NONE, CancellationToken.none()))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Unsupported URL");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void missingInfoIsAnError() throws IOException {
        useScript("echo \"[filepath] $(pwd -P)/clip.mp4\"\n");

        assertThatThrownBy(() -> extractor.extract(request(null), ProgressChannel.NONE, CancellationToken.none()))
                .isInstanceOf(ExtractionException.class);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void cancellationKillsTheProcess() throws Exception {
        useScript("exec sleep 30\n");
        CancellationToken token = new CancellationToken();

        CompletableFuture<ExtractionResult> run = CompletableFuture.supplyAsync(
                () -> extractor.extract(request(null), ProgressChannel.NONE, token));
        Thread.sleep(300);
        token.cancel();

        assertThatThrownBy(() -> run.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IngestCancelledException.class);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void hungProcessTimesOut() throws IOException {
        useScript("exec sleep 30\n");
        properties.getExtractor().setTimeout(Duration.ofMillis(300));

        assertThatThrownBy(() -> extractor.extract(request(null), ProgressChannel.NONE, CancellationToken.none()))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("не завершился");
    }

    private void useScript(String body) throws IOException {
        Path script = Files.createTempFile("fake-yt-dlp", ".sh");
        Files.writeString(script, "#!/bin/sh\n" + body, StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        script.toFile().deleteOnExit();
        properties.getExtractor().setExecutable(script.toString());
    }
}
