package com.example.medialibrary.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "media-library")
@Validated
@Getter
@Setter
public class MediaLibraryProperties {

    @NotNull
    private Path home = Path.of(System.getProperty("user.home"), "Downloads", "media-library");

    // Unset directories are derived from home, see LibraryLayout
    private Path databasePath;
    private Path videosDir;
    private Path thumbnailsDir;
    private Path exportsDir;
    private Path tempDir;

    private boolean flatStructure = false;

    private boolean exportJson = true;

    /**
     * Platform name to host patterns. Declaration order is the match order.
     */
    private Map<String, List<String>> platforms = defaultPlatforms();

    @Valid
    private Extractor extractor = new Extractor();

    @Valid
    private Queue queue = new Queue();

    @Getter
    @Setter
    public static class Extractor {
        @NotBlank
        private String executable = "yt-dlp";

        @NotBlank
        private String filenameTemplate = "%(upload_date)s_%(uploader)s_%(title)s.%(ext)s";

        @NotNull
        private Duration timeout = Duration.ofHours(2);

        private boolean writeThumbnail = true;
    }

    @Getter
    @Setter
    public static class Queue {
        @Min(1)
        private int maxConcurrent = 32;

        @NotNull
        private Duration staleAfter = Duration.ofMinutes(5);

        @Min(1000)
        private long expireIntervalMs = 60_000;
    }

    private static Map<String, List<String>> defaultPlatforms() {
        Map<String, List<String>> platforms = new LinkedHashMap<>();
        platforms.put("youtube", List.of("youtube.com", "youtu.be", "youtube-nocookie.com"));
        platforms.put("tiktok", List.of("tiktok.com", "vm.tiktok.com"));
        platforms.put("instagram", List.of("instagram.com", "instagr.am"));
        platforms.put("twitter", List.of("twitter.com", "x.com", "t.co"));
        platforms.put("reddit", List.of("reddit.com", "redd.it"));
        platforms.put("twitch", List.of("twitch.tv", "clips.twitch.tv"));
        platforms.put("c-span", List.of("c-span.org"));
        return platforms;
    }
}
