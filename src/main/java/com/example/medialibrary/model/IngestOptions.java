package com.example.medialibrary.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class IngestOptions {

    private String formatId;

    /**
     * Destination directory override. When null the platform directory of the library is used.
     */
    private Path outputDirectory;

    /**
     * Null means "use the library default".
     */
    private Boolean flatStructure;

    private boolean skipDuplicateCheck;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String collection;

    public static IngestOptions defaults() {
        return IngestOptions.builder().build();
    }
}
