package com.example.musiclibrary.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.dr")
public class AppDrProperties {

    /**
     * Lifetime of a memoized DR value in milliseconds.
     */
    private long cacheTtlMs = 3_600_000L;

    /**
     * Max cached album paths. Oldest entries are evicted first.
     */
    private int cacheMaxEntries = 10_000;

    private List<String> sidecarExtensions = new ArrayList<>(Arrays.asList("txt", "log", "md", "csv"));

    public Set<String> normalizedSidecarExtensions() {
        return AppLibraryProperties.normalize(sidecarExtensions);
    }
}
