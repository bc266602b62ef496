package com.example.musiclibrary.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.library")
public class AppLibraryProperties {

    /**
     * Library root directories registered with the watcher at startup.
     */
    private List<String> roots = new ArrayList<>();

    /**
     * Start filesystem watching on startup. Disabled in tests and for rescan-only deployments.
     */
    private boolean watchEnabled = true;

    private List<String> audioExtensions = new ArrayList<>(
            Arrays.asList("flac", "mp3", "aac", "opus", "ogg", "wav", "aiff", "aif", "mpc"));

    /**
     * Quiet period after the last raw event before a batch is flushed.
     */
    private long debounceDelayMs = 500;

    /**
     * Upper bound on how long a continuously active batch may be held back. 0 disables the cap.
     */
    private long debounceMaxWaitMs = 5000;

    private int rawChannelCapacity = 1000;

    private int debouncedChannelCapacity = 50;

    /**
     * Forward create/modify/remove of DR sidecar files so that album DR values follow edits to them.
     */
    private boolean trackSidecarChanges = true;

    public Set<String> normalizedAudioExtensions() {
        return normalize(audioExtensions);
    }

    static Set<String> normalize(List<String> extensions) {
        if (extensions == null) {
            return new LinkedHashSet<>();
        }
        return extensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
