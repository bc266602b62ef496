package com.example.musiclibrary.application.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CoverArtDetector {

    private static final Logger log = LoggerFactory.getLogger(CoverArtDetector.class);

    private static final Set<String> COVER_FILENAMES = new HashSet<>(Arrays.asList(
            "cover.jpg", "cover.jpeg", "cover.png",
            "album.jpg", "album.jpeg", "album.png",
            "folder.jpg", "folder.jpeg", "folder.png",
            "front.jpg", "front.jpeg", "front.png",
            "artwork.jpg", "artwork.jpeg", "artwork.png"
    ));

    private static final Set<String> IMAGE_EXTENSIONS = new HashSet<>(Arrays.asList(
            "jpg", "jpeg", "png", "bmp", "gif", "webp"
    ));

    /**
     * Detect cover art directly inside an album directory.
     * Returns the absolute path of the cover image, or null if none found.
     */
    public String detectCoverInDirectory(Path albumDir) {
        if (albumDir == null || !Files.isDirectory(albumDir)) {
            return null;
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(albumDir)) {
            files = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("COVER_DETECT_FAILED dir={} reason={}", albumDir, e.getMessage());
            return null;
        }

        // First pass: well-known names (cover.jpg, folder.png, ...)
        for (Path file : files) {
            if (COVER_FILENAMES.contains(file.getFileName().toString().toLowerCase(Locale.ROOT))) {
                return file.toString();
            }
        }

        // Second pass: any image file as fallback
        for (Path file : files) {
            String ext = extractExtension(file.getFileName().toString());
            if (ext != null && IMAGE_EXTENSIONS.contains(ext.toLowerCase(Locale.ROOT))) {
                return file.toString();
            }
        }
        return null;
    }

    private String extractExtension(String filename) {
        int dotIdx = filename.lastIndexOf('.');
        if (dotIdx < 0 || dotIdx >= filename.length() - 1) {
            return null;
        }
        return filename.substring(dotIdx + 1);
    }
}
