package com.example.musiclibrary.domain.model;

import java.nio.file.Path;
import lombok.Data;

/**
 * A track as derived from disk: resolved tags plus file facts, ready to be grouped into its album.
 */
@Data
public class ScannedTrack {

    private Path path;

    private long fileSize;

    private String format;

    private String codec;

    private boolean lossless;

    private boolean highResolution;

    /** Tags after path fallback; title, artist and album are never blank. */
    private AudioMetadata metadata;
}
