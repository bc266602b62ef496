package com.example.musiclibrary.domain.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Tracks sharing one album directory with the album-level values aggregated from them.
 */
@Data
public class AlbumGroup {

    private Path directory;

    private String title;

    private String artistName;

    private Integer year;

    private String genre;

    private boolean compilation;

    private String artworkPath;

    private String format;

    private Integer bitsPerSample;

    private Integer sampleRate;

    private List<ScannedTrack> tracks = new ArrayList<>();
}
