package com.example.musiclibrary.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class AlbumEntity {

    private Long id;

    private Long artistId;

    private String title;

    private Integer year;

    private String genre;

    private Boolean compilation;

    /** Album directory, unique across the catalog. */
    private String path;

    /** Canonical "DR&lt;NN&gt;" or null. */
    private String drValue;

    private String artworkPath;

    private String format;

    private Integer bitsPerSample;

    private Integer sampleRate;

    private String createdAt;

    private String updatedAt;
}
