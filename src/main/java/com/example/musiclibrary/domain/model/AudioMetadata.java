package com.example.musiclibrary.domain.model;

import lombok.Data;

/**
 * Tag values read from one audio file. Any field may be null when the file carries no such tag.
 */
@Data
public class AudioMetadata {

    private String title;

    private String artist;

    private String album;

    private String albumArtist;

    private Integer trackNumber;

    private Integer discNumber;

    private Integer year;

    private String genre;

    private Long durationMs;

    private Integer sampleRate;

    private Integer bitsPerSample;

    private Integer channels;

    private String codec;
}
