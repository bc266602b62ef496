package com.example.musiclibrary.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class TrackEntity {

    private Long id;

    private Long albumId;

    private String title;

    private Integer trackNumber;

    private Integer discNumber;

    private Long durationMs;

    private String path;

    private Long fileSize;

    private String format;

    private String codec;

    private Integer sampleRate;

    private Integer bitsPerSample;

    private Integer channels;

    private Boolean isLossless;

    private Boolean isHighResolution;

    private String createdAt;

    private String updatedAt;
}
