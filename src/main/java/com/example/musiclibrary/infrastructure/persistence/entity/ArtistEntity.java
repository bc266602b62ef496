package com.example.musiclibrary.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class ArtistEntity {

    private Long id;

    private String name;

    private String createdAt;

    private String updatedAt;
}
