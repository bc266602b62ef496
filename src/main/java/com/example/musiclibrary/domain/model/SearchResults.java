package com.example.musiclibrary.domain.model;

import com.example.musiclibrary.infrastructure.persistence.entity.AlbumEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.TrackEntity;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class SearchResults {

    private List<ArtistEntity> artists = new ArrayList<>();

    private List<AlbumEntity> albums = new ArrayList<>();

    private List<TrackEntity> tracks = new ArrayList<>();
}
