package com.example.musiclibrary.api.controller;

import com.example.musiclibrary.api.response.ApiResponse;
import com.example.musiclibrary.application.service.CatalogService;
import com.example.musiclibrary.domain.model.SearchResults;
import com.example.musiclibrary.infrastructure.persistence.entity.AlbumEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.TrackEntity;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/catalog")
public class CatalogController {

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping("/albums")
    public ApiResponse<List<AlbumEntity>> albums(@RequestParam(value = "filter", required = false) String filter) {
        return ApiResponse.success(catalogService.getAlbums(filter));
    }

    @GetMapping("/albums/{id}")
    public ApiResponse<AlbumEntity> album(@PathVariable("id") Long id) {
        return ApiResponse.success(catalogService.getAlbum(id));
    }

    @GetMapping("/albums/{id}/tracks")
    public ApiResponse<List<TrackEntity>> albumTracks(@PathVariable("id") Long id) {
        return ApiResponse.success(catalogService.getTracksByAlbum(id));
    }

    @GetMapping("/artists")
    public ApiResponse<List<ArtistEntity>> artists(@RequestParam(value = "filter", required = false) String filter) {
        return ApiResponse.success(catalogService.getArtists(filter));
    }

    @GetMapping("/artists/{id}/albums")
    public ApiResponse<List<AlbumEntity>> artistAlbums(@PathVariable("id") Long id) {
        return ApiResponse.success(catalogService.getAlbumsByArtist(id));
    }

    @GetMapping("/artists/{id}/tracks")
    public ApiResponse<List<TrackEntity>> artistTracks(@PathVariable("id") Long id) {
        return ApiResponse.success(catalogService.getTracksByArtist(id));
    }

    @GetMapping("/search")
    public ApiResponse<SearchResults> search(@RequestParam("q") String query) {
        return ApiResponse.success(catalogService.search(query));
    }
}
