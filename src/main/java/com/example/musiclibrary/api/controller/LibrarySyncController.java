package com.example.musiclibrary.api.controller;

import com.example.musiclibrary.api.response.ApiResponse;
import com.example.musiclibrary.api.response.LibraryStatusResponse;
import com.example.musiclibrary.application.service.CatalogService;
import com.example.musiclibrary.application.service.DrCoordinator;
import com.example.musiclibrary.application.service.IncrementalSynchronizer;
import com.example.musiclibrary.application.service.LibraryRescanService;
import com.example.musiclibrary.application.service.LibrarySyncEngine;
import com.example.musiclibrary.common.exception.LibraryException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Collectors;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library")
public class LibrarySyncController {

    private final LibrarySyncEngine librarySyncEngine;
    private final LibraryRescanService libraryRescanService;
    private final IncrementalSynchronizer incrementalSynchronizer;
    private final CatalogService catalogService;
    private final DrCoordinator drCoordinator;

    public LibrarySyncController(LibrarySyncEngine librarySyncEngine,
                                 LibraryRescanService libraryRescanService,
                                 IncrementalSynchronizer incrementalSynchronizer,
                                 CatalogService catalogService,
                                 DrCoordinator drCoordinator) {
        this.librarySyncEngine = librarySyncEngine;
        this.libraryRescanService = libraryRescanService;
        this.incrementalSynchronizer = incrementalSynchronizer;
        this.catalogService = catalogService;
        this.drCoordinator = drCoordinator;
    }

    @PostMapping("/rescan")
    public ApiResponse<String> rescan() {
        libraryRescanService.trigger();
        return ApiResponse.success("SUBMITTED");
    }

    @GetMapping("/status")
    public ApiResponse<LibraryStatusResponse> status() {
        LibraryStatusResponse response = new LibraryStatusResponse();
        response.setWatching(librarySyncEngine.isRunning());
        response.setDirectories(librarySyncEngine.getWatchedDirectories().stream()
                .map(Path::toString).collect(Collectors.toList()));
        response.setDroppedEvents(librarySyncEngine.getDroppedEventCount());
        response.setBatchesApplied(incrementalSynchronizer.getBatchesApplied());
        response.setFilesFailed(incrementalSynchronizer.getFilesFailed());
        long lastBatchAt = incrementalSynchronizer.getLastBatchAtMs();
        response.setLastBatchAtMs(lastBatchAt > 0 ? lastBatchAt : null);
        response.setArtistCount(catalogService.countArtists());
        response.setAlbumCount(catalogService.countAlbums());
        response.setTrackCount(catalogService.countTracks());
        response.setRescan(libraryRescanService.getStatus());
        return ApiResponse.success(response);
    }

    @PostMapping("/albums/dr/refresh")
    public ApiResponse<String> refreshDr(@RequestParam("path") String path) {
        Path albumDir;
        try {
            albumDir = Paths.get(path).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new LibraryException(LibraryException.BAD_REQUEST, "Invalid album path: " + path);
        }
        return ApiResponse.success(drCoordinator.refresh(albumDir));
    }
}
