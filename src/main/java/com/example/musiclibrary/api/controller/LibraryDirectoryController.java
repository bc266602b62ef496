package com.example.musiclibrary.api.controller;

import com.example.musiclibrary.api.request.LibraryDirectoryRequest;
import com.example.musiclibrary.api.response.ApiResponse;
import com.example.musiclibrary.application.service.LibrarySyncEngine;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library/directories")
public class LibraryDirectoryController {

    private final LibrarySyncEngine librarySyncEngine;

    public LibraryDirectoryController(LibrarySyncEngine librarySyncEngine) {
        this.librarySyncEngine = librarySyncEngine;
    }

    @GetMapping
    public ApiResponse<List<String>> list() {
        return ApiResponse.success(toStrings(librarySyncEngine.getWatchedDirectories()));
    }

    @PostMapping
    public ApiResponse<List<String>> add(@Valid @RequestBody LibraryDirectoryRequest request) {
        librarySyncEngine.addDirectory(request.getPath());
        return ApiResponse.success(toStrings(librarySyncEngine.getWatchedDirectories()));
    }

    @DeleteMapping
    public ApiResponse<List<String>> remove(@RequestParam("path") String path) {
        librarySyncEngine.removeDirectory(path);
        return ApiResponse.success(toStrings(librarySyncEngine.getWatchedDirectories()));
    }

    private List<String> toStrings(List<Path> paths) {
        return paths.stream().map(Path::toString).collect(Collectors.toList());
    }
}
