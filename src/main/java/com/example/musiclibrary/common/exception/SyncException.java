package com.example.musiclibrary.common.exception;

import java.nio.file.Path;

/**
 * Per-file failure while applying a batch. The file is skipped and the batch continues.
 */
public class SyncException extends LibraryException {

    private final Path path;

    public SyncException(Path path, String message, Throwable cause) {
        super("50001", message, null, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
