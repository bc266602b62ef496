package com.example.musiclibrary.common.exception;

/**
 * The stored schema version cannot be brought to the current one. Aborts startup.
 */
public class SchemaMigrationException extends LibraryException {

    public SchemaMigrationException(String message) {
        super("50002", message, "Restore the library database from a backup or delete it to rebuild");
    }

    public SchemaMigrationException(String message, Throwable cause) {
        super("50002", message, "Restore the library database from a backup or delete it to rebuild", cause);
    }
}
