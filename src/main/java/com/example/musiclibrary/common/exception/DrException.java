package com.example.musiclibrary.common.exception;

/**
 * DR extraction outcome other than a valid value. Never fatal: a missing DR value is a normal state.
 */
public class DrException extends LibraryException {

    public enum Kind {
        NO_DR_VALUE_FOUND,
        INVALID_CONTENT,
        INVALID_DR_FORMAT,
        READ_ERROR
    }

    private final Kind kind;

    public DrException(Kind kind, String message) {
        this(kind, message, null);
    }

    public DrException(Kind kind, String message, Throwable cause) {
        super("20401", message, null, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
