package com.example.musiclibrary.common.exception;

/**
 * A directory subscription could not be established or released. Reported to the caller, the engine keeps
 * running.
 */
public class WatchException extends LibraryException {

    public static final String CODE = "42201";

    public WatchException(String message) {
        super(CODE, message, "Check that the directory exists and is readable");
    }

    public WatchException(String message, Throwable cause) {
        super(CODE, message, "Check that the directory exists and is readable", cause);
    }
}
