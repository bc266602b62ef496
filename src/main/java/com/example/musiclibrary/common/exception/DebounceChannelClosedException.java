package com.example.musiclibrary.common.exception;

/**
 * The raw event channel feeding the debouncer was closed. Terminates the debouncer loop.
 */
public class DebounceChannelClosedException extends LibraryException {

    public DebounceChannelClosedException(String message, Throwable cause) {
        super("50301", message, null, cause);
    }
}
