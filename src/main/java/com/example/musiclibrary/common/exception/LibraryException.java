package com.example.musiclibrary.common.exception;

/**
 * Base unchecked failure of the library engine. Carries an API error code and an optional hint that the
 * HTTP layer forwards to the user.
 */
public class LibraryException extends RuntimeException {

    public static final String NOT_FOUND = "40401";
    public static final String CONFLICT = "40901";
    public static final String BAD_REQUEST = "40001";

    private final String code;
    private final String userAction;

    public LibraryException(String code, String message) {
        this(code, message, null, null);
    }

    public LibraryException(String code, String message, String userAction) {
        this(code, message, userAction, null);
    }

    public LibraryException(String code, String message, String userAction, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.userAction = userAction;
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}
