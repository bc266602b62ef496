package com.example.musiclibrary.common.exception;

import com.example.musiclibrary.api.response.ApiResponse;
import javax.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(WatchException.class)
    public ApiResponse<Void> handleWatchException(WatchException e) {
        log.warn("WATCH_REQUEST_FAILED message={}", e.getMessage());
        return ApiResponse.fail(e);
    }

    @ExceptionHandler(LibraryException.class)
    public ApiResponse<Void> handleLibraryException(LibraryException e) {
        return ApiResponse.fail(e);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class,
            ConstraintViolationException.class, MissingServletRequestParameterException.class})
    public ApiResponse<Void> handleValidationException(Exception e) {
        return ApiResponse.fail("400", "Invalid request parameters");
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ApiResponse<Void> handleDuplicateKeyException(DuplicateKeyException e) {
        return ApiResponse.fail("409", "Duplicate catalog entry");
    }

    @ExceptionHandler(Exception.class)
    public ApiResponse<Void> handleException(Exception e) {
        log.error("Unhandled exception", e);
        return ApiResponse.fail("500", "Internal error");
    }
}
