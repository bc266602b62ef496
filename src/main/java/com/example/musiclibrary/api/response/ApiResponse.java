package com.example.musiclibrary.api.response;

import com.example.musiclibrary.common.exception.LibraryException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * Envelope for every HTTP answer. Failures keep HTTP 200 and carry the library error code, with the user
 * action hint when the error has one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String SUCCESS_CODE = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String traceId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "OK", data, null, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return new ApiResponse<>(code, message, null, null, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(String code, String message, String userAction) {
        return new ApiResponse<>(code, message, null, userAction, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(LibraryException e) {
        return fail(e.getCode(), e.getMessage(), e.getUserAction());
    }

    private static String currentTraceId() {
        return MDC.get("requestId");
    }
}
