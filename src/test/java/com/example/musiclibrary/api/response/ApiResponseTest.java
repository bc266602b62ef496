package com.example.musiclibrary.api.response;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.musiclibrary.common.exception.LibraryException;
import com.example.musiclibrary.common.exception.WatchException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ApiResponseTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void failShouldCarryLibraryErrorCodeAndUserAction() {
        MDC.put("requestId", "req-1");

        ApiResponse<Void> response = ApiResponse.fail(new WatchException("Not a directory: /missing"));

        assertEquals(WatchException.CODE, response.getCode());
        assertEquals("Not a directory: /missing", response.getMessage());
        assertEquals("Check that the directory exists and is readable", response.getUserAction());
        assertEquals("req-1", response.getTraceId());
        assertNull(response.getData());
    }

    @Test
    void successShouldUseZeroCode() {
        ApiResponse<String> response = ApiResponse.success("ok");

        assertEquals(ApiResponse.SUCCESS_CODE, response.getCode());
        assertEquals("ok", response.getData());
        assertNull(response.getUserAction());
        assertEquals(LibraryException.NOT_FOUND, ApiResponse.fail(
                new LibraryException(LibraryException.NOT_FOUND, "Album not found: 7")).getCode());
    }
}
