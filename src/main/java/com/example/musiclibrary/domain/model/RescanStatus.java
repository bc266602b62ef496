package com.example.musiclibrary.domain.model;

import lombok.Data;

@Data
public class RescanStatus {

    private boolean running;

    private Long lastStartedAtMs;

    private Long lastFinishedAtMs;

    private SyncResult lastResult;

    private String lastError;
}
