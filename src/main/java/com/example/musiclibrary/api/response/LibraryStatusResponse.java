package com.example.musiclibrary.api.response;

import com.example.musiclibrary.domain.model.RescanStatus;
import java.util.List;
import lombok.Data;

@Data
public class LibraryStatusResponse {

    private boolean watching;

    private List<String> directories;

    private long droppedEvents;

    private long batchesApplied;

    private long filesFailed;

    private Long lastBatchAtMs;

    private long artistCount;

    private long albumCount;

    private long trackCount;

    private RescanStatus rescan;
}
