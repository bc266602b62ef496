package com.example.musiclibrary.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sync")
public class AppSyncProperties {

    /**
     * Files applied per transaction. Larger drops are processed in sequential slices of this size.
     */
    private int maxBatchSize = 50;

    private boolean drParsingEnabled = true;

    /**
     * Full reconciliation schedule. "-" disables the job.
     */
    private String rescanCron = "-";

    /**
     * How long the synchronizer waits on an empty channel before re-checking for shutdown.
     */
    private long pollIntervalMs = 200;
}
