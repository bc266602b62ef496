package com.example.musiclibrary.application.job;

import com.example.musiclibrary.application.service.LibraryRescanService;
import com.example.musiclibrary.common.config.AppSyncProperties;
import com.example.musiclibrary.common.exception.LibraryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class LibraryRescanJob {

    private static final Logger log = LoggerFactory.getLogger(LibraryRescanJob.class);

    private final AppSyncProperties appSyncProperties;
    private final LibraryRescanService libraryRescanService;

    public LibraryRescanJob(AppSyncProperties appSyncProperties,
                            LibraryRescanService libraryRescanService) {
        this.appSyncProperties = appSyncProperties;
        this.libraryRescanService = libraryRescanService;
    }

    @Scheduled(cron = "${app.sync.rescan-cron:-}")
    public void run() {
        log.info("Library rescan schedule triggered, cron={}", appSyncProperties.getRescanCron());
        try {
            libraryRescanService.trigger();
        } catch (LibraryException e) {
            if (LibraryException.CONFLICT.equals(e.getCode())) {
                log.info("Library rescan skipped due to active rescan");
            } else {
                log.warn("Library rescan submit failed, code={}, msg={}", e.getCode(), e.getMessage());
            }
        } catch (Exception e) {
            log.warn("Library rescan submit failed unexpectedly", e);
        }
    }
}
