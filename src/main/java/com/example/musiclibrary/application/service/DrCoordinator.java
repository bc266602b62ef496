package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.exception.DrException;
import com.example.musiclibrary.infrastructure.parser.DrExtractor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves album DR values: cache first, then the album's sidecar files, writing hits through to the cache
 * and the catalog. Misses are not cached so a log dropped in later is picked up.
 */
@Service
public class DrCoordinator {

    private static final Logger log = LoggerFactory.getLogger(DrCoordinator.class);

    private final DrCache drCache;
    private final DrExtractor drExtractor;
    private final CatalogService catalogService;

    public DrCoordinator(DrCache drCache, DrExtractor drExtractor, CatalogService catalogService) {
        this.drCache = drCache;
        this.drExtractor = drExtractor;
        this.catalogService = catalogService;
    }

    /**
     * @return the DR value, or null when the directory holds no valid official DR value
     */
    public String resolve(Path albumDir) {
        String cached = drCache.get(albumDir);
        if (cached != null) {
            log.debug("DR_CACHE_HIT dir={} value={}", albumDir, cached);
            // Album rows can be pruned and recreated while the cache entry is still live.
            if (!cached.equals(catalogService.getDrValue(albumDir))) {
                boolean stored = catalogService.updateDrValue(albumDir, cached);
                log.info("DR_RESTORED dir={} value={} stored={}", albumDir, cached, stored);
            }
            return cached;
        }
        String value = extract(albumDir);
        if (value == null) {
            return null;
        }
        drCache.put(albumDir, value);
        boolean stored = catalogService.updateDrValue(albumDir, value);
        log.info("DR_RESOLVED dir={} value={} stored={}", albumDir, value, stored);
        return value;
    }

    /**
     * Re-derives the value after a sidecar changed. Clears the catalog value when nothing valid remains.
     */
    public String refresh(Path albumDir) {
        drCache.invalidate(albumDir);
        String value = resolve(albumDir);
        if (value == null && catalogService.getDrValue(albumDir) != null) {
            catalogService.updateDrValue(albumDir, null);
            log.info("DR_CLEARED dir={}", albumDir);
        }
        return value;
    }

    private String extract(Path albumDir) {
        List<Path> candidates;
        try {
            candidates = drExtractor.findCandidateFiles(albumDir);
        } catch (IOException e) {
            log.warn("DR_LIST_FAILED dir={} reason={}", albumDir, e.getMessage());
            return null;
        }
        for (Path candidate : candidates) {
            try {
                return drExtractor.extractFromFile(candidate);
            } catch (DrException e) {
                if (e.getKind() == DrException.Kind.READ_ERROR) {
                    log.warn("DR_READ_FAILED file={} reason={}", candidate, e.getMessage());
                } else {
                    log.debug("DR_CANDIDATE_SKIPPED file={} kind={}", candidate, e.getKind());
                }
            }
        }
        return null;
    }
}
