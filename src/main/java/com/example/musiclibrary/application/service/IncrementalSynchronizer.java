package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.common.config.AppSyncProperties;
import com.example.musiclibrary.common.exception.SyncException;
import com.example.musiclibrary.common.util.EventChannel;
import com.example.musiclibrary.domain.model.AlbumGroup;
import com.example.musiclibrary.domain.model.AudioMetadata;
import com.example.musiclibrary.domain.model.DebouncedEvent;
import com.example.musiclibrary.domain.model.LibraryChangedEvent;
import com.example.musiclibrary.domain.model.RenamedPath;
import com.example.musiclibrary.domain.model.ScannedTrack;
import com.example.musiclibrary.domain.model.SyncResult;
import com.example.musiclibrary.infrastructure.parser.AudioMetadataParser;
import com.example.musiclibrary.infrastructure.parser.DrExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Applies settled filesystem batches to the catalog without a full rescan.
 *
 * <p>A changed file re-derives its whole album directory so album-level values (majority title and artist,
 * compilation flag, best format) stay consistent. Tag reading happens outside any transaction; catalog writes
 * for one slice of albums run in a single transaction where failing rows are skipped.
 */
@Service
public class IncrementalSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(IncrementalSynchronizer.class);

    static final String VARIOUS_ARTISTS = "Various Artists";

    private static final Map<String, String> FORMAT_BY_EXTENSION;

    static {
        Map<String, String> formats = new HashMap<>();
        formats.put("flac", "FLAC");
        formats.put("mp3", "MP3");
        formats.put("aac", "AAC");
        formats.put("m4a", "MP4");
        formats.put("opus", "Opus");
        formats.put("ogg", "Ogg");
        formats.put("wav", "WAV");
        formats.put("aiff", "AIFF");
        formats.put("aif", "AIFF");
        formats.put("mpc", "MPC");
        FORMAT_BY_EXTENSION = Collections.unmodifiableMap(formats);
    }

    private static final List<String> LOSSLESS_MARKERS = Collections.unmodifiableList(
            Arrays.asList("FLAC", "ALAC", "PCM", "WAV", "AIFF", "DSD"));

    private final AppSyncProperties syncProperties;
    private final Set<String> audioExtensions;
    private final AudioMetadataParser audioMetadataParser;
    private final MetadataFallbackService metadataFallbackService;
    private final CoverArtDetector coverArtDetector;
    private final CatalogService catalogService;
    private final DrCoordinator drCoordinator;
    private final DrExtractor drExtractor;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    private final ReentrantLock syncLock = new ReentrantLock();
    private final AtomicLong batchesApplied = new AtomicLong();
    private final AtomicLong filesFailed = new AtomicLong();
    private volatile long lastBatchAtMs;

    public IncrementalSynchronizer(AppSyncProperties syncProperties,
                                   AppLibraryProperties libraryProperties,
                                   AudioMetadataParser audioMetadataParser,
                                   MetadataFallbackService metadataFallbackService,
                                   CoverArtDetector coverArtDetector,
                                   CatalogService catalogService,
                                   DrCoordinator drCoordinator,
                                   DrExtractor drExtractor,
                                   ApplicationEventPublisher eventPublisher,
                                   ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.syncProperties = syncProperties;
        this.audioExtensions = libraryProperties.normalizedAudioExtensions();
        this.audioMetadataParser = audioMetadataParser;
        this.metadataFallbackService = metadataFallbackService;
        this.coverArtDetector = coverArtDetector;
        this.catalogService = catalogService;
        this.drCoordinator = drCoordinator;
        this.drExtractor = drExtractor;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * Consumes the debounced channel until it is closed. A failing batch is logged and the loop continues.
     */
    public void consume(EventChannel<DebouncedEvent> channel) {
        log.info("SYNC_LOOP_STARTED channel={}", channel.getName());
        while (true) {
            DebouncedEvent event;
            try {
                event = channel.receive(syncProperties.getPollIntervalMs());
            } catch (EventChannel.ChannelClosedException e) {
                log.info("SYNC_LOOP_STOPPED reason=channel-closed");
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("SYNC_LOOP_STOPPED reason=interrupted");
                return;
            }
            if (event == null) {
                continue;
            }
            try {
                apply(event);
            } catch (RuntimeException e) {
                log.error("SYNC_BATCH_FAILED type={} size={}", event.getType(), event.size(), e);
            }
        }
    }

    public SyncResult apply(DebouncedEvent event) {
        SyncResult result;
        switch (event.getType()) {
            case FILES_CHANGED:
                result = handleChanged(event.getPaths());
                break;
            case FILES_REMOVED:
                result = handleRemoved(event.getPaths());
                break;
            case FILES_RENAMED:
                result = handleRenamed(event.getRenames());
                break;
            default:
                throw new IllegalArgumentException("Unsupported batch type " + event.getType());
        }
        batchesApplied.incrementAndGet();
        lastBatchAtMs = System.currentTimeMillis();
        incrementCounter("library.sync.batch.applied", 1, "type", event.getType().name());
        log.info("SYNC_BATCH_APPLIED type={} size={} upserted={} removed={} failed={} albumsPruned={} "
                        + "artistsPruned={} drResolved={}",
                event.getType(), event.size(), result.getTracksUpserted(), result.getTracksRemoved(),
                result.getFilesFailed(), result.getAlbumsPruned(), result.getArtistsPruned(),
                result.getDrValuesResolved());
        if (result.hasChanges()) {
            eventPublisher.publishEvent(new LibraryChangedEvent(this, event.getType(), result));
        }
        return result;
    }

    public SyncResult handleChanged(List<Path> paths) {
        return withLock(() -> doHandleChanged(paths));
    }

    public SyncResult handleRemoved(List<Path> paths) {
        return withLock(() -> doHandleRemoved(paths));
    }

    /**
     * Renames are applied as removal of the source followed by a change at the destination. Pairing from the
     * OS is not reliable enough to carry rows over in place.
     */
    public SyncResult handleRenamed(List<RenamedPath> renames) {
        return withLock(() -> {
            List<Path> from = renames.stream().map(RenamedPath::getFrom).collect(Collectors.toList());
            List<Path> to = renames.stream().map(RenamedPath::getTo).collect(Collectors.toList());
            SyncResult result = doHandleRemoved(from);
            result.merge(doHandleChanged(to));
            return result;
        });
    }

    /**
     * Runs work with incremental batches held off, used by full rescans.
     */
    public <T> T withLock(Supplier<T> work) {
        syncLock.lock();
        try {
            return work.get();
        } finally {
            syncLock.unlock();
        }
    }

    public long getBatchesApplied() {
        return batchesApplied.get();
    }

    public long getFilesFailed() {
        return filesFailed.get();
    }

    public long getLastBatchAtMs() {
        return lastBatchAtMs;
    }

    private SyncResult doHandleChanged(List<Path> paths) {
        SyncResult result = new SyncResult();
        Set<Path> sidecarDirs = new LinkedHashSet<>();
        Set<Path> albumDirs = new LinkedHashSet<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                for (Path file : listAudioFiles(path, Integer.MAX_VALUE)) {
                    addAlbumDir(albumDirs, file);
                }
            } else if (drExtractor.isSidecar(path)) {
                if (path.getParent() != null) {
                    sidecarDirs.add(path.getParent());
                }
            } else if (isAudioFile(path)) {
                if (Files.isRegularFile(path)) {
                    addAlbumDir(albumDirs, path);
                } else {
                    log.debug("SYNC_CHANGED_PATH_GONE path={}", path);
                }
            }
        }

        List<AlbumGroup> slice = new ArrayList<>();
        int sliceFiles = 0;
        for (Path albumDir : albumDirs) {
            AlbumGroup group = deriveAlbumGroup(albumDir, result);
            if (group == null) {
                continue;
            }
            if (!slice.isEmpty() && sliceFiles + group.getTracks().size() > maxBatchSize()) {
                result.merge(catalogService.applyChangedBatch(slice));
                slice = new ArrayList<>();
                sliceFiles = 0;
            }
            slice.add(group);
            sliceFiles += group.getTracks().size();
        }
        if (!slice.isEmpty()) {
            result.merge(catalogService.applyChangedBatch(slice));
        }

        if (syncProperties.isDrParsingEnabled()) {
            for (Path albumDir : albumDirs) {
                if (drCoordinator.resolve(albumDir) != null) {
                    result.setDrValuesResolved(result.getDrValuesResolved() + 1);
                }
            }
            for (Path dir : sidecarDirs) {
                if (!albumDirs.contains(dir) && drCoordinator.refresh(dir) != null) {
                    result.setDrValuesResolved(result.getDrValuesResolved() + 1);
                }
            }
        }
        recordFailures(result);
        return result;
    }

    private SyncResult doHandleRemoved(List<Path> paths) {
        SyncResult result = new SyncResult();
        Set<Path> sidecarDirs = new LinkedHashSet<>();
        List<Path> trackPaths = new ArrayList<>();
        for (Path path : paths) {
            if (drExtractor.isSidecar(path)) {
                if (path.getParent() != null) {
                    sidecarDirs.add(path.getParent());
                }
            } else {
                trackPaths.add(path);
            }
        }
        int batchSize = maxBatchSize();
        for (int start = 0; start < trackPaths.size(); start += batchSize) {
            List<Path> slice = trackPaths.subList(start, Math.min(trackPaths.size(), start + batchSize));
            result.merge(catalogService.batchRemoveTracks(slice));
        }
        if (syncProperties.isDrParsingEnabled()) {
            for (Path dir : sidecarDirs) {
                drCoordinator.refresh(dir);
            }
        }
        return result;
    }

    private AlbumGroup deriveAlbumGroup(Path albumDir, SyncResult result) {
        List<ScannedTrack> tracks = new ArrayList<>();
        for (Path file : listAlbumFiles(albumDir)) {
            try {
                tracks.add(deriveTrack(file));
            } catch (SyncException e) {
                result.setFilesFailed(result.getFilesFailed() + 1);
                log.warn("SYNC_FILE_SKIPPED path={} reason={}", e.getPath(), e.getMessage());
            }
        }
        if (tracks.isEmpty()) {
            return null;
        }
        return buildAlbumGroup(albumDir, tracks);
    }

    ScannedTrack deriveTrack(Path file) {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new SyncException(file, "Cannot stat file: " + e.getMessage(), e);
        }
        AudioMetadata tags = null;
        try {
            tags = audioMetadataParser.parse(file.toFile());
        } catch (Exception e) {
            log.warn("SYNC_TAG_READ_FAILED path={} reason={} action=path-fallback", file, e.getMessage());
        }
        AudioMetadata metadata = metadataFallbackService.applyFallback(tags, file);

        ScannedTrack track = new ScannedTrack();
        track.setPath(file);
        track.setFileSize(size);
        track.setMetadata(metadata);
        String format = formatOf(file);
        track.setFormat(format);
        track.setCodec(StringUtils.hasText(metadata.getCodec()) ? metadata.getCodec() : format);
        track.setLossless(isLossless(format, track.getCodec()));
        track.setHighResolution(isHighResolution(metadata.getSampleRate(), metadata.getBitsPerSample()));
        return track;
    }

    AlbumGroup buildAlbumGroup(Path albumDir, List<ScannedTrack> tracks) {
        AlbumGroup group = new AlbumGroup();
        group.setDirectory(albumDir);
        group.setTracks(tracks);

        Set<String> distinctArtists = tracks.stream()
                .map(track -> track.getMetadata().getArtist())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        boolean compilation = distinctArtists.size() > 1;
        group.setCompilation(compilation);
        group.setTitle(majority(tracks.stream().map(t -> t.getMetadata().getAlbum()).collect(Collectors.toList()),
                MetadataFallbackService.UNKNOWN_ALBUM));
        if (compilation) {
            group.setArtistName(majority(tracks.stream().map(t -> t.getMetadata().getAlbumArtist())
                    .collect(Collectors.toList()), VARIOUS_ARTISTS));
        } else {
            group.setArtistName(majority(new ArrayList<>(distinctArtists), MetadataFallbackService.UNKNOWN_ARTIST));
        }
        group.setYear(tracks.stream().map(t -> t.getMetadata().getYear())
                .filter(year -> year != null && year > 0).findFirst().orElse(null));
        group.setGenre(tracks.stream().map(t -> t.getMetadata().getGenre())
                .filter(StringUtils::hasText).findFirst().orElse(null));

        ScannedTrack best = tracks.stream().max(Comparator
                .comparingInt((ScannedTrack t) -> orZero(t.getMetadata().getBitsPerSample()))
                .thenComparingInt(t -> orZero(t.getMetadata().getSampleRate())))
                .orElse(tracks.get(0));
        group.setFormat(best.getFormat());
        group.setBitsPerSample(best.getMetadata().getBitsPerSample());
        group.setSampleRate(best.getMetadata().getSampleRate());
        group.setArtworkPath(coverArtDetector.detectCoverInDirectory(albumDir));
        return group;
    }

    private List<Path> listAlbumFiles(Path albumDir) {
        return listAudioFiles(albumDir, 2).stream()
                .filter(file -> albumDir.equals(metadataFallbackService.resolveAlbumDirectory(file)))
                .collect(Collectors.toList());
    }

    List<Path> listAudioFiles(Path dir, int maxDepth) {
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> stream = Files.walk(dir, maxDepth)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isAudioFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            log.warn("SYNC_LIST_FAILED dir={} reason={}", dir, e.getMessage());
            return Collections.emptyList();
        }
    }

    boolean isAudioFile(Path path) {
        String extension = extensionOf(path);
        return !extension.isEmpty() && audioExtensions.contains(extension);
    }

    private void addAlbumDir(Set<Path> albumDirs, Path file) {
        Path albumDir = metadataFallbackService.resolveAlbumDirectory(file);
        if (albumDir != null) {
            albumDirs.add(albumDir);
        }
    }

    private String formatOf(Path file) {
        String extension = extensionOf(file);
        String format = FORMAT_BY_EXTENSION.get(extension);
        return format != null ? format : extension.toUpperCase(Locale.ROOT);
    }

    static boolean isLossless(String format, String codec) {
        String combined = ((format == null ? "" : format) + " " + (codec == null ? "" : codec)).toUpperCase(Locale.ROOT);
        for (String marker : LOSSLESS_MARKERS) {
            if (combined.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    static boolean isHighResolution(Integer sampleRate, Integer bitsPerSample) {
        return (sampleRate != null && sampleRate > 48000) || (bitsPerSample != null && bitsPerSample > 16);
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private String majority(List<String> values, String fallback) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        String winner = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                winner = entry.getKey();
                best = entry.getValue();
            }
        }
        return winner == null ? fallback : winner;
    }

    private String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private int maxBatchSize() {
        return Math.max(1, syncProperties.getMaxBatchSize());
    }

    private void recordFailures(SyncResult result) {
        if (result.getFilesFailed() > 0) {
            filesFailed.addAndGet(result.getFilesFailed());
            incrementCounter("library.sync.file.failed", result.getFilesFailed());
        }
    }

    private void incrementCounter(String name, double value, String... tags) {
        if (meterRegistry == null || value <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment(value);
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }
}
