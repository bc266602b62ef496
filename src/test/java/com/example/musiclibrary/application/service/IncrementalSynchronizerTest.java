package com.example.musiclibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiclibrary.common.config.AppDrProperties;
import com.example.musiclibrary.common.config.AppLibraryProperties;
import com.example.musiclibrary.common.config.AppSyncProperties;
import com.example.musiclibrary.common.exception.SyncException;
import com.example.musiclibrary.domain.model.AlbumGroup;
import com.example.musiclibrary.domain.model.AudioMetadata;
import com.example.musiclibrary.domain.model.DebouncedEvent;
import com.example.musiclibrary.domain.model.LibraryChangedEvent;
import com.example.musiclibrary.domain.model.ScannedTrack;
import com.example.musiclibrary.domain.model.SyncResult;
import com.example.musiclibrary.infrastructure.parser.AudioMetadataParser;
import com.example.musiclibrary.infrastructure.parser.DrExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.context.ApplicationEventPublisher;

class IncrementalSynchronizerTest {

    @TempDir
    Path library;

    private AudioMetadataParser parser;
    private CatalogService catalogService;
    private DrCoordinator drCoordinator;
    private ApplicationEventPublisher eventPublisher;
    private SimpleMeterRegistry meterRegistry;
    private AppSyncProperties syncProperties;
    private IncrementalSynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        parser = mock(AudioMetadataParser.class);
        catalogService = mock(CatalogService.class);
        drCoordinator = mock(DrCoordinator.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        meterRegistry = new SimpleMeterRegistry();
        syncProperties = new AppSyncProperties();
        syncProperties.setMaxBatchSize(2);

        when(catalogService.applyChangedBatch(anyList())).thenAnswer(invocation -> {
            List<AlbumGroup> groups = invocation.getArgument(0);
            SyncResult result = new SyncResult();
            result.setTracksUpserted(groups.stream().mapToInt(group -> group.getTracks().size()).sum());
            return result;
        });

        synchronizer = new IncrementalSynchronizer(syncProperties, new AppLibraryProperties(), parser,
                new MetadataFallbackService(), new CoverArtDetector(), catalogService, drCoordinator,
                new DrExtractor(new AppDrProperties()), eventPublisher, beanProvider(meterRegistry));
    }

    @Test
    void deriveTrackShouldClassifyHighResolutionLossless() throws Exception {
        Path file = audio(library.resolve("Artist").resolve("Album (2020)"), "01 Song.flac");
        AudioMetadata tags = new AudioMetadata();
        tags.setSampleRate(96000);
        tags.setBitsPerSample(24);
        when(parser.parse(any(File.class))).thenReturn(tags);

        ScannedTrack track = synchronizer.deriveTrack(file);

        assertEquals("FLAC", track.getFormat());
        assertEquals("FLAC", track.getCodec());
        assertTrue(track.isLossless());
        assertTrue(track.isHighResolution());
        assertEquals(4L, track.getFileSize());
        assertEquals("Song", track.getMetadata().getTitle());
    }

    @Test
    void deriveTrackShouldKeepLossyCdQualityApart() throws Exception {
        Path file = audio(library.resolve("Artist").resolve("Album"), "02 Song.mp3");
        AudioMetadata tags = new AudioMetadata();
        tags.setSampleRate(44100);
        tags.setBitsPerSample(16);
        tags.setCodec("MPEG-1 Layer 3");
        when(parser.parse(any(File.class))).thenReturn(tags);

        ScannedTrack track = synchronizer.deriveTrack(file);

        assertEquals("MP3", track.getFormat());
        assertEquals("MPEG-1 Layer 3", track.getCodec());
        assertFalse(track.isLossless());
        assertFalse(track.isHighResolution());
    }

    @Test
    void deriveTrackShouldFailForVanishedFile() {
        Path missing = library.resolve("gone.flac");

        SyncException e = assertThrows(SyncException.class, () -> synchronizer.deriveTrack(missing));
        assertEquals(missing, e.getPath());
    }

    @Test
    void albumGroupShouldUseMajorityTitleAndBestFormat() throws IOException {
        Path albumDir = library.resolve("Artist").resolve("Album");
        ScannedTrack first = scanned(albumDir.resolve("01.flac"), "Artist", "Album", 44100, 16);
        ScannedTrack second = scanned(albumDir.resolve("02.flac"), "Artist", "Album", 96000, 24);
        ScannedTrack third = scanned(albumDir.resolve("03.flac"), "Artist", "Album (Bonus)", 48000, 24);
        third.setFormat("WAV");

        AlbumGroup group = synchronizer.buildAlbumGroup(albumDir, Arrays.asList(first, second, third));

        assertEquals("Album", group.getTitle());
        assertEquals("Artist", group.getArtistName());
        assertFalse(group.isCompilation());
        assertEquals("FLAC", group.getFormat());
        assertEquals(Integer.valueOf(24), group.getBitsPerSample());
        assertEquals(Integer.valueOf(96000), group.getSampleRate());
    }

    @Test
    void compilationShouldPreferSharedAlbumArtist() {
        Path albumDir = library.resolve("Soundtrack");
        ScannedTrack first = scanned(albumDir.resolve("01.flac"), "Composer A", "Score", 44100, 16);
        ScannedTrack second = scanned(albumDir.resolve("02.flac"), "Composer B", "Score", 44100, 16);
        first.getMetadata().setAlbumArtist("Orchestra");
        second.getMetadata().setAlbumArtist("Orchestra");

        AlbumGroup group = synchronizer.buildAlbumGroup(albumDir, Arrays.asList(first, second));

        assertTrue(group.isCompilation());
        assertEquals("Orchestra", group.getArtistName());
    }

    @Test
    void changedBatchShouldBeSlicedByWholeAlbums() throws Exception {
        Path artist = library.resolve("Artist");
        Path one = artist.resolve("One (2001)");
        Path two = artist.resolve("Two (2002)");
        audio(one, "01 a.flac");
        audio(one, "02 b.flac");
        audio(two, "01 c.flac");
        audio(two, "02 d.flac");
        audio(two, "cover.jpg");

        SyncResult result = synchronizer.apply(DebouncedEvent.filesChanged(Collections.singletonList(library)));

        assertEquals(4, result.getTracksUpserted());
        verify(catalogService, times(2)).applyChangedBatch(anyList());
        verify(drCoordinator).resolve(one);
        verify(drCoordinator).resolve(two);
        ArgumentCaptor<LibraryChangedEvent> published = ArgumentCaptor.forClass(LibraryChangedEvent.class);
        verify(eventPublisher).publishEvent(published.capture());
        assertEquals(DebouncedEvent.Type.FILES_CHANGED, published.getValue().getTrigger());
        assertEquals(1L, synchronizer.getBatchesApplied());
        assertEquals(1.0, meterRegistry.counter("library.sync.batch.applied", "type", "FILES_CHANGED").count());
    }

    @Test
    void disabledDrParsingShouldSkipSidecars() throws Exception {
        syncProperties.setDrParsingEnabled(false);
        Path album = library.resolve("Artist").resolve("Album");
        Path track = audio(album, "01 a.flac");

        synchronizer.handleChanged(Collections.singletonList(track));

        verify(drCoordinator, never()).resolve(any());
        verify(drCoordinator, never()).refresh(any());
    }

    @Test
    void removedSidecarShouldRefreshItsDirectory() {
        Path album = library.resolve("Artist").resolve("Album");
        when(catalogService.batchRemoveTracks(anyList())).thenReturn(new SyncResult());

        synchronizer.handleRemoved(Arrays.asList(album.resolve("dr.txt"), album.resolve("01 a.flac")));

        verify(drCoordinator).refresh(album);
        verify(catalogService).batchRemoveTracks(Collections.singletonList(album.resolve("01 a.flac")));
    }

    @Test
    void unchangedBatchShouldNotPublish() {
        when(catalogService.batchRemoveTracks(anyList())).thenReturn(new SyncResult());

        synchronizer.apply(DebouncedEvent.filesRemoved(Collections.singletonList(library.resolve("x.flac"))));

        verify(eventPublisher, never()).publishEvent(any(LibraryChangedEvent.class));
    }

    @Test
    void highResolutionThresholds() {
        assertFalse(IncrementalSynchronizer.isHighResolution(48000, 16));
        assertTrue(IncrementalSynchronizer.isHighResolution(48001, 16));
        assertTrue(IncrementalSynchronizer.isHighResolution(44100, 24));
        assertFalse(IncrementalSynchronizer.isHighResolution(null, null));
        assertTrue(IncrementalSynchronizer.isLossless("MP4", "ALAC"));
        assertFalse(IncrementalSynchronizer.isLossless("MP4", "AAC"));
    }

    private ScannedTrack scanned(Path path, String artist, String album, int sampleRate, int bits) {
        AudioMetadata metadata = new AudioMetadata();
        metadata.setArtist(artist);
        metadata.setAlbum(album);
        metadata.setSampleRate(sampleRate);
        metadata.setBitsPerSample(bits);
        ScannedTrack track = new ScannedTrack();
        track.setPath(path);
        track.setFormat("FLAC");
        track.setMetadata(metadata);
        return track;
    }

    private Path audio(Path dir, String name) throws IOException {
        Files.createDirectories(dir);
        return Files.write(dir.resolve(name), new byte[]{1, 2, 3, 4});
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
