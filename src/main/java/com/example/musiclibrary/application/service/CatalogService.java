package com.example.musiclibrary.application.service;

import com.example.musiclibrary.common.exception.LibraryException;
import com.example.musiclibrary.domain.model.AlbumGroup;
import com.example.musiclibrary.domain.model.PruneResult;
import com.example.musiclibrary.domain.model.ScannedTrack;
import com.example.musiclibrary.domain.model.SearchResults;
import com.example.musiclibrary.domain.model.SyncResult;
import com.example.musiclibrary.infrastructure.persistence.entity.AlbumEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.musiclibrary.infrastructure.persistence.entity.TrackEntity;
import com.example.musiclibrary.infrastructure.persistence.mapper.AlbumMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.ArtistMapper;
import com.example.musiclibrary.infrastructure.persistence.mapper.TrackMapper;
import java.io.File;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;
import org.springframework.util.StringUtils;

/**
 * Typed read/write surface over artists, albums and tracks.
 *
 * <p>Batch writes run in one transaction. Each album group and each track inside it gets its own savepoint,
 * so a failing row is rolled back and skipped while the rest of the batch commits.
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final ArtistMapper artistMapper;
    private final AlbumMapper albumMapper;
    private final TrackMapper trackMapper;

    public CatalogService(ArtistMapper artistMapper, AlbumMapper albumMapper, TrackMapper trackMapper) {
        this.artistMapper = artistMapper;
        this.albumMapper = albumMapper;
        this.trackMapper = trackMapper;
    }

    // ---- reads ----

    public List<AlbumEntity> getAlbums(String filter) {
        return albumMapper.selectAll(normalizeFilter(filter));
    }

    public List<ArtistEntity> getArtists(String filter) {
        return artistMapper.selectAll(normalizeFilter(filter));
    }

    public AlbumEntity getAlbum(Long albumId) {
        AlbumEntity album = albumMapper.selectById(albumId);
        if (album == null) {
            throw new LibraryException(LibraryException.NOT_FOUND, "Album not found: " + albumId);
        }
        return album;
    }

    public ArtistEntity getArtist(Long artistId) {
        ArtistEntity artist = artistMapper.selectById(artistId);
        if (artist == null) {
            throw new LibraryException(LibraryException.NOT_FOUND, "Artist not found: " + artistId);
        }
        return artist;
    }

    public List<AlbumEntity> getAlbumsByArtist(Long artistId) {
        getArtist(artistId);
        return albumMapper.selectByArtistId(artistId);
    }

    public List<TrackEntity> getTracksByAlbum(Long albumId) {
        getAlbum(albumId);
        return trackMapper.selectByAlbumId(albumId);
    }

    public List<TrackEntity> getTracksByArtist(Long artistId) {
        getArtist(artistId);
        return trackMapper.selectByArtistId(artistId);
    }

    public TrackEntity getTrackByPath(Path path) {
        return trackMapper.selectByPath(path.toString());
    }

    public AlbumEntity getAlbumByPath(Path albumDir) {
        return albumMapper.selectByPath(albumDir.toString());
    }

    /**
     * Case-sensitive substring search over artist names, album titles and track titles.
     */
    public SearchResults search(String query) {
        SearchResults results = new SearchResults();
        String filter = normalizeFilter(query);
        if (filter == null) {
            return results;
        }
        results.setArtists(artistMapper.selectAll(filter));
        results.setAlbums(albumMapper.selectAll(filter));
        results.setTracks(trackMapper.selectByTitle(filter));
        return results;
    }

    public long countArtists() {
        return artistMapper.countAll();
    }

    public long countAlbums() {
        return albumMapper.countAll();
    }

    public long countTracks() {
        return trackMapper.countAll();
    }

    public List<String> listTrackPathsUnder(Path directory) {
        return trackMapper.selectPathsUnderPrefix(directoryPrefix(directory));
    }

    // ---- writes ----

    /**
     * Resolves the artist and album of every group and upserts its tracks keyed by path, then prunes albums
     * and artists left without children.
     */
    @Transactional(rollbackFor = Exception.class)
    public SyncResult applyChangedBatch(List<AlbumGroup> groups) {
        SyncResult result = new SyncResult();
        for (AlbumGroup group : groups) {
            TransactionStatus status = TransactionAspectSupport.currentTransactionStatus();
            Object groupSavepoint = status.createSavepoint();
            Long albumId;
            try {
                albumId = batchUpdateAlbum(group);
                status.releaseSavepoint(groupSavepoint);
            } catch (DataAccessException e) {
                status.rollbackToSavepoint(groupSavepoint);
                result.setFilesFailed(result.getFilesFailed() + group.getTracks().size());
                log.warn("SYNC_ALBUM_FAILED dir={} tracks={} reason={}",
                        group.getDirectory(), group.getTracks().size(), e.getMessage());
                continue;
            }
            SyncResult trackResult = batchUpsertTracks(albumId, group.getTracks());
            result.merge(trackResult);
        }
        PruneResult pruned = pruneOrphans();
        result.setAlbumsPruned(result.getAlbumsPruned() + pruned.getAlbumsRemoved());
        result.setArtistsPruned(result.getArtistsPruned() + pruned.getArtistsRemoved());
        return result;
    }

    /**
     * Removes tracks for the given paths. A path that is not a known track file is treated as a directory
     * and every track beneath it is removed. Orphans are pruned afterwards.
     */
    @Transactional(rollbackFor = Exception.class)
    public SyncResult batchRemoveTracks(Collection<Path> paths) {
        SyncResult result = new SyncResult();
        for (Path path : paths) {
            String value = path.toString();
            int removed = trackMapper.deleteByPath(value);
            if (removed == 0) {
                removed = trackMapper.deleteUnderPrefix(directoryPrefix(path));
                if (removed > 0) {
                    log.info("SYNC_DIRECTORY_REMOVED dir={} tracks={}", path, removed);
                }
            }
            result.setTracksRemoved(result.getTracksRemoved() + removed);
        }
        PruneResult pruned = pruneOrphans();
        result.setAlbumsPruned(pruned.getAlbumsRemoved());
        result.setArtistsPruned(pruned.getArtistsRemoved());
        return result;
    }

    /**
     * Deletes albums with no tracks, then artists with no albums. Two fixed passes cover the whole
     * track &rarr; album &rarr; artist chain.
     */
    @Transactional(rollbackFor = Exception.class)
    public PruneResult pruneOrphans() {
        int albums = albumMapper.deleteWithoutTracks();
        int artists = artistMapper.deleteWithoutAlbums();
        if (albums > 0 || artists > 0) {
            log.info("CATALOG_PRUNED albums={} artists={}", albums, artists);
        }
        return new PruneResult(albums, artists);
    }

    public String getDrValue(Path albumDir) {
        return albumMapper.selectDrValueByPath(albumDir.toString());
    }

    /**
     * Stores the DR value for the album at this directory; null clears it.
     *
     * @return whether an album row exists for the directory
     */
    public boolean updateDrValue(Path albumDir, String drValue) {
        return albumMapper.updateDrValueByPath(albumDir.toString(), drValue) > 0;
    }

    private Long batchUpdateAlbum(AlbumGroup group) {
        ArtistEntity artist = getOrCreateArtist(group.getArtistName());
        String path = group.getDirectory().toString();

        AlbumEntity album = albumMapper.selectByNaturalKey(artist.getId(), group.getTitle(), group.getYear());
        AlbumEntity pathOwner = albumMapper.selectByPath(path);
        if (album == null) {
            // Retagged album in the same directory keeps its row and its DR value.
            album = pathOwner;
        } else if (!path.equals(album.getPath()) && (pathOwner != null
                || trackMapper.countByAlbumOutsidePrefix(album.getId(), directoryPrefix(group.getDirectory())) > 0)) {
            // Same album split over two directories: the row keeps its path, the directory's own row is pruned
            // once its tracks move over.
            log.info("SYNC_ALBUM_MERGED dir={} albumId={} albumPath={} replacedAlbumId={}", path, album.getId(),
                    album.getPath(), pathOwner == null ? null : pathOwner.getId());
            return album.getId();
        }
        boolean exists = album != null;
        if (!exists) {
            album = new AlbumEntity();
        }
        album.setArtistId(artist.getId());
        album.setTitle(group.getTitle());
        album.setYear(group.getYear());
        album.setGenre(group.getGenre());
        album.setCompilation(group.isCompilation());
        album.setPath(path);
        album.setArtworkPath(group.getArtworkPath());
        album.setFormat(group.getFormat());
        album.setBitsPerSample(group.getBitsPerSample());
        album.setSampleRate(group.getSampleRate());
        if (exists) {
            albumMapper.update(album);
        } else {
            albumMapper.insert(album);
            log.debug("CATALOG_ALBUM_CREATED albumId={} title={} path={}", album.getId(), album.getTitle(), path);
        }
        return album.getId();
    }

    private ArtistEntity getOrCreateArtist(String name) {
        ArtistEntity artist = artistMapper.selectByName(name);
        if (artist != null) {
            return artist;
        }
        artist = new ArtistEntity();
        artist.setName(name);
        artistMapper.insert(artist);
        log.debug("CATALOG_ARTIST_CREATED artistId={} name={}", artist.getId(), name);
        return artist;
    }

    private SyncResult batchUpsertTracks(Long albumId, List<ScannedTrack> tracks) {
        SyncResult result = new SyncResult();
        TransactionStatus status = TransactionAspectSupport.currentTransactionStatus();
        for (ScannedTrack track : tracks) {
            Object savepoint = status.createSavepoint();
            try {
                trackMapper.upsert(toEntity(albumId, track));
                status.releaseSavepoint(savepoint);
                result.setTracksUpserted(result.getTracksUpserted() + 1);
            } catch (DataAccessException e) {
                status.rollbackToSavepoint(savepoint);
                result.setFilesFailed(result.getFilesFailed() + 1);
                log.warn("SYNC_TRACK_FAILED path={} reason={}", track.getPath(), e.getMessage());
            }
        }
        return result;
    }

    private TrackEntity toEntity(Long albumId, ScannedTrack track) {
        TrackEntity entity = new TrackEntity();
        entity.setAlbumId(albumId);
        entity.setPath(track.getPath().toString());
        entity.setTitle(track.getMetadata().getTitle());
        entity.setTrackNumber(track.getMetadata().getTrackNumber());
        entity.setDiscNumber(track.getMetadata().getDiscNumber() == null ? 1 : track.getMetadata().getDiscNumber());
        entity.setDurationMs(track.getMetadata().getDurationMs() == null ? 0L : track.getMetadata().getDurationMs());
        entity.setFileSize(track.getFileSize());
        entity.setFormat(track.getFormat());
        entity.setCodec(track.getCodec());
        entity.setSampleRate(track.getMetadata().getSampleRate());
        entity.setBitsPerSample(track.getMetadata().getBitsPerSample());
        entity.setChannels(track.getMetadata().getChannels());
        entity.setIsLossless(track.isLossless());
        entity.setIsHighResolution(track.isHighResolution());
        return entity;
    }

    static String directoryPrefix(Path directory) {
        String value = directory.toString();
        return value.endsWith(File.separator) ? value : value + File.separator;
    }

    private String normalizeFilter(String filter) {
        return StringUtils.hasText(filter) ? filter : null;
    }
}
