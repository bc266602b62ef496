package com.example.musiclibrary.application.service;

import com.example.musiclibrary.domain.model.AudioMetadata;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Fills tag gaps from the file's location, assuming the common {@code Artist/Album (Year)/NN Title.ext}
 * layout with optional {@code CD1}/{@code Disc 2} subfolders.
 */
@Service
public class MetadataFallbackService {

    public static final String UNKNOWN_ARTIST = "Unknown Artist";
    public static final String UNKNOWN_ALBUM = "Unknown Album";

    private static final Pattern TRACK_PREFIX_PATTERN = Pattern.compile("^(\\d{1,3})[\\s.\\-_]+(.+)$");
    private static final Pattern DASH_PATTERN = Pattern.compile("^\\s*(.+?)\\s*-\\s*(.+?)\\s*$");
    private static final Pattern TRAILING_YEAR_PATTERN = Pattern.compile("^(.*?)\\s*[(\\[](\\d{4})[)\\]]$");
    private static final Pattern LEADING_YEAR_PATTERN = Pattern.compile("^(\\d{4})\\s*[-.]\\s*(.+)$");
    private static final Pattern DISC_DIR_PATTERN = Pattern.compile("^(?:cd|disc|disk)\\s*(\\d{1,2})$",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> GENERIC_DIR_NAMES = new HashSet<>(Arrays.asList(
            "music", "audio", "songs", "download", "downloads", "my music", "library",
            "mp3", "flac", "lossless", "hi-res", "various", "misc", "unsorted", "incoming"
    ));

    public AudioMetadata applyFallback(AudioMetadata input, Path file) {
        AudioMetadata metadata = input == null ? new AudioMetadata() : input;
        if (file == null || file.getFileName() == null) {
            fillDefaults(metadata, "unknown-track");
            return metadata;
        }

        String fileBaseName = extractFileBaseName(file);
        String guessedTitle = fileBaseName;
        String guessedArtist = null;
        Integer guessedTrackNumber = null;

        Matcher trackMatcher = TRACK_PREFIX_PATTERN.matcher(fileBaseName);
        if (trackMatcher.matches()) {
            guessedTrackNumber = Integer.parseInt(trackMatcher.group(1));
            guessedTitle = trackMatcher.group(2).trim();
        } else {
            String[] parsed = parseDashSegments(fileBaseName);
            if (parsed != null) {
                guessedArtist = parsed[0];
                guessedTitle = parsed[1];
            }
        }

        Integer guessedDisc = extractDiscNumber(file);
        Path albumDir = resolveAlbumDirectory(file);
        String albumDirName = dirName(albumDir);
        String artistDirName = albumDir == null ? null : dirName(albumDir.getParent());

        String guessedAlbum = null;
        Integer guessedYear = null;
        if (StringUtils.hasText(albumDirName) && !isGenericDirName(albumDirName)) {
            String[] albumAndYear = splitAlbumYear(albumDirName);
            guessedAlbum = albumAndYear[0];
            guessedYear = albumAndYear[1] == null ? null : Integer.valueOf(albumAndYear[1]);
            String[] dashed = parseDashSegments(guessedAlbum);
            if (dashed != null && (artistDirName == null || isGenericDirName(artistDirName))) {
                // "Artist - Album" folder directly under a library root
                if (guessedArtist == null) {
                    guessedArtist = dashed[0];
                }
                guessedAlbum = dashed[1];
            }
        }
        if (guessedArtist == null && StringUtils.hasText(artistDirName) && !isGenericDirName(artistDirName)) {
            guessedArtist = artistDirName;
        }

        if (!StringUtils.hasText(metadata.getTitle())) {
            metadata.setTitle(guessedTitle);
        }
        if (!StringUtils.hasText(metadata.getArtist())) {
            metadata.setArtist(guessedArtist);
        }
        if (!StringUtils.hasText(metadata.getAlbum())) {
            metadata.setAlbum(guessedAlbum);
        }
        if (metadata.getTrackNumber() == null) {
            metadata.setTrackNumber(guessedTrackNumber);
        }
        if (metadata.getDiscNumber() == null) {
            metadata.setDiscNumber(guessedDisc);
        }
        if (metadata.getYear() == null) {
            metadata.setYear(guessedYear);
        }
        fillDefaults(metadata, fileBaseName);
        return metadata;
    }

    /**
     * Directory that represents the album for a track: the parent, or the grandparent when the parent is a
     * disc folder.
     */
    public Path resolveAlbumDirectory(Path file) {
        Path parent = file == null ? null : file.getParent();
        if (parent == null) {
            return null;
        }
        String parentName = dirName(parent);
        if (parentName != null && DISC_DIR_PATTERN.matcher(parentName).matches() && parent.getParent() != null) {
            return parent.getParent();
        }
        return parent;
    }

    private void fillDefaults(AudioMetadata metadata, String fileBaseName) {
        metadata.setTitle(StringUtils.hasText(metadata.getTitle()) ? metadata.getTitle().trim() : fileBaseName);
        metadata.setArtist(StringUtils.hasText(metadata.getArtist()) ? metadata.getArtist().trim() : UNKNOWN_ARTIST);
        metadata.setAlbum(StringUtils.hasText(metadata.getAlbum()) ? metadata.getAlbum().trim() : UNKNOWN_ALBUM);
        if (StringUtils.hasText(metadata.getAlbumArtist())) {
            metadata.setAlbumArtist(metadata.getAlbumArtist().trim());
        } else {
            metadata.setAlbumArtist(null);
        }
        if (metadata.getDiscNumber() == null || metadata.getDiscNumber() <= 0) {
            metadata.setDiscNumber(1);
        }
    }

    private Integer extractDiscNumber(Path file) {
        String parentName = dirName(file.getParent());
        if (parentName == null) {
            return null;
        }
        Matcher matcher = DISC_DIR_PATTERN.matcher(parentName);
        return matcher.matches() ? Integer.valueOf(matcher.group(1)) : null;
    }

    private String[] parseDashSegments(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = DASH_PATTERN.matcher(value);
        if (matcher.matches()) {
            String a = safe(matcher.group(1));
            String b = safe(matcher.group(2));
            if (StringUtils.hasText(a) && StringUtils.hasText(b)) {
                return new String[]{a, b};
            }
        }
        return null;
    }

    String[] splitAlbumYear(String dirName) {
        Matcher trailing = TRAILING_YEAR_PATTERN.matcher(dirName);
        if (trailing.matches() && StringUtils.hasText(trailing.group(1))) {
            return new String[]{trailing.group(1).trim(), trailing.group(2)};
        }
        Matcher leading = LEADING_YEAR_PATTERN.matcher(dirName);
        if (leading.matches()) {
            return new String[]{leading.group(2).trim(), leading.group(1)};
        }
        return new String[]{dirName.trim(), null};
    }

    String extractFileBaseName(Path file) {
        String filename = file.getFileName().toString();
        int dotIndex = filename.lastIndexOf('.');
        if (dotIndex > 0) {
            filename = filename.substring(0, dotIndex);
        }
        String safe = safe(filename);
        return StringUtils.hasText(safe) ? safe : "unknown-track";
    }

    boolean isGenericDirName(String dirName) {
        if (dirName == null || dirName.trim().isEmpty()) {
            return true;
        }
        return GENERIC_DIR_NAMES.contains(dirName.trim().toLowerCase(Locale.ROOT));
    }

    private String dirName(Path dir) {
        if (dir == null || dir.getFileName() == null) {
            return null;
        }
        return safe(dir.getFileName().toString());
    }

    private String safe(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
