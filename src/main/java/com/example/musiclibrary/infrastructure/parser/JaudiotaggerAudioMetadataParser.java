package com.example.musiclibrary.infrastructure.parser;

import com.example.musiclibrary.domain.model.AudioMetadata;
import java.io.File;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerAudioMetadataParser implements AudioMetadataParser {

    private static final Pattern FIRST_INTEGER_PATTERN = Pattern.compile("(\\d+)");

    @Override
    public AudioMetadata parse(File audioFile) throws Exception {
        AudioFile parsed = AudioFileIO.read(audioFile);
        Tag tag = parsed.getTag();
        AudioHeader header = parsed.getAudioHeader();

        AudioMetadata metadata = new AudioMetadata();
        metadata.setTitle(safeTagValue(tag, FieldKey.TITLE));
        metadata.setArtist(safeTagValue(tag, FieldKey.ARTIST));
        metadata.setAlbum(safeTagValue(tag, FieldKey.ALBUM));
        metadata.setAlbumArtist(safeTagValue(tag, FieldKey.ALBUM_ARTIST));
        metadata.setTrackNumber(parseInteger(safeTagValue(tag, FieldKey.TRACK)));
        metadata.setDiscNumber(parseInteger(safeTagValue(tag, FieldKey.DISC_NO)));
        metadata.setYear(parseInteger(safeTagValue(tag, FieldKey.YEAR)));
        metadata.setGenre(safeTagValue(tag, FieldKey.GENRE));

        if (header != null) {
            metadata.setDurationMs(Math.round(header.getPreciseTrackLength() * 1000D));
            metadata.setSampleRate(parseInteger(header.getSampleRate()));
            metadata.setChannels(parseInteger(header.getChannels()));
            int bits = header.getBitsPerSample();
            metadata.setBitsPerSample(bits > 0 ? bits : null);
            String encoding = header.getEncodingType();
            metadata.setCodec(encoding == null || encoding.trim().isEmpty() ? null : encoding.trim());
        }
        return metadata;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        String value;
        try {
            value = tag.getFirst(fieldKey);
        } catch (UnsupportedOperationException e) {
            // Some container formats reject fields they cannot carry.
            return null;
        }
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Integer parseInteger(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        Matcher matcher = FIRST_INTEGER_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
