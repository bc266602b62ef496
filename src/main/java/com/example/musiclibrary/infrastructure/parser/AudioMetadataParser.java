package com.example.musiclibrary.infrastructure.parser;

import com.example.musiclibrary.domain.model.AudioMetadata;
import java.io.File;

/**
 * Tag-reading collaborator. Implementations report unreadable files by throwing; callers fall back to
 * path-derived metadata.
 */
public interface AudioMetadataParser {

    AudioMetadata parse(File audioFile) throws Exception;
}
