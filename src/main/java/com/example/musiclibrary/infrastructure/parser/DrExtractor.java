package com.example.musiclibrary.infrastructure.parser;

import com.example.musiclibrary.common.config.AppDrProperties;
import com.example.musiclibrary.common.exception.DrException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Reads the album-level "Official DR" rating from loudness analyzer logs. Per-track figures such as
 * {@code Track 1: DR12} or {@code DR=12} are ignored; only the official album value counts.
 */
@Component
public class DrExtractor {

    private static final Pattern DR_VALUE_PATTERN = Pattern.compile("^DR(\\d{1,2})$");

    private static final int MIN_DR = 1;
    private static final int MAX_DR = 20;

    private static final List<Pattern> OFFICIAL_PATTERNS = Collections.unmodifiableList(Arrays.asList(
            Pattern.compile("Official DR value:\\s*DR\\s*(\\d{1,2})(?!\\d)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Official EP/Album DR:\\s*(?:DR)?\\s*(\\d{1,2})(?!\\d)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Реальные значения DR:\\s*DR\\s*(\\d{1,2})(?!\\d)",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
    ));

    private static final Charset FALLBACK_CHARSET = Charset.forName("windows-1251");

    private final Set<String> sidecarExtensions;

    public DrExtractor(AppDrProperties appDrProperties) {
        this.sidecarExtensions = appDrProperties.normalizedSidecarExtensions();
    }

    /**
     * Scans line by line; the first line matching any official phrasing with a valid value wins.
     *
     * @throws DrException {@code INVALID_CONTENT} for blank text, {@code INVALID_DR_FORMAT} when only
     *                     out-of-range values were found, {@code NO_DR_VALUE_FOUND} otherwise
     */
    public String extractFromContent(String content) {
        if (content == null || content.trim().isEmpty()) {
            throw new DrException(DrException.Kind.INVALID_CONTENT, "Empty DR sidecar content");
        }
        String rejected = null;
        for (String line : content.split("\\R")) {
            for (Pattern pattern : OFFICIAL_PATTERNS) {
                Matcher matcher = pattern.matcher(line);
                if (!matcher.find()) {
                    continue;
                }
                String candidate = "DR" + matcher.group(1);
                if (validate(candidate)) {
                    return candidate;
                }
                rejected = candidate;
                break;
            }
        }
        if (rejected != null) {
            throw new DrException(DrException.Kind.INVALID_DR_FORMAT, "Out of range DR value " + rejected);
        }
        throw new DrException(DrException.Kind.NO_DR_VALUE_FOUND, "No official DR value in content");
    }

    /**
     * @throws DrException {@code READ_ERROR} when the file cannot be read, otherwise as
     *                     {@link #extractFromContent(String)}
     */
    public String extractFromFile(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new DrException(DrException.Kind.READ_ERROR, "Cannot read DR sidecar " + file, e);
        }
        return extractFromContent(decode(bytes));
    }

    /**
     * True iff the value is canonical {@code DR<n>} with one or two digits and n in [1, 20].
     */
    public boolean validate(String drValue) {
        if (drValue == null) {
            return false;
        }
        Matcher matcher = DR_VALUE_PATTERN.matcher(drValue);
        if (!matcher.matches()) {
            return false;
        }
        int number = Integer.parseInt(matcher.group(1));
        return number >= MIN_DR && number <= MAX_DR;
    }

    /**
     * Text files directly inside the album directory, sorted by name. A missing directory yields an empty
     * list.
     */
    public List<Path> findCandidateFiles(Path albumDir) throws IOException {
        if (albumDir == null || !Files.isDirectory(albumDir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> stream = Files.list(albumDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isSidecar)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public boolean isSidecar(Path file) {
        if (file == null || file.getFileName() == null) {
            return false;
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return sidecarExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    String decode(byte[] bytes) {
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            return new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        }
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xFE) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE);
        }
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
        }
        CharsetDecoder strictUtf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return strictUtf8.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // Legacy Cyrillic analyzer logs
            return new String(bytes, FALLBACK_CHARSET);
        }
    }
}
