package com.example.musiclibrary.infrastructure.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.musiclibrary.common.config.AppDrProperties;
import com.example.musiclibrary.common.exception.DrException;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DrExtractorTest {

    @TempDir
    Path tempDir;

    private DrExtractor drExtractor;

    @BeforeEach
    void setUp() {
        drExtractor = new DrExtractor(new AppDrProperties());
    }

    @Test
    void validateShouldAcceptOnlyCanonicalValuesInRange() {
        assertTrue(drExtractor.validate("DR12"));
        assertTrue(drExtractor.validate("DR05"));
        assertTrue(drExtractor.validate("DR1"));
        assertTrue(drExtractor.validate("DR20"));

        assertFalse(drExtractor.validate("DR0"));
        assertFalse(drExtractor.validate("DR21"));
        assertFalse(drExtractor.validate("DR25"));
        assertFalse(drExtractor.validate("DR"));
        assertFalse(drExtractor.validate("12"));
        assertFalse(drExtractor.validate(""));
        assertFalse(drExtractor.validate("DR 12"));
        assertFalse(drExtractor.validate("DR=12"));
        assertFalse(drExtractor.validate("DR123"));
        assertFalse(drExtractor.validate(null));
    }

    @Test
    void shouldExtractOfficialPhrasings() {
        assertEquals("DR12", drExtractor.extractFromContent("Official DR value: DR12"));
        assertEquals("DR9", drExtractor.extractFromContent("Official DR Value: DR9"));
        assertEquals("DR8", drExtractor.extractFromContent("Official DR value:DR8"));
        assertEquals("DR5", drExtractor.extractFromContent("Official EP/Album DR: 5"));
        assertEquals("DR12", drExtractor.extractFromContent("Official EP/Album DR:12"));
        assertEquals("DR5", drExtractor.extractFromContent("Реальные значения DR:\tDR5"));
        assertEquals("DR12", drExtractor.extractFromContent("foobar2000 log\r\nOfficial DR value: DR12\r\nend"));
    }

    @Test
    void shouldRejectPerTrackValues() {
        String[] perTrack = {
                "Track 1: DR12",
                "DR12\nTrack 2: DR10",
                "Some content with DR8 embedded",
                "DR=12",
                "Dynamic Range: 12"
        };
        for (String content : perTrack) {
            DrException e = assertThrows(DrException.class, () -> drExtractor.extractFromContent(content));
            assertEquals(DrException.Kind.NO_DR_VALUE_FOUND, e.getKind(), content);
        }
    }

    @Test
    void shouldSkipOutOfRangeLineAndKeepScanning() {
        assertEquals("DR7", drExtractor.extractFromContent("Official DR value: DR42\nOfficial DR value: DR7"));

        DrException e = assertThrows(DrException.class,
                () -> drExtractor.extractFromContent("Official DR value: DR0"));
        assertEquals(DrException.Kind.INVALID_DR_FORMAT, e.getKind());
    }

    @Test
    void shouldNotMatchValuesLongerThanTwoDigits() {
        DrException e = assertThrows(DrException.class,
                () -> drExtractor.extractFromContent("Official DR value: DR123"));
        assertEquals(DrException.Kind.NO_DR_VALUE_FOUND, e.getKind());

        assertEquals("DR9", drExtractor.extractFromContent("Official EP/Album DR: 123\nOfficial DR value: DR9"));
    }

    @Test
    void shouldReportBlankContentAsInvalid() {
        DrException e = assertThrows(DrException.class, () -> drExtractor.extractFromContent("  \n "));
        assertEquals(DrException.Kind.INVALID_CONTENT, e.getKind());
    }

    @Test
    void shouldReadWindows1251AndBomFiles() throws IOException {
        Path cyrillic = tempDir.resolve("dr_ru.log");
        Files.write(cyrillic, "Реальные значения DR: DR11".getBytes(Charset.forName("windows-1251")));
        Path bom = tempDir.resolve("dr_bom.txt");
        byte[] text = "Official DR value: DR13".getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[text.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(text, 0, withBom, 3, text.length);
        Files.write(bom, withBom);

        assertEquals("DR11", drExtractor.extractFromFile(cyrillic));
        assertEquals("DR13", drExtractor.extractFromFile(bom));
    }

    @Test
    void shouldReportMissingFileAsReadError() {
        DrException e = assertThrows(DrException.class,
                () -> drExtractor.extractFromFile(tempDir.resolve("absent.txt")));
        assertEquals(DrException.Kind.READ_ERROR, e.getKind());
    }

    @Test
    void findCandidateFilesShouldListSortedTextFilesOnly() throws IOException {
        Files.write(tempDir.resolve("dr.txt"), "Official DR value: DR12".getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("2012-2017_log.TXT"), "x".getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("analysis.log"), "x".getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("notes.md"), "x".getBytes(StandardCharsets.UTF_8));
        Files.write(tempDir.resolve("01 Track.flac"), new byte[]{1, 2, 3});
        Files.write(tempDir.resolve("cover.jpg"), new byte[]{1});
        Files.createDirectory(tempDir.resolve("scans.txt"));

        List<Path> candidates = drExtractor.findCandidateFiles(tempDir);

        assertEquals(4, candidates.size());
        assertEquals(tempDir.resolve("2012-2017_log.TXT"), candidates.get(0));
        assertEquals(tempDir.resolve("analysis.log"), candidates.get(1));
        assertEquals(tempDir.resolve("dr.txt"), candidates.get(2));
        assertEquals(tempDir.resolve("notes.md"), candidates.get(3));
    }

    @Test
    void findCandidateFilesShouldReturnEmptyForMissingDirectory() throws IOException {
        assertTrue(drExtractor.findCandidateFiles(tempDir.resolve("nope")).isEmpty());
        assertTrue(drExtractor.findCandidateFiles(null).isEmpty());
    }
}
