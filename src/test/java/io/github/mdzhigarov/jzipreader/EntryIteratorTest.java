package io.github.mdzhigarov.jzipreader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.mdzhigarov.jzipreader.UnsupportedFeatureException.Feature;
import io.github.mdzhigarov.jzipreader.format.CentralDirectoryHeader;
import io.github.mdzhigarov.jzipreader.format.EndOfCentralDirectoryRecord;
import java.io.IOException;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for EntryIterator.
 */
class EntryIteratorTest {

    @Test
    @DisplayName("Should yield every entry in storage order, then end")
    void shouldYieldEntriesInOrder() throws IOException {
        // Given
        byte[] zip = ZipFileGenerator.newArchive()
            .stored("first.txt", "1")
            .deflated("second.txt", "2")
            .stored("third/", new byte[0])
            .build();

        try (ZipBrowser browser = ZipBrowser.newBuilder(zip).build()) {
            // When
            EntryIterator iterator = browser.entries();

            // Then
            assertEquals("first.txt", iterator.next().getName());
            assertEquals("second.txt", iterator.next().getName());
            ZipEntry third = iterator.next();
            assertEquals("third/", third.getName());
            assertTrue(third.isDirectory());

            assertFalse(iterator.hasNext());
            assertEquals(3, iterator.getIndex());
            assertThrows(NoSuchElementException.class, iterator::next);
        }
    }

    @Test
    @DisplayName("Should advance by the full size of each header")
    void shouldAdvanceByHeaderSize() throws IOException {
        byte[] zip = ZipFileGenerator.newArchive()
            .raw("commented.txt", new byte[] {'x'}, 0, ZipFileGenerator.crc32(new byte[] {'x'}), 1,
                h -> h.fileComment("a comment").extraField(new byte[] {1, 0, 0, 0}))
            .stored("next.txt", "y")
            .build();

        try (ZipBrowser browser = ZipBrowser.newBuilder(zip).build()) {
            EntryIterator iterator = browser.entries();
            long start = iterator.getOffset();

            ZipEntry first = iterator.next();

            assertEquals("a comment", first.getComment());
            assertEquals(start + CentralDirectoryHeader.FIXED_SIZE + 13 + 4 + 9, iterator.getOffset());
            assertEquals("next.txt", iterator.next().getName());
        }
    }

    @Test
    @DisplayName("Should end the iteration at the first damaged header until reset")
    void shouldStopAtFirstFailure() throws IOException {
        // Given - the signature of the second central directory header is overwritten
        byte[] zip = ZipFileGenerator.createMultiFileZip();
        long secondHeader;
        try (ZipBrowser browser = ZipBrowser.newBuilder(zip).build()) {
            EntryIterator iterator = browser.entries();
            iterator.next();
            secondHeader = iterator.getOffset();
        }
        zip[(int) secondHeader] = 'X';

        try (ZipBrowser browser = ZipBrowser.newBuilder(zip).build()) {
            EntryIterator iterator = browser.entries();

            // When
            assertEquals("file1.txt", iterator.next().getName());
            InvalidSignatureException e = assertThrows(InvalidSignatureException.class, iterator::next);

            // Then
            assertEquals(secondHeader, e.getOffset());
            assertFalse(iterator.hasNext());
            assertThrows(NoSuchElementException.class, iterator::next);

            iterator.reset();
            assertTrue(iterator.hasNext());
            assertEquals("file1.txt", iterator.next().getName());
        }
    }

    @Test
    @DisplayName("Should reject a header with ZIP64 markers")
    void shouldRejectZip64Header() throws IOException {
        byte[] zip = ZipFileGenerator.newArchive()
            .raw("huge.bin", new byte[0], 0, 0, 0,
                h -> h.uncompressedSize(EndOfCentralDirectoryRecord.ZIP64_MARKER))
            .build();

        try (ZipBrowser browser = ZipBrowser.newBuilder(zip).build()) {
            UnsupportedFeatureException e = assertThrows(UnsupportedFeatureException.class, browser::listFiles);
            assertEquals(Feature.ZIP64, e.getFeature());
        }
    }

    @Test
    @DisplayName("Should reject a header that starts on another disk")
    void shouldRejectHeaderOnAnotherDisk() throws IOException {
        byte[] zip = ZipFileGenerator.newArchive()
            .raw("elsewhere.bin", new byte[0], 0, 0, 0, h -> h.diskNumberStart(2))
            .build();

        try (ZipBrowser browser = ZipBrowser.newBuilder(zip).build()) {
            EntryIterator iterator = browser.entries();
            UnsupportedFeatureException e = assertThrows(UnsupportedFeatureException.class, iterator::next);
            assertEquals(Feature.MULTI_DISK, e.getFeature());
            assertFalse(iterator.hasNext());
        }
    }

    @Test
    @DisplayName("Should report a central directory name that is not UTF-8")
    void shouldReportNonUtf8Name() throws IOException {
        byte[] zip = ZipFileGenerator.newArchive().stored("name.txt", "content").build();
        try (ZipBrowser browser = ZipBrowser.newBuilder(zip).build()) {
            long header = browser.entries().getOffset();
            zip[(int) header + CentralDirectoryHeader.FIXED_SIZE] = (byte) 0xC3;
            zip[(int) header + CentralDirectoryHeader.FIXED_SIZE + 1] = (byte) 0x28;
        }

        try (ZipBrowser browser = ZipBrowser.newBuilder(zip).build()) {
            NonUtf8FieldException e = assertThrows(NonUtf8FieldException.class, browser::listEntries);
            assertEquals("file name", e.getFieldName());
        }
    }
}
