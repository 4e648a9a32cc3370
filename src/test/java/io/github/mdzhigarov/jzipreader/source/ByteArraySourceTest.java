package io.github.mdzhigarov.jzipreader.source;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the in-memory and file sources.
 */
class ByteArraySourceTest {

    private static final byte[] DATA = {10, 20, 30, 40, 50};

    @Test
    @DisplayName("Should read from the current position and advance")
    void shouldReadAndAdvance() throws IOException {
        ByteArraySource source = new ByteArraySource(DATA);
        byte[] buffer = new byte[3];

        source.seek(2);
        assertEquals(3, source.read(buffer, 0, 3));
        assertArrayEquals(new byte[] {30, 40, 50}, buffer);
        assertEquals(5, source.position());
        assertEquals(-1, source.read(buffer, 0, 1));
        assertEquals(0, source.read(buffer, 0, 0));
    }

    @Test
    @DisplayName("Should fail readFully past the end with EOFException")
    void shouldFailReadFullyPastEnd() throws IOException {
        ByteArraySource source = new ByteArraySource(DATA);
        source.seek(3);

        assertThrows(EOFException.class, () -> source.readFully(new byte[3]));
    }

    @Test
    @DisplayName("Should allow seeking to the end but not beyond")
    void shouldBoundSeeks() throws IOException {
        ByteArraySource source = new ByteArraySource(DATA);

        source.seek(5);
        assertEquals(5, source.position());
        assertThrows(IOException.class, () -> source.seek(6));
        assertThrows(IOException.class, () -> source.seek(-1));
    }

    @Test
    @DisplayName("Should read a file the same way")
    void shouldReadFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("data.bin");
        Files.write(file, DATA);

        try (FileSource source = new FileSource(file)) {
            byte[] buffer = new byte[2];
            assertEquals(5, source.size());
            source.seek(1);
            source.readFully(buffer);
            assertArrayEquals(new byte[] {20, 30}, buffer);
            assertEquals(file, source.getPath());
            assertThrows(IOException.class, () -> source.seek(6));
        }
    }
}
