package io.github.mdzhigarov.jzipreader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the command line front end.
 */
class MainTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream output;
    private Path archive;

    @BeforeEach
    void setUp() throws IOException {
        output = new ByteArrayOutputStream();
        archive = tempDir.resolve("archive.zip");
        Files.write(archive, ZipFileGenerator.createMultiFileZip());
    }

    @Test
    @DisplayName("Should list one name per line")
    void shouldListNames() {
        assertEquals(Main.EXIT_OK, run("list", archive.toString()));

        assertEquals("file1.txt\nfile2.txt\nsubdir/\nsubdir/file3.txt\n", printed().replace("\r\n", "\n"));
    }

    @Test
    @DisplayName("Should print archive and entry details")
    void shouldPrintInfo() {
        assertEquals(Main.EXIT_OK, run("info", archive.toString()));

        String info = printed();
        assertTrue(info.contains("Entries: 4"), info);
        assertTrue(info.contains("file2.txt  DEFLATED"), info);
        assertTrue(info.contains("2024-05-17 13:45:30"), info);
    }

    @Test
    @DisplayName("Should extract the verified bytes of one entry")
    void shouldExtractEntry() throws IOException {
        Path target = tempDir.resolve("out.txt");

        assertEquals(Main.EXIT_OK, run("extract", archive.toString(), "subdir/file3.txt", target.toString()));

        assertEquals("Content of file 3 in subdirectory", Files.readString(target));
    }

    @Test
    @DisplayName("Should map failures to exit codes")
    void shouldMapFailuresToExitCodes() throws IOException {
        Path notAZip = tempDir.resolve("notes.txt");
        Files.writeString(notAZip, "plain text, no archive here");
        byte[] corrupt = ZipFileGenerator.createSingleFileZip();
        corrupt[ZipFileGenerator.dataOffset(corrupt, 0)] ^= 0x01;
        Path corruptZip = tempDir.resolve("corrupt.zip");
        Files.write(corruptZip, corrupt);
        Path encryptedZip = tempDir.resolve("encrypted.zip");
        Files.write(encryptedZip, ZipFileGenerator.newArchive().flags(1).stored("secret.txt", "x").build());
        Path targetPath = tempDir.resolve("out.bin");
        String target = targetPath.toString();

        assertEquals(Main.EXIT_NOT_A_ZIP, run("list", notAZip.toString()));
        assertEquals(Main.EXIT_CORRUPT, run("extract", corruptZip.toString(), "hello.txt", target));
        assertFalse(Files.exists(targetPath), "Unverified entry must not be written");
        assertEquals(Main.EXIT_UNSUPPORTED, run("extract", encryptedZip.toString(), "secret.txt", target));
        assertFalse(Files.exists(targetPath));
        assertEquals(Main.EXIT_NOT_FOUND, run("extract", archive.toString(), "missing.txt", target));
        assertEquals(Main.EXIT_IO, run("list", tempDir.resolve("absent.zip").toString()));
    }

    @Test
    @DisplayName("Should reject malformed command lines")
    void shouldRejectMalformedCommandLines() {
        assertEquals(Main.EXIT_USAGE, run());
        assertEquals(Main.EXIT_USAGE, run("list"));
        assertEquals(Main.EXIT_USAGE, run("delete", archive.toString()));
        assertEquals(Main.EXIT_USAGE, run("extract", archive.toString(), "file1.txt"));
        assertEquals(Main.EXIT_USAGE, run("list", archive.toString(), "extra"));
    }

    private int run(String... args) {
        return Main.run(args, new PrintStream(output, true, StandardCharsets.UTF_8), Map.of());
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
