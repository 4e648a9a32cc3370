/*
 * Copyright 2024 mdzhigarov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.mdzhigarov.jzipreader;

import java.io.IOException;
import java.io.PrintStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line front end of the jZipReader library.
 * Lists, describes and extracts entries of a local or remote ZIP archive.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_NOT_A_ZIP = 2;
    static final int EXIT_CORRUPT = 3;
    static final int EXIT_UNSUPPORTED = 4;
    static final int EXIT_NOT_FOUND = 5;
    static final int EXIT_IO = 6;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.getenv()));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args, PrintStream out, Map<String, String> env) {
        if (args.length < 2) {
            return usage();
        }
        String command = args[0];
        boolean extract = command.equals("extract");
        if (!extract && !command.equals("list") && !command.equals("info")) {
            System.err.println("Unknown command: " + command);
            return usage();
        }
        if (extract ? args.length != 4 : args.length != 2) {
            return usage();
        }

        ZipBrowser.Builder builder;
        try {
            builder = newBuilder(args[1], env);
        } catch (MalformedURLException e) {
            System.err.println("Invalid archive URL: " + args[1]);
            return EXIT_USAGE;
        }

        try (ZipBrowser browser = builder.build()) {
            logger.debug("Opened {} ({} bytes, {} entries)", args[1], browser.getSize(), browser.getEntryCount());
            switch (command) {
                case "list":
                    browser.listFiles().forEach(out::println);
                    break;
                case "info":
                    printInfo(browser, out);
                    break;
                default:
                    ZipEntry entry = browser.getEntry(args[2]);
                    Path target = Paths.get(args[3]);
                    byte[] data = browser.read(entry);
                    Files.write(target, data);
                    logger.info("Extracted {} ({} bytes) to {}", entry.getName(), data.length, target);
                    break;
            }
            return EXIT_OK;
        } catch (ZipArchiveException e) {
            logger.error("{}: {}", args[1], e.getMessage());
            return exitCode(e.getKind().getCategory());
        } catch (IOException e) {
            logger.error("I/O error while reading {}: {}", args[1], e.getMessage(), e);
            return EXIT_IO;
        }
    }

    static int exitCode(ZipArchiveException.Category category) {
        switch (category) {
            case NOT_A_ZIP:
                return EXIT_NOT_A_ZIP;
            case CORRUPT:
                return EXIT_CORRUPT;
            case UNSUPPORTED:
                return EXIT_UNSUPPORTED;
            case LOOKUP:
                return EXIT_NOT_FOUND;
            default:
                throw new IllegalArgumentException("Unknown category: " + category);
        }
    }

    private static ZipBrowser.Builder newBuilder(String archive, Map<String, String> env) throws MalformedURLException {
        if (archive.startsWith("http://") || archive.startsWith("https://")) {
            String username = env.get("ZIP_USERNAME");
            String password = env.get("ZIP_PASSWORD");
            logger.debug("Remote archive {}, credentials: {}", archive, username != null ? username + "/***" : "none");
            return ZipBrowser.newBuilder(new URL(archive)).withBasicAuth(username, password);
        }
        return ZipBrowser.newBuilder(Paths.get(archive));
    }

    private static void printInfo(ZipBrowser browser, PrintStream out) throws IOException {
        List<ZipEntry> entries = browser.listEntries();
        out.println("Archive size: " + browser.getSize() + " bytes");
        out.println("Entries: " + entries.size());
        out.println("Comment: " + browser.getComment());
        for (ZipEntry entry : entries) {
            String method = entry.getCompression()
                .map(Enum::name)
                .orElse("method " + entry.getCompressionMethod());
            out.printf("%s  %s  %d -> %d  crc=%08x  %s%n",
                entry.getName(), method, entry.getCompressedSize(), entry.getUncompressedSize(),
                entry.getCrc32(), entry.getLastModified());
        }
    }

    private static int usage() {
        System.err.println("Usage: jzipreader <command> <archive> [args]");
        System.err.println();
        System.err.println("Commands:");
        System.err.println("  list <archive>                          print one entry name per line");
        System.err.println("  info <archive>                          print archive and entry details");
        System.err.println("  extract <archive> <entry> <output-file> write the verified bytes of one entry");
        System.err.println();
        System.err.println("<archive> is a file path or an http(s):// URL. For remote archives, basic auth");
        System.err.println("credentials are read from ZIP_USERNAME and ZIP_PASSWORD.");
        return EXIT_USAGE;
    }
}
