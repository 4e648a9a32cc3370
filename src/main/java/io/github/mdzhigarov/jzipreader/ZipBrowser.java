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

import io.github.mdzhigarov.jzipreader.source.SeekableSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URL;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * An interface for browsing and extracting files from a ZIP archive, local or remote, without
 * unpacking the whole archive.
 *
 * <p>Every call is synchronous and blocking. An instance is not thread-safe: the archive is
 * read through a single seekable source, so concurrent use needs external locking. Separate
 * instances share nothing and may be used in parallel.
 */
public interface ZipBrowser extends AutoCloseable {

    /**
     * Retrieves the names of all entries, in central directory order.
     *
     * @return A list of file names.
     */
    List<String> listFiles() throws IOException;

    /**
     * Retrieves all entries, in central directory order.
     */
    List<ZipEntry> listEntries() throws IOException;

    /**
     * Returns a fresh cursor over the central directory, for callers that want to stop early or
     * handle a damaged entry themselves.
     */
    EntryIterator entries();

    /**
     * Finds an entry by name. Names are compared by their encoded bytes; if the archive holds
     * the same name twice, the first one in central directory order is returned.
     *
     * @throws EntryNotFoundException if no entry has that name
     */
    ZipEntry getEntry(String fileName) throws IOException;

    /**
     * Retrieves a specific file from the ZIP archive as an InputStream.
     * The file is decompressed and verified before the stream is returned.
     *
     * @param fileName The exact name of the file inside the ZIP archive (e.g., "data/metadata.yml").
     * @return An Optional containing an InputStream for the requested file's uncompressed data.
     * The Optional will be empty if the file is not found or is a directory.
     */
    Optional<InputStream> getFile(String fileName) throws IOException;

    /**
     * Extracts an entry into memory.
     *
     * @return the uncompressed bytes, whose length and CRC-32 match the entry's local header
     * @throws CrcMismatchException if the data does not match its checksum
     * @throws UnsupportedFeatureException if the entry is encrypted, uses a data descriptor or an
     *                                     unknown compression method
     */
    byte[] read(ZipEntry entry) throws IOException;

    /**
     * Extracts an entry into {@code out}. Nothing is written unless the entry verifies.
     *
     * @return the number of bytes written
     */
    long extract(ZipEntry entry, OutputStream out) throws IOException;

    /**
     * Returns the total size of the ZIP file in bytes.
     *
     * @return The size of the file in bytes.
     */
    long getSize();

    /**
     * @return the number of entries the end of central directory record declares
     */
    int getEntryCount();

    /**
     * @return the archive comment, empty if there is none
     */
    String getComment();

    /**
     * Closes the underlying source.
     */
    @Override
    void close() throws IOException;

    /**
     * Opens a local archive with default settings.
     */
    static ZipBrowser open(Path path) throws IOException {
        return newBuilder(path).build();
    }

    /**
     * Factory method to obtain a builder for a local ZIP file.
     */
    static Builder newBuilder(Path path) {
        return new SeekableZipBrowser.Builder(path);
    }

    /**
     * Factory method to obtain a builder for a remote ZIP file, read with HTTP Range requests.
     *
     * @param url The URL of the remote ZIP file.
     */
    static Builder newBuilder(URL url) {
        return new SeekableZipBrowser.Builder(url);
    }

    /**
     * Factory method to obtain a builder for an archive held in memory.
     */
    static Builder newBuilder(byte[] archive) {
        return new SeekableZipBrowser.Builder(archive);
    }

    /**
     * Factory method to obtain a builder for any seekable source. The browser takes ownership of
     * the source and closes it.
     */
    static Builder newBuilder(SeekableSource source) {
        return new SeekableZipBrowser.Builder(source);
    }

    /**
     * A builder for configuring and creating a ZipBrowser instance.
     */
    interface Builder {
        /**
         * (Optional) Sets basic authentication credentials. Remote archives only.
         *
         * @param username The username.
         * @param password The password.
         * @return This builder instance for chaining.
         */
        Builder withBasicAuth(String username, String password);

        /**
         * (Optional) Provide a custom HttpClient instance. If not provided, a default one is
         * created. Remote archives only.
         *
         * @param client The HttpClient to use.
         * @return This builder instance for chaining.
         */
        Builder withHttpClient(HttpClient client);

        /**
         * (Optional) Number of bytes read at a time while searching for the end of central
         * directory record, and per HTTP Range request for remote archives. Defaults to 64 KiB.
         */
        Builder withBlockSize(int blockSize);

        /**
         * (Optional) Whether a signature match at the end of the archive must also describe a
         * consistent record before it is accepted. Defaults to true. When false, the match
         * nearest the end of the archive is used as is.
         */
        Builder withStrictEndRecordCheck(boolean strict);

        /**
         * Opens the archive: locates and decodes the end of central directory record and checks
         * that the archive is one this reader supports.
         *
         * @return the ready-to-use ZipBrowser instance.
         * @throws NotAZipFileException if no end of central directory record is found
         * @throws UnsupportedFeatureException for ZIP64 and multi-disk archives
         */
        ZipBrowser build() throws IOException;
    }
}
