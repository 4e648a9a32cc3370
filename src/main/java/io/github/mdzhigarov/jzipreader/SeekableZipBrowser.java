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

import io.github.mdzhigarov.jzipreader.UnsupportedFeatureException.Feature;
import io.github.mdzhigarov.jzipreader.format.EndOfCentralDirectoryRecord;
import io.github.mdzhigarov.jzipreader.format.RecordCodec;
import io.github.mdzhigarov.jzipreader.source.ByteArraySource;
import io.github.mdzhigarov.jzipreader.source.FileSource;
import io.github.mdzhigarov.jzipreader.source.HttpRangeSource;
import io.github.mdzhigarov.jzipreader.source.SeekableSource;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URL;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of ZipBrowser over a {@link SeekableSource}: a local file, an in-memory
 * buffer or a remote file read with HTTP Range requests. Only the end of central directory
 * record is read up front; central directory headers are decoded on demand, and entry data is
 * read only when an entry is extracted.
 */
public class SeekableZipBrowser implements ZipBrowser {

    private static final Logger logger = LoggerFactory.getLogger(SeekableZipBrowser.class);

    private final SeekableSource source;
    private final long fileSize;
    private final EndOfCentralDirectoryRecord endRecord;
    private final ContentExtractor extractor;
    private boolean closed = false;

    private SeekableZipBrowser(SeekableSource source, long fileSize, EndOfCentralDirectoryRecord endRecord) {
        this.source = source;
        this.fileSize = fileSize;
        this.endRecord = endRecord;
        this.extractor = new ContentExtractor(source);
    }

    /**
     * Locates and decodes the end of central directory record of {@code source}.
     */
    static SeekableZipBrowser open(SeekableSource source, int blockSize, boolean strict) throws IOException {
        long fileSize = source.size();
        long endRecordOffset = new ArchiveLocator(source, blockSize, strict).locate();

        source.seek(endRecordOffset);
        EndOfCentralDirectoryRecord endRecord = RecordCodec.decodeEndOfCentralDirectory(source);
        checkSupported(endRecord);

        logger.debug("Opened {}: {} bytes, {} entries, central directory at offset {} ({} bytes)",
                    source, fileSize, endRecord.getTotalEntries(),
                    endRecord.getCentralDirectoryOffset(), endRecord.getCentralDirectorySize());
        return new SeekableZipBrowser(source, fileSize, endRecord);
    }

    private static void checkSupported(EndOfCentralDirectoryRecord endRecord) throws UnsupportedFeatureException {
        if (endRecord.hasZip64Markers()) {
            throw new UnsupportedFeatureException(Feature.ZIP64, "end of central directory carries ZIP64 markers");
        }
        if (endRecord.isMultiDisk()) {
            throw new UnsupportedFeatureException(Feature.MULTI_DISK, String.format(
                    "disk %d, central directory on disk %d, %d of %d entries on this disk",
                    endRecord.getDiskNumber(), endRecord.getCentralDirectoryDisk(),
                    endRecord.getEntriesOnDisk(), endRecord.getTotalEntries()));
        }
    }

    @Override
    public List<String> listFiles() throws IOException {
        List<String> names = new ArrayList<>();
        for (ZipEntry entry : listEntries()) {
            names.add(entry.getName());
        }
        return names;
    }

    @Override
    public List<ZipEntry> listEntries() throws IOException {
        EntryIterator iterator = entries();
        List<ZipEntry> entries = new ArrayList<>(endRecord.getTotalEntries());
        while (iterator.hasNext()) {
            entries.add(iterator.next());
        }
        logger.debug("Parsed {} file entries", entries.size());
        return entries;
    }

    @Override
    public EntryIterator entries() {
        ensureOpen();
        return new EntryIterator(source, endRecord);
    }

    @Override
    public ZipEntry getEntry(String fileName) throws IOException {
        return findEntry(fileName).orElseThrow(() -> new EntryNotFoundException(fileName));
    }

    @Override
    public Optional<InputStream> getFile(String fileName) throws IOException {
        Optional<ZipEntry> entry = findEntry(fileName);
        if (entry.isEmpty() || entry.get().isDirectory()) {
            return Optional.empty();
        }
        return Optional.of(new ByteArrayInputStream(read(entry.get())));
    }

    @Override
    public byte[] read(ZipEntry entry) throws IOException {
        Objects.requireNonNull(entry, "entry");
        ensureOpen();
        return extractor.extract(entry);
    }

    @Override
    public long extract(ZipEntry entry, OutputStream out) throws IOException {
        Objects.requireNonNull(out, "out");
        byte[] data = read(entry);
        out.write(data);
        return data.length;
    }

    @Override
    public long getSize() {
        return fileSize;
    }

    @Override
    public int getEntryCount() {
        return endRecord.getTotalEntries();
    }

    @Override
    public String getComment() {
        return endRecord.getComment();
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            source.close();
        }
    }

    /**
     * Linear scan over the central directory, comparing encoded names.
     */
    private Optional<ZipEntry> findEntry(String fileName) throws IOException {
        Objects.requireNonNull(fileName, "fileName");
        byte[] wanted = fileName.getBytes(StandardCharsets.UTF_8);

        EntryIterator iterator = entries();
        while (iterator.hasNext()) {
            ZipEntry entry = iterator.next();
            if (Arrays.equals(entry.getNameBytes(), wanted)) {
                return Optional.of(entry);
            }
        }
        logger.debug("No entry named {} among {} entries", fileName, iterator.getIndex());
        return Optional.empty();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ZipBrowser is closed");
        }
    }

    /**
     * Builder class for creating SeekableZipBrowser instances.
     */
    public static class Builder implements ZipBrowser.Builder {
        private final Path path;
        private final URL url;
        private final byte[] bytes;
        private final SeekableSource source;
        private HttpClient httpClient;
        private String username;
        private String password;
        private int blockSize = HttpRangeSource.DEFAULT_BLOCK_SIZE;
        private boolean strictEndRecordCheck = true;

        public Builder(Path path) {
            this(Objects.requireNonNull(path, "path"), null, null, null);
        }

        public Builder(URL url) {
            this(null, Objects.requireNonNull(url, "url"), null, null);
        }

        public Builder(byte[] bytes) {
            this(null, null, Objects.requireNonNull(bytes, "bytes"), null);
        }

        public Builder(SeekableSource source) {
            this(null, null, null, Objects.requireNonNull(source, "source"));
        }

        private Builder(Path path, URL url, byte[] bytes, SeekableSource source) {
            this.path = path;
            this.url = url;
            this.bytes = bytes;
            this.source = source;
        }

        @Override
        public Builder withBasicAuth(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        @Override
        public Builder withHttpClient(HttpClient client) {
            this.httpClient = client;
            return this;
        }

        @Override
        public Builder withBlockSize(int blockSize) {
            if (blockSize < EndOfCentralDirectoryRecord.FIXED_SIZE) {
                throw new IllegalArgumentException("blockSize must be at least "
                        + EndOfCentralDirectoryRecord.FIXED_SIZE + ": " + blockSize);
            }
            this.blockSize = blockSize;
            return this;
        }

        @Override
        public Builder withStrictEndRecordCheck(boolean strict) {
            this.strictEndRecordCheck = strict;
            return this;
        }

        @Override
        public ZipBrowser build() throws IOException {
            SeekableSource opened = openSource();
            try {
                return SeekableZipBrowser.open(opened, blockSize, strictEndRecordCheck);
            } catch (IOException | RuntimeException e) {
                try {
                    opened.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw e;
            }
        }

        private SeekableSource openSource() throws IOException {
            if (url != null) {
                return HttpRangeSource.newBuilder(url)
                    .withBasicAuth(username, password)
                    .withHttpClient(httpClient)
                    .withBlockSize(blockSize)
                    .build();
            }
            if (username != null || password != null || httpClient != null) {
                throw new IllegalStateException("Basic auth and HttpClient apply to remote (URL) archives only");
            }
            if (path != null) {
                return new FileSource(path);
            }
            if (bytes != null) {
                return new ByteArraySource(bytes);
            }
            return source;
        }
    }
}
