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
import io.github.mdzhigarov.jzipreader.format.CompressionMethod;
import io.github.mdzhigarov.jzipreader.format.LocalFileHeader;
import io.github.mdzhigarov.jzipreader.format.RecordCodec;
import io.github.mdzhigarov.jzipreader.source.SeekableSource;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.zip.CRC32;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an entry's payload, decompresses it and verifies it. The local file header is
 * re-decoded for every extraction and is trusted over the central directory for the payload
 * offset, its length, the method and the CRC. Bytes are only handed out once both the size
 * and the CRC-32 check have passed.
 */
final class ContentExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ContentExtractor.class);

    // largest array most JVMs allocate, minus the byte used to detect oversized output
    private static final long MAX_ENTRY_SIZE = Integer.MAX_VALUE - 9;

    private static final int INFLATE_CHUNK_SIZE = 64 * 1024;

    private final SeekableSource source;

    ContentExtractor(SeekableSource source) {
        this.source = source;
    }

    byte[] extract(ZipEntry entry) throws IOException {
        long headerOffset = entry.getLocalHeaderOffset();
        source.seek(headerOffset);
        LocalFileHeader header = RecordCodec.decodeLocalFileHeader(source);

        if (header.getCompressionMethod() != entry.getCompressionMethod()) {
            logger.warn("Compression method of {} differs between central directory ({}) and local header ({}); using local header",
                        entry.getName(), entry.getCompressionMethod(), header.getCompressionMethod());
        }

        long dataOffset = headerOffset + header.getTotalSize();
        logger.debug("Extracting {}: local header at {}, data at {}, method={}, compressed size={}, uncompressed size={}",
                    entry.getName(), headerOffset, dataOffset, header.getCompressionMethod(),
                    header.getCompressedSize(), header.getUncompressedSize());

        CompressionMethod method = CompressionMethod.fromCode(header.getCompressionMethod())
            .orElseThrow(() -> new UnsupportedFeatureException(Feature.COMPRESSION_METHOD,
                    "method " + header.getCompressionMethod() + " of " + entry.getName()));

        byte[] data;
        if (method == CompressionMethod.STORED) {
            data = readPayload(entry, dataOffset, header.getUncompressedSize());
        } else {
            int declaredSize = checkedArraySize(entry, header.getUncompressedSize());
            byte[] compressed = readPayload(entry, dataOffset, header.getCompressedSize());
            data = inflate(entry.getName(), compressed, declaredSize);
        }

        CRC32 crc32 = new CRC32();
        crc32.update(data);
        if (crc32.getValue() != header.getCrc32()) {
            throw new CrcMismatchException(entry.getName(), header.getCrc32(), crc32.getValue());
        }
        return data;
    }

    private byte[] readPayload(ZipEntry entry, long offset, long length) throws IOException {
        long available = source.size() - offset;
        if (length > available) {
            throw new EOFException(entry.getName() + " declares " + length + " payload bytes at offset " + offset
                                   + " but only " + Math.max(available, 0) + " remain");
        }
        byte[] data = new byte[checkedArraySize(entry, length)];
        source.seek(offset);
        source.readFully(data);
        return data;
    }

    /**
     * Inflates a raw DEFLATE stream, producing at most one byte more than declared so that an
     * oversized stream is detected without inflating all of it. The output grows with what the
     * stream actually produces, not with the declared size.
     */
    private static byte[] inflate(String name, byte[] compressed, int declaredSize) throws IOException {
        long limit = (long) declaredSize + 1;
        ByteArrayOutputStream output = new ByteArrayOutputStream((int) Math.min(limit, INFLATE_CHUNK_SIZE));
        byte[] chunk = new byte[(int) Math.min(limit, INFLATE_CHUNK_SIZE)];
        long produced = 0;

        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(compressed);
            while (!inflater.finished() && produced < limit) {
                int n = inflater.inflate(chunk, 0, (int) Math.min(chunk.length, limit - produced));
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DecompressionException(name, "deflate stream ends before its final block");
                }
                output.write(chunk, 0, n);
                produced += n;
            }
        } catch (DataFormatException e) {
            throw new DecompressionException(name, e);
        } finally {
            inflater.end();
        }

        if (produced != declaredSize) {
            throw new SizeMismatchException(name, declaredSize, produced);
        }
        return output.toByteArray();
    }

    private static int checkedArraySize(ZipEntry entry, long size) throws UnsupportedFeatureException {
        if (size > MAX_ENTRY_SIZE) {
            throw new UnsupportedFeatureException(Feature.LARGE_ENTRY, entry.getName() + " declares " + size + " bytes");
        }
        return (int) size;
    }
}
