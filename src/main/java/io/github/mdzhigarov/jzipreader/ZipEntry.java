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

import io.github.mdzhigarov.jzipreader.format.CentralDirectoryHeader;
import io.github.mdzhigarov.jzipreader.format.CompressionMethod;
import io.github.mdzhigarov.jzipreader.format.DosDateTime;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents a file entry within a ZIP archive.
 * Contains all the metadata needed to locate and extract the file. An entry is a detached
 * snapshot of its central directory header: it keeps no reference to the archive it came from
 * and may outlive it.
 */
public final class ZipEntry {
    private static final long DOS_DIRECTORY_ATTRIBUTE = 0x10;

    private final String name;
    private final long localHeaderOffset;
    private final long compressedSize;
    private final long uncompressedSize;
    private final int compressionMethod;
    private final long crc32;
    private final boolean isDirectory;
    private final DosDateTime lastModified;
    private final String comment;

    /**
     * Creates a new ZipEntry with the specified metadata.
     *
     * @param name The name of the file in the ZIP archive
     * @param localHeaderOffset The offset to the local file header
     * @param compressedSize The size of the compressed data
     * @param uncompressedSize The size of the uncompressed data
     * @param compressionMethod The compression method used (0 = stored, 8 = deflated)
     * @param crc32 The CRC32 checksum of the uncompressed data
     * @param isDirectory Whether this entry represents a directory
     * @param lastModified The last modification time as stored in the archive
     * @param comment The entry comment, empty if there is none
     */
    public ZipEntry(String name, long localHeaderOffset, long compressedSize,
                    long uncompressedSize, int compressionMethod, long crc32, boolean isDirectory,
                    DosDateTime lastModified, String comment) {
        this.name = Objects.requireNonNull(name, "name");
        this.localHeaderOffset = localHeaderOffset;
        this.compressedSize = compressedSize;
        this.uncompressedSize = uncompressedSize;
        this.compressionMethod = compressionMethod;
        this.crc32 = crc32;
        this.isDirectory = isDirectory;
        this.lastModified = Objects.requireNonNull(lastModified, "lastModified");
        this.comment = Objects.requireNonNull(comment, "comment");
    }

    /**
     * Projects a decoded central directory header onto the caller-facing entry.
     */
    static ZipEntry fromHeader(CentralDirectoryHeader header) {
        String name = header.getFileName();
        boolean isDirectory = name.endsWith("/")
            || (header.getExternalAttributes() & DOS_DIRECTORY_ATTRIBUTE) != 0;
        return new ZipEntry(name, header.getLocalHeaderOffset(), header.getCompressedSize(),
            header.getUncompressedSize(), header.getCompressionMethod(), header.getCrc32(),
            isDirectory, header.getLastModified(), header.getFileComment());
    }

    /**
     * @return The name of the file in the ZIP archive
     */
    public String getName() {
        return name;
    }

    /**
     * @return The name as it is encoded in the archive; lookups compare these bytes
     */
    public byte[] getNameBytes() {
        return name.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return The offset to the local file header from the beginning of the ZIP file
     */
    public long getLocalHeaderOffset() {
        return localHeaderOffset;
    }

    /**
     * @return The size of the compressed data in bytes
     */
    public long getCompressedSize() {
        return compressedSize;
    }

    /**
     * @return The size of the uncompressed data in bytes
     */
    public long getUncompressedSize() {
        return uncompressedSize;
    }

    /**
     * @return The compression method id (0 = stored, 8 = deflated)
     */
    public int getCompressionMethod() {
        return compressionMethod;
    }

    /**
     * @return The compression method, or empty if this reader cannot extract it
     */
    public Optional<CompressionMethod> getCompression() {
        return CompressionMethod.fromCode(compressionMethod);
    }

    /**
     * @return The CRC32 checksum of the uncompressed data
     */
    public long getCrc32() {
        return crc32;
    }

    /**
     * @return Whether this entry represents a directory
     */
    public boolean isDirectory() {
        return isDirectory;
    }

    /**
     * @return Whether this entry uses compression (compression method 8 = deflated)
     */
    public boolean isCompressed() {
        return compressionMethod == CompressionMethod.DEFLATED.getCode();
    }

    public DosDateTime getLastModified() {
        return lastModified;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ZipEntry)) {
            return false;
        }
        ZipEntry other = (ZipEntry) o;
        return localHeaderOffset == other.localHeaderOffset
            && compressedSize == other.compressedSize
            && uncompressedSize == other.uncompressedSize
            && compressionMethod == other.compressionMethod
            && crc32 == other.crc32
            && isDirectory == other.isDirectory
            && name.equals(other.name)
            && lastModified.equals(other.lastModified)
            && comment.equals(other.comment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, localHeaderOffset, compressedSize, uncompressedSize,
                compressionMethod, crc32, isDirectory, lastModified, comment);
    }

    @Override
    public String toString() {
        return String.format("ZipEntry{name='%s', offset=%d, compressedSize=%d, uncompressedSize=%d, compressionMethod=%d, isDirectory=%s}",
                name, localHeaderOffset, compressedSize, uncompressedSize, compressionMethod, isDirectory);
    }
}
