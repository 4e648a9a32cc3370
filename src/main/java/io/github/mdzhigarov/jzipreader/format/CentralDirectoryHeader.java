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

package io.github.mdzhigarov.jzipreader.format;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One entry of the central directory. The central directory stores these headers back to back,
 * one per entry, in an order unrelated to where the entries' data sits.
 *
 * <pre>
 * central file header signature   4 bytes  (0x02014b50)
 * version made by                 2 bytes
 * version needed to extract       2 bytes
 * general purpose bit flag        2 bytes
 * compression method              2 bytes
 * last mod file time              2 bytes
 * last mod file date              2 bytes
 * crc-32                          4 bytes
 * compressed size                 4 bytes
 * uncompressed size               4 bytes
 * file name length                2 bytes
 * extra field length              2 bytes
 * file comment length             2 bytes
 * disk number start               2 bytes
 * internal file attributes        2 bytes
 * external file attributes        4 bytes
 * relative offset of local header 4 bytes
 * file name (variable size)
 * extra field (variable size)
 * file comment (variable size)
 * </pre>
 */
public final class CentralDirectoryHeader {

    public static final long SIGNATURE = 0x02014b50L;
    public static final int FIXED_SIZE = 46;

    private final int versionMadeBy;
    private final int versionNeededToExtract;
    private final GeneralPurposeFlags flags;
    private final int compressionMethod;
    private final DosDateTime lastModified;
    private final long crc32;
    private final long compressedSize;
    private final long uncompressedSize;
    private final int diskNumberStart;
    private final int internalAttributes;
    private final long externalAttributes;
    private final long localHeaderOffset;
    private final String fileName;
    private final byte[] fileNameBytes;
    private final byte[] extraField;
    private final String fileComment;
    private final byte[] fileCommentBytes;

    private CentralDirectoryHeader(Builder builder) {
        this.versionMadeBy = builder.versionMadeBy;
        this.versionNeededToExtract = builder.versionNeededToExtract;
        this.flags = builder.flags;
        this.compressionMethod = builder.compressionMethod;
        this.lastModified = builder.lastModified;
        this.crc32 = builder.crc32;
        this.compressedSize = builder.compressedSize;
        this.uncompressedSize = builder.uncompressedSize;
        this.diskNumberStart = builder.diskNumberStart;
        this.internalAttributes = builder.internalAttributes;
        this.externalAttributes = builder.externalAttributes;
        this.localHeaderOffset = builder.localHeaderOffset;
        this.fileName = builder.fileName;
        this.fileNameBytes = builder.fileName.getBytes(StandardCharsets.UTF_8);
        this.extraField = builder.extraField.clone();
        this.fileComment = builder.fileComment;
        this.fileCommentBytes = builder.fileComment.getBytes(StandardCharsets.UTF_8);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .versionMadeBy(versionMadeBy)
            .versionNeededToExtract(versionNeededToExtract)
            .flags(flags)
            .compressionMethod(compressionMethod)
            .lastModified(lastModified)
            .crc32(crc32)
            .compressedSize(compressedSize)
            .uncompressedSize(uncompressedSize)
            .diskNumberStart(diskNumberStart)
            .internalAttributes(internalAttributes)
            .externalAttributes(externalAttributes)
            .localHeaderOffset(localHeaderOffset)
            .fileName(fileName)
            .extraField(extraField)
            .fileComment(fileComment);
    }

    public int getVersionMadeBy() {
        return versionMadeBy;
    }

    public int getVersionNeededToExtract() {
        return versionNeededToExtract;
    }

    public GeneralPurposeFlags getFlags() {
        return flags;
    }

    public int getCompressionMethod() {
        return compressionMethod;
    }

    public DosDateTime getLastModified() {
        return lastModified;
    }

    public long getCrc32() {
        return crc32;
    }

    public long getCompressedSize() {
        return compressedSize;
    }

    public long getUncompressedSize() {
        return uncompressedSize;
    }

    public int getDiskNumberStart() {
        return diskNumberStart;
    }

    public int getInternalAttributes() {
        return internalAttributes;
    }

    public long getExternalAttributes() {
        return externalAttributes;
    }

    /**
     * @return the absolute offset of the matching {@link LocalFileHeader}
     */
    public long getLocalHeaderOffset() {
        return localHeaderOffset;
    }

    public String getFileName() {
        return fileName;
    }

    public int getFileNameLength() {
        return fileNameBytes.length;
    }

    byte[] fileNameBytes() {
        return fileNameBytes;
    }

    public byte[] getExtraField() {
        return extraField.clone();
    }

    public int getExtraFieldLength() {
        return extraField.length;
    }

    byte[] extraFieldBytes() {
        return extraField;
    }

    public String getFileComment() {
        return fileComment;
    }

    public int getFileCommentLength() {
        return fileCommentBytes.length;
    }

    byte[] fileCommentBytes() {
        return fileCommentBytes;
    }

    /**
     * @return the number of bytes this header occupies in the central directory
     */
    public long getTotalSize() {
        return FIXED_SIZE + (long) fileNameBytes.length + extraField.length + fileCommentBytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CentralDirectoryHeader)) {
            return false;
        }
        CentralDirectoryHeader that = (CentralDirectoryHeader) o;
        return versionMadeBy == that.versionMadeBy
            && versionNeededToExtract == that.versionNeededToExtract
            && compressionMethod == that.compressionMethod
            && crc32 == that.crc32
            && compressedSize == that.compressedSize
            && uncompressedSize == that.uncompressedSize
            && diskNumberStart == that.diskNumberStart
            && internalAttributes == that.internalAttributes
            && externalAttributes == that.externalAttributes
            && localHeaderOffset == that.localHeaderOffset
            && flags.equals(that.flags)
            && lastModified.equals(that.lastModified)
            && fileName.equals(that.fileName)
            && Arrays.equals(extraField, that.extraField)
            && fileComment.equals(that.fileComment);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(versionMadeBy, versionNeededToExtract, flags, compressionMethod,
                lastModified, crc32, compressedSize, uncompressedSize, diskNumberStart,
                internalAttributes, externalAttributes, localHeaderOffset, fileName, fileComment);
        return 31 * result + Arrays.hashCode(extraField);
    }

    @Override
    public String toString() {
        return String.format("CentralDirectoryHeader{name='%s', method=%d, flags=%s, modified=%s, crc32=0x%08x, "
                + "compressedSize=%d, uncompressedSize=%d, localHeaderOffset=%d}",
                fileName, compressionMethod, flags, lastModified, crc32,
                compressedSize, uncompressedSize, localHeaderOffset);
    }

    /**
     * Builder for {@link CentralDirectoryHeader}.
     */
    public static final class Builder {
        private int versionMadeBy = 20;
        private int versionNeededToExtract = 20;
        private GeneralPurposeFlags flags = GeneralPurposeFlags.NONE;
        private int compressionMethod = CompressionMethod.STORED.getCode();
        private DosDateTime lastModified = DosDateTime.ZERO;
        private long crc32;
        private long compressedSize;
        private long uncompressedSize;
        private int diskNumberStart;
        private int internalAttributes;
        private long externalAttributes;
        private long localHeaderOffset;
        private String fileName = "";
        private byte[] extraField = new byte[0];
        private String fileComment = "";

        private Builder() {
        }

        public Builder versionMadeBy(int version) {
            this.versionMadeBy = FieldChecks.u16("versionMadeBy", version);
            return this;
        }

        public Builder versionNeededToExtract(int version) {
            this.versionNeededToExtract = FieldChecks.u16("versionNeededToExtract", version);
            return this;
        }

        public Builder flags(int flags) {
            return flags(GeneralPurposeFlags.of(flags));
        }

        public Builder flags(GeneralPurposeFlags flags) {
            this.flags = Objects.requireNonNull(flags, "flags");
            return this;
        }

        public Builder compressionMethod(int method) {
            this.compressionMethod = FieldChecks.u16("compressionMethod", method);
            return this;
        }

        public Builder compressionMethod(CompressionMethod method) {
            return compressionMethod(method.getCode());
        }

        public Builder lastModified(DosDateTime lastModified) {
            this.lastModified = Objects.requireNonNull(lastModified, "lastModified");
            return this;
        }

        public Builder crc32(long crc32) {
            this.crc32 = FieldChecks.u32("crc32", crc32);
            return this;
        }

        public Builder compressedSize(long size) {
            this.compressedSize = FieldChecks.u32("compressedSize", size);
            return this;
        }

        public Builder uncompressedSize(long size) {
            this.uncompressedSize = FieldChecks.u32("uncompressedSize", size);
            return this;
        }

        public Builder diskNumberStart(int disk) {
            this.diskNumberStart = FieldChecks.u16("diskNumberStart", disk);
            return this;
        }

        public Builder internalAttributes(int attributes) {
            this.internalAttributes = FieldChecks.u16("internalAttributes", attributes);
            return this;
        }

        public Builder externalAttributes(long attributes) {
            this.externalAttributes = FieldChecks.u32("externalAttributes", attributes);
            return this;
        }

        public Builder localHeaderOffset(long offset) {
            this.localHeaderOffset = FieldChecks.u32("localHeaderOffset", offset);
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = Objects.requireNonNull(fileName, "fileName");
            return this;
        }

        public Builder extraField(byte[] extraField) {
            this.extraField = Objects.requireNonNull(extraField, "extraField").clone();
            return this;
        }

        public Builder fileComment(String fileComment) {
            this.fileComment = Objects.requireNonNull(fileComment, "fileComment");
            return this;
        }

        public CentralDirectoryHeader build() {
            return new CentralDirectoryHeader(this);
        }
    }
}
