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
 * The header written immediately before each entry's data. Its size fields are authoritative
 * for where the payload starts and how long it is.
 *
 * <pre>
 * local file header signature     4 bytes  (0x04034b50)
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
 * file name (variable size)
 * extra field (variable size)
 * </pre>
 */
public final class LocalFileHeader {

    public static final long SIGNATURE = 0x04034b50L;
    public static final int FIXED_SIZE = 30;

    private final int versionNeededToExtract;
    private final GeneralPurposeFlags flags;
    private final int compressionMethod;
    private final DosDateTime lastModified;
    private final long crc32;
    private final long compressedSize;
    private final long uncompressedSize;
    private final String fileName;
    private final byte[] fileNameBytes;
    private final byte[] extraField;

    private LocalFileHeader(Builder builder) {
        this.versionNeededToExtract = builder.versionNeededToExtract;
        this.flags = builder.flags;
        this.compressionMethod = builder.compressionMethod;
        this.lastModified = builder.lastModified;
        this.crc32 = builder.crc32;
        this.compressedSize = builder.compressedSize;
        this.uncompressedSize = builder.uncompressedSize;
        this.fileName = builder.fileName;
        this.fileNameBytes = builder.fileName.getBytes(StandardCharsets.UTF_8);
        this.extraField = builder.extraField.clone();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .versionNeededToExtract(versionNeededToExtract)
            .flags(flags)
            .compressionMethod(compressionMethod)
            .lastModified(lastModified)
            .crc32(crc32)
            .compressedSize(compressedSize)
            .uncompressedSize(uncompressedSize)
            .fileName(fileName)
            .extraField(extraField);
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

    /**
     * @return the number of bytes this header occupies in the archive
     */
    public long getTotalSize() {
        return FIXED_SIZE + (long) fileNameBytes.length + extraField.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocalFileHeader)) {
            return false;
        }
        LocalFileHeader that = (LocalFileHeader) o;
        return versionNeededToExtract == that.versionNeededToExtract
            && compressionMethod == that.compressionMethod
            && crc32 == that.crc32
            && compressedSize == that.compressedSize
            && uncompressedSize == that.uncompressedSize
            && flags.equals(that.flags)
            && lastModified.equals(that.lastModified)
            && fileName.equals(that.fileName)
            && Arrays.equals(extraField, that.extraField);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(versionNeededToExtract, flags, compressionMethod, lastModified,
                crc32, compressedSize, uncompressedSize, fileName);
        return 31 * result + Arrays.hashCode(extraField);
    }

    @Override
    public String toString() {
        return String.format("LocalFileHeader{name='%s', version=%d, flags=%s, method=%d, modified=%s, "
                + "crc32=0x%08x, compressedSize=%d, uncompressedSize=%d, extraLength=%d}",
                fileName, versionNeededToExtract, flags, compressionMethod, lastModified,
                crc32, compressedSize, uncompressedSize, extraField.length);
    }

    /**
     * Builder for {@link LocalFileHeader}. Integer fields are range-checked against their
     * wire width when set.
     */
    public static final class Builder {
        private int versionNeededToExtract = 20;
        private GeneralPurposeFlags flags = GeneralPurposeFlags.NONE;
        private int compressionMethod = CompressionMethod.STORED.getCode();
        private DosDateTime lastModified = DosDateTime.ZERO;
        private long crc32;
        private long compressedSize;
        private long uncompressedSize;
        private String fileName = "";
        private byte[] extraField = new byte[0];

        private Builder() {
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

        public Builder fileName(String fileName) {
            this.fileName = Objects.requireNonNull(fileName, "fileName");
            return this;
        }

        public Builder extraField(byte[] extraField) {
            this.extraField = Objects.requireNonNull(extraField, "extraField").clone();
            return this;
        }

        public LocalFileHeader build() {
            return new LocalFileHeader(this);
        }
    }
}
