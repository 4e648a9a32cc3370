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
import java.util.Objects;

/**
 * The trailer of every archive and the only entry point for parsing it: it locates the
 * central directory and says how many entries it holds.
 *
 * <pre>
 * end of central dir signature    4 bytes  (0x06054b50)
 * number of this disk             2 bytes
 * disk where central dir starts   2 bytes
 * number of entries on this disk  2 bytes
 * total number of entries         2 bytes
 * size of the central directory   4 bytes
 * offset of the central directory 4 bytes
 * .ZIP file comment length        2 bytes
 * .ZIP file comment (variable size)
 * </pre>
 */
public final class EndOfCentralDirectoryRecord {

    public static final long SIGNATURE = 0x06054b50L;
    public static final int FIXED_SIZE = 22;

    /** Value of 16-bit count fields that defers to a ZIP64 record. */
    public static final int ZIP64_COUNT_MARKER = 0xFFFF;
    /** Value of 32-bit size and offset fields that defers to a ZIP64 record. */
    public static final long ZIP64_MARKER = 0xFFFFFFFFL;

    private final int diskNumber;
    private final int centralDirectoryDisk;
    private final int entriesOnDisk;
    private final int totalEntries;
    private final long centralDirectorySize;
    private final long centralDirectoryOffset;
    private final String comment;
    private final byte[] commentBytes;

    private EndOfCentralDirectoryRecord(Builder builder) {
        this.diskNumber = builder.diskNumber;
        this.centralDirectoryDisk = builder.centralDirectoryDisk;
        this.entriesOnDisk = builder.entriesOnDisk;
        this.totalEntries = builder.totalEntries;
        this.centralDirectorySize = builder.centralDirectorySize;
        this.centralDirectoryOffset = builder.centralDirectoryOffset;
        this.comment = builder.comment;
        this.commentBytes = builder.comment.getBytes(StandardCharsets.UTF_8);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .diskNumber(diskNumber)
            .centralDirectoryDisk(centralDirectoryDisk)
            .entriesOnDisk(entriesOnDisk)
            .totalEntries(totalEntries)
            .centralDirectorySize(centralDirectorySize)
            .centralDirectoryOffset(centralDirectoryOffset)
            .comment(comment);
    }

    public int getDiskNumber() {
        return diskNumber;
    }

    public int getCentralDirectoryDisk() {
        return centralDirectoryDisk;
    }

    public int getEntriesOnDisk() {
        return entriesOnDisk;
    }

    public int getTotalEntries() {
        return totalEntries;
    }

    public long getCentralDirectorySize() {
        return centralDirectorySize;
    }

    public long getCentralDirectoryOffset() {
        return centralDirectoryOffset;
    }

    public String getComment() {
        return comment;
    }

    public int getCommentLength() {
        return commentBytes.length;
    }

    byte[] commentBytes() {
        return commentBytes;
    }

    public long getTotalSize() {
        return FIXED_SIZE + (long) commentBytes.length;
    }

    /**
     * @return true if any field carries the marker value that points to a ZIP64 record
     */
    public boolean hasZip64Markers() {
        return entriesOnDisk == ZIP64_COUNT_MARKER || totalEntries == ZIP64_COUNT_MARKER
            || centralDirectorySize == ZIP64_MARKER || centralDirectoryOffset == ZIP64_MARKER;
    }

    /**
     * @return true if the record describes anything other than a single-disk archive
     */
    public boolean isMultiDisk() {
        return diskNumber != 0 || centralDirectoryDisk != 0 || entriesOnDisk != totalEntries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EndOfCentralDirectoryRecord)) {
            return false;
        }
        EndOfCentralDirectoryRecord that = (EndOfCentralDirectoryRecord) o;
        return diskNumber == that.diskNumber
            && centralDirectoryDisk == that.centralDirectoryDisk
            && entriesOnDisk == that.entriesOnDisk
            && totalEntries == that.totalEntries
            && centralDirectorySize == that.centralDirectorySize
            && centralDirectoryOffset == that.centralDirectoryOffset
            && comment.equals(that.comment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(diskNumber, centralDirectoryDisk, entriesOnDisk, totalEntries,
                centralDirectorySize, centralDirectoryOffset, comment);
    }

    @Override
    public String toString() {
        return String.format("EndOfCentralDirectoryRecord{disk=%d, centralDirectoryDisk=%d, entriesOnDisk=%d, "
                + "totalEntries=%d, centralDirectorySize=%d, centralDirectoryOffset=%d, commentLength=%d}",
                diskNumber, centralDirectoryDisk, entriesOnDisk, totalEntries,
                centralDirectorySize, centralDirectoryOffset, commentBytes.length);
    }

    /**
     * Builder for {@link EndOfCentralDirectoryRecord}.
     */
    public static final class Builder {
        private int diskNumber;
        private int centralDirectoryDisk;
        private int entriesOnDisk;
        private int totalEntries;
        private long centralDirectorySize;
        private long centralDirectoryOffset;
        private String comment = "";

        private Builder() {
        }

        public Builder diskNumber(int disk) {
            this.diskNumber = FieldChecks.u16("diskNumber", disk);
            return this;
        }

        public Builder centralDirectoryDisk(int disk) {
            this.centralDirectoryDisk = FieldChecks.u16("centralDirectoryDisk", disk);
            return this;
        }

        public Builder entriesOnDisk(int entries) {
            this.entriesOnDisk = FieldChecks.u16("entriesOnDisk", entries);
            return this;
        }

        public Builder totalEntries(int entries) {
            this.totalEntries = FieldChecks.u16("totalEntries", entries);
            return this;
        }

        /**
         * Sets both entry counts, as a single-disk archive requires.
         */
        public Builder entries(int entries) {
            return entriesOnDisk(entries).totalEntries(entries);
        }

        public Builder centralDirectorySize(long size) {
            this.centralDirectorySize = FieldChecks.u32("centralDirectorySize", size);
            return this;
        }

        public Builder centralDirectoryOffset(long offset) {
            this.centralDirectoryOffset = FieldChecks.u32("centralDirectoryOffset", offset);
            return this;
        }

        public Builder comment(String comment) {
            this.comment = Objects.requireNonNull(comment, "comment");
            return this;
        }

        public EndOfCentralDirectoryRecord build() {
            return new EndOfCentralDirectoryRecord(this);
        }
    }
}
