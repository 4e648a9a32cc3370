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

import io.github.mdzhigarov.jzipreader.format.EndOfCentralDirectoryRecord;
import io.github.mdzhigarov.jzipreader.format.RecordCodec;
import io.github.mdzhigarov.jzipreader.source.SeekableSource;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the End of Central Directory (EOCD) record by searching backwards from the end of the
 * source. The record has a variable-length comment and nothing points to it, so a backward scan
 * is the only way in: every offset from {@code size - 4} down to 0 is a candidate, and the
 * match nearest the end wins.
 *
 * <p>The tail is read in windows of {@code windowSize} candidates, each window overlapping the
 * next by three bytes so a signature straddling two windows is still seen.
 *
 * <p>In strict mode a signature match must also describe a plausible record before it is
 * accepted: the fixed part and the declared comment must fit in the source, and the central
 * directory must end before the record starts. This rejects the signature bytes turning up
 * inside an archive comment or inside entry data. Records carrying ZIP64 markers are accepted
 * as they are, so that the caller can reject them as unsupported.
 */
final class ArchiveLocator {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveLocator.class);

    private static final int SIGNATURE_SIZE = 4;

    // field offsets inside the fixed part of the record
    private static final int CENTRAL_DIRECTORY_SIZE_OFFSET = 12;
    private static final int CENTRAL_DIRECTORY_OFFSET_OFFSET = 16;
    private static final int COMMENT_LENGTH_OFFSET = 20;

    private final SeekableSource source;
    private final int windowSize;
    private final boolean strict;

    ArchiveLocator(SeekableSource source, int windowSize, boolean strict) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
        }
        this.source = source;
        this.windowSize = windowSize;
        this.strict = strict;
    }

    /**
     * @return the absolute offset of the end of central directory record
     * @throws NotAZipFileException if no acceptable record exists
     */
    long locate() throws IOException {
        long fileSize = source.size();
        logger.debug("Searching for EOCD signature 0x{} in {} bytes (strict={})",
                Long.toHexString(EndOfCentralDirectoryRecord.SIGNATURE).toUpperCase(), fileSize, strict);

        byte[] window = new byte[windowSize + SIGNATURE_SIZE - 1];
        long highest = fileSize - SIGNATURE_SIZE;
        while (highest >= 0) {
            long windowStart = Math.max(0, highest - windowSize + 1);
            int length = (int) (highest - windowStart) + SIGNATURE_SIZE;
            source.seek(windowStart);
            source.readFully(window, 0, length);

            for (int i = length - SIGNATURE_SIZE; i >= 0; i--) {
                if (RecordCodec.readU32(window, i) != EndOfCentralDirectoryRecord.SIGNATURE) {
                    continue;
                }
                long candidate = windowStart + i;
                if (accept(candidate, fileSize)) {
                    logger.debug("Found EOCD record at offset {} ({} bytes before end)", candidate, fileSize - candidate);
                    return candidate;
                }
            }
            highest = windowStart - 1;
        }

        logger.debug("EOCD not found in {} bytes", fileSize);
        throw new NotAZipFileException(fileSize);
    }

    private boolean accept(long candidate, long fileSize) throws IOException {
        if (!strict) {
            return true;
        }
        if (candidate + EndOfCentralDirectoryRecord.FIXED_SIZE > fileSize) {
            logger.debug("Rejecting EOCD candidate at {}: record would extend past end of data", candidate);
            return false;
        }

        byte[] fixed = new byte[EndOfCentralDirectoryRecord.FIXED_SIZE];
        source.seek(candidate);
        source.readFully(fixed);
        ByteBuffer buffer = ByteBuffer.wrap(fixed).order(ByteOrder.LITTLE_ENDIAN);
        long centralDirSize = buffer.getInt(CENTRAL_DIRECTORY_SIZE_OFFSET) & 0xFFFFFFFFL;
        long centralDirOffset = buffer.getInt(CENTRAL_DIRECTORY_OFFSET_OFFSET) & 0xFFFFFFFFL;
        int commentLength = buffer.getShort(COMMENT_LENGTH_OFFSET) & 0xFFFF;

        if (candidate + EndOfCentralDirectoryRecord.FIXED_SIZE + commentLength > fileSize) {
            logger.debug("Rejecting EOCD candidate at {}: comment of {} bytes extends past end of data",
                    candidate, commentLength);
            return false;
        }
        if (centralDirSize == EndOfCentralDirectoryRecord.ZIP64_MARKER
                || centralDirOffset == EndOfCentralDirectoryRecord.ZIP64_MARKER) {
            return true;
        }
        if (centralDirOffset + centralDirSize > candidate) {
            logger.debug("Rejecting EOCD candidate at {}: central directory [{}, +{}) overlaps it",
                    candidate, centralDirOffset, centralDirSize);
            return false;
        }
        return true;
    }
}
