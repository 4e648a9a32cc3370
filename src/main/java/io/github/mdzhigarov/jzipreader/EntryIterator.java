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
import io.github.mdzhigarov.jzipreader.format.CentralDirectoryHeader;
import io.github.mdzhigarov.jzipreader.format.EndOfCentralDirectoryRecord;
import io.github.mdzhigarov.jzipreader.format.RecordCodec;
import io.github.mdzhigarov.jzipreader.source.SeekableSource;
import java.io.IOException;
import java.util.NoSuchElementException;

/**
 * A cursor over the central directory, yielding one {@link ZipEntry} per header in storage
 * order. It does not implement {@link java.util.Iterator} because decoding can fail with a
 * checked {@link IOException}.
 *
 * <p>The first failure ends the iteration: the exception is thrown from {@link #next()} and
 * {@link #hasNext()} returns false from then on, until {@link #reset()}. The cursor shares the
 * archive's source with its browser, so it must not be used after the browser is closed or
 * from more than one thread.
 */
public final class EntryIterator {

    private final SeekableSource source;
    private final int totalEntries;
    private final long centralDirectoryOffset;

    private int index;
    private long offset;
    private boolean exhausted;

    EntryIterator(SeekableSource source, EndOfCentralDirectoryRecord endRecord) {
        this.source = source;
        this.totalEntries = endRecord.getTotalEntries();
        this.centralDirectoryOffset = endRecord.getCentralDirectoryOffset();
        reset();
    }

    public boolean hasNext() {
        return !exhausted && index < totalEntries;
    }

    /**
     * Decodes the next central directory header.
     *
     * @throws NoSuchElementException if the iteration has ended
     * @throws UnsupportedFeatureException if the header relies on ZIP64 or spans disks
     */
    public ZipEntry next() throws IOException {
        if (!hasNext()) {
            throw new NoSuchElementException("No more entries (index " + index + " of " + totalEntries + ")");
        }
        try {
            source.seek(offset);
            CentralDirectoryHeader header = RecordCodec.decodeCentralDirectoryHeader(source);
            checkSupported(header);
            offset += header.getTotalSize();
            index++;
            return ZipEntry.fromHeader(header);
        } catch (IOException e) {
            exhausted = true;
            throw e;
        }
    }

    /**
     * Rewinds the cursor to the first entry and clears a previous failure.
     */
    public void reset() {
        index = 0;
        offset = centralDirectoryOffset;
        exhausted = false;
    }

    /**
     * @return the number of entries yielded so far
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return the absolute offset of the next header to decode
     */
    public long getOffset() {
        return offset;
    }

    private static void checkSupported(CentralDirectoryHeader header) throws UnsupportedFeatureException {
        if (header.getCompressedSize() == EndOfCentralDirectoryRecord.ZIP64_MARKER
                || header.getUncompressedSize() == EndOfCentralDirectoryRecord.ZIP64_MARKER
                || header.getLocalHeaderOffset() == EndOfCentralDirectoryRecord.ZIP64_MARKER) {
            throw new UnsupportedFeatureException(Feature.ZIP64, "entry " + header.getFileName());
        }
        if (header.getDiskNumberStart() != 0) {
            throw new UnsupportedFeatureException(Feature.MULTI_DISK,
                    "entry " + header.getFileName() + " starts on disk " + header.getDiskNumberStart());
        }
    }
}
