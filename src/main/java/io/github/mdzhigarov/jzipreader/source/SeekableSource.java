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

package io.github.mdzhigarov.jzipreader.source;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;

/**
 * A random-access byte source: an archive file, an in-memory buffer or a remote object.
 * All positioning is absolute, so a caller never relies on where a previous call left the
 * cursor.
 *
 * <p>Implementations are not thread-safe; a seek followed by a read is not atomic.
 */
public interface SeekableSource extends Closeable {

    /**
     * @return the total number of bytes in the source
     */
    long size() throws IOException;

    /**
     * @return the current absolute read position
     */
    long position() throws IOException;

    /**
     * Moves the read position.
     *
     * @param position absolute offset, between 0 and {@link #size()} inclusive
     */
    void seek(long position) throws IOException;

    /**
     * Reads up to {@code length} bytes from the current position and advances it.
     *
     * @return the number of bytes read, or -1 at the end of the source
     */
    int read(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Reads exactly {@code length} bytes.
     *
     * @throws EOFException if the source ends first
     */
    default void readFully(byte[] buffer, int offset, int length) throws IOException {
        int done = 0;
        while (done < length) {
            int n = read(buffer, offset + done, length - done);
            if (n < 0) {
                throw new EOFException("Unexpected end of data: " + length + " bytes expected, "
                        + done + " available at offset " + (position() - done));
            }
            done += n;
        }
    }

    default void readFully(byte[] buffer) throws IOException {
        readFully(buffer, 0, buffer.length);
    }
}
