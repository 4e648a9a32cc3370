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

import java.io.IOException;
import java.util.Objects;

/**
 * A {@link SeekableSource} over an in-memory archive.
 */
public class ByteArraySource implements SeekableSource {

    private final byte[] data;
    private int position;

    public ByteArraySource(byte[] data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    @Override
    public long size() {
        return data.length;
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public void seek(long position) throws IOException {
        if (position < 0 || position > data.length) {
            throw new IOException("Seek position " + position + " outside [0, " + data.length + "]");
        }
        this.position = (int) position;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, buffer.length);
        if (length == 0) {
            return 0;
        }
        if (position >= data.length) {
            return -1;
        }
        int n = Math.min(length, data.length - position);
        System.arraycopy(data, position, buffer, offset, n);
        position += n;
        return n;
    }

    @Override
    public void close() {
        // nothing to release
    }
}
