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

/**
 * No end of central directory record could be found in the input.
 */
public final class NotAZipFileException extends ZipArchiveException {

    private static final long serialVersionUID = 1L;

    private final long streamSize;

    public NotAZipFileException(long streamSize) {
        super("Not a ZIP file: no end of central directory record in " + streamSize + " bytes");
        this.streamSize = streamSize;
    }

    /**
     * @return the number of bytes that were searched
     */
    public long getStreamSize() {
        return streamSize;
    }

    @Override
    public Kind getKind() {
        return Kind.NOT_A_ZIP_FILE;
    }
}
