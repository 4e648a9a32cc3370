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

import java.io.IOException;

/**
 * Base class for every failure that comes from the archive itself rather than from the
 * underlying byte source. Plain {@link IOException}s thrown by the source are never wrapped
 * into this type; they reach the caller unchanged.
 *
 * <p>Callers branch on {@link #getKind()} (or on {@link Kind#getCategory()}) to tell
 * "this is not a ZIP file" apart from "this entry is corrupt" and "this archive uses a
 * feature the reader does not support".
 */
public abstract class ZipArchiveException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Coarse grouping of {@link Kind}s, matching the different ways a caller usually reacts.
     */
    public enum Category {
        /** The input is not a ZIP archive at all. */
        NOT_A_ZIP,
        /** The input is a ZIP archive, but a structure or a payload is damaged. */
        CORRUPT,
        /** The archive is well formed but uses something this reader refuses to interpret. */
        UNSUPPORTED,
        /** The requested entry does not exist. */
        LOOKUP
    }

    /**
     * The closed set of archive failure kinds.
     */
    public enum Kind {
        NOT_A_ZIP_FILE(Category.NOT_A_ZIP),
        INVALID_SIGNATURE(Category.CORRUPT),
        CRC_MISMATCH(Category.CORRUPT),
        SIZE_MISMATCH(Category.CORRUPT),
        DECOMPRESSION_FAILED(Category.CORRUPT),
        NON_UTF8_FIELD(Category.CORRUPT),
        FIELD_TOO_LONG(Category.UNSUPPORTED),
        UNSUPPORTED_FEATURE(Category.UNSUPPORTED),
        ENTRY_NOT_FOUND(Category.LOOKUP);

        private final Category category;

        Kind(Category category) {
            this.category = category;
        }

        public Category getCategory() {
            return category;
        }
    }

    protected ZipArchiveException(String message) {
        super(message);
    }

    protected ZipArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the kind of this failure, never null
     */
    public abstract Kind getKind();
}
