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

import java.util.Optional;

/**
 * Compression methods this reader can extract.
 */
public enum CompressionMethod {
    STORED(0),
    DEFLATED(8);

    private final int code;

    CompressionMethod(int code) {
        this.code = code;
    }

    /**
     * @return the method id used on the wire
     */
    public int getCode() {
        return code;
    }

    /**
     * @return the method for a wire id, or empty for ids this reader does not support
     */
    public static Optional<CompressionMethod> fromCode(int code) {
        for (CompressionMethod method : values()) {
            if (method.code == code) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
