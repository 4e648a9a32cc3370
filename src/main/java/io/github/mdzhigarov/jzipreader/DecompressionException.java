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
 * The DEFLATE stream of an entry could not be inflated.
 */
public final class DecompressionException extends ZipArchiveException {

    private static final long serialVersionUID = 1L;

    private final String entryName;

    public DecompressionException(String entryName, String reason) {
        super("Decompression failure for '" + entryName + "': " + reason);
        this.entryName = entryName;
    }

    public DecompressionException(String entryName, Throwable cause) {
        super("Decompression failure for '" + entryName + "': " + cause.getMessage(), cause);
        this.entryName = entryName;
    }

    public String getEntryName() {
        return entryName;
    }

    @Override
    public Kind getKind() {
        return Kind.DECOMPRESSION_FAILED;
    }
}
