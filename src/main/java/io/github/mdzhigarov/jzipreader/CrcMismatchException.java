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
 * The CRC-32 of an extracted payload differs from the value declared in its local header.
 */
public final class CrcMismatchException extends ZipArchiveException {

    private static final long serialVersionUID = 1L;

    private final String entryName;
    private final long expectedCrc;
    private final long actualCrc;

    public CrcMismatchException(String entryName, long expectedCrc, long actualCrc) {
        super(String.format("CRC mismatch for '%s': header declares 0x%08x, data has 0x%08x",
                entryName, expectedCrc, actualCrc));
        this.entryName = entryName;
        this.expectedCrc = expectedCrc;
        this.actualCrc = actualCrc;
    }

    public String getEntryName() {
        return entryName;
    }

    public long getExpectedCrc() {
        return expectedCrc;
    }

    public long getActualCrc() {
        return actualCrc;
    }

    @Override
    public Kind getKind() {
        return Kind.CRC_MISMATCH;
    }
}
