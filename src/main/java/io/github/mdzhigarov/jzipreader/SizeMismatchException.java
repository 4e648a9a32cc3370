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
 * Inflated data is longer or shorter than the uncompressed size its header declares.
 */
public final class SizeMismatchException extends ZipArchiveException {

    private static final long serialVersionUID = 1L;

    private final String entryName;
    private final long declaredSize;
    private final long actualSize;

    /**
     * @param actualSize the produced length; when inflation was cut off early this is
     *                   {@code declaredSize + 1}, meaning "more than declared"
     */
    public SizeMismatchException(String entryName, long declaredSize, long actualSize) {
        super(String.format("Size mismatch for '%s': header declares %d bytes, got %s",
                entryName, declaredSize,
                actualSize > declaredSize ? "more than that" : actualSize + " bytes"));
        this.entryName = entryName;
        this.declaredSize = declaredSize;
        this.actualSize = actualSize;
    }

    public String getEntryName() {
        return entryName;
    }

    public long getDeclaredSize() {
        return declaredSize;
    }

    public long getActualSize() {
        return actualSize;
    }

    @Override
    public Kind getKind() {
        return Kind.SIZE_MISMATCH;
    }
}
