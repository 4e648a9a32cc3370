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

import io.github.mdzhigarov.jzipreader.UnsupportedFeatureException;
import io.github.mdzhigarov.jzipreader.UnsupportedFeatureException.Feature;

/**
 * The 16-bit general purpose bit flag of local and central directory headers.
 * See section 4.4.4 of PKWARE's APPNOTE.TXT.
 */
public final class GeneralPurposeFlags {

    public static final int ENCRYPTED = 1;
    public static final int DATA_DESCRIPTOR = 1 << 3;
    public static final int PATCHED_DATA = 1 << 5;
    public static final int STRONG_ENCRYPTION = 1 << 6;
    public static final int UTF8_NAME = 1 << 11;
    public static final int MASKED_LOCAL_HEADER = 1 << 13;

    public static final GeneralPurposeFlags NONE = new GeneralPurposeFlags(0);

    private final int value;

    private GeneralPurposeFlags(int value) {
        this.value = value;
    }

    public static GeneralPurposeFlags of(int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException("Flag word out of 16-bit range: " + value);
        }
        return value == 0 ? NONE : new GeneralPurposeFlags(value);
    }

    public int getValue() {
        return value;
    }

    public boolean isEncrypted() {
        return (value & ENCRYPTED) != 0;
    }

    public boolean hasDataDescriptor() {
        return (value & DATA_DESCRIPTOR) != 0;
    }

    public boolean isPatchedData() {
        return (value & PATCHED_DATA) != 0;
    }

    public boolean usesStrongEncryption() {
        return (value & STRONG_ENCRYPTION) != 0;
    }

    public boolean isUtf8Name() {
        return (value & UTF8_NAME) != 0;
    }

    public boolean usesMaskedLocalHeader() {
        return (value & MASKED_LOCAL_HEADER) != 0;
    }

    /**
     * Rejects flag combinations this reader cannot safely interpret.
     *
     * @throws UnsupportedFeatureException naming the first unsupported flag that is set
     */
    public void checkSupported() throws UnsupportedFeatureException {
        if (isEncrypted()) {
            throw new UnsupportedFeatureException(Feature.ENCRYPTION);
        }
        if (hasDataDescriptor()) {
            throw new UnsupportedFeatureException(Feature.DATA_DESCRIPTOR);
        }
        if (isPatchedData()) {
            throw new UnsupportedFeatureException(Feature.PATCHED_DATA);
        }
        if (usesStrongEncryption()) {
            throw new UnsupportedFeatureException(Feature.STRONG_ENCRYPTION);
        }
        if (usesMaskedLocalHeader()) {
            throw new UnsupportedFeatureException(Feature.MASKED_HEADER);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GeneralPurposeFlags && ((GeneralPurposeFlags) o).value == value;
    }

    @Override
    public int hashCode() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("0x%04x", value);
    }
}
