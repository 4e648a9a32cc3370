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
 * A record did not start with the signature its position requires.
 */
public final class InvalidSignatureException extends ZipArchiveException {

    private static final long serialVersionUID = 1L;

    private final long actualSignature;
    private final long expectedSignature;
    private final long offset;

    public InvalidSignatureException(long actualSignature, long expectedSignature, long offset) {
        super(String.format("Invalid ZIP signature 0x%08x at offset %d (expected 0x%08x)",
                actualSignature, offset, expectedSignature));
        this.actualSignature = actualSignature;
        this.expectedSignature = expectedSignature;
        this.offset = offset;
    }

    /**
     * @return the 32-bit value found where the signature should have been
     */
    public long getActualSignature() {
        return actualSignature;
    }

    public long getExpectedSignature() {
        return expectedSignature;
    }

    /**
     * @return the absolute offset of the record that failed to decode
     */
    public long getOffset() {
        return offset;
    }

    @Override
    public Kind getKind() {
        return Kind.INVALID_SIGNATURE;
    }
}
