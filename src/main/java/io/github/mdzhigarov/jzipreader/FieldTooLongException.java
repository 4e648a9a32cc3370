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
 * A variable-length field does not fit the 16-bit length that precedes it on the wire.
 */
public final class FieldTooLongException extends ZipArchiveException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final int length;

    public FieldTooLongException(String fieldName, int length) {
        super("Field '" + fieldName + "' is too long: " + length + " bytes (max 65535)");
        this.fieldName = fieldName;
        this.length = length;
    }

    public String getFieldName() {
        return fieldName;
    }

    public int getLength() {
        return length;
    }

    @Override
    public Kind getKind() {
        return Kind.FIELD_TOO_LONG;
    }
}
