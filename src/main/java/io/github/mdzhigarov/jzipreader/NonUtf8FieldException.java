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
 * A file name or comment is not valid UTF-8.
 */
public final class NonUtf8FieldException extends ZipArchiveException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;
    private final long offset;

    public NonUtf8FieldException(String fieldName, long offset) {
        super("Field '" + fieldName + "' at offset " + offset + " is not valid UTF-8");
        this.fieldName = fieldName;
        this.offset = offset;
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * @return the absolute offset of the first byte of the field
     */
    public long getOffset() {
        return offset;
    }

    @Override
    public Kind getKind() {
        return Kind.NON_UTF8_FIELD;
    }
}
