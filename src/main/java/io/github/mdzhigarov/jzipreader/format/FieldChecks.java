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

/**
 * Width checks shared by the record builders.
 */
final class FieldChecks {

    static final int MAX_U16 = 0xFFFF;
    static final long MAX_U32 = 0xFFFFFFFFL;

    private FieldChecks() {
    }

    static int u16(String field, int value) {
        if (value < 0 || value > MAX_U16) {
            throw new IllegalArgumentException(field + " does not fit 16 bits: " + value);
        }
        return value;
    }

    static long u32(String field, long value) {
        if (value < 0 || value > MAX_U32) {
            throw new IllegalArgumentException(field + " does not fit 32 bits: " + value);
        }
        return value;
    }
}
