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
 * The archive is structurally valid but relies on a feature this reader refuses to interpret.
 * Such archives are rejected instead of being decoded approximately.
 */
public final class UnsupportedFeatureException extends ZipArchiveException {

    private static final long serialVersionUID = 1L;

    /**
     * Features that cause an archive or an entry to be rejected.
     */
    public enum Feature {
        ENCRYPTION("encrypted entries"),
        DATA_DESCRIPTOR("trailing data descriptors"),
        PATCHED_DATA("compressed patched data"),
        STRONG_ENCRYPTION("strong encryption"),
        MASKED_HEADER("masked local headers"),
        ZIP64("ZIP64 archives"),
        MULTI_DISK("multi-disk archives"),
        COMPRESSION_METHOD("compression method"),
        LARGE_ENTRY("entries larger than a Java array");

        private final String description;

        Feature(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Feature feature;

    public UnsupportedFeatureException(Feature feature) {
        super("Unsupported: " + feature.getDescription());
        this.feature = feature;
    }

    public UnsupportedFeatureException(Feature feature, String detail) {
        super("Unsupported: " + feature.getDescription() + " (" + detail + ")");
        this.feature = feature;
    }

    public Feature getFeature() {
        return feature;
    }

    @Override
    public Kind getKind() {
        return Kind.UNSUPPORTED_FEATURE;
    }
}
