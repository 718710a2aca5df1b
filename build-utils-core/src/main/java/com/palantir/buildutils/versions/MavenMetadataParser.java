/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
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

package com.palantir.buildutils.versions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

/** Reads {@code maven-metadata.xml} documents. Only the {@code <versioning>} section is looked at. */
public final class MavenMetadataParser {
    private static final XmlMapper MAPPER = XmlMapper.builder().build();

    private MavenMetadataParser() {
        // cannot instantiate
    }

    public static MavenMetadata parse(String xml) {
        JsonNode root;
        try {
            root = MAPPER.readTree(xml);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse maven metadata", e);
        }

        ImmutableMavenMetadata.Builder metadata = MavenMetadata.builder();
        JsonNode versioning = root == null ? null : root.get("versioning");
        if (versioning == null || !versioning.isObject()) {
            return metadata.build();
        }

        JsonNode release = versioning.get("release");
        if (release != null && !release.asText().isBlank()) {
            metadata.release(release.asText().trim());
        }

        JsonNode versions = versioning.get("versions");
        JsonNode version = versions == null ? null : versions.get("version");
        if (version == null) {
            return metadata.build();
        }

        // a single <version> element is read as a value, repeated ones as an array
        if (version.isArray()) {
            version.forEach(node -> addVersion(metadata, node));
        } else {
            addVersion(metadata, version);
        }
        return metadata.build();
    }

    private static void addVersion(ImmutableMavenMetadata.Builder metadata, JsonNode node) {
        String value = node.asText().trim();
        if (!value.isEmpty()) {
            metadata.addVersions(value);
        }
    }
}
