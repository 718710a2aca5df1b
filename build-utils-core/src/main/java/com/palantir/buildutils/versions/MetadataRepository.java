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

import java.net.URI;
import org.immutables.value.Value;

/** A Maven repository queried for {@code maven-metadata.xml} files. */
@Value.Immutable
public interface MetadataRepository {
    String GRADLE_PLUGIN_PORTAL = "https://plugins.gradle.org/m2/";

    @Value.Parameter
    String url();

    @Value.Parameter
    Layout layout();

    @Value.Check
    default MetadataRepository normalize() {
        if (url().endsWith("/")) {
            return this;
        }
        return ImmutableMetadataRepository.of(url() + '/', layout());
    }

    default URI metadataUri(ModuleId module) {
        return URI.create(url() + layout().metadataPath(module));
    }

    static MetadataRepository of(String url) {
        return ImmutableMetadataRepository.of(url, Layout.STANDARD);
    }

    static MetadataRepository of(String url, Layout layout) {
        return ImmutableMetadataRepository.of(url, layout);
    }

    enum Layout {
        /** {@code <group path>/<name>/maven-metadata.xml} */
        STANDARD,
        /** {@code gradle/plugin/<group path>/maven-metadata.xml}, used by older plugin portal publications. */
        LEGACY_PLUGIN;

        String metadataPath(ModuleId module) {
            switch (this) {
                case STANDARD:
                    return module.repositoryPath() + "maven-metadata.xml";
                case LEGACY_PLUGIN:
                    return "gradle/plugin/" + module.group().replace('.', '/') + "/maven-metadata.xml";
            }
            throw new IllegalStateException("Unknown layout: " + this);
        }
    }
}
