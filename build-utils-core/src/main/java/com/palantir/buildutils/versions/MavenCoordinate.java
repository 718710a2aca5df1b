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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Splitter;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableMavenCoordinate.class)
public interface MavenCoordinate {
    @Value.Parameter
    String group();

    @Value.Parameter
    String name();

    @Value.Parameter
    String version();

    @JsonIgnore
    @Value.Derived
    default ModuleId moduleId() {
        return ModuleId.of(group(), name());
    }

    /**
     * Gradle publishes plugin marker artifacts as {@code <plugin id>:<plugin id>.gradle.plugin}, for which the
     * plugin id alone is enough to identify them.
     */
    @JsonIgnore
    default boolean isPluginMarker() {
        return name().equals(group() + ".gradle.plugin");
    }

    @JsonIgnore
    default String mavenId() {
        return group() + ':' + name() + ':' + version();
    }

    static MavenCoordinate of(String group, String name, String version) {
        return ImmutableMavenCoordinate.of(group, name, version);
    }

    /** Parses a {@code group:name:version} notation. */
    static MavenCoordinate parse(String notation) {
        List<String> parts = Splitter.on(':').splitToList(notation);
        if (parts.size() != 3 || parts.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Expected 'group:name:version' but got '" + notation + "'");
        }
        return of(parts.get(0), parts.get(1), parts.get(2));
    }
}
