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
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.immutables.value.Value;

/**
 * The result of comparing the dependencies of one scope (the build script, or one project) against the versions
 * published in their repositories.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableVersionReport.class)
public interface VersionReport {
    /** How the scope is named in the report headings, e.g. {@code "build script"} or {@code "project 'core'"}. */
    String scope();

    /** Dependencies at the advertised release version. */
    List<MavenCoordinate> latest();

    List<OutdatedDependency> outdated();

    /** Dependencies for which no repository advertised a release. */
    List<MavenCoordinate> unknown();

    @JsonIgnore
    @Value.Derived
    default boolean isEmpty() {
        return latest().isEmpty() && outdated().isEmpty() && unknown().isEmpty();
    }

    static ImmutableVersionReport.Builder builder() {
        return ImmutableVersionReport.builder();
    }

    /**
     * Sorts every used coordinate into one of the three groups, using the metadata in {@code holders}. Coordinates
     * keep their given order inside each group and duplicates are reported once.
     */
    static VersionReport classify(
            String scope, Collection<MavenCoordinate> used, Map<ModuleId, VersionHolder> holders) {
        ImmutableVersionReport.Builder report = builder().scope(scope);
        Set<MavenCoordinate> unique = ImmutableSet.copyOf(used);

        for (MavenCoordinate coordinate : unique) {
            VersionHolder holder = holders.getOrDefault(coordinate.moduleId(), new VersionHolder());
            if (holder.release().isEmpty()) {
                report.addUnknown(coordinate);
            } else if (holder.release().get().equals(coordinate.version())) {
                report.addLatest(coordinate);
            } else {
                report.addOutdated(OutdatedDependency.of(coordinate, holder.toVersionString(coordinate.version())));
            }
        }
        return report.build();
    }
}
