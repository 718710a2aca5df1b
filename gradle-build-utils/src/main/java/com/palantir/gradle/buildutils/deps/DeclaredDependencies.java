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

package com.palantir.gradle.buildutils.deps;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.palantir.buildutils.versions.MavenCoordinate;
import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.gradle.api.Project;
import org.gradle.api.artifacts.Configuration;
import org.gradle.api.artifacts.ExternalModuleDependency;
import org.gradle.api.artifacts.ResolvedDependency;
import org.gradle.api.artifacts.dsl.RepositoryHandler;
import org.gradle.api.artifacts.repositories.MavenArtifactRepository;

/** Reads the external dependencies and Maven repositories that a build declares. */
public final class DeclaredDependencies {
    public static final String BUILD_SCRIPT_CLASSPATH = "classpath";

    private DeclaredDependencies() {
        // cannot instantiate
    }

    /** External module dependencies with a version, declared in any configuration of {@code project}. */
    public static List<MavenCoordinate> declaredBy(Project project) {
        Set<MavenCoordinate> coordinates = new LinkedHashSet<>();
        for (Configuration configuration : project.getConfigurations()) {
            for (ExternalModuleDependency dependency :
                    configuration.getDependencies().withType(ExternalModuleDependency.class)) {
                String group = dependency.getGroup();
                String version = dependency.getVersion();
                if (group != null && version != null && !version.isEmpty()) {
                    coordinates.add(MavenCoordinate.of(group, dependency.getName(), version));
                }
            }
        }
        return ImmutableList.copyOf(coordinates);
    }

    /** The resolved first level modules of the build script classpath, unresolvable ones left out. */
    public static List<MavenCoordinate> buildScriptDependencies(Project project) {
        Configuration classpath =
                project.getBuildscript().getConfigurations().findByName(BUILD_SCRIPT_CLASSPATH);
        if (classpath == null || !classpath.isCanBeResolved()) {
            return ImmutableList.of();
        }

        ImmutableSet.Builder<MavenCoordinate> coordinates = ImmutableSet.builder();
        for (ResolvedDependency dependency :
                classpath.getResolvedConfiguration().getLenientConfiguration().getFirstLevelModuleDependencies()) {
            coordinates.add(MavenCoordinate.of(
                    dependency.getModuleGroup(), dependency.getModuleName(), dependency.getModuleVersion()));
        }
        return coordinates.build().asList();
    }

    /** URLs of the http(s) Maven repositories, each ending in a slash. */
    public static List<String> repositoryUrls(RepositoryHandler repositories) {
        ImmutableSet.Builder<String> urls = ImmutableSet.builder();
        for (MavenArtifactRepository repository : repositories.withType(MavenArtifactRepository.class)) {
            URI url = repository.getUrl();
            String scheme = url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
            if (scheme.equals("http") || scheme.equals("https")) {
                String text = url.toString();
                urls.add(text.endsWith("/") ? text : text + "/");
            }
        }
        return urls.build().asList();
    }
}
