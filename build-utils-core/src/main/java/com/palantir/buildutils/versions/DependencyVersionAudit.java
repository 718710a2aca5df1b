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

import com.google.common.collect.ImmutableList;
import com.palantir.buildutils.http.TextFetcher;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares the dependencies of a build against the versions published in its repositories.
 * <p>
 * A coordinate may be in use at several versions; the metadata is fetched once per {@code group:name} and every
 * used version is classified on its own.
 */
public final class DependencyVersionAudit {
    private static final Logger log = LoggerFactory.getLogger(DependencyVersionAudit.class);

    public static final String BUILD_SCRIPT_SCOPE = "build script";
    public static final String ROOT_PROJECT_SCOPE = "project";

    private final TextFetcher fetcher;
    private final int threads;
    private final String pluginRepository;

    public DependencyVersionAudit(TextFetcher fetcher, int threads) {
        this(fetcher, threads, MetadataRepository.GRADLE_PLUGIN_PORTAL);
    }

    public DependencyVersionAudit(TextFetcher fetcher, int threads, String pluginRepository) {
        this.fetcher = fetcher;
        this.threads = threads;
        this.pluginRepository = pluginRepository;
    }

    public static String projectScope(String projectName) {
        return ROOT_PROJECT_SCOPE + " '" + projectName + "'";
    }

    /**
     * Build script dependencies are looked up in the plugin repository, in both its current and legacy layout, and
     * in the build script repositories.
     */
    public VersionReport auditBuildScript(Collection<MavenCoordinate> dependencies, Collection<String> repositories) {
        Set<ModuleId> modules = modulesOf(dependencies);
        if (!modules.isEmpty()) {
            log.info("\tGetting version data for {} dependencies...", modules.size());
        }

        List<MetadataRepository> standard = ImmutableList.<MetadataRepository>builder()
                .add(MetadataRepository.of(pluginRepository))
                .addAll(repositories.stream().map(MetadataRepository::of).collect(Collectors.toList()))
                .build();

        try (VersionInfoFetcher versionInfo = new VersionInfoFetcher(fetcher, threads)) {
            versionInfo.fetch(
                    modules, List.of(MetadataRepository.of(pluginRepository, MetadataRepository.Layout.LEGACY_PLUGIN)));
            Map<ModuleId, VersionHolder> holders = versionInfo.fetch(modules, distinct(standard));
            return VersionReport.classify(BUILD_SCRIPT_SCOPE, dependencies, holders);
        }
    }

    /**
     * Audits several projects at once. Metadata is fetched for the union of all dependencies from the union of all
     * repositories, then one report is made per project, keyed by scope.
     *
     * @param dependenciesByScope the declared dependencies of each project, in report order
     */
    public List<VersionReport> auditProjects(
            Map<String, ? extends Collection<MavenCoordinate>> dependenciesByScope, Collection<String> repositories) {
        Set<ModuleId> modules = modulesOf(dependenciesByScope.values().stream()
                .flatMap(Collection::stream)
                .collect(Collectors.toList()));
        if (!modules.isEmpty()) {
            log.info("\tGetting version data for {} dependencies...", modules.size());
        }

        List<MetadataRepository> metadataRepositories =
                distinct(repositories.stream().map(MetadataRepository::of).collect(Collectors.toList()));

        try (VersionInfoFetcher versionInfo = new VersionInfoFetcher(fetcher, threads)) {
            Map<ModuleId, VersionHolder> holders = versionInfo.fetch(modules, metadataRepositories);
            return dependenciesByScope.entrySet().stream()
                    .map(entry -> VersionReport.classify(entry.getKey(), entry.getValue(), holders))
                    .collect(ImmutableList.toImmutableList());
        }
    }

    private static Set<ModuleId> modulesOf(Collection<MavenCoordinate> dependencies) {
        return dependencies.stream()
                .map(MavenCoordinate::moduleId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static List<MetadataRepository> distinct(List<MetadataRepository> repositories) {
        Map<String, MetadataRepository> byUrl = new LinkedHashMap<>();
        repositories.forEach(repository -> byUrl.putIfAbsent(repository.url(), repository));
        return List.copyOf(byUrl.values());
    }
}
