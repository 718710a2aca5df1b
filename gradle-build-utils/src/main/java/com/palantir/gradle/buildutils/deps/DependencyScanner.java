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

import com.palantir.buildutils.dependencies.ArtifactInfo;
import com.palantir.buildutils.dependencies.DependencyNode;
import com.palantir.buildutils.dependencies.ImmutableDependencyNode;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.gradle.api.Project;
import org.gradle.api.artifacts.Configuration;
import org.gradle.api.artifacts.ModuleVersionIdentifier;
import org.gradle.api.artifacts.ResolvedArtifact;
import org.gradle.api.artifacts.ResolvedDependency;

/**
 * Turns Gradle's resolved dependency graph into {@link DependencyNode} trees.
 * <p>
 * Resolving configurations at configuration time is expensive, so this should be called from a task action or
 * {@code afterEvaluate}.
 */
public final class DependencyScanner {
    private DependencyScanner() {
        // cannot instantiate
    }

    /**
     * Adds the dependency trees of {@code configurationName} to {@code projectDependencies}. A module with
     * dependencies of its own records its {@code group:name} in {@code existingNames} and is not expanded again,
     * which also stops the recursion when a project depends on an older release of itself. Leaf modules are not
     * recorded and show up under every module that uses them. Trees equal to one already in
     * {@code projectDependencies} are not added twice. Configurations that are missing or cannot be resolved are
     * skipped, and so are unresolvable dependencies.
     */
    public static void scan(
            Project project,
            String configurationName,
            List<DependencyNode> projectDependencies,
            Set<String> existingNames) {
        Configuration configuration = project.getConfigurations().findByName(configurationName);
        if (configuration == null || !configuration.isCanBeResolved()) {
            return;
        }

        Set<ResolvedDependency> firstLevel = configuration
                .getResolvedConfiguration()
                .getLenientConfiguration()
                .getFirstLevelModuleDependencies();
        for (ResolvedDependency dependency : firstLevel) {
            makeTree(dependency, existingNames)
                    .filter(node -> !projectDependencies.contains(node))
                    .ifPresent(projectDependencies::add);
        }
    }

    private static Optional<DependencyNode> makeTree(ResolvedDependency dependency, Set<String> existingNames) {
        String group = dependency.getModuleGroup();
        String name = dependency.getModuleName();
        String key = group + ":" + name;
        if (existingNames.contains(key)) {
            return Optional.empty();
        }

        ImmutableDependencyNode.Builder node = DependencyNode.builder()
                .group(group)
                .name(name)
                .version(dependency.getModuleVersion());

        for (ResolvedArtifact artifact : dependency.getModuleArtifacts()) {
            ModuleVersionIdentifier id = artifact.getModuleVersion().getId();
            node.addArtifacts(ArtifactInfo.of(
                    id.getGroup(), id.getName(), id.getVersion(), artifact.getFile().getAbsoluteFile()));
        }
        Set<ResolvedDependency> children = dependency.getChildren();
        if (!children.isEmpty()) {
            existingNames.add(key);
        }
        for (ResolvedDependency child : children) {
            makeTree(child, existingNames).ifPresent(node::addChildren);
        }
        return Optional.of(node.build());
    }
}
