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
import com.palantir.buildutils.dependencies.ArtifactInfo;
import com.palantir.buildutils.dependencies.DependencyNode;
import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.gradle.api.Project;
import org.gradle.api.plugins.JavaPlugin;

/** Resolves the dependency trees of the standard Java classpaths. */
public final class ProjectDependencies {
    private ProjectDependencies() {
        // cannot instantiate
    }

    public static List<DependencyNode> compileAndRuntime(Project project) {
        return resolve(
                project,
                JavaPlugin.COMPILE_CLASSPATH_CONFIGURATION_NAME,
                JavaPlugin.RUNTIME_CLASSPATH_CONFIGURATION_NAME);
    }

    public static List<DependencyNode> compile(Project project) {
        return resolve(project, JavaPlugin.COMPILE_CLASSPATH_CONFIGURATION_NAME);
    }

    public static List<DependencyNode> runtime(Project project) {
        return resolve(project, JavaPlugin.RUNTIME_CLASSPATH_CONFIGURATION_NAME);
    }

    /** Modules already found in an earlier configuration are not repeated. */
    public static List<DependencyNode> resolve(Project project, String... configurationNames) {
        List<DependencyNode> nodes = new ArrayList<>();
        Set<String> existingNames = new HashSet<>();
        for (String configurationName : configurationNames) {
            DependencyScanner.scan(project, configurationName, nodes, existingNames);
        }
        return ImmutableList.copyOf(nodes);
    }

    /** Every artifact file of the trees, transitive ones included, in discovery order. */
    public static List<File> artifactFiles(Collection<DependencyNode> roots) {
        Set<File> files = new LinkedHashSet<>();
        for (DependencyNode root : roots) {
            for (DependencyNode node : root.flatten()) {
                node.artifacts().stream().map(ArtifactInfo::file).forEach(files::add);
            }
        }
        return ImmutableList.copyOf(files);
    }
}
