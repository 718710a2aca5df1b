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

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.buildutils.dependencies.ArtifactInfo;
import com.palantir.buildutils.dependencies.DependencyNode;
import com.palantir.gradle.buildutils.AbstractProjectBuilderTest;
import com.palantir.gradle.buildutils.LocalMavenRepository;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DependencyScannerTest extends AbstractProjectBuilderTest {
    @BeforeEach
    public void before() throws IOException {
        project.getPluginManager().apply("java");
        new LocalMavenRepository(projectDir.resolve("repo"))
                .publish("com.example:shared:1.0")
                .publish("com.example:a:1.0", "com.example:shared:1.0")
                .publish("com.example:b:1.0", "com.example:shared:1.0")
                .publish("com.example:extra:1.0")
                .addTo(project);
    }

    @Test
    public void buildsTreesWithArtifacts() {
        project.getDependencies().add("implementation", "com.example:a:1.0");

        List<DependencyNode> nodes = ProjectDependencies.compile(project);

        assertThat(nodes).hasSize(1);
        DependencyNode a = nodes.get(0);
        assertThat(a.mavenId()).isEqualTo("com.example:a:1.0");
        assertThat(a.artifacts()).extracting(ArtifactInfo::id).containsExactly("com.example:a:1.0");
        assertThat(a.artifacts().get(0).file()).isAbsolute().hasName("a-1.0.jar");
        assertThat(a.children()).extracting(DependencyNode::mavenId).containsExactly("com.example:shared:1.0");
    }

    @Test
    public void listsSharedLeavesUnderEveryParent() {
        project.getDependencies().add("implementation", "com.example:a:1.0");
        project.getDependencies().add("implementation", "com.example:b:1.0");

        List<DependencyNode> nodes = ProjectDependencies.compile(project);

        assertThat(nodes).extracting(DependencyNode::mavenId)
                .containsExactlyInAnyOrder("com.example:a:1.0", "com.example:b:1.0");
        assertThat(nodes).allSatisfy(node -> assertThat(node.children())
                .extracting(DependencyNode::mavenId)
                .containsExactly("com.example:shared:1.0"));
    }

    @Test
    public void doesNotRepeatModulesAcrossConfigurations() {
        project.getDependencies().add("implementation", "com.example:a:1.0");
        project.getDependencies().add("implementation", "com.example:shared:1.0");
        project.getDependencies().add("runtimeOnly", "com.example:extra:1.0");

        List<DependencyNode> nodes = ProjectDependencies.compileAndRuntime(project);

        assertThat(nodes).extracting(DependencyNode::mavenId)
                .containsExactlyInAnyOrder("com.example:a:1.0", "com.example:shared:1.0", "com.example:extra:1.0");
        assertThat(ProjectDependencies.artifactFiles(nodes))
                .extracting(File::getName)
                .containsExactlyInAnyOrder("a-1.0.jar", "shared-1.0.jar", "extra-1.0.jar");
    }

    @Test
    public void skipsMissingAndUnresolvableConfigurations() {
        project.getDependencies().add("implementation", "com.example:a:1.0");
        List<DependencyNode> nodes = new ArrayList<>();
        Set<String> existingNames = new HashSet<>();

        DependencyScanner.scan(project, "doesNotExist", nodes, existingNames);
        DependencyScanner.scan(project, "implementation", nodes, existingNames);

        assertThat(nodes).isEmpty();
        assertThat(existingNames).isEmpty();
    }

    @Test
    public void skipsModulesThatWereAlreadyExpanded() {
        project.getDependencies().add("implementation", "com.example:a:1.0");
        project.getDependencies().add("implementation", "com.example:b:1.0");
        List<DependencyNode> nodes = new ArrayList<>();
        Set<String> existingNames = new HashSet<>(Set.of("com.example:a"));

        DependencyScanner.scan(project, "compileClasspath", nodes, existingNames);

        assertThat(nodes).extracting(DependencyNode::mavenId).containsExactly("com.example:b:1.0");
        assertThat(existingNames).containsExactlyInAnyOrder("com.example:a", "com.example:b");
    }

    @Test
    public void skipsUnresolvableDependencies() {
        project.getDependencies().add("implementation", "com.example:missing:1.0");
        project.getDependencies().add("implementation", "com.example:extra:1.0");

        assertThat(ProjectDependencies.compile(project))
                .extracting(DependencyNode::mavenId)
                .containsExactly("com.example:extra:1.0");
    }
}
