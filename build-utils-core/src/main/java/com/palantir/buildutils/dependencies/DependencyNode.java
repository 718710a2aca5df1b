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

package com.palantir.buildutils.dependencies;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.immutables.value.Value;

/** One module of a resolved dependency tree, with its artifacts and the modules it pulled in. */
@Value.Immutable
public interface DependencyNode {
    String group();

    String name();

    String version();

    List<ArtifactInfo> artifacts();

    List<DependencyNode> children();

    default String mavenId() {
        return group() + ':' + name() + ':' + version();
    }

    /** This node followed by all of its descendants, depth first, each distinct node once. */
    default List<DependencyNode> flatten() {
        Set<DependencyNode> flat = new LinkedHashSet<>();
        collect(this, flat);
        return List.copyOf(flat);
    }

    private static void collect(DependencyNode node, Set<DependencyNode> flat) {
        if (flat.add(node)) {
            node.children().forEach(child -> collect(child, flat));
        }
    }

    static ImmutableDependencyNode.Builder builder() {
        return ImmutableDependencyNode.builder();
    }
}
