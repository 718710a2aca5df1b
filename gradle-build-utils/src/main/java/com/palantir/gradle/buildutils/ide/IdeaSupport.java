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

package com.palantir.gradle.buildutils.ide;

import java.io.File;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import org.gradle.api.Action;
import org.gradle.api.Project;
import org.gradle.plugins.ide.idea.IdeaPlugin;
import org.gradle.plugins.ide.idea.model.IdeaModel;
import org.gradle.plugins.ide.idea.model.IdeaModule;

/** Adjusts the IntelliJ module model, only when the {@code idea} plugin is applied. */
public final class IdeaSupport {
    public static final String IDEA_PLUGIN_ID = "idea";

    private IdeaSupport() {
        // cannot instantiate
    }

    /** Applies {@code idea} to {@code project} and to the root project, which IntelliJ needs to read the model. */
    public static void applyIdea(Project project) {
        if (!project.getRootProject().getPluginManager().hasPlugin(IDEA_PLUGIN_ID)) {
            project.getRootProject().getPluginManager().apply(IDEA_PLUGIN_ID);
        }
        if (!project.getPluginManager().hasPlugin(IDEA_PLUGIN_ID)) {
            project.getPluginManager().apply(IDEA_PLUGIN_ID);
        }
    }

    public static void configureModule(Project project, Action<? super IdeaModule> action) {
        project.getPlugins().withType(IdeaPlugin.class, _ignored -> {
            IdeaModule module = project.getExtensions().getByType(IdeaModel.class).getModule();
            action.execute(module);
        });
    }

    public static void addSourceDirs(Project project, Collection<File> sources, Collection<File> resources) {
        configureModule(project, module -> {
            module.setSourceDirs(union(module.getSourceDirs(), sources));
            module.setResourceDirs(union(module.getResourceDirs(), resources));
        });
    }

    public static void addTestDirs(Project project, Collection<File> sources, Collection<File> resources) {
        configureModule(project, module -> {
            module.getTestSources().from(sources);
            module.getTestResources().from(resources);
        });
    }

    // other plugins add to these sets in place, so they must stay mutable
    private static Set<File> union(Set<File> existing, Collection<File> added) {
        Set<File> result = new LinkedHashSet<>();
        if (existing != null) {
            result.addAll(existing);
        }
        result.addAll(added);
        return result;
    }
}
