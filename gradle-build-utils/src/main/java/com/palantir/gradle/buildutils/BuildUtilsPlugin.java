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

package com.palantir.gradle.buildutils;

import com.palantir.buildutils.versions.VersionInfoFetcher;
import com.palantir.gradle.buildutils.deps.GetVersionInfoTask;
import com.palantir.gradle.buildutils.libraries.LibraryCacheBuildService;
import com.palantir.gradle.buildutils.libraries.PrepLibrariesTask;
import com.palantir.gradle.buildutils.wrapper.WrapperTasks;
import org.gradle.api.JavaVersion;
import org.gradle.api.Plugin;
import org.gradle.api.Project;
import org.gradle.api.logging.Logging;
import org.gradle.api.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/**
 * Adds the {@code GradleUtils} extension and the dependency, wrapper and library tasks. The wrapper tasks only exist
 * on the root project, since the wrapper belongs to the whole build.
 */
public class BuildUtilsPlugin implements Plugin<Project> {
    private static final Logger log = Logging.getLogger(BuildUtilsPlugin.class);

    public static final String EXTENSION_NAME = "GradleUtils";
    public static final String THREADS_PROPERTY = "buildutils.versions.threads";

    @Override
    public final void apply(@NotNull Project project) {
        log.info("\tGradle {} on Java {}", project.getGradle().getGradleVersion(), JavaVersion.current());

        project.getExtensions().create(EXTENSION_NAME, BuildUtilsExtension.class, project);

        project.getTasks().register(GetVersionInfoTask.TASK_NAME, GetVersionInfoTask.class, task -> {
            task.getThreads()
                    .convention(project.getProviders()
                            .gradleProperty(THREADS_PROPERTY)
                            .map(Integer::parseInt)
                            .orElse(VersionInfoFetcher.DEFAULT_THREADS));
            task.getTimeoutSeconds()
                    .convention(project.getProviders()
                            .gradleProperty(WrapperTasks.TIMEOUT_PROPERTY)
                            .map(Integer::parseInt)
                            .orElse(WrapperTasks.DEFAULT_TIMEOUT_SECONDS));
            task.getReportFile()
                    .convention(project.getLayout().getBuildDirectory().file(GetVersionInfoTask.REPORT_PATH));
        });

        if (project.equals(project.getRootProject())) {
            WrapperTasks.register(project);
        }

        project.getPluginManager().withPlugin("java", _ignored -> {
            Provider<LibraryCacheBuildService> libraryCache = PrepLibrariesTask.registerLibraryCache(project);
            project.getTasks().register(PrepLibrariesTask.TASK_NAME, PrepLibrariesTask.class, task -> {
                task.getLibraryCache().set(libraryCache);
                task.usesService(libraryCache);
            });
        });
    }
}
