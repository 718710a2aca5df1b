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

package com.palantir.gradle.buildutils.libraries;

import com.google.common.collect.ImmutableList;
import com.palantir.buildutils.dependencies.DependencyNode;
import com.palantir.buildutils.libraries.LibraryNames;
import com.palantir.gradle.buildutils.deps.ProjectDependencies;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.gradle.api.Action;
import org.gradle.api.DefaultTask;
import org.gradle.api.Project;
import org.gradle.api.file.CopySpec;
import org.gradle.api.logging.Logging;
import org.gradle.api.provider.Property;
import org.gradle.api.provider.Provider;
import org.gradle.api.tasks.Internal;
import org.gradle.api.tasks.TaskAction;
import org.slf4j.Logger;

/**
 * Collects the runtime libraries of a project under unique file names, for distributions that ship them in a
 * {@code lib/} directory next to the jar.
 * <p>
 * The helpers must be called from task actions or copy specs that are evaluated at execution time. Nothing is
 * collected when no task was requested, or when only clean tasks were requested.
 */
public abstract class PrepLibrariesTask extends DefaultTask {
    private static final Logger log = Logging.getLogger(PrepLibrariesTask.class);

    public static final String TASK_NAME = "prepareLibraries";

    @Internal
    public abstract Property<LibraryCacheBuildService> getLibraryCache();

    public PrepLibrariesTask() {
        setGroup("build");
        setDescription("Prepares and checks the libraries used by all projects.");
        getOutputs().upToDateWhen(_ignored -> false);
        notCompatibleWithConfigurationCache("Resolves the runtime classpath of the project at execution time");
    }

    @TaskAction
    public final void prepare() {
        Map<File, String> libraries = collectLibraries();
        log.info("\tPrepared {} libraries for {}", libraries.size(), getProject().getName());
    }

    /** Runtime libraries of this project, mapped to their unique file names. */
    public final Map<File, String> collectLibraries() {
        Project project = getProject();
        return getLibraryCache()
                .get()
                .libraries("project:" + project.getPath(), () -> runtimeFiles(project));
    }

    /** A {@code Class-Path} manifest value, e.g. {@code "lib/a.jar lib/b.jar\r\n"}. */
    public final String getAsClasspath() {
        if (!shouldRun(getProject())) {
            return "";
        }
        log.info("\tGetting libraries as classpath for {}", getProject().getName());
        return LibraryNames.asClasspath(collectLibraries().values());
    }

    public final Action<CopySpec> copyLibrariesTo() {
        return this::copyLibrariesTo;
    }

    public final void copyLibrariesTo(CopySpec copySpec) {
        if (!shouldRun(getProject())) {
            return;
        }
        log.info("\tCopying libraries for {}", getProject().getName());
        addTo(copySpec, collectLibraries());
    }

    public final void copyLibrariesTo(File location) {
        if (!shouldRun(getProject())) {
            return;
        }
        log.info("\tCopying libraries for {}", getProject().getName());
        for (Map.Entry<File, String> library : collectLibraries().entrySet()) {
            File target = new File(location, library.getValue());
            try {
                Files.createDirectories(location.toPath());
                Files.copy(library.getKey().toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new RuntimeException("Error copying " + library.getKey() + " to " + target, e);
            }
        }
    }

    /** Copies the compile libraries of all {@code projects}, named uniquely across them, into a copy spec. */
    public static Action<CopySpec> copyCompileLibrariesTo(Project... projects) {
        return copySpec -> copyAllTo(copySpec, "compile", ProjectDependencies::compile, projects);
    }

    public static Action<CopySpec> copyRuntimeLibrariesTo(Project... projects) {
        return copySpec -> copyAllTo(copySpec, "runtime", ProjectDependencies::runtime, projects);
    }

    private static void copyAllTo(
            CopySpec copySpec,
            String kind,
            Function<Project, List<DependencyNode>> resolver,
            Project... projects) {
        if (projects.length == 0 || !shouldRun(projects[0])) {
            return;
        }

        List<Project> all = ImmutableList.copyOf(projects);
        String names = all.stream().map(Project::getName).collect(Collectors.joining(","));
        String key = kind + ":" + all.stream().map(Project::getPath).collect(Collectors.joining(","));

        LibraryCacheBuildService cache = libraryCache(projects[0]);
        Map<File, String> libraries = cache.libraries(key, () -> {
            log.info("\tCollecting all libraries for: {}", names);
            List<File> files = new ArrayList<>();
            all.forEach(project -> files.addAll(ProjectDependencies.artifactFiles(resolver.apply(project))));
            return files;
        });

        log.info("\tCopying {} libraries for {}", kind, names);
        addTo(copySpec, libraries);
    }

    private static void addTo(CopySpec copySpec, Map<File, String> libraries) {
        libraries.forEach((file, fileName) -> copySpec.from(file, spec -> spec.rename(_ignored -> fileName)));
    }

    private static Collection<File> runtimeFiles(Project project) {
        return ProjectDependencies.artifactFiles(ProjectDependencies.runtime(project));
    }

    static LibraryCacheBuildService libraryCache(Project project) {
        return registerLibraryCache(project).get();
    }

    public static Provider<LibraryCacheBuildService> registerLibraryCache(Project project) {
        return project.getGradle()
                .getSharedServices()
                .registerIfAbsent(LibraryCacheBuildService.NAME, LibraryCacheBuildService.class, _ignored -> {});
    }

    /** The requested tasks of the whole build decide, so checking one project is enough. */
    static boolean shouldRun(Project project) {
        return LibraryNames.shouldRun(project.getGradle().getStartParameter().getTaskNames());
    }
}
