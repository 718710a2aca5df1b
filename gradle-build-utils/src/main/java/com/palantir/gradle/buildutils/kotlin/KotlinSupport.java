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

package com.palantir.gradle.buildutils.kotlin;

import com.palantir.buildutils.kotlin.KotlinVersions;
import java.util.Optional;
import org.gradle.api.Action;
import org.gradle.api.JavaVersion;
import org.gradle.api.Project;
import org.gradle.api.Task;
import org.gradle.api.file.Directory;
import org.gradle.api.file.SourceDirectorySet;
import org.gradle.api.logging.Logging;
import org.gradle.api.provider.Provider;
import org.jetbrains.kotlin.gradle.dsl.JvmTarget;
import org.jetbrains.kotlin.gradle.dsl.KotlinJvmCompilerOptions;
import org.jetbrains.kotlin.gradle.dsl.KotlinVersion;
import org.jetbrains.kotlin.gradle.plugin.KotlinBasePlugin;
import org.jetbrains.kotlin.gradle.plugin.KotlinSourceSetContainer;
import org.jetbrains.kotlin.gradle.tasks.KotlinJvmCompile;
import org.slf4j.Logger;

/**
 * All access to the Kotlin Gradle plugin API. Nothing here may be called unless the Kotlin JVM plugin is applied,
 * since its classes are only present on the build classpath in that case.
 */
public final class KotlinSupport {
    private static final Logger log = Logging.getLogger(KotlinSupport.class);

    public static final String KOTLIN_JVM_PLUGIN_ID = "org.jetbrains.kotlin.jvm";

    private KotlinSupport() {
        // cannot instantiate
    }

    /** Checked by plugin id, so it is safe to call without Kotlin on the classpath. */
    public static boolean hasKotlin(Project project) {
        return project.getPluginManager().hasPlugin(KOTLIN_JVM_PLUGIN_ID);
    }

    public static Optional<String> pluginVersion(Project project) {
        return project.getPlugins().withType(KotlinBasePlugin.class).stream()
                .findFirst()
                .map(KotlinBasePlugin::getPluginVersion);
    }

    /** The api and language version to compile with: the major.minor of the applied Kotlin plugin. */
    public static String languageVersion(Project project) {
        return KotlinVersions.languageVersion(pluginVersion(project).orElse(null));
    }

    /** Applies the target JVM and language level to every Kotlin JVM compile task of {@code project}. */
    public static void configureCompileTasks(
            Project project, JavaVersion jvmTarget, Action<? super Task> kotlinAction) {
        String languageVersion = languageVersion(project);

        project.getTasks().withType(KotlinJvmCompile.class).configureEach(task -> {
            KotlinJvmCompilerOptions options = task.getCompilerOptions();
            options.getJvmTarget().set(JvmTarget.Companion.fromTarget(jvmTarget.toString()));
            options.getApiVersion().set(KotlinVersion.Companion.fromVersion(languageVersion));
            options.getLanguageVersion().set(KotlinVersion.Companion.fromVersion(languageVersion));

            task.doFirst(_ignored -> log.info(
                    "\tCompiling classes to Kotlin {}, Java {}",
                    options.getLanguageVersion().get().getVersion(),
                    options.getJvmTarget().get().getTarget()));

            kotlinAction.execute(task);
        });
    }

    /**
     * Configures the Kotlin compile task of a versioned source set. The module name has to stay the project name,
     * otherwise the versioned classes cannot see the internals of the main ones at runtime.
     */
    public static void configureVersionedCompileTask(
            Project project, String taskName, String release, String dependsOnTaskName) {
        project.getTasks().named(taskName, KotlinJvmCompile.class).configure(task -> {
            task.dependsOn(dependsOnTaskName);
            task.getCompilerOptions().getJvmTarget().set(JvmTarget.Companion.fromTarget(release));
            task.getCompilerOptions().getModuleName().set(project.getName());
        });
    }

    public static SourceDirectorySet kotlinSources(Project project, String sourceSetName) {
        return project.getExtensions()
                .getByType(KotlinSourceSetContainer.class)
                .getSourceSets()
                .getByName(sourceSetName)
                .getKotlin();
    }

    public static Provider<Directory> destinationDirectory(Project project, String taskName) {
        return project.getTasks()
                .named(taskName, KotlinJvmCompile.class)
                .flatMap(KotlinJvmCompile::getDestinationDirectory);
    }
}
