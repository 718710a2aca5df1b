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

import com.google.common.annotations.VisibleForTesting;
import com.palantir.buildutils.dependencies.DependencyNode;
import com.palantir.buildutils.platform.OperatingSystemFamily;
import com.palantir.buildutils.platform.SwtPlatform;
import com.palantir.buildutils.properties.PropertyBinder;
import com.palantir.buildutils.properties.PropertyFiles;
import com.palantir.gradle.buildutils.deps.ProjectDependencies;
import com.palantir.gradle.buildutils.ide.IdeaSupport;
import com.palantir.gradle.buildutils.jpms.JavaXConfiguration;
import com.palantir.gradle.buildutils.jpms.JpmsMultiRelease;
import com.palantir.gradle.buildutils.jpms.JpmsOnly;
import com.palantir.gradle.buildutils.kotlin.KotlinSupport;
import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import org.gradle.api.Action;
import org.gradle.api.GradleException;
import org.gradle.api.JavaVersion;
import org.gradle.api.Project;
import org.gradle.api.Task;
import org.gradle.api.file.DuplicatesStrategy;
import org.gradle.api.logging.Logging;
import org.gradle.api.plugins.ExtraPropertiesExtension;
import org.gradle.api.tasks.SourceSetContainer;
import org.gradle.api.tasks.compile.JavaCompile;
import org.gradle.jvm.tasks.Jar;
import org.gradle.util.GradleVersion;
import org.slf4j.Logger;

/**
 * The {@code GradleUtils} extension: helpers a build script calls to configure compilation, JPMS, IDE output and
 * dependency resolution in one line each.
 */
public abstract class BuildUtilsExtension {
    private static final Logger log = Logging.getLogger(BuildUtilsExtension.class);

    /** Extra property holding a list of {@code Action<Map.Entry<String, String>>} notified by {@link #load}. */
    public static final String PROPERTY_LOADER_FUNCTIONS = "property_loader_functions";

    public static final String INTELLIJ_CLASSES = "classes-intellij";

    private final Project project;
    private final OperatingSystemFamily operatingSystem = OperatingSystemFamily.current();
    private final ProjectMetadata data = new ProjectMetadata();

    private volatile boolean swtSubstituted = false;

    @Inject
    public BuildUtilsExtension(Project project) {
        this.project = project;
    }

    public final boolean isUnix() {
        return operatingSystem.isUnix();
    }

    public final boolean isLinux() {
        return operatingSystem.isLinux();
    }

    public final boolean isMac() {
        return operatingSystem.isMac();
    }

    public final boolean isWindows() {
        return operatingSystem.isWindows();
    }

    public final boolean getHasKotlin() {
        return KotlinSupport.hasKotlin(project);
    }

    public final ProjectMetadata getData() {
        return data;
    }

    public final void data(Action<? super ProjectMetadata> action) {
        action.execute(data);
    }

    /**
     * Maps the entries of a {@code .properties} file onto {@code target} (its static members when it is a
     * {@link Class}), onto the matching {@code Project} setters, and into the project's extra properties. Every
     * {@code String} member of {@code target} that names a project property is then copied onto the project, e.g. a
     * {@code version} field sets the project version. A file that cannot be read is skipped.
     */
    public final void load(String propertyFile, Object target) {
        Path file = Paths.get(propertyFile).normalize();
        Optional<Map<String, String>> properties = PropertyFiles.readIfPresent(file);
        if (properties.isEmpty()) {
            return;
        }
        log.info("\tLoading custom property data from: [{}]", file);

        PropertyBinder targetBinder = PropertyBinder.of(target);
        PropertyBinder projectBinder = PropertyBinder.of(project);
        ExtraPropertiesExtension extra = project.getExtensions().getExtraProperties();
        List<Action<Map.Entry<String, String>>> loaderFunctions = loaderFunctions(extra);

        properties.get().forEach((key, value) -> {
            targetBinder.assign(key, value);
            projectBinder.assign(key, value);
            extra.set(key, value);

            Map.Entry<String, String> entry = new AbstractMap.SimpleImmutableEntry<>(key, value);
            loaderFunctions.forEach(function -> function.execute(entry));
        });

        targetBinder.readableValues().forEach(projectBinder::assign);
    }

    @SuppressWarnings("unchecked")
    private static List<Action<Map.Entry<String, String>>> loaderFunctions(ExtraPropertiesExtension extra) {
        if (!extra.has(PROPERTY_LOADER_FUNCTIONS)) {
            return List.of();
        }
        Object functions = extra.get(PROPERTY_LOADER_FUNCTIONS);
        if (!(functions instanceof List)) {
            throw new GradleException("The extra property '" + PROPERTY_LOADER_FUNCTIONS
                    + "' must be a list of actions, but is " + functions);
        }
        return (List<Action<Map.Entry<String, String>>>) functions;
    }

    /** Fails the build when the running Gradle is older than {@code version}. */
    public final void minVersion(String version) {
        checkMinVersion(GradleVersion.current(), version);
    }

    /** Fails the build when the running Gradle is newer than {@code version}. */
    public final void maxVersion(String version) {
        checkMaxVersion(GradleVersion.current(), version);
    }

    @VisibleForTesting
    static void checkMinVersion(GradleVersion current, String version) {
        if (current.compareTo(GradleVersion.version(version)) < 0) {
            throw new GradleException("This project requires Gradle " + version + " or higher.");
        }
    }

    @VisibleForTesting
    static void checkMaxVersion(GradleVersion current, String version) {
        if (current.compareTo(GradleVersion.version(version)) > 0) {
            throw new GradleException("This project requires Gradle " + version + " or lower.");
        }
    }

    /** Dependency trees of the compile and runtime classpaths. Resolves, so only call it from a task or afterEvaluate. */
    public final List<DependencyNode> resolveDependencies() {
        return ProjectDependencies.compileAndRuntime(project);
    }

    public final List<DependencyNode> resolveCompileDependencies() {
        return ProjectDependencies.compile(project);
    }

    public final List<DependencyNode> resolveRuntimeDependencies() {
        return ProjectDependencies.runtime(project);
    }

    /** Keeps the IntelliJ compiler output apart from Gradle's, in {@code build/classes-intellij}. */
    public final void fixIntellijPaths() {
        fixIntellijPaths(project.getLayout()
                .getBuildDirectory()
                .dir(INTELLIJ_CLASSES)
                .get()
                .getAsFile()
                .getPath());
    }

    public final void fixIntellijPaths(String location) {
        File outputDir = project.file(location);
        for (Project each : project.getAllprojects()) {
            IdeaSupport.applyIdea(each);
            IdeaSupport.configureModule(each, module -> {
                module.setInheritOutputDirs(false);
                module.setOutputDir(outputDir);
                module.setTestOutputDir(outputDir);
                module.setDownloadJavadoc(false);
                module.setDownloadSources(true);
            });

            if (each.getState().getExecuted()) {
                createClassesDirectories(each);
            } else {
                each.afterEvaluate(BuildUtilsExtension::createClassesDirectories);
            }
        }
    }

    // IntelliJ refuses to use output directories that do not exist yet
    private static void createClassesDirectories(Project project) {
        SourceSetContainer sourceSets = project.getExtensions().findByType(SourceSetContainer.class);
        if (sourceSets == null) {
            return;
        }
        sourceSets.forEach(sourceSet -> sourceSet.getOutput().getClassesDirs().forEach(File::mkdirs));
    }

    /** Strict resolution for every configuration of every project. */
    public final void defaultResolutionStrategy() {
        for (Project each : project.getAllprojects()) {
            each.getConfigurations().configureEach(configuration -> configuration.resolutionStrategy(strategy -> {
                strategy.failOnVersionConflict();
                strategy.preferProjectModules();
                strategy.cacheDynamicVersionsFor(10, TimeUnit.MINUTES);
                strategy.cacheChangingModulesFor(0, TimeUnit.SECONDS);
            }));
        }
    }

    public final void compileConfiguration(JavaVersion javaVersion) {
        compileConfiguration(javaVersion, javaVersion);
    }

    public final void compileConfiguration(JavaVersion javaVersion, JavaVersion kotlinJavaVersion) {
        compileConfiguration(javaVersion, kotlinJavaVersion, _ignored -> {});
    }

    /**
     * Compiles every project for {@code javaVersion}, and Kotlin for {@code kotlinJavaVersion} at the language
     * version of the applied Kotlin plugin. {@code kotlinAction} is called with every Kotlin compile task. A project
     * with a {@code module-info.java} in its main sources is compiled as a module.
     */
    public final void compileConfiguration(
            JavaVersion javaVersion, JavaVersion kotlinJavaVersion, Action<? super Task> kotlinAction) {
        String release = javaVersion.toString();

        for (Project each : project.getAllprojects()) {
            each.getTasks().withType(JavaCompile.class).configureEach(task -> {
                task.doFirst(_ignored -> log.info("\tCompiling classes to Java {}", javaVersion));
                task.getOptions().setEncoding("UTF-8");
                task.getOptions().setDeprecation(true);
                task.getOptions().getCompilerArgs().add("-Xlint:unchecked");
                task.setSourceCompatibility(release);
                task.setTargetCompatibility(release);
            });
            each.getTasks()
                    .withType(Jar.class)
                    .configureEach(jar -> jar.setDuplicatesStrategy(DuplicatesStrategy.FAIL));

            each.getPluginManager()
                    .withPlugin(
                            KotlinSupport.KOTLIN_JVM_PLUGIN_ID,
                            _ignored -> KotlinSupport.configureCompileTasks(each, kotlinJavaVersion, kotlinAction));
        }

        project.getPluginManager().withPlugin("java", _ignored -> JpmsOnly.runIfNecessary(javaVersion, project));
    }

    /**
     * The SWT artifact for the current platform, e.g. {@code org.eclipse.platform:org.eclipse.swt.gtk.linux.x86_64:
     * 3.124.0}. The first call also makes every project resolve SWT's {@code ${osgi.platform}} placeholder
     * dependency to that artifact.
     */
    public final String getSwtMavenId(String version) {
        String fullId = SwtPlatform.current().mavenId(version);

        if (!swtSubstituted) {
            swtSubstituted = true;
            for (Project each : project.getAllprojects()) {
                each.getConfigurations().configureEach(configuration -> configuration
                        .getResolutionStrategy()
                        .dependencySubstitution(substitutions -> substitutions
                                .substitute(substitutions.module(SwtPlatform.UNRESOLVED_MODULE))
                                .using(substitutions.module(fullId))));
            }
        }
        return fullId;
    }

    /** Builds a multi-release jar with the {@code jpmsMain}/{@code jpmsTest} source sets. */
    public final JpmsMultiRelease jpms(JavaVersion javaVersion) {
        return new JpmsMultiRelease(javaVersion, project);
    }

    /** Builds a multi-release jar with source sets named after the release, e.g. {@code main_11}. */
    public final JavaXConfiguration javaX(JavaVersion javaVersion) {
        return new JavaXConfiguration(javaVersion, project);
    }
}
