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

package com.palantir.gradle.buildutils.jpms;

import com.palantir.buildutils.jpms.InvalidModuleInfoException;
import com.palantir.buildutils.jpms.ModuleCompilerArgs;
import com.palantir.buildutils.jpms.ModuleInfoFile;
import com.palantir.buildutils.jpms.MultiReleasePaths;
import com.palantir.gradle.buildutils.ide.IdeaSupport;
import com.palantir.gradle.buildutils.kotlin.KotlinSupport;
import org.gradle.api.Action;
import org.gradle.api.GradleException;
import org.gradle.api.JavaVersion;
import org.gradle.api.Project;
import org.gradle.api.artifacts.ConfigurationContainer;
import org.gradle.api.file.ConfigurableFileCollection;
import org.gradle.api.file.Directory;
import org.gradle.api.file.FileCollection;
import org.gradle.api.file.SourceDirectorySet;
import org.gradle.api.logging.Logging;
import org.gradle.api.plugins.JavaPlugin;
import org.gradle.api.provider.Provider;
import org.gradle.api.tasks.SourceSet;
import org.gradle.api.tasks.SourceSetContainer;
import org.gradle.api.tasks.TaskProvider;
import org.gradle.api.tasks.bundling.Jar;
import org.gradle.api.tasks.compile.JavaCompile;
import org.gradle.api.tasks.testing.Test;
import org.gradle.language.base.plugins.LifecycleBasePlugin;
import org.slf4j.Logger;

/**
 * Adds a second pair of source sets compiled for a newer Java release, and packs their classes into the
 * {@code META-INF/versions/<release>} directory of a multi-release jar. The {@code module-info.java} is compiled on
 * its own, against the already compiled main classes.
 * <p>
 * Requires the {@code java} plugin.
 */
public abstract class AbstractMultiReleaseConfiguration {
    private static final Logger log = Logging.getLogger(AbstractMultiReleaseConfiguration.class);

    private final Project project;
    private final String release;
    private final boolean hasKotlin;
    private final ModuleInfoFile moduleInfo;

    private final SourceSet main;
    private final SourceSet test;
    private final SourceSet mainX;
    private final SourceSet testX;

    private final TaskProvider<JavaCompile> compileModuleInfo;
    private final TaskProvider<Test> runTestX;

    protected AbstractMultiReleaseConfiguration(
            JavaVersion javaVersion,
            Project project,
            String mainXName,
            String testXName,
            String moduleInfoTaskName,
            String testTaskName) {
        this.project = project;
        this.release = javaVersion.getMajorVersion();
        this.hasKotlin = KotlinSupport.hasKotlin(project);
        this.moduleInfo = loadModuleInfo(project);

        log.info(
                "\tInitializing JPMS {}, {} [{}]",
                release,
                hasKotlin ? "Java/Kotlin" : "Java",
                moduleInfo.moduleName());

        SourceSetContainer sourceSets = project.getExtensions().getByType(SourceSetContainer.class);
        this.main = sourceSets.getByName(SourceSet.MAIN_SOURCE_SET_NAME);
        this.test = sourceSets.getByName(SourceSet.TEST_SOURCE_SET_NAME);
        this.mainX = sourceSets.maybeCreate(mainXName);
        this.testX = sourceSets.maybeCreate(testXName);

        configureMainSourceSet();
        configureTestSourceSet();
        configureConfigurations();
        configureCompileTasks();

        this.compileModuleInfo =
                project.getTasks().register(moduleInfoTaskName, JavaCompile.class, this::configureModuleInfoTask);
        this.runTestX = project.getTasks().register(testTaskName, Test.class, task -> {
            task.setDescription("Runs Java " + release + " tests");
            task.setGroup(LifecycleBasePlugin.VERIFICATION_GROUP);
            task.setTestClassesDirs(testX.getOutput().getClassesDirs());
            task.setClasspath(testX.getRuntimeClasspath());
        });

        configureJar();
    }

    private static ModuleInfoFile loadModuleInfo(Project project) {
        try {
            return ModuleInfoFile.load(project.getProjectDir().toPath());
        } catch (InvalidModuleInfoException e) {
            throw new GradleException(e.getMessage(), e);
        }
    }

    private void configureMainSourceSet() {
        ConfigurableFileCollection sources = project.files(MultiReleasePaths.sourceDirectory(release));
        ConfigurableFileCollection resources = project.files(MultiReleasePaths.resourceDirectory(release));

        // setSrcDirs resets the includes
        mainX.getJava().setSrcDirs(sources);
        mainX.getJava().include("**/*.java");
        mainX.getJava().exclude("**/module-info.java", "**/EmptyClass.java");
        if (hasKotlin) {
            SourceDirectorySet kotlin = KotlinSupport.kotlinSources(project, mainX.getName());
            kotlin.setSrcDirs(sources);
            kotlin.include("**/*.kt");
            kotlin.exclude("**/module-info.java", "**/EmptyClass.kt");
        }
        mainX.getResources().setSrcDirs(resources);

        mainX.setCompileClasspath(mainX.getCompileClasspath().plus(main.getCompileClasspath()));
        mainX.setRuntimeClasspath(mainX.getRuntimeClasspath().plus(main.getRuntimeClasspath()));

        IdeaSupport.addSourceDirs(project, sources.getFiles(), resources.getFiles());
    }

    private void configureTestSourceSet() {
        ConfigurableFileCollection sources = project.files(MultiReleasePaths.testDirectory(release));
        ConfigurableFileCollection resources = project.files(MultiReleasePaths.testResourceDirectory(release));

        testX.getJava().setSrcDirs(sources);
        testX.getJava().include("**/*.java");
        if (hasKotlin) {
            SourceDirectorySet kotlin = KotlinSupport.kotlinSources(project, testX.getName());
            kotlin.setSrcDirs(sources);
            kotlin.include("**/*.kt");
            kotlin.exclude("**/module-info.java", "**/EmptyClass.kt");
        }
        testX.getResources().setSrcDirs(resources);

        testX.setCompileClasspath(testX.getCompileClasspath()
                .plus(mainX.getOutput())
                .plus(mainX.getCompileClasspath())
                .plus(test.getCompileClasspath()));
        testX.setRuntimeClasspath(testX.getRuntimeClasspath()
                .plus(mainX.getOutput())
                .plus(mainX.getRuntimeClasspath())
                .plus(test.getRuntimeClasspath()));

        IdeaSupport.addTestDirs(project, sources.getFiles(), resources.getFiles());
    }

    private void configureConfigurations() {
        ConfigurationContainer configurations = project.getConfigurations();
        extend(configurations, mainX.getImplementationConfigurationName(), main.getImplementationConfigurationName());
        extend(configurations, mainX.getCompileOnlyConfigurationName(), main.getCompileOnlyConfigurationName());
        extend(configurations, mainX.getRuntimeOnlyConfigurationName(), main.getRuntimeOnlyConfigurationName());

        extend(configurations, testX.getImplementationConfigurationName(), test.getImplementationConfigurationName());
        extend(configurations, testX.getCompileOnlyConfigurationName(), test.getCompileOnlyConfigurationName());
        extend(configurations, testX.getRuntimeOnlyConfigurationName(), test.getRuntimeOnlyConfigurationName());
    }

    private static void extend(ConfigurationContainer configurations, String name, String parent) {
        configurations.maybeCreate(name).extendsFrom(configurations.getByName(parent));
    }

    private void configureCompileTasks() {
        project.getTasks().named(mainX.getCompileJavaTaskName(), JavaCompile.class).configure(task -> {
            task.dependsOn(JavaPlugin.COMPILE_JAVA_TASK_NAME);
            task.setSourceCompatibility(release);
            task.setTargetCompatibility(release);
        });
        project.getTasks().named(testX.getCompileJavaTaskName(), JavaCompile.class).configure(task -> {
            task.dependsOn(JavaPlugin.COMPILE_TEST_JAVA_TASK_NAME);
            task.setSourceCompatibility(release);
            task.setTargetCompatibility(release);
        });

        if (hasKotlin) {
            KotlinSupport.configureVersionedCompileTask(
                    project, mainX.getCompileTaskName("kotlin"), release, main.getCompileTaskName("kotlin"));
            KotlinSupport.configureVersionedCompileTask(
                    project, testX.getCompileTaskName("kotlin"), release, test.getCompileTaskName("kotlin"));
        }
    }

    private void configureModuleInfoTask(JavaCompile task) {
        task.setDescription("Compiles the module-info.java of " + moduleInfo.moduleName() + " for Java " + release);
        task.dependsOn(JavaPlugin.COMPILE_JAVA_TASK_NAME);
        if (hasKotlin) {
            task.dependsOn(main.getCompileTaskName("kotlin"));
        }
        task.mustRunAfter(mainX.getCompileJavaTaskName());

        FileCollection allSource =
                project.files(main.getAllSource().getSrcDirs(), mainX.getAllSource().getSrcDirs());
        task.setSource(allSource.getAsFileTree());
        task.include("**/module-info.java");
        task.setSourceCompatibility(release);
        task.setTargetCompatibility(release);
        task.getInputs().property("moduleName", moduleInfo.moduleName());
        task.getDestinationDirectory().set(mainXClassesDirectory());
        // only the module path is used
        task.setClasspath(project.files());

        task.doFirst(_ignored -> {
            task.getOptions().setSourcepath(allSource);
            task.getOptions()
                    .getCompilerArgs()
                    .addAll(ModuleCompilerArgs.forModule(
                            moduleInfo.moduleName(),
                            main.getCompileClasspath().getAsPath(),
                            compiledMainClasses().getAsPath()));
        });
        task.doLast(_ignored -> IntellijModuleClasses.copyFrom(
                project, task.getDestinationDirectory().get().getAsFile()));
    }

    private Provider<Directory> mainXClassesDirectory() {
        return project.getTasks()
                .named(mainX.getCompileJavaTaskName(), JavaCompile.class)
                .flatMap(JavaCompile::getDestinationDirectory);
    }

    private FileCollection compiledMainClasses() {
        Provider<Directory> javaClasses = project.getTasks()
                .named(JavaPlugin.COMPILE_JAVA_TASK_NAME, JavaCompile.class)
                .flatMap(JavaCompile::getDestinationDirectory);
        if (hasKotlin) {
            return project.files(
                    javaClasses, KotlinSupport.destinationDirectory(project, main.getCompileTaskName("kotlin")));
        }
        return project.files(javaClasses);
    }

    private void configureJar() {
        project.getTasks().named(JavaPlugin.JAR_TASK_NAME, Jar.class).configure(jar -> {
            jar.dependsOn(compileModuleInfo);
            jar.into(
                    MultiReleasePaths.versionedDirectory(release),
                    spec -> spec.from(mainX.getOutput().getClassesDirs()));
            jar.getManifest().getAttributes().put(MultiReleasePaths.MULTI_RELEASE_ATTRIBUTE, "true");
        });
    }

    public final void sourceSets(Action<? super MultiReleaseSourceSets> action) {
        action.execute(new MultiReleaseSourceSets(mainX, testX));
    }

    public final String getModuleName() {
        return moduleInfo.moduleName();
    }

    public final String getRelease() {
        return release;
    }

    public final SourceSet getMainX() {
        return mainX;
    }

    public final SourceSet getTestX() {
        return testX;
    }

    public final TaskProvider<JavaCompile> getCompileModuleInfo() {
        return compileModuleInfo;
    }

    public final TaskProvider<Test> getRunTestX() {
        return runTestX;
    }
}
