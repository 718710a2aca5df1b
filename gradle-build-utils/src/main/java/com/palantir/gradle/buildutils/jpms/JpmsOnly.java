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
import com.palantir.gradle.buildutils.kotlin.KotlinSupport;
import java.nio.file.Path;
import java.util.Optional;
import org.gradle.api.GradleException;
import org.gradle.api.JavaVersion;
import org.gradle.api.Project;
import org.gradle.api.file.Directory;
import org.gradle.api.file.FileCollection;
import org.gradle.api.logging.Logging;
import org.gradle.api.plugins.JavaPlugin;
import org.gradle.api.provider.Provider;
import org.gradle.api.tasks.SourceSet;
import org.gradle.api.tasks.SourceSetContainer;
import org.gradle.api.tasks.compile.JavaCompile;
import org.slf4j.Logger;

/** Compiles a project that has a {@code module-info.java} in its main sources as a module. */
public final class JpmsOnly {
    private static final Logger log = Logging.getLogger(JpmsOnly.class);

    private static final int FIRST_MODULAR_RELEASE = 9;

    private JpmsOnly() {
        // cannot instantiate
    }

    /**
     * Does nothing below Java 9, without a {@code module-info.java}, or when the module descriptor belongs to a
     * multi-release source directory such as {@code src11}, which {@link AbstractMultiReleaseConfiguration} handles.
     *
     * @return whether the project is compiled as a module
     */
    public static boolean runIfNecessary(JavaVersion javaVersion, Project project) {
        if (Integer.parseInt(javaVersion.getMajorVersion()) < FIRST_MODULAR_RELEASE) {
            return false;
        }

        Optional<Path> moduleFile = ModuleInfoFile.find(project.getProjectDir().toPath());
        if (moduleFile.isEmpty()) {
            return false;
        }

        ModuleInfoFile moduleInfo;
        try {
            moduleInfo = ModuleInfoFile.read(moduleFile.get());
        } catch (InvalidModuleInfoException e) {
            throw new GradleException(e.getMessage(), e);
        }
        if (moduleInfo.isInMultiReleaseDirectory()) {
            return false;
        }

        boolean hasKotlin = KotlinSupport.hasKotlin(project);
        log.info(
                "\tInitializing JPMS {}, {} [{}]",
                javaVersion.getMajorVersion(),
                hasKotlin ? "Java/Kotlin" : "Java",
                moduleInfo.moduleName());

        SourceSet main = project.getExtensions()
                .getByType(SourceSetContainer.class)
                .getByName(SourceSet.MAIN_SOURCE_SET_NAME);

        project.getTasks().named(JavaPlugin.COMPILE_JAVA_TASK_NAME, JavaCompile.class).configure(task -> {
            task.doFirst(_ignored -> task.getOptions()
                    .getCompilerArgs()
                    .addAll(ModuleCompilerArgs.forModule(
                            moduleInfo.moduleName(),
                            main.getCompileClasspath().getAsPath(),
                            compiledClasses(project, task, hasKotlin).getAsPath())));
            task.doLast(_ignored -> IntellijModuleClasses.copyFrom(
                    project, task.getDestinationDirectory().get().getAsFile()));
        });
        return true;
    }

    private static FileCollection compiledClasses(Project project, JavaCompile compileJava, boolean hasKotlin) {
        Provider<Directory> javaClasses = compileJava.getDestinationDirectory();
        if (hasKotlin) {
            return project.files(javaClasses, KotlinSupport.destinationDirectory(project, "compileKotlin"));
        }
        return project.files(javaClasses);
    }
}
