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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.gradle.api.Action;
import org.gradle.api.GradleException;
import org.gradle.api.JavaVersion;
import org.gradle.api.artifacts.Configuration;
import org.gradle.api.file.DuplicatesStrategy;
import org.gradle.api.tasks.compile.JavaCompile;
import org.gradle.jvm.tasks.Jar;
import org.gradle.plugins.ide.idea.model.IdeaModel;
import org.gradle.plugins.ide.idea.model.IdeaModule;
import org.gradle.util.GradleVersion;
import org.junit.jupiter.api.Test;

public class BuildUtilsExtensionTest extends AbstractProjectBuilderTest {
    @Test
    public void checksTheGradleVersionRange() {
        GradleVersion running = GradleVersion.version("8.5");

        assertThatCode(() -> BuildUtilsExtension.checkMinVersion(running, "8.5")).doesNotThrowAnyException();
        assertThatCode(() -> BuildUtilsExtension.checkMaxVersion(running, "8.10")).doesNotThrowAnyException();
        assertThatThrownBy(() -> BuildUtilsExtension.checkMinVersion(running, "8.6"))
                .isInstanceOf(GradleException.class)
                .hasMessage("This project requires Gradle 8.6 or higher.");
        assertThatThrownBy(() -> BuildUtilsExtension.checkMaxVersion(running, "7.6"))
                .isInstanceOf(GradleException.class)
                .hasMessage("This project requires Gradle 7.6 or lower.");
    }

    @Test
    public void loadsPropertiesIntoTheTargetAndProject() throws IOException {
        Path file = writeFile("build.properties", "version=1.2.3\ncustomKey=abc\n");
        List<String> notified = new ArrayList<>();
        List<Action<Map.Entry<String, String>>> loaders = List.of(entry -> notified.add(entry.getKey()));
        project.getExtensions().getExtraProperties().set(BuildUtilsExtension.PROPERTY_LOADER_FUNCTIONS, loaders);
        Holder holder = new Holder();

        applyPlugin(project).load(file.toString(), holder);

        assertThat(holder.customKey).isEqualTo("abc");
        assertThat(project.getVersion()).isEqualTo("1.2.3");
        assertThat(project.getGroup()).isEqualTo("com.example");
        assertThat(project.getExtensions().getExtraProperties().get("customKey")).isEqualTo("abc");
        assertThat(notified).containsExactly("customKey", "version");
    }

    @Test
    public void pushesConstantsOfTheTargetOntoTheProject() throws IOException {
        Path file = writeFile("build.properties", "customKey=abc\n");

        applyPlugin(project).load(file.toString(), Extras.INSTANCE);

        assertThat(project.getVersion()).isEqualTo("2.3");
        assertThat(project.getDescription()).isEqualTo("Build helpers");
    }

    @Test
    public void skipsMissingPropertyFiles() {
        Holder holder = new Holder();

        applyPlugin(project).load(projectDir.resolve("missing.properties").toString(), holder);

        assertThat(holder.customKey).isNull();
        assertThat(project.getGroup()).isNotEqualTo("com.example");
    }

    @Test
    public void failsOnVersionConflictsInLaterConfigurations() throws IOException {
        new LocalMavenRepository(projectDir.resolve("repo"))
                .publish("com.example:shared:1.0")
                .publish("com.example:shared:2.0")
                .publish("com.example:x:1.0", "com.example:shared:1.0")
                .publish("com.example:y:1.0", "com.example:shared:2.0")
                .addTo(project);
        BuildUtilsExtension extension = applyPlugin(project);

        Configuration lenient = project.getConfigurations().create("lenient");
        project.getDependencies().add("lenient", "com.example:x:1.0");
        project.getDependencies().add("lenient", "com.example:y:1.0");
        assertThat(lenient.getFiles()).extracting(File::getName).contains("shared-2.0.jar");

        extension.defaultResolutionStrategy();
        Configuration late = project.getConfigurations().create("late");
        project.getDependencies().add("late", "com.example:x:1.0");
        project.getDependencies().add("late", "com.example:y:1.0");

        assertThatThrownBy(late::resolve)
                .isInstanceOf(GradleException.class)
                .hasStackTraceContaining("com.example:shared");
    }

    @Test
    public void configuresJavaCompilation() {
        BuildUtilsExtension extension = applyPlugin(project);
        project.getPluginManager().apply("java");

        extension.compileConfiguration(JavaVersion.VERSION_11);

        JavaCompile compileJava = project.getTasks().withType(JavaCompile.class).getByName("compileJava");
        assertThat(compileJava.getSourceCompatibility()).isEqualTo("11");
        assertThat(compileJava.getTargetCompatibility()).isEqualTo("11");
        assertThat(compileJava.getOptions().getEncoding()).isEqualTo("UTF-8");
        assertThat(compileJava.getOptions().isDeprecation()).isTrue();
        assertThat(compileJava.getOptions().getCompilerArgs()).contains("-Xlint:unchecked");

        Jar jar = project.getTasks().withType(Jar.class).getByName("jar");
        assertThat(jar.getDuplicatesStrategy()).isEqualTo(DuplicatesStrategy.FAIL);
    }

    @Test
    public void substitutesTheSwtPlaceholder() {
        BuildUtilsExtension extension = applyPlugin(project);

        String swt = extension.getSwtMavenId("3.124.0");

        assertThat(swt).startsWith("org.eclipse.platform:org.eclipse.swt.").endsWith(":3.124.0");
        assertThat(extension.getSwtMavenId("3.124.0")).isEqualTo(swt);
        assertThatCode(() -> project.getConfigurations().create("swt")).doesNotThrowAnyException();
    }

    @Test
    public void exposesThePlatform() {
        BuildUtilsExtension extension = applyPlugin(project);

        assertThat(extension.isUnix()).isNotEqualTo(extension.isWindows());
        assertThat(extension.getHasKotlin()).isFalse();
    }

    @Test
    public void separatesIntellijOutput() {
        BuildUtilsExtension extension = applyPlugin(project);
        project.getPluginManager().apply("java");

        extension.fixIntellijPaths();

        assertThat(project.getPluginManager().hasPlugin("idea")).isTrue();
        IdeaModule module = project.getExtensions().getByType(IdeaModel.class).getModule();
        assertThat(module.getInheritOutputDirs()).isFalse();
        assertThat(module.getOutputDir().toPath())
                .isEqualTo(projectDir.resolve("build").resolve(BuildUtilsExtension.INTELLIJ_CLASSES));
    }

    public static final class Extras {
        public static final String version = "2.3";
        public static final String description = "Build helpers";
        public static final Extras INSTANCE = new Extras();
    }

    public static final class Holder {
        public String customKey;
        public String group = "com.example";
    }
}
