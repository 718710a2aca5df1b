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

package com.palantir.buildutils.jpms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ModuleInfoFileTest {
    @TempDir
    Path projectDir;

    @Test
    public void parsesModuleNames() {
        assertThat(ModuleInfoFile.parseModuleName("module com.example.core {\n  requires java.sql;\n}"))
                .hasValue("com.example.core");
        assertThat(ModuleInfoFile.parseModuleName("@Deprecated\nopen module com.example.open { }"))
                .hasValue("com.example.open");
        assertThat(ModuleInfoFile.parseModuleName("import a.b.C;\nmodule com . example . spaced{}"))
                .hasValue("com.example.spaced");
    }

    @Test
    public void ignoresModulesInComments() {
        String content = "/* module com.example.wrong { } */\n"
                + "// module com.example.alsoWrong {\n"
                + "module com.example.right {\n}";

        assertThat(ModuleInfoFile.parseModuleName(content)).hasValue("com.example.right");
        assertThat(ModuleInfoFile.parseModuleName("// module com.example.none {")).isEmpty();
    }

    @Test
    public void findsTheShallowestFile() throws IOException {
        write("src/module-info.java", "module com.example.top {}");
        write("sub/src/module-info.java", "module com.example.nested {}");
        write("build/generated/module-info.java", "module com.example.generated {}");

        ModuleInfoFile file = ModuleInfoFile.load(projectDir);

        assertThat(file.moduleName()).isEqualTo("com.example.top");
        assertThat(file.path()).isEqualTo(projectDir.resolve("src/module-info.java"));
        assertThat(file.isInMultiReleaseDirectory()).isFalse();
    }

    @Test
    public void skipsBuildOutput() throws IOException {
        write("build/module-info.java", "module com.example.generated {}");
        write(".idea/module-info.java", "module com.example.hidden {}");

        assertThat(ModuleInfoFile.find(projectDir)).isEmpty();
    }

    @Test
    public void skipsOutputDirectoriesAtAnyDepth() throws IOException {
        write("node_modules/pkg/module-info.java", "module com.example.npm {}");
        write("sub/target/module-info.java", "module com.example.maven {}");
        write("sub/src/main/java/module-info.java", "module com.example.sub {}");

        assertThat(ModuleInfoFile.find(projectDir)).hasValue(projectDir.resolve("sub/src/main/java/module-info.java"));
    }

    @Test
    public void searchesAProjectDirectoryWithASkippedName() throws IOException {
        projectDir = Files.createDirectories(projectDir.resolve("build"));
        write("src/module-info.java", "module com.example.named {}");

        assertThat(ModuleInfoFile.load(projectDir).moduleName()).isEqualTo("com.example.named");
    }

    @Test
    public void recognisesVersionedSourceDirectories() throws IOException {
        write("src11/module-info.java", "module com.example.eleven {}");

        assertThat(ModuleInfoFile.load(projectDir).isInMultiReleaseDirectory()).isTrue();
    }

    @Test
    public void failsWithoutAFile() {
        assertThatThrownBy(() -> ModuleInfoFile.load(projectDir))
                .isInstanceOf(InvalidModuleInfoException.class)
                .hasMessageContaining("module-info.java");
    }

    @Test
    public void failsWithoutAModuleDeclaration() throws IOException {
        Path file = write("src/module-info.java", "// nothing here\n");

        assertThatThrownBy(() -> ModuleInfoFile.read(file))
                .isInstanceOf(InvalidModuleInfoException.class)
                .hasMessageContaining("module name must be specified")
                .hasMessageContaining(file.toString());
    }

    private Path write(String relative, String content) throws IOException {
        Path file = projectDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
