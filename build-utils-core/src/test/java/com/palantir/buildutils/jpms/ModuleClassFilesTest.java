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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ModuleClassFilesTest {
    @TempDir
    Path tempDir;

    @Test
    public void findsModuleAndPackageInfo() throws IOException {
        Path classes = tempDir.resolve("classes");
        touch(classes.resolve("module-info.class"));
        touch(classes.resolve("com/example/package-info.class"));
        touch(classes.resolve("com/example/Main.class"));

        ModuleClassFiles files = ModuleClassFiles.scan(classes);

        assertThat(files.moduleInfo()).containsExactly(classes.resolve("module-info.class"));
        assertThat(files.packageInfo()).containsExactly(classes.resolve("com/example/package-info.class"));
        assertThat(files.describe()).isEqualTo("module-info and package-info");
    }

    @Test
    public void isEmptyForMissingDirectories() {
        ModuleClassFiles files = ModuleClassFiles.scan(tempDir.resolve("missing"));

        assertThat(files.isEmpty()).isTrue();
    }

    @Test
    public void copiesToTheSameRelativeLocation() throws IOException {
        Path classes = tempDir.resolve("classes");
        Path target = tempDir.resolve("classes-intellij");
        touch(classes.resolve("com/example/package-info.class"));
        touch(classes.resolve("com/example/Main.class"));

        ModuleClassFiles files = ModuleClassFiles.scan(classes);
        files.copyTo(target);
        files.copyTo(target);

        assertThat(files.describe()).isEqualTo("package-info");
        assertThat(target.resolve("com/example/package-info.class")).exists();
        assertThat(target.resolve("com/example/Main.class")).doesNotExist();
    }

    private static void touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[] {(byte) 0xCA, (byte) 0xFE});
    }
}
