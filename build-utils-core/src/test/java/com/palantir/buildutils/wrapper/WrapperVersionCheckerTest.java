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

package com.palantir.buildutils.wrapper;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class WrapperVersionCheckerTest {
    @TempDir
    Path tempDir;

    @Test
    public void notFoundWithoutARemoteVersion() {
        assertThat(WrapperVersionChecker.check("8.5", Optional.empty(), "", () -> "unused"))
                .isEqualTo(WrapperStatus.NOT_FOUND);
    }

    @Test
    public void newVersionSkipsTheChecksum() {
        AtomicBoolean asked = new AtomicBoolean();
        WrapperStatus status = WrapperVersionChecker.check("8.5", Optional.of("8.8"), "", () -> {
            asked.set(true);
            return "";
        });

        assertThat(status).isEqualTo(WrapperStatus.NEW_VERSION_AVAILABLE);
        assertThat(status.needsUpdate()).isTrue();
        assertThat(asked).isFalse();
    }

    @Test
    public void comparesTheWrapperJarChecksum() {
        assertThat(WrapperVersionChecker.check("8.8", Optional.of("8.8"), "abc", () -> "ABC\n"))
                .isEqualTo(WrapperStatus.UP_TO_DATE);

        WrapperStatus mismatch = WrapperVersionChecker.check("8.8", Optional.of("8.8"), "", () -> "abc");
        assertThat(mismatch).isEqualTo(WrapperStatus.SHA_MISMATCH);
        assertThat(mismatch.needsUpdate()).isTrue();
        assertThat(WrapperStatus.UP_TO_DATE.needsUpdate()).isFalse();
    }

    @Test
    public void hashesFiles() throws IOException {
        File file = tempDir.resolve("gradle-wrapper.jar").toFile();
        Files.write(file.toPath(), "abc".getBytes(StandardCharsets.UTF_8));

        assertThat(Hashes.sha256Hex(file))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(Hashes.sha256HexOrEmpty(tempDir.resolve("missing.jar").toFile()))
                .isEmpty();
    }
}
