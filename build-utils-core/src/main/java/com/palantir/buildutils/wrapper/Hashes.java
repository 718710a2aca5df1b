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

import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;

public final class Hashes {
    private Hashes() {
        // cannot instantiate
    }

    /** Lower case hex SHA-256 of the file contents. */
    public static String sha256Hex(File file) {
        try {
            return Files.asByteSource(file).hash(Hashing.sha256()).toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash " + file, e);
        }
    }

    /** Like {@link #sha256Hex(File)}, but an empty string when the file does not exist. */
    public static String sha256HexOrEmpty(File file) {
        return file.isFile() ? sha256Hex(file) : "";
    }
}
