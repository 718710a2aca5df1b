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

import java.nio.file.Path;

/** The {@code module-info.java} of a project is missing or does not declare a module. */
public final class InvalidModuleInfoException extends RuntimeException {
    public InvalidModuleInfoException(String message) {
        super(message);
    }

    public InvalidModuleInfoException(String message, Path file, Throwable cause) {
        super(message + " Verify file: " + file, cause);
    }
}
