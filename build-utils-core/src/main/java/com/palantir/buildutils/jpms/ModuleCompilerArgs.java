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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Compiler arguments for compiling a {@code module-info.java} against already compiled classes. */
public final class ModuleCompilerArgs {
    private ModuleCompilerArgs() {
        // cannot instantiate
    }

    /**
     * @param moduleName the declared module
     * @param modulePath the dependencies of the module, as a path string
     * @param compiledClasses the already compiled classes of the module, as a path string
     */
    public static List<String> forModule(String moduleName, String modulePath, String compiledClasses) {
        return ImmutableList.of(
                "-implicit:none",
                // package-info.java is skipped by javac unless forced
                "-Xpkginfo:always",
                "--module-path",
                modulePath,
                "--patch-module",
                moduleName + '=' + compiledClasses);
    }
}
