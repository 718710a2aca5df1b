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

import com.palantir.buildutils.jpms.ModuleClassFiles;
import com.palantir.gradle.buildutils.BuildUtilsExtension;
import java.io.File;
import org.gradle.api.Project;
import org.gradle.api.logging.Logging;
import org.slf4j.Logger;

/**
 * IntelliJ compiles into its own output directory (see {@code fixIntellijPaths}), where it never produces the
 * module descriptor. Copying the compiled {@code module-info.class} and {@code package-info.class} files there keeps
 * the IDE runs modular.
 */
final class IntellijModuleClasses {
    private static final Logger log = Logging.getLogger(IntellijModuleClasses.class);

    private IntellijModuleClasses() {
        // cannot instantiate
    }

    static void copyFrom(Project project, File compiledClasses) {
        File intellijClasses =
                project.getLayout().getBuildDirectory().dir(BuildUtilsExtension.INTELLIJ_CLASSES).get().getAsFile();
        if (!intellijClasses.isDirectory()) {
            return;
        }

        ModuleClassFiles classFiles = ModuleClassFiles.scan(compiledClasses.toPath());
        if (classFiles.isEmpty()) {
            return;
        }
        log.info("\tCopying {} files into the intellij classes location...", classFiles.describe());
        classFiles.copyTo(intellijClasses.toPath());
    }
}
