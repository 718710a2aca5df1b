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

package com.palantir.gradle.buildutils.wrapper;

import com.palantir.buildutils.wrapper.WrapperStatus;
import org.gradle.api.logging.Logging;
import org.gradle.api.tasks.TaskAction;
import org.gradle.api.logging.Logger;

public abstract class GradleUpdateTask extends AbstractGradleWrapperTask {
    private static final Logger log = Logging.getLogger(GradleUpdateTask.class);

    public static final String TASK_NAME = "updateGradleWrapper";

    public GradleUpdateTask() {
        setDescription("Automatically update Gradle to the latest version");
    }

    @TaskAction
    public final void update() {
        WrapperStatus status = checkGradleVersions();
        if (!status.needsUpdate()) {
            return;
        }

        String remoteVersion =
                getVersionsService().get().currentRelease().version().orElseThrow();
        log.lifecycle("\tUpdating Gradle Wrapper to v{}", remoteVersion);
        getVersionsService().get().requestRegeneration(remoteVersion);
    }
}
