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
import org.gradle.api.tasks.TaskAction;

/** Reports the running and the latest Gradle version, and repairs a wrapper jar whose checksum does not match. */
public abstract class GradleCheckTask extends AbstractGradleWrapperTask {
    public static final String TASK_NAME = "checkGradleVersion";

    public GradleCheckTask() {
        setDescription("Gets both the latest and currently installed Gradle versions");
    }

    @TaskAction
    public final void check() {
        getLogger().lifecycle("\tCurrent Gradle Version: '{}'", getCurrentGradleVersion().get());

        if (checkGradleVersions() == WrapperStatus.SHA_MISMATCH) {
            getVersionsService().get().requestRegeneration(getCurrentGradleVersion().get());
        }
    }
}
