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

import com.palantir.buildutils.wrapper.Hashes;
import com.palantir.buildutils.wrapper.RemoteGradleRelease;
import com.palantir.buildutils.wrapper.WrapperStatus;
import com.palantir.buildutils.wrapper.WrapperVersionChecker;
import java.io.File;
import java.util.Optional;
import org.gradle.api.DefaultTask;
import org.gradle.api.file.RegularFileProperty;
import org.gradle.api.logging.Logging;
import org.gradle.api.provider.Property;
import org.gradle.api.tasks.Internal;
import org.gradle.api.logging.Logger;

/** Compares the running Gradle and its wrapper jar against the current Gradle release. */
public abstract class AbstractGradleWrapperTask extends DefaultTask {
    private static final Logger log = Logging.getLogger(AbstractGradleWrapperTask.class);

    @Internal
    public abstract Property<GradleVersionsBuildService> getVersionsService();

    @Internal
    public abstract Property<String> getCurrentGradleVersion();

    /** The {@code gradle-wrapper.jar} of this build, which need not exist. */
    @Internal
    public abstract RegularFileProperty getWrapperJar();

    protected AbstractGradleWrapperTask() {
        setGroup("gradle");
        getOutputs().upToDateWhen(_ignored -> false);
        notCompatibleWithConfigurationCache("Downloads the current Gradle release information");
    }

    protected final WrapperStatus checkGradleVersions() {
        GradleVersionsBuildService service = getVersionsService().get();
        RemoteGradleRelease release = service.currentRelease();
        Optional<String> remoteVersion = release.version();
        if (remoteVersion.isEmpty()) {
            log.lifecycle("\tUnable to detect New Gradle Version. Output json: {}", release.rawResponse());
            return WrapperStatus.NOT_FOUND;
        }

        String currentVersion = getCurrentGradleVersion().get();
        File jarFile = getWrapperJar().get().getAsFile();
        if (!jarFile.isFile()) {
            log.lifecycle("\tWrapper JAR location: {}", jarFile.getAbsolutePath());
            log.lifecycle("\tWrapper JAR file not found!");
        }
        String localSha256 = Hashes.sha256HexOrEmpty(jarFile);

        WrapperStatus status = WrapperVersionChecker.check(
                currentVersion, remoteVersion, localSha256, () -> service.wrapperJarSha256(currentVersion));
        switch (status) {
            case UP_TO_DATE:
                log.lifecycle(
                        "\tGradle is already at the latest version '{}' and has a valid SHA256", remoteVersion.get());
                break;
            case SHA_MISMATCH:
                log.lifecycle("\tSHA256 is invalid. Reinstalling Gradle Wrapper to v{}", currentVersion);
                log.lifecycle("\tLocal  v{} SHA256: '{}'", currentVersion, localSha256);
                log.lifecycle("\tRemote v{} SHA256: '{}'", currentVersion, service.wrapperJarSha256(currentVersion));
                break;
            case NEW_VERSION_AVAILABLE:
                log.lifecycle("\tDetected new Gradle Version: '{}'", remoteVersion.get());
                break;
            default:
                break;
        }
        return status;
    }
}
