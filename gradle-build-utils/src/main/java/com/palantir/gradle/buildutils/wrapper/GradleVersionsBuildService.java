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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.palantir.buildutils.http.HttpTextFetcher;
import com.palantir.buildutils.http.RemoteFetchException;
import com.palantir.buildutils.wrapper.GradleServicesClient;
import com.palantir.buildutils.wrapper.GradleServicesClient.DistributionKind;
import com.palantir.buildutils.wrapper.RemoteGradleRelease;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.gradle.api.logging.Logging;
import org.gradle.api.provider.Property;
import org.gradle.api.services.BuildService;
import org.gradle.api.services.BuildServiceParameters;
import org.slf4j.Logger;

/**
 * Shares what {@code services.gradle.org} reports between the wrapper tasks of one build, so the release and checksum
 * files are downloaded at most once. Also carries the pending wrapper regeneration from the checking task to the
 * {@code wrapperUpdate} task.
 */
public abstract class GradleVersionsBuildService implements BuildService<GradleVersionsBuildService.Params> {
    private static final Logger log = Logging.getLogger(GradleVersionsBuildService.class);

    public static final String NAME = "gradleVersionsBuildService";

    public interface Params extends BuildServiceParameters {
        Property<String> getServicesUrl();

        Property<Integer> getTimeoutSeconds();
    }

    private final Supplier<GradleServicesClient> client = Suppliers.memoize(() -> new GradleServicesClient(
            new HttpTextFetcher(Duration.ofSeconds(getParameters().getTimeoutSeconds().get())),
            getParameters().getServicesUrl().get()));

    private final Supplier<RemoteGradleRelease> currentRelease =
            Suppliers.memoize(() -> client.get().currentRelease());

    private final AtomicReference<WrapperRegeneration> pendingRegeneration = new AtomicReference<>();

    public final RemoteGradleRelease currentRelease() {
        return currentRelease.get();
    }

    public final String wrapperJarSha256(String gradleVersion) {
        return client.get().wrapperJarSha256(gradleVersion);
    }

    /**
     * Asks for the wrapper to be regenerated at {@code gradleVersion}. A distribution checksum that cannot be fetched
     * is logged and the wrapper is regenerated without one.
     */
    public final void requestRegeneration(String gradleVersion) {
        Optional<String> distributionSha256;
        try {
            distributionSha256 = Optional.of(client.get().distributionSha256(gradleVersion, DistributionKind.ALL));
        } catch (RemoteFetchException e) {
            log.warn("\tUnable to get the distribution SHA256 of Gradle {} from {}", gradleVersion, e.getUri(), e);
            distributionSha256 = Optional.empty();
        }
        pendingRegeneration.set(WrapperRegeneration.of(gradleVersion, distributionSha256));
    }

    public final Optional<WrapperRegeneration> pendingRegeneration() {
        return Optional.ofNullable(pendingRegeneration.get());
    }
}
