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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.palantir.buildutils.http.RemoteFetchException;
import com.palantir.buildutils.http.TextFetcher;
import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads release and checksum information from {@code services.gradle.org}. */
public final class GradleServicesClient {
    private static final Logger log = LoggerFactory.getLogger(GradleServicesClient.class);
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public static final String DEFAULT_BASE_URL = "https://services.gradle.org/";

    private final TextFetcher fetcher;
    private final String baseUrl;

    public GradleServicesClient(TextFetcher fetcher) {
        this(fetcher, DEFAULT_BASE_URL);
    }

    public GradleServicesClient(TextFetcher fetcher, String baseUrl) {
        this.fetcher = fetcher;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + '/';
    }

    public RemoteGradleRelease currentRelease() {
        String response = fetcher.fetch(URI.create(baseUrl + "versions/current")).orElse("");
        return RemoteGradleRelease.of(response, parseRelease(response));
    }

    static Optional<GradleReleaseInfo> parseRelease(String response) {
        if (response.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(response, GradleReleaseInfo.class));
        } catch (JsonProcessingException e) {
            log.debug("Gradle release response is not valid JSON: {}", response, e);
            return Optional.empty();
        }
    }

    /** The published SHA-256 of {@code gradle-<version>-wrapper.jar}. */
    public String wrapperJarSha256(String version) {
        return checksum("distributions/gradle-" + version + "-wrapper.jar.sha256");
    }

    /** The published SHA-256 of the {@code bin} or {@code all} distribution zip. */
    public String distributionSha256(String version, DistributionKind kind) {
        return checksum("distributions/gradle-" + version + '-' + kind.name().toLowerCase(Locale.ROOT) + ".zip.sha256");
    }

    private String checksum(String path) {
        URI uri = URI.create(baseUrl + path);
        return fetcher.fetch(uri)
                .map(String::trim)
                .orElseThrow(() -> new RemoteFetchException("No checksum published", uri));
    }

    public enum DistributionKind {
        BIN,
        ALL
    }
}
