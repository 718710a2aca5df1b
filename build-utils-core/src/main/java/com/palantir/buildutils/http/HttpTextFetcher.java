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

package com.palantir.buildutils.http;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TextFetcher} over the JDK {@link HttpClient}. Responses, including "not found", are cached for the
 * lifetime of the instance, so the same metadata file is downloaded once per build. Failures are not cached.
 */
public final class HttpTextFetcher implements TextFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpTextFetcher.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;
    private final Duration timeout;

    private final LoadingCache<URI, Optional<String>> cache =
            Caffeine.newBuilder().maximumSize(10_000).build(this::download);

    public HttpTextFetcher() {
        this(DEFAULT_TIMEOUT);
    }

    public HttpTextFetcher(Duration timeout) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public Optional<String> fetch(URI uri) {
        return cache.get(uri);
    }

    private Optional<String> download(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", "gradle-build-utils")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteFetchException("Failed to fetch", uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteFetchException("Interrupted while fetching", uri, e);
        }

        int status = response.statusCode();
        if (status == 404 || status == 410) {
            log.debug("Not found: {}", uri);
            return Optional.empty();
        }
        if (status < 200 || status >= 300) {
            throw new RemoteFetchException("HTTP " + status, uri);
        }
        return Optional.of(response.body());
    }
}
