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

import java.net.URI;
import java.util.Optional;

/** Fetches small text documents such as {@code maven-metadata.xml} or checksum files. */
@FunctionalInterface
public interface TextFetcher {
    /**
     * Returns the document at {@code uri}, or empty if the server does not have it.
     *
     * @throws RemoteFetchException if the document could not be fetched for any other reason
     */
    Optional<String> fetch(URI uri);
}
