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

public final class RemoteFetchException extends RuntimeException {
    private final URI uri;

    public RemoteFetchException(String message, URI uri) {
        super(message + ": " + uri);
        this.uri = uri;
    }

    public RemoteFetchException(String message, URI uri, Throwable cause) {
        super(message + ": " + uri, cause);
        this.uri = uri;
    }

    public URI getUri() {
        return uri;
    }
}
