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

public enum WrapperStatus {
    /** The current Gradle release could not be determined. */
    NOT_FOUND,
    /** Running the current release and the local wrapper jar matches the published checksum. */
    UP_TO_DATE,
    /** Running the current release but the local wrapper jar does not match the published checksum. */
    SHA_MISMATCH,
    NEW_VERSION_AVAILABLE;

    /** Whether the wrapper files should be generated again for an update. */
    public boolean needsUpdate() {
        return this == SHA_MISMATCH || this == NEW_VERSION_AVAILABLE;
    }
}
