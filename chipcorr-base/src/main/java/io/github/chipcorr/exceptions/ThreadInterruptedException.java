/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.chipcorr.exceptions;

/**
 * Thrown by blocking calls that were interrupted.  Wraps the checked {@link InterruptedException}
 * so that callers of the correlator are not forced to handle it at every call site.
 * <p>
 * The interrupt status of the current thread is restored when this is created.
 */
public final class ThreadInterruptedException extends RuntimeException {
    public ThreadInterruptedException(InterruptedException ie) {
        super(ie);
        Thread.currentThread().interrupt();
    }
}
