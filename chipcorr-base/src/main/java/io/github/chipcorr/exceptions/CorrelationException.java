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
 * Failure of the parallel correlation engine.  The {@link Kind} tells the caller which stage failed;
 * for {@link Kind#CORRELATION} the cause is the first failure recorded by a correlation thread.
 */
public class CorrelationException extends RuntimeException {
    public enum Kind {
        /** chip buffers, queues or threads could not be created */
        ALLOCATION,
        /** an internal queue was used in a way that breaks its invariants */
        QUEUE,
        /** the correlation routine (or the work around it) failed for a chip */
        CORRELATION,
        /** releasing engine resources failed */
        SHUTDOWN
    }

    private final Kind kind;

    public CorrelationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CorrelationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return String.format("%s[%s]: %s", getClass().getSimpleName(), kind, getMessage());
    }
}
