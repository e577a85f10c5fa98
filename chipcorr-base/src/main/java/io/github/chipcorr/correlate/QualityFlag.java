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

package io.github.chipcorr.correlate;

/**
 * Quality outcomes raised by a correlation routine.  A raised flag means the measured offset may be unreliable;
 * whether that invalidates the result depends on which checks the correlator was configured to enforce.
 */
public enum QualityFlag {
    /** the correlation peak is too near the edge of the search area */
    EDGE,
    /** a subsidiary peak is too close to the main one */
    MULTIPLE_PEAK,
    /** the peak strength is below the minimum */
    LOW_PEAK,
    /** the diagonal displacement from the nominal location exceeds the maximum */
    MAX_DISPLACEMENT
}
