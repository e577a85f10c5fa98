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
 * Surface fit used to locate the correlation peak to sub-pixel precision.
 * Codes are the values used for {@code Corr_Fit_Method} in correlation parameter files.
 */
public enum FitMethod {
    ELLIPTICAL_PARABOLOID(1),
    ELLIPTICAL_GAUSSIAN(2),
    RECIPROCAL_PARABOLOID(3),
    /** round the peak to the nearest whole pixel */
    ROUND(4);

    private final int code;

    FitMethod(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static FitMethod fromCode(int code) {
        for (FitMethod method : values()) {
            if (method.code == code) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown correlation fit method code " + code);
    }
}
