package io.lineprof.stats;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.lineprof.stats.cardinality.CardinalityConfig;
import io.lineprof.stats.report.StatFormat;

/**
 * Immutable settings for one profiling run.
 *
 * @param delimiter   the input field delimiter
 * @param zeroAsEmpty whether parsed zeros count as empty values
 * @param cardinality the distinct-count strategy for string profiles
 * @param precision   decimals for fixed-point output
 */
public record ProfileConfig(char delimiter, boolean zeroAsEmpty, CardinalityConfig cardinality, int precision) {

    public static final char DEFAULT_DELIMITER = ',';

    /**
     * Compact constructor with validation.
     */
    public ProfileConfig {
        if (cardinality == null) {
            throw new IllegalArgumentException("cardinality config cannot be null");
        }
        if (delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("the delimiter cannot be a line terminator");
        }
        if (precision < 0 || precision > StatFormat.MAX_PRECISION) {
            throw new IllegalArgumentException(
                "precision must be between 0 and " + StatFormat.MAX_PRECISION + ": " + precision);
        }
    }

    /**
     * Comma delimited, zeros kept, exact cardinality, no decimals.
     */
    public static ProfileConfig defaults() {
        return new ProfileConfig(DEFAULT_DELIMITER, false, CardinalityConfig.defaults(), 0);
    }

    public ProfileConfig withDelimiter(char newDelimiter) {
        return new ProfileConfig(newDelimiter, zeroAsEmpty, cardinality, precision);
    }

    public ProfileConfig withZeroAsEmpty(boolean newZeroAsEmpty) {
        return new ProfileConfig(delimiter, newZeroAsEmpty, cardinality, precision);
    }

    public ProfileConfig withCardinality(CardinalityConfig newCardinality) {
        return new ProfileConfig(delimiter, zeroAsEmpty, newCardinality, precision);
    }

    public ProfileConfig withPrecision(int newPrecision) {
        return new ProfileConfig(delimiter, zeroAsEmpty, cardinality, newPrecision);
    }

    public StatFormat statFormat() {
        return new StatFormat(precision);
    }
}
