package io.lineprof.stats.accumulate;

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

import io.lineprof.stats.cardinality.CardinalityTracker;

import java.util.Optional;

/// Lexicographic min/max and distinct-value cardinality over string observations.
///
/// Ordering is ordinal by code point ([CodePointOrder]). The distinct count is delegated to
/// whichever [CardinalityTracker] the run is configured with.
///
/// Not thread-safe.
public final class StringAccumulator {

    private final CardinalityTracker cardinality;
    private long count = 0;
    private long emptyCount = 0;
    private long errorCount = 0;
    private String min;
    private String max;

    /// @param cardinality the tracker this accumulator owns
    public StringAccumulator(CardinalityTracker cardinality) {
        if (cardinality == null) {
            throw new IllegalArgumentException("cardinality tracker cannot be null");
        }
        this.cardinality = cardinality;
    }

    /// Add a non-empty string observation.
    ///
    /// @param value the observed value
    public void observe(String value) {
        count++;
        if (min == null || CodePointOrder.INSTANCE.compare(value, min) < 0) {
            min = value;
        }
        if (max == null || CodePointOrder.INSTANCE.compare(value, max) > 0) {
            max = value;
        }
        cardinality.offer(value);
    }

    public void observeEmpty() {
        emptyCount++;
    }

    public void observeError() {
        errorCount++;
    }

    public long getCount() {
        return count;
    }

    public long getEmptyCount() {
        return emptyCount;
    }

    public long getErrorCount() {
        return errorCount;
    }

    public Optional<String> getMin() {
        return Optional.ofNullable(min);
    }

    public Optional<String> getMax() {
        return Optional.ofNullable(max);
    }

    public long getCardinality() {
        return cardinality.cardinality();
    }

    public boolean isCardinalityCapped() {
        return cardinality.isCapped();
    }

    public boolean isCardinalityEnabled() {
        return cardinality.isEnabled();
    }
}
