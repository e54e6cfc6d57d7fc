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

import io.lineprof.stats.classify.FieldValue;

import java.util.OptionalDouble;

/// Running statistics over a sequence of numeric observations.
///
/// ## Welford's Algorithm
///
/// Mean and variance are maintained in a single pass without revisiting earlier values:
///
/// ```
/// For each new value x:
///   n++
///   delta = x - mean
///   mean += delta / n
///   delta2 = x - mean
///   M2 += delta * delta2
/// ```
///
/// The reported standard deviation is the population form, `sqrt(M2 / n)`.
///
/// The sum is a plain running addition and is not compensated.
///
/// Empty and unparseable observations only bump their counters. They never touch the
/// moments or the min/max.
///
/// ## Thread Safety
///
/// This class is **not thread-safe**. A profiling pass owns its accumulators exclusively.
public final class NumberAccumulator {

    private long count = 0;
    private long emptyCount = 0;
    private long errorCount = 0;
    private double sum = 0.0;
    private double mean = 0.0;
    private double m2 = 0.0;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    /// Route a classified field to the matching counter or to the moments.
    ///
    /// @param value the classified field
    public void observe(FieldValue value) {
        if (value instanceof FieldValue.Numeric numeric) {
            observe(numeric.value());
        } else if (value instanceof FieldValue.Empty) {
            observeEmpty();
        } else {
            observeError();
        }
    }

    /// Add a numeric observation.
    ///
    /// @param value the value to add
    public void observe(double value) {
        if (value < min) min = value;
        if (value > max) max = value;

        count++;
        double delta = value - mean;
        mean += delta / count;
        double delta2 = value - mean;
        m2 += delta * delta2;

        sum += value;
    }

    /// Count an empty observation.
    public void observeEmpty() {
        emptyCount++;
    }

    /// Count an observation which could not be used.
    public void observeError() {
        errorCount++;
    }

    /// @return the number of numeric observations
    public long getCount() {
        return count;
    }

    /// @return the number of empty observations
    public long getEmptyCount() {
        return emptyCount;
    }

    /// @return the number of unusable observations
    public long getErrorCount() {
        return errorCount;
    }

    /// @return the smallest numeric observation, or empty before the first one
    public OptionalDouble getMin() {
        return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(min);
    }

    /// @return the largest numeric observation, or empty before the first one
    public OptionalDouble getMax() {
        return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(max);
    }

    public double getSum() {
        return sum;
    }

    /// @return the running mean, `0.0` when nothing was observed
    public double getMean() {
        return count == 0 ? 0.0 : mean;
    }

    /// @return the population variance, `0.0` when nothing was observed
    public double getVariance() {
        return count < 1 ? 0.0 : m2 / count;
    }

    /// @return the population standard deviation, `0.0` when nothing was observed
    public double getStdDev() {
        return Math.sqrt(getVariance());
    }
}
