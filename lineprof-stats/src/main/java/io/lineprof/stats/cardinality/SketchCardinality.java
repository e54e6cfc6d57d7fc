package io.lineprof.stats.cardinality;

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

import com.clearspring.analytics.hash.MurmurHash;
import com.clearspring.analytics.stream.cardinality.HyperLogLog;

import java.nio.charset.StandardCharsets;

/// Approximate distinct counting in fixed memory, using a HyperLogLog sketch.
///
/// The relative standard error is about `1.04 / sqrt(2^log2m)`, so the default
/// precision of 14 gives roughly 0.8% with 16K registers. The sketch never caps.
///
/// Values are hashed from their UTF-8 bytes, so estimates do not depend on the platform charset.
public final class SketchCardinality implements CardinalityTracker {

    public static final int MIN_LOG2M = 4;
    public static final int MAX_LOG2M = 20;

    private final HyperLogLog sketch;

    /// @param log2m the base-2 log of the register count, in `[4, 20]`
    public SketchCardinality(int log2m) {
        if (log2m < MIN_LOG2M || log2m > MAX_LOG2M) {
            throw new IllegalArgumentException(
                "sketch precision must be between " + MIN_LOG2M + " and " + MAX_LOG2M + ": " + log2m);
        }
        this.sketch = new HyperLogLog(log2m);
    }

    @Override
    public void offer(String value) {
        sketch.offerHashed(MurmurHash.hash(value.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public long cardinality() {
        return sketch.cardinality();
    }

    @Override
    public boolean isCapped() {
        return false;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
