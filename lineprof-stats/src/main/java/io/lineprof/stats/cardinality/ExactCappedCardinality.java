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

import java.util.HashSet;
import java.util.Set;

/// Exact distinct counting with a hard cap on the retained set.
///
/// Values are inserted until the set holds more than `cap` entries. From then on the tracker
/// is capped for good and no new values are inserted, so [#cardinality()] stays at `cap + 1`.
/// A cap of zero turns tracking off entirely.
public final class ExactCappedCardinality implements CardinalityTracker {

    private final int cap;
    private final Set<String> seen = new HashSet<>();
    private boolean capped = false;

    /// @param cap the largest set size kept before capping, `0` to disable tracking
    public ExactCappedCardinality(int cap) {
        if (cap < 0) {
            throw new IllegalArgumentException("cardinality cap must be non-negative: " + cap);
        }
        this.cap = cap;
    }

    @Override
    public void offer(String value) {
        if (cap == 0 || capped) {
            return;
        }
        seen.add(value);
        if (seen.size() > cap) {
            capped = true;
        }
    }

    @Override
    public long cardinality() {
        return seen.size();
    }

    @Override
    public boolean isCapped() {
        return capped;
    }

    @Override
    public boolean isEnabled() {
        return cap > 0;
    }
}
