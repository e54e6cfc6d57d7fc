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

/// Counts distinct string values, exactly or approximately.
///
/// Callers do not need to know which strategy is behind the interface. One
/// [CardinalityConfig] selects the strategy for every tracker in a run.
public interface CardinalityTracker {

    /// Record one occurrence of a value.
    /// @param value a non-null value
    void offer(String value);

    /// @return the distinct count seen so far, possibly capped or estimated
    long cardinality();

    /// @return true once the tracker has stopped recording new distinct values
    boolean isCapped();

    /// @return false when tracking is switched off and [#cardinality()] means nothing
    boolean isEnabled();
}
