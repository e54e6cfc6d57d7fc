package io.lineprof.stats.profile;

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

import io.lineprof.stats.report.ProfileLayout;
import io.lineprof.stats.report.StatFormat;

import java.nio.charset.StandardCharsets;
import java.util.List;

/// The accumulators owned by one group, column or series.
///
/// A router hands every raw field to [#observe(String)] and every structurally broken line
/// to [#observeMalformed()]. Each call bumps exactly one counter (numeric, empty or error)
/// on each accumulator it touches.
public interface ValueProfile {

    /// Observe one raw field value.
    /// @param raw the field text, possibly empty
    void observe(String raw);

    /// Observe a line which did not have the expected shape.
    void observeMalformed();

    /// @return the stat columns produced by [#format(StatFormat)]
    ProfileLayout layout();

    /// Format the current stats.
    /// @param format the numeric formatting to apply
    /// @return one string per [ProfileLayout#fieldNames()] entry
    List<String> format(StatFormat format);

    /// Length of a field value in UTF-8 bytes, the unit it had in the input.
    static int lengthOf(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }
}
