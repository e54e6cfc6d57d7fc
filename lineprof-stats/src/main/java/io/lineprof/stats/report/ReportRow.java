package io.lineprof.stats.report;

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

import java.util.List;

/// One output row: the group key components followed by the pre-formatted stat values.
///
/// @param groupKey the key components, empty for an ungrouped series
/// @param stats the formatted stats, in [ProfileLayout] order
public record ReportRow(List<String> groupKey, List<String> stats) {
    public ReportRow {
        groupKey = List.copyOf(groupKey);
        stats = List.copyOf(stats);
    }
}
