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

/**
 * The finished, ordered result of one profiling pass, ready for a renderer.
 *
 * <p>A series report has exactly one row with an empty group key. A keyed report (grouped or
 * per-column) has one row per key. Its {@code groupWidth} is taken from the first row, or
 * zero when there are no rows.
 *
 * @param layout     the stat columns every row carries
 * @param keyed      false for a single-series report
 * @param groupWidth the number of group-key components used for header alignment
 * @param rows       the rows in output order
 */
public record ProfileReport(ProfileLayout layout, boolean keyed, int groupWidth, List<ReportRow> rows) {

    public ProfileReport {
        rows = List.copyOf(rows);
        for (ReportRow row : rows) {
            if (row.stats().size() != layout.width()) {
                throw new IllegalArgumentException("row has " + row.stats().size()
                    + " stats but layout " + layout + " has " + layout.width());
            }
        }
    }

    /**
     * A report for an ungrouped series.
     */
    public static ProfileReport series(ProfileLayout layout, List<String> stats) {
        return new ProfileReport(layout, false, 0, List.of(new ReportRow(List.of(), stats)));
    }

    /**
     * A report keyed by group or column, with the group width taken from the first row.
     */
    public static ProfileReport keyed(ProfileLayout layout, List<ReportRow> rows) {
        int width = rows.isEmpty() ? 0 : rows.get(0).groupKey().size();
        return new ProfileReport(layout, true, width, rows);
    }
}
