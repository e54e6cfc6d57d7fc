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

import io.lineprof.stats.profile.ColumnProfile;
import io.lineprof.stats.profile.NumberProfile;
import io.lineprof.stats.profile.StringProfile;
import io.lineprof.stats.profile.ValueProfile;
import io.lineprof.stats.report.ProfileLayout;
import io.lineprof.stats.report.ProfileReport;
import io.lineprof.stats.report.ReportRow;
import io.lineprof.stats.report.StatFormat;
import io.lineprof.stats.route.ColumnTable;
import io.lineprof.stats.route.GroupRouter;
import io.lineprof.stats.route.GroupTable;
import io.lineprof.stats.route.LineSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Runs one profiling pass and snapshots it into a [ProfileReport].
///
/// Each call to [#profile(ProfileMode, LineSource)] builds its own tables, so a profiler can
/// be reused and two passes never share state. Rendering is left to the caller.
///
/// ```java
/// LineProfiler profiler = new LineProfiler(ProfileConfig.defaults().withPrecision(2));
/// try (LineSource lines = LineSource.of(System.in)) {
///     ProfileReport report = profiler.profile(ProfileMode.GROUP_NUMBER, lines);
/// }
/// ```
public final class LineProfiler {
    private static final Logger logger = LogManager.getLogger(LineProfiler.class);

    private final ProfileConfig config;
    private final GroupRouter router;
    private final StatFormat format;

    /// @param config the run settings
    public LineProfiler(ProfileConfig config) {
        this.config = config;
        this.router = new GroupRouter(config.delimiter());
        this.format = config.statFormat();
    }

    /// Profile a line stream.
    ///
    /// @param mode how to interpret the lines
    /// @param lines the input, consumed to the end
    /// @return the formatted report
    /// @throws IOException if reading fails, in which case no report is produced
    /// @throws io.lineprof.stats.route.MissingHeaderException if CSV input has no lines
    public ProfileReport profile(ProfileMode mode, LineSource lines) throws IOException {
        logger.debug("profiling in {} mode with {}", mode, config);
        return switch (mode) {
            case NUMBER -> series(router.routeSeries(lines, newNumberProfile()));
            case STRING -> series(router.routeSeries(lines, newStringProfile()));
            case GROUP_NUMBER -> grouped(ProfileLayout.NUMBER, router.routeGrouped(lines, this::newNumberProfile));
            case GROUP_STRING -> grouped(ProfileLayout.STRING, router.routeGrouped(lines, this::newStringProfile));
            case CSV -> columns(router.routeColumns(lines, this::newColumnProfile));
        };
    }

    private NumberProfile newNumberProfile() {
        return new NumberProfile(config.zeroAsEmpty());
    }

    private StringProfile newStringProfile() {
        return new StringProfile(config.cardinality().newTracker());
    }

    private ColumnProfile newColumnProfile() {
        return new ColumnProfile(config.cardinality().newTracker(), config.zeroAsEmpty());
    }

    private ProfileReport series(ValueProfile profile) {
        return ProfileReport.series(profile.layout(), profile.format(format));
    }

    private <P extends ValueProfile> ProfileReport grouped(ProfileLayout layout, GroupTable<P> table) {
        List<ReportRow> rows = new ArrayList<>(table.size());
        for (GroupTable.Entry<P> entry : table.snapshot()) {
            rows.add(new ReportRow(entry.key().components(), entry.profile().format(format)));
        }
        return ProfileReport.keyed(layout, rows);
    }

    private ProfileReport columns(ColumnTable table) {
        List<ReportRow> rows = new ArrayList<>(table.size());
        for (ColumnTable.Column column : table.columns()) {
            rows.add(new ReportRow(List.of(column.header()), column.profile().format(format)));
        }
        return ProfileReport.keyed(ProfileLayout.COLUMN, rows);
    }
}
