package io.lineprof.command.render;

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

import io.lineprof.stats.report.ProfileReport;
import io.lineprof.stats.report.ReportRow;

/// Machine-readable output with a single-character field delimiter.
///
/// Keyed reports start with a header made of one delimiter per group-key component followed
/// by the field names, so stat names line up with the stat columns below them. A series report
/// is written as one `name<delimiter>value` line per stat.
///
/// Values are written as they are. Nothing is quoted or escaped.
public final class DelimitedTextRenderer implements ReportRenderer {

    private final String delimiter;

    /// @param delimiter the output field delimiter
    public DelimitedTextRenderer(char delimiter) {
        this.delimiter = String.valueOf(delimiter);
    }

    @Override
    public String render(ProfileReport report) {
        StringBuilder sb = new StringBuilder();
        if (!report.keyed()) {
            ReportRow row = report.rows().get(0);
            for (int i = 0; i < report.layout().width(); i++) {
                sb.append(report.layout().fieldNames().get(i)).append(delimiter)
                    .append(row.stats().get(i)).append('\n');
            }
            return sb.toString();
        }

        sb.append(delimiter.repeat(report.groupWidth()))
            .append(String.join(delimiter, report.layout().fieldNames()))
            .append('\n');
        for (ReportRow row : report.rows()) {
            sb.append(String.join(delimiter, row.groupKey()))
                .append(delimiter)
                .append(String.join(delimiter, row.stats()))
                .append('\n');
        }
        return sb.toString();
    }
}
