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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Formats a report as a bordered ASCII table for terminals.
 *
 * <p>Keyed reports get one row per group or column. The title row has a blank cell above every
 * group-key column, followed by the stat titles, and is the only row with a separator under
 * it. Group cells are left aligned, stat cells right aligned. Rows whose key has fewer
 * components than the widest key are padded with blank cells.
 *
 * <p>Series reports are transposed into a two-column table of (title, value) pairs.
 *
 * <h2>Example</h2>
 *
 * <pre>
 * +-----------+-------+-------+
 * |           | Count |  Mean |
 * +-----------+-------+-------+
 * | g2        |     1 |    30 |
 * | g1        |     2 |    15 |
 * +-----------+-------+-------+
 * </pre>
 *
 * <p>Cell widths are measured in code points.
 */
public final class BorderedTableRenderer implements ReportRenderer {

    @Override
    public String render(ProfileReport report) {
        return report.keyed() ? renderKeyed(report) : renderSeries(report);
    }

    private String renderSeries(ProfileReport report) {
        List<String> titles = report.layout().titles();
        List<String> values = report.rows().get(0).stats();
        List<List<String>> body = new ArrayList<>(titles.size());
        for (int i = 0; i < titles.size(); i++) {
            body.add(List.of(titles.get(i), values.get(i)));
        }

        boolean[] rightAlign = {true, true};
        int[] widths = columnWidths(2, body);

        StringBuilder sb = new StringBuilder();
        appendBorder(sb, widths);
        for (List<String> row : body) {
            appendRow(sb, row, widths, rightAlign);
        }
        appendBorder(sb, widths);
        return sb.toString();
    }

    private String renderKeyed(ProfileReport report) {
        int groupColumns = report.groupWidth();
        for (ReportRow row : report.rows()) {
            groupColumns = Math.max(groupColumns, row.groupKey().size());
        }
        int columns = groupColumns + report.layout().width();

        List<String> title = new ArrayList<>(columns);
        title.addAll(Collections.nCopies(groupColumns, ""));
        title.addAll(report.layout().titles());

        List<List<String>> body = new ArrayList<>(report.rows().size());
        for (ReportRow row : report.rows()) {
            List<String> cells = new ArrayList<>(columns);
            cells.addAll(row.groupKey());
            cells.addAll(Collections.nCopies(groupColumns - row.groupKey().size(), ""));
            cells.addAll(row.stats());
            body.add(cells);
        }

        boolean[] rightAlign = new boolean[columns];
        for (int c = groupColumns; c < columns; c++) {
            rightAlign[c] = true;
        }

        List<List<String>> all = new ArrayList<>(body.size() + 1);
        all.add(title);
        all.addAll(body);
        int[] widths = columnWidths(columns, all);

        StringBuilder sb = new StringBuilder();
        appendBorder(sb, widths);
        appendRow(sb, title, widths, rightAlign);
        appendBorder(sb, widths);
        for (List<String> row : body) {
            appendRow(sb, row, widths, rightAlign);
        }
        if (!body.isEmpty()) {
            appendBorder(sb, widths);
        }
        return sb.toString();
    }

    /**
     * Pads a string to the specified width in code points.
     *
     * @param s          the string to pad
     * @param width      target width
     * @param rightAlign true for right alignment, false for left
     * @return padded string
     */
    static String pad(String s, int width, boolean rightAlign) {
        int length = displayWidth(s);
        if (length >= width) {
            return s;
        }
        int padding = width - length;
        if (rightAlign) {
            return " ".repeat(padding) + s;
        } else {
            return s + " ".repeat(padding);
        }
    }

    static int displayWidth(String s) {
        return s.codePointCount(0, s.length());
    }

    private static int[] columnWidths(int columns, List<List<String>> rows) {
        int[] widths = new int[columns];
        for (List<String> row : rows) {
            for (int c = 0; c < columns; c++) {
                widths[c] = Math.max(widths[c], displayWidth(row.get(c)));
            }
        }
        return widths;
    }

    private static void appendBorder(StringBuilder sb, int[] widths) {
        sb.append('+');
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        sb.append('\n');
    }

    private static void appendRow(StringBuilder sb, List<String> cells, int[] widths, boolean[] rightAlign) {
        sb.append('|');
        for (int c = 0; c < widths.length; c++) {
            sb.append(' ').append(pad(cells.get(c), widths[c], rightAlign[c])).append(" |");
        }
        sb.append('\n');
    }
}
