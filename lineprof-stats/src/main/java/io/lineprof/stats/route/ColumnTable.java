package io.lineprof.stats.route;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/// Positional per-column profiles for CSV input, in header order.
///
/// Columns are addressed by position, so repeated header names stay separate columns.
public final class ColumnTable {

    private final List<Column> columns;

    /// One header column with its profile
    /// @param header the header text
    /// @param profile the column's accumulators
    public record Column(String header, ColumnProfile profile) {
    }

    /// @param headers the header names, in order
    /// @param profileFactory creates a fresh profile for each column
    public ColumnTable(List<String> headers, Supplier<ColumnProfile> profileFactory) {
        List<Column> built = new ArrayList<>(headers.size());
        for (String header : headers) {
            built.add(new Column(header, profileFactory.get()));
        }
        this.columns = Collections.unmodifiableList(built);
    }

    /// Feed one data row. Fields past the last header are dropped and headers past the last
    /// field are left untouched for this row.
    ///
    /// @param fields the row split into fields
    public void observeRow(List<String> fields) {
        int width = Math.min(fields.size(), columns.size());
        for (int i = 0; i < width; i++) {
            columns.get(i).profile().observe(fields.get(i));
        }
    }

    public List<Column> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }
}
