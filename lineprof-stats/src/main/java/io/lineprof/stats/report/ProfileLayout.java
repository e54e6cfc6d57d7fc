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

/// The stat columns produced by each kind of profile.
///
/// Each layout carries two parallel name lists. `titles` are for the human-readable
/// table and `fieldNames` are for delimited output.
public enum ProfileLayout {

    NUMBER(
        List.of("Count", "Empty", "Error", "Min", "Max", "Sum", "Mean", "StdDev"),
        List.of("count", "empty", "error", "min", "max", "sum", "mean", "stddev")),

    STRING(
        List.of("Count", "Empty", "Error", "Cardinality", "String Min", "String Max",
            "Length Min", "Length Max", "Length Mean", "Length StdDev"),
        List.of("count", "empty", "error", "cardinality", "string_min", "string_max",
            "length_min", "length_max", "length_mean", "length_stddev")),

    COLUMN(
        List.of("Count", "Cardinality", "String Empty", "String Min", "String Max",
            "Number Empty", "Number Error", "Number Min", "Number Max", "Number Mean", "Number StdDev",
            "Length Min", "Length Max", "Length Mean", "Length StdDev"),
        List.of("count", "cardinality", "string_empty", "string_min", "string_max",
            "number_empty", "number_error", "number_min", "number_max", "number_mean", "number_stddev",
            "length_min", "length_max", "length_mean", "length_stddev"));

    private final List<String> titles;
    private final List<String> fieldNames;

    ProfileLayout(List<String> titles, List<String> fieldNames) {
        if (titles.size() != fieldNames.size()) {
            throw new IllegalStateException("title and field name counts differ for " + name());
        }
        this.titles = titles;
        this.fieldNames = fieldNames;
    }

    public List<String> titles() {
        return titles;
    }

    public List<String> fieldNames() {
        return fieldNames;
    }

    public int width() {
        return titles.size();
    }
}
