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

import java.util.ArrayList;
import java.util.List;

/// Identifies the bucket a line's value belongs to.
///
/// `raw` is the key text as it appeared in the input and is what keys are compared and sorted
/// by. `components` is that text split on the delimiter, keeping empty parts, for display.
///
/// @param raw the pre-split key text
/// @param components the key split into its columns
public record GroupKey(String raw, List<String> components) {

    /// Name of the bucket which absorbs lines that are missing the delimiter
    public static final String INVALID_NAME = "<INVALID>";

    /// The sentinel key for malformed lines
    public static final GroupKey INVALID = new GroupKey(INVALID_NAME, List.of(INVALID_NAME));

    public GroupKey {
        if (raw == null) {
            throw new IllegalArgumentException("group key cannot be null");
        }
        components = List.copyOf(components);
    }

    /// Build a key from its raw text.
    ///
    /// @param raw the key text
    /// @param delimiter the field delimiter
    /// @return the key with its components split out
    public static GroupKey of(String raw, char delimiter) {
        return new GroupKey(raw, splitAll(raw, delimiter));
    }

    /// Split on every occurrence of the delimiter. Empty fields are kept, including trailing
    /// ones, so `"a,,"` gives three fields.
    ///
    /// @param text the text to split
    /// @param delimiter the delimiter
    /// @return the fields, at least one
    public static List<String> splitAll(String text, char delimiter) {
        List<String> fields = new ArrayList<>();
        int start = 0;
        int at;
        while ((at = text.indexOf(delimiter, start)) >= 0) {
            fields.add(text.substring(start, at));
            start = at + 1;
        }
        fields.add(text.substring(start));
        return fields;
    }
}
