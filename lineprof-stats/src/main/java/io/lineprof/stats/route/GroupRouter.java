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
import io.lineprof.stats.profile.ValueProfile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.function.Supplier;

/// Turns a stream of raw lines into populated profiles in one pass.
///
/// ## Routing Modes
///
/// - **series**: each whole line is one value for a single profile. The delimiter is not
///   consulted.
/// - **grouped**: each line is split once at the *last* delimiter. Everything before it is the
///   group key (and may itself contain delimiters). The final field is the value. Lines with
///   no delimiter are counted as malformed on the `<INVALID>` group.
/// - **columns**: the first line is split on every delimiter into column headers. Each
///   following line is split the same way and zipped against the headers.
///
/// Problems with row content never stop a pass; they only show up in the profiles' counters.
/// Only an I/O failure, or a missing CSV header, ends a pass early.
public final class GroupRouter {
    private static final Logger logger = LogManager.getLogger(GroupRouter.class);

    private final char delimiter;

    /// @param delimiter the single-character field delimiter
    public GroupRouter(char delimiter) {
        this.delimiter = delimiter;
    }

    /// Feed every line to a single profile.
    ///
    /// @param lines the input
    /// @param profile the profile to fill
    /// @param <P> the profile type
    /// @return the same profile, after the pass
    /// @throws IOException if reading fails
    public <P extends ValueProfile> P routeSeries(LineSource lines, P profile) throws IOException {
        String line;
        while ((line = lines.nextLine()) != null) {
            profile.observe(line);
        }
        logger.debug("series pass read {} lines", lines.getLinesRead());
        return profile;
    }

    /// Route each line to the profile of its group key.
    ///
    /// @param lines the input
    /// @param profileFactory creates the profile for each new group
    /// @param <P> the profile type
    /// @return the populated table
    /// @throws IOException if reading fails
    public <P extends ValueProfile> GroupTable<P> routeGrouped(LineSource lines, Supplier<P> profileFactory)
        throws IOException {
        GroupTable<P> table = new GroupTable<>(delimiter, profileFactory);
        long malformed = 0;
        String line;
        while ((line = lines.nextLine()) != null) {
            int split = line.lastIndexOf(delimiter);
            if (split < 0) {
                table.invalidProfile().observeMalformed();
                malformed++;
                continue;
            }
            table.profileFor(line.substring(0, split)).observe(line.substring(split + 1));
        }
        logger.debug("grouped pass read {} lines into {} groups, {} malformed",
            lines.getLinesRead(), table.size(), malformed);
        return table;
    }

    /// Profile each column of a headed, delimited stream.
    ///
    /// @param lines the input, starting with the header row
    /// @param profileFactory creates the profile for each column
    /// @return the populated columns in header order
    /// @throws MissingHeaderException if the input has no lines
    /// @throws IOException if reading fails
    public ColumnTable routeColumns(LineSource lines, Supplier<ColumnProfile> profileFactory) throws IOException {
        String header = lines.nextLine();
        if (header == null) {
            throw new MissingHeaderException();
        }
        ColumnTable table = new ColumnTable(GroupKey.splitAll(header, delimiter), profileFactory);
        String line;
        while ((line = lines.nextLine()) != null) {
            table.observeRow(GroupKey.splitAll(line, delimiter));
        }
        logger.debug("column pass read {} lines across {} columns", lines.getLinesRead(), table.size());
        return table;
    }
}
