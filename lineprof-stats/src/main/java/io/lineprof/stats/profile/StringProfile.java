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

import io.lineprof.stats.accumulate.NumberAccumulator;
import io.lineprof.stats.accumulate.StringAccumulator;
import io.lineprof.stats.cardinality.CardinalityTracker;
import io.lineprof.stats.report.ProfileLayout;
import io.lineprof.stats.report.StatFormat;

import java.util.List;

/// Profiles every value as a string, alongside the distribution of its length.
///
/// Values are never parsed, so zero folding does not apply here.
public final class StringProfile implements ValueProfile {

    private final StringAccumulator values;
    private final NumberAccumulator lengths = new NumberAccumulator();

    /// @param cardinality the distinct-count tracker for this profile
    public StringProfile(CardinalityTracker cardinality) {
        this.values = new StringAccumulator(cardinality);
    }

    @Override
    public void observe(String raw) {
        if (raw.isEmpty()) {
            values.observeEmpty();
            lengths.observeEmpty();
        } else {
            values.observe(raw);
            lengths.observe(ValueProfile.lengthOf(raw));
        }
    }

    @Override
    public void observeMalformed() {
        values.observeError();
        lengths.observeError();
    }

    @Override
    public ProfileLayout layout() {
        return ProfileLayout.STRING;
    }

    @Override
    public List<String> format(StatFormat format) {
        return List.of(
            format.count(values.getCount()),
            format.count(values.getEmptyCount()),
            format.count(values.getErrorCount()),
            format.cardinality(values),
            format.text(values.getMin()),
            format.text(values.getMax()),
            format.whole(lengths.getMin()),
            format.whole(lengths.getMax()),
            format.fixed(lengths.getMean()),
            format.fixed(lengths.getStdDev()));
    }

    public StringAccumulator values() {
        return values;
    }

    public NumberAccumulator lengths() {
        return lengths;
    }
}
