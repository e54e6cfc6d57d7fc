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
import io.lineprof.stats.classify.ValueClassifier;
import io.lineprof.stats.report.ProfileLayout;
import io.lineprof.stats.report.StatFormat;

import java.util.List;

/// Profiles one CSV column three ways at once: as a string, as a number where it parses,
/// and by length.
public final class ColumnProfile implements ValueProfile {

    private final boolean zeroAsEmpty;
    private final StringAccumulator strings;
    private final NumberAccumulator numbers = new NumberAccumulator();
    private final NumberAccumulator lengths = new NumberAccumulator();

    /// @param cardinality the distinct-count tracker for this column
    /// @param zeroAsEmpty whether zeros count as empty numbers
    public ColumnProfile(CardinalityTracker cardinality, boolean zeroAsEmpty) {
        this.strings = new StringAccumulator(cardinality);
        this.zeroAsEmpty = zeroAsEmpty;
    }

    @Override
    public void observe(String raw) {
        if (raw.isEmpty()) {
            strings.observeEmpty();
            numbers.observeEmpty();
            lengths.observeEmpty();
            return;
        }
        strings.observe(raw);
        lengths.observe(ValueProfile.lengthOf(raw));
        numbers.observe(ValueClassifier.classify(raw, zeroAsEmpty));
    }

    @Override
    public void observeMalformed() {
        strings.observeError();
        numbers.observeError();
        lengths.observeError();
    }

    @Override
    public ProfileLayout layout() {
        return ProfileLayout.COLUMN;
    }

    @Override
    public List<String> format(StatFormat format) {
        return List.of(
            format.count(strings.getCount()),
            format.cardinality(strings),
            format.count(strings.getEmptyCount()),
            format.text(strings.getMin()),
            format.text(strings.getMax()),
            format.count(numbers.getEmptyCount()),
            format.count(numbers.getErrorCount()),
            format.fixed(numbers.getMin()),
            format.fixed(numbers.getMax()),
            format.fixed(numbers.getMean()),
            format.fixed(numbers.getStdDev()),
            format.whole(lengths.getMin()),
            format.whole(lengths.getMax()),
            format.fixed(lengths.getMean()),
            format.fixed(lengths.getStdDev()));
    }

    public StringAccumulator strings() {
        return strings;
    }

    public NumberAccumulator numbers() {
        return numbers;
    }

    public NumberAccumulator lengths() {
        return lengths;
    }
}
