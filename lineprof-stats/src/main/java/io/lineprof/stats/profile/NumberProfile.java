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
import io.lineprof.stats.classify.ValueClassifier;
import io.lineprof.stats.report.ProfileLayout;
import io.lineprof.stats.report.StatFormat;

import java.util.List;

/// Profiles every value as a number.
public final class NumberProfile implements ValueProfile {

    private final boolean zeroAsEmpty;
    private final NumberAccumulator numbers = new NumberAccumulator();

    /// @param zeroAsEmpty whether zeros count as empty values
    public NumberProfile(boolean zeroAsEmpty) {
        this.zeroAsEmpty = zeroAsEmpty;
    }

    @Override
    public void observe(String raw) {
        numbers.observe(ValueClassifier.classify(raw, zeroAsEmpty));
    }

    @Override
    public void observeMalformed() {
        numbers.observeError();
    }

    @Override
    public ProfileLayout layout() {
        return ProfileLayout.NUMBER;
    }

    @Override
    public List<String> format(StatFormat format) {
        return List.of(
            format.count(numbers.getCount()),
            format.count(numbers.getEmptyCount()),
            format.count(numbers.getErrorCount()),
            format.fixed(numbers.getMin()),
            format.fixed(numbers.getMax()),
            StatFormat.scientific(numbers.getSum()),
            format.fixed(numbers.getMean()),
            format.fixed(numbers.getStdDev()));
    }

    public NumberAccumulator numbers() {
        return numbers;
    }
}
