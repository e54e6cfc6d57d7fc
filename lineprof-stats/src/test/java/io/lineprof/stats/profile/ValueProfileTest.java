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

import io.lineprof.stats.cardinality.ExactCappedCardinality;
import io.lineprof.stats.report.StatFormat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ValueProfileTest {

    @Test
    void lengthCountsUtf8Bytes() {
        assertThat(ValueProfile.lengthOf("abc")).isEqualTo(3);
        assertThat(ValueProfile.lengthOf("hé")).isEqualTo(3);
        assertThat(ValueProfile.lengthOf("é😀")).isEqualTo(6);
        assertThat(ValueProfile.lengthOf("")).isZero();
    }

    @Test
    void numberProfileClassifiesEachValue() {
        NumberProfile profile = new NumberProfile(false);
        profile.observe("2");
        profile.observe("");
        profile.observe("two");
        profile.observeMalformed();

        assertThat(profile.numbers().getCount()).isEqualTo(1);
        assertThat(profile.numbers().getEmptyCount()).isEqualTo(1);
        assertThat(profile.numbers().getErrorCount()).isEqualTo(2);
    }

    @Test
    void stringProfileTracksValuesAndLengths() {
        StringProfile profile = new StringProfile(new ExactCappedCardinality(10));
        profile.observe("0");
        profile.observe("hello");
        profile.observe("");
        profile.observeMalformed();

        assertThat(profile.values().getCount()).isEqualTo(2);
        assertThat(profile.values().getEmptyCount()).isEqualTo(1);
        assertThat(profile.values().getErrorCount()).isEqualTo(1);
        assertThat(profile.lengths().getEmptyCount()).isEqualTo(1);
        assertThat(profile.lengths().getErrorCount()).isEqualTo(1);
        assertThat(profile.format(new StatFormat(0)))
            .containsExactly("2", "1", "1", "2", "0", "hello", "1", "5", "3", "2");
    }

    @Test
    void columnProfileSplitsTextAndNumbers() {
        ColumnProfile profile = new ColumnProfile(new ExactCappedCardinality(10), true);
        profile.observe("0");
        profile.observe("4");
        profile.observe("n/a");
        profile.observe("");

        assertThat(profile.strings().getCount()).isEqualTo(3);
        assertThat(profile.strings().getEmptyCount()).isEqualTo(1);
        assertThat(profile.numbers().getCount()).isEqualTo(1);
        assertThat(profile.numbers().getEmptyCount()).isEqualTo(2);
        assertThat(profile.numbers().getErrorCount()).isEqualTo(1);
        assertThat(profile.lengths().getCount()).isEqualTo(3);
        assertThat(profile.lengths().getMax()).hasValue(3.0);
    }
}
