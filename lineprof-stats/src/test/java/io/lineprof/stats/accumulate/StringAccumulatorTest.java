package io.lineprof.stats.accumulate;

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

import io.lineprof.stats.cardinality.CardinalityConfig;
import io.lineprof.stats.cardinality.ExactCappedCardinality;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StringAccumulatorTest {

    @Test
    void newAccumulatorIsBlank() {
        StringAccumulator acc = new StringAccumulator(new ExactCappedCardinality(10));

        assertThat(acc.getCount()).isZero();
        assertThat(acc.getEmptyCount()).isZero();
        assertThat(acc.getErrorCount()).isZero();
        assertThat(acc.getMin()).isEmpty();
        assertThat(acc.getMax()).isEmpty();
        assertThat(acc.getCardinality()).isZero();
    }

    @Test
    void tracksLexicographicBounds() {
        StringAccumulator acc = new StringAccumulator(new ExactCappedCardinality(10));
        acc.observe("pear");
        acc.observe("Apple");
        acc.observe("banana");
        acc.observe("apple");

        assertThat(acc.getCount()).isEqualTo(4);
        assertThat(acc.getMin()).contains("Apple");
        assertThat(acc.getMax()).contains("pear");
    }

    @Test
    void boundsUseCodePointOrder() {
        StringAccumulator acc = new StringAccumulator(new ExactCappedCardinality(10));
        acc.observe("Ａ");
        acc.observe("😀");

        assertThat(acc.getMax()).contains("😀");
        assertThat(acc.getMin()).contains("Ａ");
    }

    @Test
    void countsDistinctValues() {
        StringAccumulator acc = new StringAccumulator(CardinalityConfig.defaults().newTracker());
        acc.observe("a");
        acc.observe("b");
        acc.observe("a");

        assertThat(acc.getCardinality()).isEqualTo(2);
        assertThat(acc.isCardinalityCapped()).isFalse();
        assertThat(acc.isCardinalityEnabled()).isTrue();
    }

    @Test
    void countersPartitionObservations() {
        StringAccumulator acc = new StringAccumulator(new ExactCappedCardinality(10));
        acc.observe("x");
        acc.observeEmpty();
        acc.observeEmpty();
        acc.observeError();

        assertThat(acc.getCount() + acc.getEmptyCount() + acc.getErrorCount()).isEqualTo(4);
        assertThat(acc.getCardinality()).isEqualTo(1);
    }

    @Test
    void requiresTracker() {
        assertThatThrownBy(() -> new StringAccumulator(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
