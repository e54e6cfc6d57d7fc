package io.lineprof.stats.cardinality;

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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardinalityConfigTest {

    @Test
    void defaultsToExactTracking() {
        CardinalityConfig config = CardinalityConfig.defaults();

        assertThat(config.strategy()).isEqualTo(CardinalityConfig.Strategy.EXACT);
        assertThat(config.cap()).isEqualTo(CardinalityConfig.DEFAULT_CAP);
        assertThat(config.newTracker()).isInstanceOf(ExactCappedCardinality.class);
    }

    @Test
    void sketchStrategyCreatesSketches() {
        assertThat(CardinalityConfig.sketch(10).newTracker()).isInstanceOf(SketchCardinality.class);
    }

    @Test
    void eachTrackerIsIndependent() {
        CardinalityConfig config = CardinalityConfig.exact(5);
        CardinalityTracker first = config.newTracker();
        CardinalityTracker second = config.newTracker();
        first.offer("x");

        assertThat(first.cardinality()).isEqualTo(1);
        assertThat(second.cardinality()).isZero();
    }

    @Test
    void validatesParameters() {
        assertThatThrownBy(() -> CardinalityConfig.exact(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CardinalityConfig.sketch(30))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CardinalityConfig(null, 1, 14))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
