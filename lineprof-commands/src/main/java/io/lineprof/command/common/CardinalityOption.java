package io.lineprof.command.common;

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
import picocli.CommandLine;

/**
 * Shared distinct-count options for string profiles.
 *
 * <p>{@code --cardinality} picks the strategy. {@code --cardinality-cap} only applies to
 * {@code EXACT} and {@code --sketch-precision} only to {@code SKETCH}.
 */
public class CardinalityOption {

    @CommandLine.Option(
        names = {"--cardinality"},
        defaultValue = "EXACT",
        description = "Distinct-count strategy. Valid values: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private CardinalityConfig.Strategy strategy = CardinalityConfig.Strategy.EXACT;

    @CommandLine.Option(
        names = {"--cardinality-cap"},
        defaultValue = "" + CardinalityConfig.DEFAULT_CAP,
        description = "Most distinct values kept per group for EXACT counting, 0 disables it; "
            + "capped counts print with a trailing '+' (default: ${DEFAULT-VALUE})"
    )
    private int cap = CardinalityConfig.DEFAULT_CAP;

    @CommandLine.Option(
        names = {"--sketch-precision"},
        defaultValue = "" + CardinalityConfig.DEFAULT_SKETCH_PRECISION,
        description = "HyperLogLog log2m for SKETCH counting, 4 to 20 (default: ${DEFAULT-VALUE})"
    )
    private int sketchPrecision = CardinalityConfig.DEFAULT_SKETCH_PRECISION;

    /**
     * Builds the validated configuration.
     *
     * @return the cardinality settings
     * @throws IllegalArgumentException if the cap or the sketch precision is out of range
     */
    public CardinalityConfig toConfig() {
        return new CardinalityConfig(strategy, cap, sketchPrecision);
    }

    @Override
    public String toString() {
        return strategy == CardinalityConfig.Strategy.EXACT
            ? "exact(cap=" + cap + ")"
            : "sketch(log2m=" + sketchPrecision + ")";
    }
}
