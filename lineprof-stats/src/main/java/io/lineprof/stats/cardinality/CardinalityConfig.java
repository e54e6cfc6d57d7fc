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

/**
 * The distinct-count strategy for one profiling run.
 *
 * <p>Only the parameter belonging to the selected strategy is used: {@code cap} for
 * {@link Strategy#EXACT}, {@code sketchPrecision} for {@link Strategy#SKETCH}. Both are still
 * validated so a bad value is reported no matter which strategy is selected.
 *
 * @param strategy        which tracker to create
 * @param cap             exact-set cap, {@code 0} disables tracking
 * @param sketchPrecision HyperLogLog log2m
 */
public record CardinalityConfig(Strategy strategy, int cap, int sketchPrecision) {

    public static final int DEFAULT_CAP = 100_000;
    public static final int DEFAULT_SKETCH_PRECISION = 14;

    /**
     * Available distinct-count strategies.
     */
    public enum Strategy {
        /** bounded exact set */
        EXACT,
        /** HyperLogLog estimate */
        SKETCH
    }

    /**
     * Compact constructor with validation.
     */
    public CardinalityConfig {
        if (strategy == null) {
            throw new IllegalArgumentException("cardinality strategy cannot be null");
        }
        if (cap < 0) {
            throw new IllegalArgumentException("cardinality cap must be non-negative: " + cap);
        }
        if (sketchPrecision < SketchCardinality.MIN_LOG2M || sketchPrecision > SketchCardinality.MAX_LOG2M) {
            throw new IllegalArgumentException("sketch precision must be between "
                + SketchCardinality.MIN_LOG2M + " and " + SketchCardinality.MAX_LOG2M + ": " + sketchPrecision);
        }
    }

    /**
     * Exact tracking with the given cap.
     */
    public static CardinalityConfig exact(int cap) {
        return new CardinalityConfig(Strategy.EXACT, cap, DEFAULT_SKETCH_PRECISION);
    }

    /**
     * Sketch tracking with the given precision.
     */
    public static CardinalityConfig sketch(int sketchPrecision) {
        return new CardinalityConfig(Strategy.SKETCH, DEFAULT_CAP, sketchPrecision);
    }

    /**
     * Exact tracking with the default cap.
     */
    public static CardinalityConfig defaults() {
        return exact(DEFAULT_CAP);
    }

    /**
     * Creates a new, empty tracker for the configured strategy.
     *
     * @return a tracker owned by the caller
     */
    public CardinalityTracker newTracker() {
        return switch (strategy) {
            case EXACT -> new ExactCappedCardinality(cap);
            case SKETCH -> new SketchCardinality(sketchPrecision);
        };
    }
}
