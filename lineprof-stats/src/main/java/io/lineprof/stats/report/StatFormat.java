package io.lineprof.stats.report;

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

import io.lineprof.stats.accumulate.StringAccumulator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Turns accumulator values into the strings handed to the presentation layer.
 *
 * <p>Fixed-point values are rounded half-to-even from the exact binary value of the double, so
 * output does not depend on the host locale. Non-finite values print as {@code inf},
 * {@code -inf} and {@code NaN}.
 *
 * @param precision number of decimals for fixed-point values
 */
public record StatFormat(int precision) {

    public static final int MAX_PRECISION = 17;

    static final String CARDINALITY_DISABLED = "-";

    public StatFormat {
        if (precision < 0 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException(
                "precision must be between 0 and " + MAX_PRECISION + ": " + precision);
        }
    }

    public String count(long value) {
        return Long.toString(value);
    }

    /**
     * Fixed-point with the configured precision.
     */
    public String fixed(double value) {
        return fixed(value, precision);
    }

    /**
     * Fixed-point for an optional value, with an absent value shown as zero.
     */
    public String fixed(OptionalDouble value) {
        return fixed(value.orElse(0.0), precision);
    }

    /**
     * Fixed-point without decimals, as used for length bounds.
     */
    public String whole(OptionalDouble value) {
        return fixed(value.orElse(0.0), 0);
    }

    public String text(Optional<String> value) {
        return value.orElse("");
    }

    /**
     * The distinct count, marked with a trailing {@code +} when the tracker hit its cap and
     * shown as {@code -} when tracking is off.
     */
    public String cardinality(StringAccumulator accumulator) {
        if (!accumulator.isCardinalityEnabled()) {
            return CARDINALITY_DISABLED;
        }
        String value = Long.toString(accumulator.getCardinality());
        return accumulator.isCardinalityCapped() ? value + "+" : value;
    }

    /**
     * Shortest scientific notation: one leading digit, only as many fraction digits as the
     * value needs, and an unpadded exponent. For example {@code 15.0 -> 1.5e1},
     * {@code 3.0 -> 3e0}, {@code 0.00125 -> 1.25e-3}.
     *
     * @param value the value, possibly an overflowed sum
     * @return the formatted value
     */
    public static String scientific(double value) {
        if (!Double.isFinite(value)) {
            return nonFinite(value);
        }
        if (value == 0.0d) {
            return (1.0d / value < 0) ? "-0e0" : "0e0";
        }
        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();

        StringBuilder sb = new StringBuilder();
        if (decimal.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        return sb.append('e').append(exponent).toString();
    }

    private static String fixed(double value, int decimals) {
        if (!Double.isFinite(value)) {
            return nonFinite(value);
        }
        String text = new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).toPlainString();
        // BigDecimal drops the sign of values that round to zero
        boolean negative = value < 0.0d || (value == 0.0d && 1.0d / value < 0);
        return negative && text.charAt(0) != '-' ? "-" + text : text;
    }

    private static String nonFinite(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return value > 0 ? "inf" : "-inf";
    }
}
