package io.lineprof.stats.classify;

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

import java.util.regex.Pattern;

/// Turns a raw text field into a [FieldValue].
///
/// The rules are applied in order:
/// 1. An empty field is [FieldValue.Empty].
/// 2. The field must be a plain decimal literal: optional sign, digits with an optional
///    fraction, and an optional exponent. Anything else, including whitespace, hex floats,
///    type suffixes and the `NaN` / `Infinity` spellings, is [FieldValue.Unparseable].
/// 3. A literal which overflows to an infinite double is [FieldValue.Unparseable].
/// 4. With `zeroAsEmpty` set, a value equal to `0.0` is [FieldValue.Empty].
/// 5. Anything left is [FieldValue.Numeric].
///
/// Parsing does not depend on the default locale.
public final class ValueClassifier {

    private static final Pattern DECIMAL =
        Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private ValueClassifier() {
    }

    /// Classify a raw field.
    ///
    /// @param raw the field text, without its delimiter
    /// @param zeroAsEmpty whether zeros count as missing values
    /// @return the classification, never null
    public static FieldValue classify(String raw, boolean zeroAsEmpty) {
        if (raw.isEmpty()) {
            return FieldValue.EMPTY;
        }
        if (!DECIMAL.matcher(raw).matches()) {
            return FieldValue.UNPARSEABLE;
        }
        double value = Double.parseDouble(raw);
        if (!Double.isFinite(value)) {
            return FieldValue.UNPARSEABLE;
        }
        if (zeroAsEmpty && value == 0.0d) {
            return FieldValue.EMPTY;
        }
        return new FieldValue.Numeric(value);
    }
}
