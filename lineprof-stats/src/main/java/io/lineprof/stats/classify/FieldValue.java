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

/// The outcome of classifying one raw text field.
///
/// Every field maps to exactly one of the three variants:
///
/// | Variant | Meaning |
/// |---|---|
/// | [Numeric] | the field parsed to a finite double |
/// | [Empty] | the field was empty, or a zero folded into "missing" |
/// | [Unparseable] | the field is not a decimal number |
///
/// @see ValueClassifier
public sealed interface FieldValue permits FieldValue.Numeric, FieldValue.Empty, FieldValue.Unparseable {

    /// Shared instance for empty fields
    Empty EMPTY = new Empty();

    /// Shared instance for fields which fail to parse
    Unparseable UNPARSEABLE = new Unparseable();

    /// A field holding a finite numeric value
    /// @param value the parsed value, never NaN or infinite
    record Numeric(double value) implements FieldValue {
        public Numeric {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("numeric field values must be finite: " + value);
            }
        }
    }

    /// A field with no value
    record Empty() implements FieldValue {
    }

    /// A field which could not be read as a number
    record Unparseable() implements FieldValue {
    }
}
