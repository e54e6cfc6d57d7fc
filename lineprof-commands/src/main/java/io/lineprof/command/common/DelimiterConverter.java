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

import picocli.CommandLine;

/**
 * Picocli type converter for single-character delimiters.
 *
 * <p>Besides a literal character, the names {@code \t}, {@code tab}, {@code \s} and
 * {@code space} are accepted, since tabs and spaces are awkward to pass through a shell.
 * Line terminators are rejected because they can never appear inside a line.
 */
public class DelimiterConverter implements CommandLine.ITypeConverter<Character> {

    @Override
    public Character convert(String value) {
        if (value == null || value.isEmpty()) {
            throw new CommandLine.TypeConversionException("Delimiter cannot be empty");
        }
        switch (value) {
            case "\\t":
            case "tab":
                return '\t';
            case "\\s":
            case "space":
                return ' ';
            default:
                break;
        }
        if (value.length() != 1) {
            throw new CommandLine.TypeConversionException(
                "Delimiter must be a single character, or one of \\t, tab, \\s, space: '" + value + "'");
        }
        char delimiter = value.charAt(0);
        if (delimiter == '\n' || delimiter == '\r') {
            throw new CommandLine.TypeConversionException("Delimiter cannot be a line terminator");
        }
        return delimiter;
    }
}
