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

import io.lineprof.stats.route.LineSource;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Shared positional input parameter: a file path, or {@code -} for standard input.
 * All supporting types are inner classes for self-contained encapsulation.
 */
public class InputSourceOption {

    /** The argument that selects standard input. */
    public static final String STDIN_NAME = "-";

    /**
     * Immutable input specification.
     *
     * @param path the input file, or null for standard input
     */
    public record InputSource(Path path) {

        /** Standard input. */
        public static final InputSource STDIN = new InputSource(null);

        /**
         * Checks if this source reads standard input.
         */
        public boolean isStdin() {
            return path == null;
        }

        /**
         * Validates that a file source exists and is a regular file.
         *
         * @throws IllegalStateException if the file is missing
         */
        public void validate() {
            if (!isStdin() && !Files.isRegularFile(path)) {
                throw new IllegalStateException("Input file does not exist: " + path);
            }
        }

        /**
         * Opens the source as strict UTF-8 lines.
         *
         * @param stdin the stream to use when this source is standard input
         * @return a line source the caller must close
         * @throws IOException if the file cannot be opened
         */
        public LineSource open(InputStream stdin) throws IOException {
            InputStream in = isStdin() ? stdin : Files.newInputStream(path);
            return LineSource.of(in);
        }

        @Override
        public String toString() {
            return isStdin() ? "<stdin>" : path.toString();
        }
    }

    /**
     * Picocli type converter for {@link InputSource} specifications.
     */
    public static class InputSourceConverter implements CommandLine.ITypeConverter<InputSource> {

        @Override
        public InputSource convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("Input path cannot be empty");
            }
            if (STDIN_NAME.equals(value)) {
                return InputSource.STDIN;
            }
            return new InputSource(Paths.get(value));
        }
    }

    @CommandLine.Parameters(
        index = "1",
        arity = "0..1",
        paramLabel = "FILE",
        defaultValue = STDIN_NAME,
        description = "The file to read, or '-' to read standard input, which must not be a terminal (default: ${DEFAULT-VALUE})",
        converter = InputSourceConverter.class
    )
    private InputSource inputSource = InputSource.STDIN;

    /**
     * Gets the InputSource record constructed from the parameter.
     */
    public InputSource getInputSource() {
        return inputSource;
    }

    @Override
    public String toString() {
        return inputSource.toString();
    }
}
