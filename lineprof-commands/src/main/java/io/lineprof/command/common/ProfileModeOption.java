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

import io.lineprof.stats.ProfileMode;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Shared positional mode parameter.
 * All supporting types are inner classes for self-contained encapsulation.
 */
public class ProfileModeOption {

    /**
     * Picocli type converter accepting the hyphenated mode names, for example
     * {@code group-number}, in any case.
     */
    public static class ProfileModeConverter implements CommandLine.ITypeConverter<ProfileMode> {

        @Override
        public ProfileMode convert(String value) {
            try {
                return ProfileMode.fromName(value.trim());
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    /**
     * The hyphenated mode names, for help text.
     */
    public static class ProfileModeCandidates implements Iterable<String> {

        @Override
        public Iterator<String> iterator() {
            List<String> names = new ArrayList<>();
            for (ProfileMode mode : ProfileMode.values()) {
                names.add(mode.modeName());
            }
            return names.iterator();
        }
    }

    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "MODE",
        defaultValue = "number",
        description = "How to interpret each line. Valid values: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        completionCandidates = ProfileModeCandidates.class,
        converter = ProfileModeConverter.class
    )
    private ProfileMode mode = ProfileMode.NUMBER;

    /**
     * Gets the selected mode.
     */
    public ProfileMode getMode() {
        return mode;
    }

    @Override
    public String toString() {
        return mode.modeName();
    }
}
