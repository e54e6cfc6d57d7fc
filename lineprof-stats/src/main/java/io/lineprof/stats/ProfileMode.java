package io.lineprof.stats;

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

import java.util.Arrays;
import java.util.stream.Collectors;

/// How lines are interpreted during a profiling pass.
public enum ProfileMode {

    /// each line is one number
    NUMBER("number"),
    /// each line is one string
    STRING("string"),
    /// the last field is a number, the preceding fields are the group key
    GROUP_NUMBER("group-number"),
    /// the last field is a string, the preceding fields are the group key
    GROUP_STRING("group-string"),
    /// the first line holds column headers, every column is profiled
    CSV("csv");

    private final String modeName;

    ProfileMode(String modeName) {
        this.modeName = modeName;
    }

    /// @return the hyphenated name used on the command line
    public String modeName() {
        return modeName;
    }

    /// Resolve a mode by its hyphenated name or its constant name, ignoring case.
    ///
    /// @param name the mode name
    /// @return the matching mode
    /// @throws IllegalArgumentException if nothing matches
    public static ProfileMode fromName(String name) {
        for (ProfileMode mode : values()) {
            if (mode.modeName.equalsIgnoreCase(name) || mode.name().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode '" + name + "', expected one of: "
            + Arrays.stream(values()).map(ProfileMode::modeName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return modeName;
    }
}
