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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.LoggerConfig;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags. Both only change the
 * log level on stderr; the report on stdout is always written.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log progress details to stderr"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Log only errors to stderr"
    )
    private boolean quiet = false;

    /**
     * Checks if verbose mode is enabled.
     *
     * @return true if verbose is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Checks if quiet mode is enabled.
     *
     * @return true if quiet is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * The root log level these flags ask for.
     *
     * @return DEBUG for verbose, ERROR for quiet, WARN otherwise
     */
    public Level logLevel() {
        if (verbose) {
            return Level.DEBUG;
        }
        return quiet ? Level.ERROR : Level.WARN;
    }

    /**
     * Applies {@link #logLevel()} to the root logger of the current log4j context.
     */
    public void applyLogLevel() {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        LoggerConfig rootConfig = context.getConfiguration().getRootLogger();
        rootConfig.setLevel(logLevel());
        context.updateLoggers();
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }
}
