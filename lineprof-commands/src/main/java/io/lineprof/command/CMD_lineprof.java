package io.lineprof.command;

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

import io.lineprof.command.common.CardinalityOption;
import io.lineprof.command.common.DelimiterConverter;
import io.lineprof.command.common.InputSourceOption;
import io.lineprof.command.common.ProfileModeOption;
import io.lineprof.command.common.VerbosityOption;
import io.lineprof.command.render.BorderedTableRenderer;
import io.lineprof.command.render.DelimitedTextRenderer;
import io.lineprof.command.render.ReportRenderer;
import io.lineprof.stats.LineProfiler;
import io.lineprof.stats.ProfileConfig;
import io.lineprof.stats.ProfileMode;
import io.lineprof.stats.report.ProfileReport;
import io.lineprof.stats.route.LineSource;
import io.lineprof.stats.route.MissingHeaderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.concurrent.Callable;

/// Profile a stream of delimited text lines
///
/// Reads a file or standard input once and prints per-group or per-column statistics:
/// counts of present, empty and unparseable values, numeric min/max/sum/mean/stddev, string
/// min/max and cardinality, and string length statistics. Output is a bordered table unless
/// an output delimiter is given.
///
/// ```
/// lineprof group-number data.csv -p 2
/// cut -d, -f1,4 data.csv | lineprof group-string - -D tab
/// ```
@CommandLine.Command(name = "lineprof",
    header = "Profile delimited text data in a single pass",
    description = "Reports per-group or per-column statistics for line-oriented data. "
        + "Empty fields, unparseable numbers and lines without the delimiter are counted, never fatal.",
    mixinStandardHelpOptions = true,
    version = "lineprof 0.1.0",
    sortOptions = false,
    exitCodeListHeading = "Exit codes:%n",
    exitCodeList = {"0: success", "1: error reading input or missing CSV header", "2: usage error"})
public class CMD_lineprof implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_lineprof.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ProfileModeOption modeOption = new ProfileModeOption();

    @CommandLine.Mixin
    private InputSourceOption inputOption = new InputSourceOption();

    @CommandLine.Option(names = {"-d", "--input-delimiter"},
        defaultValue = ",",
        converter = DelimiterConverter.class,
        description = "Input field delimiter, a single character or \\t, tab, \\s, space (default: ${DEFAULT-VALUE})")
    private char inputDelimiter = ProfileConfig.DEFAULT_DELIMITER;

    @CommandLine.Option(names = {"-D", "--output-delimiter"},
        converter = DelimiterConverter.class,
        description = "Write delimited output with this delimiter instead of a table")
    private Character outputDelimiter;

    @CommandLine.Option(names = {"-p", "--precision"},
        defaultValue = "0",
        description = "Decimals for fixed-point values, 0 to 17 (default: ${DEFAULT-VALUE})")
    private int precision = 0;

    @CommandLine.Option(names = {"-z", "--zero-as-empty"},
        description = "Count numeric zeros as empty values")
    private boolean zeroAsEmpty = false;

    @CommandLine.Mixin
    private CardinalityOption cardinalityOption = new CardinalityOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    private InputStream stdin = System.in;

    /// run the lineprof command
    /// @param args command line args
    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /// @return a command line configured the way [#main(String[])] runs it
    public static CommandLine newCommandLine() {
        return newCommandLine(new CMD_lineprof());
    }

    static CommandLine newCommandLine(CMD_lineprof command) {
        return new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true);
    }

    /// Replace the stream read when the input is `-`.
    ///
    /// @param stdin the stream to read instead of [System#in]
    /// @return this command
    CMD_lineprof withStdin(InputStream stdin) {
        this.stdin = stdin;
        return this;
    }

    /// Execute the profiling pass and print the report
    ///
    /// @return 0 for success, 1 for input errors, 2 for usage errors
    @Override
    public Integer call() {
        ProfileConfig config = validateOptions();
        verbosityOption.applyLogLevel();

        InputSourceOption.InputSource source = inputOption.getInputSource();
        if (source.isStdin() && stdin == System.in && System.console() != null) {
            spec.commandLine().usage(System.out);
            return CommandLine.ExitCode.USAGE;
        }

        ProfileMode mode = modeOption.getMode();
        ReportRenderer renderer = outputDelimiter == null
            ? new BorderedTableRenderer()
            : new DelimitedTextRenderer(outputDelimiter);

        ProfileReport report;
        try {
            source.validate();
            try (LineSource lines = source.open(stdin)) {
                report = new LineProfiler(config).profile(mode, lines);
                logger.debug("read {} lines from {}", lines.getLinesRead(), source);
            }
        } catch (MissingHeaderException e) {
            logger.error("Cannot profile {} in {} mode: {}", source, mode, e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } catch (IOException e) {
            logger.error("Error reading {}: {}", source, e.toString());
            return CommandLine.ExitCode.SOFTWARE;
        }

        PrintStream out = System.out;
        out.print(renderer.render(report));
        out.flush();
        return CommandLine.ExitCode.OK;
    }

    private ProfileConfig validateOptions() {
        try {
            verbosityOption.validate();
        } catch (IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
        try {
            return new ProfileConfig(inputDelimiter, zeroAsEmpty, cardinalityOption.toConfig(), precision);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }
}
