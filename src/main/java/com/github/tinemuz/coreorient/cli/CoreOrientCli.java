/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.coreorient.cli;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tinemuz.coreorient.Borehole;
import com.github.tinemuz.coreorient.OrientationSettings;
import com.github.tinemuz.coreorient.Plane;
import com.github.tinemuz.coreorient.RawMeasurement;
import com.github.tinemuz.coreorient.ReferenceLine;
import com.github.tinemuz.coreorient.SurveyStation;
import com.github.tinemuz.coreorient.io.MalformedTableException;
import com.github.tinemuz.coreorient.io.PlaneTableWriter;
import com.github.tinemuz.coreorient.io.SurveyTableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 * core-orient borehole --dh-orientation survey.csv --dh-measurements core.csv [--output planes.csv]
 *                      [--bottom | --reference-line top|bottom]
 * core-orient orient-one --bearing B --inclination I --alpha A --beta B
 *                        [--bottom | --reference-line top|bottom]
 * </pre>
 *
 * <p>{@code orient-one} takes the inclination as a positive angle below
 * horizontal and prints the plane as JSON.</p>
 */
public final class CoreOrientCli {
    private static final Logger log = LoggerFactory.getLogger(CoreOrientCli.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_DATA = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO = 3;
    public static final int EXIT_CONFIG = 4;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  core-orient borehole --dh-orientation <csv> --dh-measurements <csv> [--output <csv>]",
            "                       [--bottom | --reference-line top|bottom]",
            "  core-orient orient-one --bearing <deg> --inclination <deg> --alpha <deg> --beta <deg>",
            "                         [--bottom | --reference-line top|bottom]");

    private final PrintStream out;
    private final PrintStream err;

    public CoreOrientCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CoreOrientCli(System.out, System.err).run(args));
    }

    /** Run one command and return the process exit code. */
    public int run(String[] args) {
        if (args.length == 0 || "help".equals(args[0]) || "--help".equals(args[0])) {
            out.println(USAGE);
            return args.length == 0 ? EXIT_USAGE : EXIT_OK;
        }
        try {
            Options options = Options.parse(args, 1);
            switch (args[0]) {
                case "borehole":
                    return borehole(options);
                case "orient-one":
                    return orientOne(options);
                default:
                    throw new UsageException("Unknown command '" + args[0] + "'");
            }
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (MalformedTableException e) {
            err.println("Invalid table: " + e.getMessage());
            return EXIT_INVALID_DATA;
        } catch (IllegalArgumentException e) {
            err.println("Invalid input: " + e.getMessage());
            return EXIT_INVALID_DATA;
        } catch (IllegalStateException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (IOException e) {
            log.error("I/O failure", e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private int borehole(Options options) throws UsageException, IOException {
        options.allow("dh-orientation", "dh-measurements", "output", "reference-line", "bottom");
        Path surveyPath = Path.of(options.required("dh-orientation"));
        Path measurementPath = Path.of(options.required("dh-measurements"));
        ReferenceLine referenceLine = referenceLine(options);

        SurveyTableReader reader = new SurveyTableReader();
        List<SurveyStation> stations = reader.readStations(surveyPath);
        List<RawMeasurement> measurements = reader.readMeasurements(measurementPath);
        Borehole borehole = new Borehole(referenceLine, measurements, stations);

        PlaneTableWriter writer = new PlaneTableWriter();
        String output = options.value("output");
        if (output != null) {
            writer.write(borehole.orientedMeasurements(), Path.of(output));
            out.println("Wrote " + borehole.orientedMeasurements().size() + " planes to " + output);
        } else {
            Writer stdout = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            writer.write(borehole.orientedMeasurements(), stdout);
        }
        return EXIT_OK;
    }

    private int orientOne(Options options) throws UsageException, IOException {
        options.allow("bearing", "inclination", "alpha", "beta", "reference-line", "bottom");
        double bearing = options.number("bearing");
        // positive down on the command line, negative down in the transform
        double inclination = -options.number("inclination");
        double alpha = options.number("alpha");
        double beta = options.number("beta");

        Plane plane = Plane.alphaBeta(bearing, inclination, alpha, beta, referenceLine(options));

        ObjectNode json = OBJECT_MAPPER.createObjectNode();
        json.put("strike", plane.strike());
        json.put("dip", plane.dip());
        json.put("dip_direction", plane.dipDirection());
        json.put("trend", plane.trend());
        json.put("plunge", plane.plunge());
        out.println(OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(json));
        return EXIT_OK;
    }

    private static ReferenceLine referenceLine(Options options) throws UsageException {
        String named = options.value("reference-line");
        if (options.flag("bottom")) {
            if (named != null && parseReferenceLine(named) != ReferenceLine.BOTTOM) {
                throw new UsageException("--bottom conflicts with --reference-line " + named);
            }
            return ReferenceLine.BOTTOM;
        }
        if (named != null) {
            return parseReferenceLine(named);
        }
        return OrientationSettings.load().referenceLine();
    }

    private static ReferenceLine parseReferenceLine(String name) throws UsageException {
        try {
            return ReferenceLine.parse(name);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    /** Parsed {@code --name value} options and {@code --flag} switches. */
    private static final class Options {
        private static final Set<String> FLAGS = Set.of("bottom");

        private final Map<String, String> values = new HashMap<>();
        private final Set<String> flags = new HashSet<>();

        static Options parse(String[] args, int from) throws UsageException {
            Options options = new Options();
            for (int i = from; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--") || arg.length() == 2) {
                    throw new UsageException("Unexpected argument '" + arg + "'");
                }
                String name = arg.substring(2);
                int eq = name.indexOf('=');
                if (eq >= 0) {
                    options.values.put(name.substring(0, eq), name.substring(eq + 1));
                } else if (FLAGS.contains(name)) {
                    options.flags.add(name);
                } else if (i + 1 < args.length) {
                    options.values.put(name, args[++i]);
                } else {
                    throw new UsageException("Missing value for --" + name);
                }
            }
            return options;
        }

        void allow(String... names) throws UsageException {
            Set<String> allowed = Set.of(names);
            for (String name : values.keySet()) {
                if (!allowed.contains(name)) {
                    throw new UsageException("Unknown option --" + name);
                }
            }
            for (String name : flags) {
                if (!allowed.contains(name)) {
                    throw new UsageException("Unknown option --" + name);
                }
            }
        }

        String value(String name) {
            return values.get(name);
        }

        boolean flag(String name) {
            return flags.contains(name);
        }

        String required(String name) throws UsageException {
            String value = values.get(name);
            if (value == null) {
                throw new UsageException("Missing required option --" + name);
            }
            return value;
        }

        double number(String name) throws UsageException {
            String value = required(name);
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new UsageException("--" + name + " must be a number, got '" + value + "'");
            }
        }
    }

    private static final class UsageException extends Exception {
        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }
}
