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

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tinemuz.coreorient.OrientationSettings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoreOrientCliTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private CoreOrientCli cli;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new CoreOrientCli(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("orient-one")
    class OrientOneTests {

        @Test
        @DisplayName("Prints the plane as JSON; inclination is positive downward")
        void printsPlane() throws IOException {
            int code = cli.run(new String[] {
                "orient-one", "--bearing", "262.7", "--inclination", "55.3", "--alpha", "65", "--beta", "230"
            });

            assertEquals(CoreOrientCli.EXIT_OK, code, stderr());
            JsonNode json = new ObjectMapper().readTree(stdout());
            assertEquals(16.0, Math.round(json.get("strike").asDouble()));
            assertEquals(54.0, Math.round(json.get("dip").asDouble()));
            assertEquals(106.0, Math.round(json.get("dip_direction").asDouble()));
            assertEquals(286.0, Math.round(json.get("trend").asDouble()));
            assertEquals(36.0, Math.round(json.get("plunge").asDouble()));
        }

        @Test
        @DisplayName("--bottom shifts beta by 180 degrees")
        void bottom() throws IOException {
            int code = cli.run(new String[] {
                "orient-one", "--bearing=0", "--inclination=45", "--alpha=90", "--beta=0", "--bottom"
            });

            assertEquals(CoreOrientCli.EXIT_OK, code, stderr());
            JsonNode json = new ObjectMapper().readTree(stdout());
            assertEquals(90.0, Math.round(json.get("strike").asDouble()));
            assertEquals(45.0, Math.round(json.get("plunge").asDouble()));
        }

        @Test
        @DisplayName("Out of range angle is invalid data")
        void outOfRange() {
            int code = cli.run(new String[] {
                "orient-one", "--bearing", "0", "--inclination", "45", "--alpha", "95", "--beta", "0"
            });

            assertEquals(CoreOrientCli.EXIT_INVALID_DATA, code);
            assertTrue(stderr().contains("alpha"), stderr());
        }

        @Test
        @DisplayName("Missing or malformed options are usage errors")
        void usageErrors() {
            assertEquals(CoreOrientCli.EXIT_USAGE,
                    cli.run(new String[] {"orient-one", "--bearing", "0", "--alpha", "45", "--beta", "0"}));
            assertEquals(CoreOrientCli.EXIT_USAGE,
                    cli.run(new String[] {"orient-one", "--bearing", "east", "--inclination", "45",
                        "--alpha", "45", "--beta", "0"}));
            assertEquals(CoreOrientCli.EXIT_USAGE,
                    cli.run(new String[] {"orient-one", "--bearing", "0", "--inclination", "45",
                        "--alpha", "45", "--beta", "0", "--reference-line", "left"}));
            assertEquals(CoreOrientCli.EXIT_USAGE,
                    cli.run(new String[] {"orient-one", "--bearing", "0", "--inclination", "45",
                        "--alpha", "45", "--beta", "0", "--depth", "3"}));
            assertTrue(stderr().contains("Usage"), stderr());
        }
    }

    @Nested
    @DisplayName("borehole")
    class BoreholeTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("Writes the oriented table to --output")
        void writesOutputFile() throws IOException {
            Path survey = write("survey.csv", "depth,bearing,inclination\n0,0,-45\n12.5,0,-45\n30,0,-45\n");
            Path core = write("core.csv", "depth,alpha,beta\n1,90,180\n20,90,180\n");
            Path output = dir.resolve("planes.csv");

            int code = cli.run(new String[] {
                "borehole", "--dh-orientation", survey.toString(), "--dh-measurements", core.toString(),
                "--output", output.toString()
            });

            assertEquals(CoreOrientCli.EXIT_OK, code, stderr());
            List<String> lines = Files.readAllLines(output);
            assertEquals(3, lines.size());
            assertEquals("strike,dip,dip_direction,pole.trend,pole.plunge", lines.get(0));
            String[] row = lines.get(1).split(",");
            assertEquals(90.0, Math.round(Double.parseDouble(row[0])));
            assertEquals(45.0, Math.round(Double.parseDouble(row[1])));
            assertTrue(stdout().contains("Wrote 2 planes"), stdout());
        }

        @Test
        @DisplayName("Without --output the table goes to standard output")
        void writesStdout() throws IOException {
            Path survey = write("survey.csv", "depth,bearing,inclination\n0,0,-45\n30,0,-45\n");
            Path core = write("core.csv", "depth,alpha,beta\n5,90,0\n");

            int code = cli.run(new String[] {
                "borehole", "--dh-orientation", survey.toString(), "--dh-measurements", core.toString(),
                "--reference-line", "bottom"
            });

            assertEquals(CoreOrientCli.EXIT_OK, code, stderr());
            String[] lines = stdout().split("\n");
            assertEquals(2, lines.length);
            assertEquals(90.0, Math.round(Double.parseDouble(lines[1].split(",")[0])));
        }

        @Test
        @DisplayName("Survey not starting at zero is invalid data")
        void invalidSurvey() throws IOException {
            Path survey = write("survey.csv", "depth,bearing,inclination\n5,0,-45\n30,0,-45\n");
            Path core = write("core.csv", "depth,alpha,beta\n10,90,0\n");

            int code = cli.run(new String[] {
                "borehole", "--dh-orientation", survey.toString(), "--dh-measurements", core.toString()
            });

            assertEquals(CoreOrientCli.EXIT_INVALID_DATA, code);
            assertTrue(stderr().contains("0.0"), stderr());
        }

        @Test
        @DisplayName("Measurement below the survey is invalid data")
        void depthOutOfRange() throws IOException {
            Path survey = write("survey.csv", "depth,bearing,inclination\n0,0,-45\n30,0,-45\n");
            Path core = write("core.csv", "depth,alpha,beta\n10,90,0\n45,90,0\n");

            int code = cli.run(new String[] {
                "borehole", "--dh-orientation", survey.toString(), "--dh-measurements", core.toString()
            });

            assertEquals(CoreOrientCli.EXIT_INVALID_DATA, code);
            assertTrue(stderr().contains("45.0"), stderr());
        }

        @Test
        @DisplayName("Missing input file is an I/O error")
        void missingFile() {
            int code = cli.run(new String[] {
                "borehole", "--dh-orientation", dir.resolve("nope.csv").toString(),
                "--dh-measurements", dir.resolve("nope2.csv").toString()
            });

            assertEquals(CoreOrientCli.EXIT_IO, code);
        }

        private Path write(String name, String content) throws IOException {
            Path file = dir.resolve(name);
            Files.writeString(file, content);
            return file;
        }
    }

    @Test
    @DisplayName("Bad reference line setting is a configuration error, not a crash")
    void invalidConfiguration() {
        System.setProperty(OrientationSettings.REFERENCE_LINE_PROPERTY, "sideways");
        try {
            int code = cli.run(new String[] {
                "orient-one", "--bearing", "0", "--inclination", "45", "--alpha", "90", "--beta", "180"
            });

            assertEquals(CoreOrientCli.EXIT_CONFIG, code);
            assertTrue(stderr().contains("sideways"), stderr());
        } finally {
            System.clearProperty(OrientationSettings.REFERENCE_LINE_PROPERTY);
        }
    }

    @Test
    @DisplayName("Unknown command and no command")
    void unknownCommand() {
        assertEquals(CoreOrientCli.EXIT_USAGE, cli.run(new String[] {"stereonet"}));
        assertEquals(CoreOrientCli.EXIT_USAGE, cli.run(new String[0]));
        assertEquals(CoreOrientCli.EXIT_OK, cli.run(new String[] {"--help"}));
    }

    // Helper methods

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
