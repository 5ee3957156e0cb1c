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
package com.github.tinemuz.coreorient.io;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.coreorient.Plane;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PlaneTableWriterTest {

    private final PlaneTableWriter writer = new PlaneTableWriter();

    @Test
    @DisplayName("Writes a header and one row per plane")
    void writesRows() throws IOException {
        StringWriter out = new StringWriter();

        writer.write(List.of(Plane.of(16.0, 54.0), Plane.of(90.0, 45.5)), out);

        assertEquals(
                "strike,dip,dip_direction,pole.trend,pole.plunge\n"
                        + "16.0,54.0,106.0,286.0,36.0\n"
                        + "90.0,45.5,180.0,0.0,44.5\n",
                out.toString());
    }

    @Test
    @DisplayName("No planes still writes the header")
    void headerOnly() throws IOException {
        StringWriter out = new StringWriter();

        writer.write(List.of(), out);

        assertEquals(PlaneTableWriter.HEADER + "\n", out.toString());
    }

    @Test
    @DisplayName("Writes to a file")
    void writesFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("planes.csv");

        writer.write(List.of(Plane.of(0.0, 0.0)), file);

        assertEquals(
                List.of(PlaneTableWriter.HEADER, "0.0,0.0,90.0,270.0,90.0"),
                Files.readAllLines(file));
    }
}
