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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.github.tinemuz.coreorient.Plane;

/** Writes oriented planes as a comma separated table, one row per plane. */
public final class PlaneTableWriter {

    public static final String HEADER = "strike,dip,dip_direction,pole.trend,pole.plunge";

    public void write(List<Plane> planes, Path path) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(planes, writer);
        }
    }

    /** Writes the table to {@code writer} and flushes it; the writer is left open. */
    public void write(List<Plane> planes, Writer writer) throws IOException {
        writer.write(HEADER);
        writer.write('\n');
        for (Plane plane : planes) {
            writer.write(Double.toString(plane.strike()));
            writer.write(',');
            writer.write(Double.toString(plane.dip()));
            writer.write(',');
            writer.write(Double.toString(plane.dipDirection()));
            writer.write(',');
            writer.write(Double.toString(plane.trend()));
            writer.write(',');
            writer.write(Double.toString(plane.plunge()));
            writer.write('\n');
        }
        writer.flush();
    }
}
