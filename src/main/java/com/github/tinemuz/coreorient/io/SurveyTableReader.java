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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.github.tinemuz.coreorient.RawMeasurement;
import com.github.tinemuz.coreorient.SurveyStation;

/**
 * Reads comma separated survey and measurement tables.
 *
 * <p>The first non-blank line is a header naming the columns; columns are
 * matched by name (case-insensitive), so their order does not matter and
 * extra columns are ignored. Blank lines and lines starting with {@code #}
 * are skipped. Survey tables need {@code depth,bearing,inclination};
 * measurement tables need {@code depth,alpha,beta}.</p>
 */
public final class SurveyTableReader {

    private static final String[] STATION_COLUMNS = {"depth", "bearing", "inclination"};
    private static final String[] MEASUREMENT_COLUMNS = {"depth", "alpha", "beta"};

    public List<SurveyStation> readStations(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readStations(reader);
        }
    }

    public List<SurveyStation> readStations(Reader reader) throws IOException {
        List<SurveyStation> stations = new ArrayList<>();
        for (Row row : readRows(reader, STATION_COLUMNS)) {
            try {
                stations.add(new SurveyStation(row.values[0], row.values[1], row.values[2]));
            } catch (IllegalArgumentException e) {
                throw new MalformedTableException(row.lineNumber, e.getMessage(), e);
            }
        }
        return stations;
    }

    public List<RawMeasurement> readMeasurements(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readMeasurements(reader);
        }
    }

    public List<RawMeasurement> readMeasurements(Reader reader) throws IOException {
        List<RawMeasurement> measurements = new ArrayList<>();
        for (Row row : readRows(reader, MEASUREMENT_COLUMNS)) {
            try {
                measurements.add(new RawMeasurement(row.values[0], row.values[1], row.values[2]));
            } catch (IllegalArgumentException e) {
                throw new MalformedTableException(row.lineNumber, e.getMessage(), e);
            }
        }
        return measurements;
    }

    private static List<Row> readRows(Reader reader, String[] columns) throws IOException {
        Objects.requireNonNull(reader, "reader");
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        List<Row> rows = new ArrayList<>();
        int[] indices = null;
        int lineNumber = 0;
        String line;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            // spreadsheet exports often start with a UTF-8 byte-order mark
            if (lineNumber == 1 && line.startsWith("\uFEFF")) {
                line = line.substring(1);
            }
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            String[] cells = split(trimmed);
            if (indices == null) {
                indices = headerIndices(cells, columns, lineNumber);
                continue;
            }
            double[] values = new double[columns.length];
            for (int i = 0; i < columns.length; i++) {
                int col = indices[i];
                if (col >= cells.length) {
                    throw new MalformedTableException(
                            lineNumber, "missing value for column '" + columns[i] + "'");
                }
                try {
                    values[i] = Double.parseDouble(cells[col]);
                } catch (NumberFormatException e) {
                    throw new MalformedTableException(
                            lineNumber, "'" + cells[col] + "' in column '" + columns[i] + "' is not a number", e);
                }
            }
            rows.add(new Row(lineNumber, values));
        }
        if (indices == null) {
            throw new MalformedTableException(
                    Math.max(lineNumber, 1), "table has no header line; expected " + String.join(",", columns));
        }
        return rows;
    }

    private static int[] headerIndices(String[] header, String[] columns, int lineNumber)
            throws MalformedTableException {
        Map<String, Integer> byName = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            byName.putIfAbsent(header[i].toLowerCase(Locale.ROOT), i);
        }
        int[] indices = new int[columns.length];
        for (int i = 0; i < columns.length; i++) {
            Integer index = byName.get(columns[i]);
            if (index == null) {
                throw new MalformedTableException(lineNumber, "header is missing column '" + columns[i] + "'");
            }
            indices[i] = index;
        }
        return indices;
    }

    private static String[] split(String line) {
        String[] cells = line.split(",", -1);
        for (int i = 0; i < cells.length; i++) {
            String cell = cells[i].trim();
            if (cell.length() >= 2 && cell.startsWith("\"") && cell.endsWith("\"")) {
                cell = cell.substring(1, cell.length() - 1).trim();
            }
            cells[i] = cell;
        }
        return cells;
    }

    private record Row(int lineNumber, double[] values) {}
}
