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
package com.github.tinemuz.coreorient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns measurement depths to borehole survey stations.
 *
 * <p>Each station owns the depths closer to it than to its neighbours: the
 * hole is cut at the midpoint between every pair of adjacent stations. A
 * station's interval is open at the top and closed at the bottom, so a depth
 * exactly on a midpoint belongs to the shallower of the two stations and a
 * depth exactly at a station belongs to that station. The first station must
 * sit at the collar (depth 0.0); its interval includes the collar itself.</p>
 */
public final class DepthIntervalMapper {
    private static final Logger log = LoggerFactory.getLogger(DepthIntervalMapper.class);

    private final List<SurveyStation> stations;
    private final List<DepthInterval> intervals;

    private DepthIntervalMapper(List<SurveyStation> stations, List<DepthInterval> intervals) {
        this.stations = stations;
        this.intervals = intervals;
    }

    /**
     * Build the depth partition for a survey.
     *
     * @param stations survey stations, strictly depth-ascending, first at depth 0.0
     * @throws InvalidSurveyDataException if the stations cannot anchor a partition
     */
    public static DepthIntervalMapper of(List<SurveyStation> stations) {
        checkSurvey(stations);
        List<SurveyStation> copy = List.copyOf(stations);
        int n = copy.size();
        List<DepthInterval> intervals = new ArrayList<>(n);
        if (n == 1) {
            double d = copy.get(0).depth();
            intervals.add(new DepthInterval(d, d, true));
        } else {
            // Shared midpoints, computed once so neighbouring intervals meet exactly
            double[] cuts = new double[n - 1];
            for (int i = 0; i < n - 1; i++) {
                double upper = copy.get(i).depth();
                double lower = copy.get(i + 1).depth();
                cuts[i] = upper + (lower - upper) / 2.0;
            }
            intervals.add(new DepthInterval(copy.get(0).depth(), cuts[0], true));
            for (int i = 1; i < n - 1; i++) {
                intervals.add(new DepthInterval(cuts[i - 1], cuts[i], false));
            }
            intervals.add(new DepthInterval(cuts[n - 2], copy.get(n - 1).depth(), false));
        }
        log.debug("Partitioned survey into {} intervals down to {}", n, copy.get(n - 1).depth());
        return new DepthIntervalMapper(copy, Collections.unmodifiableList(intervals));
    }

    private static void checkSurvey(List<SurveyStation> stations) {
        if (stations == null || stations.isEmpty()) {
            throw new InvalidSurveyDataException("Survey must contain at least one station");
        }
        for (int i = 0; i < stations.size(); i++) {
            if (stations.get(i) == null) {
                throw new InvalidSurveyDataException("Survey station " + i + " is null");
            }
        }
        double first = stations.get(0).depth();
        if (first != 0.0) {
            throw new InvalidSurveyDataException(
                    "First survey station must be at depth 0.0, got " + first);
        }
        for (int i = 1; i < stations.size(); i++) {
            double previous = stations.get(i - 1).depth();
            double current = stations.get(i).depth();
            if (current <= previous) {
                throw new InvalidSurveyDataException(
                        "Survey depths must be strictly ascending: station " + i + " at " + current
                                + " follows " + previous);
            }
        }
    }

    /** Intervals in station order; they partition [0, last station depth]. */
    public List<DepthInterval> intervals() {
        return intervals;
    }

    public List<SurveyStation> stations() {
        return stations;
    }

    /**
     * Index of the station whose interval contains {@code depth}.
     *
     * @return the station index, or -1 if the depth lies outside the survey
     */
    public int indexOf(double depth) {
        if (Double.isNaN(depth)) {
            return -1;
        }
        int lo = 0;
        int hi = intervals.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int where = intervals.get(mid).locate(depth);
            if (where == 0) {
                return mid;
            }
            if (where < 0) {
                hi = mid - 1;
            } else {
                lo = mid + 1;
            }
        }
        return -1;
    }

    /**
     * Survey station governing {@code depth}.
     *
     * @throws DepthOutOfSurveyRangeException if no station interval contains the depth
     */
    public SurveyStation stationFor(double depth) {
        int index = indexOf(depth);
        if (index < 0) {
            throw new DepthOutOfSurveyRangeException(
                    depth, stations.get(0).depth(), stations.get(stations.size() - 1).depth());
        }
        return stations.get(index);
    }

    /**
     * Orient every measurement with the station that governs its depth.
     *
     * @return planes in the order of {@code measurements}
     * @throws DepthOutOfSurveyRangeException if any measurement lies outside the survey;
     *         no planes are returned in that case
     */
    public List<Plane> orient(List<RawMeasurement> measurements, ReferenceLine referenceLine) {
        List<Plane> planes = new ArrayList<>(measurements.size());
        for (RawMeasurement measurement : measurements) {
            SurveyStation station = stationFor(measurement.depth());
            planes.add(Plane.alphaBeta(
                    station.bearing(),
                    station.inclination(),
                    measurement.alpha(),
                    measurement.beta(),
                    referenceLine));
        }
        return planes;
    }
}
