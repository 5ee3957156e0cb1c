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

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A surveyed borehole with its oriented structural measurements.
 *
 * <p>All measurements are oriented when the borehole is constructed; either
 * every measurement is classified and oriented or construction fails. The
 * instance is immutable afterwards.</p>
 */
public final class Borehole {
    private static final Logger log = LoggerFactory.getLogger(Borehole.class);

    private final ReferenceLine referenceLine;
    private final List<SurveyStation> stations;
    private final List<Plane> orientedMeasurements;

    /**
     * @param referenceLine   side of the core the beta reference line is marked on
     * @param rawMeasurements alpha/beta measurements, in any depth order
     * @param stations        survey stations, strictly depth-ascending, the first at depth 0.0
     * @throws InvalidSurveyDataException     if the survey cannot anchor a depth partition
     * @throws DepthOutOfSurveyRangeException if a measurement lies outside the survey
     * @throws OutOfRangeException            if an angle is out of range
     */
    public Borehole(
            ReferenceLine referenceLine, List<RawMeasurement> rawMeasurements, List<SurveyStation> stations) {
        if (referenceLine == null) {
            throw new IllegalArgumentException("referenceLine must not be null");
        }
        if (rawMeasurements == null) {
            throw new IllegalArgumentException("rawMeasurements must not be null");
        }
        DepthIntervalMapper mapper = DepthIntervalMapper.of(stations);
        this.referenceLine = referenceLine;
        this.stations = mapper.stations();
        this.orientedMeasurements =
                Collections.unmodifiableList(mapper.orient(rawMeasurements, referenceLine));
        log.debug("Oriented {} measurements against {} survey stations ({} reference line)",
                orientedMeasurements.size(), this.stations.size(), referenceLine);
    }

    public ReferenceLine referenceLine() {
        return referenceLine;
    }

    /** Survey stations as supplied, in depth order. */
    public List<SurveyStation> stations() {
        return stations;
    }

    /** One plane per raw measurement, in the order the measurements were given. */
    public List<Plane> orientedMeasurements() {
        return orientedMeasurements;
    }
}
