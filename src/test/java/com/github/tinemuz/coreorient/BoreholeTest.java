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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BoreholeTest {

    private static final List<SurveyStation> SURVEY = List.of(
            new SurveyStation(0.0, 0.0, -45.0),
            new SurveyStation(12.5, 0.0, -45.0),
            new SurveyStation(16.0, 0.0, -45.0),
            new SurveyStation(22.0, 0.0, -45.0),
            new SurveyStation(30.0, 0.0, -45.0));

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Every measurement is oriented, in input order")
        void orientsAllMeasurements() {
            List<RawMeasurement> raw = List.of(
                    new RawMeasurement(1.0, 90.0, 180.0),
                    new RawMeasurement(10.0, 90.0, 180.0),
                    new RawMeasurement(20.0, 90.0, 180.0),
                    new RawMeasurement(30.0, 90.0, 180.0));

            Borehole hole = new Borehole(ReferenceLine.TOP, raw, SURVEY);

            assertEquals(4, hole.orientedMeasurements().size());
            for (Plane plane : hole.orientedMeasurements()) {
                assertEquals(90.0, Math.round(plane.strike()));
                assertEquals(45.0, Math.round(plane.dip()));
                assertEquals(180.0, Math.round(plane.dipDirection()));
                assertEquals(45.0, Math.round(plane.plunge()));
            }
        }

        @Test
        @DisplayName("Each measurement uses the station that governs its depth")
        void usesGoverningStation() {
            List<SurveyStation> curving = List.of(
                    new SurveyStation(0.0, 262.7, -55.3),
                    new SurveyStation(50.0, 270.0, -50.0),
                    new SurveyStation(100.0, 280.0, -45.0));
            List<RawMeasurement> raw = List.of(
                    new RawMeasurement(80.0, 65.0, 230.0),
                    new RawMeasurement(10.0, 65.0, 230.0),
                    new RawMeasurement(75.0, 65.0, 230.0),
                    new RawMeasurement(50.0, 65.0, 230.0));

            Borehole hole = new Borehole(ReferenceLine.TOP, raw, curving);

            List<Plane> planes = hole.orientedMeasurements();
            assertEquals(Plane.alphaBeta(280.0, -45.0, 65.0, 230.0, ReferenceLine.TOP), planes.get(0));
            assertEquals(Plane.alphaBeta(262.7, -55.3, 65.0, 230.0, ReferenceLine.TOP), planes.get(1));
            // 75.0 is the midpoint, which belongs to the shallower station
            assertEquals(Plane.alphaBeta(270.0, -50.0, 65.0, 230.0, ReferenceLine.TOP), planes.get(2));
            assertEquals(Plane.alphaBeta(270.0, -50.0, 65.0, 230.0, ReferenceLine.TOP), planes.get(3));
            assertEquals(36.0, Math.round(planes.get(1).plunge()));
            assertEquals(286.0, Math.round(planes.get(1).trend()));
        }

        @Test
        @DisplayName("The reference line applies to every measurement")
        void referenceLine() {
            List<RawMeasurement> raw = List.of(new RawMeasurement(5.0, 90.0, 0.0));

            Borehole hole = new Borehole(ReferenceLine.BOTTOM, raw, SURVEY);

            assertEquals(ReferenceLine.BOTTOM, hole.referenceLine());
            Plane plane = hole.orientedMeasurements().get(0);
            assertEquals(45.0, Math.round(plane.plunge()));
            assertEquals(90.0, Math.round(plane.strike()));
        }

        @Test
        @DisplayName("No measurements gives no planes")
        void noMeasurements() {
            Borehole hole = new Borehole(ReferenceLine.TOP, List.of(), SURVEY);

            assertTrue(hole.orientedMeasurements().isEmpty());
            assertEquals(SURVEY, hole.stations());
        }
    }

    @Nested
    @DisplayName("Immutability")
    class ImmutabilityTests {

        @Test
        @DisplayName("Results and stations cannot be modified")
        void unmodifiable() {
            Borehole hole = new Borehole(ReferenceLine.TOP, List.of(new RawMeasurement(3.0, 45.0, 45.0)), SURVEY);

            assertThrows(UnsupportedOperationException.class, () -> hole.orientedMeasurements().clear());
            assertThrows(UnsupportedOperationException.class, () -> hole.stations().clear());
        }

        @Test
        @DisplayName("Later changes to the input lists do not leak in")
        void defensiveCopies() {
            List<SurveyStation> stations = new ArrayList<>(SURVEY);
            List<RawMeasurement> raw = new ArrayList<>(List.of(new RawMeasurement(3.0, 45.0, 45.0)));

            Borehole hole = new Borehole(ReferenceLine.TOP, raw, stations);
            stations.clear();
            raw.add(new RawMeasurement(4.0, 45.0, 45.0));

            assertEquals(5, hole.stations().size());
            assertEquals(1, hole.orientedMeasurements().size());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Survey not starting at the collar")
        void firstStationNotAtZero() {
            List<SurveyStation> shifted = List.of(
                    new SurveyStation(5.0, 0.0, -45.0), new SurveyStation(10.0, 0.0, -45.0));

            assertThrows(InvalidSurveyDataException.class,
                    () -> new Borehole(ReferenceLine.TOP, List.of(new RawMeasurement(6.0, 45.0, 45.0)), shifted));
            assertThrows(InvalidSurveyDataException.class,
                    () -> new Borehole(ReferenceLine.TOP, List.of(), shifted));
        }

        @Test
        @DisplayName("Any measurement beyond the survey fails the whole borehole")
        void measurementBeyondSurvey() {
            List<RawMeasurement> raw = List.of(
                    new RawMeasurement(5.0, 45.0, 45.0),
                    new RawMeasurement(30.5, 45.0, 45.0));

            DepthOutOfSurveyRangeException e = assertThrows(
                    DepthOutOfSurveyRangeException.class, () -> new Borehole(ReferenceLine.TOP, raw, SURVEY));
            assertEquals(30.5, e.getDepth());
        }

        @Test
        @DisplayName("Out of range raw values are rejected before a borehole exists")
        void outOfRangeMeasurement() {
            assertThrows(OutOfRangeException.class, () -> new RawMeasurement(1.0, 90.5, 10.0));
            assertThrows(OutOfRangeException.class, () -> new RawMeasurement(-1.0, 45.0, 10.0));
            assertThrows(OutOfRangeException.class, () -> new SurveyStation(0.0, 360.001, -45.0));
            assertThrows(OutOfRangeException.class, () -> new SurveyStation(0.0, 10.0, -90.5));
        }

        @Test
        @DisplayName("Null arguments")
        void nulls() {
            assertThrows(IllegalArgumentException.class, () -> new Borehole(null, List.of(), SURVEY));
            assertThrows(IllegalArgumentException.class, () -> new Borehole(ReferenceLine.TOP, null, SURVEY));
        }
    }
}
