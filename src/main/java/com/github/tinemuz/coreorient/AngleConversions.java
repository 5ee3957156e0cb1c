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

/**
 * Conversions between the angles that describe a plane and its pole.
 *
 * <p>All values are decimal degrees. Azimuths are clockwise from north and
 * wrap into [0, 360); dips and plunges live in [0, 90]. Every input is
 * validated before it is converted.</p>
 */
public final class AngleConversions {
    static final double FULL_CIRCLE = 360.0;
    static final double RIGHT_ANGLE = 90.0;

    private AngleConversions() {}

    /** Dip direction lies 90 degrees clockwise of strike (right-hand rule). */
    public static double dipDirectionFromStrike(double strike) {
        return clockwise("strike", strike, 90.0);
    }

    /** Trend of the pole lies 90 degrees anticlockwise of strike. */
    public static double trendFromStrike(double strike) {
        return clockwise("strike", strike, 270.0);
    }

    public static double strikeFromTrend(double trend) {
        return clockwise("trend", trend, 90.0);
    }

    public static double plungeFromDip(double dip) {
        return perpendicular("dip", dip);
    }

    public static double dipFromPlunge(double plunge) {
        return perpendicular("plunge", plunge);
    }

    /**
     * Rotate an azimuth clockwise by {@code add} degrees. Inputs are in
     * [0, 360] after validation and {@code add < 360}, so one subtraction
     * brings the sum back into [0, 360).
     */
    private static double clockwise(String field, double azimuth, double add) {
        AngleValidator.validate(field, azimuth, 0.0, FULL_CIRCLE);
        double out = azimuth + add;
        if (out >= FULL_CIRCLE) {
            out -= FULL_CIRCLE;
        }
        return out;
    }

    private static double perpendicular(String field, double angle) {
        AngleValidator.validate(field, angle, 0.0, RIGHT_ANGLE);
        return RIGHT_ANGLE - angle;
    }
}
