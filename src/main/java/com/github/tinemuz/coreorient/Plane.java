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
 * A geological plane in decimal degrees.
 *
 * <p>Strike follows the right-hand rule, so the dip direction is strike + 90
 * and the pole trends strike - 90 with plunge 90 - dip. Those relations are
 * used to fill in any field the caller leaves out; fields the caller does
 * supply are only range-checked, never reconciled against strike and dip.</p>
 *
 * @param strike       azimuth of the horizontal line in the plane, [0, 360]
 * @param dip          angle between the plane and horizontal, [0, 90]
 * @param dipDirection azimuth of the steepest descent, [0, 360]
 * @param pole         downward normal to the plane
 */
public record Plane(double strike, double dip, double dipDirection, Lineation pole) {

    public Plane {
        AngleValidator.validate("strike", strike, 0.0, AngleConversions.FULL_CIRCLE);
        AngleValidator.validate("dip", dip, 0.0, AngleConversions.RIGHT_ANGLE);
        AngleValidator.validate("dip direction", dipDirection, 0.0, AngleConversions.FULL_CIRCLE);
        if (pole == null) {
            throw new IllegalArgumentException("pole must not be null");
        }
    }

    /** Plane with every other field derived from strike and dip. */
    public static Plane of(double strike, double dip) {
        return of(strike, dip, null, null, null);
    }

    /**
     * Plane from strike and dip plus any explicitly known fields.
     *
     * @param dipDirection dip direction, or {@code null} to derive it from strike
     * @param trend        pole trend, or {@code null} to derive it from strike
     * @param plunge       pole plunge, or {@code null} to derive it from dip
     * @throws OutOfRangeException if any supplied or derived value is out of range
     */
    public static Plane of(double strike, double dip, Double dipDirection, Double trend, Double plunge) {
        AngleValidator.validate("strike", strike, 0.0, AngleConversions.FULL_CIRCLE);
        AngleValidator.validate("dip", dip, 0.0, AngleConversions.RIGHT_ANGLE);
        double dd = dipDirection != null ? dipDirection : AngleConversions.dipDirectionFromStrike(strike);
        double tr = trend != null ? trend : AngleConversions.trendFromStrike(strike);
        double pl = plunge != null ? plunge : AngleConversions.plungeFromDip(dip);
        return new Plane(strike, dip, dd, new Lineation(tr, pl));
    }

    /**
     * Orient a plane measured on drill core.
     *
     * @see Orient#Orient(double, double, double, double, ReferenceLine)
     */
    public static Plane alphaBeta(
            double bearing, double inclination, double alpha, double beta, ReferenceLine referenceLine) {
        return new Orient(bearing, inclination, alpha, beta, referenceLine).toPlane();
    }

    public double trend() {
        return pole.trend();
    }

    public double plunge() {
        return pole.plunge();
    }
}
