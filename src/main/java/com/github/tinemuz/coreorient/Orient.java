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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orientation of a plane measured on oriented drill core.
 *
 * <p>The plane is observed in the borehole frame as an alpha angle (between
 * the plane and the core axis) and a beta angle (clockwise, looking down-hole,
 * from the reference line to the lowest point of the trace on the core). This
 * class rotates the plane's normal from the borehole frame into the global
 * frame (x east, y north, z up) using the hole's bearing and inclination, and
 * reports the result as a pole (trend/plunge) or a full {@link Plane}.</p>
 *
 * <p>Conventions follow Stigsson and Munier, "Orientation uncertainty goes
 * bananas", Computers &amp; Geosciences 56 (2013). Inputs are degrees; the
 * stored values are radians. Inclination is negative for a hole drilled
 * downward.</p>
 *
 * <p>The pole is always reported as the downward end of the normal. For
 * small alpha the rotated normal can point upward; it is then reversed, so
 * the trend differs by 180 degrees from the raw normal's azimuth and the
 * plunge stays in [0, 90].</p>
 */
public final class Orient {
    private static final Logger log = LoggerFactory.getLogger(Orient.class);
    private static final double HALF_PI = Math.PI / 2.0;
    private static final double TWO_PI = Math.PI * 2.0;
    // Below this the normal is treated as vertical and has no azimuth
    private static final double VERTICAL_EPSILON = 1e-12;

    private final double bearing;
    private final double inclination;
    private final double alpha;
    private final double beta;

    /**
     * Validate and store one core measurement together with the borehole
     * orientation at its depth.
     *
     * @param bearing       azimuth of the hole trajectory, clockwise from north, [0, 360]
     * @param inclination   angle of the trajectory from horizontal, negative downward, [-90, 90]
     * @param alpha         acute angle between plane and core axis, [0, 90]
     * @param beta          angle from the reference line to the trace's lower inflection point, [0, 360]
     * @param referenceLine side of the core the reference line is marked on
     * @throws OutOfRangeException naming the first field that is out of range
     */
    public Orient(double bearing, double inclination, double alpha, double beta, ReferenceLine referenceLine) {
        AngleValidator.validate("bearing", bearing, 0.0, 360.0);
        AngleValidator.validate("inclination", inclination, -90.0, 90.0);
        AngleValidator.validate("alpha", alpha, 0.0, 90.0);
        AngleValidator.validate("beta", beta, 0.0, 360.0);
        if (referenceLine == null) {
            throw new IllegalArgumentException("referenceLine must not be null");
        }
        this.bearing = Math.toRadians(bearing);
        this.inclination = Math.toRadians(inclination);
        this.alpha = Math.toRadians(alpha);
        this.beta = Math.toRadians(referenceLine.adjustBeta(beta));
    }

    /**
     * Normal of the measured plane in the borehole frame, where the hole axis
     * is +x and the reference line lies in the x/y plane.
     */
    Vector3 normalInBorehole() {
        double cosAlpha = Math.cos(alpha);
        return new Vector3(cosAlpha * Math.cos(beta), cosAlpha * Math.sin(beta), Math.sin(alpha));
    }

    /**
     * Normal of the measured plane in the global frame, always pointing into
     * the lower hemisphere.
     */
    Vector3 normalInGlobal() {
        // Tilt the hole axis down to its inclination, then swing it round to its bearing
        Matrix3 tilt = Matrix3.rotationY(HALF_PI - inclination);
        Matrix3 swing = Matrix3.rotationZ(HALF_PI - bearing);
        Vector3 n = swing.multiply(tilt).apply(normalInBorehole());
        // A pole is an axis; report the downward end
        return n.z() > 0.0 ? n.negate() : n;
    }

    /** Trend and plunge of the pole, in radians: {@code {trend, plunge}}. */
    double[] trendAndPlungeRadians() {
        Vector3 n = normalInGlobal();

        // STEP 1: angle between the horizontal projection of the normal and +x
        double horizontal = n.horizontalLength();
        double apparentTrend;
        if (horizontal < VERTICAL_EPSILON) {
            log.debug("Pole is vertical (horizontal component {}); using trend of 90 degrees", horizontal);
            apparentTrend = 0.0;
        } else {
            apparentTrend = Math.acos(clamp(n.x() / horizontal));
        }

        // STEP 2: convert the mathematical angle to an azimuth clockwise from north
        double trend = n.y() <= 0.0 ? HALF_PI + apparentTrend : HALF_PI - apparentTrend;
        if (trend < 0.0) {
            trend += TWO_PI;
        }

        // STEP 3: plunge is positive downward
        double plunge = -Math.asin(clamp(n.z()));
        return new double[] {trend, plunge};
    }

    /** The pole (downward normal) of the measured plane, in degrees. */
    public Lineation pole() {
        double[] tp = trendAndPlungeRadians();
        double trend = Math.toDegrees(tp[0]);
        if (trend >= 360.0) {
            trend -= 360.0;
        }
        return new Lineation(trend, Math.toDegrees(tp[1]));
    }

    /** The measured plane in global coordinates. */
    public Plane toPlane() {
        Lineation pole = pole();
        double strike = AngleConversions.strikeFromTrend(pole.trend());
        return Plane.of(
                strike,
                AngleConversions.dipFromPlunge(pole.plunge()),
                AngleConversions.dipDirectionFromStrike(strike),
                pole.trend(),
                pole.plunge());
    }

    /** Beta after the reference-line adjustment, i.e. relative to the top of the core. */
    double betaDegrees() {
        return Math.toDegrees(beta);
    }

    private static double clamp(double cosOrSin) {
        return Math.max(-1.0, Math.min(1.0, cosOrSin));
    }
}
