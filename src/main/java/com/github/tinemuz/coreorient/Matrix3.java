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
 * Immutable 3x3 matrix, stored row-major. Only what the rotation code needs:
 * the two elementary rotations, products and application to a vector.
 */
public final class Matrix3 {
    private final double[] m;

    private Matrix3(double[] m) {
        this.m = m;
    }

    public static Matrix3 of(
            double m00, double m01, double m02,
            double m10, double m11, double m12,
            double m20, double m21, double m22) {
        return new Matrix3(new double[] {m00, m01, m02, m10, m11, m12, m20, m21, m22});
    }

    /** Right-handed rotation by {@code angle} radians about the y-axis. */
    public static Matrix3 rotationY(double angle) {
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return of(
                c, 0.0, s,
                0.0, 1.0, 0.0,
                -s, 0.0, c);
    }

    /** Right-handed rotation by {@code angle} radians about the z-axis. */
    public static Matrix3 rotationZ(double angle) {
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return of(
                c, -s, 0.0,
                s, c, 0.0,
                0.0, 0.0, 1.0);
    }

    double get(int row, int col) {
        return m[row * 3 + col];
    }

    /** Matrix product {@code this * other}; {@code other} is applied first. */
    public Matrix3 multiply(Matrix3 other) {
        double[] out = new double[9];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                double sum = 0.0;
                for (int k = 0; k < 3; k++) {
                    sum += m[r * 3 + k] * other.m[k * 3 + c];
                }
                out[r * 3 + c] = sum;
            }
        }
        return new Matrix3(out);
    }

    public Vector3 apply(Vector3 v) {
        return new Vector3(
                m[0] * v.x() + m[1] * v.y() + m[2] * v.z(),
                m[3] * v.x() + m[4] * v.y() + m[5] * v.z(),
                m[6] * v.x() + m[7] * v.y() + m[8] * v.z());
    }
}
