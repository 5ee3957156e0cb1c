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
 * Range checks for angles and depths entering the orientation code.
 *
 * <p>Bounds are inclusive: a value equal to {@code min} or {@code max} is
 * always accepted. NaN is never accepted.</p>
 */
public final class AngleValidator {

    private AngleValidator() {}

    /**
     * Return {@code value} unchanged if it lies within {@code [min, max]}.
     *
     * @param field name reported when the check fails (e.g. "bearing")
     * @param value the value to check
     * @param min   inclusive lower bound
     * @param max   inclusive upper bound
     * @return the validated value
     * @throws OutOfRangeException if the value is NaN or outside the bounds
     */
    public static double validate(String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new OutOfRangeException(field, value, min, max);
        }
        return value;
    }
}
