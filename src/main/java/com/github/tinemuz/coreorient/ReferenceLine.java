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

import java.util.Locale;

/**
 * Side of the core on which the orientation (reference) line is marked.
 * Beta angles are measured clockwise, looking down-hole, from this line.
 */
public enum ReferenceLine {
    /** Line along the top of the core; beta is used as measured. */
    TOP {
        @Override
        double adjustBeta(double beta) {
            return beta;
        }
    },
    /** Line along the bottom of the core; beta is shifted by half a turn. */
    BOTTOM {
        @Override
        double adjustBeta(double beta) {
            double shifted = beta + 180.0;
            return shifted > 360.0 ? shifted - 360.0 : shifted;
        }
    };

    /** Beta angle (degrees) relative to the top of the core. */
    abstract double adjustBeta(double beta);

    /**
     * Parse a convention name such as {@code "top"} or {@code "BOTTOM"}.
     *
     * @throws IllegalArgumentException if the name matches neither convention
     */
    public static ReferenceLine parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Reference line must be 'top' or 'bottom', got null");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ReferenceLine line : values()) {
            if (line.name().equals(normalized)) {
                return line;
            }
        }
        throw new IllegalArgumentException(
                "Reference line must be 'top' or 'bottom', got '" + name + "'");
    }
}
