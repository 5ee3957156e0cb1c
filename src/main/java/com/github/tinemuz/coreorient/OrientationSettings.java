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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Defaults for orienting a borehole, read from the classpath resource
 * <code>core-orient.properties</code>.
 *
 * <p>Recognised keys:</p>
 * <ul>
 *   <li><code>reference-line</code>: <code>top</code> (default) or <code>bottom</code></li>
 * </ul>
 *
 * <p>The system property <code>coreorient.reference-line</code> takes
 * precedence over the file.</p>
 */
public final class OrientationSettings {
    private static final Logger log = LoggerFactory.getLogger(OrientationSettings.class);
    public static final String RESOURCE = "core-orient.properties";
    public static final String REFERENCE_LINE_KEY = "reference-line";
    public static final String REFERENCE_LINE_PROPERTY = "coreorient.reference-line";

    private final ReferenceLine referenceLine;

    public OrientationSettings(ReferenceLine referenceLine) {
        if (referenceLine == null) {
            throw new IllegalArgumentException("referenceLine must not be null");
        }
        this.referenceLine = referenceLine;
    }

    public ReferenceLine referenceLine() {
        return referenceLine;
    }

    /**
     * Load settings from the classpath and system properties. A missing
     * resource is not an error; the built-in defaults are used instead.
     *
     * @throws IllegalStateException if the resource cannot be read or holds an invalid value
     */
    public static OrientationSettings load() {
        Properties props = new Properties();
        InputStream in = OrientationSettings.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.warn("'{}' not found on classpath; using the top reference line", RESOURCE);
        } else {
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            } catch (IOException e) {
                log.error("Failed to read '{}'", RESOURCE, e);
                throw new IllegalStateException("Failed to read " + RESOURCE, e);
            }
        }
        String override = System.getProperty(REFERENCE_LINE_PROPERTY);
        if (override != null) {
            props.setProperty(REFERENCE_LINE_KEY, override);
        }
        return fromProperties(props);
    }

    /**
     * Build settings from already loaded properties.
     *
     * @throws IllegalStateException if a value is not recognised
     */
    public static OrientationSettings fromProperties(Properties props) {
        String value = props.getProperty(REFERENCE_LINE_KEY);
        if (value == null || value.isBlank()) {
            return new OrientationSettings(ReferenceLine.TOP);
        }
        try {
            return new OrientationSettings(ReferenceLine.parse(value));
        } catch (IllegalArgumentException e) {
            log.error("Invalid '{}' setting: {}", REFERENCE_LINE_KEY, value);
            throw new IllegalStateException("Invalid " + REFERENCE_LINE_KEY + " setting: " + value, e);
        }
    }
}
