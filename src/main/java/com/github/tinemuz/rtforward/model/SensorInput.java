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

package com.github.tinemuz.rtforward.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Auxiliary, sensor-specific inputs handed through to predictor generation and
 * gas absorption (for example cell pressures of pressure-modulated radiometers
 * or the geomagnetic field for Zeeman-affected channels). The forward model
 * itself never interprets the values.
 */
public final class SensorInput {
    /** No auxiliary input. */
    public static final SensorInput NONE = new SensorInput(Map.of());

    private final Map<String, Double> values;

    private SensorInput(Map<String, Double> values) {
        this.values = values;
    }

    public static SensorInput of(Map<String, Double> values) {
        if (values == null || values.isEmpty()) return NONE;
        return new SensorInput(Collections.unmodifiableMap(new TreeMap<>(values)));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /** Named value, or {@code defaultValue} when absent. */
    public double get(String name, double defaultValue) {
        Double v = values.get(name);
        return v == null ? defaultValue : v;
    }

    public Map<String, Double> values() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SensorInput && values.equals(((SensorInput) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SensorInput" + values;
    }
}
