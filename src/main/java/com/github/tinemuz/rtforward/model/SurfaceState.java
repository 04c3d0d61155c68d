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

/**
 * Surface type mixture of one profile: coverage fractions and the skin
 * temperature of each surface type.
 *
 * <p>Coverages are fractions in [0, 1] whose sum may not exceed 1. Temperatures
 * are in kelvin.</p>
 */
public record SurfaceState(
        double landCoverage,
        double waterCoverage,
        double snowCoverage,
        double iceCoverage,
        double landTemperature,
        double waterTemperature,
        double snowTemperature,
        double iceTemperature) {

    private static final double COVERAGE_TOLERANCE = 1.0e-6;

    public SurfaceState {
        checkCoverage("land", landCoverage);
        checkCoverage("water", waterCoverage);
        checkCoverage("snow", snowCoverage);
        checkCoverage("ice", iceCoverage);
        double total = landCoverage + waterCoverage + snowCoverage + iceCoverage;
        if (total > 1.0 + COVERAGE_TOLERANCE) {
            throw new IllegalArgumentException("Total surface coverage " + total + " exceeds 1");
        }
        checkTemperature("land", landTemperature);
        checkTemperature("water", waterTemperature);
        checkTemperature("snow", snowTemperature);
        checkTemperature("ice", iceTemperature);
    }

    /** Fully water-covered surface. */
    public static SurfaceState water(double temperature) {
        return new SurfaceState(0, 1, 0, 0, 0, temperature, 0, 0);
    }

    /** Fully land-covered surface. */
    public static SurfaceState land(double temperature) {
        return new SurfaceState(1, 0, 0, 0, temperature, 0, 0, 0);
    }

    private static void checkCoverage(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " coverage " + value + " outside [0, 1]");
        }
    }

    private static void checkTemperature(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException(name + " temperature " + value + " is not a valid temperature");
        }
    }
}
