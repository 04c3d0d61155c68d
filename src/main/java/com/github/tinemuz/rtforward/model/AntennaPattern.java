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
 * Antenna efficiency coefficients of a microwave sensor, per scan position and
 * channel.
 *
 * <p>Arrays are indexed {@code [fieldOfView - 1][channelIndex]}; the measured
 * antenna temperature is {@code (aEarth + aPlatform) * Tb + aSpace * T_cosmic}.</p>
 */
public final class AntennaPattern {
    private final double[][] aEarth;
    private final double[][] aSpace;
    private final double[][] aPlatform;

    public AntennaPattern(double[][] aEarth, double[][] aSpace, double[][] aPlatform) {
        if (aEarth == null || aSpace == null || aPlatform == null) {
            throw new IllegalArgumentException("Antenna efficiency tables are required");
        }
        if (aEarth.length == 0 || aEarth.length != aSpace.length || aEarth.length != aPlatform.length) {
            throw new IllegalArgumentException("Antenna efficiency tables must share a non-zero FOV count");
        }
        this.aEarth = deepCopy(aEarth);
        this.aSpace = deepCopy(aSpace);
        this.aPlatform = deepCopy(aPlatform);
    }

    public int nFieldsOfView() {
        return aEarth.length;
    }

    /** True for 1-based scan positions covered by this pattern. */
    public boolean isValidFieldOfView(int fieldOfView) {
        return fieldOfView >= 1 && fieldOfView <= aEarth.length;
    }

    public double aEarth(int fieldOfView, int channelIndex) {
        return aEarth[fieldOfView - 1][channelIndex];
    }

    public double aSpace(int fieldOfView, int channelIndex) {
        return aSpace[fieldOfView - 1][channelIndex];
    }

    public double aPlatform(int fieldOfView, int channelIndex) {
        return aPlatform[fieldOfView - 1][channelIndex];
    }

    private static double[][] deepCopy(double[][] src) {
        double[][] copy = new double[src.length][];
        for (int i = 0; i < src.length; i++) copy[i] = src[i].clone();
        return copy;
    }
}
