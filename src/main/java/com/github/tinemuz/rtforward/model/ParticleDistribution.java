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

import java.util.Arrays;

/**
 * Per-layer particle size and loading shared by clouds and aerosols.
 *
 * <p>Both arrays are indexed by layer with index 0 at the top of the atmosphere,
 * matching {@link AtmosphericProfile}. Instances are immutable.</p>
 */
public abstract class ParticleDistribution {
    private final double[] effectiveRadius;
    private final double[] loading;

    protected ParticleDistribution(double[] effectiveRadius, double[] loading) {
        if (effectiveRadius == null || loading == null) {
            throw new IllegalArgumentException("Effective radius and loading arrays are required");
        }
        if (effectiveRadius.length != loading.length) {
            throw new IllegalArgumentException(
                    "Effective radius (" + effectiveRadius.length
                            + ") and loading (" + loading.length + ") layer counts differ");
        }
        this.effectiveRadius = effectiveRadius.clone();
        this.loading = loading.clone();
    }

    /** Number of layers described. */
    public int nLayers() {
        return loading.length;
    }

    /** Effective radius in microns for the given layer. */
    public double effectiveRadius(int layer) {
        return effectiveRadius[layer];
    }

    /** Water content (clouds, kg/m^2) or concentration (aerosols, kg/m^2) for the layer. */
    public double loading(int layer) {
        return loading[layer];
    }

    /** Largest effective radius over the layers that carry a non-zero loading. */
    public double maxEffectiveRadius() {
        double max = 0.0;
        for (int k = 0; k < loading.length; k++) {
            if (loading[k] > 0.0 && effectiveRadius[k] > max) max = effectiveRadius[k];
        }
        return max;
    }

    /** Copy of the layers with {@code n} empty layers inserted above the top. */
    protected double[][] paddedAbove(int n) {
        double[] r = new double[n + effectiveRadius.length];
        double[] q = new double[n + loading.length];
        System.arraycopy(effectiveRadius, 0, r, n, effectiveRadius.length);
        System.arraycopy(loading, 0, q, n, loading.length);
        return new double[][] {r, q};
    }

    /** Returns a copy of this distribution with {@code n} empty layers above the top. */
    public abstract ParticleDistribution padAbove(int n);

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        ParticleDistribution other = (ParticleDistribution) obj;
        return Arrays.equals(effectiveRadius, other.effectiveRadius)
                && Arrays.equals(loading, other.loading);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(effectiveRadius) + Arrays.hashCode(loading);
    }
}
