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

package com.github.tinemuz.rtforward.optics;

import com.github.tinemuz.rtforward.backend.BackendException;
import com.github.tinemuz.rtforward.backend.Workspace;
import java.util.Arrays;

/**
 * Layer optical properties of one channel, accumulated from every absorption
 * and scattering contributor and then normalized by the combiner.
 *
 * <p>The buffer is allocated once per profile and reused for every channel of
 * that profile. During accumulation {@link #singleScatterAlbedo()} holds the
 * layer scattering optical depth and {@link #phaseCoefficient()} the
 * scattering-weighted Legendre coefficients; the combiner turns both into
 * normalized quantities. Arrays are live and indexed by layer (top first);
 * phase coefficients are {@code [legendreTerm][phaseElement][layer]}.</p>
 */
public class CombinedOpticalState implements Workspace {
    private final int nLayers;
    private final int maxLegendreTerms;
    private final int maxPhaseElements;
    private final double[] opticalDepth;
    private final double[] singleScatterAlbedo;
    private final double[] deltaTruncation;
    private final double[][][] phaseCoefficient;
    private int nLegendreTerms;
    private int nPhaseElements = 1;
    private boolean released;

    public CombinedOpticalState(int nLayers, int maxLegendreTerms, int maxPhaseElements) {
        if (nLayers <= 0 || maxLegendreTerms < 0 || maxPhaseElements <= 0) {
            throw new IllegalArgumentException(
                    "Invalid optical state dimensions: layers=" + nLayers
                            + ", legendre=" + maxLegendreTerms + ", phase=" + maxPhaseElements);
        }
        this.nLayers = nLayers;
        this.maxLegendreTerms = maxLegendreTerms;
        this.maxPhaseElements = maxPhaseElements;
        this.opticalDepth = new double[nLayers];
        this.singleScatterAlbedo = new double[nLayers];
        this.deltaTruncation = new double[nLayers];
        this.phaseCoefficient = new double[maxLegendreTerms + 1][maxPhaseElements][nLayers];
    }

    /**
     * Return to the zero-scattering baseline: no optical depth, no scattering,
     * no Legendre terms.
     */
    public void resetScattering() {
        Arrays.fill(opticalDepth, 0.0);
        Arrays.fill(singleScatterAlbedo, 0.0);
        Arrays.fill(deltaTruncation, 0.0);
        for (double[][] term : phaseCoefficient) {
            for (double[] element : term) Arrays.fill(element, 0.0);
        }
        nLegendreTerms = 0;
        nPhaseElements = 1;
    }

    public int nLayers() {
        return nLayers;
    }

    public int maxLegendreTerms() {
        return maxLegendreTerms;
    }

    public int maxPhaseElements() {
        return maxPhaseElements;
    }

    public int nLegendreTerms() {
        return nLegendreTerms;
    }

    /**
     * Overwrite the active Legendre-term count. Used once per channel for the
     * stream count; contributors widen with {@link #requireLegendreTerms} and
     * a lower count than the channel already reached fails that contributor.
     */
    public void setLegendreTerms(int n) {
        checkLegendre(n);
        this.nLegendreTerms = n;
    }

    /**
     * Widen the active Legendre-term count to at least {@code n}. The count never
     * narrows within one channel.
     *
     * @return true if the count was widened
     */
    public boolean requireLegendreTerms(int n) {
        checkLegendre(n);
        if (n <= nLegendreTerms) return false;
        nLegendreTerms = n;
        return true;
    }

    public int nPhaseElements() {
        return nPhaseElements;
    }

    public void setPhaseElements(int n) {
        if (n < 1 || n > maxPhaseElements) {
            throw new IllegalArgumentException("Phase element count " + n + " outside [1, " + maxPhaseElements + "]");
        }
        this.nPhaseElements = n;
    }

    public double[] opticalDepth() {
        return opticalDepth;
    }

    public double[] singleScatterAlbedo() {
        return singleScatterAlbedo;
    }

    public double[] deltaTruncation() {
        return deltaTruncation;
    }

    public double[][][] phaseCoefficient() {
        return phaseCoefficient;
    }

    /** True when any layer has a non-zero single-scatter albedo. */
    public boolean isScattering() {
        for (double w : singleScatterAlbedo) {
            if (w != 0.0) return true;
        }
        return false;
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void release() throws BackendException {
        if (released) throw new BackendException("Optical state released twice");
        released = true;
    }

    private void checkLegendre(int n) {
        if (n < 0 || n > maxLegendreTerms) {
            throw new IllegalArgumentException(
                    "Legendre term count " + n + " outside [0, " + maxLegendreTerms + "]");
        }
    }
}
