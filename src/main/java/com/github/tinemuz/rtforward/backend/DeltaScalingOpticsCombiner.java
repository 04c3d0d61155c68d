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

package com.github.tinemuz.rtforward.backend;

import com.github.tinemuz.rtforward.optics.CombinedOpticalState;

/**
 * Normalizes the accumulated scattering and applies delta-M truncation.
 *
 * <p>On entry each layer holds total extinction in the optical depth, the
 * scattering optical depth in the single-scatter albedo and
 * scattering-weighted phase coefficients. On exit the phase coefficients are
 * normalized, the truncated fraction {@code f} (the highest active Legendre
 * coefficient) is stored as the delta truncation, and optical depth and albedo
 * are scaled by {@code (1 - f*w)} and {@code (1 - f)/(1 - f*w)}. Layers that do
 * not scatter are left with zero albedo and zero phase coefficients.</p>
 */
public final class DeltaScalingOpticsCombiner implements OpticsCombiner {
    private static final double SCATTERING_THRESHOLD = 1.0e-15;

    @Override
    public void combine(CombinedOpticalState optics) {
        int nTerms = optics.nLegendreTerms();
        int nPhase = optics.nPhaseElements();
        double[] tau = optics.opticalDepth();
        double[] omega = optics.singleScatterAlbedo();
        double[] delta = optics.deltaTruncation();
        double[][][] phase = optics.phaseCoefficient();

        for (int k = 0; k < optics.nLayers(); k++) {
            double scattering = omega[k];
            if (scattering <= SCATTERING_THRESHOLD || tau[k] <= 0.0) {
                omega[k] = 0.0;
                delta[k] = 0.0;
                for (double[][] term : phase) {
                    for (double[] element : term) element[k] = 0.0;
                }
                continue;
            }
            for (int l = 0; l <= nTerms; l++) {
                for (int i = 0; i < nPhase; i++) phase[l][i][k] /= scattering;
            }
            double w = Math.min(scattering / tau[k], 1.0);

            if (nTerms > 2) {
                double f = phase[nTerms][0][k];
                if (f > 0.0 && f < 1.0) {
                    for (int l = 0; l <= nTerms; l++) {
                        phase[l][0][k] = (phase[l][0][k] - f) / (1.0 - f);
                    }
                    tau[k] *= 1.0 - f * w;
                    w = w * (1.0 - f) / (1.0 - f * w);
                    delta[k] = f;
                } else {
                    delta[k] = 0.0;
                }
            } else {
                delta[k] = 0.0;
            }
            omega[k] = w;
        }
    }
}
