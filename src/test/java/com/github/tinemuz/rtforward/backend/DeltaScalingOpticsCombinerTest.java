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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.rtforward.optics.CombinedOpticalState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DeltaScalingOpticsCombinerTest {

    private static final double TOLERANCE = 1.0e-12;

    private final DeltaScalingOpticsCombiner combiner = new DeltaScalingOpticsCombiner();

    @Test
    @DisplayName("Non-scattering layers end with zero albedo and phase")
    void nonScattering() {
        CombinedOpticalState optics = new CombinedOpticalState(2, 4, 1);
        optics.setLegendreTerms(4);
        optics.opticalDepth()[0] = 0.5;
        optics.phaseCoefficient()[1][0][0] = 0.3; // stray phase with no scattering

        combiner.combine(optics);

        assertEquals(0.5, optics.opticalDepth()[0], 0.0);
        assertEquals(0.0, optics.singleScatterAlbedo()[0]);
        assertEquals(0.0, optics.deltaTruncation()[0]);
        assertEquals(0.0, optics.phaseCoefficient()[1][0][0]);
        assertFalse(optics.isScattering());
    }

    @Test
    @DisplayName("Phase coefficients are normalized by the scattering optical depth")
    void normalization() {
        CombinedOpticalState optics = hgLayer(2, 1.0, 0.4, 0.5);

        combiner.combine(optics);

        double[][][] phase = optics.phaseCoefficient();
        assertEquals(1.0, phase[0][0][0], TOLERANCE);
        assertEquals(0.5, phase[1][0][0], TOLERANCE);
        assertEquals(0.25, phase[2][0][0], TOLERANCE);
        assertEquals(0.4, optics.singleScatterAlbedo()[0], TOLERANCE);
        assertEquals(1.0, optics.opticalDepth()[0], TOLERANCE);
        assertEquals(0.0, optics.deltaTruncation()[0], "No truncation with two terms");
    }

    @Test
    @DisplayName("Delta-M scaling truncates the highest Legendre coefficient")
    void deltaM() {
        CombinedOpticalState optics = hgLayer(4, 1.0, 0.4, 0.5);

        combiner.combine(optics);

        double f = Math.pow(0.5, 4);
        double[][][] phase = optics.phaseCoefficient();
        assertEquals(f, optics.deltaTruncation()[0], TOLERANCE);
        assertEquals(1.0, phase[0][0][0], TOLERANCE);
        assertEquals((0.5 - f) / (1.0 - f), phase[1][0][0], TOLERANCE);
        assertEquals(0.0, phase[4][0][0], TOLERANCE);
        assertEquals(1.0 - f * 0.4, optics.opticalDepth()[0], TOLERANCE);
        assertEquals(0.4 * (1.0 - f) / (1.0 - f * 0.4), optics.singleScatterAlbedo()[0], TOLERANCE);
    }

    @Test
    @DisplayName("Albedo never exceeds one")
    void albedoCapped() {
        CombinedOpticalState optics = hgLayer(0, 0.3, 0.3 + 1.0e-9, 0.0);

        combiner.combine(optics);

        assertEquals(1.0, optics.singleScatterAlbedo()[0], 0.0);
    }

    /** One layer with extinction tau and Henyey-Greenstein scattering, weighted the way accumulation leaves it. */
    private static CombinedOpticalState hgLayer(int nTerms, double tau, double scattering, double g) {
        CombinedOpticalState optics = new CombinedOpticalState(1, 8, 1);
        optics.setLegendreTerms(nTerms);
        optics.opticalDepth()[0] = tau;
        optics.singleScatterAlbedo()[0] = scattering;
        for (int l = 0; l <= nTerms; l++) optics.phaseCoefficient()[l][0][0] = scattering * Math.pow(g, l);
        return optics;
    }
}
