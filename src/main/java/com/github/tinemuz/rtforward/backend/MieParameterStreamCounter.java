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

import com.github.tinemuz.rtforward.model.Aerosol;
import com.github.tinemuz.rtforward.model.AtmosphericProfile;
import com.github.tinemuz.rtforward.model.Cloud;
import com.github.tinemuz.rtforward.model.RadianceResult;
import com.github.tinemuz.rtforward.model.SensorCoefficients;

/**
 * Chooses the stream count from the largest size parameter
 * {@code x = 2*pi*r_eff/lambda} over the cloud and aerosol layers: larger
 * particles relative to the wavelength have more forward-peaked phase functions
 * and need more Legendre terms.
 */
public final class MieParameterStreamCounter implements StreamCounter {
    // microns * cm^-1 -> dimensionless
    private static final double MICRON_WAVENUMBER_TO_UNITLESS = 1.0e-4;

    private final int maxLegendreTerms;

    public MieParameterStreamCounter(int maxLegendreTerms) {
        if (maxLegendreTerms < 2) throw new IllegalArgumentException("At least two Legendre terms are required");
        this.maxLegendreTerms = maxLegendreTerms;
    }

    @Override
    public int computeStreamCount(
            AtmosphericProfile atmosphere, SensorCoefficients sensor, int channelIndex, RadianceResult result) {
        double maxRadius = 0.0;
        for (Cloud c : atmosphere.clouds()) maxRadius = Math.max(maxRadius, c.maxEffectiveRadius());
        for (Aerosol a : atmosphere.aerosols()) maxRadius = Math.max(maxRadius, a.maxEffectiveRadius());
        if (maxRadius <= 0.0) {
            result.setScatteringFlag(false);
            result.setNFullStreams(0);
            return 0;
        }

        double wavenumber = sensor.channel(channelIndex).wavenumber();
        double sizeParameter = 2.0 * Math.PI * maxRadius * wavenumber * MICRON_WAVENUMBER_TO_UNITLESS;
        int n;
        if (sizeParameter < 0.01) n = 2;
        else if (sizeParameter < 1.0) n = 4;
        else if (sizeParameter < 5.0) n = 8;
        else n = 16;
        n = Math.min(n, maxLegendreTerms - maxLegendreTerms % 2);

        result.setScatteringFlag(true);
        result.setNFullStreams(n + 2);
        return n;
    }
}
