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

import com.github.tinemuz.rtforward.model.AntennaPattern;
import com.github.tinemuz.rtforward.model.RadianceResult;
import com.github.tinemuz.rtforward.model.SensorCoefficients;
import com.github.tinemuz.rtforward.model.SpectralChannel;
import com.github.tinemuz.rtforward.model.ViewGeometry;

/**
 * Antenna temperature as a linear mix of the scene, the platform and cold
 * space: {@code Ta = (aEarth + aPlatform) * Tb + aSpace * T_cosmic}. The
 * radiance is recomputed from the corrected temperature.
 */
public final class LinearAntennaCorrection implements AntennaCorrection {
    /** Cosmic background temperature, K. */
    public static final double COSMIC_BACKGROUND_TEMPERATURE = 2.7253;

    @Override
    public void apply(ViewGeometry geometry, SensorCoefficients sensor, int channelIndex, RadianceResult result) {
        AntennaPattern pattern = sensor.antennaPattern();
        int fov = geometry.fieldOfView();
        if (pattern == null || !pattern.isValidFieldOfView(fov)) return;

        double tb = result.brightnessTemperature();
        double ta = (pattern.aEarth(fov, channelIndex) + pattern.aPlatform(fov, channelIndex)) * tb
                + pattern.aSpace(fov, channelIndex) * COSMIC_BACKGROUND_TEMPERATURE;
        SpectralChannel channel = sensor.channel(channelIndex);
        result.setBrightnessTemperature(ta);
        result.setRadiance(channel.radiance(ta));
        result.setAntennaCorrected(true);
    }
}
