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
 * Spectral coefficients of one sensor channel.
 *
 * <p>Radiances are in mW/(m^2.sr.cm^-1) and temperatures in kelvin. The Planck
 * coefficients are {@code c1 = C1*v^3} and {@code c2 = C2*v} for the channel
 * central wavenumber {@code v}; the band-correction coefficients convert the
 * monochromatic temperature to a polychromatic one,
 * {@code T = bandC1 + bandC2 * T_mono}.</p>
 *
 * @param sensorChannel   channel number as published for the sensor
 * @param wavenumber      central wavenumber in cm^-1
 * @param planckC1        first Planck coefficient for the channel
 * @param planckC2        second Planck coefficient for the channel
 * @param bandC1          band-correction offset
 * @param bandC2          band-correction slope
 * @param solarIrradiance top-of-atmosphere solar irradiance, 0 when the sun does not contribute
 */
public record SpectralChannel(
        int sensorChannel,
        double wavenumber,
        double planckC1,
        double planckC2,
        double bandC1,
        double bandC2,
        double solarIrradiance) {

    /** First radiation constant, mW/(m^2.sr.cm^-4). */
    public static final double C1 = 1.191042972e-05;
    /** Second radiation constant, K.cm. */
    public static final double C2 = 1.4387769;

    public SpectralChannel {
        if (!(wavenumber > 0.0)) {
            throw new IllegalArgumentException("Channel " + sensorChannel + " wavenumber must be positive");
        }
        if (bandC2 == 0.0) {
            throw new IllegalArgumentException("Channel " + sensorChannel + " band-correction slope is zero");
        }
        if (!(solarIrradiance >= 0.0)) {
            throw new IllegalArgumentException("Channel " + sensorChannel + " solar irradiance is negative");
        }
    }

    /** Channel with Planck coefficients derived from the wavenumber. */
    public static SpectralChannel of(
            int sensorChannel, double wavenumber, double bandC1, double bandC2, double solarIrradiance) {
        return new SpectralChannel(
                sensorChannel,
                wavenumber,
                C1 * wavenumber * wavenumber * wavenumber,
                C2 * wavenumber,
                bandC1,
                bandC2,
                solarIrradiance);
    }

    /** Brightness temperature for a radiance; 0 for non-positive radiance. */
    public double brightnessTemperature(double radiance) {
        if (!(radiance > 0.0)) return 0.0;
        double monochromatic = planckC2 / Math.log(planckC1 / radiance + 1.0);
        return (monochromatic - bandC1) / bandC2;
    }

    /** Radiance emitted by a black body at the given brightness temperature. */
    public double radiance(double brightnessTemperature) {
        if (!(brightnessTemperature > 0.0)) return 0.0;
        double monochromatic = bandC1 + bandC2 * brightnessTemperature;
        return planckC1 / Math.expm1(planckC2 / monochromatic);
    }
}
