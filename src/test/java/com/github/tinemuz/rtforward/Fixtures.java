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

package com.github.tinemuz.rtforward;

import com.github.tinemuz.rtforward.model.AntennaPattern;
import com.github.tinemuz.rtforward.model.AtmosphericProfile;
import com.github.tinemuz.rtforward.model.Cloud;
import com.github.tinemuz.rtforward.model.SensorCoefficients;
import com.github.tinemuz.rtforward.model.SensorType;
import com.github.tinemuz.rtforward.model.SpectralChannel;
import com.github.tinemuz.rtforward.model.ViewGeometry;
import java.util.List;

/** Shared profiles, sensors and geometries for forward model tests. */
final class Fixtures {
    static final double[] LEVELS = {100.0, 300.0, 500.0, 700.0, 1000.0};
    static final double[] PRESSURE = {200.0, 400.0, 600.0, 850.0};
    static final double[] TEMPERATURE = {220.0, 250.0, 270.0, 285.0};
    static final int[] ABSORBERS = {AtmosphericProfile.H2O, AtmosphericProfile.O3};
    static final double[][] AMOUNTS = {{0.01, 0.30}, {0.5, 0.10}, {3.0, 0.05}, {8.0, 0.03}};

    private Fixtures() {}

    /** Four clear-sky layers from 100 to 1000 hPa. */
    static AtmosphericProfile clearSky() {
        return AtmosphericProfile.clearSky(LEVELS, PRESSURE, TEMPERATURE, ABSORBERS, AMOUNTS);
    }

    /** The clear-sky column with a water cloud of the given radius in its third layer. */
    static AtmosphericProfile cloudy(double effectiveRadius) {
        Cloud cloud = new Cloud(Cloud.Type.WATER,
                new double[] {0.0, 0.0, effectiveRadius, 0.0},
                new double[] {0.0, 0.0, 0.2, 0.0});
        return new AtmosphericProfile(LEVELS, PRESSURE, TEMPERATURE, ABSORBERS, AMOUNTS, List.of(cloud), List.of());
    }

    /** Infrared sounder with three channels and no solar contribution. */
    static SensorCoefficients infrared() {
        return SensorCoefficients.builder("hirs4_n19", SensorType.INFRARED)
                .channel(SpectralChannel.of(4, 703.0, 0.0, 1.0, 0.0))
                .channel(SpectralChannel.of(8, 900.0, 0.0, 1.0, 0.0))
                .channel(SpectralChannel.of(12, 1420.0, 0.0, 1.0, 0.0))
                .build();
    }

    /** Two-channel microwave radiometer with a two-position antenna pattern. */
    static SensorCoefficients microwave() {
        return SensorCoefficients.builder("amsua_n19", SensorType.MICROWAVE)
                .channel(SpectralChannel.of(1, 0.794, 0.0, 1.0, 0.0))
                .channel(SpectralChannel.of(3, 1.672, 0.0, 1.0, 0.0))
                .antennaPattern(new AntennaPattern(
                        new double[][] {{0.95, 0.96}, {0.94, 0.95}},
                        new double[][] {{0.03, 0.02}, {0.04, 0.03}},
                        new double[][] {{0.02, 0.02}, {0.02, 0.02}}))
                .build();
    }

    /** Single-channel visible imager. */
    static SensorCoefficients visible() {
        return SensorCoefficients.builder("abi_g16", SensorType.VISIBLE)
                .channel(SpectralChannel.of(2, 15797.0, 0.0, 1.0, 1580.0))
                .build();
    }

    static ViewGeometry day() {
        return new ViewGeometry(30.0, 10.0, 40.0, 130.0, ViewGeometry.NO_FIELD_OF_VIEW);
    }

    static ViewGeometry night() {
        return ViewGeometry.nightTime(30.0);
    }
}
