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

import com.github.tinemuz.rtforward.model.Aerosol;
import com.github.tinemuz.rtforward.model.AtmosphericProfile;
import com.github.tinemuz.rtforward.model.Cloud;
import com.github.tinemuz.rtforward.model.RadianceResult;
import com.github.tinemuz.rtforward.model.SensorCoefficients;
import com.github.tinemuz.rtforward.model.SensorType;
import com.github.tinemuz.rtforward.model.SpectralChannel;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MieParameterStreamCounterTest {

    // 1000 cm-1: size parameter is 0.6283 times the radius in microns
    private static final SensorCoefficients SENSOR = SensorCoefficients.builder("iasi_metop-b", SensorType.INFRARED)
            .channel(SpectralChannel.of(1, 1000.0, 0.0, 1.0, 0.0))
            .build();

    private final MieParameterStreamCounter counter = new MieParameterStreamCounter(16);

    @Test
    @DisplayName("Atmosphere without particles needs no streams")
    void noParticles() {
        RadianceResult result = new RadianceResult();
        result.setScatteringFlag(true);

        assertEquals(0, counter.computeStreamCount(profile(List.of(), List.of()), SENSOR, 0, result));
        assertFalse(result.scatteringFlag());
        assertEquals(0, result.nFullStreams());
    }

    @Test
    @DisplayName("Stream count grows with the size parameter")
    void sizeParameterBands() {
        assertEquals(2, streamsForCloudRadius(0.001));
        assertEquals(4, streamsForCloudRadius(1.0));
        assertEquals(8, streamsForCloudRadius(5.0));
        assertEquals(16, streamsForCloudRadius(10.0));
    }

    @Test
    @DisplayName("Full stream count is the Legendre count plus two")
    void fullStreams() {
        RadianceResult result = new RadianceResult();
        int n = counter.computeStreamCount(profile(List.of(cloud(1.0, 0.1)), List.of()), SENSOR, 0, result);

        assertTrue(result.scatteringFlag());
        assertEquals(n + 2, result.nFullStreams());
    }

    @Test
    @DisplayName("Layers without loading do not count")
    void emptyLayersIgnored() {
        RadianceResult result = new RadianceResult();
        assertEquals(0, counter.computeStreamCount(profile(List.of(cloud(10.0, 0.0)), List.of()), SENSOR, 0, result));
    }

    @Test
    @DisplayName("Aerosols are sized like clouds and the largest particle wins")
    void aerosolsCount() {
        Aerosol dust = new Aerosol(Aerosol.Type.DUST, new double[] {5.0, 0.0}, new double[] {1.0e-6, 0.0});
        RadianceResult result = new RadianceResult();

        assertEquals(8, counter.computeStreamCount(profile(List.of(), List.of(dust)), SENSOR, 0, result));
        assertEquals(16, counter.computeStreamCount(
                profile(List.of(cloud(10.0, 0.1)), List.of(dust)), SENSOR, 0, result));
    }

    @Test
    @DisplayName("Stream count is capped to an even number within the Legendre limit")
    void capped() {
        MieParameterStreamCounter small = new MieParameterStreamCounter(7);
        RadianceResult result = new RadianceResult();

        assertEquals(6, small.computeStreamCount(profile(List.of(cloud(10.0, 0.1)), List.of()), SENSOR, 0, result));
        assertEquals(8, result.nFullStreams());
        assertThrows(IllegalArgumentException.class, () -> new MieParameterStreamCounter(1));
    }

    private int streamsForCloudRadius(double radius) {
        return counter.computeStreamCount(profile(List.of(cloud(radius, 0.1)), List.of()), SENSOR, 0, new RadianceResult());
    }

    private static Cloud cloud(double radius, double waterContent) {
        return new Cloud(Cloud.Type.WATER, new double[] {radius, radius}, new double[] {0.0, waterContent});
    }

    private static AtmosphericProfile profile(List<Cloud> clouds, List<Aerosol> aerosols) {
        return new AtmosphericProfile(
                new double[] {300.0, 600.0, 1000.0},
                new double[] {450.0, 800.0},
                new double[] {240.0, 280.0},
                new int[] {AtmosphericProfile.H2O},
                new double[][] {{0.5}, {5.0}},
                clouds,
                aerosols);
    }
}
