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
 * The channels requested from one sensor, in the order their results are
 * written. Immutable and shared read-only by every profile of a call.
 */
public final class ChannelCatalog {
    private final SensorCoefficients sensor;
    private final int[] channelIndex;

    private ChannelCatalog(SensorCoefficients sensor, int[] channelIndex) {
        this.sensor = sensor;
        this.channelIndex = channelIndex;
    }

    /**
     * Select channels by their position in the sensor coefficients.
     *
     * @throws IllegalArgumentException if an index is outside the sensor's channels
     */
    public static ChannelCatalog of(SensorCoefficients sensor, int... channelIndex) {
        if (sensor == null) throw new IllegalArgumentException("Sensor coefficients are required");
        for (int idx : channelIndex) {
            if (idx < 0 || idx >= sensor.nChannels()) {
                throw new IllegalArgumentException(
                        "Channel index " + idx + " outside " + sensor.sensorId()
                                + " channel range [0, " + sensor.nChannels() + ")");
            }
        }
        return new ChannelCatalog(sensor, channelIndex.clone());
    }

    /** Every channel of the sensor. */
    public static ChannelCatalog all(SensorCoefficients sensor) {
        int[] idx = new int[sensor.nChannels()];
        for (int i = 0; i < idx.length; i++) idx[i] = i;
        return new ChannelCatalog(sensor, idx);
    }

    public SensorCoefficients sensor() {
        return sensor;
    }

    public String sensorId() {
        return sensor.sensorId();
    }

    public int nChannels() {
        return channelIndex.length;
    }

    /** Index into the sensor coefficients of the l-th requested channel. */
    public int channelIndex(int l) {
        return channelIndex[l];
    }

    /** Published channel number of the l-th requested channel. */
    public int sensorChannel(int l) {
        return sensor.channel(channelIndex[l]).sensorChannel();
    }

    public SpectralChannel channel(int l) {
        return sensor.channel(channelIndex[l]);
    }

    @Override
    public String toString() {
        return sensor.sensorId() + Arrays.toString(channelIndex);
    }
}
