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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only spectral description of one sensor: its type, the coefficients of
 * each channel and, for microwave sounders, the antenna pattern.
 */
public final class SensorCoefficients {
    private final String sensorId;
    private final SensorType type;
    private final List<SpectralChannel> channels;
    private final AntennaPattern antennaPattern;

    private SensorCoefficients(Builder b) {
        this.sensorId = b.sensorId;
        this.type = b.type;
        this.channels = Collections.unmodifiableList(new ArrayList<>(b.channels));
        this.antennaPattern = b.antennaPattern;
    }

    public static Builder builder(String sensorId, SensorType type) {
        return new Builder(sensorId, type);
    }

    public String sensorId() {
        return sensorId;
    }

    public SensorType type() {
        return type;
    }

    public int nChannels() {
        return channels.size();
    }

    public SpectralChannel channel(int channelIndex) {
        return channels.get(channelIndex);
    }

    public List<SpectralChannel> channels() {
        return channels;
    }

    public boolean hasAntennaPattern() {
        return antennaPattern != null;
    }

    /** Antenna pattern, or {@code null} when the sensor has none. */
    public AntennaPattern antennaPattern() {
        return antennaPattern;
    }

    /** Index of the channel with the given published number, or -1. */
    public int indexOf(int sensorChannel) {
        for (int i = 0; i < channels.size(); i++) {
            if (channels.get(i).sensorChannel() == sensorChannel) return i;
        }
        return -1;
    }

    @Override
    public String toString() {
        return sensorId + " (" + type + ", " + channels.size() + " channels)";
    }

    /** Builder collecting channels in publication order. */
    public static final class Builder {
        private final String sensorId;
        private final SensorType type;
        private final List<SpectralChannel> channels = new ArrayList<>();
        private AntennaPattern antennaPattern;

        private Builder(String sensorId, SensorType type) {
            if (sensorId == null || sensorId.isBlank()) {
                throw new IllegalArgumentException("Sensor id is required");
            }
            if (type == null) throw new IllegalArgumentException("Sensor type is required");
            this.sensorId = sensorId;
            this.type = type;
        }

        public Builder channel(SpectralChannel channel) {
            channels.add(channel);
            return this;
        }

        public Builder antennaPattern(AntennaPattern pattern) {
            this.antennaPattern = pattern;
            return this;
        }

        public SensorCoefficients build() {
            if (channels.isEmpty()) {
                throw new IllegalArgumentException("Sensor " + sensorId + " has no channels");
            }
            return new SensorCoefficients(this);
        }
    }
}
