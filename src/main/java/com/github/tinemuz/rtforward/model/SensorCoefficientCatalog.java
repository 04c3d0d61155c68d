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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only registry of sensor coefficients, keyed by sensor id. Callers build
 * one per application and select channels from it for each forward call.
 */
public final class SensorCoefficientCatalog {
    private final Map<String, SensorCoefficients> sensors;

    private SensorCoefficientCatalog(Map<String, SensorCoefficients> sensors) {
        this.sensors = Collections.unmodifiableMap(sensors);
    }

    public static SensorCoefficientCatalog of(SensorCoefficients... sensors) {
        Map<String, SensorCoefficients> map = new LinkedHashMap<>();
        for (SensorCoefficients s : sensors) {
            if (map.putIfAbsent(s.sensorId(), s) != null) {
                throw new IllegalArgumentException("Duplicate sensor id " + s.sensorId());
            }
        }
        return new SensorCoefficientCatalog(map);
    }

    public boolean contains(String sensorId) {
        return sensors.containsKey(sensorId);
    }

    public SensorCoefficients sensor(String sensorId) {
        SensorCoefficients s = sensors.get(sensorId);
        if (s == null) throw new IllegalArgumentException("Unknown sensor id " + sensorId);
        return s;
    }

    /** Select channels of a sensor by their published channel numbers. */
    public ChannelCatalog select(String sensorId, int... sensorChannels) {
        SensorCoefficients s = sensor(sensorId);
        int[] idx = new int[sensorChannels.length];
        for (int i = 0; i < sensorChannels.length; i++) {
            idx[i] = s.indexOf(sensorChannels[i]);
            if (idx[i] < 0) {
                throw new IllegalArgumentException(
                        "Sensor " + sensorId + " has no channel " + sensorChannels[i]);
            }
        }
        return ChannelCatalog.of(s, idx);
    }

    public ChannelCatalog selectAll(String sensorId) {
        return ChannelCatalog.all(sensor(sensorId));
    }
}
