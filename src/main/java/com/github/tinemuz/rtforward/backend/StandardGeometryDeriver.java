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

import com.github.tinemuz.rtforward.model.ViewGeometry;

/**
 * Plane-parallel geometry: cosines and secants of the zenith angles and the
 * sensor-to-source relative azimuth folded into [0, 180] degrees.
 */
public final class StandardGeometryDeriver implements GeometryDeriver {
    /** Largest sensor zenith angle accepted by default, degrees. */
    public static final double DEFAULT_MAX_SENSOR_ZENITH_ANGLE = 80.0;

    private final double maxSensorZenithAngle;

    public StandardGeometryDeriver() {
        this(DEFAULT_MAX_SENSOR_ZENITH_ANGLE);
    }

    public StandardGeometryDeriver(double maxSensorZenithAngle) {
        if (!(maxSensorZenithAngle > 0.0 && maxSensorZenithAngle < 90.0)) {
            throw new IllegalArgumentException("Maximum sensor zenith angle must be in (0, 90)");
        }
        this.maxSensorZenithAngle = maxSensorZenithAngle;
    }

    @Override
    public void derive(ViewGeometry geometry) throws BackendException {
        double sza = geometry.sensorZenithAngle();
        if (!(Math.abs(sza) <= maxSensorZenithAngle)) {
            throw new BackendException(
                    "Sensor zenith angle " + sza + " exceeds the maximum " + maxSensorZenithAngle);
        }
        double src = geometry.sourceZenithAngle();
        if (!(src >= 0.0 && src <= 180.0)) {
            throw new BackendException("Source zenith angle " + src + " outside [0, 180]");
        }
        checkAzimuth("Sensor", geometry.sensorAzimuthAngle());
        checkAzimuth("Source", geometry.sourceAzimuthAngle());
        if (geometry.fieldOfView() < 0) {
            throw new BackendException("Field of view index " + geometry.fieldOfView() + " is negative");
        }

        double relAz = Math.abs(geometry.sensorAzimuthAngle() - geometry.sourceAzimuthAngle()) % 360.0;
        if (relAz > 180.0) relAz = 360.0 - relAz;
        geometry.applyDerived(
                Math.cos(Math.toRadians(Math.abs(sza))), Math.cos(Math.toRadians(src)), relAz);
    }

    private static void checkAzimuth(String which, double azimuth) throws BackendException {
        if (!(azimuth >= 0.0 && azimuth <= 360.0)) {
            throw new BackendException(which + " azimuth angle " + azimuth + " outside [0, 360]");
        }
    }
}
