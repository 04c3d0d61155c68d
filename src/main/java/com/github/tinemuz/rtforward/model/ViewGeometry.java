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
 * Viewing and illumination geometry of one profile.
 *
 * <p>The observation angles are set by the caller. The derived fields (cosines,
 * secants, relative azimuth) start out as {@code NaN} and are filled in place by
 * the geometry derivation step of the forward model; this is the only input the
 * forward model mutates. Angles are in degrees.</p>
 */
public final class ViewGeometry {
    /** Field-of-view index meaning "no specific scan position". */
    public static final int NO_FIELD_OF_VIEW = 0;

    private final double sensorZenithAngle;
    private final double sensorAzimuthAngle;
    private final double sourceZenithAngle;
    private final double sourceAzimuthAngle;
    private final int fieldOfView;

    private double cosSensorZenith = Double.NaN;
    private double secantSensorZenith = Double.NaN;
    private double cosSourceZenith = Double.NaN;
    private double secantSourceZenith = Double.NaN;
    private double relativeAzimuthAngle = Double.NaN;
    private boolean derived;

    public ViewGeometry(
            double sensorZenithAngle,
            double sensorAzimuthAngle,
            double sourceZenithAngle,
            double sourceAzimuthAngle,
            int fieldOfView) {
        this.sensorZenithAngle = sensorZenithAngle;
        this.sensorAzimuthAngle = sensorAzimuthAngle;
        this.sourceZenithAngle = sourceZenithAngle;
        this.sourceAzimuthAngle = sourceAzimuthAngle;
        this.fieldOfView = fieldOfView;
    }

    /** Geometry for a given sensor zenith angle, sun below the horizon, no scan position. */
    public static ViewGeometry nightTime(double sensorZenithAngle) {
        return new ViewGeometry(sensorZenithAngle, 0.0, 180.0, 0.0, NO_FIELD_OF_VIEW);
    }

    public double sensorZenithAngle() {
        return sensorZenithAngle;
    }

    public double sensorAzimuthAngle() {
        return sensorAzimuthAngle;
    }

    public double sourceZenithAngle() {
        return sourceZenithAngle;
    }

    public double sourceAzimuthAngle() {
        return sourceAzimuthAngle;
    }

    /** Scan position, 1-based; {@link #NO_FIELD_OF_VIEW} when unknown. */
    public int fieldOfView() {
        return fieldOfView;
    }

    public double cosSensorZenith() {
        return cosSensorZenith;
    }

    public double secantSensorZenith() {
        return secantSensorZenith;
    }

    public double cosSourceZenith() {
        return cosSourceZenith;
    }

    public double secantSourceZenith() {
        return secantSourceZenith;
    }

    public double relativeAzimuthAngle() {
        return relativeAzimuthAngle;
    }

    public boolean isDerived() {
        return derived;
    }

    /**
     * Store derived quantities. Secants are computed here from the cosines; a
     * source below the horizon (cosine &lt;= 0) gets an infinite secant.
     */
    public void applyDerived(double cosSensorZenith, double cosSourceZenith, double relativeAzimuthAngle) {
        this.cosSensorZenith = cosSensorZenith;
        this.secantSensorZenith = 1.0 / cosSensorZenith;
        this.cosSourceZenith = cosSourceZenith;
        this.secantSourceZenith = cosSourceZenith > 0.0 ? 1.0 / cosSourceZenith : Double.POSITIVE_INFINITY;
        this.relativeAzimuthAngle = relativeAzimuthAngle;
        this.derived = true;
    }
}
