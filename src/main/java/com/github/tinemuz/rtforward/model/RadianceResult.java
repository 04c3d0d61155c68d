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
 * Forward solution for one channel of one profile.
 *
 * <p>Instances are owned by the caller (see {@link RadianceResults}) and
 * overwritten in place by the forward model, which resets every field it owns
 * before computing a channel, so a slot may be reused across calls.</p>
 */
public final class RadianceResult {
    private String sensorId;
    private int sensorChannel;
    private double radiance;
    private double brightnessTemperature;
    private boolean scatteringFlag;
    private int nFullStreams;
    private boolean solarFlag;
    private boolean visibleFlag;
    private boolean antennaCorrected;

    /** Clear every field and label the slot with the channel being computed. */
    public void reset(String sensorId, int sensorChannel) {
        this.sensorId = sensorId;
        this.sensorChannel = sensorChannel;
        this.radiance = 0.0;
        this.brightnessTemperature = 0.0;
        this.scatteringFlag = false;
        this.nFullStreams = 0;
        this.solarFlag = false;
        this.visibleFlag = false;
        this.antennaCorrected = false;
    }

    public String sensorId() {
        return sensorId;
    }

    public int sensorChannel() {
        return sensorChannel;
    }

    /** Radiance in mW/(m^2.sr.cm^-1). */
    public double radiance() {
        return radiance;
    }

    public void setRadiance(double radiance) {
        this.radiance = radiance;
    }

    /** Brightness temperature in kelvin. */
    public double brightnessTemperature() {
        return brightnessTemperature;
    }

    public void setBrightnessTemperature(double brightnessTemperature) {
        this.brightnessTemperature = brightnessTemperature;
    }

    public boolean scatteringFlag() {
        return scatteringFlag;
    }

    public void setScatteringFlag(boolean scatteringFlag) {
        this.scatteringFlag = scatteringFlag;
    }

    /** Number of streams used by the solver, including the two boundary streams. */
    public int nFullStreams() {
        return nFullStreams;
    }

    public void setNFullStreams(int nFullStreams) {
        this.nFullStreams = nFullStreams;
    }

    public boolean solarFlag() {
        return solarFlag;
    }

    public void setSolarFlag(boolean solarFlag) {
        this.solarFlag = solarFlag;
    }

    public boolean visibleFlag() {
        return visibleFlag;
    }

    public void setVisibleFlag(boolean visibleFlag) {
        this.visibleFlag = visibleFlag;
    }

    public boolean antennaCorrected() {
        return antennaCorrected;
    }

    public void setAntennaCorrected(boolean antennaCorrected) {
        this.antennaCorrected = antennaCorrected;
    }

    @Override
    public String toString() {
        return sensorId + " ch" + sensorChannel + ": R=" + radiance + " Tb=" + brightnessTemperature;
    }
}
