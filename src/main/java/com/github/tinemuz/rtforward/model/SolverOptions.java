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
 * Optional per-profile overrides of the forward calculation.
 *
 * <p>Emissivity and direct reflectivity overrides are indexed by the running
 * channel index of the profile (all sensors' requested channels concatenated),
 * so when a switch is set its array must cover every requested channel.
 * {@link #NONE} reproduces the behaviour of calling without options.</p>
 */
public final class SolverOptions {
    /** Model-derived surface optics, no antenna correction, no sensor input. */
    public static final SolverOptions NONE = builder().build();

    private final boolean emissivitySwitch;
    private final double[] emissivityValues;
    private final boolean directReflectivitySwitch;
    private final double[] directReflectivityValues;
    private final boolean antennaCorrectionSwitch;
    private final SensorInput sensorInput;

    private SolverOptions(Builder b) {
        this.emissivitySwitch = b.emissivitySwitch;
        this.emissivityValues = b.emissivityValues.clone();
        this.directReflectivitySwitch = b.directReflectivitySwitch;
        this.directReflectivityValues = b.directReflectivityValues.clone();
        this.antennaCorrectionSwitch = b.antennaCorrectionSwitch;
        this.sensorInput = b.sensorInput;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean emissivitySwitch() {
        return emissivitySwitch;
    }

    /** Number of emissivity override values supplied. */
    public int nEmissivityValues() {
        return emissivityValues.length;
    }

    public double emissivity(int runningChannel) {
        return emissivityValues[runningChannel];
    }

    public boolean directReflectivitySwitch() {
        return directReflectivitySwitch;
    }

    public int nDirectReflectivityValues() {
        return directReflectivityValues.length;
    }

    public double directReflectivity(int runningChannel) {
        return directReflectivityValues[runningChannel];
    }

    public boolean antennaCorrectionSwitch() {
        return antennaCorrectionSwitch;
    }

    public SensorInput sensorInput() {
        return sensorInput;
    }

    public static final class Builder {
        private boolean emissivitySwitch;
        private double[] emissivityValues = new double[0];
        private boolean directReflectivitySwitch;
        private double[] directReflectivityValues = new double[0];
        private boolean antennaCorrectionSwitch;
        private SensorInput sensorInput = SensorInput.NONE;

        private Builder() {}

        /** Supply emissivities and switch the override on. */
        public Builder emissivity(double... values) {
            this.emissivityValues = values.clone();
            this.emissivitySwitch = true;
            return this;
        }

        /** Set the emissivity switch without changing the supplied values. */
        public Builder emissivitySwitch(boolean on) {
            this.emissivitySwitch = on;
            return this;
        }

        /** Supply direct reflectivities and switch that override on. */
        public Builder directReflectivity(double... values) {
            this.directReflectivityValues = values.clone();
            this.directReflectivitySwitch = true;
            return this;
        }

        public Builder directReflectivitySwitch(boolean on) {
            this.directReflectivitySwitch = on;
            return this;
        }

        public Builder antennaCorrection(boolean on) {
            this.antennaCorrectionSwitch = on;
            return this;
        }

        public Builder sensorInput(SensorInput input) {
            this.sensorInput = input == null ? SensorInput.NONE : input;
            return this;
        }

        public SolverOptions build() {
            return new SolverOptions(this);
        }
    }
}
