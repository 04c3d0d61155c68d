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

package com.github.tinemuz.rtforward.optics;

import com.github.tinemuz.rtforward.backend.BackendException;
import com.github.tinemuz.rtforward.backend.Workspace;
import java.util.Arrays;

/**
 * Surface emissivity and reflectivity of one channel.
 *
 * <p>Allocated once per profile. The effective surface temperature is set once
 * per profile and survives {@link #resetForChannel()}; everything else is
 * cleared for each channel. Emissivities are {@code [angle][stokes]} and
 * reflectivities {@code [angle][stokes][angle][stokes]}.</p>
 */
public class SurfaceOpticalState implements Workspace {
    private final int maxAngles;
    private final int maxStokes;
    private final double[][] emissivity;
    private final double[][][][] reflectivity;
    private final double[][] directReflectivity;
    private boolean computeFromModel = true;
    private double surfaceTemperature;
    private int fourierOrder;
    private boolean released;

    public SurfaceOpticalState(int maxAngles, int maxStokes) {
        if (maxAngles <= 0 || maxStokes <= 0) {
            throw new IllegalArgumentException(
                    "Invalid surface optics dimensions: angles=" + maxAngles + ", stokes=" + maxStokes);
        }
        this.maxAngles = maxAngles;
        this.maxStokes = maxStokes;
        this.emissivity = new double[maxAngles][maxStokes];
        this.reflectivity = new double[maxAngles][maxStokes][maxAngles][maxStokes];
        this.directReflectivity = new double[maxAngles][maxStokes];
    }

    /** Back to "compute from the surface model" with cleared optics. */
    public void resetForChannel() {
        computeFromModel = true;
        fourierOrder = 0;
        for (double[] row : emissivity) Arrays.fill(row, 0.0);
        for (double[] row : directReflectivity) Arrays.fill(row, 0.0);
        for (double[][][] a : reflectivity) {
            for (double[][] b : a) {
                for (double[] c : b) Arrays.fill(c, 0.0);
            }
        }
    }

    public int maxAngles() {
        return maxAngles;
    }

    public int maxStokes() {
        return maxStokes;
    }

    /** False when the caller's emissivity replaces the surface model. */
    public boolean computeFromModel() {
        return computeFromModel;
    }

    public void setComputeFromModel(boolean computeFromModel) {
        this.computeFromModel = computeFromModel;
    }

    public double surfaceTemperature() {
        return surfaceTemperature;
    }

    public void setSurfaceTemperature(double surfaceTemperature) {
        this.surfaceTemperature = surfaceTemperature;
    }

    public int fourierOrder() {
        return fourierOrder;
    }

    public void setFourierOrder(int fourierOrder) {
        this.fourierOrder = fourierOrder;
    }

    public double[][] emissivity() {
        return emissivity;
    }

    public double[][][][] reflectivity() {
        return reflectivity;
    }

    public double[][] directReflectivity() {
        return directReflectivity;
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void release() throws BackendException {
        if (released) throw new BackendException("Surface optical state released twice");
        released = true;
    }
}
