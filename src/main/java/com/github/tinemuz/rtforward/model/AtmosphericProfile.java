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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One atmospheric state: a column of layers ordered from the top of the
 * atmosphere downward.
 *
 * <p>Level pressures bound the layers, so there is always one more level than
 * there are layers. Absorber amounts are indexed {@code [layer][absorber]} with
 * the absorber identities given by {@link #absorberId(int)} (HITRAN molecule
 * numbers, see {@link #H2O} and {@link #O3}). Instances are immutable; the
 * constructor only checks that the arrays are present, shape checks happen when
 * the profile enters the forward model.</p>
 */
public final class AtmosphericProfile {
    /** HITRAN molecule number for water vapour. */
    public static final int H2O = 1;
    /** HITRAN molecule number for carbon dioxide. */
    public static final int CO2 = 2;
    /** HITRAN molecule number for ozone. */
    public static final int O3 = 3;

    private final double[] levelPressure;
    private final double[] pressure;
    private final double[] temperature;
    private final int[] absorberIds;
    private final double[][] absorber;
    private final List<Cloud> clouds;
    private final List<Aerosol> aerosols;

    /**
     * @param levelPressure level pressures in hPa, top first (n+1 values)
     * @param pressure      layer pressures in hPa (n values)
     * @param temperature   layer temperatures in K (n values)
     * @param absorberIds   absorber identities, one per absorber column
     * @param absorber      absorber amounts {@code [layer][absorber]}
     * @param clouds        clouds present in the column, possibly empty
     * @param aerosols      aerosols present in the column, possibly empty
     */
    public AtmosphericProfile(
            double[] levelPressure,
            double[] pressure,
            double[] temperature,
            int[] absorberIds,
            double[][] absorber,
            List<Cloud> clouds,
            List<Aerosol> aerosols) {
        if (levelPressure == null || pressure == null || temperature == null
                || absorberIds == null || absorber == null) {
            throw new IllegalArgumentException("Profile pressure, temperature and absorber data are required");
        }
        this.levelPressure = levelPressure.clone();
        this.pressure = pressure.clone();
        this.temperature = temperature.clone();
        this.absorberIds = absorberIds.clone();
        this.absorber = new double[absorber.length][];
        for (int k = 0; k < absorber.length; k++) {
            this.absorber[k] = absorber[k] == null ? null : absorber[k].clone();
        }
        this.clouds = clouds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(clouds));
        this.aerosols = aerosols == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(aerosols));
    }

    /** Clear-sky profile without clouds or aerosols. */
    public static AtmosphericProfile clearSky(
            double[] levelPressure, double[] pressure, double[] temperature,
            int[] absorberIds, double[][] absorber) {
        return new AtmosphericProfile(levelPressure, pressure, temperature, absorberIds, absorber,
                List.of(), List.of());
    }

    public int nLayers() {
        return pressure.length;
    }

    public int nLevels() {
        return levelPressure.length;
    }

    public int nAbsorbers() {
        return absorberIds.length;
    }

    public int nClouds() {
        return clouds.size();
    }

    public int nAerosols() {
        return aerosols.size();
    }

    /** Pressure of the uppermost level in hPa. */
    public double topPressure() {
        return levelPressure[0];
    }

    public double levelPressure(int level) {
        return levelPressure[level];
    }

    public double pressure(int layer) {
        return pressure[layer];
    }

    public double temperature(int layer) {
        return temperature[layer];
    }

    public int absorberId(int j) {
        return absorberIds[j];
    }

    /** Column index of the absorber with the given id, or -1 if not present. */
    public int absorberIndex(int id) {
        for (int j = 0; j < absorberIds.length; j++) {
            if (absorberIds[j] == id) return j;
        }
        return -1;
    }

    public double absorber(int layer, int j) {
        return absorber[layer][j];
    }

    public List<Cloud> clouds() {
        return clouds;
    }

    public List<Aerosol> aerosols() {
        return aerosols;
    }

    /**
     * Describe the first structural problem of this profile, or {@code null} if
     * it is well formed: layer/level counts agree, pressures are finite, positive
     * and increase downward, temperatures are finite and positive, every absorber
     * row has one value per absorber and every cloud and aerosol covers all
     * layers.
     */
    public String findDefect() {
        int n = pressure.length;
        if (n == 0) return "profile has no layers";
        if (levelPressure.length != n + 1) {
            return "level count (" + levelPressure.length + ") is not layer count + 1 (" + (n + 1) + ")";
        }
        if (temperature.length != n) {
            return "temperature count (" + temperature.length + ") differs from layer count (" + n + ")";
        }
        if (absorber.length != n) {
            return "absorber row count (" + absorber.length + ") differs from layer count (" + n + ")";
        }
        for (int i = 0; i <= n; i++) {
            double p = levelPressure[i];
            if (!Double.isFinite(p) || p <= 0.0) return "level pressure #" + i + " is not positive";
            if (i > 0 && p <= levelPressure[i - 1]) {
                return "level pressures do not increase downward at level #" + i;
            }
        }
        for (int k = 0; k < n; k++) {
            if (!Double.isFinite(pressure[k]) || pressure[k] <= 0.0) {
                return "layer pressure #" + k + " is not positive";
            }
            if (!Double.isFinite(temperature[k]) || temperature[k] <= 0.0) {
                return "layer temperature #" + k + " is not positive";
            }
            if (absorber[k] == null || absorber[k].length != absorberIds.length) {
                return "absorber row #" + k + " does not hold " + absorberIds.length + " values";
            }
        }
        for (int c = 0; c < clouds.size(); c++) {
            if (clouds.get(c).nLayers() != n) return "cloud #" + c + " does not cover " + n + " layers";
        }
        for (int a = 0; a < aerosols.size(); a++) {
            if (aerosols.get(a).nLayers() != n) return "aerosol #" + a + " does not cover " + n + " layers";
        }
        return null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        AtmosphericProfile other = (AtmosphericProfile) obj;
        return Arrays.equals(levelPressure, other.levelPressure)
                && Arrays.equals(pressure, other.pressure)
                && Arrays.equals(temperature, other.temperature)
                && Arrays.equals(absorberIds, other.absorberIds)
                && Arrays.deepEquals(absorber, other.absorber)
                && clouds.equals(other.clouds)
                && aerosols.equals(other.aerosols);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(levelPressure);
        h = 31 * h + Arrays.hashCode(pressure);
        h = 31 * h + Arrays.hashCode(temperature);
        h = 31 * h + Arrays.deepHashCode(absorber);
        return 31 * h + clouds.hashCode() + aerosols.hashCode();
    }
}
