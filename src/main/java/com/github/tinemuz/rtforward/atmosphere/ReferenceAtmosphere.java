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

package com.github.tinemuz.rtforward.atmosphere;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Climatological model atmosphere used to synthesize layers above a profile's
 * top level.
 *
 * <p>The standard table is loaded from the classpath resource
 * <code>reference_atmosphere.txt</code> on first use. Levels are held top
 * first (increasing pressure). Values between levels are interpolated linearly
 * in log-pressure and clamped at both ends.</p>
 */
public final class ReferenceAtmosphere {
    private static final Logger log = LoggerFactory.getLogger(ReferenceAtmosphere.class);
    private static final String RESOURCE = "reference_atmosphere.txt";
    private static final String HEADER = "p/T";

    private static volatile ReferenceAtmosphere standard;

    private final double[] pressure;
    private final double[] temperature;
    private final int[] absorberIds;
    private final double[][] absorber; // [absorber][level]

    private ReferenceAtmosphere(double[] pressure, double[] temperature, int[] absorberIds, double[][] absorber) {
        this.pressure = pressure;
        this.temperature = temperature;
        this.absorberIds = absorberIds;
        this.absorber = absorber;
    }

    /**
     * The standard reference atmosphere. Safe to call repeatedly; the first
     * caller loads it from the classpath.
     *
     * @throws IllegalStateException if the resource is missing or cannot be parsed
     */
    public static ReferenceAtmosphere standard() {
        ReferenceAtmosphere s = standard;
        if (s == null) {
            synchronized (ReferenceAtmosphere.class) {
                s = standard;
                if (s == null) {
                    s = load(RESOURCE);
                    standard = s;
                }
            }
        }
        return s;
    }

    static ReferenceAtmosphere load(String resource) {
        InputStream in = ReferenceAtmosphere.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.error("Reference atmosphere '{}' not found on classpath", resource);
            throw new IllegalStateException("Reference atmosphere '" + resource + "' not found on classpath");
        }
        try {
            return read(in);
        } catch (IOException e) {
            log.error("Failed to read reference atmosphere '{}'", resource, e);
            throw new IllegalStateException("Failed to read reference atmosphere '" + resource + "'", e);
        } catch (IllegalArgumentException e) {
            log.error("Malformed reference atmosphere '{}'", resource, e);
            throw new IllegalStateException("Malformed reference atmosphere '" + resource + "'", e);
        }
    }

    /**
     * Parse a reference atmosphere table.
     *
     * <p>Blank lines and lines starting with {@code #} are skipped. A header line
     * starting with {@code p/T} lists the HITRAN ids of the absorber columns that
     * follow pressure (hPa) and temperature (K) on each data row. Rows may come in
     * any pressure order.</p>
     *
     * @throws IOException              if the stream cannot be read
     * @throws IllegalArgumentException if the table is malformed
     */
    public static ReferenceAtmosphere read(InputStream in) throws IOException {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<Integer> ids = null;
            List<double[]> rows = new ArrayList<>();
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (toks[0].equals(HEADER)) {
                    ids = new ArrayList<>();
                    for (int i = 1; i < toks.length; i++) ids.add(Integer.parseInt(toks[i]));
                    continue;
                }
                if (ids == null) throw new IllegalArgumentException("Data row before '" + HEADER + "' header");
                if (toks.length != 2 + ids.size()) {
                    throw new IllegalArgumentException(
                            "Expected " + (2 + ids.size()) + " columns but found " + toks.length + ": " + line);
                }
                double[] row = new double[toks.length];
                for (int i = 0; i < toks.length; i++) row[i] = Double.parseDouble(toks[i]);
                if (!(row[0] > 0.0)) throw new IllegalArgumentException("Non-positive pressure: " + line);
                rows.add(row);
            }
            if (ids == null || rows.size() < 2) {
                throw new IllegalArgumentException("Reference atmosphere needs a header and at least two levels");
            }
            rows.sort(Comparator.comparingDouble(r -> r[0]));

            int n = rows.size();
            double[] p = new double[n];
            double[] t = new double[n];
            double[][] abs = new double[ids.size()][n];
            for (int k = 0; k < n; k++) {
                double[] row = rows.get(k);
                if (k > 0 && row[0] == p[k - 1]) {
                    throw new IllegalArgumentException("Duplicate reference level at " + row[0] + " hPa");
                }
                p[k] = row[0];
                t[k] = row[1];
                for (int j = 0; j < ids.size(); j++) abs[j][k] = row[2 + j];
            }
            int[] idArray = ids.stream().mapToInt(Integer::intValue).toArray();
            log.debug("Loaded reference atmosphere: {} levels from {} to {} hPa", n, p[0], p[n - 1]);
            return new ReferenceAtmosphere(p, t, idArray, abs);
        }
    }

    public int nLevels() {
        return pressure.length;
    }

    public double pressure(int level) {
        return pressure[level];
    }

    /** Lowest pressure (top) of the table. */
    public double topPressure() {
        return pressure[0];
    }

    public boolean hasAbsorber(int id) {
        return indexOf(id) >= 0;
    }

    /** Temperature at an arbitrary pressure. */
    public double temperatureAt(double p) {
        return interpolate(temperature, p);
    }

    /**
     * Absorber amount at an arbitrary pressure.
     *
     * @throws IllegalArgumentException if the table has no such absorber
     */
    public double absorberAt(int id, double p) {
        int j = indexOf(id);
        if (j < 0) throw new IllegalArgumentException("Reference atmosphere has no absorber " + id);
        return interpolate(absorber[j], p);
    }

    private int indexOf(int id) {
        for (int j = 0; j < absorberIds.length; j++) {
            if (absorberIds[j] == id) return j;
        }
        return -1;
    }

    private double interpolate(double[] values, double p) {
        int n = pressure.length;
        if (p <= pressure[0]) return values[0];
        if (p >= pressure[n - 1]) return values[n - 1];
        int hi = upperBound(pressure, p);
        int lo = hi - 1;
        double t = Math.log(p / pressure[lo]) / Math.log(pressure[hi] / pressure[lo]);
        return values[lo] + t * (values[hi] - values[lo]);
    }

    /** First index where arr[index] >= x; the last index if x exceeds every entry. */
    private static int upperBound(double[] arr, double x) {
        int lo = 0;
        int hi = arr.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (arr[mid] < x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }
}
