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

import com.github.tinemuz.rtforward.backend.BackendException;
import com.github.tinemuz.rtforward.model.Aerosol;
import com.github.tinemuz.rtforward.model.AtmosphericProfile;
import com.github.tinemuz.rtforward.model.Cloud;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pads a profile with layers from a reference atmosphere so that it reaches
 * the top-of-atmosphere pressure the absorption and scattering physics expect.
 *
 * <p>Added levels are the reference levels lying strictly above the profile's
 * top, plus the top-of-atmosphere level itself. A reference level closer to the
 * profile top than {@link #MIN_GAP_FRACTION} of its pressure is skipped so no
 * sliver layer is created. Added layer temperatures are the mean of the
 * bounding reference level temperatures. Absorbers the reference knows follow
 * the reference shape, scaled so they match the profile's top layer at its
 * pressure; other absorbers carry the top layer amount upward. Clouds and
 * aerosols are empty in the added layers.</p>
 */
public final class AtmosphereExtender {
    private static final Logger log = LoggerFactory.getLogger(AtmosphereExtender.class);
    /** Minimum relative pressure gap between the profile top and the first added level. */
    public static final double MIN_GAP_FRACTION = 0.1;
    // relative tolerance for "already at the top of the atmosphere"
    private static final double TOA_TOLERANCE = 1.0e-6;

    private final ReferenceAtmosphere reference;
    private final double toaPressure;

    public AtmosphereExtender(ReferenceAtmosphere reference, double toaPressure) {
        if (reference == null) throw new IllegalArgumentException("Reference atmosphere is required");
        if (!(toaPressure > 0.0)) throw new IllegalArgumentException("TOA pressure must be positive");
        this.reference = reference;
        this.toaPressure = toaPressure;
    }

    public double toaPressure() {
        return toaPressure;
    }

    /**
     * Extend a profile to the top of the atmosphere. A profile that already
     * reaches it is returned unchanged with an empty extension state.
     *
     * @throws BackendException if the profile is malformed
     */
    public ExtendedAtmosphere extend(AtmosphericProfile profile) throws BackendException {
        String defect = profile.findDefect();
        if (defect != null) throw new BackendException("Malformed profile: " + defect);

        double top = profile.topPressure();
        if (top <= toaPressure * (1.0 + TOA_TOLERANCE)) {
            return new ExtendedAtmosphere(profile, new ExtensionState(0, top));
        }

        List<Double> added = new ArrayList<>();
        added.add(toaPressure);
        double limit = top * (1.0 - MIN_GAP_FRACTION);
        for (int i = 0; i < reference.nLevels(); i++) {
            double p = reference.pressure(i);
            if (p > toaPressure * (1.0 + TOA_TOLERANCE) && p < limit) added.add(p);
        }
        int nAdded = added.size();
        int nOld = profile.nLayers();
        int nNew = nOld + nAdded;
        int nAbs = profile.nAbsorbers();

        double[] level = new double[nNew + 1];
        double[] pressure = new double[nNew];
        double[] temperature = new double[nNew];
        double[][] absorber = new double[nNew][nAbs];
        for (int i = 0; i < nAdded; i++) level[i] = added.get(i);
        for (int i = 0; i <= nOld; i++) level[nAdded + i] = profile.levelPressure(i);

        double[] scale = absorberScale(profile);
        for (int k = 0; k < nAdded; k++) {
            double pUp = level[k];
            double pDown = level[k + 1];
            pressure[k] = (pDown - pUp) / Math.log(pDown / pUp);
            temperature[k] = 0.5 * (reference.temperatureAt(pUp) + reference.temperatureAt(pDown));
            for (int j = 0; j < nAbs; j++) {
                int id = profile.absorberId(j);
                absorber[k][j] = Double.isNaN(scale[j])
                        ? profile.absorber(0, j)
                        : scale[j] * 0.5 * (reference.absorberAt(id, pUp) + reference.absorberAt(id, pDown));
            }
        }
        for (int k = 0; k < nOld; k++) {
            pressure[nAdded + k] = profile.pressure(k);
            temperature[nAdded + k] = profile.temperature(k);
            for (int j = 0; j < nAbs; j++) absorber[nAdded + k][j] = profile.absorber(k, j);
        }

        int[] ids = new int[nAbs];
        for (int j = 0; j < nAbs; j++) ids[j] = profile.absorberId(j);
        List<Cloud> clouds = new ArrayList<>();
        for (Cloud c : profile.clouds()) clouds.add(c.padAbove(nAdded));
        List<Aerosol> aerosols = new ArrayList<>();
        for (Aerosol a : profile.aerosols()) aerosols.add(a.padAbove(nAdded));

        log.debug("Extended profile from {} hPa to {} hPa with {} layers", top, toaPressure, nAdded);
        return new ExtendedAtmosphere(
                new AtmosphericProfile(level, pressure, temperature, ids, absorber, clouds, aerosols),
                new ExtensionState(nAdded, top));
    }

    /**
     * Factor mapping reference absorber amounts onto the profile's units, or NaN
     * for absorbers the reference does not carry (or carries as zero).
     */
    private double[] absorberScale(AtmosphericProfile profile) {
        double[] scale = new double[profile.nAbsorbers()];
        for (int j = 0; j < scale.length; j++) {
            int id = profile.absorberId(j);
            scale[j] = Double.NaN;
            if (!reference.hasAbsorber(id)) continue;
            double ref = reference.absorberAt(id, profile.pressure(0));
            if (ref > 0.0) scale[j] = profile.absorber(0, j) / ref;
        }
        return scale;
    }
}
