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

package com.github.tinemuz.rtforward;

import com.github.tinemuz.rtforward.model.SolverOptions;
import com.github.tinemuz.rtforward.model.SurfaceState;
import com.github.tinemuz.rtforward.optics.SurfaceOpticalState;

/**
 * Prepares the surface optics record: the coverage-weighted surface
 * temperature once per profile, and user-supplied emissivity overrides per
 * channel.
 */
final class SurfaceOpticsBuilder {

    /** Coverage-weighted skin temperature; coverages are not renormalized. */
    static double effectiveTemperature(SurfaceState s) {
        return s.landCoverage() * s.landTemperature()
                + s.waterCoverage() * s.waterTemperature()
                + s.snowCoverage() * s.snowTemperature()
                + s.iceCoverage() * s.iceTemperature();
    }

    void computeSurfaceTemperature(SurfaceState surface, SurfaceOpticalState sfc) {
        sfc.setSurfaceTemperature(effectiveTemperature(surface));
    }

    /**
     * Reset the per-channel surface optics and apply the emissivity override for
     * running channel {@code ln}, if {@code options} requests one. Without an
     * override the surface model computes emissivity in the solver.
     */
    void applyOverrides(SurfaceOpticalState sfc, SolverOptions options, int ln) {
        sfc.resetForChannel();
        if (options == null || !options.emissivitySwitch()) return;

        double e = options.emissivity(ln);
        sfc.setComputeFromModel(false);
        sfc.emissivity()[0][0] = e;
        sfc.reflectivity()[0][0][0][0] = 1.0 - e;
        sfc.directReflectivity()[0][0] = options.directReflectivitySwitch()
                ? options.directReflectivity(ln)
                : 1.0 - e;
    }
}
