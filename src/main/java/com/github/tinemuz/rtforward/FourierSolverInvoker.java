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

import com.github.tinemuz.rtforward.backend.BackendException;
import com.github.tinemuz.rtforward.backend.RtSolveContext;
import com.github.tinemuz.rtforward.backend.RtSolver;
import com.github.tinemuz.rtforward.model.RadianceResult;

/**
 * Sums the solver's Fourier azimuth components into the channel radiance,
 * orders 0 through {@code nAzimuthOrders} in ascending order, then derives the
 * brightness temperature for non-visible sensors.
 */
final class FourierSolverInvoker {
    private final RtSolver solver;

    FourierSolverInvoker(RtSolver solver) {
        this.solver = solver;
    }

    void solve(ChannelContext ch, RtSolveContext context, int nAzimuthOrders, RadianceResult result)
            throws StageException {
        result.setRadiance(0.0);
        for (int mth = 0; mth <= nAzimuthOrders; mth++) {
            context.surfaceOptics().setFourierOrder(mth);
            double component;
            try {
                component = solver.solve(context, mth, result);
            } catch (BackendException | RuntimeException e) {
                throw ch.fail(Stage.SOLVE, e);
            }
            if (!Double.isFinite(component)) {
                throw ch.fail(Stage.SOLVE, "non-finite radiance at Fourier order " + mth);
            }
            result.setRadiance(result.radiance() + component);
        }
        result.setBrightnessTemperature(ch.sensor().type().isVisible()
                ? 0.0
                : ch.channel().brightnessTemperature(result.radiance()));
    }
}
