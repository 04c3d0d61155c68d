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

import com.github.tinemuz.rtforward.optics.CombinedOpticalState;
import com.github.tinemuz.rtforward.optics.SurfaceOpticalState;

/** Allocates plain heap buffers. */
public final class HeapWorkspaceProvider implements WorkspaceProvider {

    @Override
    public CombinedOpticalState allocateOpticalState(int nLayers, int maxLegendreTerms, int maxPhaseElements)
            throws BackendException {
        try {
            return new CombinedOpticalState(nLayers, maxLegendreTerms, maxPhaseElements);
        } catch (IllegalArgumentException e) {
            throw new BackendException("Cannot allocate optical state: " + e.getMessage(), e);
        }
    }

    @Override
    public SurfaceOpticalState allocateSurfaceOptics(int maxAngles, int maxStokes) throws BackendException {
        try {
            return new SurfaceOpticalState(maxAngles, maxStokes);
        } catch (IllegalArgumentException e) {
            throw new BackendException("Cannot allocate surface optics: " + e.getMessage(), e);
        }
    }
}
