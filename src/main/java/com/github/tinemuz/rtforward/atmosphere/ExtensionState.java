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
import com.github.tinemuz.rtforward.backend.Workspace;
import java.util.Arrays;

/**
 * Bookkeeping of one atmosphere extension: how many layers were synthesized
 * above the caller's profile and where the caller's profile used to end.
 * Needed to map per-layer quantities back onto the caller's layers.
 */
public class ExtensionState implements Workspace {
    private final int nAddedLayers;
    private final double originalTopPressure;
    private boolean released;

    public ExtensionState(int nAddedLayers, double originalTopPressure) {
        if (nAddedLayers < 0) throw new IllegalArgumentException("Added layer count is negative");
        this.nAddedLayers = nAddedLayers;
        this.originalTopPressure = originalTopPressure;
    }

    public int nAddedLayers() {
        return nAddedLayers;
    }

    /** True when the profile already reached the top of the atmosphere. */
    public boolean isEmpty() {
        return nAddedLayers == 0;
    }

    public double originalTopPressure() {
        return originalTopPressure;
    }

    /**
     * Drop the synthesized layers from a per-layer array of the extended
     * atmosphere.
     *
     * @throws IllegalArgumentException if the array is shorter than the added layers
     */
    public double[] strip(double[] extendedLayers) {
        if (extendedLayers.length < nAddedLayers) {
            throw new IllegalArgumentException(
                    "Array of " + extendedLayers.length + " layers cannot hold " + nAddedLayers + " added layers");
        }
        return Arrays.copyOfRange(extendedLayers, nAddedLayers, extendedLayers.length);
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void release() throws BackendException {
        if (released) throw new BackendException("Extension state released twice");
        released = true;
    }
}
