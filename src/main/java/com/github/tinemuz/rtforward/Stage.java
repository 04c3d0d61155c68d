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

/** Pipeline stages that can fail for a specific profile, sensor or channel. */
public enum Stage {
    GEOMETRY("derived geometry"),
    EXTENSION("atmosphere extension"),
    ALLOCATION("workspace allocation"),
    PREDICTORS("Predictors"),
    STREAMS("nStreams"),
    ABSORPTION("AtmAbsorption"),
    MOLECULAR_SCATTERING("MoleculeScatter"),
    CLOUD_SCATTERING("CloudScatter"),
    AEROSOL_SCATTERING("AerosolScatter"),
    COMBINATION("AtmOptics"),
    SOLVE("RTSolution"),
    ANTENNA_CORRECTION("antenna correction");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    /** Name of the stage as it appears in failure messages. */
    public String label() {
        return label;
    }
}
