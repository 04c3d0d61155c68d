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
 * Caller-allocated {@code [channel][profile]} result table.
 *
 * <p>The channel dimension follows the concatenation of every requested
 * sensor's channels in catalog order and must be at least the total number of
 * requested channels; extra rows are left alone.</p>
 */
public final class RadianceResults {
    private final RadianceResult[][] cells;
    private final int nProfiles;

    public RadianceResults(int nChannels, int nProfiles) {
        if (nChannels < 0 || nProfiles < 0) {
            throw new IllegalArgumentException("Result dimensions must not be negative");
        }
        this.nProfiles = nProfiles;
        this.cells = new RadianceResult[nChannels][nProfiles];
        for (int l = 0; l < nChannels; l++) {
            for (int m = 0; m < nProfiles; m++) {
                cells[l][m] = new RadianceResult();
            }
        }
    }

    public int nChannels() {
        return cells.length;
    }

    public int nProfiles() {
        return nProfiles;
    }

    public RadianceResult get(int channel, int profile) {
        return cells[channel][profile];
    }
}
