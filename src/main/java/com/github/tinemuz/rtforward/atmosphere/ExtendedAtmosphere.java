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
import com.github.tinemuz.rtforward.model.AtmosphericProfile;

/**
 * The working atmosphere of one profile iteration: the caller's profile with
 * any synthesized upper layers, plus the state needed to undo the extension.
 */
public class ExtendedAtmosphere implements Workspace {
    private final AtmosphericProfile atmosphere;
    private final ExtensionState extension;
    private boolean released;

    public ExtendedAtmosphere(AtmosphericProfile atmosphere, ExtensionState extension) {
        this.atmosphere = atmosphere;
        this.extension = extension;
    }

    public AtmosphericProfile atmosphere() {
        return atmosphere;
    }

    public ExtensionState extension() {
        return extension;
    }

    public int nLayers() {
        return atmosphere.nLayers();
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void release() throws BackendException {
        if (released) throw new BackendException("Extended atmosphere released twice");
        released = true;
    }
}
