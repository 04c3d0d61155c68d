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

/** One cloud species distributed over the profile layers. */
public final class Cloud extends ParticleDistribution {

    /** Hydrometeor categories. */
    public enum Type { WATER, ICE, RAIN, SNOW, GRAUPEL, HAIL }

    private final Type type;

    public Cloud(Type type, double[] effectiveRadius, double[] waterContent) {
        super(effectiveRadius, waterContent);
        if (type == null) throw new IllegalArgumentException("Cloud type is required");
        this.type = type;
    }

    public Type type() {
        return type;
    }

    @Override
    public Cloud padAbove(int n) {
        double[][] padded = paddedAbove(n);
        return new Cloud(type, padded[0], padded[1]);
    }

    @Override
    public boolean equals(Object obj) {
        return super.equals(obj) && type == ((Cloud) obj).type;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + type.hashCode();
    }
}
