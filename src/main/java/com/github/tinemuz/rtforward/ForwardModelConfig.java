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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunable limits of the forward model.
 *
 * <p>Defaults come from the classpath resource
 * <code>forward-model.properties</code>, loaded once on first use. Use
 * {@link #builder()} to override individual values; every instance is
 * validated on construction.</p>
 */
public final class ForwardModelConfig {
    private static final Logger log = LoggerFactory.getLogger(ForwardModelConfig.class);
    private static final String RESOURCE = "forward-model.properties";
    /** Legendre terms molecular scattering needs; the configured maximum may not be lower. */
    public static final int RAYLEIGH_LEGENDRE_TERMS = 4;

    private static volatile ForwardModelConfig defaults;

    private final int maxProfiles;
    private final int maxLegendreTerms;
    private final int maxPhaseElements;
    private final int maxStokes;
    private final int maxAngles;
    private final int maxAzimuthOrder;
    private final double maxSourceZenithAngle;
    private final double toaPressure;

    private ForwardModelConfig(Builder b) {
        if (b.maxProfiles < 1) throw new IllegalArgumentException("maxProfiles must be at least 1");
        if (b.maxLegendreTerms < RAYLEIGH_LEGENDRE_TERMS) {
            throw new IllegalArgumentException("maxLegendreTerms must be at least " + RAYLEIGH_LEGENDRE_TERMS);
        }
        if (b.maxPhaseElements < 1) throw new IllegalArgumentException("maxPhaseElements must be at least 1");
        if (b.maxStokes < 1) throw new IllegalArgumentException("maxStokes must be at least 1");
        if (b.maxAngles < 1) throw new IllegalArgumentException("maxAngles must be at least 1");
        if (b.maxAzimuthOrder < 0) throw new IllegalArgumentException("maxAzimuthOrder must not be negative");
        if (!(b.maxSourceZenithAngle > 0.0 && b.maxSourceZenithAngle <= 180.0)) {
            throw new IllegalArgumentException("maxSourceZenithAngle must be in (0, 180]");
        }
        if (!(b.toaPressure > 0.0) || Double.isInfinite(b.toaPressure)) {
            throw new IllegalArgumentException("toaPressure must be positive");
        }
        this.maxProfiles = b.maxProfiles;
        this.maxLegendreTerms = b.maxLegendreTerms;
        this.maxPhaseElements = b.maxPhaseElements;
        this.maxStokes = b.maxStokes;
        this.maxAngles = b.maxAngles;
        this.maxAzimuthOrder = b.maxAzimuthOrder;
        this.maxSourceZenithAngle = b.maxSourceZenithAngle;
        this.toaPressure = b.toaPressure;
    }

    /**
     * Defaults from the classpath.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static ForwardModelConfig defaults() {
        ForwardModelConfig d = defaults;
        if (d == null) {
            synchronized (ForwardModelConfig.class) {
                d = defaults;
                if (d == null) {
                    d = load();
                    defaults = d;
                }
            }
        }
        return d;
    }

    /** Builder seeded with {@link #defaults()}. */
    public static Builder builder() {
        return new Builder(defaults());
    }

    private static ForwardModelConfig load() {
        InputStream in = ForwardModelConfig.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Forward model configuration '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Forward model configuration '" + RESOURCE + "' not found on classpath");
        }
        Properties props = new Properties();
        try (InputStream is = in) {
            props.load(is);
        } catch (IOException e) {
            log.error("Failed to read forward model configuration", e);
            throw new IllegalStateException("Failed to read forward model configuration", e);
        }
        try {
            Builder b = new Builder();
            b.maxProfiles = intValue(props, "maxProfiles");
            b.maxLegendreTerms = intValue(props, "maxLegendreTerms");
            b.maxPhaseElements = intValue(props, "maxPhaseElements");
            b.maxStokes = intValue(props, "maxStokes");
            b.maxAngles = intValue(props, "maxAngles");
            b.maxAzimuthOrder = intValue(props, "maxAzimuthOrder");
            b.maxSourceZenithAngle = doubleValue(props, "maxSourceZenithAngle");
            b.toaPressure = doubleValue(props, "toaPressure");
            return b.build();
        } catch (IllegalArgumentException e) {
            log.error("Failed to parse forward model configuration", e);
            throw new IllegalStateException("Failed to parse forward model configuration", e);
        }
    }

    private static String value(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) throw new IllegalArgumentException("Missing property '" + key + "'");
        return v.trim();
    }

    private static int intValue(Properties props, String key) {
        return Integer.parseInt(value(props, key));
    }

    private static double doubleValue(Properties props, String key) {
        return Double.parseDouble(value(props, key));
    }

    /** Maximum number of profiles in one call. */
    public int maxProfiles() {
        return maxProfiles;
    }

    public int maxLegendreTerms() {
        return maxLegendreTerms;
    }

    public int maxPhaseElements() {
        return maxPhaseElements;
    }

    public int maxStokes() {
        return maxStokes;
    }

    public int maxAngles() {
        return maxAngles;
    }

    /** Highest Fourier azimuth order solved for solar visible channels. */
    public int maxAzimuthOrder() {
        return maxAzimuthOrder;
    }

    /** Source zenith angle (degrees) at and above which there is no solar contribution. */
    public double maxSourceZenithAngle() {
        return maxSourceZenithAngle;
    }

    /** Top-of-atmosphere pressure (hPa) profiles are extended to. */
    public double toaPressure() {
        return toaPressure;
    }

    @Override
    public String toString() {
        return "ForwardModelConfig{maxProfiles=" + maxProfiles
                + ", maxLegendreTerms=" + maxLegendreTerms
                + ", maxPhaseElements=" + maxPhaseElements
                + ", maxStokes=" + maxStokes
                + ", maxAngles=" + maxAngles
                + ", maxAzimuthOrder=" + maxAzimuthOrder
                + ", maxSourceZenithAngle=" + maxSourceZenithAngle
                + ", toaPressure=" + toaPressure + '}';
    }

    public static final class Builder {
        private int maxProfiles;
        private int maxLegendreTerms;
        private int maxPhaseElements;
        private int maxStokes;
        private int maxAngles;
        private int maxAzimuthOrder;
        private double maxSourceZenithAngle;
        private double toaPressure;

        private Builder() {}

        private Builder(ForwardModelConfig base) {
            this.maxProfiles = base.maxProfiles;
            this.maxLegendreTerms = base.maxLegendreTerms;
            this.maxPhaseElements = base.maxPhaseElements;
            this.maxStokes = base.maxStokes;
            this.maxAngles = base.maxAngles;
            this.maxAzimuthOrder = base.maxAzimuthOrder;
            this.maxSourceZenithAngle = base.maxSourceZenithAngle;
            this.toaPressure = base.toaPressure;
        }

        public Builder maxProfiles(int value) {
            this.maxProfiles = value;
            return this;
        }

        public Builder maxLegendreTerms(int value) {
            this.maxLegendreTerms = value;
            return this;
        }

        public Builder maxPhaseElements(int value) {
            this.maxPhaseElements = value;
            return this;
        }

        public Builder maxStokes(int value) {
            this.maxStokes = value;
            return this;
        }

        public Builder maxAngles(int value) {
            this.maxAngles = value;
            return this;
        }

        public Builder maxAzimuthOrder(int value) {
            this.maxAzimuthOrder = value;
            return this;
        }

        public Builder maxSourceZenithAngle(double degrees) {
            this.maxSourceZenithAngle = degrees;
            return this;
        }

        public Builder toaPressure(double hPa) {
            this.toaPressure = hPa;
            return this;
        }

        /** @throws IllegalArgumentException if a value is out of range */
        public ForwardModelConfig build() {
            return new ForwardModelConfig(this);
        }
    }
}
