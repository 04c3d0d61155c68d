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
import com.github.tinemuz.rtforward.backend.PredictorSet;
import com.github.tinemuz.rtforward.backend.StreamCounter;
import com.github.tinemuz.rtforward.model.AtmosphericProfile;
import com.github.tinemuz.rtforward.model.RadianceResult;
import com.github.tinemuz.rtforward.model.SensorCoefficients;
import com.github.tinemuz.rtforward.model.SensorInput;
import com.github.tinemuz.rtforward.model.SpectralChannel;
import com.github.tinemuz.rtforward.model.ViewGeometry;
import com.github.tinemuz.rtforward.optics.CombinedOpticalState;

/**
 * Builds the combined optical state of one channel.
 *
 * <p>Order per channel: reset, stream count, gas absorption, then for a solar
 * visible channel the Rayleigh stream bump and molecular scattering, then cloud
 * and aerosol scattering when present, then combination. The bump comes before
 * the particle steps so they accumulate with the widened Legendre count.</p>
 *
 * <p>Once the stream count is set, contributors may only widen the Legendre
 * count; a contributor that narrows it fails its stage. Unchecked exceptions
 * from a contributor fail its stage as well.</p>
 */
final class OpticalPropertyAccumulator {
    private final ForwardBackend backend;
    private final StreamCounter streams;
    private final ForwardModelConfig config;

    OpticalPropertyAccumulator(ForwardBackend backend, StreamCounter streams, ForwardModelConfig config) {
        this.backend = backend;
        this.streams = streams;
        this.config = config;
    }

    /**
     * Accumulate and combine the optics of one channel and set the result's
     * solar, visible and scattering flags.
     *
     * @return highest Fourier azimuth order to solve; 0 means order 0 only
     */
    int accumulate(
            ChannelContext ch,
            AtmosphericProfile atmosphere,
            ViewGeometry geometry,
            SensorInput input,
            PredictorSet predictors,
            CombinedOpticalState optics,
            RadianceResult result)
            throws StageException {
        SensorCoefficients sensor = ch.sensor();
        int ci = ch.channelIndex();
        optics.resetScattering();

        int nStreams;
        try {
            nStreams = streams.computeStreamCount(atmosphere, sensor, ci, result);
        } catch (BackendException | RuntimeException e) {
            throw ch.fail(Stage.STREAMS, e);
        }
        if (nStreams < 0 || nStreams > optics.maxLegendreTerms()) {
            throw ch.fail(Stage.STREAMS, "stream count " + nStreams + " outside [0, " + optics.maxLegendreTerms() + "]");
        }
        optics.setLegendreTerms(nStreams);

        try {
            backend.absorption().compute(input, sensor, ci, atmosphere, predictors, optics);
        } catch (BackendException | RuntimeException e) {
            throw ch.fail(Stage.ABSORPTION, e);
        }
        int floor = checkNotNarrowed(ch, Stage.ABSORPTION, optics, nStreams);

        SpectralChannel channel = ch.channel();
        boolean solar = channel.solarIrradiance() > 0.0
                && geometry.sourceZenithAngle() < config.maxSourceZenithAngle();
        boolean visible = solar && sensor.type().isVisible();
        result.setSolarFlag(solar);
        result.setVisibleFlag(visible);

        int nAzimuthOrders = 0;
        if (visible) {
            nAzimuthOrders = config.maxAzimuthOrder();
            if (optics.maxLegendreTerms() < ForwardModelConfig.RAYLEIGH_LEGENDRE_TERMS) {
                throw ch.fail(Stage.MOLECULAR_SCATTERING, "optical state holds " + optics.maxLegendreTerms()
                        + " Legendre terms but visible channels need " + ForwardModelConfig.RAYLEIGH_LEGENDRE_TERMS);
            }
            if (optics.requireLegendreTerms(ForwardModelConfig.RAYLEIGH_LEGENDRE_TERMS)) {
                result.setScatteringFlag(true);
                result.setNFullStreams(optics.nLegendreTerms() + 2);
            }
            floor = optics.nLegendreTerms();
            try {
                backend.molecular().compute(channel.wavenumber(), atmosphere, optics);
            } catch (BackendException | RuntimeException e) {
                throw ch.fail(Stage.MOLECULAR_SCATTERING, e);
            }
            floor = checkNotNarrowed(ch, Stage.MOLECULAR_SCATTERING, optics, floor);
        }

        if (atmosphere.nClouds() > 0) {
            try {
                backend.clouds().compute(atmosphere, sensor, ci, optics);
            } catch (BackendException | RuntimeException e) {
                throw ch.fail(Stage.CLOUD_SCATTERING, e);
            }
            floor = checkNotNarrowed(ch, Stage.CLOUD_SCATTERING, optics, floor);
        }
        if (atmosphere.nAerosols() > 0) {
            try {
                backend.aerosols().compute(atmosphere, sensor, ci, optics);
            } catch (BackendException | RuntimeException e) {
                throw ch.fail(Stage.AEROSOL_SCATTERING, e);
            }
            floor = checkNotNarrowed(ch, Stage.AEROSOL_SCATTERING, optics, floor);
        }

        try {
            backend.combiner().combine(optics);
        } catch (BackendException | RuntimeException e) {
            throw ch.fail(Stage.COMBINATION, e);
        }
        checkNotNarrowed(ch, Stage.COMBINATION, optics, floor);
        return nAzimuthOrders;
    }

    /** Fail {@code stage} if the Legendre count fell below {@code floor}; return the new floor. */
    private static int checkNotNarrowed(ChannelContext ch, Stage stage, CombinedOpticalState optics, int floor)
            throws StageException {
        int n = optics.nLegendreTerms();
        if (n < floor) {
            throw ch.fail(stage, "Legendre term count narrowed from " + floor + " to " + n);
        }
        return n;
    }
}
