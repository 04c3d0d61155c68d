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

import com.github.tinemuz.rtforward.atmosphere.AtmosphereExtender;
import com.github.tinemuz.rtforward.atmosphere.ExtendedAtmosphere;
import com.github.tinemuz.rtforward.atmosphere.ReferenceAtmosphere;
import com.github.tinemuz.rtforward.backend.BackendException;
import com.github.tinemuz.rtforward.backend.MieParameterStreamCounter;
import com.github.tinemuz.rtforward.backend.PredictorSet;
import com.github.tinemuz.rtforward.backend.RtSolveContext;
import com.github.tinemuz.rtforward.backend.SolverWorkspace;
import com.github.tinemuz.rtforward.model.AtmosphericProfile;
import com.github.tinemuz.rtforward.model.ChannelCatalog;
import com.github.tinemuz.rtforward.model.RadianceResult;
import com.github.tinemuz.rtforward.model.RadianceResults;
import com.github.tinemuz.rtforward.model.SensorCoefficients;
import com.github.tinemuz.rtforward.model.SensorInput;
import com.github.tinemuz.rtforward.model.SolverOptions;
import com.github.tinemuz.rtforward.model.SurfaceState;
import com.github.tinemuz.rtforward.model.ViewGeometry;
import com.github.tinemuz.rtforward.optics.CombinedOpticalState;
import com.github.tinemuz.rtforward.optics.SurfaceOpticalState;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forward radiative-transfer driver.
 *
 * <p>For every profile and every requested sensor channel, {@link #forward}
 * extends the atmosphere to the top of the atmosphere, accumulates the layer
 * optical properties, solves the radiative transfer over the needed Fourier
 * azimuth orders and writes radiance and brightness temperature into the
 * caller's {@link RadianceResults}. Channels of all sensors are numbered by one
 * running index {@code ln}, which addresses both the results and any per-channel
 * options.</p>
 *
 * <p>Profiles run in order and the call stops at the first failure. Results of
 * profiles before the failing one are complete; later cells hold whatever they
 * held before the call. Workspaces are owned by the loop scope that allocated
 * them and are released on every exit path.</p>
 *
 * <p>Checked and unchecked exceptions thrown by backend collaborators are
 * reported as a {@link StageException} for the stage that called them.</p>
 *
 * <p>An instance holds no per-call state and may be shared; the caller's
 * argument objects must not be used concurrently by two calls.</p>
 */
public final class ForwardModel {
    private static final Logger log = LoggerFactory.getLogger(ForwardModel.class);

    private final ForwardModelConfig config;
    private final ForwardBackend backend;
    private final AtmosphereExtender extender;
    private final OpticalPropertyAccumulator accumulator;
    private final SurfaceOpticsBuilder surfaceOptics = new SurfaceOpticsBuilder();
    private final FourierSolverInvoker fourier;

    public ForwardModel(ForwardBackend backend) {
        this(ForwardModelConfig.defaults(), backend);
    }

    public ForwardModel(ForwardModelConfig config, ForwardBackend backend) {
        this(config, backend, ReferenceAtmosphere.standard());
    }

    public ForwardModel(ForwardModelConfig config, ForwardBackend backend, ReferenceAtmosphere reference) {
        this.config = Objects.requireNonNull(config, "config");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.extender = new AtmosphereExtender(reference, config.toaPressure());
        this.accumulator = new OpticalPropertyAccumulator(
                backend,
                backend.streams().orElseGet(() -> new MieParameterStreamCounter(config.maxLegendreTerms())),
                config);
        this.fourier = new FourierSolverInvoker(backend.solver());
    }

    public ForwardModelConfig config() {
        return config;
    }

    /** Run without per-profile options. */
    public ForwardStatus forward(
            List<AtmosphericProfile> profiles,
            List<SurfaceState> surfaces,
            List<ViewGeometry> geometries,
            List<ChannelCatalog> channels,
            RadianceResults results) {
        return forward(profiles, surfaces, geometries, channels, results, null);
    }

    /**
     * Compute radiances for every profile and channel.
     *
     * @param profiles   atmospheric profiles, one per profile
     * @param surfaces   surface states, one per profile
     * @param geometries view geometries, one per profile; derived fields are
     *                   filled in place
     * @param channels   channel selection per sensor, in running-index order
     * @param results    output grid, at least {@code L} channels by {@code M}
     *                   profiles
     * @param options    per-profile options, or {@code null}; a {@code null}
     *                   element means no options for that profile
     * @return SUCCESS, WARNING when only workspace releases failed, or FAILURE
     *         with the first fatal error
     */
    public ForwardStatus forward(
            List<AtmosphericProfile> profiles,
            List<SurfaceState> surfaces,
            List<ViewGeometry> geometries,
            List<ChannelCatalog> channels,
            RadianceResults results,
            List<SolverOptions> options) {
        Objects.requireNonNull(profiles, "profiles");
        Objects.requireNonNull(surfaces, "surfaces");
        Objects.requireNonNull(geometries, "geometries");
        Objects.requireNonNull(channels, "channels");
        Objects.requireNonNull(results, "results");

        List<String> warnings = new ArrayList<>();
        try {
            int nChannels = validate(profiles, surfaces, geometries, channels, results, options);
            if (nChannels == 0) {
                log.debug("No channels requested; nothing to do");
                return ForwardStatus.completed(warnings);
            }
            for (int m = 0; m < profiles.size(); m++) {
                SolverOptions opts = options == null ? null : options.get(m);
                runProfile(m, profiles.get(m), surfaces.get(m), geometries.get(m), opts, channels, results, warnings);
            }
        } catch (ForwardModelException e) {
            log.error(e.getMessage(), e.getCause());
            return ForwardStatus.failed(e, warnings);
        }
        return ForwardStatus.completed(warnings);
    }

    /** Check argument shapes; return the total channel count {@code L}. */
    private int validate(
            List<AtmosphericProfile> profiles,
            List<SurfaceState> surfaces,
            List<ViewGeometry> geometries,
            List<ChannelCatalog> channels,
            RadianceResults results,
            List<SolverOptions> options)
            throws ValidationException {
        int nChannels = 0;
        for (ChannelCatalog c : channels) nChannels += c.nChannels();
        if (channels.isEmpty() || nChannels == 0) return 0;

        int m = profiles.size();
        if (results.nChannels() < nChannels) {
            throw new ValidationException("Output radiance array too small (" + results.nChannels()
                    + ") to hold results for the number of requested channels (" + nChannels + ")");
        }
        if (m > config.maxProfiles()) {
            throw new ValidationException("Number of passed profiles (" + m
                    + ") exceeds the maximum allowed (" + config.maxProfiles() + ")");
        }
        if (surfaces.size() != m || geometries.size() != m || results.nProfiles() != m) {
            throw new ValidationException("Inconsistent profile dimensionality for input arguments");
        }
        if (options == null) return nChannels;
        if (options.size() != m) {
            throw new ValidationException("Inconsistent profile dimensionality for Options optional input argument");
        }
        for (int i = 0; i < m; i++) {
            SolverOptions o = options.get(i);
            if (o == null) continue;
            if (o.emissivitySwitch() && o.nEmissivityValues() < nChannels) {
                throw new ValidationException("Input Options emissivity array too small (" + o.nEmissivityValues()
                        + ") for the number of requested channels (" + nChannels + ") for profile #" + i);
            }
            if (o.emissivitySwitch() && o.directReflectivitySwitch() && o.nDirectReflectivityValues() < nChannels) {
                throw new ValidationException("Input Options direct reflectivity array too small ("
                        + o.nDirectReflectivityValues() + ") for the number of requested channels ("
                        + nChannels + ") for profile #" + i);
            }
        }
        return nChannels;
    }

    private void runProfile(
            int m,
            AtmosphericProfile profile,
            SurfaceState surface,
            ViewGeometry geometry,
            SolverOptions options,
            List<ChannelCatalog> channels,
            RadianceResults results,
            List<String> warnings)
            throws StageException {
        try {
            backend.geometry().derive(geometry);
        } catch (BackendException | RuntimeException e) {
            throw StageException.forProfile(Stage.GEOMETRY, m, "computing derived geometry", e);
        }

        try (WorkspaceScope scope = new WorkspaceScope("profile #" + m, warnings)) {
            ExtendedAtmosphere extended;
            try {
                extended = extender.extend(profile);
            } catch (BackendException | RuntimeException e) {
                throw StageException.forProfile(Stage.EXTENSION, m, "adding extra layers", e);
            }
            scope.hold(extended.extension());
            scope.hold(extended);
            AtmosphericProfile atmosphere = extended.atmosphere();

            CombinedOpticalState optics;
            SurfaceOpticalState sfc;
            try {
                optics = scope.hold(backend.workspaces().allocateOpticalState(
                        atmosphere.nLayers(), config.maxLegendreTerms(), config.maxPhaseElements()));
                sfc = scope.hold(backend.workspaces().allocateSurfaceOptics(config.maxAngles(), config.maxStokes()));
            } catch (BackendException | RuntimeException e) {
                throw StageException.forProfile(Stage.ALLOCATION, m, "allocating local data structures", e);
            }
            surfaceOptics.computeSurfaceTemperature(surface, sfc);

            ProfileRun run = new ProfileRun(m, atmosphere, surface, geometry, options, optics, sfc, results, warnings);
            int ln = 0;
            for (int n = 0; n < channels.size(); n++) {
                ln = runSensor(run, n, channels.get(n), ln);
            }
            log.debug("Profile #{} done: {} layers after extension, {} channels", m, atmosphere.nLayers(), ln);
        }
    }

    /** Run every channel of one sensor; return the next running index. */
    private int runSensor(ProfileRun run, int n, ChannelCatalog catalog, int ln) throws StageException {
        SensorCoefficients sensor = catalog.sensor();
        AtmosphericProfile atmosphere = run.atmosphere;
        ViewGeometry geometry = run.geometry;
        boolean antennaCorrection = run.options != null
                && run.options.antennaCorrectionSwitch()
                && sensor.hasAntennaPattern()
                && geometry.fieldOfView() != ViewGeometry.NO_FIELD_OF_VIEW
                && sensor.antennaPattern().isValidFieldOfView(geometry.fieldOfView());
        SensorInput input = run.options == null ? SensorInput.NONE : run.options.sensorInput();

        try (WorkspaceScope scope = new WorkspaceScope("profile #" + run.m + " sensor #" + n, run.warnings)) {
            PredictorSet predictors;
            SolverWorkspace rtWorkspace = null;
            try {
                predictors = scope.hold(backend.predictors().allocate(sensor, atmosphere.nLayers(), geometry));
                if (atmosphere.nClouds() > 0 || atmosphere.nAerosols() > 0 || sensor.type().isVisible()) {
                    rtWorkspace = scope.hold(backend.solver().allocateWorkspace(atmosphere.nLayers()));
                }
            } catch (BackendException | RuntimeException e) {
                throw StageException.forSensor(Stage.ALLOCATION, run.m, n, sensor.sensorId(),
                        "allocating predictor or RT solver workspace", e);
            }
            try {
                backend.predictors().compute(input, sensor, atmosphere, geometry, predictors);
            } catch (BackendException | RuntimeException e) {
                throw StageException.forSensor(Stage.PREDICTORS, run.m, n, sensor.sensorId(),
                        "computing predictors", e);
            }

            for (int l = 0; l < catalog.nChannels(); l++, ln++) {
                ChannelContext ch = new ChannelContext(run.m, catalog, l, ln);
                RadianceResult result = run.results.get(ln, run.m);
                result.reset(ch.sensorId(), ch.sensorChannel());

                int nAzimuthOrders = accumulator.accumulate(
                        ch, atmosphere, geometry, input, predictors, run.optics, result);
                surfaceOptics.applyOverrides(run.sfc, run.options, ln);
                RtSolveContext context = new RtSolveContext(atmosphere, run.surface, run.optics, run.sfc,
                        geometry, sensor, ch.channelIndex(), rtWorkspace);
                fourier.solve(ch, context, nAzimuthOrders, result);
                if (antennaCorrection) {
                    try {
                        backend.antenna().apply(geometry, sensor, ch.channelIndex(), result);
                    } catch (RuntimeException e) {
                        throw ch.fail(Stage.ANTENNA_CORRECTION, e);
                    }
                }
            }
            log.debug("Profile #{}: sensor {} done", run.m, sensor.sensorId());
        }
        return ln;
    }

    /** Profile-scope state shared by the sensor loop. */
    private static final class ProfileRun {
        final int m;
        final AtmosphericProfile atmosphere;
        final SurfaceState surface;
        final ViewGeometry geometry;
        final SolverOptions options;
        final CombinedOpticalState optics;
        final SurfaceOpticalState sfc;
        final RadianceResults results;
        final List<String> warnings;

        ProfileRun(int m, AtmosphericProfile atmosphere, SurfaceState surface, ViewGeometry geometry,
                   SolverOptions options, CombinedOpticalState optics, SurfaceOpticalState sfc,
                   RadianceResults results, List<String> warnings) {
            this.m = m;
            this.atmosphere = atmosphere;
            this.surface = surface;
            this.geometry = geometry;
            this.options = options;
            this.optics = optics;
            this.sfc = sfc;
            this.results = results;
            this.warnings = warnings;
        }
    }
}
