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

import com.github.tinemuz.rtforward.backend.AerosolScattering;
import com.github.tinemuz.rtforward.backend.AntennaCorrection;
import com.github.tinemuz.rtforward.backend.CloudScattering;
import com.github.tinemuz.rtforward.backend.DeltaScalingOpticsCombiner;
import com.github.tinemuz.rtforward.backend.GasAbsorption;
import com.github.tinemuz.rtforward.backend.GeometryDeriver;
import com.github.tinemuz.rtforward.backend.HeapWorkspaceProvider;
import com.github.tinemuz.rtforward.backend.LinearAntennaCorrection;
import com.github.tinemuz.rtforward.backend.MolecularScattering;
import com.github.tinemuz.rtforward.backend.OpticsCombiner;
import com.github.tinemuz.rtforward.backend.PredictorGenerator;
import com.github.tinemuz.rtforward.backend.RtSolver;
import com.github.tinemuz.rtforward.backend.StandardGeometryDeriver;
import com.github.tinemuz.rtforward.backend.StreamCounter;
import com.github.tinemuz.rtforward.backend.WorkspaceProvider;
import java.util.Objects;
import java.util.Optional;

/**
 * The physics collaborators the forward model drives.
 *
 * <p>Predictors, gas absorption, the three scattering computations and the
 * radiative-transfer solver have no default and must be supplied. Geometry
 * derivation, optics combination, antenna correction and workspace allocation
 * default to the implementations in the backend package. Without an explicit
 * stream counter the model uses a Mie size-parameter counter capped at its
 * configured Legendre term limit.</p>
 */
public final class ForwardBackend {
    private final GeometryDeriver geometry;
    private final PredictorGenerator predictors;
    private final StreamCounter streams;
    private final GasAbsorption absorption;
    private final MolecularScattering molecular;
    private final CloudScattering clouds;
    private final AerosolScattering aerosols;
    private final OpticsCombiner combiner;
    private final RtSolver solver;
    private final AntennaCorrection antenna;
    private final WorkspaceProvider workspaces;

    private ForwardBackend(Builder b) {
        this.geometry = b.geometry;
        this.predictors = Objects.requireNonNull(b.predictors, "predictor generator is required");
        this.streams = b.streams;
        this.absorption = Objects.requireNonNull(b.absorption, "gas absorption is required");
        this.molecular = Objects.requireNonNull(b.molecular, "molecular scattering is required");
        this.clouds = Objects.requireNonNull(b.clouds, "cloud scattering is required");
        this.aerosols = Objects.requireNonNull(b.aerosols, "aerosol scattering is required");
        this.combiner = b.combiner;
        this.solver = Objects.requireNonNull(b.solver, "RT solver is required");
        this.antenna = b.antenna;
        this.workspaces = b.workspaces;
    }

    public static Builder builder() {
        return new Builder();
    }

    public GeometryDeriver geometry() {
        return geometry;
    }

    public PredictorGenerator predictors() {
        return predictors;
    }

    /** Explicit stream counter, if one was supplied. */
    public Optional<StreamCounter> streams() {
        return Optional.ofNullable(streams);
    }

    public GasAbsorption absorption() {
        return absorption;
    }

    public MolecularScattering molecular() {
        return molecular;
    }

    public CloudScattering clouds() {
        return clouds;
    }

    public AerosolScattering aerosols() {
        return aerosols;
    }

    public OpticsCombiner combiner() {
        return combiner;
    }

    public RtSolver solver() {
        return solver;
    }

    public AntennaCorrection antenna() {
        return antenna;
    }

    public WorkspaceProvider workspaces() {
        return workspaces;
    }

    public static final class Builder {
        private GeometryDeriver geometry = new StandardGeometryDeriver();
        private PredictorGenerator predictors;
        private StreamCounter streams;
        private GasAbsorption absorption;
        private MolecularScattering molecular;
        private CloudScattering clouds;
        private AerosolScattering aerosols;
        private OpticsCombiner combiner = new DeltaScalingOpticsCombiner();
        private RtSolver solver;
        private AntennaCorrection antenna = new LinearAntennaCorrection();
        private WorkspaceProvider workspaces = new HeapWorkspaceProvider();

        private Builder() {}

        public Builder geometry(GeometryDeriver geometry) {
            this.geometry = Objects.requireNonNull(geometry);
            return this;
        }

        public Builder predictors(PredictorGenerator predictors) {
            this.predictors = predictors;
            return this;
        }

        public Builder streams(StreamCounter streams) {
            this.streams = streams;
            return this;
        }

        public Builder absorption(GasAbsorption absorption) {
            this.absorption = absorption;
            return this;
        }

        public Builder molecular(MolecularScattering molecular) {
            this.molecular = molecular;
            return this;
        }

        public Builder clouds(CloudScattering clouds) {
            this.clouds = clouds;
            return this;
        }

        public Builder aerosols(AerosolScattering aerosols) {
            this.aerosols = aerosols;
            return this;
        }

        public Builder combiner(OpticsCombiner combiner) {
            this.combiner = Objects.requireNonNull(combiner);
            return this;
        }

        public Builder solver(RtSolver solver) {
            this.solver = solver;
            return this;
        }

        public Builder antenna(AntennaCorrection antenna) {
            this.antenna = Objects.requireNonNull(antenna);
            return this;
        }

        public Builder workspaces(WorkspaceProvider workspaces) {
            this.workspaces = Objects.requireNonNull(workspaces);
            return this;
        }

        /** @throws NullPointerException if a required collaborator is missing */
        public ForwardBackend build() {
            return new ForwardBackend(this);
        }
    }
}
