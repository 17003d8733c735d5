/*
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.reciprocity.diffraction;

import com.hellblazer.reciprocity.exceptions.GeometryException;
import com.hellblazer.reciprocity.exceptions.MissingFieldException;
import com.hellblazer.reciprocity.transform.ChainComposer;
import com.hellblazer.reciprocity.transform.ChainDescriber;
import com.hellblazer.reciprocity.transform.GroupNode;
import com.hellblazer.reciprocity.transform.NodeAccessor;
import com.hellblazer.reciprocity.transform.NodePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The diffraction geometry of one scan: beam, sample and detectors, every chain resolved over a common scan length
 * and expressed in the lab frame of the model's context.
 * <p>
 * The scan length is the largest value count of any sample or detector chain; single valued links broadcast to
 * every scan point.
 *
 * @author hal.hildebrand
 */
public final class GeometryModel {

    public static final String NX_BEAM            = "NXbeam";
    public static final String NX_DETECTOR        = "NXdetector";
    public static final String NX_DETECTOR_MODULE = "NXdetector_module";
    public static final String NX_ENTRY           = "NXentry";
    public static final String NX_INSTRUMENT      = "NXinstrument";
    public static final String NX_SAMPLE          = "NXsample";

    public static class Builder {
        private final NodeAccessor accessor;
        private final List<String> detectors  = new ArrayList<>();
        private       String       beam;
        private       GeometryContext context = GeometryContext.defaults();
        private       String       instrument;
        private       String       sample;

        private Builder(NodeAccessor accessor) {
            this.accessor = Objects.requireNonNull(accessor, "accessor");
        }

        public Builder beam(String path) {
            this.beam = path;
            return this;
        }

        public GeometryModel build() {
            if (sample == null) {
                throw new MissingFieldException(NodePaths.ROOT, "no sample group");
            }
            if (beam == null) {
                throw new MissingFieldException(NodePaths.ROOT, "no beam group");
            }
            return new GeometryModel(this);
        }

        public Builder context(GeometryContext context) {
            this.context = Objects.requireNonNull(context, "context");
            return this;
        }

        public Builder detector(String path) {
            detectors.add(Objects.requireNonNull(path, "path"));
            return this;
        }

        /**
         * The instrument group whose components with a parent reference are reported by
         * {@link GeometryModel#componentPositions()}
         */
        public Builder instrument(String path) {
            this.instrument = path;
            return this;
        }

        public Builder sample(String path) {
            this.sample = path;
            return this;
        }
    }

    private static final Logger log = LoggerFactory.getLogger(GeometryModel.class);

    public static Builder builder(NodeAccessor accessor) {
        return new Builder(accessor);
    }

    /**
     * Discover and load the geometry of the first entry, in the default context
     */
    public static GeometryModel load(NodeAccessor accessor) {
        return load(accessor, GeometryContext.defaults());
    }

    /**
     * Discover and load the geometry of the first entry: its instrument, every detector in the instrument, the
     * sample, and the beam (inside the sample, else inside the instrument)
     *
     * @param accessor the stored hierarchy
     * @param context  lab frame and configuration
     * @return the model
     * @throws MissingFieldException if the entry, instrument, sample or beam cannot be found
     */
    public static GeometryModel load(NodeAccessor accessor, GeometryContext context) {
        var entry = Fields.firstChildGroup(accessor, NodePaths.ROOT, NX_ENTRY)
                          .orElseThrow(() -> new MissingFieldException(NodePaths.ROOT, "no " + NX_ENTRY));
        var instrument = Fields.firstChildGroup(accessor, entry, NX_INSTRUMENT)
                               .orElseThrow(() -> new MissingFieldException(entry, "no " + NX_INSTRUMENT));
        var sample = Fields.firstChildGroup(accessor, entry, NX_SAMPLE)
                           .orElseThrow(() -> new MissingFieldException(entry, "no " + NX_SAMPLE));
        var beam = Fields.firstChildGroup(accessor, sample, NX_BEAM)
                         .or(() -> Fields.firstChildGroup(accessor, instrument, NX_BEAM))
                         .orElseThrow(() -> new MissingFieldException(sample, "no " + NX_BEAM));

        var builder = builder(accessor).context(context).instrument(instrument).sample(sample).beam(beam);
        Fields.childGroups(accessor, instrument, NX_DETECTOR).forEach(builder::detector);
        return builder.build();
    }

    private final Beam                      beam;
    private final ReciprocalSpaceCalculator calculator;
    private final Map<String, Point3d>      componentPositions;
    private final GeometryContext           context;
    private final List<Detector>            detectors;
    private final Sample                    sample;
    private final int                       scanLength;

    private GeometryModel(Builder builder) {
        this.context = builder.context;
        var config = context.config();
        var labFrame = context.labFrame();
        var composer = new ChainComposer(builder.accessor, config);
        this.calculator = new ReciprocalSpaceCalculator(config);

        var length = composer.getWalker().maxSize(builder.sample);
        for (var detector : builder.detectors) {
            length = Math.max(length, Detector.scanLength(composer, detector));
        }
        this.scanLength = length;

        this.beam = Beam.load(composer.getWalker(), builder.beam, labFrame);
        this.sample = Sample.load(composer, builder.sample, scanLength, labFrame, calculator);
        this.detectors = builder.detectors.stream()
                                          .map(path -> Detector.load(composer, path, scanLength, labFrame))
                                          .toList();
        this.componentPositions = positions(composer, builder.accessor, builder.instrument);
        log.info("Loaded geometry: {} detectors, {} scan points, {}", detectors.size(), scanLength, labFrame);
    }

    public Beam beam() {
        return beam;
    }

    /**
     * Positions of the instrument components that carry a parent reference, at the first scan point, plus the
     * sample, which is always reported at the lab origin. Components whose chains cannot be resolved are left
     * out.
     */
    public Map<String, Point3d> componentPositions() {
        var copy = new LinkedHashMap<String, Point3d>();
        componentPositions.forEach((name, position) -> copy.put(name, new Point3d(position)));
        return Collections.unmodifiableMap(copy);
    }

    public GeometryContext context() {
        return context;
    }

    /**
     * A report of the model at a scan point: beam, every chain with its links and composed transform, and
     * component positions
     */
    public String describe(int scanIndex) {
        var sb = new StringBuilder();
        sb.append("Geometry @ scan point ").append(scanIndex).append(" of ").append(scanLength).append('\n');
        sb.append(beam).append('\n');
        sb.append(sample).append('\n');
        sb.append(ChainDescriber.describe(sample.chain(), scanIndex));
        for (var detector : detectors) {
            sb.append(detector).append('\n');
            sb.append(ChainDescriber.describe(detector.chain(), scanIndex));
            for (var module : detector.modules()) {
                sb.append(module).append('\n');
                sb.append(ChainDescriber.describe(module.offsetChain(), scanIndex));
                sb.append(ChainDescriber.describe(module.fastChain(), scanIndex));
                sb.append(ChainDescriber.describe(module.slowChain(), scanIndex));
            }
        }
        sb.append("Component positions\n");
        componentPositions.forEach((name, p) -> sb.append(
        String.format(Locale.ROOT, "  %-20s (%.3f, %.3f, %.3f)%n", name, p.x, p.y, p.z)));
        return sb.toString();
    }

    /**
     * Scattering vector Q = kf - ki for a pixel of the first detector module
     */
    public Vector3d detectorQ(PixelPoint point) {
        return detectorQ(module(), point);
    }

    /**
     * Scattering vector Q = kf - ki for a pixel of a detector module
     *
     * @return Q in inverse Angstrom, in lab axes
     */
    public Vector3d detectorQ(DetectorModule module, PixelPoint point) {
        var kf = module.pixelWavevector(point, beam.wavelength());
        return calculator.scatteringVector(beam.incidentWavevector(), kf);
    }

    public List<Detector> detectors() {
        return detectors;
    }

    /**
     * Miller indices measured at a pixel of the first detector module
     */
    public Vector3d hkl(PixelPoint point) {
        return hkl(module(), point);
    }

    /**
     * Miller indices measured at a pixel, using the sample rotation at the same scan point
     */
    public Vector3d hkl(DetectorModule module, PixelPoint point) {
        return sample.hkl(detectorQ(module, point), point.frame());
    }

    /**
     * Scattering vector of a reflection at a scan point
     */
    public Vector3d hklToQ(Tuple3d hkl, int scanIndex) {
        return sample.hklToQ(hkl, scanIndex);
    }

    /**
     * @return the first module of the first detector
     * @throws MissingFieldException if the model has no detector modules
     */
    public DetectorModule module() {
        return detectors.stream()
                        .flatMap(d -> d.modules().stream())
                        .findFirst()
                        .orElseThrow(() -> new MissingFieldException(sample.path(), "geometry has no detector modules"));
    }

    public Sample sample() {
        return sample;
    }

    public int scanLength() {
        return scanLength;
    }

    /**
     * @return (frames, slow pixels, fast pixels) of the first detector module
     */
    public int[] shape() {
        return module().shape();
    }

    @Override
    public String toString() {
        return "GeometryModel[%s, %s, %d detectors, %d points]".formatted(beam.path(), sample.path(),
                                                                         detectors.size(), scanLength);
    }

    private Map<String, Point3d> positions(ChainComposer composer, NodeAccessor accessor, String instrument) {
        var positions = new LinkedHashMap<String, Point3d>();
        if (instrument != null) {
            var frame = context.labFrame().toMatrix4d();
            for (var child : accessor.children(instrument)) {
                var record = accessor.find(child);
                if (record.isEmpty() || !(record.get() instanceof GroupNode group) || !group.hasDependsOn()) {
                    continue;
                }
                try {
                    positions.put(NodePaths.name(child), composer.chain(child).prepend(frame).origin(0));
                } catch (GeometryException e) {
                    log.warn("Cannot place component {}: {}", child, e.getMessage());
                }
            }
        }
        positions.put("sample", new Point3d());
        return positions;
    }
}
