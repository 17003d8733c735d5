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

import com.hellblazer.reciprocity.common.Affine;
import com.hellblazer.reciprocity.exceptions.DegenerateDirectionException;
import com.hellblazer.reciprocity.exceptions.IndexOutOfRangeException;
import com.hellblazer.reciprocity.transform.ChainComposer;
import com.hellblazer.reciprocity.transform.NodePaths;
import com.hellblazer.reciprocity.transform.TransformChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.List;
import java.util.Objects;

/**
 * A rectangular pixel array. The module's origin, and the positions one pixel along its fast and slow axes, come
 * from three transformation chains resolved over the scan.
 *
 * @author hal.hildebrand
 */
public final class DetectorModule {

    public static final String DATA_ORIGIN          = "data_origin";
    public static final String DATA_SIZE            = "data_size";
    public static final String FAST_PIXEL_DIRECTION = "fast_pixel_direction";
    public static final String MODULE_OFFSET        = "module_offset";
    public static final String SLOW_PIXEL_DIRECTION = "slow_pixel_direction";

    private static final Logger log = LoggerFactory.getLogger(DetectorModule.class);

    /**
     * The scan length implied by a module's three chains
     */
    public static int scanLength(ChainComposer composer, String path) {
        var walker = composer.getWalker();
        return Math.max(walker.maxSize(NodePaths.join(path, MODULE_OFFSET)),
                        Math.max(walker.maxSize(NodePaths.join(path, FAST_PIXEL_DIRECTION)),
                                 walker.maxSize(NodePaths.join(path, SLOW_PIXEL_DIRECTION))));
    }

    /**
     * Load a detector module group
     *
     * @param composer   resolves the module's chains
     * @param path       the module group
     * @param scanLength the number of scan points the model resolves over
     * @param labFrame   the frame positions are expressed in
     * @return the module
     */
    public static DetectorModule load(ChainComposer composer, String path, int scanLength, LabFrame labFrame) {
        var accessor = composer.getWalker().getAccessor();
        var frame = labFrame.toMatrix4d();
        var module = new DetectorModule(path, Fields.ints(accessor, path, DATA_ORIGIN, new int[] { 0, 0 }),
                                        Fields.ints(accessor, path, DATA_SIZE, new int[] { 1, 1 }),
                                        composer.chain(NodePaths.join(path, MODULE_OFFSET), scanLength)
                                                .prepend(frame),
                                        composer.chain(NodePaths.join(path, FAST_PIXEL_DIRECTION), scanLength)
                                                .prepend(frame),
                                        composer.chain(NodePaths.join(path, SLOW_PIXEL_DIRECTION), scanLength)
                                                .prepend(frame));
        log.debug("Loaded {}", module);
        return module;
    }

    private final int[]          dataOrigin;
    private final int[]          dataSize;
    private final TransformChain fastChain;
    private final TransformChain offsetChain;
    private final String         path;
    private final TransformChain slowChain;

    /**
     * @param path        the module group
     * @param dataOrigin  first pixel (slow, fast) of the module in the detector image
     * @param dataSize    pixel count (slow, fast)
     * @param offsetChain places the module origin
     * @param fastChain   places the origin of the next pixel along the fast axis
     * @param slowChain   places the origin of the next pixel along the slow axis
     */
    public DetectorModule(String path, int[] dataOrigin, int[] dataSize, TransformChain offsetChain,
                          TransformChain fastChain, TransformChain slowChain) {
        this.path = Objects.requireNonNull(path, "path");
        if (dataOrigin.length != 2 || dataSize.length != 2) {
            throw new IllegalArgumentException("Module origin and size are (slow, fast) pairs");
        }
        if (dataSize[0] < 1 || dataSize[1] < 1) {
            throw new IllegalArgumentException("Module size must be positive: (%d, %d)".formatted(dataSize[0],
                                                                                                 dataSize[1]));
        }
        if (offsetChain.size() != fastChain.size() || offsetChain.size() != slowChain.size()) {
            throw new IllegalArgumentException("Module chains resolved over different scan lengths");
        }
        this.dataOrigin = dataOrigin.clone();
        this.dataSize = dataSize.clone();
        this.offsetChain = offsetChain;
        this.fastChain = fastChain;
        this.slowChain = slowChain;
    }

    /**
     * The outline of the module at a scan point: origin, origin + slow, origin + slow + fast, origin + fast, and
     * back to the origin
     */
    public List<Point3d> corners(int frame) {
        var slow = dataSize[0];
        var fast = dataSize[1];
        return List.of(pixelPosition(frame, 0, 0), pixelPosition(frame, slow, 0), pixelPosition(frame, slow, fast),
                       pixelPosition(frame, 0, fast), pixelPosition(frame, 0, 0));
    }

    public int[] dataOrigin() {
        return dataOrigin.clone();
    }

    public TransformChain fastChain() {
        return fastChain;
    }

    public TransformChain offsetChain() {
        return offsetChain;
    }

    public String path() {
        return path;
    }

    /**
     * @return the unit direction from the sample position (the lab origin) to a pixel
     * @throws DegenerateDirectionException if the pixel sits on the origin
     */
    public Vector3d pixelDirection(PixelPoint point) {
        var position = new Vector3d(pixelPosition(point));
        if (!(position.length() > Affine.ZERO_LENGTH)) {
            throw new DegenerateDirectionException(path, point.frame());
        }
        return Affine.unit(position);
    }

    /**
     * Position of a pixel coordinate at a scan point
     *
     * @param frame the scan point
     * @param slow  pixel coordinate along the slow axis, in [0, slow size]
     * @param fast  pixel coordinate along the fast axis, in [0, fast size]
     * @return the position in millimetres, in lab axes
     * @throws IndexOutOfRangeException if the frame or either pixel coordinate is out of range
     */
    public Point3d pixelPosition(int frame, double slow, double fast) {
        checkPixel("Slow pixel", slow, dataSize[0]);
        checkPixel("Fast pixel", fast, dataSize[1]);
        var origin = offsetChain.origin(frame);
        var slowDirection = new Vector3d(slowChain.origin(frame));
        slowDirection.sub(origin);
        var fastDirection = new Vector3d(fastChain.origin(frame));
        fastDirection.sub(origin);

        var position = new Point3d(origin);
        position.scaleAdd(slow, slowDirection, position);
        position.scaleAdd(fast, fastDirection, position);
        return position;
    }

    public Point3d pixelPosition(PixelPoint point) {
        return pixelPosition(point.frame(), point.slow(), point.fast());
    }

    /**
     * The scattered wavevector reaching a pixel, kf = 2 pi / lambda along the pixel direction
     *
     * @param point      the pixel coordinate
     * @param wavelength the wavelength in Angstrom
     * @return kf in inverse Angstrom
     */
    public Vector3d pixelWavevector(PixelPoint point, double wavelength) {
        var kf = pixelDirection(point);
        kf.scale(XrayUtils.wavevector(wavelength));
        return kf;
    }

    /**
     * @return (frames, slow pixels, fast pixels)
     */
    public int[] shape() {
        return new int[] { offsetChain.size(), dataSize[0], dataSize[1] };
    }

    public TransformChain slowChain() {
        return slowChain;
    }

    @Override
    public String toString() {
        return "DetectorModule[%s, %d x %d pixels, %d frames]".formatted(path, dataSize[0], dataSize[1],
                                                                        offsetChain.size());
    }

    private void checkPixel(String what, double coordinate, int size) {
        if (!(coordinate >= 0 && coordinate <= size)) {
            throw new IndexOutOfRangeException(what, (int) Math.floor(coordinate), size + 1);
        }
    }
}
