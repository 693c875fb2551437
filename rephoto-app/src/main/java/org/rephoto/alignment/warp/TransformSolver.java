/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.rephoto.alignment.warp;

import java.util.List;

import org.rephoto.alignment.correspondence.CorrespondenceSnapshot;
import org.rephoto.alignment.correspondence.CorrespondenceStore;
import org.rephoto.alignment.correspondence.PointPair;
import org.rephoto.alignment.transform.ThinPlateSplineTransform;
import org.rephoto.alignment.transform.TransformFitException;
import org.rephoto.alignment.transform.TransformMode;
import org.rephoto.alignment.transform.WarpTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits a homography or thin plate spline mapping modern image (B) coordinates to historical image (A)
 * coordinates.  Fit failures never escape as exceptions, they are returned as failed {@link SolveResult}s
 * so callers can keep showing their last valid result.
 */
public class TransformSolver {

    private final double smoothing;
    private final Double ransacThreshold;

    public TransformSolver() {
        this(0.0, null);
    }

    /**
     * @param  smoothing        thin plate spline smoothing (0 for exact interpolation).
     * @param  ransacThreshold  homography outlier threshold in pixels, or null to fit all pairs.
     */
    public TransformSolver(final double smoothing,
                           final Double ransacThreshold) {
        if (! (smoothing >= 0.0)) {
            throw new IllegalArgumentException("smoothing must be non-negative but was " + smoothing);
        }
        if ((ransacThreshold != null) && (! (ransacThreshold > 0.0))) {
            throw new IllegalArgumentException("ransacThreshold must be positive but was " + ransacThreshold);
        }
        this.smoothing = smoothing;
        this.ransacThreshold = ransacThreshold;
    }

    public double getSmoothing() {
        return smoothing;
    }

    public Double getRansacThreshold() {
        return ransacThreshold;
    }

    public SolveResult computeTransform(final CorrespondenceStore store,
                                        final TransformMode mode) {
        return computeTransform(store.snapshot(), mode);
    }

    public SolveResult computeTransform(final CorrespondenceSnapshot snapshot,
                                        final TransformMode mode) {
        return computeTransform(snapshot.flattenToPointPairs(), mode);
    }

    public SolveResult computeTransform(final List<PointPair> pointPairs,
                                        final TransformMode mode) {

        final AbstractWarpTransformBuilder<? extends WarpTransform> builder = buildBuilder(pointPairs, mode);

        SolveResult result;
        try {
            result = SolveResult.success(mode, pointPairs.size(), builder.call());
        } catch (final TransformFitException e) {
            LOG.warn("computeTransform: failed to fit {} to {} point pairs, {}: {}",
                     mode, pointPairs.size(), e.getError(), e.getMessage());
            result = SolveResult.failure(mode, pointPairs.size(), e);
        }

        return result;
    }

    private AbstractWarpTransformBuilder<? extends WarpTransform> buildBuilder(final List<PointPair> pointPairs,
                                                                               final TransformMode mode) {
        final AbstractWarpTransformBuilder<? extends WarpTransform> builder;
        switch (mode) {
            case HOMOGRAPHY:
                builder = new HomographyBuilder(pointPairs,
                                                ransacThreshold,
                                                HomographyBuilder.DEFAULT_RANSAC_ITERATIONS,
                                                HomographyBuilder.DEFAULT_RANSAC_SEED,
                                                HomographyBuilder.DEFAULT_MAX_CONDITION_NUMBER);
                break;
            case THIN_PLATE_SPLINE:
                builder = new ThinPlateSplineBuilder(pointPairs,
                                                     smoothing,
                                                     ThinPlateSplineTransform.DEFAULT_MAX_CONDITION_NUMBER);
                break;
            default:
                throw new IllegalArgumentException("unsupported transform mode " + mode);
        }
        return builder;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TransformSolver.class);
}
