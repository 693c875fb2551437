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

import org.rephoto.alignment.correspondence.PointPair;
import org.rephoto.alignment.transform.InsufficientCorrespondencesException;
import org.rephoto.alignment.transform.PointNormalization;
import org.rephoto.alignment.transform.SingularSystemException;
import org.rephoto.alignment.transform.ThinPlateSplineTransform;
import org.rephoto.alignment.transform.TransformFitException;
import org.rephoto.alignment.transform.TransformMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AbstractWarpTransformBuilder} implementation that realizes the warp (see {@link #call})
 * with a Thin Plate Spline transformation.
 */
public class ThinPlateSplineBuilder
        extends AbstractWarpTransformBuilder<ThinPlateSplineTransform> {

    /** Control points closer than this many pixels are treated as duplicates. */
    public static final double DUPLICATE_TOLERANCE = 1e-6;

    private final double smoothing;
    private final double maxConditionNumber;

    /**
     * Constructs a builder for an exactly interpolating spline.
     */
    public ThinPlateSplineBuilder(final List<PointPair> pointPairs) {
        this(pointPairs, 0.0, ThinPlateSplineTransform.DEFAULT_MAX_CONDITION_NUMBER);
    }

    /**
     * @param  pointPairs          pairs to fit.
     * @param  smoothing           non-negative regularization, 0 interpolates the control points exactly
     *                             and larger values trade that for a smoother global deformation.
     * @param  maxConditionNumber  condition number above which the linear system is considered singular.
     */
    public ThinPlateSplineBuilder(final List<PointPair> pointPairs,
                                  final double smoothing,
                                  final double maxConditionNumber) {
        super(pointPairs);
        if (! (smoothing >= 0.0)) {
            throw new IllegalArgumentException("smoothing must be non-negative but was " + smoothing);
        }
        this.smoothing = smoothing;
        this.maxConditionNumber = maxConditionNumber;
    }

    /**
     * @return a TPS transform instance using this builder's point pairs.
     *
     * @throws TransformFitException
     *   if there are fewer than 3 non-collinear pairs or the control points are duplicated.
     */
    @Override
    public ThinPlateSplineTransform call()
            throws TransformFitException {

        LOG.info("call: entry, fitting {} point pairs with smoothing {}", getNumberOfPointPairs(), smoothing);

        validatePointPairCount(TransformMode.THIN_PLATE_SPLINE);

        if (PointSetGeometry.areCollinear(p, PointNormalization.allIndexes(getNumberOfPointPairs()))) {
            throw new InsufficientCorrespondencesException(
                    "thin plate spline requires at least 3 non-collinear point pairs but all " +
                    getNumberOfPointPairs() + " modern image points are collinear");
        }

        final int duplicateCount = countDuplicates(p, DUPLICATE_TOLERANCE);
        if (duplicateCount > 0) {
            throw new SingularSystemException(duplicateCount + " modern image control point(s) have the same location");
        }

        final ThinPlateSplineTransform transform = ThinPlateSplineTransform.fit(p, q, smoothing, maxConditionNumber);

        LOG.info("call: exit");

        return transform;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ThinPlateSplineBuilder.class);

}
