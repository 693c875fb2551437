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
import java.util.concurrent.Callable;

import org.rephoto.alignment.correspondence.ImagePoint;
import org.rephoto.alignment.correspondence.PointPair;
import org.rephoto.alignment.transform.InsufficientCorrespondencesException;
import org.rephoto.alignment.transform.TransformFitException;
import org.rephoto.alignment.transform.TransformMode;
import org.rephoto.alignment.transform.WarpTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for builders that derive a {@link WarpTransform} (see {@link #call}) from user supplied point pairs.
 * <p>
 * The modern image (B) locations of the pairs are the source points {@link #p} and the historical image (A)
 * locations are the target points {@link #q}, so built transforms map B coordinates to A coordinates.
 * </p>
 */
abstract public class AbstractWarpTransformBuilder<T extends WarpTransform>
        implements Callable<T> {

    /** Source (B) points as { xValues, yValues }. */
    protected final double[][] p;

    /** Target (A) points as { xValues, yValues }. */
    protected final double[][] q;

    protected AbstractWarpTransformBuilder(final List<PointPair> pointPairs) {

        final int numberOfPairs = pointPairs.size();

        p = new double[2][numberOfPairs];
        q = new double[2][numberOfPairs];

        int i = 0;
        for (final PointPair pair : pointPairs) {
            final ImagePoint b = pair.getB();
            final ImagePoint a = pair.getA();
            p[0][i] = b.getX();
            p[1][i] = b.getY();
            q[0][i] = a.getX();
            q[1][i] = a.getY();
            ++i;
        }
    }

    /**
     * @return transform fitted to the point pairs.
     *
     * @throws TransformFitException
     *   if the pairs cannot determine a transform.
     */
    @Override
    public abstract T call()
            throws TransformFitException;

    public int getNumberOfPointPairs() {
        return p[0].length;
    }

    protected void validatePointPairCount(final TransformMode mode)
            throws InsufficientCorrespondencesException {
        final int numberOfPairs = getNumberOfPointPairs();
        if (numberOfPairs < mode.getMinimumPointPairs()) {
            throw new InsufficientCorrespondencesException(
                    mode + " requires at least " + mode.getMinimumPointPairs() + " point pairs but only " +
                    numberOfPairs + " were provided");
        }
    }

    /**
     * @param  points     points as { xValues, yValues }.
     * @param  tolerance  points closer than this distance are considered duplicates.
     *
     * @return number of points that duplicate an earlier point.
     */
    protected static int countDuplicates(final double[][] points,
                                         final double tolerance) {
        final int n = points[0].length;
        int duplicateCount = 0;
        for (int i = 1; i < n; i++) {
            for (int j = 0; j < i; j++) {
                if (Math.hypot(points[0][i] - points[0][j], points[1][i] - points[1][j]) <= tolerance) {
                    duplicateCount++;
                    LOG.warn("countDuplicates: point {} ({}, {}) has the same location as point {}",
                             i, points[0][i], points[1][i], j);
                    break;
                }
            }
        }
        return duplicateCount;
    }

    private static final Logger LOG = LoggerFactory.getLogger(AbstractWarpTransformBuilder.class);
}
