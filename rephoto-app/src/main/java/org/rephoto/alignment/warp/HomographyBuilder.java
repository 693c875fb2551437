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

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.SingularOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import org.rephoto.alignment.correspondence.PointPair;
import org.rephoto.alignment.transform.DegenerateGeometryException;
import org.rephoto.alignment.transform.HomographyTransform;
import org.rephoto.alignment.transform.PointNormalization;
import org.rephoto.alignment.transform.SingularSystemException;
import org.rephoto.alignment.transform.TransformFitException;
import org.rephoto.alignment.transform.TransformMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AbstractWarpTransformBuilder} implementation that realizes the warp (see {@link #call})
 * with a projective homography.
 * <p>
 * The homography is the normalized direct linear transform: coordinates of both point sets are normalized,
 * the 2N x 9 design matrix is decomposed with a singular value decomposition and the right singular vector
 * of the smallest singular value is the (normalized) solution.  For exactly 4 pairs this is an exact fit,
 * for more pairs it is the algebraic least squares fit.
 * </p>
 * <p>
 * An optional RANSAC pass (enabled by specifying a reprojection threshold) fits minimal 4 pair samples,
 * keeps the sample with the most inliers and refits on those inliers.
 * </p>
 */
public class HomographyBuilder
        extends AbstractWarpTransformBuilder<HomographyTransform> {

    /** Ratio of largest to second smallest singular value above which the system is singular. */
    public static final double DEFAULT_MAX_CONDITION_NUMBER = 1e10;

    public static final int DEFAULT_RANSAC_ITERATIONS = 1000;
    public static final long DEFAULT_RANSAC_SEED = 42;

    private final Double ransacThreshold;
    private final int ransacIterations;
    private final long ransacSeed;
    private final double maxConditionNumber;

    private int[] inlierIndexes;

    /**
     * Constructs a builder for an all pairs (non-robust) fit.
     */
    public HomographyBuilder(final List<PointPair> pointPairs) {
        this(pointPairs, null, DEFAULT_RANSAC_ITERATIONS, DEFAULT_RANSAC_SEED, DEFAULT_MAX_CONDITION_NUMBER);
    }

    /**
     * @param  pointPairs          pairs to fit.
     * @param  ransacThreshold     maximum reprojection error (in A pixels) for a pair to be an inlier,
     *                             or null to fit all pairs without outlier rejection.
     * @param  ransacIterations    number of random minimal samples to evaluate.
     * @param  ransacSeed          seed for sample selection (fits are reproducible for the same seed).
     * @param  maxConditionNumber  condition number above which the linear system is considered singular.
     */
    public HomographyBuilder(final List<PointPair> pointPairs,
                             final Double ransacThreshold,
                             final int ransacIterations,
                             final long ransacSeed,
                             final double maxConditionNumber) {
        super(pointPairs);
        this.ransacThreshold = ransacThreshold;
        this.ransacIterations = ransacIterations;
        this.ransacSeed = ransacSeed;
        this.maxConditionNumber = maxConditionNumber;
        this.inlierIndexes = null;
    }

    /**
     * @return indexes of the pairs used for the final fit (all pairs unless RANSAC rejected some),
     *         or null if {@link #call} has not completed.
     */
    public int[] getInlierIndexes() {
        return inlierIndexes == null ? null : inlierIndexes.clone();
    }

    /**
     * @return a homography using this builder's point pairs.
     *
     * @throws TransformFitException
     *   if there are fewer than 4 pairs, the points are degenerate, or the system is singular.
     */
    @Override
    public HomographyTransform call()
            throws TransformFitException {

        LOG.info("call: entry, fitting {} point pairs, ransacThreshold={}", getNumberOfPointPairs(), ransacThreshold);

        validatePointPairCount(TransformMode.HOMOGRAPHY);

        final int[] allIndexes = PointNormalization.allIndexes(getNumberOfPointPairs());
        validateGeometry(allIndexes);

        final HomographyTransform homography;
        if ((ransacThreshold == null) || (allIndexes.length == 4)) {
            inlierIndexes = allIndexes;
            homography = fit(allIndexes);
        } else {
            inlierIndexes = findInliers(allIndexes);
            homography = fit(inlierIndexes);
        }

        LOG.info("call: exit, fit {} of {} pairs, max residual is {}",
                 inlierIndexes.length, allIndexes.length, maxResidual(homography, inlierIndexes));

        return homography;
    }

    private void validateGeometry(final int[] indexes)
            throws DegenerateGeometryException {

        if (indexes.length == 4) {
            // a minimal set must be in general position on both sides
            if (PointSetGeometry.hasCollinearTriple(p, indexes)) {
                throw new DegenerateGeometryException("3 or more of the 4 modern image points are collinear");
            }
            if (PointSetGeometry.hasCollinearTriple(q, indexes)) {
                throw new DegenerateGeometryException("3 or more of the 4 historical image points are collinear");
            }
        } else {
            // without 4 points in general position the system is underdetermined
            if (PointSetGeometry.areCollinearExceptOne(p, indexes)) {
                throw new DegenerateGeometryException(
                        "at least " + (indexes.length - 1) + " of the " + indexes.length +
                        " modern image points are collinear");
            }
            if (PointSetGeometry.areCollinearExceptOne(q, indexes)) {
                throw new DegenerateGeometryException(
                        "at least " + (indexes.length - 1) + " of the " + indexes.length +
                        " historical image points are collinear");
            }
        }
    }

    /**
     * Normalized direct linear transform over the specified pairs.
     */
    HomographyTransform fit(final int[] indexes)
            throws DegenerateGeometryException, SingularSystemException {

        final PointNormalization sourceNormalization = PointNormalization.forPoints(p, indexes);
        final PointNormalization targetNormalization = PointNormalization.forPoints(q, indexes);

        // pad to at least 9 rows so minimal sets decompose the same way as over-determined ones
        final int rows = Math.max(2 * indexes.length, 9);
        final DMatrixRMaj design = new DMatrixRMaj(rows, 9);

        int row = 0;
        for (final int i : indexes) {
            final double x = sourceNormalization.normalizeX(p[0][i]);
            final double y = sourceNormalization.normalizeY(p[1][i]);
            final double u = targetNormalization.normalizeX(q[0][i]);
            final double v = targetNormalization.normalizeY(q[1][i]);

            design.set(row, 0, -x);
            design.set(row, 1, -y);
            design.set(row, 2, -1.0);
            design.set(row, 6, u * x);
            design.set(row, 7, u * y);
            design.set(row, 8, u);
            row++;

            design.set(row, 3, -x);
            design.set(row, 4, -y);
            design.set(row, 5, -1.0);
            design.set(row, 6, v * x);
            design.set(row, 7, v * y);
            design.set(row, 8, v);
            row++;
        }

        final SingularValueDecomposition_F64<DMatrixRMaj> svd =
                DecompositionFactory_DDRM.svd(rows, 9, false, true, true);
        if (! svd.decompose(design)) {
            throw new SingularSystemException("singular value decomposition failed for " + indexes.length + " pairs");
        }

        final DMatrixRMaj w = svd.getW(null);
        final DMatrixRMaj v = svd.getV(null, false);
        SingularOps_DDRM.descendingOrder(null, false, w, v, false);

        // the solution is the null vector, so the system is only well posed if the next smallest
        // singular value is clearly separated from zero
        final double largest = w.get(0, 0);
        final double secondSmallest = w.get(7, 7);
        final double conditionNumber = largest / secondSmallest;
        if (! (conditionNumber < maxConditionNumber)) {
            throw new SingularSystemException(
                    "homography system for " + indexes.length + " pairs is ill-conditioned (condition number " +
                    conditionNumber + ")");
        }

        final DMatrixRMaj normalizedHomography = new DMatrixRMaj(3, 3);
        for (int k = 0; k < 9; k++) {
            normalizedHomography.set(k / 3, k % 3, v.get(k, 8));
        }

        // H = T_q^-1 * H_n * T_p
        final DMatrixRMaj tmp = new DMatrixRMaj(3, 3);
        final DMatrixRMaj homography = new DMatrixRMaj(3, 3);
        CommonOps_DDRM.mult(normalizedHomography, sourceNormalization.toMatrix(), tmp);
        CommonOps_DDRM.mult(targetNormalization.toInverseMatrix(), tmp, homography);

        return HomographyTransform.fromMatrix(homography);
    }

    private int[] findInliers(final int[] allIndexes)
            throws TransformFitException {

        final Random random = new Random(ransacSeed);
        final int n = allIndexes.length;

        int[] bestInliers = null;
        double bestError = Double.MAX_VALUE;
        int degenerateSampleCount = 0;

        for (int iteration = 0; iteration < ransacIterations; iteration++) {

            final int[] sample = sampleDistinct(random, n, 4);
            if (PointSetGeometry.hasCollinearTriple(p, sample) || PointSetGeometry.hasCollinearTriple(q, sample)) {
                degenerateSampleCount++;
                continue;
            }

            final HomographyTransform candidate;
            try {
                candidate = fit(sample);
            } catch (final TransformFitException e) {
                degenerateSampleCount++;
                continue;
            }

            final int[] inliers = new int[n];
            int inlierCount = 0;
            double inlierError = 0.0;
            for (int i = 0; i < n; i++) {
                final double residual = residual(candidate, i);
                if (residual <= ransacThreshold) {
                    inliers[inlierCount++] = i;
                    inlierError += residual;
                }
            }

            if ((bestInliers == null) || (inlierCount > bestInliers.length) ||
                ((inlierCount == bestInliers.length) && (inlierError < bestError))) {
                bestInliers = Arrays.copyOf(inliers, inlierCount);
                bestError = inlierError;
                if (inlierCount == n) {
                    break;
                }
            }
        }

        if ((bestInliers == null) || (bestInliers.length < 4)) {
            throw new DegenerateGeometryException(
                    "no consensus found for " + n + " pairs after " + ransacIterations + " iterations (" +
                    degenerateSampleCount + " degenerate samples)");
        }

        LOG.info("findInliers: {} of {} pairs are within {} pixels, skipped {} degenerate samples",
                 bestInliers.length, n, ransacThreshold, degenerateSampleCount);

        return bestInliers;
    }

    private static int[] sampleDistinct(final Random random,
                                        final int n,
                                        final int count) {
        final int[] sample = new int[count];
        int filled = 0;
        while (filled < count) {
            final int candidate = random.nextInt(n);
            boolean isNew = true;
            for (int i = 0; i < filled; i++) {
                if (sample[i] == candidate) {
                    isNew = false;
                    break;
                }
            }
            if (isNew) {
                sample[filled++] = candidate;
            }
        }
        return sample;
    }

    private double residual(final HomographyTransform homography,
                            final int i) {
        final double[] mapped = homography.apply(new double[] { p[0][i], p[1][i] });
        final double residual = Math.hypot(mapped[0] - q[0][i], mapped[1] - q[1][i]);
        return Double.isNaN(residual) ? Double.MAX_VALUE : residual;
    }

    private double maxResidual(final HomographyTransform homography,
                               final int[] indexes) {
        double max = 0.0;
        for (final int i : indexes) {
            max = Math.max(max, residual(homography, i));
        }
        return max;
    }

    private static final Logger LOG = LoggerFactory.getLogger(HomographyBuilder.class);
}
