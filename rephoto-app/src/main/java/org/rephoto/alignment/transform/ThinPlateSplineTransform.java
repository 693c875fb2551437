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
package org.rephoto.alignment.transform;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin plate spline with kernel U(r) = r^2 log(r).
 * <p>
 * Each output dimension is an affine part plus a weighted sum of kernel terms centered at the
 * source landmarks:
 * <pre>
 *   f(p) = a0 + a1 x + a2 y + sum_i w_i U(|p - c_i|)
 * </pre>
 * Landmarks are normalized (see {@link PointNormalization}) before the system is built, so all
 * coefficients are expressed in normalized source coordinates.  The spline is invariant to that
 * similarity, so the fitted mapping is the same one a raw pixel fit would produce.
 * </p>
 */
public class ThinPlateSplineTransform implements WarpTransform {

    /** Condition number of the (N+3) system above which a fit is rejected. */
    public static final double DEFAULT_MAX_CONDITION_NUMBER = 1e12;

    private final double[][] sourceLandmarks;
    private final double[][] targetLandmarks;
    private final double smoothing;
    private final double maxConditionNumber;

    private final PointNormalization normalization;
    private final double[] normalizedX;
    private final double[] normalizedY;
    private final double[][] kernelWeights;
    private final double[][] affine;

    private ThinPlateSplineTransform(final double[][] sourceLandmarks,
                                     final double[][] targetLandmarks,
                                     final double smoothing,
                                     final double maxConditionNumber,
                                     final PointNormalization normalization,
                                     final double[] normalizedX,
                                     final double[] normalizedY,
                                     final double[][] kernelWeights,
                                     final double[][] affine) {
        this.sourceLandmarks = sourceLandmarks;
        this.targetLandmarks = targetLandmarks;
        this.smoothing = smoothing;
        this.maxConditionNumber = maxConditionNumber;
        this.normalization = normalization;
        this.normalizedX = normalizedX;
        this.normalizedY = normalizedY;
        this.kernelWeights = kernelWeights;
        this.affine = affine;
    }

    /**
     * Solves the spline that maps each source landmark to its target landmark.
     *
     * @param  sourceLandmarks     source points as { xValues, yValues }.
     * @param  targetLandmarks     target points as { xValues, yValues }.
     * @param  smoothing           regularization added to the kernel diagonal (0 for exact interpolation).
     * @param  maxConditionNumber  condition number above which the system is considered singular.
     *
     * @return the solved spline.
     *
     * @throws DegenerateGeometryException
     *   if all source landmarks coincide.
     *
     * @throws SingularSystemException
     *   if the linear system is singular or ill-conditioned.
     */
    public static ThinPlateSplineTransform fit(final double[][] sourceLandmarks,
                                               final double[][] targetLandmarks,
                                               final double smoothing,
                                               final double maxConditionNumber)
            throws DegenerateGeometryException, SingularSystemException {

        final int n = sourceLandmarks[0].length;
        final int size = n + 3;

        final PointNormalization normalization = PointNormalization.forPoints(sourceLandmarks);
        final double[] normalizedX = new double[n];
        final double[] normalizedY = new double[n];
        for (int i = 0; i < n; i++) {
            normalizedX[i] = normalization.normalizeX(sourceLandmarks[0][i]);
            normalizedY[i] = normalization.normalizeY(sourceLandmarks[1][i]);
        }

        // L = | K + lambda I   P |
        //     | P^T            0 |
        final DMatrixRMaj l = new DMatrixRMaj(size, size);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                final double dx = normalizedX[i] - normalizedX[j];
                final double dy = normalizedY[i] - normalizedY[j];
                final double u = kernel(dx * dx + dy * dy);
                l.set(i, j, u);
                l.set(j, i, u);
            }
            l.set(i, i, smoothing);
            l.set(i, n, 1.0);
            l.set(i, n + 1, normalizedX[i]);
            l.set(i, n + 2, normalizedY[i]);
            l.set(n, i, 1.0);
            l.set(n + 1, i, normalizedX[i]);
            l.set(n + 2, i, normalizedY[i]);
        }

        final DMatrixRMaj values = new DMatrixRMaj(size, 2);
        for (int i = 0; i < n; i++) {
            values.set(i, 0, targetLandmarks[0][i]);
            values.set(i, 1, targetLandmarks[1][i]);
        }

        final double conditionNumber = NormOps_DDRM.conditionP2(l.copy());
        if (! (conditionNumber < maxConditionNumber)) {
            throw new SingularSystemException(
                    "thin plate spline system for " + n + " landmarks is ill-conditioned (condition number " +
                    conditionNumber + "), landmarks may be duplicated or collinear");
        }

        final LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.lu(size);
        if (! solver.setA(l)) {
            throw new SingularSystemException("thin plate spline system for " + n + " landmarks is singular");
        }

        final DMatrixRMaj coefficients = new DMatrixRMaj(size, 2);
        solver.solve(values, coefficients);

        if (MatrixFeatures_DDRM.hasUncountable(coefficients)) {
            throw new SingularSystemException("thin plate spline solution for " + n +
                                              " landmarks contains NaN or infinite coefficients");
        }

        final double[][] kernelWeights = new double[2][n];
        final double[][] affine = new double[2][3];
        for (int d = 0; d < 2; d++) {
            for (int i = 0; i < n; i++) {
                kernelWeights[d][i] = coefficients.get(i, d);
            }
            for (int k = 0; k < 3; k++) {
                affine[d][k] = coefficients.get(n + k, d);
            }
        }

        LOG.debug("fit: solved {} landmarks with smoothing {}, condition number {}", n, smoothing, conditionNumber);

        return new ThinPlateSplineTransform(copy(sourceLandmarks), copy(targetLandmarks), smoothing, maxConditionNumber,
                                            normalization, normalizedX, normalizedY, kernelWeights, affine);
    }

    /**
     * @return U(r) = r^2 log(r) evaluated from the squared distance (0.5 r^2 log(r^2)), with U(0) = 0.
     */
    static double kernel(final double squaredDistance) {
        return squaredDistance > 0.0 ? 0.5 * squaredDistance * Math.log(squaredDistance) : 0.0;
    }

    @Override
    public TransformMode getMode() {
        return TransformMode.THIN_PLATE_SPLINE;
    }

    public int getNumberOfLandmarks() {
        return normalizedX.length;
    }

    public double getSmoothing() {
        return smoothing;
    }

    public double[][] getSourceLandmarks() {
        return copy(sourceLandmarks);
    }

    public double[][] getTargetLandmarks() {
        return copy(targetLandmarks);
    }

    @Override
    public void applyInPlace(final double[] location) {
        final double x = normalization.normalizeX(location[0]);
        final double y = normalization.normalizeY(location[1]);
        location[0] = evaluate(0, x, y);
        location[1] = evaluate(1, x, y);
    }

    @Override
    public void applyToRow(final int y,
                           final double[] xOut,
                           final double[] yOut) {

        final int n = normalizedX.length;
        final double[] wx = kernelWeights[0];
        final double[] wy = kernelWeights[1];
        final double[] ax = affine[0];
        final double[] ay = affine[1];

        final double ny = normalization.normalizeY(y);

        // squared y distances are shared by every pixel in the row
        final double[] dy2 = new double[n];
        for (int i = 0; i < n; i++) {
            final double dy = ny - normalizedY[i];
            dy2[i] = dy * dy;
        }

        for (int x = 0; x < xOut.length; x++) {
            final double nx = normalization.normalizeX(x);
            double sumX = ax[0] + ax[1] * nx + ax[2] * ny;
            double sumY = ay[0] + ay[1] * nx + ay[2] * ny;
            for (int i = 0; i < n; i++) {
                final double dx = nx - normalizedX[i];
                final double u = kernel(dx * dx + dy2[i]);
                sumX += wx[i] * u;
                sumY += wy[i] * u;
            }
            xOut[x] = sumX;
            yOut[x] = sumY;
        }
    }

    /**
     * A thin plate spline has no closed form inverse, so the inverse is a second spline
     * fitted with the landmark roles swapped.  It interpolates the landmarks exactly
     * (when smoothing is 0) and approximates the inverse between them.
     *
     * @throws TransformFitException
     *   if the swapped system cannot be solved (e.g. duplicated target landmarks).
     */
    @Override
    public ThinPlateSplineTransform createInverse()
            throws TransformFitException {
        return fit(targetLandmarks, sourceLandmarks, smoothing, maxConditionNumber);
    }

    @Override
    public String toDataString() {
        final StringBuilder sb = new StringBuilder(64 + normalizedX.length * 96);
        sb.append(normalizedX.length).append(' ').append(smoothing);
        for (int d = 0; d < 2; d++) {
            for (final double a : affine[d]) {
                sb.append(' ').append(a);
            }
        }
        for (int i = 0; i < normalizedX.length; i++) {
            sb.append(' ').append(sourceLandmarks[0][i]).append(' ').append(sourceLandmarks[1][i]);
            sb.append(' ').append(kernelWeights[0][i]).append(' ').append(kernelWeights[1][i]);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ThinPlateSplineTransform{landmarks: " + normalizedX.length + ", smoothing: " + smoothing +
               ", normalization: " + normalization + '}';
    }

    private double evaluate(final int dimension,
                            final double x,
                            final double y) {
        final double[] a = affine[dimension];
        final double[] w = kernelWeights[dimension];
        double sum = a[0] + a[1] * x + a[2] * y;
        for (int i = 0; i < normalizedX.length; i++) {
            final double dx = x - normalizedX[i];
            final double dy = y - normalizedY[i];
            sum += w[i] * kernel(dx * dx + dy * dy);
        }
        return sum;
    }

    private static double[][] copy(final double[][] points) {
        return new double[][] { points[0].clone(), points[1].clone() };
    }

    private static final Logger LOG = LoggerFactory.getLogger(ThinPlateSplineTransform.class);
}
