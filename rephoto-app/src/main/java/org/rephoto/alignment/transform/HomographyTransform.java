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
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;

/**
 * 2D projective transform
 * <pre>
 *   x' = (m00 x + m01 y + m02) / (m20 x + m21 y + m22)
 *   y' = (m10 x + m11 y + m12) / (m20 x + m21 y + m22)
 * </pre>
 */
public class HomographyTransform implements WarpTransform {

    /** Matrix condition number above which a homography is treated as not invertible. */
    public static final double MAX_INVERTIBLE_CONDITION_NUMBER = 1e15;

    private final double m00, m01, m02;
    private final double m10, m11, m12;
    private final double m20, m21, m22;

    public HomographyTransform(final double m00, final double m01, final double m02,
                               final double m10, final double m11, final double m12,
                               final double m20, final double m21, final double m22) {
        this.m00 = m00;
        this.m01 = m01;
        this.m02 = m02;
        this.m10 = m10;
        this.m11 = m11;
        this.m12 = m12;
        this.m20 = m20;
        this.m21 = m21;
        this.m22 = m22;
    }

    /**
     * @return homography for the specified 3x3 matrix, scaled so that m22 is 1 when possible.
     */
    public static HomographyTransform fromMatrix(final DMatrixRMaj matrix) {
        double divisor = matrix.get(2, 2);
        if (Math.abs(divisor) < 1e-12) {
            divisor = CommonOps_DDRM.elementMaxAbs(matrix);
        }
        return new HomographyTransform(matrix.get(0, 0) / divisor, matrix.get(0, 1) / divisor, matrix.get(0, 2) / divisor,
                                       matrix.get(1, 0) / divisor, matrix.get(1, 1) / divisor, matrix.get(1, 2) / divisor,
                                       matrix.get(2, 0) / divisor, matrix.get(2, 1) / divisor, matrix.get(2, 2) / divisor);
    }

    public static HomographyTransform identity() {
        return new HomographyTransform(1, 0, 0,
                                       0, 1, 0,
                                       0, 0, 1);
    }

    @Override
    public TransformMode getMode() {
        return TransformMode.HOMOGRAPHY;
    }

    public DMatrixRMaj toMatrix() {
        return new DMatrixRMaj(3, 3, true,
                               m00, m01, m02,
                               m10, m11, m12,
                               m20, m21, m22);
    }

    /**
     * Points on the line at infinity (zero homogeneous coordinate) map to NaN.
     */
    @Override
    public void applyInPlace(final double[] location) {
        final double x = location[0];
        final double y = location[1];
        final double w = m20 * x + m21 * y + m22;
        if (w == 0.0) {
            location[0] = Double.NaN;
            location[1] = Double.NaN;
        } else {
            location[0] = (m00 * x + m01 * y + m02) / w;
            location[1] = (m10 * x + m11 * y + m12) / w;
        }
    }

    @Override
    public void applyToRow(final int y,
                           final double[] xOut,
                           final double[] yOut) {

        // row terms are constant, only the x terms change along the row
        double u = m01 * y + m02;
        double v = m11 * y + m12;
        double w = m21 * y + m22;
        for (int x = 0; x < xOut.length; x++) {
            if (w == 0.0) {
                xOut[x] = Double.NaN;
                yOut[x] = Double.NaN;
            } else {
                xOut[x] = u / w;
                yOut[x] = v / w;
            }
            u += m00;
            v += m10;
            w += m20;
        }
    }

    /**
     * @return the exact matrix inverse of this homography.
     *
     * @throws SingularSystemException
     *   if this homography's matrix is singular.
     */
    @Override
    public HomographyTransform createInverse()
            throws SingularSystemException {

        final DMatrixRMaj matrix = toMatrix();
        final double conditionNumber = NormOps_DDRM.conditionP2(matrix.copy());
        if (! (conditionNumber < MAX_INVERTIBLE_CONDITION_NUMBER)) {
            throw new SingularSystemException("homography " + toDataString() + " is not invertible, condition number is " +
                                              conditionNumber);
        }

        final DMatrixRMaj inverse = new DMatrixRMaj(3, 3);
        if ((! CommonOps_DDRM.invert(matrix, inverse)) || MatrixFeatures_DDRM.hasUncountable(inverse)) {
            throw new SingularSystemException("failed to invert homography " + toDataString());
        }

        return fromMatrix(inverse);
    }

    @Override
    public String toDataString() {
        return m00 + " " + m01 + " " + m02 + " " +
               m10 + " " + m11 + " " + m12 + " " +
               m20 + " " + m21 + " " + m22;
    }

    @Override
    public String toString() {
        return "HomographyTransform{" + toDataString() + '}';
    }
}
