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

import java.io.Serializable;

import org.ejml.data.DMatrixRMaj;

/**
 * Similarity that moves the centroid of a point set to the origin and scales it so the
 * average distance from the origin is sqrt(2).  Conditions the linear systems built from
 * pixel coordinates that are typically in the thousands.
 */
public class PointNormalization implements Serializable {

    private final double centerX;
    private final double centerY;
    private final double scale;

    public PointNormalization(final double centerX,
                              final double centerY,
                              final double scale) {
        this.centerX = centerX;
        this.centerY = centerY;
        this.scale = scale;
    }

    /**
     * @param  points     points as { xValues, yValues }.
     * @param  indexes    indexes of the points to consider.
     *
     * @return normalization for the specified points.
     *
     * @throws DegenerateGeometryException
     *   if all points coincide.
     */
    public static PointNormalization forPoints(final double[][] points,
                                               final int[] indexes)
            throws DegenerateGeometryException {

        double sumX = 0.0;
        double sumY = 0.0;
        for (final int i : indexes) {
            sumX += points[0][i];
            sumY += points[1][i];
        }
        final double centerX = sumX / indexes.length;
        final double centerY = sumY / indexes.length;

        double sumDistance = 0.0;
        for (final int i : indexes) {
            sumDistance += Math.hypot(points[0][i] - centerX, points[1][i] - centerY);
        }
        final double meanDistance = sumDistance / indexes.length;

        if (! (meanDistance > 0.0)) {
            throw new DegenerateGeometryException("all " + indexes.length + " points coincide at (" +
                                                  centerX + ", " + centerY + ")");
        }

        return new PointNormalization(centerX, centerY, Math.sqrt(2.0) / meanDistance);
    }

    public static PointNormalization forPoints(final double[][] points)
            throws DegenerateGeometryException {
        return forPoints(points, allIndexes(points[0].length));
    }

    public static int[] allIndexes(final int count) {
        final int[] indexes = new int[count];
        for (int i = 0; i < count; i++) {
            indexes[i] = i;
        }
        return indexes;
    }

    public double normalizeX(final double x) {
        return (x - centerX) * scale;
    }

    public double normalizeY(final double y) {
        return (y - centerY) * scale;
    }

    /**
     * @return 3x3 homogeneous matrix for this normalization.
     */
    public DMatrixRMaj toMatrix() {
        return new DMatrixRMaj(3, 3, true,
                               scale, 0.0, -scale * centerX,
                               0.0, scale, -scale * centerY,
                               0.0, 0.0, 1.0);
    }

    /**
     * @return 3x3 homogeneous matrix for the inverse of this normalization.
     */
    public DMatrixRMaj toInverseMatrix() {
        return new DMatrixRMaj(3, 3, true,
                               1.0 / scale, 0.0, centerX,
                               0.0, 1.0 / scale, centerY,
                               0.0, 0.0, 1.0);
    }

    @Override
    public String toString() {
        return "{center: (" + centerX + ", " + centerY + "), scale: " + scale + '}';
    }
}
