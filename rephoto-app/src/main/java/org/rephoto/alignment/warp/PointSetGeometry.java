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

/**
 * Collinearity tests for small point sets.
 * Tolerances are relative to the spread of the tested points so results do not depend on pixel scale.
 */
class PointSetGeometry {

    /** Relative tolerance used for collinearity tests. */
    static final double COLLINEAR_TOLERANCE = 1e-9;

    private PointSetGeometry() {
    }

    /**
     * @param  points   points as { xValues, yValues }.
     * @param  indexes  indexes of the points to test.
     *
     * @return true if the specified points all lie on one line (or all coincide).
     */
    static boolean areCollinear(final double[][] points,
                                final int[] indexes) {

        if (indexes.length < 3) {
            return true;
        }

        double meanX = 0.0;
        double meanY = 0.0;
        for (final int i : indexes) {
            meanX += points[0][i];
            meanY += points[1][i];
        }
        meanX /= indexes.length;
        meanY /= indexes.length;

        double sxx = 0.0;
        double sxy = 0.0;
        double syy = 0.0;
        for (final int i : indexes) {
            final double dx = points[0][i] - meanX;
            final double dy = points[1][i] - meanY;
            sxx += dx * dx;
            sxy += dx * dy;
            syy += dy * dy;
        }

        // eigenvalues of the 2x2 scatter matrix, collinear when the minor one vanishes
        final double trace = sxx + syy;
        if (trace == 0.0) {
            return true;
        }
        final double halfDifference = (sxx - syy) / 2.0;
        final double major = trace / 2.0 + Math.sqrt(halfDifference * halfDifference + sxy * sxy);
        final double minor = Math.max(0.0, (sxx * syy - sxy * sxy) / major);

        return minor <= COLLINEAR_TOLERANCE * major;
    }

    static boolean areCollinear(final double[][] points,
                                final int i,
                                final int j,
                                final int k) {
        return areCollinear(points, new int[] { i, j, k });
    }

    /**
     * @return true if any three of the indexed points are collinear.
     */
    static boolean hasCollinearTriple(final double[][] points,
                                      final int[] indexes) {
        for (int a = 0; a < indexes.length; a++) {
            for (int b = a + 1; b < indexes.length; b++) {
                for (int c = b + 1; c < indexes.length; c++) {
                    if (areCollinear(points, indexes[a], indexes[b], indexes[c])) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * A set of distinct points contains 4 points with no collinear triple unless all but one of them
     * lie on a single line.
     *
     * @return true if at most one of the indexed points lies off the line through the others.
     */
    static boolean areCollinearExceptOne(final double[][] points,
                                         final int[] indexes) {

        // at most one point is off the line, so it passes through 2 of any 3 distinct locations
        final int[] representatives = new int[3];
        int count = 0;
        for (int i = 0; (i < indexes.length) && (count < 3); i++) {
            boolean isDistinct = true;
            for (int r = 0; r < count; r++) {
                if (coincide(points, indexes[i], representatives[r])) {
                    isDistinct = false;
                    break;
                }
            }
            if (isDistinct) {
                representatives[count++] = indexes[i];
            }
        }

        if (count < 3) {
            return true;
        }

        for (int a = 0; a < 3; a++) {
            for (int b = a + 1; b < 3; b++) {
                if (countOffLine(points, indexes, representatives[a], representatives[b]) <= 1) {
                    return true;
                }
            }
        }

        return false;
    }

    private static int countOffLine(final double[][] points,
                                    final int[] indexes,
                                    final int lineStart,
                                    final int lineEnd) {
        int offLineCount = 0;
        for (final int k : indexes) {
            if ((k != lineStart) && (k != lineEnd) && (! areCollinear(points, lineStart, lineEnd, k))) {
                offLineCount++;
                if (offLineCount > 1) {
                    break;
                }
            }
        }
        return offLineCount;
    }

    private static boolean coincide(final double[][] points,
                                    final int i,
                                    final int j) {
        return (points[0][i] == points[0][j]) && (points[1][i] == points[1][j]);
    }

}
