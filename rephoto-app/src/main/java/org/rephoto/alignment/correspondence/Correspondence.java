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
package org.rephoto.alignment.correspondence;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable pairing of a point, line or face between the historical (A) and modern (B) images.
 * Every shape is expressed as two equally sized, equally ordered point lists so that the
 * solver only ever needs {@link #flattenToPointPairs()}.
 */
public class Correspondence implements Serializable {

    private final long id;
    private final CorrespondenceKind kind;
    private final List<ImagePoint> aPoints;
    private final List<ImagePoint> bPoints;

    /**
     * @throws InvalidShapeException
     *   if either point list does not match the size required by the kind.
     */
    public Correspondence(final long id,
                          final CorrespondenceKind kind,
                          final List<ImagePoint> aPoints,
                          final List<ImagePoint> bPoints)
            throws InvalidShapeException {
        if (kind == null) {
            throw new InvalidShapeException("correspondence " + id + " is missing a kind");
        }
        this.id = id;
        this.kind = kind;
        this.aPoints = copyOf(aPoints);
        this.bPoints = copyOf(bPoints);
        validateShape();
    }

    public static Correspondence point(final long id,
                                       final ImagePoint a,
                                       final ImagePoint b) {
        return new Correspondence(id, CorrespondenceKind.POINT, Collections.singletonList(a), Collections.singletonList(b));
    }

    public static Correspondence line(final long id,
                                      final ImagePoint a0,
                                      final ImagePoint a1,
                                      final ImagePoint b0,
                                      final ImagePoint b1) {
        return new Correspondence(id, CorrespondenceKind.LINE, Arrays.asList(a0, a1), Arrays.asList(b0, b1));
    }

    public static Correspondence face(final long id,
                                      final ImagePoint[] cornersA,
                                      final ImagePoint[] cornersB) {
        if ((cornersA == null) || (cornersB == null)) {
            throw new InvalidShapeException("face " + id + " must specify corners for both images");
        }
        return new Correspondence(id, CorrespondenceKind.FACE, Arrays.asList(cornersA), Arrays.asList(cornersB));
    }

    public long getId() {
        return id;
    }

    public CorrespondenceKind getKind() {
        return kind;
    }

    public List<ImagePoint> getPoints(final ImageSide side) {
        return side == ImageSide.A ? aPoints : bPoints;
    }

    public ImagePoint getPoint(final ImageSide side,
                               final int index) {
        return getPoints(side).get(index);
    }

    /**
     * @throws InvalidShapeException
     *   if the point lists do not have the cardinality required by this correspondence's kind.
     */
    public void validateShape()
            throws InvalidShapeException {
        final int expected = kind.getPointCount();
        if ((aPoints.size() != expected) || (bPoints.size() != expected)) {
            throw new InvalidShapeException(
                    kind + " correspondence " + id + " requires " + expected + " points per image but has " +
                    aPoints.size() + " A points and " + bPoints.size() + " B points");
        }
    }

    /**
     * @return ordered point pairs for this correspondence
     *         (1 for a point, start and end for a line, 4 corners in order for a face).
     */
    public List<PointPair> flattenToPointPairs() {
        final List<PointPair> pairs = new ArrayList<>(aPoints.size());
        for (int i = 0; i < aPoints.size(); i++) {
            pairs.add(new PointPair(aPoints.get(i), bPoints.get(i)));
        }
        return pairs;
    }

    /**
     * @return copy of this correspondence with the specified point replaced.
     *
     * @throws InvalidShapeException
     *   if the index is out of range for this correspondence's kind.
     */
    public Correspondence withPoint(final ImageSide side,
                                    final int index,
                                    final ImagePoint newPoint)
            throws InvalidShapeException {

        if ((index < 0) || (index >= kind.getPointCount())) {
            throw new InvalidShapeException("index " + index + " is out of range for " + kind +
                                            " correspondence " + id);
        }

        final List<ImagePoint> updatedA = new ArrayList<>(aPoints);
        final List<ImagePoint> updatedB = new ArrayList<>(bPoints);
        if (side == ImageSide.A) {
            updatedA.set(index, newPoint);
        } else {
            updatedB.set(index, newPoint);
        }
        return new Correspondence(id, kind, updatedA, updatedB);
    }

    @Override
    public String toString() {
        return kind + " " + id + ": " + aPoints + " <- " + bPoints;
    }

    private static List<ImagePoint> copyOf(final List<ImagePoint> points)
            throws InvalidShapeException {
        if (points == null) {
            return Collections.emptyList();
        }
        for (final ImagePoint point : points) {
            if (point == null) {
                throw new InvalidShapeException("correspondence points may not be null");
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(points));
    }

}
