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
package org.rephoto.alignment.spec;

import java.util.ArrayList;
import java.util.List;

import org.rephoto.alignment.correspondence.Correspondence;
import org.rephoto.alignment.correspondence.CorrespondenceKind;
import org.rephoto.alignment.correspondence.ImagePoint;
import org.rephoto.alignment.correspondence.ImageSide;

/**
 * Persisted planar quad correspondence with corners listed in the same order for both images.
 */
public class FaceSpec {

    private final Long id;
    private final List<CornerSpec> cornersA;
    private final List<CornerSpec> cornersB;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FaceSpec() {
        this.id = null;
        this.cornersA = null;
        this.cornersB = null;
    }

    public FaceSpec(final Correspondence correspondence) {
        ProjectSpecs.checkKind(correspondence, CorrespondenceKind.FACE);
        this.id = correspondence.getId();
        this.cornersA = toCornerSpecs(correspondence.getPoints(ImageSide.A));
        this.cornersB = toCornerSpecs(correspondence.getPoints(ImageSide.B));
    }

    public Long getId() {
        return id;
    }

    public Correspondence toCorrespondence()
            throws ProjectFormatException {
        final long checkedId = ProjectSpecs.checkId(id, "face");
        return Correspondence.face(checkedId,
                                   toImagePoints(cornersA, "face " + checkedId + " cornersA"),
                                   toImagePoints(cornersB, "face " + checkedId + " cornersB"));
    }

    private static List<CornerSpec> toCornerSpecs(final List<ImagePoint> points) {
        final List<CornerSpec> corners = new ArrayList<>(points.size());
        for (final ImagePoint point : points) {
            corners.add(new CornerSpec(point));
        }
        return corners;
    }

    private static ImagePoint[] toImagePoints(final List<CornerSpec> corners,
                                              final String context)
            throws ProjectFormatException {

        final int expectedCount = CorrespondenceKind.FACE.getPointCount();
        if ((corners == null) || (corners.size() != expectedCount)) {
            throw new ProjectFormatException(context + " must contain exactly " + expectedCount + " corners");
        }

        final ImagePoint[] points = new ImagePoint[corners.size()];
        for (int i = 0; i < points.length; i++) {
            final CornerSpec corner = corners.get(i);
            if (corner == null) {
                throw new ProjectFormatException(context + " corner " + i + " is missing");
            }
            points[i] = corner.toImagePoint(context + " corner " + i);
        }
        return points;
    }
}
