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

import org.rephoto.alignment.correspondence.Correspondence;
import org.rephoto.alignment.correspondence.CorrespondenceKind;
import org.rephoto.alignment.correspondence.ImagePoint;
import org.rephoto.alignment.correspondence.ImageSide;

/**
 * Persisted directional line correspondence (a0 to a1 corresponds to b0 to b1).
 */
public class LineSpec {

    private final Long id;
    private final Double ax0;
    private final Double ay0;
    private final Double ax1;
    private final Double ay1;
    private final Double bx0;
    private final Double by0;
    private final Double bx1;
    private final Double by1;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private LineSpec() {
        this.id = null;
        this.ax0 = null;
        this.ay0 = null;
        this.ax1 = null;
        this.ay1 = null;
        this.bx0 = null;
        this.by0 = null;
        this.bx1 = null;
        this.by1 = null;
    }

    public LineSpec(final Correspondence correspondence) {
        ProjectSpecs.checkKind(correspondence, CorrespondenceKind.LINE);
        final ImagePoint a0 = correspondence.getPoint(ImageSide.A, 0);
        final ImagePoint a1 = correspondence.getPoint(ImageSide.A, 1);
        final ImagePoint b0 = correspondence.getPoint(ImageSide.B, 0);
        final ImagePoint b1 = correspondence.getPoint(ImageSide.B, 1);
        this.id = correspondence.getId();
        this.ax0 = a0.getX();
        this.ay0 = a0.getY();
        this.ax1 = a1.getX();
        this.ay1 = a1.getY();
        this.bx0 = b0.getX();
        this.by0 = b0.getY();
        this.bx1 = b1.getX();
        this.by1 = b1.getY();
    }

    public Long getId() {
        return id;
    }

    public Correspondence toCorrespondence()
            throws ProjectFormatException {
        final String context = "line " + id;
        return Correspondence.line(ProjectSpecs.checkId(id, "line"),
                                   ProjectSpecs.toImagePoint(ax0, ay0, context + " a0"),
                                   ProjectSpecs.toImagePoint(ax1, ay1, context + " a1"),
                                   ProjectSpecs.toImagePoint(bx0, by0, context + " b0"),
                                   ProjectSpecs.toImagePoint(bx1, by1, context + " b1"));
    }
}
