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

/**
 * Supported correspondence shapes along with the number of points each shape pairs per image.
 */
public enum CorrespondenceKind {

    POINT(1),

    /** Directional line, start then end. */
    LINE(2),

    /** Planar quad with corners ordered top-left, top-right, bottom-right, bottom-left. */
    FACE(4);

    private final int pointCount;

    CorrespondenceKind(final int pointCount) {
        this.pointCount = pointCount;
    }

    public int getPointCount() {
        return pointCount;
    }

}
