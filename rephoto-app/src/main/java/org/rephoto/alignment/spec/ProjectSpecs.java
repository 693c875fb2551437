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

/**
 * Field validation shared by the persisted correspondence specs.
 */
class ProjectSpecs {

    static long checkId(final Long id,
                        final String kindName)
            throws ProjectFormatException {
        if (id == null) {
            throw new ProjectFormatException(kindName + " is missing its id");
        }
        if (id < 1) {
            throw new ProjectFormatException(kindName + " id " + id + " must be positive");
        }
        return id;
    }

    static ImagePoint toImagePoint(final Double x,
                                   final Double y,
                                   final String context)
            throws ProjectFormatException {
        if ((x == null) || (y == null)) {
            throw new ProjectFormatException(context + " is missing a coordinate");
        }
        if (Double.isNaN(x) || Double.isInfinite(x) || Double.isNaN(y) || Double.isInfinite(y)) {
            throw new ProjectFormatException(context + " has a non-finite coordinate");
        }
        return new ImagePoint(x, y);
    }

    static void checkKind(final Correspondence correspondence,
                          final CorrespondenceKind expectedKind)
            throws IllegalArgumentException {
        if (correspondence.getKind() != expectedKind) {
            throw new IllegalArgumentException("correspondence " + correspondence.getId() + " is a " +
                                               correspondence.getKind() + ", not a " + expectedKind);
        }
    }

    private ProjectSpecs() {
    }
}
