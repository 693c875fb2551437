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
package org.rephoto.alignment;

/**
 * Progress of an alignment session.
 * <pre>
 *   EMPTY -> IMAGES_LOADED -> (CORRESPONDENCES_INSUFFICIENT <-> CORRESPONDENCES_SUFFICIENT)
 *         -> TRANSFORM_COMPUTED -> WARPED -> COMPOSITED
 * </pre>
 * Any correspondence mutation returns to one of the correspondence states and loading images returns to EMPTY.
 */
public enum SessionState {

    EMPTY,
    IMAGES_LOADED,
    CORRESPONDENCES_INSUFFICIENT,
    CORRESPONDENCES_SUFFICIENT,
    TRANSFORM_COMPUTED,
    WARPED,
    COMPOSITED;

    public boolean hasImages() {
        return this != EMPTY;
    }

    /**
     * @return the correspondence state for the specified number of point pairs.
     */
    public static SessionState forPointPairCount(final int numberOfPointPairs,
                                                 final int minimumPointPairs) {
        return numberOfPointPairs < minimumPointPairs ? CORRESPONDENCES_INSUFFICIENT : CORRESPONDENCES_SUFFICIENT;
    }

}
