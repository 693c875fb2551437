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

import org.rephoto.alignment.correspondence.ImagePoint;

/**
 * Coordinate transform fitted from point correspondences.
 * Fitted instances map modern image (B) coordinates to historical image (A) coordinates.
 */
public interface WarpTransform extends Serializable {

    TransformMode getMode();

    /**
     * Transforms the specified location in place.
     *
     * @param  location  two element (x, y) array.
     */
    void applyInPlace(final double[] location);

    /**
     * @return transformed copy of the specified (x, y) location.
     */
    default double[] apply(final double[] location) {
        final double[] transformed = location.clone();
        applyInPlace(transformed);
        return transformed;
    }

    default ImagePoint apply(final ImagePoint point) {
        final double[] location = point.toArray();
        applyInPlace(location);
        return new ImagePoint(location[0], location[1]);
    }

    /**
     * Batch evaluates the integer pixel locations (x, y) for x in [0, width) of one row.
     *
     * @param  y     row coordinate.
     * @param  xOut  receives the transformed x coordinate of each pixel in the row.
     * @param  yOut  receives the transformed y coordinate of each pixel in the row.
     */
    void applyToRow(final int y,
                    final double[] xOut,
                    final double[] yOut);

    /**
     * @return a transform mapping in the opposite direction.
     *
     * @throws TransformFitException
     *   if the inverse cannot be derived.
     */
    WarpTransform createInverse()
            throws TransformFitException;

    /**
     * @return whitespace separated parameter string suitable for logging or persistence.
     */
    String toDataString();

}
