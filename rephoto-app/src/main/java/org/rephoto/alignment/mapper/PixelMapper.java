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
package org.rephoto.alignment.mapper;

/**
 * Copies pixels from a source image to a target canvas for inverse mapped coordinates.
 */
public interface PixelMapper {

    /**
     * @return width of the mapped target.
     */
    int getTargetWidth();

    /**
     * @return height of the mapped target.
     */
    int getTargetHeight();

    /**
     * @return true if the {@link #mapInterpolated} method should be used for mapping;
     *         false if the {@link #map} method should be used for mapping.
     */
    boolean isMappingInterpolated();

    /**
     * Maps the value of the source pixel nearest to (sourceX, sourceY) to pixel (targetX, targetY).
     *
     * @param  sourceX  source x coordinate.
     * @param  sourceY  source y coordinate.
     * @param  targetX  target x coordinate.
     * @param  targetY  target y coordinate.
     */
    void map(final double sourceX,
             final double sourceY,
             final int targetX,
             final int targetY);

    /**
     * Maps the value at real coordinates (sourceX, sourceY) to pixel (targetX, targetY)
     * using bi-linear interpolation.
     *
     * @param  sourceX  source x coordinate.
     * @param  sourceY  source y coordinate.
     * @param  targetX  target x coordinate.
     * @param  targetY  target y coordinate.
     */
    void mapInterpolated(final double sourceX,
                         final double sourceY,
                         final int targetX,
                         final int targetY);

}
