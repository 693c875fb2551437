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
 * Ways of comparing the historical image with the warped modern image.
 */
public enum CompositeMode {

    /** Split reveal: one side of the split shows the warped image, the other the historical image. */
    SLIDER,

    /** Linear alpha blend of the warped image over the historical image. */
    GHOST,

    /** Per-channel absolute difference. */
    DIFF

}
