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

/**
 * Failure codes reported by transform fitting and warping.
 */
public enum AlignmentError {

    /** Fewer point pairs than the transform family requires. */
    INSUFFICIENT_CORRESPONDENCES,

    /** Collinear or otherwise degenerate point configuration for the transform family. */
    DEGENERATE_GEOMETRY,

    /** Ill-conditioned or singular linear system. */
    SINGULAR_SYSTEM

}
