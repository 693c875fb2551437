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

import java.awt.image.BufferedImage;

import org.rephoto.alignment.transform.AlignmentError;
import org.rephoto.alignment.transform.TransformFitException;

/**
 * Outcome of warping an image: either the warped image or the reason warping was not possible.
 */
public class WarpResult {

    private final BufferedImage image;
    private final AlignmentError error;
    private final String errorMessage;

    private WarpResult(final BufferedImage image,
                       final AlignmentError error,
                       final String errorMessage) {
        this.image = image;
        this.error = error;
        this.errorMessage = errorMessage;
    }

    public static WarpResult success(final BufferedImage image) {
        return new WarpResult(image, null, null);
    }

    public static WarpResult failure(final TransformFitException cause) {
        return new WarpResult(null, cause.getError(), cause.getMessage());
    }

    public boolean isSuccessful() {
        return image != null;
    }

    public BufferedImage getImage() {
        return image;
    }

    public AlignmentError getError() {
        return error;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccessful() ?
               "{image: " + image.getWidth() + "x" + image.getHeight() + '}' :
               "{error: " + error + ", message: '" + errorMessage + "'}";
    }
}
