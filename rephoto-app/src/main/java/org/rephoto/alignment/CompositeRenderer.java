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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders comparison images from the historical image (A) and the warped modern image (B).
 * <p>
 * Both inputs must have the same dimensions.  Neither input is modified; a new ARGB image is always returned.
 * Warped pixels with zero alpha (outside of the modern image) contribute nothing:
 * slider and ghost show A there and diff shows black.
 * </p>
 */
public class CompositeRenderer {

    /**
     * @throws IllegalArgumentException
     *   if the images do not have the same dimensions.
     */
    public BufferedImage composite(final BufferedImage imageA,
                                   final BufferedImage warpedB,
                                   final CompositeMode mode,
                                   final CompositeParameters parameters)
            throws IllegalArgumentException {

        if ((imageA.getWidth() != warpedB.getWidth()) || (imageA.getHeight() != warpedB.getHeight())) {
            throw new IllegalArgumentException(
                    "composite images must have the same size but A is " + imageA.getWidth() + "x" +
                    imageA.getHeight() + " and warped B is " + warpedB.getWidth() + "x" + warpedB.getHeight());
        }

        LOG.debug("composite: entry, mode={}, parameters={}", mode, parameters);

        final int width = imageA.getWidth();
        final int height = imageA.getHeight();
        final int[] aPixels = Utils.getArgbPixels(Utils.toArgb(imageA));
        final int[] bPixels = Utils.getArgbPixels(Utils.toArgb(warpedB));

        final BufferedImage result = Utils.newArgbImage(width, height);
        final int[] resultPixels = Utils.getArgbPixels(result);

        switch (mode) {
            case SLIDER:
                slider(aPixels, bPixels, resultPixels, width, height, parameters);
                break;
            case GHOST:
                ghost(aPixels, bPixels, resultPixels, parameters.getAlpha());
                break;
            case DIFF:
                diff(aPixels, bPixels, resultPixels, parameters.getThreshold(), parameters.isFalseColor());
                break;
            default:
                throw new IllegalArgumentException("unsupported composite mode " + mode);
        }

        return result;
    }

    /**
     * Columns (or rows when vertical) with index below round(position * size) show B, the rest show A.
     */
    static void slider(final int[] aPixels,
                       final int[] bPixels,
                       final int[] resultPixels,
                       final int width,
                       final int height,
                       final CompositeParameters parameters) {

        final boolean vertical = parameters.isVertical();
        final int split = (int) Math.round(parameters.getPosition() * (vertical ? height : width));

        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++, i++) {
                final boolean showB = vertical ? (y < split) : (x < split);
                if (showB && (alphaOf(bPixels[i]) != 0)) {
                    resultPixels[i] = bPixels[i];
                } else {
                    resultPixels[i] = aPixels[i];
                }
            }
        }
    }

    /**
     * result = (1 - a) * A + a * B for every channel, where a is alpha scaled by the B pixel's own alpha.
     */
    static void ghost(final int[] aPixels,
                      final int[] bPixels,
                      final int[] resultPixels,
                      final double alpha) {

        for (int i = 0; i < aPixels.length; i++) {
            final int a = aPixels[i];
            final int b = bPixels[i];
            final double weight = alpha * alphaOf(b) / 255.0;
            if (weight == 0.0) {
                resultPixels[i] = a;
            } else if (weight == 1.0) {
                resultPixels[i] = b;
            } else {
                resultPixels[i] = (blend(a >>> 24, b >>> 24, weight) << 24) |
                                  (blend((a >> 16) & 0xff, (b >> 16) & 0xff, weight) << 16) |
                                  (blend((a >> 8) & 0xff, (b >> 8) & 0xff, weight) << 8) |
                                  blend(a & 0xff, b & 0xff, weight);
            }
        }
    }

    /**
     * Writes opaque |A - B| per color channel.  Pixels whose largest channel difference is below the threshold
     * are black.  With false color, the mean channel difference is rendered with {@link #heatColor}.
     */
    static void diff(final int[] aPixels,
                     final int[] bPixels,
                     final int[] resultPixels,
                     final int threshold,
                     final boolean falseColor) {

        for (int i = 0; i < aPixels.length; i++) {
            final int a = aPixels[i];
            final int b = bPixels[i];

            if (alphaOf(b) == 0) {
                resultPixels[i] = OPAQUE_BLACK;
                continue;
            }

            final int dr = Math.abs(((a >> 16) & 0xff) - ((b >> 16) & 0xff));
            final int dg = Math.abs(((a >> 8) & 0xff) - ((b >> 8) & 0xff));
            final int db = Math.abs((a & 0xff) - (b & 0xff));

            if (Math.max(dr, Math.max(dg, db)) < threshold) {
                resultPixels[i] = OPAQUE_BLACK;
            } else if (falseColor) {
                resultPixels[i] = heatColor((dr + dg + db) / 3);
            } else {
                resultPixels[i] = OPAQUE_BLACK | (dr << 16) | (dg << 8) | db;
            }
        }
    }

    /**
     * Black to red to yellow to white ramp for a 0-255 magnitude.
     */
    static int heatColor(final int magnitude) {
        final int scaled = Math.min(765, Math.max(0, magnitude) * 3);
        final int r = Math.min(255, scaled);
        final int g = Math.min(255, Math.max(0, scaled - 255));
        final int b = Math.max(0, scaled - 510);
        return OPAQUE_BLACK | (r << 16) | (g << 8) | b;
    }

    private static int alphaOf(final int argb) {
        return argb >>> 24;
    }

    private static int blend(final int a,
                             final int b,
                             final double weight) {
        return (int) Math.round((1.0 - weight) * a + weight * b);
    }

    private static final int OPAQUE_BLACK = 0xff000000;

    private static final Logger LOG = LoggerFactory.getLogger(CompositeRenderer.class);
}
