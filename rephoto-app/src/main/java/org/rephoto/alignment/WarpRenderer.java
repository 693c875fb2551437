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

import org.rephoto.alignment.mapper.ArgbPixelMapper;
import org.rephoto.alignment.mapper.RowMapping;
import org.rephoto.alignment.transform.TransformFitException;
import org.rephoto.alignment.transform.WarpTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resamples the modern image (B) into the frame of the historical image (A).
 * <p>
 * The transform passed to {@link #warp} maps B coordinates to A coordinates.  Warping inverse maps:
 * the transform's {@link WarpTransform#createInverse() inverse} is derived once and every target pixel
 * is mapped back into the source, where it is bi-linearly sampled.  Target pixels that map outside of
 * the source are fully transparent.  Only the source and the new target buffers are ever allocated.
 * </p>
 */
public class WarpRenderer {

    private final int numberOfThreads;
    private final boolean interpolate;

    public WarpRenderer() {
        this(Runtime.getRuntime().availableProcessors(), true);
    }

    /**
     * @param  numberOfThreads  number of threads used to map target rows.
     * @param  interpolate      true for bi-linear sampling, false for nearest neighbor.
     */
    public WarpRenderer(final int numberOfThreads,
                        final boolean interpolate) {
        if (numberOfThreads < 1) {
            throw new IllegalArgumentException("numberOfThreads must be at least 1 but was " + numberOfThreads);
        }
        this.numberOfThreads = numberOfThreads;
        this.interpolate = interpolate;
    }

    /**
     * @param  source        modern image (not modified).
     * @param  transform     fitted transform mapping source coordinates to target coordinates.
     * @param  targetWidth   width of the historical image.
     * @param  targetHeight  height of the historical image.
     *
     * @return the warped image or the reason the transform could not be inverted.
     */
    public WarpResult warp(final BufferedImage source,
                           final WarpTransform transform,
                           final int targetWidth,
                           final int targetHeight) {

        LOG.info("warp: entry, warping {}x{} source to {}x{} target with {}",
                 source.getWidth(), source.getHeight(), targetWidth, targetHeight, transform.getMode());

        final long startTime = System.currentTimeMillis();

        final WarpTransform targetToSource;
        try {
            targetToSource = transform.createInverse();
        } catch (final TransformFitException e) {
            LOG.warn("warp: failed to derive inverse of {}, {}", transform.getMode(), e.getMessage());
            return WarpResult.failure(e);
        }

        final BufferedImage argbSource = Utils.toArgb(source);
        final BufferedImage target = Utils.newArgbImage(targetWidth, targetHeight);

        final ArgbPixelMapper pixelMapper = new ArgbPixelMapper(Utils.getArgbPixels(argbSource),
                                                                argbSource.getWidth(),
                                                                argbSource.getHeight(),
                                                                Utils.getArgbPixels(target),
                                                                targetWidth,
                                                                targetHeight,
                                                                interpolate);

        new RowMapping(targetToSource).map(pixelMapper, numberOfThreads);

        LOG.info("warp: exit, took {} milliseconds", System.currentTimeMillis() - startTime);

        return WarpResult.success(target);
    }

    private static final Logger LOG = LoggerFactory.getLogger(WarpRenderer.class);
}
