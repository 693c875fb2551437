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
 * Maps pixels between packed ARGB int arrays.
 * <p>
 * Target pixels whose source coordinate lies outside of the source image (or is not finite) are
 * left fully transparent (0x00000000).  Source coordinates are never clamped into the image, apart
 * from absorbing floating point noise of {@link #EDGE_TOLERANCE} pixels at the borders.
 * </p>
 */
public class ArgbPixelMapper
        implements PixelMapper {

    /** Distance outside of the source image that is still treated as being on its border. */
    public static final double EDGE_TOLERANCE = 1e-6;

    private final int[] sourcePixels;
    private final int sourceWidth;
    private final int sourceHeight;
    private final int[] targetPixels;
    private final int targetWidth;
    private final int targetHeight;
    private final boolean isMappingInterpolated;

    private final double maxSourceX;
    private final double maxSourceY;

    /**
     * @param  sourcePixels           packed ARGB source pixels (read only).
     * @param  sourceWidth            source width.
     * @param  sourceHeight           source height.
     * @param  targetPixels           packed ARGB target pixels, expected to be initialized to 0 (transparent).
     * @param  targetWidth            target width.
     * @param  targetHeight           target height.
     * @param  isMappingInterpolated  true for bi-linear interpolation, false for nearest neighbor.
     */
    public ArgbPixelMapper(final int[] sourcePixels,
                           final int sourceWidth,
                           final int sourceHeight,
                           final int[] targetPixels,
                           final int targetWidth,
                           final int targetHeight,
                           final boolean isMappingInterpolated) {

        if (sourcePixels.length != sourceWidth * sourceHeight) {
            throw new IllegalArgumentException("source has " + sourcePixels.length + " pixels but dimensions are " +
                                               sourceWidth + "x" + sourceHeight);
        }
        if (targetPixels.length != targetWidth * targetHeight) {
            throw new IllegalArgumentException("target has " + targetPixels.length + " pixels but dimensions are " +
                                               targetWidth + "x" + targetHeight);
        }

        this.sourcePixels = sourcePixels;
        this.sourceWidth = sourceWidth;
        this.sourceHeight = sourceHeight;
        this.targetPixels = targetPixels;
        this.targetWidth = targetWidth;
        this.targetHeight = targetHeight;
        this.isMappingInterpolated = isMappingInterpolated;

        this.maxSourceX = sourceWidth - 1;
        this.maxSourceY = sourceHeight - 1;
    }

    @Override
    public int getTargetWidth() {
        return targetWidth;
    }

    @Override
    public int getTargetHeight() {
        return targetHeight;
    }

    @Override
    public boolean isMappingInterpolated() {
        return isMappingInterpolated;
    }

    @Override
    public void map(final double sourceX,
                    final double sourceY,
                    final int targetX,
                    final int targetY) {

        if (isInsideSource(sourceX, sourceY)) {
            final int x = (int) Math.round(Math.min(maxSourceX, Math.max(0.0, sourceX)));
            final int y = (int) Math.round(Math.min(maxSourceY, Math.max(0.0, sourceY)));
            targetPixels[targetY * targetWidth + targetX] = sourcePixels[y * sourceWidth + x];
        }
    }

    @Override
    public void mapInterpolated(final double sourceX,
                                final double sourceY,
                                final int targetX,
                                final int targetY) {

        if (! isInsideSource(sourceX, sourceY)) {
            return;
        }

        final double x = Math.min(maxSourceX, Math.max(0.0, sourceX));
        final double y = Math.min(maxSourceY, Math.max(0.0, sourceY));

        final int x0 = (int) x;
        final int y0 = (int) y;
        final double fx = x - x0;
        final double fy = y - y0;

        final int targetIndex = targetY * targetWidth + targetX;
        final int rowOffset = y0 * sourceWidth;

        if ((fx == 0.0) && (fy == 0.0)) {
            targetPixels[targetIndex] = sourcePixels[rowOffset + x0];
            return;
        }

        final int x1 = Math.min(x0 + 1, sourceWidth - 1);
        final int nextRowOffset = Math.min(y0 + 1, sourceHeight - 1) * sourceWidth;

        final int p00 = sourcePixels[rowOffset + x0];
        final int p10 = sourcePixels[rowOffset + x1];
        final int p01 = sourcePixels[nextRowOffset + x0];
        final int p11 = sourcePixels[nextRowOffset + x1];

        final double w00 = (1.0 - fx) * (1.0 - fy);
        final double w10 = fx * (1.0 - fy);
        final double w01 = (1.0 - fx) * fy;
        final double w11 = fx * fy;

        int argb = 0;
        for (int shift = 24; shift >= 0; shift -= 8) {
            final double value = w00 * ((p00 >> shift) & 0xff) +
                                 w10 * ((p10 >> shift) & 0xff) +
                                 w01 * ((p01 >> shift) & 0xff) +
                                 w11 * ((p11 >> shift) & 0xff);
            argb |= (Math.min(255, (int) (value + 0.5)) << shift);
        }
        targetPixels[targetIndex] = argb;
    }

    private boolean isInsideSource(final double sourceX,
                                   final double sourceY) {
        // written so NaN coordinates fail the test
        return (sourceX >= -EDGE_TOLERANCE) && (sourceX <= maxSourceX + EDGE_TOLERANCE) &&
               (sourceY >= -EDGE_TOLERANCE) && (sourceY <= maxSourceY + EDGE_TOLERANCE);
    }

}
