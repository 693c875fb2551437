package org.rephoto.alignment;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.rephoto.alignment.correspondence.ImagePoint;
import org.rephoto.alignment.correspondence.PointPair;
import org.rephoto.alignment.transform.AlignmentError;
import org.rephoto.alignment.transform.HomographyTransform;
import org.rephoto.alignment.transform.TransformMode;
import org.rephoto.alignment.warp.SolveResult;
import org.rephoto.alignment.warp.TransformSolver;

/**
 * Tests the {@link WarpRenderer} class.
 */
public class WarpRendererTest {

    @Test
    public void testIdentityWarpReproducesSource() {

        final BufferedImage source = buildPatternImage(40, 30);
        final int[] originalPixels = Utils.getArgbPixels(source).clone();

        final WarpResult result = new WarpRenderer(3, true).warp(source, HomographyTransform.identity(), 40, 30);

        Assert.assertTrue("warp should succeed: " + result, result.isSuccessful());
        Assert.assertArrayEquals("identity warp should reproduce the source",
                                 originalPixels, Utils.getArgbPixels(result.getImage()));
        Assert.assertArrayEquals("source should not be modified", originalPixels, Utils.getArgbPixels(source));
    }

    @Test
    public void testPerspectiveQuadFillsCanvas() {

        final List<PointPair> pairs = Arrays.asList(pair(0, 0, 10, 5),
                                                    pair(100, 0, 120, 0),
                                                    pair(100, 100, 115, 110),
                                                    pair(0, 100, 5, 95));

        final SolveResult solveResult = new TransformSolver().computeTransform(pairs, TransformMode.HOMOGRAPHY);
        Assert.assertTrue("solve should succeed: " + solveResult, solveResult.isSuccessful());

        final int color = 0xff3366cc;
        final BufferedImage uniformB = buildUniformImage(130, 120, color);

        final WarpResult result = new WarpRenderer().warp(uniformB, solveResult.getTransform(), 101, 101);
        Assert.assertTrue("warp should succeed: " + result, result.isSuccessful());

        final BufferedImage warped = result.getImage();
        Assert.assertEquals("invalid width", 101, warped.getWidth());
        Assert.assertEquals("invalid height", 101, warped.getHeight());

        final int[] pixels = Utils.getArgbPixels(warped);
        for (int i = 0; i < pixels.length; i++) {
            Assert.assertEquals("invalid color for pixel (" + (i % 101) + ", " + (i / 101) + ")", color, pixels[i]);
        }
    }

    @Test
    public void testOutOfBoundsPixelsAreTransparent() {

        final BufferedImage source = buildPatternImage(20, 10);
        final int[] sourcePixels = Utils.getArgbPixels(source);

        // B to A shifts right by 10 pixels, so the first 10 target columns have no source
        final HomographyTransform shift = new HomographyTransform(1, 0, 10,
                                                                  0, 1, 0,
                                                                  0, 0, 1);

        final WarpResult result = new WarpRenderer(1, true).warp(source, shift, 20, 10);
        final int[] pixels = Utils.getArgbPixels(result.getImage());

        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 20; x++) {
                final int expected = x < 10 ? 0 : sourcePixels[y * 20 + (x - 10)];
                Assert.assertEquals("invalid pixel (" + x + ", " + y + ")", expected, pixels[y * 20 + x]);
            }
        }
    }

    @Test
    public void testThinPlateSplineTranslation() {

        final List<PointPair> pairs = Arrays.asList(pair(5, 3, 0, 0),
                                                    pair(35, 3, 30, 0),
                                                    pair(35, 23, 30, 20),
                                                    pair(5, 23, 0, 20),
                                                    pair(20, 13, 15, 10));

        final SolveResult solveResult = new TransformSolver().computeTransform(pairs, TransformMode.THIN_PLATE_SPLINE);
        Assert.assertTrue("solve should succeed: " + solveResult, solveResult.isSuccessful());

        final BufferedImage source = buildPatternImage(40, 30);
        final int[] sourcePixels = Utils.getArgbPixels(source);

        final WarpResult result = new WarpRenderer(2, true).warp(source, solveResult.getTransform(), 40, 30);
        Assert.assertTrue("warp should succeed: " + result, result.isSuccessful());
        final int[] pixels = Utils.getArgbPixels(result.getImage());

        for (int y = 0; y < 30; y++) {
            for (int x = 0; x < 40; x++) {
                final int i = y * 40 + x;
                if ((x < 4) || (y < 2)) {
                    Assert.assertEquals("pixel (" + x + ", " + y + ") should be transparent", 0, pixels[i]);
                } else if ((x > 5) && (y > 3)) {
                    Assert.assertEquals("invalid pixel (" + x + ", " + y + ")",
                                        sourcePixels[(y - 3) * 40 + (x - 5)], pixels[i]);
                }
            }
        }
    }

    @Test
    public void testSingularTransformFails() {

        final HomographyTransform singular = new HomographyTransform(1, 0, 0,
                                                                     1, 0, 0,
                                                                     0, 0, 1);

        final WarpResult result = new WarpRenderer().warp(buildUniformImage(10, 10, 0xffffffff), singular, 10, 10);

        Assert.assertFalse("warp should fail", result.isSuccessful());
        Assert.assertNull("failed warp should not have an image", result.getImage());
        Assert.assertEquals("invalid error", AlignmentError.SINGULAR_SYSTEM, result.getError());
    }

    static PointPair pair(final double ax,
                          final double ay,
                          final double bx,
                          final double by) {
        return new PointPair(new ImagePoint(ax, ay), new ImagePoint(bx, by));
    }

    static BufferedImage buildUniformImage(final int width,
                                           final int height,
                                           final int argb) {
        final BufferedImage image = Utils.newArgbImage(width, height);
        Arrays.fill(Utils.getArgbPixels(image), argb);
        return image;
    }

    static BufferedImage buildPatternImage(final int width,
                                           final int height) {
        final BufferedImage image = Utils.newArgbImage(width, height);
        final int[] pixels = Utils.getArgbPixels(image);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixels[y * width + x] = 0xff000000 | ((x * 6) << 16) | ((y * 8) << 8) | ((x * y) & 0xff);
            }
        }
        return image;
    }

}
