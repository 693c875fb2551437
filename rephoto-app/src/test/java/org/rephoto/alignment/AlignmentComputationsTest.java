package org.rephoto.alignment;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.rephoto.alignment.correspondence.CorrespondenceStore;
import org.rephoto.alignment.correspondence.ImagePoint;
import org.rephoto.alignment.transform.AlignmentError;
import org.rephoto.alignment.transform.TransformMode;
import org.rephoto.alignment.warp.SolveResult;

import static org.rephoto.alignment.WarpRendererTest.buildUniformImage;

/**
 * Tests the {@link AlignmentComputations} class.
 */
public class AlignmentComputationsTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private AlignmentComputations computations;
    private CorrespondenceStore store;

    @Before
    public void setup() {
        computations = new AlignmentComputations();
        store = new CorrespondenceStore();
        store.addPoint(new ImagePoint(0, 0), new ImagePoint(10, 5));
        store.addPoint(new ImagePoint(100, 0), new ImagePoint(120, 0));
        store.addPoint(new ImagePoint(100, 100), new ImagePoint(115, 110));
    }

    @Test
    public void testSolveWarpCompositeAndExport() throws Exception {

        store.addPoint(new ImagePoint(0, 100), new ImagePoint(5, 95));

        final SolveResult solveResult = computations.computeTransform(store, TransformMode.HOMOGRAPHY);
        Assert.assertTrue("solve should succeed: " + solveResult, solveResult.isSuccessful());
        Assert.assertEquals("invalid pair count", 4, solveResult.getNumberOfPointPairs());

        final BufferedImage imageA = buildUniformImage(101, 101, HISTORICAL_COLOR);
        final BufferedImage imageB = buildUniformImage(130, 120, MODERN_COLOR);

        final WarpResult warpResult = computations.warp(imageB, solveResult.getTransform(), 101, 101);
        Assert.assertTrue("warp should succeed: " + warpResult, warpResult.isSuccessful());

        final BufferedImage warped = warpResult.getImage();
        for (final int pixel : Utils.getArgbPixels(warped)) {
            Assert.assertEquals("warped quad should cover the whole canvas", MODERN_COLOR, pixel);
        }

        final BufferedImage diff = computations.composite(imageA,
                                                          warped,
                                                          CompositeMode.DIFF,
                                                          CompositeParameters.diff(0, false));
        final int expectedDiff = 0xff000000 | (0x4d << 16) | (0x1a << 8) | 0x4c;
        for (final int pixel : Utils.getArgbPixels(diff)) {
            Assert.assertEquals("invalid diff pixel", expectedDiff, pixel);
        }

        final File exportFile = new File(temporaryFolder.getRoot(), "export/diff.png");
        computations.exportImage(diff, exportFile.getAbsolutePath());

        final BufferedImage exported = Utils.openImage(exportFile.getAbsolutePath());
        Assert.assertArrayEquals("exported image should match the composite",
                                 Utils.getArgbPixels(diff), Utils.getArgbPixels(exported));
    }

    @Test
    public void testSolveFailureIsReturned() {
        final SolveResult solveResult = computations.computeTransform(store, TransformMode.HOMOGRAPHY);
        Assert.assertFalse("solve should fail with 3 pairs", solveResult.isSuccessful());
        Assert.assertEquals("invalid error", AlignmentError.INSUFFICIENT_CORRESPONDENCES, solveResult.getError());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCompositeOfDifferentSizes() {
        computations.composite(buildUniformImage(10, 10, HISTORICAL_COLOR),
                               buildUniformImage(10, 11, MODERN_COLOR),
                               CompositeMode.GHOST,
                               CompositeParameters.ghost(0.5));
    }

    @Test(expected = IOException.class)
    public void testExportToUnwritablePath() throws Exception {
        final File regularFile = temporaryFolder.newFile("not-a-directory");
        computations.exportImage(buildUniformImage(4, 4, MODERN_COLOR),
                                 new File(regularFile, "composite.png").getAbsolutePath());
    }

    private static final int HISTORICAL_COLOR = 0xff808080;
    private static final int MODERN_COLOR = 0xff3366cc;

}
