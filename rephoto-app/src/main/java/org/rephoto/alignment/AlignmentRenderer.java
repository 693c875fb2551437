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
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.rephoto.alignment.correspondence.CorrespondenceStore;
import org.rephoto.alignment.spec.AlignmentProject;
import org.rephoto.alignment.transform.TransformMode;
import org.rephoto.alignment.util.LogbackTools;
import org.rephoto.alignment.warp.SolveResult;
import org.rephoto.alignment.warp.TransformSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns the modern image of a saved project with its historical image and saves the results.
 * <p/>
 * <pre>
 * Usage: java [-options] -cp rephoto-app.jar org.rephoto.alignment.AlignmentRenderer [options]
 * Options:
 * *     --project
 *      Path of project JSON file with image paths and correspondences
 *       --mode
 *      Transform family (defaults to the mode saved in the project or HOMOGRAPHY)
 *      Possible Values: [HOMOGRAPHY, THIN_PLATE_SPLINE]
 *       --composite
 *      Comparison rendered to --out
 *      Default: SLIDER
 *       --out
 *      Path of composite image to save
 *       --warpedOut
 *      Path of warped modern image to save
 * </pre>
 * <p>E.g.:</p>
 * <pre>java -cp rephoto-app.jar org.rephoto.alignment.AlignmentRenderer \
 *   --project "/absolute/path/to/project.json" \
 *   --mode THIN_PLATE_SPLINE \
 *   --composite GHOST --alpha 0.4 \
 *   --out "/absolute/path/to/ghost.png" \
 *   --warpedOut "/absolute/path/to/warped.tif"</pre>
 */
public class AlignmentRenderer {

    private final AlignmentRenderParameters parameters;

    public AlignmentRenderer(final AlignmentRenderParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * Loads the project and its images, fits the transform, warps and saves the requested images.
     *
     * @throws IOException
     *   if the project or an image cannot be read or written.
     *
     * @throws IllegalStateException
     *   if no transform can be fitted or inverted.
     */
    public void render()
            throws IOException, IllegalStateException {

        LOG.info("render: entry, parameters={}", parameters);

        final Path projectPath = Paths.get(parameters.project);
        final AlignmentProject project = AlignmentProject.load(projectPath);

        final CorrespondenceStore store = new CorrespondenceStore();
        project.loadInto(store);

        final BufferedImage imageA =
                Utils.openImage(AlignmentProject.resolveImagePath(projectPath, project.getImageAPath()).toString());
        final BufferedImage imageB =
                Utils.openImage(AlignmentProject.resolveImagePath(projectPath, project.getImageBPath()).toString());

        final TransformMode mode = parameters.mode == null ?
                                   project.getTransformMode(TransformMode.HOMOGRAPHY) : parameters.mode;

        final AlignmentComputations computations =
                new AlignmentComputations(new TransformSolver(parameters.smoothing, parameters.ransacThreshold),
                                          new WarpRenderer(parameters.threads, true),
                                          new CompositeRenderer());

        final SolveResult solveResult = computations.computeTransform(store, mode);
        if (! solveResult.isSuccessful()) {
            throw new IllegalStateException("failed to compute " + mode + " transform from " +
                                            solveResult.getNumberOfPointPairs() + " point pairs, " +
                                            solveResult.getError() + ": " + solveResult.getErrorMessage());
        }

        final WarpResult warpResult = computations.warp(imageB,
                                                        solveResult.getTransform(),
                                                        imageA.getWidth(),
                                                        imageA.getHeight());
        if (! warpResult.isSuccessful()) {
            throw new IllegalStateException("failed to warp with " + mode + " transform, " +
                                            warpResult.getError() + ": " + warpResult.getErrorMessage());
        }

        if (parameters.warpedOut != null) {
            computations.exportImage(warpResult.getImage(), parameters.warpedOut);
        }

        if (parameters.out != null) {
            final BufferedImage compositeImage = computations.composite(imageA,
                                                                        warpResult.getImage(),
                                                                        parameters.composite,
                                                                        parameters.buildCompositeParameters());
            computations.exportImage(compositeImage, parameters.out);
        }

        LOG.info("render: exit");
    }

    /**
     * This is basically the 'main' method but it has been extracted so that it can be more easily used for tests.
     *
     * @param  args  command line arguments for constructing a {@link AlignmentRenderParameters} instance.
     *
     * @throws Exception
     *   if rendering fails for any reason.
     */
    public static void renderUsingCommandLineArguments(final String[] args)
            throws Exception {

        final AlignmentRenderParameters parameters = new AlignmentRenderParameters();
        parameters.parse(args, AlignmentRenderer.class);

        if (parameters.isHelp()) {
            return;
        }

        if (parameters.logLevel != null) {
            LogbackTools.setRootLogLevel(parameters.logLevel);
        }
        if (parameters.logFile != null) {
            LogbackTools.setRootFileAppender(new File(parameters.logFile));
        }

        parameters.validate();

        new AlignmentRenderer(parameters).render();
    }

    public static void main(final String[] args) {

        try {
            renderUsingCommandLineArguments(args);
        } catch (final Throwable t) {
            LOG.error("main: caught exception", t);
            System.exit(1);
        }

    }

    private static final Logger LOG = LoggerFactory.getLogger(AlignmentRenderer.class);
}
