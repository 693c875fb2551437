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
import java.io.IOException;

import org.rephoto.alignment.correspondence.CorrespondenceStore;
import org.rephoto.alignment.transform.TransformMode;
import org.rephoto.alignment.transform.WarpTransform;
import org.rephoto.alignment.warp.SolveResult;
import org.rephoto.alignment.warp.TransformSolver;

/**
 * Synchronous computations consumed by interaction layers:
 * solve a transform from a store, warp an image with it, composite and export results.
 * <p>
 * None of these should be called on an interaction thread for large images;
 * {@link ComputeCoordinator} runs them in the background.
 * </p>
 */
public class AlignmentComputations {

    private final TransformSolver solver;
    private final WarpRenderer warpRenderer;
    private final CompositeRenderer compositeRenderer;

    public AlignmentComputations() {
        this(new TransformSolver(), new WarpRenderer(), new CompositeRenderer());
    }

    public AlignmentComputations(final TransformSolver solver,
                                 final WarpRenderer warpRenderer,
                                 final CompositeRenderer compositeRenderer) {
        this.solver = solver;
        this.warpRenderer = warpRenderer;
        this.compositeRenderer = compositeRenderer;
    }

    public SolveResult computeTransform(final CorrespondenceStore store,
                                        final TransformMode mode) {
        return solver.computeTransform(store, mode);
    }

    public WarpResult warp(final BufferedImage image,
                           final WarpTransform transform,
                           final int targetWidth,
                           final int targetHeight) {
        return warpRenderer.warp(image, transform, targetWidth, targetHeight);
    }

    public BufferedImage composite(final BufferedImage imageA,
                                   final BufferedImage warpedB,
                                   final CompositeMode mode,
                                   final CompositeParameters parameters)
            throws IllegalArgumentException {
        return compositeRenderer.composite(imageA, warpedB, mode, parameters);
    }

    /**
     * Saves the image in the format implied by the path's extension.
     *
     * @throws IOException
     *   if the image cannot be written.
     */
    public void exportImage(final BufferedImage image,
                            final String path)
            throws IOException {
        Utils.saveImage(image, path);
    }

}
