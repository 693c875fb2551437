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
import org.rephoto.alignment.transform.WarpTransform;
import org.rephoto.alignment.warp.SolveResult;

/**
 * Output of one solve, warp and composite pipeline run for a specific store generation.
 */
public class ComputeResult {

    private final long generation;
    private final long configurationVersion;
    private final SolveResult solveResult;
    private final BufferedImage warpedImage;
    private final BufferedImage compositeImage;
    private final AlignmentError error;
    private final String errorMessage;

    private ComputeResult(final long generation,
                          final long configurationVersion,
                          final SolveResult solveResult,
                          final BufferedImage warpedImage,
                          final BufferedImage compositeImage,
                          final AlignmentError error,
                          final String errorMessage) {
        this.generation = generation;
        this.configurationVersion = configurationVersion;
        this.solveResult = solveResult;
        this.warpedImage = warpedImage;
        this.compositeImage = compositeImage;
        this.error = error;
        this.errorMessage = errorMessage;
    }

    public static ComputeResult success(final long generation,
                                        final long configurationVersion,
                                        final SolveResult solveResult,
                                        final BufferedImage warpedImage,
                                        final BufferedImage compositeImage) {
        return new ComputeResult(generation, configurationVersion, solveResult, warpedImage, compositeImage, null, null);
    }

    public static ComputeResult failure(final long generation,
                                        final long configurationVersion,
                                        final SolveResult solveResult,
                                        final AlignmentError error,
                                        final String errorMessage) {
        return new ComputeResult(generation, configurationVersion, solveResult, null, null, error, errorMessage);
    }

    public boolean isSuccessful() {
        return compositeImage != null;
    }

    /**
     * @return store generation of the correspondences this result was computed from.
     */
    public long getGeneration() {
        return generation;
    }

    /**
     * @return version of the images, transform mode and composite options this result was computed from.
     */
    public long getConfigurationVersion() {
        return configurationVersion;
    }

    public SolveResult getSolveResult() {
        return solveResult;
    }

    public WarpTransform getTransform() {
        return solveResult == null ? null : solveResult.getTransform();
    }

    public BufferedImage getWarpedImage() {
        return warpedImage;
    }

    public BufferedImage getCompositeImage() {
        return compositeImage;
    }

    /**
     * @return failure code, or null if the failure was not an alignment error (or the run succeeded).
     */
    public AlignmentError getError() {
        return error;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "{generation: " + generation +
               ", configurationVersion: " + configurationVersion +
               ", successful: " + isSuccessful() +
               (isSuccessful() ? "" : ", error: " + error + ", message: '" + errorMessage + "'") + '}';
    }
}
