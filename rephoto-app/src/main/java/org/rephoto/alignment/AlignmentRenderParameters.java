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

import com.beust.jcommander.Parameter;

import org.rephoto.alignment.transform.TransformMode;

/**
 * Command line parameters for {@link AlignmentRenderer}.
 */
public class AlignmentRenderParameters
        extends CommandLineParameters {

    @Parameter(
            names = "--project",
            description = "Path of project JSON file with image paths and correspondences",
            required = true)
    public String project;

    @Parameter(
            names = "--mode",
            description = "Transform family (defaults to the mode saved in the project or HOMOGRAPHY)")
    public TransformMode mode;

    @Parameter(
            names = "--smoothing",
            description = "Thin plate spline smoothing, 0 for exact interpolation")
    public double smoothing = 0.0;

    @Parameter(
            names = "--ransacThreshold",
            description = "Fit homography robustly, ignoring pairs with reprojection errors above this many pixels (5 is typical)")
    public Double ransacThreshold;

    @Parameter(
            names = "--composite",
            description = "Comparison rendered to --out")
    public CompositeMode composite = CompositeMode.SLIDER;

    @Parameter(
            names = "--position",
            description = "Slider split position in [0, 1]")
    public double position = CompositeParameters.DEFAULT_POSITION;

    @Parameter(
            names = "--vertical",
            description = "Split slider rows instead of columns",
            arity = 0)
    public boolean vertical = false;

    @Parameter(
            names = "--alpha",
            description = "Ghost opacity of the warped image in [0, 1]")
    public double alpha = CompositeParameters.DEFAULT_ALPHA;

    @Parameter(
            names = "--threshold",
            description = "Diff channel differences below this value (0-255) are rendered black")
    public int threshold = 0;

    @Parameter(
            names = "--falseColor",
            description = "Render diff magnitude with a heat color ramp",
            arity = 0)
    public boolean falseColor = false;

    @Parameter(
            names = "--out",
            description = "Path of composite image to save (format from extension: png, jpg, tif)")
    public String out;

    @Parameter(
            names = "--warpedOut",
            description = "Path of warped modern image to save (format from extension: png, jpg, tif)")
    public String warpedOut;

    @Parameter(
            names = "--threads",
            description = "Number of threads used to warp")
    public int threads = Runtime.getRuntime().availableProcessors();

    @Parameter(
            names = "--logLevel",
            description = "Root log level (e.g. DEBUG, INFO, WARN)")
    public String logLevel;

    @Parameter(
            names = "--logFile",
            description = "Also write log messages to this file")
    public String logFile;

    /**
     * @throws IllegalArgumentException
     *   if the parameter combination is invalid.
     */
    public void validate()
            throws IllegalArgumentException {
        if ((out == null) && (warpedOut == null)) {
            throw new IllegalArgumentException("at least one of --out or --warpedOut must be specified");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("--threads must be at least 1");
        }
        buildCompositeParameters();
    }

    public CompositeParameters buildCompositeParameters()
            throws IllegalArgumentException {
        return new CompositeParameters(position, vertical, alpha, threshold, falseColor);
    }

}
