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
package org.rephoto.alignment.warp;

import org.rephoto.alignment.transform.AlignmentError;
import org.rephoto.alignment.transform.TransformFitException;
import org.rephoto.alignment.transform.TransformMode;
import org.rephoto.alignment.transform.WarpTransform;

/**
 * Outcome of a transform fit: either a transform or the reason no transform is available.
 */
public class SolveResult {

    private final TransformMode mode;
    private final int numberOfPointPairs;
    private final WarpTransform transform;
    private final AlignmentError error;
    private final String errorMessage;

    private SolveResult(final TransformMode mode,
                        final int numberOfPointPairs,
                        final WarpTransform transform,
                        final AlignmentError error,
                        final String errorMessage) {
        this.mode = mode;
        this.numberOfPointPairs = numberOfPointPairs;
        this.transform = transform;
        this.error = error;
        this.errorMessage = errorMessage;
    }

    public static SolveResult success(final TransformMode mode,
                                      final int numberOfPointPairs,
                                      final WarpTransform transform) {
        return new SolveResult(mode, numberOfPointPairs, transform, null, null);
    }

    public static SolveResult failure(final TransformMode mode,
                                      final int numberOfPointPairs,
                                      final TransformFitException cause) {
        return new SolveResult(mode, numberOfPointPairs, null, cause.getError(), cause.getMessage());
    }

    public boolean isSuccessful() {
        return transform != null;
    }

    public TransformMode getMode() {
        return mode;
    }

    public int getNumberOfPointPairs() {
        return numberOfPointPairs;
    }

    /**
     * @return the fitted transform (null if the fit failed).
     */
    public WarpTransform getTransform() {
        return transform;
    }

    /**
     * @return the failure code (null if the fit succeeded).
     */
    public AlignmentError getError() {
        return error;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccessful() ?
               "{mode: " + mode + ", pairs: " + numberOfPointPairs + ", transform: " + transform + '}' :
               "{mode: " + mode + ", pairs: " + numberOfPointPairs + ", error: " + error + ", message: '" +
               errorMessage + "'}";
    }
}
