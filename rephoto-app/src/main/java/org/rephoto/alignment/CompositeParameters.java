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

import java.io.Serializable;

/**
 * Options for {@link CompositeRenderer}.  Each mode only reads the options it needs:
 * {@link CompositeMode#SLIDER} uses position and vertical,
 * {@link CompositeMode#GHOST} uses alpha,
 * {@link CompositeMode#DIFF} uses threshold and falseColor.
 */
public class CompositeParameters implements Serializable {

    public static final double DEFAULT_POSITION = 0.5;
    public static final double DEFAULT_ALPHA = 0.5;

    private final double position;
    private final boolean vertical;
    private final double alpha;
    private final int threshold;
    private final boolean falseColor;

    public CompositeParameters() {
        this(DEFAULT_POSITION, false, DEFAULT_ALPHA, 0, false);
    }

    /**
     * @param  position    slider split position in [0, 1].
     * @param  vertical    true to split rows (top/bottom) instead of columns (left/right).
     * @param  alpha       ghost opacity of the warped image in [0, 1].
     * @param  threshold   diff channel differences below this value (0-255) are written as black.
     * @param  falseColor  true to render diff magnitude with a heat color ramp.
     */
    public CompositeParameters(final double position,
                               final boolean vertical,
                               final double alpha,
                               final int threshold,
                               final boolean falseColor) {

        if (! ((position >= 0.0) && (position <= 1.0))) {
            throw new IllegalArgumentException("position must be in [0, 1] but was " + position);
        }
        if (! ((alpha >= 0.0) && (alpha <= 1.0))) {
            throw new IllegalArgumentException("alpha must be in [0, 1] but was " + alpha);
        }
        if ((threshold < 0) || (threshold > 255)) {
            throw new IllegalArgumentException("threshold must be in [0, 255] but was " + threshold);
        }

        this.position = position;
        this.vertical = vertical;
        this.alpha = alpha;
        this.threshold = threshold;
        this.falseColor = falseColor;
    }

    public static CompositeParameters slider(final double position,
                                             final boolean vertical) {
        return new CompositeParameters(position, vertical, DEFAULT_ALPHA, 0, false);
    }

    public static CompositeParameters ghost(final double alpha) {
        return new CompositeParameters(DEFAULT_POSITION, false, alpha, 0, false);
    }

    public static CompositeParameters diff(final int threshold,
                                           final boolean falseColor) {
        return new CompositeParameters(DEFAULT_POSITION, false, DEFAULT_ALPHA, threshold, falseColor);
    }

    public double getPosition() {
        return position;
    }

    public boolean isVertical() {
        return vertical;
    }

    public double getAlpha() {
        return alpha;
    }

    public int getThreshold() {
        return threshold;
    }

    public boolean isFalseColor() {
        return falseColor;
    }

    @Override
    public String toString() {
        return "{position: " + position +
               ", vertical: " + vertical +
               ", alpha: " + alpha +
               ", threshold: " + threshold +
               ", falseColor: " + falseColor + '}';
    }
}
