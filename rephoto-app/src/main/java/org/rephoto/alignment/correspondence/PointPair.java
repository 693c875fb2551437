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
package org.rephoto.alignment.correspondence;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single point correspondence: location {@link #getA() a} in the historical image
 * paired with location {@link #getB() b} in the modern image.
 */
public class PointPair implements Serializable {

    private final ImagePoint a;
    private final ImagePoint b;

    public PointPair(final ImagePoint a,
                     final ImagePoint b) {
        this.a = Objects.requireNonNull(a, "a point must be specified");
        this.b = Objects.requireNonNull(b, "b point must be specified");
    }

    public ImagePoint getA() {
        return a;
    }

    public ImagePoint getB() {
        return b;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final PointPair that = (PointPair) o;
        return a.equals(that.a) && b.equals(that.b);
    }

    @Override
    public int hashCode() {
        return Objects.hash(a, b);
    }

    @Override
    public String toString() {
        return a + " <- " + b;
    }
}
