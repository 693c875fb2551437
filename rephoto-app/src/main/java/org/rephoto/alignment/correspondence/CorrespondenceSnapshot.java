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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only view of a {@link CorrespondenceStore} captured at a specific generation.
 * Snapshots are what the interaction layer and background computations work with,
 * so nothing outside the store ever holds a reference into its mutable state.
 */
public class CorrespondenceSnapshot implements Serializable {

    private final long generation;
    private final List<Correspondence> correspondences;

    public CorrespondenceSnapshot(final long generation,
                                  final List<Correspondence> correspondences) {
        this.generation = generation;
        this.correspondences = Collections.unmodifiableList(new ArrayList<>(correspondences));
    }

    public long getGeneration() {
        return generation;
    }

    public List<Correspondence> getCorrespondences() {
        return correspondences;
    }

    public int size() {
        return correspondences.size();
    }

    /**
     * @return all point pairs in store insertion order, with each correspondence
     *         contributing its own pairs in point order.
     */
    public List<PointPair> flattenToPointPairs() {
        final List<PointPair> pairs = new ArrayList<>();
        for (final Correspondence correspondence : correspondences) {
            pairs.addAll(correspondence.flattenToPointPairs());
        }
        return pairs;
    }

    @Override
    public String toString() {
        return "{generation: " + generation + ", correspondenceCount: " + correspondences.size() + '}';
    }
}
