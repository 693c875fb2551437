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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical collection of point, line and face correspondences between the historical (A)
 * and modern (B) images.
 * <p>
 * Ids are assigned monotonically, never reused, and insertion order is preserved.
 * That order is the deterministic order used by {@link #flattenToPointPairs()}.
 * Every mutation increments the store's generation and marks the store dirty.
 * Only {@link #markSolved(long)} clears the dirty flag.
 * </p>
 */
public class CorrespondenceStore {

    private final Map<Long, Correspondence> idToCorrespondence;
    private final List<CorrespondenceStoreListener> listeners;

    private long nextId;
    private long generation;
    private boolean dirty;

    public CorrespondenceStore() {
        this.idToCorrespondence = new LinkedHashMap<>();
        this.listeners = new CopyOnWriteArrayList<>();
        this.nextId = 1;
        this.generation = 0;
        this.dirty = false;
    }

    public void addListener(final CorrespondenceStoreListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final CorrespondenceStoreListener listener) {
        listeners.remove(listener);
    }

    public long addPoint(final ImagePoint a,
                         final ImagePoint b) {
        return add(id -> Correspondence.point(id, a, b));
    }

    /**
     * Adds a directional line: a0 to a1 corresponds to b0 to b1.
     */
    public long addLine(final ImagePoint a0,
                        final ImagePoint a1,
                        final ImagePoint b0,
                        final ImagePoint b1) {
        return add(id -> Correspondence.line(id, a0, a1, b0, b1));
    }

    /**
     * @throws InvalidShapeException
     *   if either corner array does not have exactly 4 corners.
     */
    public long addFace(final ImagePoint[] cornersA,
                        final ImagePoint[] cornersB)
            throws InvalidShapeException {
        return add(id -> Correspondence.face(id, cornersA, cornersB));
    }

    /**
     * Moves one point of an existing correspondence.
     *
     * @throws CorrespondenceNotFoundException
     *   if no correspondence with the specified id exists.
     *
     * @throws InvalidShapeException
     *   if the index is out of range for the correspondence's kind.
     */
    public void update(final long id,
                       final ImageSide side,
                       final int index,
                       final ImagePoint newPoint)
            throws CorrespondenceNotFoundException, InvalidShapeException {

        final long updatedGeneration;
        synchronized (this) {
            final Correspondence existing = getExisting(id);
            idToCorrespondence.put(id, existing.withPoint(side, index, newPoint));
            updatedGeneration = markDirty();
        }

        LOG.debug("update: {} point {} of correspondence {} moved to {}", side, index, id, newPoint);

        notifyListeners(updatedGeneration);
    }

    /**
     * @throws CorrespondenceNotFoundException
     *   if no correspondence with the specified id exists.
     */
    public void remove(final long id)
            throws CorrespondenceNotFoundException {

        final long updatedGeneration;
        synchronized (this) {
            getExisting(id);
            idToCorrespondence.remove(id);
            updatedGeneration = markDirty();
        }

        LOG.debug("remove: removed correspondence {}", id);

        notifyListeners(updatedGeneration);
    }

    /**
     * Removes all correspondences as a single mutation.
     */
    public void clear() {
        final long updatedGeneration;
        synchronized (this) {
            idToCorrespondence.clear();
            updatedGeneration = markDirty();
        }
        notifyListeners(updatedGeneration);
    }

    /**
     * Replaces the entire content of this store with the specified correspondences (in iteration order),
     * keeping their ids.  Everything is validated before anything is replaced, so a failure leaves the
     * store untouched.
     *
     * @throws InvalidShapeException
     *   if any correspondence is malformed or if ids are duplicated.
     */
    public void replaceAll(final Collection<Correspondence> correspondences)
            throws InvalidShapeException {

        final Map<Long, Correspondence> validated = new LinkedHashMap<>();
        long maxId = 0;
        for (final Correspondence correspondence : correspondences) {
            correspondence.validateShape();
            if (correspondence.getId() < 1) {
                throw new InvalidShapeException("correspondence id " + correspondence.getId() + " must be positive");
            }
            if (validated.put(correspondence.getId(), correspondence) != null) {
                throw new InvalidShapeException("correspondence id " + correspondence.getId() + " is duplicated");
            }
            maxId = Math.max(maxId, correspondence.getId());
        }

        final long updatedGeneration;
        synchronized (this) {
            idToCorrespondence.clear();
            idToCorrespondence.putAll(validated);
            nextId = Math.max(nextId, maxId + 1);
            updatedGeneration = markDirty();
        }

        LOG.info("replaceAll: loaded {} correspondences, generation is now {}", validated.size(), updatedGeneration);

        notifyListeners(updatedGeneration);
    }

    /**
     * @throws CorrespondenceNotFoundException
     *   if no correspondence with the specified id exists.
     */
    public synchronized CorrespondenceKind kindOf(final long id)
            throws CorrespondenceNotFoundException {
        return getExisting(id).getKind();
    }

    /**
     * @throws CorrespondenceNotFoundException
     *   if no correspondence with the specified id exists.
     */
    public synchronized Correspondence get(final long id)
            throws CorrespondenceNotFoundException {
        return getExisting(id);
    }

    public synchronized boolean contains(final long id) {
        return idToCorrespondence.containsKey(id);
    }

    public synchronized int size() {
        return idToCorrespondence.size();
    }

    /**
     * Pure projection of the store to ordered point pairs: lines contribute 2 pairs, faces 4 (in corner order).
     * Does not affect the dirty flag.
     */
    public List<PointPair> flattenToPointPairs() {
        return snapshot().flattenToPointPairs();
    }

    public synchronized CorrespondenceSnapshot snapshot() {
        return new CorrespondenceSnapshot(generation, new ArrayList<>(idToCorrespondence.values()));
    }

    public synchronized long getGeneration() {
        return generation;
    }

    public synchronized boolean isDirty() {
        return dirty;
    }

    /**
     * Clears the dirty flag if the specified generation is still current.
     *
     * @param  solvedGeneration  generation of the snapshot used for a completed solve.
     *
     * @return true if the flag was cleared; false if the store has since been mutated.
     */
    public synchronized boolean markSolved(final long solvedGeneration) {
        final boolean isCurrent = (solvedGeneration == generation);
        if (isCurrent) {
            dirty = false;
        }
        return isCurrent;
    }

    @Override
    public synchronized String toString() {
        return "{generation: " + generation + ", size: " + idToCorrespondence.size() + ", dirty: " + dirty + '}';
    }

    private long add(final LongFunction<Correspondence> factory)
            throws InvalidShapeException {

        final Correspondence correspondence;
        final long updatedGeneration;
        synchronized (this) {
            // id is only consumed once the correspondence has been validated
            correspondence = factory.apply(nextId);
            nextId++;
            idToCorrespondence.put(correspondence.getId(), correspondence);
            updatedGeneration = markDirty();
        }

        LOG.debug("add: added {}", correspondence);

        notifyListeners(updatedGeneration);
        return correspondence.getId();
    }

    private Correspondence getExisting(final long id)
            throws CorrespondenceNotFoundException {
        final Correspondence correspondence = idToCorrespondence.get(id);
        if (correspondence == null) {
            throw new CorrespondenceNotFoundException(id);
        }
        return correspondence;
    }

    private long markDirty() {
        dirty = true;
        return ++generation;
    }

    private void notifyListeners(final long updatedGeneration) {
        for (final CorrespondenceStoreListener listener : listeners) {
            listener.storeChanged(this, updatedGeneration);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CorrespondenceStore.class);
}
