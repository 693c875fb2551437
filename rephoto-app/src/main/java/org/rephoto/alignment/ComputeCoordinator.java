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
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import org.rephoto.alignment.correspondence.CorrespondenceSnapshot;
import org.rephoto.alignment.correspondence.CorrespondenceStore;
import org.rephoto.alignment.correspondence.CorrespondenceStoreListener;
import org.rephoto.alignment.transform.TransformMode;
import org.rephoto.alignment.warp.SolveResult;
import org.rephoto.alignment.warp.TransformSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs solve, warp and composite pipelines off the caller's thread and decides which results get applied.
 * <p>
 * Each submission captures a snapshot of the correspondence store (with its generation) and the current
 * configuration version (images, transform mode, composite options).  When a run completes, its result is
 * applied only if neither has changed since submission and no result for a later generation has been applied.
 * The check and the update happen under the coordinator and store locks (always taken in that order).
 * Superseded results are discarded; nothing is ever interrupted.  Failed runs never replace the last
 * applied result.
 * </p>
 */
public class ComputeCoordinator
        implements CorrespondenceStoreListener {

    private final CorrespondenceStore store;
    private final Executor executor;
    private final TransformSolver solver;
    private final WarpRenderer warpRenderer;
    private final CompositeRenderer compositeRenderer;

    private final List<ComputeListener> listeners;
    private final AtomicReference<ComputeResult> latestResult;

    private BufferedImage imageA;
    private BufferedImage imageB;
    private TransformMode transformMode;
    private CompositeMode compositeMode;
    private CompositeParameters compositeParameters;
    private long configurationVersion;
    private SessionState state;
    private boolean autoRecompute;

    public ComputeCoordinator(final CorrespondenceStore store,
                              final Executor executor) {
        this(store, executor, new TransformSolver(), new WarpRenderer(), new CompositeRenderer());
    }

    public ComputeCoordinator(final CorrespondenceStore store,
                              final Executor executor,
                              final TransformSolver solver,
                              final WarpRenderer warpRenderer,
                              final CompositeRenderer compositeRenderer) {
        this.store = store;
        this.executor = executor;
        this.solver = solver;
        this.warpRenderer = warpRenderer;
        this.compositeRenderer = compositeRenderer;
        this.listeners = new CopyOnWriteArrayList<>();
        this.latestResult = new AtomicReference<>();
        this.transformMode = TransformMode.HOMOGRAPHY;
        this.compositeMode = CompositeMode.SLIDER;
        this.compositeParameters = new CompositeParameters();
        this.configurationVersion = 0;
        this.state = SessionState.EMPTY;
        this.autoRecompute = false;

        store.addListener(this);
    }

    public void addListener(final ComputeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final ComputeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Stops listening to store mutations.
     */
    public void close() {
        store.removeListener(this);
    }

    /**
     * Installs a new image pair.  The previously applied result is dropped and in-flight runs are superseded.
     */
    public void setImages(final BufferedImage historicalImage,
                          final BufferedImage modernImage) {

        if ((historicalImage == null) || (modernImage == null)) {
            throw new IllegalArgumentException("both images must be specified");
        }

        synchronized (this) {
            this.imageA = historicalImage;
            this.imageB = modernImage;
            this.configurationVersion++;
            latestResult.set(null);
        }

        LOG.info("setImages: historical image is {}x{}, modern image is {}x{}",
                 historicalImage.getWidth(), historicalImage.getHeight(),
                 modernImage.getWidth(), modernImage.getHeight());

        changeState(SessionState.EMPTY);
        changeState(SessionState.IMAGES_LOADED);
        if (store.size() > 0) {
            changeState(getCorrespondenceState());
        }

        recomputeIfAutomatic();
    }

    public void clearImages() {
        synchronized (this) {
            this.imageA = null;
            this.imageB = null;
            this.configurationVersion++;
            latestResult.set(null);
        }
        changeState(SessionState.EMPTY);
    }

    public void setTransformMode(final TransformMode transformMode) {
        synchronized (this) {
            this.transformMode = transformMode;
            this.configurationVersion++;
        }
        if (getState().hasImages()) {
            changeState(getCorrespondenceState());
        }
        recomputeIfAutomatic();
    }

    public void setComposite(final CompositeMode compositeMode,
                             final CompositeParameters compositeParameters) {
        synchronized (this) {
            this.compositeMode = compositeMode;
            this.compositeParameters = compositeParameters;
            this.configurationVersion++;
        }
        recomputeIfAutomatic();
    }

    /**
     * @param  autoRecompute  true to submit a new run after every store mutation or configuration change
     *                        that leaves enough correspondences for the current transform mode.
     */
    public synchronized void setAutoRecompute(final boolean autoRecompute) {
        this.autoRecompute = autoRecompute;
    }

    public synchronized boolean isAutoRecompute() {
        return autoRecompute;
    }

    public synchronized TransformMode getTransformMode() {
        return transformMode;
    }

    public synchronized SessionState getState() {
        return state;
    }

    /**
     * @return the last applied result (null if none has been applied since the images were loaded).
     */
    public ComputeResult getLatestResult() {
        return latestResult.get();
    }

    /**
     * Submits a pipeline run for the store's current generation.
     *
     * @return the captured generation.
     *
     * @throws IllegalStateException
     *   if no images have been loaded.
     */
    public long submit()
            throws IllegalStateException {

        final ComputeRequest request;
        synchronized (this) {
            if (imageA == null) {
                throw new IllegalStateException("images must be loaded before computing an alignment");
            }
            request = new ComputeRequest(store.snapshot(),
                                         configurationVersion,
                                         imageA,
                                         imageB,
                                         transformMode,
                                         compositeMode,
                                         compositeParameters);
        }

        LOG.info("submit: submitting {}", request);

        executor.execute(() -> run(request));

        return request.snapshot.getGeneration();
    }

    @Override
    public void storeChanged(final CorrespondenceStore changedStore,
                             final long generation) {
        if (getState().hasImages()) {
            changeState(getCorrespondenceState());
            recomputeIfAutomatic();
        }
    }

    private void recomputeIfAutomatic() {
        if (isAutoRecompute() && (getState() == SessionState.CORRESPONDENCES_SUFFICIENT)) {
            submit();
        }
    }

    private SessionState getCorrespondenceState() {
        return SessionState.forPointPairCount(store.flattenToPointPairs().size(),
                                              getTransformMode().getMinimumPointPairs());
    }

    private void run(final ComputeRequest request) {
        ComputeResult result;
        try {
            result = compute(request);
        } catch (final RuntimeException e) {
            LOG.error("run: failed to compute " + request, e);
            result = ComputeResult.failure(request.getGeneration(),
                                           request.configurationVersion,
                                           null,
                                           null,
                                           e.getMessage());
        }
        apply(result);
    }

    private ComputeResult compute(final ComputeRequest request) {

        final long startTime = System.currentTimeMillis();

        final SolveResult solveResult = solver.computeTransform(request.snapshot, request.transformMode);
        if (! solveResult.isSuccessful()) {
            return ComputeResult.failure(request.getGeneration(),
                                         request.configurationVersion,
                                         solveResult,
                                         solveResult.getError(),
                                         solveResult.getErrorMessage());
        }
        advanceState(request, SessionState.TRANSFORM_COMPUTED);

        final WarpResult warpResult = warpRenderer.warp(request.imageB,
                                                        solveResult.getTransform(),
                                                        request.imageA.getWidth(),
                                                        request.imageA.getHeight());
        if (! warpResult.isSuccessful()) {
            return ComputeResult.failure(request.getGeneration(),
                                         request.configurationVersion,
                                         solveResult,
                                         warpResult.getError(),
                                         warpResult.getErrorMessage());
        }
        advanceState(request, SessionState.WARPED);

        final BufferedImage compositeImage = compositeRenderer.composite(request.imageA,
                                                                         warpResult.getImage(),
                                                                         request.compositeMode,
                                                                         request.compositeParameters);

        LOG.info("compute: generation {} took {} milliseconds",
                 request.getGeneration(), System.currentTimeMillis() - startTime);

        return ComputeResult.success(request.getGeneration(),
                                     request.configurationVersion,
                                     solveResult,
                                     warpResult.getImage(),
                                     compositeImage);
    }

    private void apply(final ComputeResult result) {

        if (! isCurrent(result.getGeneration(), result.getConfigurationVersion())) {
            discard(result);
            return;
        }

        if (! result.isSuccessful()) {
            LOG.warn("apply: keeping previous result, generation {} failed with {}: {}",
                     result.getGeneration(), result.getError(), result.getErrorMessage());
            for (final ComputeListener listener : listeners) {
                listener.computeFailed(result);
            }
            return;
        }

        if (! applyIfCurrent(result)) {
            discard(result);
            return;
        }

        LOG.info("apply: applied result for generation {}", result.getGeneration());

        if (isCurrent(result.getGeneration(), result.getConfigurationVersion())) {
            changeState(SessionState.COMPOSITED);
        }

        for (final ComputeListener listener : listeners) {
            listener.resultApplied(result);
        }
    }

    /**
     * Installs the result while holding both the coordinator and the store locks so that no mutation or
     * configuration change can slip in between the staleness check and the update.
     *
     * @return true if the result was installed.
     */
    private boolean applyIfCurrent(final ComputeResult result) {
        synchronized (this) {
            synchronized (store) {
                if (! isCurrent(result.getGeneration(), result.getConfigurationVersion())) {
                    return false;
                }
                final ComputeResult previous = latestResult.get();
                if ((previous != null) && (! isNewer(result, previous))) {
                    return false;
                }
                latestResult.set(result);
                // markSolved re-reads the generation, so a mutation made while checking is still caught
                if (! store.markSolved(result.getGeneration())) {
                    latestResult.set(previous);
                    return false;
                }
                return true;
            }
        }
    }

    private void discard(final ComputeResult result) {
        LOG.info("discard: dropping superseded result for generation {} (store generation is {})",
                 result.getGeneration(), store.getGeneration());
        for (final ComputeListener listener : listeners) {
            listener.resultDiscarded(result);
        }
    }

    private synchronized boolean isCurrent(final long generation,
                                           final long resultConfigurationVersion) {
        return (generation == store.getGeneration()) && (resultConfigurationVersion == configurationVersion);
    }

    private static boolean isNewer(final ComputeResult result,
                                   final ComputeResult previous) {
        final boolean isNewer;
        if (result.getConfigurationVersion() == previous.getConfigurationVersion()) {
            isNewer = result.getGeneration() > previous.getGeneration();
        } else {
            isNewer = result.getConfigurationVersion() > previous.getConfigurationVersion();
        }
        return isNewer;
    }

    private void advanceState(final ComputeRequest request,
                              final SessionState toState) {
        if (isCurrent(request.getGeneration(), request.configurationVersion)) {
            changeState(toState);
        }
    }

    private void changeState(final SessionState toState) {
        final SessionState fromState;
        synchronized (this) {
            fromState = state;
            state = toState;
        }
        if (fromState != toState) {
            LOG.debug("changeState: {} -> {}", fromState, toState);
            for (final ComputeListener listener : listeners) {
                listener.stateChanged(fromState, toState);
            }
        }
    }

    /**
     * Everything a pipeline run reads, captured at submission time.
     */
    private static class ComputeRequest {

        private final CorrespondenceSnapshot snapshot;
        private final long configurationVersion;
        private final BufferedImage imageA;
        private final BufferedImage imageB;
        private final TransformMode transformMode;
        private final CompositeMode compositeMode;
        private final CompositeParameters compositeParameters;

        ComputeRequest(final CorrespondenceSnapshot snapshot,
                       final long configurationVersion,
                       final BufferedImage imageA,
                       final BufferedImage imageB,
                       final TransformMode transformMode,
                       final CompositeMode compositeMode,
                       final CompositeParameters compositeParameters) {
            this.snapshot = snapshot;
            this.configurationVersion = configurationVersion;
            this.imageA = imageA;
            this.imageB = imageB;
            this.transformMode = transformMode;
            this.compositeMode = compositeMode;
            this.compositeParameters = compositeParameters;
        }

        long getGeneration() {
            return snapshot.getGeneration();
        }

        @Override
        public String toString() {
            return "{generation: " + snapshot.getGeneration() +
                   ", configurationVersion: " + configurationVersion +
                   ", correspondenceCount: " + snapshot.size() +
                   ", transformMode: " + transformMode +
                   ", compositeMode: " + compositeMode + '}';
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ComputeCoordinator.class);
}
