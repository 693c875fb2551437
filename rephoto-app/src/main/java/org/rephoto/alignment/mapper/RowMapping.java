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
package org.rephoto.alignment.mapper;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.rephoto.alignment.transform.WarpTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inverse maps every target pixel through a {@link WarpTransform} (target to source direction)
 * and hands the resulting source coordinate to a {@link PixelMapper}.
 * Coordinates are batch evaluated one row at a time and rows are distributed across threads.
 */
public class RowMapping {

    private final WarpTransform targetToSource;

    public RowMapping(final WarpTransform targetToSource) {
        this.targetToSource = targetToSource;
    }

    public final void map(final PixelMapper pixelMapper) {
        map(pixelMapper, Runtime.getRuntime().availableProcessors());
    }

    public final void map(final PixelMapper pixelMapper,
                          final int numThreads) {

        final int threadCount = Math.max(1, Math.min(numThreads, pixelMapper.getTargetHeight()));
        final AtomicInteger nextRow = new AtomicInteger(0);

        if (threadCount > 1) {
            final AtomicReference<Throwable> failure = new AtomicReference<>();
            final List<Thread> threads = new ArrayList<>(threadCount);
            for (int k = 0; k < threadCount; ++k) {
                final Thread mrt = new MapRowThread(nextRow, targetToSource, pixelMapper);
                mrt.setUncaughtExceptionHandler((thread, throwable) -> failure.compareAndSet(null, throwable));
                threads.add(mrt);
                mrt.start();
            }
            for (final Thread mrt : threads) {
                try {
                    mrt.join();
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted while waiting for row mapping threads", e);
                }
            }
            if (failure.get() != null) {
                throw new IllegalStateException("row mapping failed", failure.get());
            }
        } else {
            mapRows(nextRow, targetToSource, pixelMapper);
        }

        LOG.debug("map: mapped {} rows with {} thread(s)", pixelMapper.getTargetHeight(), threadCount);
    }

    private static final class MapRowThread extends Thread {
        private final AtomicInteger nextRow;
        private final WarpTransform targetToSource;
        private final PixelMapper pixelMapper;

        MapRowThread(final AtomicInteger nextRow,
                     final WarpTransform targetToSource,
                     final PixelMapper pixelMapper) {
            this.nextRow = nextRow;
            this.targetToSource = targetToSource;
            this.pixelMapper = pixelMapper;
        }

        @Override
        final public void run() {
            mapRows(nextRow, targetToSource, pixelMapper);
        }
    }

    private static void mapRows(final AtomicInteger nextRow,
                                final WarpTransform targetToSource,
                                final PixelMapper pixelMapper) {

        final int width = pixelMapper.getTargetWidth();
        final int height = pixelMapper.getTargetHeight();
        final double[] sourceX = new double[width];
        final double[] sourceY = new double[width];
        final boolean isMappingInterpolated = pixelMapper.isMappingInterpolated();

        for (int targetY = nextRow.getAndIncrement(); targetY < height; targetY = nextRow.getAndIncrement()) {

            targetToSource.applyToRow(targetY, sourceX, sourceY);

            if (isMappingInterpolated) {
                for (int targetX = 0; targetX < width; ++targetX) {
                    pixelMapper.mapInterpolated(sourceX[targetX], sourceY[targetX], targetX, targetY);
                }
            } else {
                for (int targetX = 0; targetX < width; ++targetX) {
                    pixelMapper.map(sourceX[targetX], sourceY[targetX], targetX, targetY);
                }
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(RowMapping.class);
}
