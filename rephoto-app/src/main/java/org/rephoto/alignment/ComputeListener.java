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

/**
 * Receives {@link ComputeCoordinator} events.  Callbacks are made on the thread that completed the
 * computation (or made the mutation), so interaction layers must hand them over to their own thread.
 */
public interface ComputeListener {

    /**
     * Called when a result for the current generation has been accepted as the latest result.
     */
    void resultApplied(final ComputeResult result);

    /**
     * Called when a result was superseded by a later mutation (or image reload) and has been dropped.
     */
    default void resultDiscarded(final ComputeResult result) {
    }

    /**
     * Called when the computation for the current generation failed.  The previously applied result stays current.
     */
    default void computeFailed(final ComputeResult result) {
    }

    default void stateChanged(final SessionState fromState,
                              final SessionState toState) {
    }

}
