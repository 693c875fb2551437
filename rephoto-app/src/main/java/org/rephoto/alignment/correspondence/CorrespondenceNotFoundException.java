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

/**
 * Thrown when an operation references a correspondence id that is not in the store.
 */
public class CorrespondenceNotFoundException
        extends IllegalArgumentException {

    private final long id;

    public CorrespondenceNotFoundException(final long id) {
        super("correspondence " + id + " does not exist");
        this.id = id;
    }

    public long getId() {
        return id;
    }
}
