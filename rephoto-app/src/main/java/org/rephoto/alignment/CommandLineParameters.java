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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.rephoto.alignment.json.JsonUtils;

/**
 * Base parameters for all command line tools.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(names = "--help", description = "Display this note", help = true)
    protected transient boolean help;

    private transient JCommander jCommander;

    public CommandLineParameters() {
        this.help = false;
        this.jCommander = null;
    }

    /**
     * Parses the specified arguments into this instance, printing usage if help was requested or parsing failed.
     *
     * @throws IllegalArgumentException
     *   if the arguments cannot be parsed.
     */
    public void parse(final String[] args,
                      final Class programClass)
            throws IllegalArgumentException {

        jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp rephoto-app.jar " + programClass.getName());

        try {
            jCommander.parse(args);
        } catch (final ParameterException pe) {
            jCommander.getConsole().println("\nERROR: failed to parse command line arguments\n\n" + pe.getMessage() + "\n");
            jCommander.usage();
            throw new IllegalArgumentException("failed to parse command line arguments", pe);
        }

        if (help) {
            jCommander.usage();
        }
    }

    public boolean isHelp() {
        return help;
    }

    /**
     * @return string representation of these parameters.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

}
