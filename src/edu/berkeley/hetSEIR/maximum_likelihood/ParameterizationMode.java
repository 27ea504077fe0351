 /*
    This file is part of hetSEIR.

    hetSEIR is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    hetSEIR is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.

    You should have received a copy of the GNU General Public License
    along with hetSEIR.  If not, see <http://www.gnu.org/licenses/>.
  */

package edu.berkeley.hetSEIR.maximum_likelihood;

import java.util.Locale;

/// what the fitted per-group parameter vector multiplies
public enum ParameterizationMode {
	/// activity-weighted exposure: contacts made and received both scale with the parameter
	ACTIVITY ("activity"),
	/// susceptibility-weighted hazard
	SUSCEPTIBILITY ("susceptibility");
	
	public final String label;
	
	private ParameterizationMode (String label) {
		this.label = label;
	}
	
	public static ParameterizationMode fromString (String mode) {
		if (mode != null) {
			String modeLow = mode.trim().toLowerCase (Locale.ROOT);
			for (ParameterizationMode candidate : values()) {
				if (candidate.label.equals (modeLow)) return candidate;
			}
		}
		throw new ModelNotRecognizedException ("Model not recognized: " + mode + " (use activity or susceptibility).");
	}
}
