/**
 **
 ** ResidualResult - stacked residual vector with diagnostic values of the residual terms
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResidualResult.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */
package com.elphel.facetrack.optimizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class ResidualResult {
	private final double []           residuals;
	private final Map<String, Double> info;

	public ResidualResult(double [] residuals) {
		this(residuals, Collections.<String, Double>emptyMap());
	}

	public ResidualResult(double [] residuals, Map<String, Double> info) {
		this.residuals = residuals;
		this.info =      Collections.unmodifiableMap(new LinkedHashMap<String, Double>(info));
	}

	/** @return residual vector, not copied - callers should not modify it */
	public double [] getResiduals() {
		return residuals;
	}

	public int length() {
		return residuals.length;
	}

	public Map<String, Double> getInfo() {
		return info;
	}

	/** @return 0.5 * sum of squared residuals */
	public double loss() {
		double s = 0.0;
		for (double r : residuals) {
			s += r * r;
		}
		return 0.5 * s;
	}

	public boolean isFinite() {
		for (double r : residuals) {
			if (!Double.isFinite(r)) {
				return false;
			}
		}
		return true;
	}
}
