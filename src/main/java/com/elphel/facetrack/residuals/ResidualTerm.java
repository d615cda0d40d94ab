/**
 **
 ** ResidualTerm - one named contributor to the stacked residual vector
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResidualTerm.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.residuals;

import com.elphel.facetrack.optimizer.ParameterLayout;

public interface ResidualTerm {
	String getName();

	/** @return raw (unweighted) residuals */
	double [] compute(ResidualContext ctx);

	/**
	 * @return transposed derivatives of the raw residuals [num_pars][num_residuals], or null
	 *         when the context carries no model derivatives
	 */
	double [][] getJacobianTransposed(ResidualContext ctx, ParameterLayout layout);

	/** @return true if the term needs rendering and correspondence search */
	default boolean requiresCorrespondences() {
		return false;
	}

	/** @return true if the term is multiplied by the robust per-correspondence weights */
	default boolean isGeometric() {
		return false;
	}

	/** @return number of residuals per correspondence */
	default int getStride() {
		return 1;
	}
}
