/**
 **
 ** DifferentiableResidualFunction - residual function that can provide its own Jacobian
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DifferentiableResidualFunction.java is free software: you can redistribute it and/or modify
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

public interface DifferentiableResidualFunction extends ResidualFunction {
	/**
	 * Transposed Jacobian of the residuals with respect to the active parameters
	 * @param params full parameter set to differentiate at
	 * @param layout active parameters layout (columns of the Jacobian)
	 * @return jt[layout.getNumParameters()][num_residuals], jt[j][i] = dF_i/dtheta_j,
	 *         or null if not available (finite differences will be used)
	 */
	double [][] getJacobianTransposed(ParameterSet params, ParameterLayout layout);
}
