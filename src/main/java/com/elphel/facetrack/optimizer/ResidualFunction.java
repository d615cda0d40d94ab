/**
 **
 ** ResidualFunction - residual evaluation used by the optimizer step
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResidualFunction.java is free software: you can redistribute it and/or modify
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

/**
 * Pure function of the full parameter set. The optimizer builds the argument with
 * {@link DifferentiableOptimizer#residualParams(double[])}, overlaying the free variables
 * over the fixed values. Residual order and length must stay the same for all evaluations
 * of one step.
 */
@FunctionalInterface
public interface ResidualFunction {
	ResidualResult evaluate(ParameterSet params);
}
