/**
 **
 ** DifferentiableModel - parametric model that provides analytic derivatives
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DifferentiableModel.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.model;

import com.elphel.facetrack.optimizer.ParameterLayout;
import com.elphel.facetrack.optimizer.ParameterSet;

public interface DifferentiableModel extends ParametricModel {
	/**
	 * @param params non-batched parameter set
	 * @param layout non-batched layout of the active parameters
	 * @return derivatives for each layout column
	 */
	ModelJacobian getJacobian(ParameterSet params, ParameterLayout layout);
}
