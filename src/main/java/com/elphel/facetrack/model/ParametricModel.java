/**
 **
 ** ParametricModel - deformable face model: vertices and landmarks as a function of the parameters
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ParametricModel.java is free software: you can redistribute it and/or modify
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

import com.elphel.facetrack.optimizer.ParameterSet;

public interface ParametricModel {
	/**
	 * Evaluate the model geometry. May be called concurrently when finite difference
	 * Jacobians are calculated with more than one thread.
	 * @param params non-batched parameter set
	 * @return vertices and landmarks in world coordinates
	 */
	ModelOutput forward(ParameterSet params);
}
