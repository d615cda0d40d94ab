/**
 **
 ** VertexOptimizer - fits the model to known target vertices, no rendering
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  VertexOptimizer.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.tracker;

import com.elphel.facetrack.model.ParametricModel;
import com.elphel.facetrack.residuals.ResidualChain;
import com.elphel.facetrack.residuals.VertexResidual;

public class VertexOptimizer extends OptimizerFramework {

	public VertexOptimizer(ParametricModel model, TrackerParameters tracker_parameters) {
		this(model, tracker_parameters, ResidualChain.parse(VertexResidual.NAME));
	}

	/**
	 * @param residuals terms that do not need correspondences, for example "vertices,regularize"
	 */
	public VertexOptimizer(ParametricModel model, TrackerParameters tracker_parameters, ResidualChain residuals) {
		super(model, null, tracker_parameters, residuals, null, null);
	}
}
