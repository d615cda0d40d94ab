/**
 **
 ** ICPOptimizer - geometric ICP tracking with uniform or Huber weights and neutral regularization
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ICPOptimizer.java is free software: you can redistribute it and/or modify
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
import com.elphel.facetrack.model.Renderer;
import com.elphel.facetrack.regularize.DummyRegularizeModule;
import com.elphel.facetrack.residuals.ResidualChain;
import com.elphel.facetrack.weighting.DummyWeightModule;
import com.elphel.facetrack.weighting.HuberWeightModule;
import com.elphel.facetrack.weighting.WeightingModule;

public class ICPOptimizer extends OptimizerFramework {

	/**
	 * Residual terms from the parameters, Huber weights when huber_k &gt; 0
	 */
	public ICPOptimizer(ParametricModel model, Renderer renderer, TrackerParameters tracker_parameters) {
		this(model, renderer, tracker_parameters,
				ResidualChain.parse(tracker_parameters.residuals),
				(tracker_parameters.huber_k > 0.0) ? new HuberWeightModule(tracker_parameters.huber_k) : new DummyWeightModule());
	}

	public ICPOptimizer(
			ParametricModel   model,
			Renderer          renderer,
			TrackerParameters tracker_parameters,
			ResidualChain     residuals,
			WeightingModule   w_module) {
		super(model, renderer, tracker_parameters, residuals, w_module, new DummyRegularizeModule());
	}
}
