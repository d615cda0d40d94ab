/**
 **
 ** NeuralOptimizer - tracking with learned robust weights and learned regularization priors
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  NeuralOptimizer.java is free software: you can redistribute it and/or modify
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
import com.elphel.facetrack.regularize.RegularizeModule;
import com.elphel.facetrack.residuals.ResidualChain;
import com.elphel.facetrack.weighting.WeightingModule;

/**
 * The weighting latent code is passed to the regularization module. Use
 * {@link #trackIcp} for the plain ICP baseline of the same configuration.
 */
public class NeuralOptimizer extends OptimizerFramework {

	public NeuralOptimizer(
			ParametricModel   model,
			Renderer          renderer,
			TrackerParameters tracker_parameters,
			WeightingModule   w_module,
			RegularizeModule  r_module) {
		this(model, renderer, tracker_parameters, ResidualChain.parse(tracker_parameters.residuals), w_module, r_module);
	}

	public NeuralOptimizer(
			ParametricModel   model,
			Renderer          renderer,
			TrackerParameters tracker_parameters,
			ResidualChain     residuals,
			WeightingModule   w_module,
			RegularizeModule  r_module) {
		super(model, renderer, tracker_parameters, residuals, w_module, r_module);
	}
}
