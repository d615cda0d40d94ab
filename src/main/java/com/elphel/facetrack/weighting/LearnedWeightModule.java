/**
 **
 ** LearnedWeightModule - adapter for a trained weight predictor, sanitizes its output
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LearnedWeightModule.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.weighting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.facetrack.optimizer.DimensionMismatchException;

public class LearnedWeightModule implements WeightingModule {
	private static final Logger LOGGER = LoggerFactory.getLogger(LearnedWeightModule.class);

	private final WeightPredictor predictor;

	public LearnedWeightModule(WeightPredictor predictor) {
		this.predictor = predictor;
	}

	/**
	 * Weights of the wrong length are a wiring error and throw DimensionMismatchException.
	 * Negative and non-finite weights are replaced by zeros.
	 */
	@Override
	public WeightOutput predict(
			double [][] s_point,
			double [][] s_normal,
			double [][] t_point,
			double [][] t_normal) {
		WeightOutput out = predictor.predict(s_point, s_normal, t_point, t_normal);
		double [] weights = out.getWeights();
		if (weights.length != s_point.length) {
			throw new DimensionMismatchException("Predicted weights", s_point.length, weights.length);
		}
		double [] clean = weights.clone();
		int num_bad = 0;
		for (int i = 0; i < clean.length; i++) {
			if (!(clean[i] >= 0.0) || Double.isInfinite(clean[i])) {
				clean[i] = 0.0;
				num_bad++;
			}
		}
		if (num_bad > 0) {
			LOGGER.warn("Weight predictor returned {} negative or non-finite weights (of {}), replaced by zeros",
					num_bad, clean.length);
		}
		return new WeightOutput(clean, out.getLatent());
	}
}
