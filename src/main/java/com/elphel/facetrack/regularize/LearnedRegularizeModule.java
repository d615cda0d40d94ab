/**
 **
 ** LearnedRegularizeModule - adapter for a trained prior predictor, broadcasts and sanitizes its output
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LearnedRegularizeModule.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.regularize;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.facetrack.optimizer.DimensionMismatchException;
import com.elphel.facetrack.optimizer.ParameterSet;

public class LearnedRegularizeModule implements RegularizeModule {
	private static final Logger LOGGER = LoggerFactory.getLogger(LearnedRegularizeModule.class);

	private final PriorPredictor predictor;

	public LearnedRegularizeModule(PriorPredictor predictor) {
		this.predictor = predictor;
	}

	/**
	 * Vectors of length 1 are broadcast over the group, other lengths must match the group
	 * size. Non-finite deltas drop the group, negative or non-finite weights become zeros.
	 * Groups the predictor does not mention stay unregularized.
	 */
	@Override
	public RegularizeOutput predict(ParameterSet params, List<String> active_names, double [] latent) {
		RegularizeOutput out = predictor.predict(params, active_names, latent);
		LinkedHashMap<String, double []> deltas =  new LinkedHashMap<String, double []>();
		LinkedHashMap<String, double []> weights = new LinkedHashMap<String, double []>();
		for (String name : active_names) {
			int size = params.size(name);
			double [] delta =  broadcast(name, "delta",  out.getDelta(name),  size);
			double [] weight = broadcast(name, "weight", out.getWeight(name), size);
			if ((delta != null) && !isFinite(delta)) {
				LOGGER.warn("Prior predictor returned non-finite delta for \"{}\", group is not regularized", name);
				delta = null;
			}
			if (weight != null) {
				int num_bad = 0;
				for (int i = 0; i < weight.length; i++) {
					if (!(weight[i] >= 0.0) || Double.isInfinite(weight[i])) {
						weight[i] = 0.0;
						num_bad++;
					}
				}
				if (num_bad > 0) {
					LOGGER.warn("Prior predictor returned {} negative or non-finite weights for \"{}\", replaced by zeros",
							num_bad, name);
				}
			}
			deltas.put(name,  delta);
			weights.put(name, weight);
		}
		return new RegularizeOutput(deltas, weights);
	}

	private static double [] broadcast(String name, String what, double [] v, int size) {
		if (v == null) {
			return null;
		}
		if (v.length == size) {
			return v.clone();
		}
		if (v.length == 1) {
			double [] rslt = new double [size];
			Arrays.fill(rslt, v[0]);
			return rslt;
		}
		throw new DimensionMismatchException("Prior "+what+" of \""+name+"\"", size, v.length);
	}

	private static boolean isFinite(double [] v) {
		for (double d : v) {
			if (!Double.isFinite(d)) {
				return false;
			}
		}
		return true;
	}
}
