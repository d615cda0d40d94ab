/**
 **
 ** RegularizeOutput - per-group prior offsets and confidences, null excludes the group
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  RegularizeOutput.java is free software: you can redistribute it and/or modify
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RegularizeOutput {
	private final Map<String, double []> deltas;
	private final Map<String, double []> weights;

	public RegularizeOutput(Map<String, double []> deltas, Map<String, double []> weights) {
		this.deltas =  Collections.unmodifiableMap(new LinkedHashMap<String, double []>(deltas));
		this.weights = Collections.unmodifiableMap(new LinkedHashMap<String, double []>(weights));
	}

	public static RegularizeOutput empty() {
		return new RegularizeOutput(Collections.<String, double []>emptyMap(), Collections.<String, double []>emptyMap());
	}

	public Map<String, double []> getDeltas() {
		return deltas;
	}

	public Map<String, double []> getWeights() {
		return weights;
	}

	/** @return prior offset of the group or null */
	public double [] getDelta(String name) {
		return deltas.get(name);
	}

	/** @return prior confidence of the group or null */
	public double [] getWeight(String name) {
		return weights.get(name);
	}

	/**
	 * @param name parameter group
	 * @return true if both delta and weight are defined for the group
	 */
	public boolean isRegularized(String name) {
		return (deltas.get(name) != null) && (weights.get(name) != null);
	}

	/**
	 * Multiply the weights by per-group static factors, groups without a factor keep their
	 * weights unchanged
	 * @param scales group name to factor
	 * @return new output
	 */
	public RegularizeOutput scaleWeights(Map<String, Double> scales) {
		LinkedHashMap<String, double []> scaled = new LinkedHashMap<String, double []>();
		for (Map.Entry<String, double []> entry : weights.entrySet()) {
			double [] w = entry.getValue();
			Double scale = scales.get(entry.getKey());
			if ((w != null) && (scale != null)) {
				w = w.clone();
				for (int i = 0; i < w.length; i++) {
					w[i] *= scale;
				}
			}
			scaled.put(entry.getKey(), w);
		}
		return new RegularizeOutput(deltas, scaled);
	}

	/**
	 * @param outputs regularization outputs of a tracking call
	 * @return mean over the calls of min/max/mean of deltas and weights, keys like
	 *         "mean_reg_delta_shape" or "max_reg_weight_transl"
	 */
	public static Map<String, Double> summarize(List<RegularizeOutput> outputs) {
		LinkedHashMap<String, double []> acc = new LinkedHashMap<String, double []>(); // {sum, count}
		for (RegularizeOutput out : outputs) {
			accumulate(acc, "reg_delta_",  out.getDeltas());
			accumulate(acc, "reg_weight_", out.getWeights());
		}
		LinkedHashMap<String, Double> rslt = new LinkedHashMap<String, Double>();
		for (Map.Entry<String, double []> entry : acc.entrySet()) {
			rslt.put(entry.getKey(), entry.getValue()[0] / entry.getValue()[1]);
		}
		return rslt;
	}

	private static void accumulate(Map<String, double []> acc, String prefix, Map<String, double []> values) {
		for (Map.Entry<String, double []> entry : values.entrySet()) {
			double [] v = entry.getValue();
			if ((v == null) || (v.length == 0)) {
				continue;
			}
			double mn = Double.POSITIVE_INFINITY, mx = Double.NEGATIVE_INFINITY, s = 0.0;
			for (double d : v) {
				mn = Math.min(mn, d);
				mx = Math.max(mx, d);
				s += d;
			}
			add(acc, "min_"+prefix+entry.getKey(),  mn);
			add(acc, "max_"+prefix+entry.getKey(),  mx);
			add(acc, "mean_"+prefix+entry.getKey(), s / v.length);
		}
	}

	private static void add(Map<String, double []> acc, String key, double value) {
		double [] a = acc.get(key);
		if (a == null) {
			a = new double [2];
			acc.put(key, a);
		}
		a[0] += value;
		a[1] += 1;
	}
}
