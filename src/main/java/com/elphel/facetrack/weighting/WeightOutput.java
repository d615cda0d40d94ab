/**
 **
 ** WeightOutput - per-correspondence robust weights with the latent code passed to the regularization
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WeightOutput.java is free software: you can redistribute it and/or modify
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

public class WeightOutput {
	private final double [] weights; // [num_pixels], >= 0
	private final double [] latent;  // empty when the module has none

	public WeightOutput(double [] weights, double [] latent) {
		this.weights = weights;
		this.latent =  (latent != null) ? latent : new double [0];
	}

	public double [] getWeights() {
		return weights;
	}

	public double [] getLatent() {
		return latent;
	}

	/** @return {min, max, mean} of the weights, NaN for an empty array */
	public double [] getMinMaxMean() {
		if (weights.length == 0) {
			return new double [] {Double.NaN, Double.NaN, Double.NaN};
		}
		double mn = Double.POSITIVE_INFINITY, mx = Double.NEGATIVE_INFINITY, s = 0.0;
		for (double w : weights) {
			mn = Math.min(mn, w);
			mx = Math.max(mx, w);
			s += w;
		}
		return new double [] {mn, mx, s / weights.length};
	}
}
