/**
 **
 ** HuberWeightModule - Huber kernel weights from the point-to-plane distance
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  HuberWeightModule.java is free software: you can redistribute it and/or modify
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

import com.elphel.facetrack.optimizer.ConfigurationException;

/**
 * w = 1 for |r| &lt;= k, w = k/|r| otherwise, where r = dot(t_point - s_point, t_normal).
 * Pixels without geometry get zero weight.
 */
public class HuberWeightModule implements WeightingModule {
	private final double k;

	public HuberWeightModule(double k) {
		if (!(k > 0.0)) {
			throw new ConfigurationException("Huber threshold should be positive, got "+k);
		}
		this.k = k;
	}

	public double getThreshold() {
		return k;
	}

	@Override
	public WeightOutput predict(
			double [][] s_point,
			double [][] s_normal,
			double [][] t_point,
			double [][] t_normal) {
		double [] weights = new double [s_point.length];
		for (int i = 0; i < weights.length; i++) {
			if ((s_point[i] == null) || (t_point[i] == null) || (t_normal[i] == null)) {
				continue;
			}
			double r = 0.0;
			for (int c = 0; c < 3; c++) {
				r += (t_point[i][c] - s_point[i][c]) * t_normal[i][c];
			}
			r = Math.abs(r);
			if (r <= k) {
				weights[i] = 1.0;
			} else if (Double.isFinite(r)) {
				weights[i] = k / r;
			} // NaN and infinite - 0
		}
		return new WeightOutput(weights, new double [0]);
	}
}
