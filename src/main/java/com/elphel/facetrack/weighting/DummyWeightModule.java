/**
 **
 ** DummyWeightModule - uniform weights, plain ICP
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DummyWeightModule.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

public class DummyWeightModule implements WeightingModule {
	@Override
	public WeightOutput predict(
			double [][] s_point,
			double [][] s_normal,
			double [][] t_point,
			double [][] t_normal) {
		double [] weights = new double [s_point.length];
		Arrays.fill(weights, 1.0);
		return new WeightOutput(weights, new double [0]);
	}
}
