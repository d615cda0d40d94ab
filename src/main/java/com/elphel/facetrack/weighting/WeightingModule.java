/**
 **
 ** WeightingModule - robust per-correspondence weighting of the geometric residuals
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WeightingModule.java is free software: you can redistribute it and/or modify
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

/**
 * Predicts a non-negative weight for every pixel of the observation. Weights are selected
 * by the correspondence mask before they multiply the geometric residuals, a zero weight
 * suppresses the pixel without changing the mask.
 */
public interface WeightingModule {
	WeightOutput predict(
			double [][] s_point,
			double [][] s_normal,
			double [][] t_point,
			double [][] t_normal);

	default String getName() {
		return getClass().getSimpleName();
	}
}
