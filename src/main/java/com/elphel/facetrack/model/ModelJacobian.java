/**
 **
 ** ModelJacobian - derivatives of the model vertices and landmarks with respect to the active parameters
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ModelJacobian.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.model;

public class ModelJacobian {
	private final double [][][] d_vertices;  // [num_pars][num_vertices][3]
	private final double [][][] d_landmarks; // [num_pars][num_landmarks][3]

	public ModelJacobian(double [][][] d_vertices, double [][][] d_landmarks) {
		this.d_vertices =  d_vertices;
		this.d_landmarks = d_landmarks;
	}

	public double [][][] getVertexDerivatives() {
		return d_vertices;
	}

	public double [][][] getLandmarkDerivatives() {
		return d_landmarks;
	}

	public int getNumParameters() {
		return d_vertices.length;
	}
}
