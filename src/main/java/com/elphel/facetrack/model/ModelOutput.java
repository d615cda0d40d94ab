/**
 **
 ** ModelOutput - geometry produced by the parametric model for one parameter set
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ModelOutput.java is free software: you can redistribute it and/or modify
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

public class ModelOutput {
	private final double [][] vertices;  // [num_vertices][3]
	private final double [][] landmarks; // [num_landmarks][3]

	public ModelOutput(double [][] vertices, double [][] landmarks) {
		this.vertices =  vertices;
		this.landmarks = (landmarks != null) ? landmarks : new double [0][3];
	}

	public double [][] getVertices() {
		return vertices;
	}

	public double [][] getLandmarks() {
		return landmarks;
	}

	public int getNumVertices() {
		return vertices.length;
	}

	public int getNumLandmarks() {
		return landmarks.length;
	}
}
