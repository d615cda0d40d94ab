/**
 **
 ** Renderer - differentiable rasterizer contract
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Renderer.java is free software: you can redistribute it and/or modify
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

public interface Renderer {
	/**
	 * Rasterize model geometry at the current working resolution
	 * @param geometry model vertices and landmarks
	 * @return per-pixel buffers
	 */
	RenderOutput render(ModelOutput geometry);

	/**
	 * Interpolate new per-vertex attributes with the rasterization of a previous render,
	 * without rasterizing again.
	 */
	default double [][] maskInterpolate(
			int [][]    vertices_idx,
			double [][] bary_coords,
			double [][] attributes,
			boolean []  mask) {
		return Barycentric.interpolate(vertices_idx, bary_coords, attributes, mask);
	}
}
