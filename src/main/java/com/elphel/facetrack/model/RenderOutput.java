/**
 **
 ** RenderOutput - per-pixel buffers of the rendered model
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  RenderOutput.java is free software: you can redistribute it and/or modify
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

/**
 * Rasterized model for the current parameters. All per-pixel arrays have the same length
 * (width*height of the current scale), pixels outside of the model have mask == false.
 */
public class RenderOutput {
	private final boolean []   mask;         // [num_pixels]
	private final double [][]  point;        // [num_pixels][3]
	private final double [][]  normal;       // [num_pixels][3]
	private final double [][]  color;        // [num_pixels][3] or null
	private final int [][]     vertices_idx; // [num_pixels][3] - triangle vertex indices
	private final double [][]  bary_coords;  // [num_pixels][3]
	private final double [][]  landmark;     // [num_landmarks][3]
	private final double [][]  normal_image; // [num_pixels][3] or null, for display
	private final double []    depth_image;  // [num_pixels] or null, for display

	public RenderOutput(
			boolean []  mask,
			double [][] point,
			double [][] normal,
			double [][] color,
			int [][]    vertices_idx,
			double [][] bary_coords,
			double [][] landmark,
			double [][] normal_image,
			double []   depth_image)
	{
		if ((point.length != mask.length) || (normal.length != mask.length) ||
				(vertices_idx.length != mask.length) || (bary_coords.length != mask.length)) {
			throw new IllegalArgumentException("Render buffers should have the same length as the mask ("+mask.length+")");
		}
		this.mask =         mask;
		this.point =        point;
		this.normal =       normal;
		this.color =        color;
		this.vertices_idx = vertices_idx;
		this.bary_coords =  bary_coords;
		this.landmark =     (landmark != null) ? landmark : new double [0][3];
		this.normal_image = normal_image;
		this.depth_image =  depth_image;
	}

	public boolean []  getMask()        {return mask;}
	public double [][] getPoint()       {return point;}
	public double [][] getNormal()      {return normal;}
	public double [][] getColor()       {return color;}
	public int [][]    getVerticesIdx() {return vertices_idx;}
	public double [][] getBaryCoords()  {return bary_coords;}
	public double [][] getLandmark()    {return landmark;}
	public double [][] getNormalImage() {return normal_image;}
	public double []   getDepthImage()  {return depth_image;}

	public int getNumPixels() {
		return mask.length;
	}
}
