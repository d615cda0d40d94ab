/**
 **
 ** FrameData - observed depth frame: masked points and normals, landmarks, optional ground truth
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FrameData.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

import com.elphel.facetrack.optimizer.ParameterSet;

public class FrameData {
	private final int          frame_idx;
	private final boolean []   mask;          // [num_pixels] valid depth
	private final double [][]  point;         // [num_pixels][3]
	private final double [][]  normal;        // [num_pixels][3]
	private final double [][]  color;         // [num_pixels][3] or null
	private final double [][]  landmark;      // [num_landmarks][3] or null
	private final boolean []   landmark_mask; // [num_landmarks] or null
	private final double [][]  vertices;      // [num_vertices][3] target mesh, or null
	private final ParameterSet params;        // ground truth or null

	public FrameData(
			int          frame_idx,
			boolean []   mask,
			double [][]  point,
			double [][]  normal,
			double [][]  color,
			double [][]  landmark,
			boolean []   landmark_mask,
			double [][]  vertices,
			ParameterSet params)
	{
		if ((point != null) && ((mask == null) || (point.length != mask.length) || (normal == null) || (normal.length != mask.length))) {
			throw new IllegalArgumentException("Frame "+frame_idx+": point and normal buffers should have the same length as the mask");
		}
		if ((landmark != null) && (landmark_mask != null) && (landmark.length != landmark_mask.length)) {
			throw new IllegalArgumentException("Frame "+frame_idx+": landmark mask length "+landmark_mask.length+
					" does not match number of landmarks "+landmark.length);
		}
		this.frame_idx =     frame_idx;
		this.mask =          mask;
		this.point =         point;
		this.normal =        normal;
		this.color =         color;
		this.landmark =      landmark;
		this.landmark_mask = ((landmark_mask == null) && (landmark != null)) ? allTrue(landmark.length) : landmark_mask;
		this.vertices =      vertices;
		this.params =        params;
	}

	/** Frame with only 3D landmarks */
	public static FrameData ofLandmarks(int frame_idx, double [][] landmark, boolean [] landmark_mask) {
		return new FrameData(frame_idx, null, null, null, null, landmark, landmark_mask, null, null);
	}

	/** Frame with a target mesh for vertex fitting */
	public static FrameData ofVertices(int frame_idx, double [][] vertices) {
		return new FrameData(frame_idx, null, null, null, null, null, null, vertices, null);
	}

	private static boolean [] allTrue(int n) {
		boolean [] b = new boolean [n];
		Arrays.fill(b, true);
		return b;
	}

	public int          getFrameIdx()     {return frame_idx;}
	public boolean []   getMask()         {return mask;}
	public double [][]  getPoint()        {return point;}
	public double [][]  getNormal()       {return normal;}
	public double [][]  getColor()        {return color;}
	public double [][]  getLandmark()     {return landmark;}
	public boolean []   getLandmarkMask() {return landmark_mask;}
	public double [][]  getVertices()     {return vertices;}
	public ParameterSet getParams()       {return params;}

	public boolean hasPoints()    {return point != null;}
	public boolean hasLandmarks() {return landmark != null;}
	public boolean hasVertices()  {return vertices != null;}

	public int getNumPixels() {
		return (mask != null) ? mask.length : 0;
	}
}
