/**
 **
 ** CorrespondenceFilter - selects observed/rendered point pairs by validity, distance and normal agreement
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CorrespondenceFilter.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.correspondence;

import java.util.LinkedHashMap;

import com.elphel.facetrack.common.MultiThreading;
import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.DimensionMismatchException;

/**
 * Projective correspondences: pixel i of the observation is paired with pixel i of the
 * rendered model. A pair is kept when both pixels are valid, the points are not farther
 * than d_max and the normals differ by no more than the maximal angle:
 * <pre>
 * mask = s_mask &amp; t_mask &amp; (|s_point - t_point| &lt;= d_max) &amp; (dot(s_normal, t_normal) &gt;= cos_min)
 * </pre>
 * Non-finite points or normals fail their tests. The filter is stateless.
 */
public class CorrespondenceFilter {
	private final double d_max;
	private final double cos_min;
	private final int    threads_max;

	public CorrespondenceFilter(double d_max, double cos_min, int threads_max) {
		if (!(d_max >= 0.0)) {
			throw new ConfigurationException("Correspondence distance threshold should be non-negative, got "+d_max);
		}
		if (!(cos_min >= -1.0) || (cos_min > 1.0)) {
			throw new ConfigurationException("Correspondence normal cosine threshold should be in [-1,1], got "+cos_min);
		}
		this.d_max =       d_max;
		this.cos_min =     cos_min;
		this.threads_max = threads_max;
	}

	/**
	 * @param d_max                maximal point distance (same units as the points)
	 * @param max_normal_angle_deg maximal angle between normals in degrees
	 * @param threads_max          maximal number of threads
	 * @return filter with cos_min = cos(max_normal_angle_deg)
	 */
	public static CorrespondenceFilter fromAngle(double d_max, double max_normal_angle_deg, int threads_max) {
		return new CorrespondenceFilter(d_max, Math.cos(Math.toRadians(max_normal_angle_deg)), threads_max);
	}

	public double getCosineThreshold() {
		return cos_min;
	}

	public CorrespondenceMask mask(
			final boolean []  s_mask,
			final double [][] s_point,
			final double [][] s_normal,
			final boolean []  t_mask,
			final double [][] t_point,
			final double [][] t_normal)
	{
		final int num_pixels = s_mask.length;
		checkLength("Observed points",  num_pixels, s_point.length);
		checkLength("Observed normals", num_pixels, s_normal.length);
		checkLength("Rendered mask",    num_pixels, t_mask.length);
		checkLength("Rendered points",  num_pixels, t_point.length);
		checkLength("Rendered normals", num_pixels, t_normal.length);
		final boolean [] valid =    new boolean [num_pixels];
		final boolean [] distance = new boolean [num_pixels];
		final boolean [] normal =   new boolean [num_pixels];
		final boolean [] mask =     new boolean [num_pixels];
		final double d_max2 = d_max * d_max;
		MultiThreading.runIndexed(num_pixels, threads_max, (pix) -> {
			valid[pix] = s_mask[pix] && t_mask[pix];
			if ((s_point[pix] != null) && (t_point[pix] != null)) {
				double d2 = 0.0;
				for (int c = 0; c < 3; c++) {
					double d = s_point[pix][c] - t_point[pix][c];
					d2 += d * d;
				}
				distance[pix] = d2 <= d_max2; // false for NaN
			}
			if ((s_normal[pix] != null) && (t_normal[pix] != null)) {
				double dot = 0.0;
				for (int c = 0; c < 3; c++) {
					dot += s_normal[pix][c] * t_normal[pix][c];
				}
				normal[pix] = dot >= cos_min;
			}
			mask[pix] = valid[pix] && distance[pix] && normal[pix];
		});
		LinkedHashMap<String, boolean []> diagnostics = new LinkedHashMap<String, boolean []>();
		diagnostics.put(CorrespondenceMask.S_MASK,   s_mask.clone());
		diagnostics.put(CorrespondenceMask.T_MASK,   t_mask.clone());
		diagnostics.put(CorrespondenceMask.VALID,    valid);
		diagnostics.put(CorrespondenceMask.DISTANCE, distance);
		diagnostics.put(CorrespondenceMask.NORMAL,   normal);
		return new CorrespondenceMask(mask, diagnostics);
	}

	private static void checkLength(String what, int expected, int actual) {
		if (expected != actual) {
			throw new DimensionMismatchException(what, expected, actual);
		}
	}
}
