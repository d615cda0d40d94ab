/**
 **
 ** TrackingMetrics - parameter and geometric errors of a tracking result
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrackingMetrics.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.tracker;

import java.util.LinkedHashMap;
import java.util.Map;

import com.elphel.facetrack.correspondence.CorrespondenceFilter;
import com.elphel.facetrack.correspondence.CorrespondenceMask;
import com.elphel.facetrack.model.FrameData;
import com.elphel.facetrack.model.ModelOutput;
import com.elphel.facetrack.model.ParametricModel;
import com.elphel.facetrack.model.RenderOutput;
import com.elphel.facetrack.model.Renderer;
import com.elphel.facetrack.optimizer.DimensionMismatchException;
import com.elphel.facetrack.optimizer.ParameterSet;

/**
 * Distances are reported in millimeters for geometry in meters.
 */
public class TrackingMetrics {
	public static final double M_TO_MM = 1.0E3;

	/**
	 * Mean absolute parameter error per group ("param_"+name), the same multiplied by the
	 * group weight ("weighted_param_"+name) and over all listed groups ("param",
	 * "weighted_param")
	 * @param params        tracked parameters
	 * @param gt_params     ground truth
	 * @param group_weights groups to compare with their weights
	 */
	public static Map<String, Double> paramError(ParameterSet params, ParameterSet gt_params, Map<String, Double> group_weights) {
		Map<String, Double> rslt = new LinkedHashMap<String, Double>();
		double s_all = 0.0, sw_all = 0.0;
		int n_all = 0;
		for (Map.Entry<String, Double> entry : group_weights.entrySet()) {
			String name = entry.getKey();
			double [] p =  params.get(name);
			double [] gt = gt_params.get(name);
			if (p.length != gt.length) {
				throw new DimensionMismatchException("Ground truth \""+name+"\"", p.length, gt.length);
			}
			double s = 0.0;
			for (int i = 0; i < p.length; i++) {
				s += Math.abs(p[i] - gt[i]);
			}
			double mean = (p.length > 0) ? (s / p.length) : 0.0;
			rslt.put("param_"+name, mean);
			rslt.put("weighted_param_"+name, mean * entry.getValue());
			s_all +=  s;
			sw_all += s * entry.getValue();
			n_all +=  p.length;
		}
		rslt.put("param",          (n_all > 0) ? (s_all / n_all) : 0.0);
		rslt.put("weighted_param", (n_all > 0) ? (sw_all / n_all) : 0.0);
		return rslt;
	}

	/** @return mean |dot(s - t, t_normal)| over the mask, mm */
	public static double point2plane(double [][] s_point, double [][] t_point, double [][] t_normal, boolean [] mask) {
		double s = 0.0;
		int n = 0;
		for (int i = 0; i < mask.length; i++) if (mask[i]) {
			double d = 0.0;
			for (int c = 0; c < 3; c++) {
				d += (s_point[i][c] - t_point[i][c]) * t_normal[i][c];
			}
			s += Math.abs(d);
			n++;
		}
		return (n > 0) ? (s / n * M_TO_MM) : Double.NaN;
	}

	/** @return mean |s - t| over the mask, mm */
	public static double point2point(double [][] s_point, double [][] t_point, boolean [] mask) {
		double s = 0.0;
		int n = 0;
		for (int i = 0; i < s_point.length; i++) if ((mask == null) || mask[i]) {
			s += distance(s_point[i], t_point[i]);
			n++;
		}
		return (n > 0) ? (s / n * M_TO_MM) : Double.NaN;
	}

	/** @return mean vertex distance, mm */
	public static double vertices(double [][] vertices, double [][] target) {
		if (vertices.length != target.length) {
			throw new DimensionMismatchException("Target vertices", vertices.length, target.length);
		}
		double s = 0.0;
		for (int i = 0; i < vertices.length; i++) {
			s += distance(vertices[i], target[i]);
		}
		return (vertices.length > 0) ? (s / vertices.length * M_TO_MM) : Double.NaN;
	}

	/**
	 * Render the parameters and measure them against the frame: "geometric_point2plane",
	 * "geometric_point2point" over the correspondences and "vertices" when the frame has
	 * target vertices
	 */
	public static Map<String, Double> geometricError(
			ParametricModel      model,
			Renderer             renderer,
			CorrespondenceFilter filter,
			FrameData            frame,
			ParameterSet         params) {
		Map<String, Double> rslt = new LinkedHashMap<String, Double>();
		ModelOutput out = model.forward(params);
		if (frame.hasPoints() && (renderer != null)) {
			RenderOutput render = renderer.render(out);
			CorrespondenceMask mask = filter.mask(
					frame.getMask(), frame.getPoint(), frame.getNormal(),
					render.getMask(), render.getPoint(), render.getNormal());
			rslt.put("geometric_point2plane", point2plane(frame.getPoint(), render.getPoint(), render.getNormal(), mask.getMask()));
			rslt.put("geometric_point2point", point2point(frame.getPoint(), render.getPoint(), mask.getMask()));
		}
		if (frame.hasVertices()) {
			rslt.put("vertices", vertices(out.getVertices(), frame.getVertices()));
		}
		return rslt;
	}

	private static double distance(double [] a, double [] b) {
		double dx = a[0] - b[0], dy = a[1] - b[1], dz = a[2] - b[2];
		return Math.sqrt(dx * dx + dy * dy + dz * dz);
	}
}
