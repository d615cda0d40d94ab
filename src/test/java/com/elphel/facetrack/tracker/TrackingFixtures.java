/**
 **
 ** TrackingFixtures - synthetic model, renderer and frames for tracking tests
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrackingFixtures.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

import com.elphel.facetrack.model.FrameData;
import com.elphel.facetrack.model.LinearBlendshapeModel;
import com.elphel.facetrack.model.ModelOutput;
import com.elphel.facetrack.model.RenderOutput;
import com.elphel.facetrack.model.Renderer;
import com.elphel.facetrack.model.Rescalable;
import com.elphel.facetrack.optimizer.ParameterSet;

/**
 * 5x5 vertex grid on a curved patch, two shape and two expression components acting along
 * z, landmarks at the corners and the center.
 */
final class TrackingFixtures {
	static final int    NX =        5;
	static final int    NY =        5;
	static final double STEP =      0.05; // m
	static final int [] LANDMARKS = {0, 4, 12, 20, 24};

	private TrackingFixtures() {
	}

	static LinearBlendshapeModel createModel() {
		int num_vert = NX * NY;
		double [][]   template = new double [num_vert][];
		double [][][] shape =    new double [2][num_vert][];
		double [][][] expr =     new double [2][num_vert][];
		for (int iy = 0; iy < NY; iy++) {
			for (int ix = 0; ix < NX; ix++) {
				int i = iy * NX + ix;
				double x = (ix - NX / 2) * STEP;
				double y = (iy - NY / 2) * STEP;
				template[i] = new double [] {x, y, 0.5 * (x * x + y * y)};
				shape[0][i] =  new double [] {0.0, 0.0, x * y};
				shape[1][i] =  new double [] {0.0, 0.0, x * x - y * y};
				expr[0][i] =   new double [] {0.0, 0.0, 10.0 * x * x * y};
				expr[1][i] =   new double [] {0.0, 0.0, 10.0 * x * y * y};
			}
		}
		return new LinearBlendshapeModel(template, shape, expr, LANDMARKS);
	}

	/** ground truth away from the neutral pose */
	static ParameterSet groundTruth(LinearBlendshapeModel model) {
		ParameterSet gt = model.createParameters();
		gt.set(ParameterSet.TRANSL,      new double [] {0.01, -0.02, 0.5});
		gt.set(ParameterSet.GLOBAL_POSE, new double [] {0.05, -0.1, 0.02});
		gt.set(ParameterSet.SHAPE,       new double [] {0.3, -0.2});
		gt.set(ParameterSet.EXPRESSION,  new double [] {0.1, 0.4});
		return gt;
	}

	/** ground truth with a rigid offset */
	static ParameterSet perturbRigid(ParameterSet gt) {
		ParameterSet init = gt.copy();
		double [] transl = init.get(ParameterSet.TRANSL);
		double [] pose =   init.get(ParameterSet.GLOBAL_POSE);
		init.set(ParameterSet.TRANSL,      new double [] {transl[0] + 0.01, transl[1] - 0.02, transl[2] + 0.015});
		init.set(ParameterSet.GLOBAL_POSE, new double [] {pose[0] + 0.02, pose[1] - 0.03, pose[2] + 0.01});
		return init;
	}

	/** depth frame, landmarks and target vertices of the model at params */
	static FrameData observe(LinearBlendshapeModel model, int frame_idx, ParameterSet params) {
		ModelOutput out = model.forward(params);
		RenderOutput render = new VertexSplatRenderer().render(out);
		return new FrameData(
				frame_idx,
				render.getMask().clone(),
				copy(render.getPoint()),
				copy(render.getNormal()),
				null,
				copy(out.getLandmarks()),
				null,
				copy(out.getVertices()),
				params.copy());
	}

	/** same frame with the listed pixels moved along z */
	static FrameData withOutliers(FrameData frame, double dz, int ... pixels) {
		double [][] point = copy(frame.getPoint());
		for (int pix : pixels) {
			point[pix][2] += dz;
		}
		return new FrameData(frame.getFrameIdx(), frame.getMask(), point, frame.getNormal(), null,
				frame.getLandmark(), frame.getLandmarkMask(), frame.getVertices(), frame.getParams());
	}

	/** same frame without valid depth pixels */
	static FrameData withoutDepth(FrameData frame) {
		return new FrameData(frame.getFrameIdx(), new boolean [frame.getNumPixels()], frame.getPoint(), frame.getNormal(),
				null, frame.getLandmark(), frame.getLandmarkMask(), frame.getVertices(), frame.getParams());
	}

	static double maxDifference(ParameterSet a, ParameterSet b, String ... names) {
		double d = 0.0;
		for (String name : names) {
			double [] va = a.get(name);
			double [] vb = b.get(name);
			for (int i = 0; i < va.length; i++) {
				d = Math.max(d, Math.abs(va[i] - vb[i]));
			}
		}
		return d;
	}

	static TrackerParameters rigidParameters(String residuals) {
		TrackerParameters tp = new TrackerParameters();
		tp.max_iters =                  10;
		tp.d_max =                      1.0;
		tp.residuals =                  residuals;
		tp.threads_max =                1;
		tp.optimizer.threads_max =      1;
		tp.schedule.active_milestones = "0:transl,global_pose";
		return tp;
	}

	private static double [][] copy(double [][] data) {
		double [][] rslt = new double [data.length][];
		for (int i = 0; i < data.length; i++) {
			rslt[i] = data[i].clone();
		}
		return rslt;
	}

	/**
	 * One pixel per grid vertex, normals from the neighbor differences. Records the scale
	 * of the last rescale.
	 */
	static class VertexSplatRenderer implements Renderer, Rescalable {
		int scale = 1;
		int num_rescales = 0;

		@Override
		public void rescale(int scale) {
			this.scale = scale;
			num_rescales++;
		}

		@Override
		public RenderOutput render(ModelOutput geometry) {
			double [][] v = geometry.getVertices();
			int num_pix = v.length;
			boolean [] mask =   new boolean [num_pix];
			double [][] point = new double [num_pix][];
			double [][] normal = new double [num_pix][];
			int [][] vertices_idx = new int [num_pix][];
			double [][] bary = new double [num_pix][];
			Arrays.fill(mask, true);
			for (int iy = 0; iy < NY; iy++) {
				for (int ix = 0; ix < NX; ix++) {
					int i = iy * NX + ix;
					double [] dx = sub(v[iy * NX + Math.min(ix + 1, NX - 1)], v[iy * NX + Math.max(ix - 1, 0)]);
					double [] dy = sub(v[Math.min(iy + 1, NY - 1) * NX + ix], v[Math.max(iy - 1, 0) * NX + ix]);
					double [] n = {
							dx[1] * dy[2] - dx[2] * dy[1],
							dx[2] * dy[0] - dx[0] * dy[2],
							dx[0] * dy[1] - dx[1] * dy[0]};
					double l = Math.sqrt(n[0] * n[0] + n[1] * n[1] + n[2] * n[2]);
					normal[i] = new double [] {n[0] / l, n[1] / l, n[2] / l};
					point[i] = v[i].clone();
					vertices_idx[i] = new int [] {i, i, i};
					bary[i] = new double [] {1.0, 0.0, 0.0};
				}
			}
			return new RenderOutput(mask, point, normal, null, vertices_idx, bary, geometry.getLandmarks(), null, null);
		}

		private static double [] sub(double [] a, double [] b) {
			return new double [] {a[0] - b[0], a[1] - b[1], a[2] - b[2]};
		}
	}
}
