/**
 **
 ** TrackingResidualFunction - residuals of the current model parameters against one observed batch, fixed render and mask
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrackingResidualFunction.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.elphel.facetrack.model.Barycentric;
import com.elphel.facetrack.model.DifferentiableModel;
import com.elphel.facetrack.model.FrameBatch;
import com.elphel.facetrack.model.FrameData;
import com.elphel.facetrack.model.ModelJacobian;
import com.elphel.facetrack.model.ModelOutput;
import com.elphel.facetrack.model.ParametricModel;
import com.elphel.facetrack.model.RenderOutput;
import com.elphel.facetrack.optimizer.DifferentiableResidualFunction;
import com.elphel.facetrack.optimizer.DimensionMismatchException;
import com.elphel.facetrack.optimizer.ParameterLayout;
import com.elphel.facetrack.optimizer.ParameterSet;
import com.elphel.facetrack.optimizer.ResidualResult;
import com.elphel.facetrack.regularize.RegularizeOutput;
import com.elphel.facetrack.residuals.ResidualChain;
import com.elphel.facetrack.residuals.ResidualContext;

/**
 * Model points are re-interpolated from the new vertices with the triangle indices and
 * barycentric coordinates of the render made at the start of the outer iteration, so the
 * selected pixels and their order do not change while the parameters move.
 * All captured state is immutable, an instance can be evaluated any number of times.
 */
public class TrackingResidualFunction implements DifferentiableResidualFunction {
	private final ParametricModel    model;
	private final ResidualChain      chain;
	private final FrameBatch         batch;
	private final List<RenderOutput> renders; // per item, empty without correspondences
	private final List<boolean []>   masks;   // per item
	private final List<double []>    weights; // per item, per pixel
	private final ParameterSet       reference;
	private final RegularizeOutput   regularize;

	public TrackingResidualFunction(
			ParametricModel    model,
			ResidualChain      chain,
			FrameBatch         batch,
			List<RenderOutput> renders,
			List<boolean []>   masks,
			List<double []>    weights,
			ParameterSet       reference,
			RegularizeOutput   regularize)
	{
		this.model =      model;
		this.chain =      chain;
		this.batch =      batch;
		this.renders =    (renders != null) ? Collections.unmodifiableList(new ArrayList<RenderOutput>(renders)) :
			Collections.<RenderOutput>emptyList();
		this.masks =      (masks != null) ? Collections.unmodifiableList(new ArrayList<boolean []>(masks)) :
			Collections.<boolean []>emptyList();
		this.weights =    (weights != null) ? Collections.unmodifiableList(new ArrayList<double []>(weights)) :
			Collections.<double []>emptyList();
		this.reference =  reference;
		this.regularize = (regularize != null) ? regularize : RegularizeOutput.empty();
		if (!this.renders.isEmpty() && ((this.renders.size() != batch.size()) || (this.masks.size() != batch.size()))) {
			throw new IllegalArgumentException("Need one render and one mask per batch item ("+batch.size()+")");
		}
	}

	@Override
	public ResidualResult evaluate(ParameterSet params) {
		return chain.evaluate(buildContext(params, null));
	}

	@Override
	public double [][] getJacobianTransposed(ParameterSet params, ParameterLayout layout) {
		if (!(model instanceof DifferentiableModel)) {
			return null;
		}
		return chain.getJacobianTransposed(buildContext(params, layout), layout);
	}

	public int getNumCorrespondences() {
		int n = 0;
		for (boolean [] mask : masks) {
			n += Barycentric.count(mask);
		}
		return n;
	}

	/**
	 * @param params full (possibly batched) parameters
	 * @param layout active layout, null - values only
	 */
	ResidualContext buildContext(ParameterSet params, ParameterLayout layout) {
		if (params.getBatchSize() != batch.size()) {
			throw new DimensionMismatchException("Parameter batch", batch.size(), params.getBatchSize());
		}
		int num_items = batch.size();
		boolean use_points = !renders.isEmpty();
		int num_pars = (layout != null) ? layout.getNumParameters() : 0;
		ParameterLayout item_layout = (layout != null) ? layout.itemLayout() : null;

		List<double [][]> s_point =    new ArrayList<double [][]>();
		List<double [][]> s_normal =   new ArrayList<double [][]>();
		List<double [][]> t_point =    new ArrayList<double [][]>();
		List<double [][]> t_normal =   new ArrayList<double [][]>();
		List<double []>   w_sel =      new ArrayList<double []>();
		List<double [][]> s_landmark = new ArrayList<double [][]>();
		List<boolean []>  l_mask =     new ArrayList<boolean []>();
		List<double [][]> t_landmark = new ArrayList<double [][]>();
		List<double [][]> s_vertices = new ArrayList<double [][]>();
		List<double [][]> t_vertices = new ArrayList<double [][]>();
		List<ModelJacobian> jacobians = new ArrayList<ModelJacobian>();

		for (int item = 0; item < num_items; item++) {
			FrameData frame = batch.get(item);
			ParameterSet item_params = params.item(item);
			ModelOutput out = model.forward(item_params);
			ModelJacobian jac = (layout != null) ? ((DifferentiableModel) model).getJacobian(item_params, item_layout) : null;
			jacobians.add(jac);
			if (use_points) {
				RenderOutput render = renders.get(item);
				boolean [] mask = masks.get(item);
				s_point.add(Barycentric.select(frame.getPoint(), mask));
				s_normal.add(Barycentric.select(frame.getNormal(), mask));
				t_normal.add(Barycentric.select(render.getNormal(), mask));
				t_point.add(Barycentric.interpolate(render.getVerticesIdx(), render.getBaryCoords(), out.getVertices(), mask));
				if (!weights.isEmpty()) {
					w_sel.add(Barycentric.select(weights.get(item), mask));
				}
			}
			if (frame.hasLandmarks()) {
				s_landmark.add(frame.getLandmark());
				l_mask.add(frame.getLandmarkMask());
				t_landmark.add(out.getLandmarks());
			}
			if (frame.hasVertices()) {
				s_vertices.add(frame.getVertices());
				t_vertices.add(out.getVertices());
			}
		}
		ResidualContext.Builder builder = ResidualContext.builder()
				.params(params)
				.regularize(reference, regularize);
		if (use_points) {
			builder.points(concat(s_point), concat(s_normal), concat(t_point), concat(t_normal));
			if (!w_sel.isEmpty()) {
				builder.weights(concatWeights(w_sel));
			}
		}
		if (s_landmark.size() == num_items) {
			builder.landmarks(concat(s_landmark), concatMask(l_mask), concat(t_landmark));
		}
		if (s_vertices.size() == num_items) {
			builder.vertices(concat(s_vertices), concat(t_vertices));
		}
		if (layout != null) {
			if (use_points) {
				builder.pointDerivatives(getDerivatives(layout, item_layout, num_pars, jacobians, true, false));
			}
			if (s_landmark.size() == num_items) {
				builder.landmarkDerivatives(getDerivatives(layout, item_layout, num_pars, jacobians, false, true));
			}
			if (s_vertices.size() == num_items) {
				builder.vertexDerivatives(getDerivatives(layout, item_layout, num_pars, jacobians, false, false));
			}
		}
		return builder.build();
	}

	/**
	 * Spread the per-item model derivatives over the batch columns, each item only depends
	 * on its own parameter columns
	 */
	private double [][][] getDerivatives(
			ParameterLayout     layout,
			ParameterLayout     item_layout,
			int                 num_pars,
			List<ModelJacobian> jacobians,
			boolean             interpolate_points,
			boolean             landmarks)
	{
		int num_items = jacobians.size();
		int [] item_len =  new int [num_items];
		int total = 0;
		for (int item = 0; item < num_items; item++) {
			if (interpolate_points) {
				item_len[item] = Barycentric.count(masks.get(item));
			} else if (landmarks) {
				item_len[item] = batch.get(item).getLandmark().length;
			} else {
				item_len[item] = batch.get(item).getVertices().length;
			}
			total += item_len[item];
		}
		double [][][] dt = new double [num_pars][total][3];
		int start = 0;
		for (int item = 0; item < num_items; item++) {
			ModelJacobian jac = jacobians.get(item);
			for (String name : layout.names()) {
				int dim = layout.getDimension(name);
				for (int k = 0; k < dim; k++) {
					int item_col = item_layout.getOffset(name) + k;
					int col =      layout.getColumn(name, item, k);
					double [][] d;
					if (interpolate_points) {
						RenderOutput render = renders.get(item);
						d = Barycentric.interpolate(render.getVerticesIdx(), render.getBaryCoords(),
								jac.getVertexDerivatives()[item_col], masks.get(item));
					} else if (landmarks) {
						d = jac.getLandmarkDerivatives()[item_col];
					} else {
						d = jac.getVertexDerivatives()[item_col];
					}
					for (int i = 0; i < item_len[item]; i++) {
						dt[col][start + i] = d[i];
					}
				}
			}
			start += item_len[item];
		}
		return dt;
	}

	private static double [][] concat(List<double [][]> parts) {
		if (parts.size() == 1) {
			return parts.get(0);
		}
		int len = 0;
		for (double [][] p : parts) len += p.length;
		double [][] rslt = new double [len][];
		int indx = 0;
		for (double [][] p : parts) {
			System.arraycopy(p, 0, rslt, indx, p.length);
			indx += p.length;
		}
		return rslt;
	}

	private static double [] concatWeights(List<double []> parts) {
		int len = 0;
		for (double [] p : parts) len += p.length;
		double [] rslt = new double [len];
		int indx = 0;
		for (double [] p : parts) {
			System.arraycopy(p, 0, rslt, indx, p.length);
			indx += p.length;
		}
		return rslt;
	}

	private static boolean [] concatMask(List<boolean []> parts) {
		int len = 0;
		for (boolean [] p : parts) len += p.length;
		boolean [] rslt = new boolean [len];
		int indx = 0;
		for (boolean [] p : parts) {
			System.arraycopy(p, 0, rslt, indx, p.length);
			indx += p.length;
		}
		return rslt;
	}
}
