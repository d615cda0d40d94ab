/**
 **
 ** ResidualContext - immutable inputs of one residual evaluation: observation, model geometry, weights and priors
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResidualContext.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.residuals;

import com.elphel.facetrack.optimizer.ParameterLayout;
import com.elphel.facetrack.optimizer.ParameterSet;
import com.elphel.facetrack.regularize.RegularizeOutput;

/**
 * Correspondence arrays hold only the selected pixels of all batch items, concatenated in
 * item order. Derivative arrays are indexed by the active parameter column first
 * ([num_pars][num_points][3]) and are null when only values are needed.
 */
public class ResidualContext {
	private final double [][]     s_point;
	private final double [][]     s_normal;
	private final double [][]     t_point;
	private final double [][]     t_normal;
	private final double []       weights;
	private final double [][][]   dt_point;
	private final double [][]     s_landmark;
	private final boolean []      landmark_mask;
	private final double [][]     t_landmark;
	private final double [][][]   dt_landmark;
	private final double [][]     s_vertices;
	private final double [][]     t_vertices;
	private final double [][][]   dt_vertices;
	private final ParameterSet    params;
	private final ParameterSet    reference;
	private final RegularizeOutput regularize;

	private ResidualContext(Builder b) {
		this.s_point =       b.s_point;
		this.s_normal =      b.s_normal;
		this.t_point =       b.t_point;
		this.t_normal =      b.t_normal;
		this.weights =       b.weights;
		this.dt_point =      b.dt_point;
		this.s_landmark =    b.s_landmark;
		this.landmark_mask = b.landmark_mask;
		this.t_landmark =    b.t_landmark;
		this.dt_landmark =   b.dt_landmark;
		this.s_vertices =    b.s_vertices;
		this.t_vertices =    b.t_vertices;
		this.dt_vertices =   b.dt_vertices;
		this.params =        b.params;
		this.reference =     b.reference;
		this.regularize =    (b.regularize != null) ? b.regularize : RegularizeOutput.empty();
	}

	public static Builder builder() {
		return new Builder();
	}

	public double [][]      getSourcePoints()          {return s_point;}
	public double [][]      getSourceNormals()         {return s_normal;}
	public double [][]      getTargetPoints()          {return t_point;}
	public double [][]      getTargetNormals()         {return t_normal;}
	public double []        getWeights()               {return weights;}
	public double [][][]    getTargetPointDerivatives() {return dt_point;}
	public double [][]      getSourceLandmarks()       {return s_landmark;}
	public boolean []       getLandmarkMask()          {return landmark_mask;}
	public double [][]      getTargetLandmarks()       {return t_landmark;}
	public double [][][]    getTargetLandmarkDerivatives() {return dt_landmark;}
	public double [][]      getSourceVertices()        {return s_vertices;}
	public double [][]      getTargetVertices()        {return t_vertices;}
	public double [][][]    getTargetVertexDerivatives() {return dt_vertices;}
	public ParameterSet     getParams()                {return params;}
	public ParameterSet     getReference()             {return reference;}
	public RegularizeOutput getRegularize()            {return regularize;}

	public int getNumCorrespondences() {
		return (s_point != null) ? s_point.length : 0;
	}

	/** @return robust weight of correspondence i, 1.0 when no weights are set */
	public double getWeight(int i) {
		return (weights != null) ? weights[i] : 1.0;
	}

	static double [][] requireArray(double [][] data, String what, String term) {
		if (data == null) {
			throw new IllegalStateException("Residual term \""+term+"\" requires "+what+", it is not set in the context");
		}
		return data;
	}

	/** derivative arrays must cover all active columns */
	static boolean hasDerivatives(double [][][] d, ParameterLayout layout) {
		return (d != null) && (d.length == layout.getNumParameters());
	}

	public static class Builder {
		private double [][]      s_point;
		private double [][]      s_normal;
		private double [][]      t_point;
		private double [][]      t_normal;
		private double []        weights;
		private double [][][]    dt_point;
		private double [][]      s_landmark;
		private boolean []       landmark_mask;
		private double [][]      t_landmark;
		private double [][][]    dt_landmark;
		private double [][]      s_vertices;
		private double [][]      t_vertices;
		private double [][][]    dt_vertices;
		private ParameterSet     params;
		private ParameterSet     reference;
		private RegularizeOutput regularize;

		public Builder points(double [][] s_point, double [][] s_normal, double [][] t_point, double [][] t_normal) {
			this.s_point =  s_point;
			this.s_normal = s_normal;
			this.t_point =  t_point;
			this.t_normal = t_normal;
			return this;
		}

		public Builder weights(double [] weights) {
			this.weights = weights;
			return this;
		}

		public Builder pointDerivatives(double [][][] dt_point) {
			this.dt_point = dt_point;
			return this;
		}

		public Builder landmarks(double [][] s_landmark, boolean [] landmark_mask, double [][] t_landmark) {
			this.s_landmark =    s_landmark;
			this.landmark_mask = landmark_mask;
			this.t_landmark =    t_landmark;
			return this;
		}

		public Builder landmarkDerivatives(double [][][] dt_landmark) {
			this.dt_landmark = dt_landmark;
			return this;
		}

		public Builder vertices(double [][] s_vertices, double [][] t_vertices) {
			this.s_vertices = s_vertices;
			this.t_vertices = t_vertices;
			return this;
		}

		public Builder vertexDerivatives(double [][][] dt_vertices) {
			this.dt_vertices = dt_vertices;
			return this;
		}

		public Builder params(ParameterSet params) {
			this.params = params;
			return this;
		}

		public Builder regularize(ParameterSet reference, RegularizeOutput regularize) {
			this.reference =  reference;
			this.regularize = regularize;
			return this;
		}

		public ResidualContext build() {
			if ((s_point != null) && ((t_point == null) || (t_point.length != s_point.length))) {
				throw new IllegalArgumentException("Observed and model points should have the same length");
			}
			if ((weights != null) && (s_point != null) && (weights.length != s_point.length)) {
				throw new IllegalArgumentException("Weights length "+weights.length+" does not match "+s_point.length+" correspondences");
			}
			return new ResidualContext(this);
		}
	}
}
