/**
 **
 ** LinearBlendshapeModel - template mesh with linear shape/expression bases, per-axis scale, axis-angle rotation and translation
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LinearBlendshapeModel.java is free software: you can redistribute it and/or modify
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

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.DimensionMismatchException;
import com.elphel.facetrack.optimizer.ParameterLayout;
import com.elphel.facetrack.optimizer.ParameterSet;

/*
 * v_i = R(global_pose) * (scale .* (T_i + sum_k shape_k * S_ki + sum_k expression_k * E_ki)) + transl
 *
 * R is the rotation by |global_pose| around global_pose/|global_pose|. Neck, jaw and eye poses
 * are accepted for compatibility with the full head model parameters, but this model has no
 * skinning and they do not move the vertices (zero derivatives).
 */
public class LinearBlendshapeModel implements DifferentiableModel {
	static final double ROT_DELTA = 1.0E-7; // step for the rotation matrix derivatives

	private final double [][]   template;          // [num_vertices][3]
	private final double [][][] shape_basis;       // [num_shape][num_vertices][3]
	private final double [][][] expression_basis;  // [num_expression][num_vertices][3]
	private final int []        landmark_indices;  // vertex index of each landmark

	public LinearBlendshapeModel(
			double [][]   template,
			double [][][] shape_basis,
			double [][][] expression_basis,
			int []        landmark_indices)
	{
		this.template =         template;
		this.shape_basis =      (shape_basis != null) ?      shape_basis :      new double [0][][];
		this.expression_basis = (expression_basis != null) ? expression_basis : new double [0][][];
		this.landmark_indices = (landmark_indices != null) ? landmark_indices : new int [0];
		for (double [][] b : this.shape_basis) {
			if (b.length != template.length) {
				throw new ConfigurationException("Shape basis has "+b.length+" vertices, template - "+template.length);
			}
		}
		for (double [][] b : this.expression_basis) {
			if (b.length != template.length) {
				throw new ConfigurationException("Expression basis has "+b.length+" vertices, template - "+template.length);
			}
		}
		for (int indx : this.landmark_indices) {
			if ((indx < 0) || (indx >= template.length)) {
				throw new ConfigurationException("Landmark vertex index "+indx+" is out of range [0,"+template.length+")");
			}
		}
	}

	public int getNumVertices()   {return template.length;}
	public int getNumShape()      {return shape_basis.length;}
	public int getNumExpression() {return expression_basis.length;}
	public int getNumLandmarks()  {return landmark_indices.length;}

	/**
	 * @return parameter set of the neutral model: zero shape, expression and poses, unit scale
	 */
	public ParameterSet createParameters() {
		ParameterSet ps = new ParameterSet();
		ps.add(ParameterSet.SHAPE,       new double [getNumShape()]);
		ps.add(ParameterSet.EXPRESSION,  new double [getNumExpression()]);
		ps.add(ParameterSet.GLOBAL_POSE, new double [3]);
		ps.add(ParameterSet.NECK_POSE,   new double [3]);
		ps.add(ParameterSet.JAW_POSE,    new double [3]);
		ps.add(ParameterSet.EYE_POSE,    new double [6]);
		ps.add(ParameterSet.TRANSL,      new double [3]);
		ps.add(ParameterSet.SCALE,       1.0, 1.0, 1.0);
		return ps;
	}

	@Override
	public ModelOutput forward(ParameterSet params) {
		double [][] rot =   getRotationMatrix(params.get(ParameterSet.GLOBAL_POSE));
		double [] transl =  params.get(ParameterSet.TRANSL);
		double [] scale =   params.get(ParameterSet.SCALE);
		double [][] shaped = getShapedVertices(params);
		double [][] vertices = new double [template.length][];
		for (int i = 0; i < template.length; i++) {
			double [] w = {scale[0] * shaped[i][0], scale[1] * shaped[i][1], scale[2] * shaped[i][2]};
			vertices[i] = mulMatVec(rot, w);
			for (int c = 0; c < 3; c++) {
				vertices[i][c] += transl[c];
			}
		}
		return new ModelOutput(vertices, selectLandmarks(vertices));
	}

	@Override
	public ModelJacobian getJacobian(ParameterSet params, ParameterLayout layout) {
		double [] pose =     params.get(ParameterSet.GLOBAL_POSE);
		double [][] rot =    getRotationMatrix(pose);
		double [] scale =    params.get(ParameterSet.SCALE);
		double [][] shaped = getShapedVertices(params);
		int num_vert = template.length;
		double [][][] d_vertices = new double [layout.getNumParameters()][][];
		for (String name : layout.names()) {
			int offset = layout.getOffset(name);
			int dim =    layout.getDimension(name);
			for (int k = 0; k < dim; k++) {
				double [][] dv = new double [num_vert][3];
				switch (name) {
				case ParameterSet.SHAPE:
				case ParameterSet.EXPRESSION:
					double [][] basis = (ParameterSet.SHAPE.equals(name) ? shape_basis : expression_basis)[k];
					for (int i = 0; i < num_vert; i++) {
						dv[i] = mulMatVec(rot, new double [] {scale[0] * basis[i][0], scale[1] * basis[i][1], scale[2] * basis[i][2]});
					}
					break;
				case ParameterSet.GLOBAL_POSE:
					double [] pp = pose.clone(), pm = pose.clone();
					pp[k] += ROT_DELTA;
					pm[k] -= ROT_DELTA;
					double [][] rp = getRotationMatrix(pp), rm = getRotationMatrix(pm);
					double [][] drot = new double [3][3];
					for (int r = 0; r < 3; r++) for (int c = 0; c < 3; c++) {
						drot[r][c] = (rp[r][c] - rm[r][c]) / (2 * ROT_DELTA);
					}
					for (int i = 0; i < num_vert; i++) {
						dv[i] = mulMatVec(drot, new double [] {scale[0] * shaped[i][0], scale[1] * shaped[i][1], scale[2] * shaped[i][2]});
					}
					break;
				case ParameterSet.TRANSL:
					for (int i = 0; i < num_vert; i++) {
						dv[i][k] = 1.0;
					}
					break;
				case ParameterSet.SCALE:
					for (int i = 0; i < num_vert; i++) {
						double [] e = new double [3];
						e[k] = shaped[i][k];
						dv[i] = mulMatVec(rot, e);
					}
					break;
				default: // poses without skinning
				}
				d_vertices[offset + k] = dv;
			}
		}
		double [][][] d_landmarks = new double [d_vertices.length][][];
		for (int j = 0; j < d_vertices.length; j++) {
			d_landmarks[j] = selectLandmarks(d_vertices[j]);
		}
		return new ModelJacobian(d_vertices, d_landmarks);
	}

	private double [][] getShapedVertices(ParameterSet params) {
		double [] shape =      params.get(ParameterSet.SHAPE);
		double [] expression = params.get(ParameterSet.EXPRESSION);
		if (shape.length != shape_basis.length) {
			throw new DimensionMismatchException("Shape parameters", shape_basis.length, shape.length);
		}
		if (expression.length != expression_basis.length) {
			throw new DimensionMismatchException("Expression parameters", expression_basis.length, expression.length);
		}
		double [][] shaped = new double [template.length][];
		for (int i = 0; i < template.length; i++) {
			double [] u = template[i].clone();
			for (int k = 0; k < shape.length; k++) if (shape[k] != 0.0) {
				for (int c = 0; c < 3; c++) u[c] += shape[k] * shape_basis[k][i][c];
			}
			for (int k = 0; k < expression.length; k++) if (expression[k] != 0.0) {
				for (int c = 0; c < 3; c++) u[c] += expression[k] * expression_basis[k][i][c];
			}
			shaped[i] = u;
		}
		return shaped;
	}

	private double [][] selectLandmarks(double [][] vertices) {
		double [][] landmarks = new double [landmark_indices.length][];
		for (int i = 0; i < landmark_indices.length; i++) {
			landmarks[i] = vertices[landmark_indices[i]].clone();
		}
		return landmarks;
	}

	/**
	 * @param axis_angle rotation vector, direction - axis, length - angle in radians
	 * @return 3x3 matrix, rotated = m * v
	 */
	public static double [][] getRotationMatrix(double [] axis_angle) {
		double angle = Math.sqrt(axis_angle[0] * axis_angle[0] + axis_angle[1] * axis_angle[1] + axis_angle[2] * axis_angle[2]);
		double [][] m = new double [3][3];
		if (angle == 0.0) {
			for (int i = 0; i < 3; i++) m[i][i] = 1.0;
			return m;
		}
		Rotation rotation = new Rotation(
				new Vector3D(axis_angle[0] / angle, axis_angle[1] / angle, axis_angle[2] / angle),
				angle,
				RotationConvention.VECTOR_OPERATOR);
		Vector3D [] columns = {
				rotation.applyTo(Vector3D.PLUS_I),
				rotation.applyTo(Vector3D.PLUS_J),
				rotation.applyTo(Vector3D.PLUS_K)};
		for (int c = 0; c < 3; c++) {
			m[0][c] = columns[c].getX();
			m[1][c] = columns[c].getY();
			m[2][c] = columns[c].getZ();
		}
		return m;
	}

	static double [] mulMatVec(double [][] m, double [] v) {
		return new double [] {
				m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2],
				m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2],
				m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2]};
	}
}
