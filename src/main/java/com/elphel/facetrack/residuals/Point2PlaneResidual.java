/**
 **
 ** Point2PlaneResidual - signed distance from the observed point to the tangent plane of the model
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Point2PlaneResidual.java is free software: you can redistribute it and/or modify
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

/**
 * r_i = dot(t_point_i - s_point_i, t_normal_i). The rendered normal is held fixed while the
 * model point moves.
 */
public class Point2PlaneResidual implements ResidualTerm {
	public static final String NAME = "point2plane";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public boolean requiresCorrespondences() {
		return true;
	}

	@Override
	public boolean isGeometric() {
		return true;
	}

	@Override
	public double [] compute(ResidualContext ctx) {
		double [][] s = ResidualContext.requireArray(ctx.getSourcePoints(), "points", NAME);
		double [][] t = ResidualContext.requireArray(ctx.getTargetPoints(), "model points", NAME);
		double [][] n = ResidualContext.requireArray(ctx.getTargetNormals(), "model normals", NAME);
		double [] r = new double [s.length];
		for (int i = 0; i < s.length; i++) {
			r[i] = (t[i][0] - s[i][0]) * n[i][0] + (t[i][1] - s[i][1]) * n[i][1] + (t[i][2] - s[i][2]) * n[i][2];
		}
		return r;
	}

	@Override
	public double [][] getJacobianTransposed(ResidualContext ctx, ParameterLayout layout) {
		double [][][] dt = ctx.getTargetPointDerivatives();
		if (!ResidualContext.hasDerivatives(dt, layout)) {
			return null;
		}
		double [][] n = ctx.getTargetNormals();
		int num_points = ctx.getNumCorrespondences();
		double [][] jt = new double [dt.length][num_points];
		for (int j = 0; j < dt.length; j++) {
			for (int i = 0; i < num_points; i++) {
				double [] d = dt[j][i];
				jt[j][i] = d[0] * n[i][0] + d[1] * n[i][1] + d[2] * n[i][2];
			}
		}
		return jt;
	}
}
