/**
 **
 ** Point2PointResidual - coordinate differences between the model point and the observed point
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Point2PointResidual.java is free software: you can redistribute it and/or modify
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

public class Point2PointResidual implements ResidualTerm {
	public static final String NAME = "point2point";

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
	public int getStride() {
		return 3;
	}

	@Override
	public double [] compute(ResidualContext ctx) {
		return difference(
				ResidualContext.requireArray(ctx.getTargetPoints(), "model points", NAME),
				ResidualContext.requireArray(ctx.getSourcePoints(), "points", NAME),
				null);
	}

	@Override
	public double [][] getJacobianTransposed(ResidualContext ctx, ParameterLayout layout) {
		double [][][] dt = ctx.getTargetPointDerivatives();
		if (!ResidualContext.hasDerivatives(dt, layout)) {
			return null;
		}
		return flatten(dt, null);
	}

	/**
	 * @return (t - s) for the selected rows, 3 residuals per row
	 */
	static double [] difference(double [][] t, double [][] s, boolean [] selection) {
		if (t.length != s.length) {
			throw new IllegalArgumentException("Model and observed arrays differ in length: "+t.length+" != "+s.length);
		}
		int num_sel = 0;
		for (int i = 0; i < s.length; i++) if ((selection == null) || selection[i]) num_sel++;
		double [] r = new double [3 * num_sel];
		int indx = 0;
		for (int i = 0; i < s.length; i++) if ((selection == null) || selection[i]) {
			for (int c = 0; c < 3; c++) {
				r[indx++] = t[i][c] - s[i][c];
			}
		}
		return r;
	}

	/**
	 * @return derivatives [num_pars][3 * num_selected] of the selected rows
	 */
	static double [][] flatten(double [][][] dt, boolean [] selection) {
		double [][] jt = new double [dt.length][];
		for (int j = 0; j < dt.length; j++) {
			double [][] d = dt[j];
			int num_sel = 0;
			for (int i = 0; i < d.length; i++) if ((selection == null) || selection[i]) num_sel++;
			jt[j] = new double [3 * num_sel];
			int indx = 0;
			for (int i = 0; i < d.length; i++) if ((selection == null) || selection[i]) {
				for (int c = 0; c < 3; c++) {
					jt[j][indx++] = d[i][c];
				}
			}
		}
		return jt;
	}
}
