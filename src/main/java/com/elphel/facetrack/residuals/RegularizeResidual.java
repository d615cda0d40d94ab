/**
 **
 ** RegularizeResidual - pulls active parameters toward reference + predicted offset
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  RegularizeResidual.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.List;

import com.elphel.facetrack.optimizer.ParameterLayout;
import com.elphel.facetrack.optimizer.ParameterSet;
import com.elphel.facetrack.regularize.RegularizeOutput;

/**
 * r = weight * (param - (reference + delta)) for every group with both delta and weight
 * defined, groups in the order of the regularization output. Entries with zero weight add no rows.
 */
public class RegularizeResidual implements ResidualTerm {
	public static final String NAME = "regularize";

	@Override
	public String getName() {
		return NAME;
	}

	private static List<String> getGroups(ResidualContext ctx) {
		RegularizeOutput reg = ctx.getRegularize();
		List<String> groups = new ArrayList<String>();
		for (String name : reg.getDeltas().keySet()) {
			if (reg.isRegularized(name)) {
				groups.add(name);
			}
		}
		return groups;
	}

	/**
	 * Number of rows with a non-zero weight, zero-weight entries contribute nothing and
	 * are left out of the stack
	 */
	private static int getNumRows(List<String> groups, RegularizeOutput reg) {
		int len = 0;
		for (String name : groups) {
			for (double w : reg.getWeight(name)) {
				if (w != 0.0) {
					len++;
				}
			}
		}
		return len;
	}

	@Override
	public double [] compute(ResidualContext ctx) {
		List<String> groups = getGroups(ctx);
		if (groups.isEmpty()) {
			return new double [0];
		}
		ParameterSet params =    ctx.getParams();
		ParameterSet reference = ctx.getReference();
		RegularizeOutput reg =   ctx.getRegularize();
		double [] r = new double [getNumRows(groups, reg)];
		int indx = 0;
		for (String name : groups) {
			double [] p =     params.get(name);
			double [] ref =   (reference != null) ? reference.get(name) : new double [p.length];
			double [] delta = reg.getDelta(name);
			double [] w =     reg.getWeight(name);
			for (int k = 0; k < p.length; k++) {
				if (w[k] != 0.0) {
					r[indx++] = w[k] * (p[k] - (ref[k] + delta[k]));
				}
			}
		}
		return r;
	}

	@Override
	public double [][] getJacobianTransposed(ResidualContext ctx, ParameterLayout layout) {
		List<String> groups = getGroups(ctx);
		RegularizeOutput reg = ctx.getRegularize();
		double [][] jt = new double [layout.getNumParameters()][getNumRows(groups, reg)];
		int row = 0;
		for (String name : groups) {
			double [] w = reg.getWeight(name);
			boolean active = layout.indexOf(name) >= 0;
			int offset = active ? layout.getOffset(name) : -1;
			for (int k = 0; k < w.length; k++) {
				if (w[k] == 0.0) {
					continue;
				}
				if (active) {
					jt[offset + k][row] = w[k];
				}
				row++;
			}
		}
		return jt;
	}
}
