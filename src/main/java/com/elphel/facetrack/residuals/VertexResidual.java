/**
 **
 ** VertexResidual - coordinate differences between model and target mesh vertices
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  VertexResidual.java is free software: you can redistribute it and/or modify
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

public class VertexResidual implements ResidualTerm {
	public static final String NAME = "vertices";

	@Override
	public String getName() {
		return NAME;
	}

	@Override
	public int getStride() {
		return 3;
	}

	@Override
	public double [] compute(ResidualContext ctx) {
		return Point2PointResidual.difference(
				ResidualContext.requireArray(ctx.getTargetVertices(), "model vertices", NAME),
				ResidualContext.requireArray(ctx.getSourceVertices(), "target vertices", NAME),
				null);
	}

	@Override
	public double [][] getJacobianTransposed(ResidualContext ctx, ParameterLayout layout) {
		double [][][] dt = ctx.getTargetVertexDerivatives();
		if (!ResidualContext.hasDerivatives(dt, layout)) {
			return null;
		}
		return Point2PointResidual.flatten(dt, null);
	}
}
