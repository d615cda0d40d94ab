/**
 **
 ** JacobianEstimator - central finite difference Jacobian of a residual function
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  JacobianEstimator.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.optimizer;

import com.elphel.facetrack.common.MultiThreading;

public class JacobianEstimator {
	private final double fd_delta;
	private final int    threads_max;

	public JacobianEstimator(double fd_delta, int threads_max) {
		if (!(fd_delta > 0.0)) {
			throw new ConfigurationException("Finite difference step should be positive, got "+fd_delta);
		}
		this.fd_delta =    fd_delta;
		this.threads_max = threads_max;
	}

	public double getDelta() {
		return fd_delta;
	}

	/**
	 * Central differences, step fd_delta * max(1, |theta_j|). Each column is calculated
	 * by a single thread, so the result does not depend on the number of threads.
	 * Residual functions used with threads_max &gt; 1 should be safe to call concurrently.
	 * @param fn            residual function
	 * @param base          parameter set providing the inactive (fixed) values
	 * @param layout        active parameters layout
	 * @param vector        flat active values to differentiate at
	 * @param num_residuals residual length of the base evaluation
	 * @return jt[num_pars][num_residuals]
	 */
	public double [][] getJacobianTransposed(
			final ResidualFunction fn,
			final ParameterSet     base,
			final ParameterLayout  layout,
			final double []        vector,
			final int              num_residuals)
	{
		final int num_pars = vector.length;
		final double [][] jt = new double [num_pars][];
		MultiThreading.runIndexed(num_pars, threads_max, (par) -> {
			double h = fd_delta * Math.max(1.0, Math.abs(vector[par]));
			double [] vp = vector.clone();
			double [] vm = vector.clone();
			vp[par] += h;
			vm[par] -= h;
			double [] fp = fn.evaluate(layout.overlay(base, vp)).getResiduals();
			double [] fm = fn.evaluate(layout.overlay(base, vm)).getResiduals();
			if (fp.length != num_residuals) {
				throw new DimensionMismatchException("Residuals for "+layout.getColumnName(par)+"+h", num_residuals, fp.length);
			}
			if (fm.length != num_residuals) {
				throw new DimensionMismatchException("Residuals for "+layout.getColumnName(par)+"-h", num_residuals, fm.length);
			}
			double rh2 = 1.0 / (vp[par] - vm[par]);
			double [] col = new double [num_residuals];
			for (int i = 0; i < num_residuals; i++) {
				col[i] = (fp[i] - fm[i]) * rh2;
			}
			jt[par] = col;
		});
		return jt;
	}

	/**
	 * Compare two transposed Jacobians, typically analytic and finite difference ones
	 * @return maximal absolute difference, Double.POSITIVE_INFINITY if the dimensions differ
	 */
	public static double compare(double [][] jt_a, double [][] jt_b) {
		if (jt_a.length != jt_b.length) {
			return Double.POSITIVE_INFINITY;
		}
		double max_diff = 0.0;
		for (int j = 0; j < jt_a.length; j++) {
			if (jt_a[j].length != jt_b[j].length) {
				return Double.POSITIVE_INFINITY;
			}
			for (int i = 0; i < jt_a[j].length; i++) {
				max_diff = Math.max(max_diff, Math.abs(jt_a[j][i] - jt_b[j][i]));
			}
		}
		return max_diff;
	}
}
