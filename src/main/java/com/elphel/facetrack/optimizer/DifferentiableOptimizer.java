/**
 **
 ** DifferentiableOptimizer - Gauss-Newton / Levenberg-Marquardt core solving damped normal equations over the active parameters
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DifferentiableOptimizer.java is free software: you can redistribute it and/or modify
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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.facetrack.common.MultiThreading;

import Jama.CholeskyDecomposition;
import Jama.Matrix;
import Jama.SingularValueDecomposition;

/**
 * Owns the optimization state of one tracking call: current parameter set, active parameter
 * names, damping factor and iteration counters. The state is changed only by {@link #step},
 * single writer - steps on the same instance should never run concurrently.
 */
public class DifferentiableOptimizer {
	private static final Logger LOGGER = LoggerFactory.getLogger(DifferentiableOptimizer.class);

	private final OptimizerParameters optimizer_parameters;
	private final JacobianEstimator   jacobian_estimator;
	private ParameterSet              params =       null;
	private List<String>              active_names = Collections.emptyList();
	private double                    lambda =       0.0;
	private int                       outer_iter =   0;
	private int                       inner_iter =   0;

	public DifferentiableOptimizer(OptimizerParameters optimizer_parameters) {
		optimizer_parameters.validate();
		this.optimizer_parameters = optimizer_parameters.clone();
		this.jacobian_estimator = new JacobianEstimator(
				this.optimizer_parameters.fd_delta,
				this.optimizer_parameters.threads_max);
	}

	/**
	 * Replace the optimized parameters (frame warm start), reset the iteration counters.
	 * @param params new parameters (copied)
	 */
	public void setParams(ParameterSet params) {
		if (!active_names.isEmpty()) {
			new ParameterLayout(params, active_names); // validate names
		}
		this.params =     params.copy();
		this.outer_iter = 0;
		this.inner_iter = 0;
	}

	/** @return snapshot of the current parameters */
	public ParameterSet getParams() {
		return requireParams().copy();
	}

	private ParameterSet requireParams() {
		if (params == null) {
			throw new IllegalStateException("Optimizer parameters are not set, call setParams() first");
		}
		return params;
	}

	/**
	 * Select the free variables of the following steps
	 * @param names parameter group names in the order they appear in the flat vector
	 */
	public void setActiveParameters(List<String> names) {
		if (params != null) {
			new ParameterLayout(params, names); // throws ConfigurationException on unknown names
		}
		this.active_names = Collections.unmodifiableList(new ArrayList<String>(names));
	}

	public List<String> getActiveParameters() {
		return active_names;
	}

	public ParameterLayout getLayout() {
		return new ParameterLayout(requireParams(), active_names);
	}

	public void setDamping(double lambda) {
		if (!(lambda >= 0.0) || Double.isInfinite(lambda)) {
			throw new ConfigurationException("Damping factor should be finite and non-negative, got "+lambda);
		}
		this.lambda = lambda;
	}

	public double getDamping() {
		return lambda;
	}

	public void setOuterIteration(int outer_iter) {
		this.outer_iter = outer_iter;
		this.inner_iter = 0;
	}

	public int getOuterIteration() {
		return outer_iter;
	}

	public int getInnerIteration() {
		return inner_iter;
	}

	/**
	 * Full parameter set with the active groups replaced by the flat values, inactive groups
	 * keep their current values. The stored parameters are not modified.
	 * @param flat_values values of the active groups in the declared order
	 * @return new parameter set
	 */
	public ParameterSet residualParams(double [] flat_values) {
		return getLayout().overlay(requireParams(), flat_values);
	}

	/**
	 * Evaluate residuals at the current parameters without changing anything
	 * @param fn residual function
	 * @return residuals with info, loss() = 0.5*|F|^2
	 */
	public ResidualResult lossStep(ResidualFunction fn) {
		return fn.evaluate(requireParams().copy());
	}

	/**
	 * One damped Gauss-Newton step: (JtJ + lambda*I) * delta = -JtF, theta += delta.
	 * Empty active list or empty residual vector make the step a no-op. Non-finite values
	 * and failed solves discard the update, the failure is reported in the returned status.
	 * @param fn residual function, evaluated at the full parameter set
	 * @return step statistics
	 */
	public OptimizationStats step(ResidualFunction fn) {
		final ParameterSet current = requireParams();
		final ParameterLayout layout = new ParameterLayout(current, active_names);
		inner_iter++;
		if (layout.isEmpty()) {
			LOGGER.debug("step {}:{} - no active parameters", outer_iter, inner_iter);
			return OptimizationStats.noop(StepStatus.NO_ACTIVE_PARAMETERS, lambda, 0, 0.0);
		}
		final double [] vector = layout.flatten(current);
		ResidualResult result = fn.evaluate(layout.overlay(current, vector));
		final double [] fx = result.getResiduals();
		final double loss = result.loss();
		if (fx.length == 0) {
			LOGGER.debug("step {}:{} - no residuals (no valid correspondences)", outer_iter, inner_iter);
			return OptimizationStats.noop(StepStatus.EMPTY_RESIDUAL, lambda, 0, 0.0);
		}
		double [][] hessian =  null;
		double []   gradient = null;
		double      cond =     Double.NaN;
		boolean     fallback = false;
		try {
			if (!result.isFinite()) {
				throw new NumericalException(StepStatus.NON_FINITE_RESIDUAL, "Residual vector has non-finite values");
			}
			double [][] jt = getJacobianTransposed(fn, current, layout, vector, fx.length);
			if (!isFinite(jt)) {
				throw new NumericalException(StepStatus.NON_FINITE_JACOBIAN, "Jacobian has non-finite values");
			}
			hessian =  getJtJ(jt);
			gradient = getJtF(jt, fx);
			Matrix jtjl = getDampedMatrix(hessian, lambda);
			if (!isFinite(gradient) || !isFinite(jtjl.getArray())) { // JtJ or JtF overflow
				throw new NumericalException(StepStatus.SOLVE_FAILED, "Normal equations have non-finite values");
			}
			SingularValueDecomposition svd = new SingularValueDecomposition(jtjl);
			double [] sv = svd.getSingularValues();
			cond = (sv[sv.length - 1] > 0.0) ? (sv[0] / sv[sv.length - 1]) : Double.POSITIVE_INFINITY;
			Matrix b = new Matrix(gradient, gradient.length).times(-1.0);
			if (optimizer_parameters.debug_level > 2) {
				LOGGER.debug("JtJ + lambda*{}:\n{}", optimizer_parameters.isDiagonalDamping() ? "diag(JtJ)" : "I", printMatrix(jtjl));
			}
			Matrix mdelta = null;
			CholeskyDecomposition chol = new CholeskyDecomposition(jtjl);
			if (chol.isSPD() && (cond <= optimizer_parameters.condition_threshold)) {
				mdelta = chol.solve(b);
			} else {
				fallback = true;
				mdelta = solvePseudoInverse(svd, b, optimizer_parameters.pinv_tolerance);
			}
			double [] delta = mdelta.getColumnPackedCopy();
			if (!isFinite(delta)) {
				throw new NumericalException(fallback ? StepStatus.SOLVE_FAILED : StepStatus.NON_FINITE_UPDATE,
						"Parameter update has non-finite values");
			}
			if (optimizer_parameters.debug_level > 2) {
				LOGGER.debug("delta:\n{}", printMatrix(mdelta));
			}
			double [] new_vector = vector.clone();
			for (int i = 0; i < new_vector.length; i++) {
				new_vector[i] += delta[i];
			}
			double loss_after = Double.NaN;
			if (optimizer_parameters.adaptive_damping) {
				ResidualResult result_after = fn.evaluate(layout.overlay(current, new_vector));
				if (result_after.length() != fx.length) {
					throw new DimensionMismatchException("Residuals after update", fx.length, result_after.length());
				}
				loss_after = result_after.loss();
				double lambda_used = lambda;
				if (!(loss_after < loss)) { // NaN too
					lambda = Math.min(lambda * optimizer_parameters.lambda_scale_bad, optimizer_parameters.lambda_max);
					LOGGER.debug("step {}:{} - loss increased {} -> {}, update rejected, lambda {} -> {}",
							outer_iter, inner_iter, loss, loss_after, lambda_used, lambda);
					return new OptimizationStats(StepStatus.REJECTED, lambda_used, fx.length, loss, loss_after,
							cond, fallback, hessian, gradient, delta);
				}
				lambda *= optimizer_parameters.lambda_scale_good;
				OptimizationStats stats = new OptimizationStats(StepStatus.APPLIED, lambda_used, fx.length, loss, loss_after,
						cond, fallback, hessian, gradient, delta);
				params = layout.overlay(current, new_vector);
				return stats;
			}
			params = layout.overlay(current, new_vector);
			OptimizationStats stats = new OptimizationStats(StepStatus.APPLIED, lambda, fx.length, loss, loss_after,
					cond, fallback, hessian, gradient, delta);
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug("step {}:{} - {}", outer_iter, inner_iter, stats);
			}
			return stats;
		} catch (NumericalException e) {
			LOGGER.warn("step {}:{} - {}, update discarded ({})", outer_iter, inner_iter, e.getStatus(), e.getMessage());
			return OptimizationStats.failed(e.getStatus(), lambda, fx.length, loss, cond, fallback, hessian, gradient);
		}
	}

	private double [][] getJacobianTransposed(
			ResidualFunction fn,
			ParameterSet     current,
			ParameterLayout  layout,
			double []        vector,
			int              num_residuals)
	{
		double [][] jt = null;
		if (optimizer_parameters.analytic_jacobian && (fn instanceof DifferentiableResidualFunction)) {
			jt = ((DifferentiableResidualFunction) fn).getJacobianTransposed(layout.overlay(current, vector), layout);
		}
		if (jt == null) {
			return jacobian_estimator.getJacobianTransposed(fn, current, layout, vector, num_residuals);
		}
		if (jt.length != layout.getNumParameters()) {
			throw new DimensionMismatchException("Jacobian columns", layout.getNumParameters(), jt.length);
		}
		for (int j = 0; j < jt.length; j++) {
			if (jt[j].length != num_residuals) {
				throw new DimensionMismatchException("Jacobian column "+layout.getColumnName(j), num_residuals, jt[j].length);
			}
		}
		return jt;
	}

	/**
	 * JtJ, each element accumulated by a single thread in the residual order
	 */
	double [][] getJtJ(final double [][] jt) {
		final int num_pars =  jt.length;
		final int num_pars2 = num_pars * num_pars;
		final int num_points = jt[0].length;
		final double [][] jtj = new double [num_pars][num_pars];
		MultiThreading.runIndexed(num_pars2, optimizer_parameters.threads_max, (indx) -> {
			int i = indx / num_pars;
			int j = indx % num_pars;
			if (j >= i) {
				double d = 0.0;
				for (int k = 0; k < num_points; k++) {
					d += jt[i][k] * jt[j][k];
				}
				jtj[i][j] = d;
				jtj[j][i] = d;
			}
		});
		return jtj;
	}

	double [] getJtF(final double [][] jt, final double [] fx) {
		final double [] jtf = new double [jt.length];
		MultiThreading.runIndexed(jt.length, optimizer_parameters.threads_max, (i) -> {
			double d = 0.0;
			for (int k = 0; k < fx.length; k++) {
				d += jt[i][k] * fx[k];
			}
			jtf[i] = d;
		});
		return jtf;
	}

	Matrix getDampedMatrix(double [][] jtj, double lambda) {
		Matrix m = new Matrix(jtj.length, jtj.length);
		boolean diagonal = optimizer_parameters.isDiagonalDamping();
		for (int i = 0; i < jtj.length; i++) {
			for (int j = 0; j < jtj.length; j++) {
				m.set(i, j, jtj[i][j]);
			}
			m.set(i, i, jtj[i][i] + (diagonal ? (lambda * jtj[i][i]) : lambda));
		}
		return m;
	}

	/**
	 * Minimum-norm solution of A*x = b using the SVD of a square A, singular values
	 * below tolerance * s_max are treated as zeros
	 */
	static Matrix solvePseudoInverse(SingularValueDecomposition svd, Matrix b, double tolerance) {
		double [] sv = svd.getSingularValues();
		Matrix u = svd.getU();
		Matrix v = svd.getV();
		double cutoff = tolerance * sv[0];
		Matrix utb = u.transpose().times(b);
		for (int i = 0; i < sv.length; i++) {
			double s = sv[i];
			utb.set(i, 0, ((s > cutoff) && (s > 0.0)) ? (utb.get(i, 0) / s) : 0.0);
		}
		return v.times(utb);
	}

	static boolean isFinite(double [] data) {
		for (double d : data) {
			if (!Double.isFinite(d)) {
				return false;
			}
		}
		return true;
	}

	static boolean isFinite(double [][] data) {
		for (double [] row : data) {
			if ((row == null) || !isFinite(row)) {
				return false;
			}
		}
		return true;
	}

	private static String printMatrix(Matrix m) {
		StringWriter sw = new StringWriter();
		m.print(new PrintWriter(sw, true), 18, 6);
		return sw.toString();
	}
}
