/**
 **
 ** OptimizationStats - statistics of a single optimizer step and their aggregation over a tracking call
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  OptimizationStats.java is free software: you can redistribute it and/or modify
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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class OptimizationStats {
	private final StepStatus  status;
	private final double      lambda;
	private final int         num_residuals;
	private final double      loss;       // 0.5*|F|^2 before the step
	private final double      loss_after; // only calculated with adaptive damping, NaN otherwise
	private final double      condition_number;
	private final boolean     fallback_used;
	private final double [][] hessian;    // JtJ, not damped
	private final double []   gradient;   // JtF
	private final double []   delta;
	private final double []   hessian_mmm;  // min, max, mean
	private final double []   gradient_mmm; // min, max, mean

	public OptimizationStats(
			StepStatus  status,
			double      lambda,
			int         num_residuals,
			double      loss,
			double      loss_after,
			double      condition_number,
			boolean     fallback_used,
			double [][] hessian,
			double []   gradient,
			double []   delta)
	{
		this.status =           status;
		this.lambda =           lambda;
		this.num_residuals =    num_residuals;
		this.loss =             loss;
		this.loss_after =       loss_after;
		this.condition_number = condition_number;
		this.fallback_used =    fallback_used;
		this.hessian =          hessian;
		this.gradient =         gradient;
		this.delta =            delta;
		this.hessian_mmm =      minMaxMean(hessian);
		this.gradient_mmm =     minMaxMean(new double [][] {gradient});
	}

	/**
	 * Statistics of a step that had nothing to solve (no active parameters, no residuals)
	 */
	public static OptimizationStats noop(StepStatus status, double lambda, int num_residuals, double loss) {
		return new OptimizationStats(status, lambda, num_residuals, loss, Double.NaN, 0.0, false,
				new double [0][0], new double [0], new double [0]);
	}

	/**
	 * Statistics of a step that failed after the normal equations were (or were not) formed
	 */
	public static OptimizationStats failed(
			StepStatus  status,
			double      lambda,
			int         num_residuals,
			double      loss,
			double      condition_number,
			boolean     fallback_used,
			double [][] hessian,
			double []   gradient) {
		return new OptimizationStats(status, lambda, num_residuals, loss, Double.NaN, condition_number, fallback_used,
				(hessian  != null) ? hessian  : new double [0][0],
				(gradient != null) ? gradient : new double [0],
				new double [0]);
	}

	private static double [] minMaxMean(double [][] data) {
		double mn = Double.POSITIVE_INFINITY, mx = Double.NEGATIVE_INFINITY, s = 0.0;
		int n = 0;
		for (double [] row : data) {
			for (double d : row) {
				mn = Math.min(mn, d);
				mx = Math.max(mx, d);
				s += d;
				n++;
			}
		}
		if (n == 0) {
			return new double [3];
		}
		return new double [] {mn, mx, s / n};
	}

	public StepStatus getStatus()          {return status;}
	public boolean    isUpdateApplied()    {return status.isApplied();}
	public boolean    isFallbackUsed()     {return fallback_used;}
	public double     getLambda()          {return lambda;}
	public int        getNumResiduals()    {return num_residuals;}
	public int        getNumParameters()   {return gradient.length;}
	public double     getLoss()            {return loss;}
	public double     getLossAfter()       {return loss_after;}
	public double     getConditionNumber() {return condition_number;}
	public double [][] getHessian()        {return hessian;}
	public double []  getGradient()        {return gradient;}
	public double []  getDelta()           {return delta;}
	public double     getHessianMin()      {return hessian_mmm[0];}
	public double     getHessianMax()      {return hessian_mmm[1];}
	public double     getHessianMean()     {return hessian_mmm[2];}
	public double     getGradientMin()     {return gradient_mmm[0];}
	public double     getGradientMax()     {return gradient_mmm[1];}
	public double     getGradientMean()    {return gradient_mmm[2];}

	/** @return true if the normal equations were formed for this step */
	public boolean hasSystem() {
		return hessian.length > 0;
	}

	public Map<String, Double> toMap() {
		Map<String, Double> map = new LinkedHashMap<String, Double>();
		map.put("loss",     loss);
		map.put("lambda",   lambda);
		map.put("min_H",    getHessianMin());
		map.put("max_H",    getHessianMax());
		map.put("mean_H",   getHessianMean());
		map.put("cond_H",   condition_number);
		map.put("min_g",    getGradientMin());
		map.put("max_g",    getGradientMax());
		map.put("mean_g",   getGradientMean());
		map.put("fallback", fallback_used ? 1.0 : 0.0);
		map.put("applied",  isUpdateApplied() ? 1.0 : 0.0);
		return map;
	}

	/**
	 * Reduce statistics of all steps of a tracking call. Min/max/mean values of H and g and
	 * the condition numbers are averaged over the steps that formed the normal equations.
	 * @param steps per-step statistics
	 * @return named summary values
	 */
	public static Map<String, Double> summarize(List<OptimizationStats> steps) {
		Map<String, Double> map = new LinkedHashMap<String, Double>();
		int applied = 0, fallbacks = 0, failures = 0, with_system = 0;
		double [] sums = new double [7];
		for (OptimizationStats s : steps) {
			if (s.isUpdateApplied())      applied++;
			if (s.isFallbackUsed())       fallbacks++;
			if (s.getStatus().isFailure()) failures++;
			if (s.hasSystem() && Double.isFinite(s.condition_number)) {
				sums[0] += s.getHessianMin();
				sums[1] += s.getHessianMax();
				sums[2] += s.getHessianMean();
				sums[3] += s.condition_number;
				sums[4] += s.getGradientMin();
				sums[5] += s.getGradientMax();
				sums[6] += s.getGradientMean();
				with_system++;
			}
		}
		map.put("steps",     (double) steps.size());
		map.put("applied",   (double) applied);
		map.put("fallbacks", (double) fallbacks);
		map.put("failures",  (double) failures);
		String [] keys = {"min_H", "max_H", "mean_H", "cond_H", "min_g", "max_g", "mean_g"};
		for (int i = 0; i < keys.length; i++) {
			map.put(keys[i], (with_system > 0) ? (sums[i] / with_system) : 0.0);
		}
		if (!steps.isEmpty()) {
			map.put("first_loss", steps.get(0).loss);
			map.put("last_loss",  steps.get(steps.size() - 1).loss);
		}
		return map;
	}

	@Override
	public String toString() {
		return String.format("%s: loss=%.6g, lambda=%.3g, cond=%.3g%s, |g|max=%.3g, residuals=%d, parameters=%d",
				status, loss, lambda, condition_number, fallback_used ? " (pinv)" : "",
				Math.max(Math.abs(getGradientMin()), Math.abs(getGradientMax())), num_residuals, getNumParameters());
	}
}
