/**
 **
 ** StepSizeScheduler - deterministic damping factor per outer iteration
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  StepSizeScheduler.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.scheduler;

import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.DifferentiableOptimizer;

/**
 * Policies:
 * <ul>
 * <li>constant: lambda(i) = lambda0</li>
 * <li>geometric: lambda(i) = lambda0 * rate^i</li>
 * <li>step: lambda(i) = lambda0 * rate^(i / step)</li>
 * </ul>
 */
public class StepSizeScheduler {
	public static final String POLICY_CONSTANT =  "constant";
	public static final String POLICY_GEOMETRIC = "geometric";
	public static final String POLICY_STEP =      "step";

	private final String policy;
	private final double lambda0;
	private final double rate;
	private final int    step;

	public StepSizeScheduler(String policy, double lambda0, double rate, int step) {
		if (!POLICY_CONSTANT.equals(policy) && !POLICY_GEOMETRIC.equals(policy) && !POLICY_STEP.equals(policy)) {
			throw new ConfigurationException("Unknown damping policy \""+policy+"\", should be one of "+
					POLICY_CONSTANT+", "+POLICY_GEOMETRIC+", "+POLICY_STEP);
		}
		if (!(lambda0 >= 0.0) || Double.isInfinite(lambda0)) {
			throw new ConfigurationException("Initial damping should be finite and non-negative, got "+lambda0);
		}
		if (!(rate > 0.0) || Double.isInfinite(rate)) {
			throw new ConfigurationException("Damping rate should be finite and positive, got "+rate);
		}
		if (POLICY_STEP.equals(policy) && (step < 1)) {
			throw new ConfigurationException("Damping step should be positive, got "+step);
		}
		this.policy =  policy;
		this.lambda0 = lambda0;
		this.rate =    rate;
		this.step =    step;
	}

	public static StepSizeScheduler constant(double lambda) {
		return new StepSizeScheduler(POLICY_CONSTANT, lambda, 1.0, 1);
	}

	public static StepSizeScheduler geometric(double lambda0, double rate) {
		return new StepSizeScheduler(POLICY_GEOMETRIC, lambda0, rate, 1);
	}

	public double damping(int outer_iter) {
		switch (policy) {
		case POLICY_GEOMETRIC: return lambda0 * Math.pow(rate, outer_iter);
		case POLICY_STEP:      return lambda0 * Math.pow(rate, outer_iter / step);
		default:               return lambda0;
		}
	}

	public void configureOptimizer(DifferentiableOptimizer optimizer, int outer_iter) {
		optimizer.setDamping(damping(outer_iter));
	}

	@Override
	public String toString() {
		return "StepSizeScheduler{"+policy+", lambda0="+lambda0+", rate="+rate+", step="+step+"}";
	}
}
