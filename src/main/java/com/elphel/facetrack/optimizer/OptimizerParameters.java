/**
 **
 ** OptimizerParameters - configuration of the Gauss-Newton / Levenberg-Marquardt solver
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  OptimizerParameters.java is free software: you can redistribute it and/or modify
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

import java.util.Properties;

public class OptimizerParameters implements Cloneable {
	public static final String DAMPING_IDENTITY = "identity"; // JtJ + lambda * I
	public static final String DAMPING_DIAGONAL = "diagonal"; // JtJ + lambda * diag(JtJ)

	public String  damping_mode =        DAMPING_IDENTITY;
	public double  condition_threshold = 1.0E12; // use pseudo-inverse above this condition number
	public double  pinv_tolerance =      1.0E-12; // relative to the largest singular value
	public double  fd_delta =            1.0E-6;  // finite differences step, scaled by max(1,|theta|)
	public boolean analytic_jacobian =   true;    // use Jacobian of the residual function when it provides one
	public boolean adaptive_damping =    false;   // LMA-style lambda update from the step outcome
	public double  lambda_scale_good =   0.5;
	public double  lambda_scale_bad =    8.0;
	public double  lambda_max =          100.0;
	public int     threads_max =         100;
	public int     debug_level =         0;

	public boolean isDiagonalDamping() {
		return DAMPING_DIAGONAL.equals(damping_mode);
	}

	public void validate() {
		if (!DAMPING_IDENTITY.equals(damping_mode) && !DAMPING_DIAGONAL.equals(damping_mode)) {
			throw new ConfigurationException("Unknown damping mode \""+damping_mode+"\", should be \""+
					DAMPING_IDENTITY+"\" or \""+DAMPING_DIAGONAL+"\"");
		}
		if (!(condition_threshold > 1.0)) {
			throw new ConfigurationException("Condition threshold should be > 1.0, got "+condition_threshold);
		}
		if (!(fd_delta > 0.0)) {
			throw new ConfigurationException("Finite difference step should be positive, got "+fd_delta);
		}
		if (adaptive_damping && (!(lambda_scale_good > 0.0) || !(lambda_scale_bad > 1.0) || !(lambda_max > 0.0))) {
			throw new ConfigurationException("Adaptive damping needs lambda_scale_good > 0, lambda_scale_bad > 1 and lambda_max > 0");
		}
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"damping_mode",        this.damping_mode);
		properties.setProperty(prefix+"condition_threshold", this.condition_threshold+"");
		properties.setProperty(prefix+"pinv_tolerance",      this.pinv_tolerance+"");
		properties.setProperty(prefix+"fd_delta",            this.fd_delta+"");
		properties.setProperty(prefix+"analytic_jacobian",   this.analytic_jacobian+"");
		properties.setProperty(prefix+"adaptive_damping",    this.adaptive_damping+"");
		properties.setProperty(prefix+"lambda_scale_good",   this.lambda_scale_good+"");
		properties.setProperty(prefix+"lambda_scale_bad",    this.lambda_scale_bad+"");
		properties.setProperty(prefix+"lambda_max",          this.lambda_max+"");
		properties.setProperty(prefix+"threads_max",         this.threads_max+"");
		properties.setProperty(prefix+"debug_level",         this.debug_level+"");
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"damping_mode")!=null)        this.damping_mode=properties.getProperty(prefix+"damping_mode").trim();
		if (properties.getProperty(prefix+"condition_threshold")!=null) this.condition_threshold=Double.parseDouble(properties.getProperty(prefix+"condition_threshold"));
		if (properties.getProperty(prefix+"pinv_tolerance")!=null)      this.pinv_tolerance=Double.parseDouble(properties.getProperty(prefix+"pinv_tolerance"));
		if (properties.getProperty(prefix+"fd_delta")!=null)            this.fd_delta=Double.parseDouble(properties.getProperty(prefix+"fd_delta"));
		if (properties.getProperty(prefix+"analytic_jacobian")!=null)   this.analytic_jacobian=Boolean.parseBoolean(properties.getProperty(prefix+"analytic_jacobian"));
		if (properties.getProperty(prefix+"adaptive_damping")!=null)    this.adaptive_damping=Boolean.parseBoolean(properties.getProperty(prefix+"adaptive_damping"));
		if (properties.getProperty(prefix+"lambda_scale_good")!=null)   this.lambda_scale_good=Double.parseDouble(properties.getProperty(prefix+"lambda_scale_good"));
		if (properties.getProperty(prefix+"lambda_scale_bad")!=null)    this.lambda_scale_bad=Double.parseDouble(properties.getProperty(prefix+"lambda_scale_bad"));
		if (properties.getProperty(prefix+"lambda_max")!=null)          this.lambda_max=Double.parseDouble(properties.getProperty(prefix+"lambda_max"));
		if (properties.getProperty(prefix+"threads_max")!=null)         this.threads_max=Integer.parseInt(properties.getProperty(prefix+"threads_max").trim());
		if (properties.getProperty(prefix+"debug_level")!=null)         this.debug_level=Integer.parseInt(properties.getProperty(prefix+"debug_level").trim());
	}

	@Override
	public OptimizerParameters clone() {
		OptimizerParameters op = new OptimizerParameters();
		op.damping_mode =        this.damping_mode;
		op.condition_threshold = this.condition_threshold;
		op.pinv_tolerance =      this.pinv_tolerance;
		op.fd_delta =            this.fd_delta;
		op.analytic_jacobian =   this.analytic_jacobian;
		op.adaptive_damping =    this.adaptive_damping;
		op.lambda_scale_good =   this.lambda_scale_good;
		op.lambda_scale_bad =    this.lambda_scale_bad;
		op.lambda_max =          this.lambda_max;
		op.threads_max =         this.threads_max;
		op.debug_level =         this.debug_level;
		return op;
	}
}
